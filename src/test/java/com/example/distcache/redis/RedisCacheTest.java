package com.example.distcache.redis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.distcache.MutableClock;
import com.example.distcache.core.CacheConnectionException;
import com.example.distcache.core.CacheException;
import com.example.distcache.core.CachePoolExhaustedException;
import com.example.distcache.core.CacheSettings;
import com.example.distcache.core.CacheStats;
import com.example.distcache.core.CacheValidationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.Pipeline;
import redis.clients.jedis.exceptions.JedisConnectionException;
import redis.clients.jedis.exceptions.JedisDataException;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.params.ScanParams;
import redis.clients.jedis.params.SetParams;
import redis.clients.jedis.resps.ScanResult;

@ExtendWith(MockitoExtension.class)
class RedisCacheTest {

    @Mock
    private JedisPool pool;

    @Mock
    private Jedis jedis;

    private final RedisSettings settings = RedisSettings.builder()
        .maxAttempts(3)
        .retryBackoff(Duration.ZERO)
        .build();

    private RedisCache cache;

    @BeforeEach
    void setUp() {
        lenient().when(pool.getResource()).thenReturn(jedis);
        cache = newCache(CacheSettings.defaults());
    }

    private RedisCache newCache(CacheSettings cacheSettings) {
        return new RedisCache(pool, settings, cacheSettings, new ObjectMapper(), new MutableClock());
    }

    @Nested
    class Commands {

        @Test
        void getDecodesJson() {
            when(jedis.get("user:1")).thenReturn("{\"name\":\"Ada\",\"age\":36}");

            assertThat(cache.get("user:1")).contains(Map.of("name", "Ada", "age", 36));
            verify(jedis).close();
        }

        @Test
        void missIsEmptyAndCounted() {
            when(jedis.get("nope")).thenReturn(null);
            when(jedis.dbSize()).thenReturn(0L);
            when(jedis.info("stats")).thenReturn("");

            assertThat(cache.get("nope")).isEmpty();
            assertThat(cache.cacheStats().getMisses()).isEqualTo(1);
        }

        @Test
        void setWithoutTtlUsesPlainSet() {
            cache.set("k", "v");

            verify(jedis).set("k", "\"v\"");
        }

        @Test
        void setWithTtlUsesMilliseconds() {
            cache.set("k", 42, Duration.ofSeconds(5));

            verify(jedis).psetex("k", 5_000L, "42");
        }

        @Test
        void defaultTtlApplies() {
            RedisCache withDefault = newCache(CacheSettings.defaults().withDefaultTtl(Duration.ofMinutes(1)));

            withDefault.set("k", "v");

            verify(jedis).psetex("k", 60_000L, "\"v\"");
        }

        @Test
        void zeroTtlDeletes() {
            cache.set("k", "v", Duration.ZERO);

            verify(jedis).del("k");
            verify(jedis, never()).set(anyString(), anyString());
        }

        @Test
        void ttlInterpretsPttl() {
            when(jedis.pttl("timed")).thenReturn(1_500L);
            when(jedis.pttl("forever")).thenReturn(-1L);
            when(jedis.pttl("missing")).thenReturn(-2L);

            assertThat(cache.ttl("timed")).contains(Duration.ofMillis(1_500));
            assertThat(cache.ttl("forever")).isEmpty();
            assertThat(cache.ttl("missing")).isEmpty();
        }

        @Test
        void expireUsesPexpire() {
            when(jedis.pexpire("k", 3_000L)).thenReturn(1L);

            assertThat(cache.expire("k", Duration.ofSeconds(3))).isTrue();
        }

        @Test
        void deleteReportsRemoval() {
            when(jedis.del("k")).thenReturn(1L);

            assertThat(cache.delete("k")).isTrue();
        }

        @Test
        void setManyIsPipelined() {
            Pipeline pipeline = mock(Pipeline.class);
            when(jedis.pipelined()).thenReturn(pipeline);

            cache.setMany(Map.of("a", 1), Duration.ofSeconds(2));

            verify(pipeline).psetex("a", 2_000L, "1");
            verify(pipeline).sync();
        }

        @Test
        void getManyOmitsMissingKeys() {
            when(jedis.mget("a", "b", "c")).thenReturn(Arrays.asList("1", null, "\"x\""));

            assertThat(cache.getMany(List.of("a", "b", "c")))
                .containsExactly(Map.entry("a", 1), Map.entry("c", "x"));
        }

        @Test
        void countersUseServerArithmetic() {
            when(jedis.eval(RedisCache.INCREMENT_SCRIPT, List.of("n"), List.of("5"))).thenReturn(5L);
            when(jedis.eval(RedisCache.INCREMENT_SCRIPT, List.of("n"), List.of("-1"))).thenReturn(4L);

            assertThat(cache.increment("n", 5)).isEqualTo(5);
            assertThat(cache.decrement("n")).isEqualTo(4);
        }

        @Test
        void incrementScriptUnwrapsQuotedIntegersOnly() {
            assertThat(RedisCache.INCREMENT_SCRIPT)
                .contains("string.match(current, '^\"(%-?%d+)\"$')")
                .contains("'PTTL'")
                .contains("#digits < 19")
                .endsWith("return redis.call('INCRBY', KEYS[1], ARGV[1])");
        }

        @Test
        void decrementOfMinimumLongIsRejected() {
            assertThatThrownBy(() -> cache.decrement("n", Long.MIN_VALUE))
                .isInstanceOf(CacheValidationException.class);
            verify(pool, never()).getResource();
        }

        @Test
        void setIfAbsentUsesSetNx() {
            when(jedis.set(eq("lock"), eq("\"me\""), any(SetParams.class))).thenReturn("OK", (String) null);

            assertThat(cache.setIfAbsent("lock", "me", Duration.ofSeconds(30))).isTrue();
            assertThat(cache.setIfAbsent("lock", "me", Duration.ofSeconds(30))).isFalse();
        }

        @Test
        void compareAndSwapRunsScript() {
            when(jedis.eval(RedisCache.COMPARE_AND_SWAP_SCRIPT, List.of("k"), List.of("\"old\"", "\"new\"")))
                .thenReturn(1L, 0L);

            assertThat(cache.compareAndSwap("k", "old", "new")).isTrue();
            assertThat(cache.compareAndSwap("k", "old", "new")).isFalse();
        }

        @Test
        void compareAndSwapMatchesMapsRegardlessOfInsertionOrder() {
            Map<String, Object> expected = new LinkedHashMap<>();
            expected.put("b", 2);
            expected.put("a", 1);
            Map<String, Object> replacement = new LinkedHashMap<>();
            replacement.put("b", 3);
            replacement.put("a", 1);
            when(jedis.eval(RedisCache.COMPARE_AND_SWAP_SCRIPT, List.of("k"),
                List.of("{\"a\":1,\"b\":2}", "{\"a\":1,\"b\":3}"))).thenReturn(1L);

            assertThat(cache.compareAndSwap("k", expected, replacement)).isTrue();
        }

        @Test
        void compareAndSwapWithoutExpectationIsSetIfAbsent() {
            when(jedis.set(eq("k"), eq("1"), any(SetParams.class))).thenReturn("OK");

            assertThat(cache.compareAndSwap("k", null, 1)).isTrue();
        }

        @Test
        void keysMatchingFollowsScanCursor() {
            when(jedis.scan(anyString(), any(ScanParams.class))).thenReturn(
                new ScanResult<>("17", List.of("user:1", "user:2")),
                new ScanResult<>(ScanParams.SCAN_POINTER_START, List.of("user:3")));

            assertThat(cache.keysMatching("user:*")).containsExactlyInAnyOrder("user:1", "user:2", "user:3");
            verify(jedis).scan(eq("17"), any(ScanParams.class));
        }

        @Test
        void deleteMatchingDeletesScannedKeys() {
            when(jedis.scan(anyString(), any(ScanParams.class)))
                .thenReturn(new ScanResult<>(ScanParams.SCAN_POINTER_START, List.of("tmp:1", "tmp:2")));
            when(jedis.del(any(String[].class))).thenReturn(2L);

            assertThat(cache.deleteMatching("tmp:*")).isEqualTo(2);
        }

        @Test
        void flushAllReturnsPreviousSize() {
            when(jedis.dbSize()).thenReturn(12L);

            assertThat(cache.flushAll()).isEqualTo(12);
            verify(jedis).flushDB();
        }

        @Test
        void validationHappensBeforeAnyCommand() {
            assertThatThrownBy(() -> cache.set("", "v")).isInstanceOf(CacheValidationException.class);
            verify(pool, never()).getResource();
        }
    }

    @Nested
    class Stats {

        @Test
        void evictionsAreRelativeToLastReset() {
            when(jedis.dbSize()).thenReturn(42L);
            when(jedis.info("stats")).thenReturn(
                "# Stats\r\nevicted_keys:7\r\n",
                "# Stats\r\nevicted_keys:7\r\n",
                "# Stats\r\nevicted_keys:10\r\n");

            CacheStats before = cache.cacheStats();
            cache.clearStats();
            CacheStats after = cache.cacheStats();

            assertThat(before.getSize()).isEqualTo(42);
            assertThat(before.getEvictions()).isEqualTo(7);
            assertThat(after.getEvictions()).isEqualTo(3);
        }

        @Test
        void parsesEvictedKeysFromInfo() {
            assertThat(RedisCache.parseEvictedKeys("keyspace_hits:1\nevicted_keys:99\n")).isEqualTo(99);
            assertThat(RedisCache.parseEvictedKeys("keyspace_hits:1\n")).isZero();
            assertThat(RedisCache.parseEvictedKeys("evicted_keys:abc")).isZero();
            assertThat(RedisCache.parseEvictedKeys(null)).isZero();
        }
    }

    @Nested
    class Failures {

        @Test
        void connectionLossIsRetryable() {
            when(jedis.get("k")).thenThrow(new JedisConnectionException("reset by peer"));

            assertThatThrownBy(() -> cache.get("k"))
                .isInstanceOf(CacheConnectionException.class)
                .matches(e -> ((CacheException) e).isRetryable());
            verify(pool, times(1)).getResource();
        }

        @Test
        void serverRejectionIsValidationError() {
            when(jedis.eval(RedisCache.INCREMENT_SCRIPT, List.of("k"), List.of("1"))).thenThrow(
                new JedisDataException("ERR value is not an integer or out of range"));

            assertThatThrownBy(() -> cache.increment("k"))
                .isInstanceOf(CacheValidationException.class)
                .hasMessageContaining("not an integer");
        }

        @Test
        void borrowIsRetriedUntilItSucceeds() {
            when(pool.getResource())
                .thenThrow(new JedisConnectionException("refused"))
                .thenReturn(jedis);
            when(jedis.get("k")).thenReturn("1");

            assertThat(cache.get("k")).contains(1);
            verify(pool, times(2)).getResource();
        }

        @Test
        void exhaustedPoolFailsAfterMaxAttempts() {
            when(pool.getResource()).thenThrow(
                new JedisException("Could not get a resource from the pool", new NoSuchElementException("Timeout waiting for idle object")));

            assertThatThrownBy(() -> cache.get("k"))
                .isInstanceOf(CachePoolExhaustedException.class)
                .hasMessageContaining("exhausted");
            verify(pool, times(3)).getResource();
        }

        @Test
        void otherPoolErrorsAreNotRetried() {
            when(pool.getResource()).thenThrow(new JedisException("misconfigured"));

            assertThatThrownBy(() -> cache.get("k"))
                .isInstanceOf(CacheException.class)
                .isNotInstanceOf(CacheConnectionException.class);
            verify(pool, times(1)).getResource();
        }

        @Test
        void pingNeverThrows() {
            when(pool.getResource()).thenThrow(new JedisConnectionException("refused"));

            assertThat(cache.ping()).isFalse();
        }

        @Test
        void pingSucceedsOnPong() {
            when(jedis.ping()).thenReturn("PONG");

            assertThat(cache.ping()).isTrue();
        }
    }

    @Nested
    class Lifecycle {

        @Test
        void closeReleasesPoolOnce() {
            cache.close();
            cache.close();

            verify(pool, times(1)).close();
        }

        @Test
        void operationsAfterCloseFail() {
            cache.close();

            assertThatThrownBy(() -> cache.get("k")).isInstanceOf(IllegalStateException.class);
            assertThat(cache.ping()).isFalse();
        }
    }
}
