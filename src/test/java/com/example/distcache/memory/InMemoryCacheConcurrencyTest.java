package com.example.distcache.memory;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.distcache.core.CacheSettings;
import com.example.distcache.eviction.EvictionPolicy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class InMemoryCacheConcurrencyTest {

    private static final int THREADS = 16;

    private final ExecutorService pool = Executors.newFixedThreadPool(THREADS);
    private InMemoryCache cache = new InMemoryCache(CacheSettings.defaults().withSweepInterval(Duration.ZERO));

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
        cache.close();
    }

    @Test
    void concurrentIncrementsAreNotLost() throws Exception {
        int perThread = 1_000;

        runConcurrently(() -> {
            for (int i = 0; i < perThread; i++) {
                cache.increment("counter");
            }
            return null;
        });

        assertThat(cache.get("counter")).contains((long) THREADS * perThread);
    }

    @Test
    void exactlyOneSetIfAbsentWins() throws Exception {
        AtomicInteger winners = new AtomicInteger();

        runConcurrently(() -> {
            if (cache.setIfAbsent("lock", Thread.currentThread().getName())) {
                winners.incrementAndGet();
            }
            return null;
        });

        assertThat(winners).hasValue(1);
    }

    @Test
    void compareAndSwapLoopsConverge() throws Exception {
        int perThread = 200;
        cache.set("n", 0L);

        runConcurrently(() -> {
            for (int i = 0; i < perThread; i++) {
                while (true) {
                    long current = (Long) cache.get("n").orElseThrow();
                    if (cache.compareAndSwap("n", current, current + 1)) {
                        break;
                    }
                }
            }
            return null;
        });

        assertThat(cache.get("n")).contains((long) THREADS * perThread);
    }

    @ParameterizedTest
    @EnumSource(EvictionPolicy.class)
    void sizeStaysBoundedUnderConcurrentWrites(EvictionPolicy policy) throws Exception {
        cache.close();
        int maxSize = 100;
        cache = new InMemoryCache(CacheSettings.defaults()
            .withMaxSize(maxSize)
            .withEvictionPolicy(policy)
            .withSweepInterval(Duration.ZERO));
        AtomicInteger ids = new AtomicInteger();

        runConcurrently(() -> {
            for (int i = 0; i < 2_000; i++) {
                int id = ids.incrementAndGet();
                cache.set("k" + id, id);
                cache.get("k" + (id / 2));
            }
            return null;
        });

        long size = cache.cacheStats().getSize();
        assertThat(size).isLessThanOrEqualTo(maxSize);
        assertThat(cache.keysMatching("*")).hasSize((int) size);
        assertThat(cache.cacheStats().getEvictions()).isEqualTo(THREADS * 2_000L - size);
    }

    private void runConcurrently(Callable<Void> task) throws Exception {
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Void>> futures = new ArrayList<>();
        for (int t = 0; t < THREADS; t++) {
            futures.add(pool.submit(() -> {
                start.await();
                return task.call();
            }));
        }
        start.countDown();
        for (Future<Void> future : futures) {
            future.get(60, TimeUnit.SECONDS);
        }
    }
}
