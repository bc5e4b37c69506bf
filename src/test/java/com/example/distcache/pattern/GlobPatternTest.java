package com.example.distcache.pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.distcache.core.CacheValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class GlobPatternTest {

    @ParameterizedTest
    @CsvSource({
        "user:*, user:1, true",
        "user:*, user:, true",
        "user:*, users:1, false",
        "user:?, user:1, true",
        "user:?, user:12, false",
        "*:profile, user:7:profile, true",
        "*:profile, user:7:profiles, false",
        "a*b*c, abc, true",
        "a*b*c, axxbyyc, true",
        "a*b*c, axxbyy, false",
        "*, anything, true",
        "User:*, user:1, false",
        "exact, exact, true",
        "exact, exactly, false",
        "**a, a, true",
        "a?*, a, false",
    })
    void matches(String pattern, String key, boolean expected) {
        assertThat(GlobPattern.compile(pattern).matches(key)).isEqualTo(expected);
    }

    @Test
    void emptyPatternMatchesOnlyEmptyKey() {
        GlobPattern empty = GlobPattern.compile("");

        assertThat(empty.matches("")).isTrue();
        assertThat(empty.matches("a")).isFalse();
    }

    @Test
    void literalPrefixStopsAtFirstWildcard() {
        assertThat(GlobPattern.compile("user:*:name").literalPrefix()).isEqualTo("user:");
        assertThat(GlobPattern.compile("a?c").literalPrefix()).isEqualTo("a");
        assertThat(GlobPattern.compile("*").literalPrefix()).isEmpty();
    }

    @Test
    void literalPatternsAreRecognised() {
        assertThat(GlobPattern.compile("plain").isLiteral()).isTrue();
        assertThat(GlobPattern.compile("pl*n").isLiteral()).isFalse();
    }

    @Test
    void bracketsAreLiteral() {
        GlobPattern pattern = GlobPattern.compile("list[0]*");

        assertThat(pattern.matches("list[0]:a")).isTrue();
        assertThat(pattern.matches("list0:a")).isFalse();
    }

    @Test
    void redisPatternEscapesItsExtraMetacharacters() {
        assertThat(GlobPattern.compile("a[1]\\*").toRedisPattern()).isEqualTo("a\\[1\\]\\\\*");
        assertThat(GlobPattern.compile("user:?*").toRedisPattern()).isEqualTo("user:?*");
    }

    @Test
    void namespacePatternCoversEveryKeyInside() {
        GlobPattern ns = GlobPattern.namespace("orders");

        assertThat(ns.pattern()).isEqualTo("orders:*");
        assertThat(ns.matches("orders:1")).isTrue();
        assertThat(ns.matches("orders")).isFalse();
    }

    @Test
    void invalidInputIsRejected() {
        assertThatThrownBy(() -> GlobPattern.compile(null)).isInstanceOf(CacheValidationException.class);
        assertThatThrownBy(() -> GlobPattern.namespace("bad*")).isInstanceOf(CacheValidationException.class);
        assertThatThrownBy(() -> GlobPattern.namespace("")).isInstanceOf(CacheValidationException.class);
    }
}
