package com.example.distcache.eviction;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class LruEvictionStrategyTest {

    private final LruEvictionStrategy lru = new LruEvictionStrategy();

    @Test
    void emptyStrategyHasNoVictim() {
        assertThat(lru.selectVictim()).isEmpty();
        assertThat(lru.size()).isZero();
    }

    @Test
    void oldestWriteIsTheVictim() {
        lru.onWrite("a");
        lru.onWrite("b");
        lru.onWrite("c");

        assertThat(lru.selectVictim()).contains("a");
        assertThat(lru.size()).isEqualTo(3);
    }

    @Test
    void accessProtectsKey() {
        lru.onWrite("a");
        lru.onWrite("b");
        lru.onWrite("c");
        lru.onAccess("a");

        assertThat(lru.selectVictim()).contains("b");
    }

    @Test
    void overwriteCountsAsUse() {
        lru.onWrite("a");
        lru.onWrite("b");
        lru.onWrite("a");

        assertThat(lru.selectVictim()).contains("b");
        assertThat(lru.size()).isEqualTo(2);
    }

    @Test
    void selectingDoesNotRemove() {
        lru.onWrite("a");
        lru.selectVictim();

        assertThat(lru.selectVictim()).contains("a");
        assertThat(lru.size()).isEqualTo(1);
    }

    @Test
    void removeUnlinksFromAnyPosition() {
        lru.onWrite("a");
        lru.onWrite("b");
        lru.onWrite("c");

        lru.onRemove("b");
        assertThat(lru.selectVictim()).contains("a");
        lru.onRemove("a");
        assertThat(lru.selectVictim()).contains("c");
        lru.onRemove("c");
        assertThat(lru.selectVictim()).isEmpty();
    }

    @Test
    void unknownKeysAreIgnored() {
        lru.onWrite("a");
        lru.onAccess("zzz");
        lru.onRemove("zzz");

        assertThat(lru.size()).isEqualTo(1);
        assertThat(lru.selectVictim()).contains("a");
    }

    @Test
    void clearForgetsEverything() {
        lru.onWrite("a");
        lru.onWrite("b");
        lru.clear();

        assertThat(lru.size()).isZero();
        assertThat(lru.selectVictim()).isEmpty();
        lru.onWrite("c");
        assertThat(lru.selectVictim()).contains("c");
    }
}
