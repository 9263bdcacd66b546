package com.geoviewer.aoi.infrastructure.cache;

import com.geoviewer.aoi.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CacheCleanupSchedulerTest {

    private static final Duration TTL = Duration.ofMinutes(5);

    private MutableClock clock;
    private BoundedTtlCache first;
    private BoundedTtlCache second;
    private CacheCleanupScheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-06-01T12:00:00Z"));
        first = new BoundedTtlCache("first", TTL, 10, clock);
        second = new BoundedTtlCache("second", TTL, 10, clock);
        scheduler = new CacheCleanupScheduler(List.of(first, second));
    }

    @Test
    void testCleanupCaches_ExpiredEntries_RemovedFromEveryCache() {
        first.put("a", "1");
        first.put("b", "2");
        second.put("c", "3");
        clock.advance(TTL.plusSeconds(1));

        scheduler.cleanupCaches();

        assertThat(first.size()).isZero();
        assertThat(second.size()).isZero();
    }

    @Test
    void testCleanupCaches_FreshEntries_Survive() {
        first.put("old", "1");
        clock.advance(Duration.ofMinutes(4));
        second.put("fresh", "2");
        clock.advance(Duration.ofMinutes(2));

        scheduler.cleanupCaches();

        assertThat(first.size()).isZero();
        assertThat(second.get("fresh", String.class)).isEqualTo("2");
    }
}
