package com.geoviewer.aoi.infrastructure.cache;

import com.geoviewer.aoi.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.cache.Cache;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BoundedTtlCacheTest {

    private static final Duration TTL = Duration.ofMinutes(5);
    private static final int MAX_SIZE = 1000;

    private MutableClock clock;
    private BoundedTtlCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-06-01T12:00:00Z"));
        cache = new BoundedTtlCache("featureInfo", TTL, MAX_SIZE, clock);
    }

    @Test
    void testGet_AfterPut_ReturnsValue() {
        cache.put("k", "body");

        assertThat(cache.get("k", String.class)).isEqualTo("body");
    }

    @Test
    void testGet_UnknownKey_ReturnsNull() {
        assertThat(cache.get("missing")).isNull();
        assertThat(cache.get("missing", String.class)).isNull();
    }

    @Test
    void testGet_JustBeforeTtl_ReturnsValue() {
        cache.put("k", "body");
        clock.advance(TTL.minusMillis(1));

        assertThat(cache.get("k", String.class)).isEqualTo("body");
    }

    @Test
    void testGet_AfterTtl_ReturnsNull() {
        cache.put("k", "body");
        clock.advance(TTL.plusMillis(1));

        assertThat(cache.get("k")).isNull();
    }

    @Test
    void testGet_ExpiredButNotSwept_ReturnsNull() {
        cache.put("k", "body");
        clock.advance(TTL.plusSeconds(1));

        // No put or cleanup has run since expiry
        assertThat(cache.size()).isEqualTo(1);
        assertThat(cache.get("k")).isNull();
    }

    @Test
    void testPut_SameKey_ReplacesValueAndTimestamp() {
        cache.put("k", "old");
        clock.advance(Duration.ofMinutes(4));
        cache.put("k", "new");
        clock.advance(Duration.ofMinutes(4));

        assertThat(cache.get("k", String.class)).isEqualTo("new");
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    void testPut_NullValue_IsIgnored() {
        cache.put("k", null);

        assertThat(cache.size()).isZero();
        assertThat(cache.get("k")).isNull();
    }

    @Test
    void testPut_BeyondMaxSize_KeepsMostRecentEntries() {
        int total = MAX_SIZE + 50;
        for (int i = 0; i < total; i++) {
            cache.put("key-" + i, "value-" + i);
            clock.advance(Duration.ofMillis(1));
        }

        assertThat(cache.size()).isEqualTo(MAX_SIZE);
        assertThat(cache.get("key-0")).isNull();
        assertThat(cache.get("key-49")).isNull();
        assertThat(cache.get("key-50", String.class)).isEqualTo("value-50");
        assertThat(cache.get("key-" + (total - 1), String.class)).isEqualTo("value-" + (total - 1));
    }

    @Test
    void testPut_SweepsExpiredEntries() {
        cache.put("a", "1");
        cache.put("b", "2");
        clock.advance(TTL);
        cache.put("c", "3");

        assertThat(cache.size()).isEqualTo(1);
        assertThat(cache.getNativeCache()).containsOnlyKeys("c");
    }

    @Test
    void testCleanup_RemovesOnlyExpiredEntries() {
        cache.put("a", "1");
        clock.advance(Duration.ofMinutes(3));
        cache.put("b", "2");
        clock.advance(Duration.ofMinutes(3));

        assertThat(cache.cleanup()).isEqualTo(1);
        assertThat(cache.get("a")).isNull();
        assertThat(cache.get("b", String.class)).isEqualTo("2");
        assertThat(cache.cleanup()).isZero();
    }

    @Test
    void testGetWithLoader_Miss_StoresLoadedValue() {
        String loaded = cache.get("k", () -> "loaded");

        assertThat(loaded).isEqualTo("loaded");
        assertThat(cache.get("k", () -> "other")).isEqualTo("loaded");
    }

    @Test
    void testGetWithLoader_LoaderFails_LeavesCacheUnchanged() {
        cache.put("existing", "1");

        assertThatThrownBy(() -> cache.get("k", () -> {
            throw new IllegalStateException("upstream down");
        }))
            .isInstanceOf(Cache.ValueRetrievalException.class)
            .hasRootCauseInstanceOf(IllegalStateException.class);

        assertThat(cache.get("k")).isNull();
        assertThat(cache.getNativeCache()).containsOnlyKeys("existing");
    }

    @Test
    void testEvictAndClear() {
        cache.put("a", "1");
        cache.put("b", "2");

        cache.evict("a");
        assertThat(cache.get("a")).isNull();
        assertThat(cache.size()).isEqualTo(1);

        cache.clear();
        assertThat(cache.size()).isZero();
    }

    @Test
    void testConstructor_InvalidSettings_Throws() {
        assertThatThrownBy(() -> new BoundedTtlCache("c", Duration.ZERO, 10, clock))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BoundedTtlCache("c", TTL, 0, clock))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testDefaults() {
        BoundedTtlCache defaults = new BoundedTtlCache("featureInfo");

        assertThat(defaults.getName()).isEqualTo("featureInfo");
        assertThat(defaults.getTtl()).isEqualTo(Duration.ofMinutes(5));
        assertThat(defaults.getMaxSize()).isEqualTo(1000);
    }

    @Test
    void testPut_SameTimestamp_EvictsFirstInserted() {
        BoundedTtlCache small = new BoundedTtlCache("small", TTL, 3, clock);
        small.put("a", "1");
        small.put("b", "2");
        small.put("c", "3");
        small.put("d", "4");

        assertThat(small.getNativeCache()).containsOnlyKeys("b", "c", "d");
    }

    @Test
    void testPut_SameTimestamp_RePutMovesKeyToNewest() {
        BoundedTtlCache small = new BoundedTtlCache("small", TTL, 3, clock);
        small.put("a", "1");
        small.put("b", "2");
        small.put("c", "3");
        small.put("a", "1b");
        small.put("d", "4");

        assertThat(small.getNativeCache()).containsOnlyKeys("a", "c", "d");
        assertThat(small.get("a", String.class)).isEqualTo("1b");
    }

    @Test
    void testConcurrentPutGetCleanup_RespectsBoundsAndExpiry() throws Exception {
        int maxSize = 100;
        int writers = 4;
        int readers = 2;
        int putsPerWriter = 2000;
        int staleKeys = 50;
        BoundedTtlCache shared = new BoundedTtlCache("shared", TTL, maxSize, clock);
        for (int i = 0; i < staleKeys; i++) {
            shared.put("stale-" + i, "stale-value-" + i);
        }
        clock.advance(TTL.plusSeconds(1));

        List<Callable<Void>> tasks = new ArrayList<>();
        for (int w = 0; w < writers; w++) {
            int writer = w;
            tasks.add(() -> {
                for (int i = 0; i < putsPerWriter; i++) {
                    shared.put("w" + writer + "-" + i, "v" + writer + "-" + i);
                }
                return null;
            });
        }
        for (int r = 0; r < readers; r++) {
            tasks.add(() -> {
                for (int i = 0; i < putsPerWriter; i++) {
                    assertThat(shared.get("stale-" + (i % staleKeys))).isNull();
                    String live = shared.get("w0-" + i, String.class);
                    if (live != null) {
                        assertThat(live).isEqualTo("v0-" + i);
                    }
                }
                return null;
            });
        }
        tasks.add(() -> {
            for (int i = 0; i < putsPerWriter; i++) {
                shared.cleanup();
                assertThat(shared.size()).isLessThanOrEqualTo(maxSize);
            }
            return null;
        });

        ExecutorService executor = Executors.newFixedThreadPool(tasks.size());
        try {
            for (Future<Void> future : executor.invokeAll(tasks)) {
                future.get();
            }
        } finally {
            executor.shutdown();
            assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        }

        shared.cleanup();
        assertThat(shared.size()).isLessThanOrEqualTo(maxSize);
        for (int i = 0; i < staleKeys; i++) {
            assertThat(shared.get("stale-" + i)).isNull();
        }
    }
}
