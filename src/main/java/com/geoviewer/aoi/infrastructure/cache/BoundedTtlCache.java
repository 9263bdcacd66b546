package com.geoviewer.aoi.infrastructure.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.support.AbstractValueAdaptingCache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process cache bounded by entry age and entry count.
 *
 * Reads, writes and sweeps all go through one lock. Entries older than the TTL
 * are never returned, even before a sweep has removed them. After every put a
 * sweep drops expired entries and then the oldest ones until at most
 * {@code maxSize} remain. The same sweep is run periodically by
 * {@link CacheCleanupScheduler}.
 *
 * Contents are lost on restart.
 */
public class BoundedTtlCache extends AbstractValueAdaptingCache {

    private static final Logger logger = LoggerFactory.getLogger(BoundedTtlCache.class);

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);
    public static final int DEFAULT_MAX_SIZE = 1000;

    private final String name;
    private final Duration ttl;
    private final int maxSize;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    // Insertion order breaks storedAt ties during eviction
    private final Map<Object, CacheEntry> entries = new LinkedHashMap<>();

    public BoundedTtlCache(String name, Duration ttl, int maxSize, Clock clock) {
        super(false);
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("TTL must be positive");
        }
        if (maxSize < 1) {
            throw new IllegalArgumentException("Max size must be at least 1");
        }
        this.name = name;
        this.ttl = ttl;
        this.maxSize = maxSize;
        this.clock = clock;
    }

    public BoundedTtlCache(String name) {
        this(name, DEFAULT_TTL, DEFAULT_MAX_SIZE, Clock.systemUTC());
    }

    @Override
    public String getName() {
        return name;
    }

    /**
     * Snapshot of the live entries. Changes to the cache are not reflected in it.
     */
    @Override
    public Map<Object, CacheEntry> getNativeCache() {
        lock.lock();
        try {
            return Map.copyOf(entries);
        } finally {
            lock.unlock();
        }
    }

    @Override
    protected Object lookup(Object key) {
        lock.lock();
        try {
            CacheEntry entry = entries.get(key);
            if (entry == null || entry.isExpired(clock.instant(), ttl)) {
                return null;
            }
            return entry.getValue();
        } finally {
            lock.unlock();
        }
    }

    /**
     * The loader runs outside the lock. A failing loader leaves the cache untouched.
     */
    @Override
    @SuppressWarnings("unchecked")
    public <T> T get(Object key, Callable<T> valueLoader) {
        ValueWrapper cached = get(key);
        if (cached != null) {
            return (T) cached.get();
        }
        T value;
        try {
            value = valueLoader.call();
        } catch (Exception e) {
            throw new ValueRetrievalException(key, valueLoader, e);
        }
        put(key, value);
        return value;
    }

    /**
     * Stores the value with the current time, then sweeps. Null values are not stored.
     */
    @Override
    public void put(Object key, Object value) {
        if (value == null) {
            logger.debug("Ignoring null value for key: {}", key);
            return;
        }
        lock.lock();
        try {
            entries.remove(key);
            entries.put(key, new CacheEntry(key, value, clock.instant()));
            sweep();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void evict(Object key) {
        lock.lock();
        try {
            entries.remove(key);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes expired entries, then the oldest entries beyond {@code maxSize}.
     *
     * @return number of entries removed
     */
    public int cleanup() {
        lock.lock();
        try {
            return sweep();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of stored entries, including expired ones not yet swept.
     */
    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public Duration getTtl() {
        return ttl;
    }

    public int getMaxSize() {
        return maxSize;
    }

    // Caller holds the lock.
    private int sweep() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.values().removeIf(entry -> entry.isExpired(now, ttl));
        int expired = before - entries.size();

        int overflow = entries.size() - maxSize;
        if (overflow > 0) {
            List<Object> oldest = entries.values().stream()
                .sorted(Comparator.comparing(CacheEntry::getStoredAt))
                .limit(overflow)
                .map(CacheEntry::getKey)
                .toList();
            oldest.forEach(entries::remove);
        }

        int evicted = Math.max(overflow, 0);
        if (expired > 0 || evicted > 0) {
            logger.debug("Cache '{}' sweep removed {} expired and {} oldest entries, {} remain",
                name, expired, evicted, entries.size());
        }
        return expired + evicted;
    }
}
