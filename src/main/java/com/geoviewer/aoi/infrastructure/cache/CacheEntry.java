package com.geoviewer.aoi.infrastructure.cache;

import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;

/**
 * One memoized value. Never updated in place; a re-put replaces the entry.
 */
@Getter
@ToString(exclude = "value")
public final class CacheEntry {

    private final Object key;
    private final Object value;
    private final Instant storedAt;

    public CacheEntry(Object key, Object value, Instant storedAt) {
        this.key = key;
        this.value = value;
        this.storedAt = storedAt;
    }

    public boolean isExpired(Instant now, Duration ttl) {
        return Duration.between(storedAt, now).compareTo(ttl) >= 0;
    }
}
