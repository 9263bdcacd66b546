package com.geoviewer.aoi.infrastructure.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Periodic sweep of every bounded TTL cache, independent of request traffic.
 */
@Component
public class CacheCleanupScheduler {

    private static final Logger logger = LoggerFactory.getLogger(CacheCleanupScheduler.class);

    private final List<BoundedTtlCache> caches;

    public CacheCleanupScheduler(List<BoundedTtlCache> caches) {
        this.caches = caches;
    }

    @Scheduled(
        fixedRateString = "${app.feature-info.cache.cleanup-interval:PT5M}",
        initialDelayString = "${app.feature-info.cache.cleanup-interval:PT5M}")
    public void cleanupCaches() {
        for (BoundedTtlCache cache : caches) {
            int removed = cache.cleanup();
            if (removed > 0) {
                logger.info("Scheduled cleanup removed {} entries from cache '{}' ({} remain)",
                    removed, cache.getName(), cache.size());
            }
        }
    }
}
