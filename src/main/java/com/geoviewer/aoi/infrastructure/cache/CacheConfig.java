package com.geoviewer.aoi.infrastructure.cache;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.support.SimpleCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Cache configuration using in-process bounded TTL caches.
 *
 * - One cache per upstream resource, constructed once and injected where needed
 * - Memory bounded by entry count and entry age
 * - Not shared across instances and cleared on restart
 */
@Configuration
@EnableCaching
public class CacheConfig {

    public static final String FEATURE_INFO_CACHE = "featureInfo";

    @Value("${app.feature-info.cache.ttl:PT5M}")
    private Duration featureInfoTtl;

    @Value("${app.feature-info.cache.max-size:1000}")
    private int featureInfoMaxSize;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public BoundedTtlCache featureInfoCache(Clock clock) {
        return new BoundedTtlCache(FEATURE_INFO_CACHE, featureInfoTtl, featureInfoMaxSize, clock);
    }

    @Bean
    public CacheManager cacheManager(List<BoundedTtlCache> caches) {
        SimpleCacheManager cacheManager = new SimpleCacheManager();
        cacheManager.setCaches(caches);
        return cacheManager;
    }
}
