package com.geoviewer.aoi.application.service;

import com.geoviewer.aoi.application.dto.FeatureInfoResult;
import com.geoviewer.aoi.application.port.in.QueryFeatureInfoUseCase;
import com.geoviewer.aoi.domain.model.FeatureInfoQuery;
import com.geoviewer.aoi.infrastructure.cache.CacheConfig;
import com.geoviewer.aoi.infrastructure.external.WmsClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Service;

/**
 * Application service for WMS feature-info lookups.
 * Implements cache-first strategy with WMS fallback.
 */
@Service
public class FeatureInfoService implements QueryFeatureInfoUseCase {

    private static final Logger logger = LoggerFactory.getLogger(FeatureInfoService.class);

    private final WmsClient wmsClient;
    private final CacheManager cacheManager;

    public FeatureInfoService(WmsClient wmsClient, CacheManager cacheManager) {
        this.wmsClient = wmsClient;
        this.cacheManager = cacheManager;
    }

    /**
     * Strategy: Cache-first → WMS fallback → populate cache
     *
     * A failed WMS call propagates unchanged and leaves the cache untouched.
     */
    @Override
    public FeatureInfoResult getFeatureInfo(FeatureInfoQuery query) {
        String cacheKey = query.fingerprint();
        Cache cache = cacheManager.getCache(CacheConfig.FEATURE_INFO_CACHE);

        if (cache != null) {
            String cachedBody = cache.get(cacheKey, String.class);
            if (cachedBody != null) {
                logger.debug("Feature-info cache hit for key: {}", cacheKey);
                return new FeatureInfoResult(cachedBody, true);
            }
        }
        logger.debug("Feature-info cache miss for key: {}", cacheKey);

        String body = wmsClient.getFeatureInfo(query);

        if (cache != null) {
            cache.put(cacheKey, body);
            logger.debug("Feature-info cache populated for key: {}", cacheKey);
        }
        return new FeatureInfoResult(body, false);
    }
}
