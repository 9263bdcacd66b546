package com.geoviewer.aoi.application.port.in;

import com.geoviewer.aoi.application.dto.FeatureInfoResult;
import com.geoviewer.aoi.domain.model.FeatureInfoQuery;

/**
 * Input port for WMS feature-info lookups.
 */
public interface QueryFeatureInfoUseCase {

    /**
     * Look up features at a map pixel.
     * Strategy: Cache-first → WMS fallback → populate cache on success only
     *
     * @param query Pixel, extent and layers of the lookup
     * @return Upstream JSON body and cache indicator
     */
    FeatureInfoResult getFeatureInfo(FeatureInfoQuery query);
}
