package com.geoviewer.aoi.application.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Feature-info lookup result: the upstream JSON body and whether it came from the cache.
 */
@Getter
@AllArgsConstructor
public class FeatureInfoResult {

    private final String body;
    private final boolean cached;
}
