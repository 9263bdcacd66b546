package com.geoviewer.aoi.application.dto;

import com.geoviewer.aoi.domain.model.Geometry;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Parsed, schema-valid AOI creation request. Geometry is not yet normalized.
 */
@Getter
@AllArgsConstructor
@ToString
public class AoiDraft {

    private final Geometry geometry;
    private final String name;
    private final String description;
}
