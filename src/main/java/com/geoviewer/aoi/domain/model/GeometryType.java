package com.geoviewer.aoi.domain.model;

/**
 * Discriminant of the supported GeoJSON geometry kinds.
 */
public enum GeometryType {
    POINT("Point"),
    POLYGON("Polygon"),
    MULTI_POLYGON("MultiPolygon");

    private final String geoJsonName;

    GeometryType(String geoJsonName) {
        this.geoJsonName = geoJsonName;
    }

    public String getGeoJsonName() {
        return geoJsonName;
    }
}
