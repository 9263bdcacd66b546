package com.geoviewer.aoi.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Parameters of a WMS GetFeatureInfo lookup that affect the upstream response.
 */
@Getter
@EqualsAndHashCode
@ToString
public class FeatureInfoQuery {

    private static final char SEPARATOR = '|';

    private final int x;
    private final int y;
    private final String bbox;
    private final int width;
    private final int height;
    private final String layers;

    public FeatureInfoQuery(int x, int y, String bbox, int width, int height, String layers) {
        if (bbox == null || layers == null) {
            throw new IllegalArgumentException("bbox and layers must not be null");
        }
        this.x = x;
        this.y = y;
        this.bbox = bbox;
        this.width = width;
        this.height = height;
        this.layers = layers;
    }

    /**
     * Cache key for this lookup: {@code layers|x|y|bbox|width|height}.
     * String fields are URL-encoded so that no separator can appear inside a field.
     */
    public String fingerprint() {
        return encode(layers) + SEPARATOR + x + SEPARATOR + y + SEPARATOR + encode(bbox)
            + SEPARATOR + width + SEPARATOR + height;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
