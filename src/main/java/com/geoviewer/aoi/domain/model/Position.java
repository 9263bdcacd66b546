package com.geoviewer.aoi.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.io.IOException;

/**
 * Value object representing a single GeoJSON coordinate pair.
 * Serialized as a two-element array {@code [lng, lat]}.
 */
@JsonDeserialize(using = Position.ArrayDeserializer.class)
@Getter
@EqualsAndHashCode
public final class Position {

    public static final double MIN_LNG = -180.0;
    public static final double MAX_LNG = 180.0;
    public static final double MIN_LAT = -90.0;
    public static final double MAX_LAT = 90.0;

    private final double lng;
    private final double lat;

    public Position(double lng, double lat) {
        this.lng = lng;
        this.lat = lat;
    }

    @JsonValue
    public double[] toArray() {
        return new double[] {lng, lat};
    }

    /**
     * WGS84 range check. NaN never passes.
     */
    public boolean isWithinBounds() {
        return lng >= MIN_LNG && lng <= MAX_LNG && lat >= MIN_LAT && lat <= MAX_LAT;
    }

    @Override
    public String toString() {
        return "[" + lng + ", " + lat + "]";
    }

    /**
     * Reads {@code [lng, lat]}. Both elements must be JSON numbers; nulls, strings
     * and any other length are rejected rather than coerced.
     */
    public static class ArrayDeserializer extends StdDeserializer<Position> {

        public ArrayDeserializer() {
            super(Position.class);
        }

        @Override
        public Position deserialize(JsonParser parser, DeserializationContext context) throws IOException {
            JsonNode node = context.readTree(parser);
            if (!node.isArray() || node.size() != 2 || !node.get(0).isNumber() || !node.get(1).isNumber()) {
                throw JsonMappingException.from(parser,
                    "A position must be exactly two numbers [lng, lat], got " + node);
            }
            return new Position(node.get(0).doubleValue(), node.get(1).doubleValue());
        }
    }
}
