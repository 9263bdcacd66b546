package com.geoviewer.aoi.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * GeoJSON geometry restricted to the kinds an AOI may have.
 *
 * Subclasses are immutable. Traversals switch on {@link #getType()} so that
 * every kind is handled explicitly.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = PointGeometry.class, name = "Point"),
    @JsonSubTypes.Type(value = PolygonGeometry.class, name = "Polygon"),
    @JsonSubTypes.Type(value = MultiPolygonGeometry.class, name = "MultiPolygon")
})
public abstract class Geometry {

    @JsonIgnore
    public abstract GeometryType getType();

    /**
     * All positions of the geometry, in document order.
     */
    @JsonIgnore
    public abstract List<Position> getPositions();

    /**
     * Smallest box containing every position.
     */
    @JsonIgnore
    public BoundingBox getEnvelope() {
        return BoundingBox.enclosing(getPositions());
    }

    static <T> List<T> immutableCopy(List<T> source) {
        return source == null ? null : Collections.unmodifiableList(new ArrayList<>(source));
    }
}
