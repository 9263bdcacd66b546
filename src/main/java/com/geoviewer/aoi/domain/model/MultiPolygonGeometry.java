package com.geoviewer.aoi.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.List;

@EqualsAndHashCode(callSuper = false)
@ToString
public final class MultiPolygonGeometry extends Geometry {

    @NotEmpty(message = "MultiPolygon must have at least one polygon")
    private final List<@NotEmpty(message = "Polygon must have at least one ring")
        List<@NotNull @Size(min = PolygonGeometry.MIN_RING_SIZE, message = "Ring must have at least 4 positions")
            List<@NotNull Position>>> coordinates;

    @JsonCreator
    public MultiPolygonGeometry(@JsonProperty("coordinates") List<List<List<Position>>> coordinates) {
        this.coordinates = coordinates == null ? null : coordinates.stream()
            .map(polygon -> polygon == null ? null : polygon.stream().map(Geometry::immutableCopy).toList())
            .toList();
    }

    public List<List<List<Position>>> getCoordinates() {
        return coordinates;
    }

    @Override
    public GeometryType getType() {
        return GeometryType.MULTI_POLYGON;
    }

    @Override
    public List<Position> getPositions() {
        if (coordinates == null) {
            return List.of();
        }
        return coordinates.stream()
            .flatMap(List::stream)
            .flatMap(List::stream)
            .toList();
    }
}
