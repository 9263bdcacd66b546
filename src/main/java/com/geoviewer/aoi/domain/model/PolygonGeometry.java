package com.geoviewer.aoi.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.List;

/**
 * Polygon as a list of linear rings. Ring 0 is the outer boundary, the rest are holes.
 */
@EqualsAndHashCode(callSuper = false)
@ToString
public final class PolygonGeometry extends Geometry {

    public static final int MIN_RING_SIZE = 4;

    @NotEmpty(message = "Polygon must have at least one ring")
    private final List<@NotNull @Size(min = MIN_RING_SIZE, message = "Ring must have at least 4 positions")
        List<@NotNull Position>> coordinates;

    @JsonCreator
    public PolygonGeometry(@JsonProperty("coordinates") List<List<Position>> coordinates) {
        this.coordinates = coordinates == null ? null : coordinates.stream().map(Geometry::immutableCopy).toList();
    }

    public List<List<Position>> getCoordinates() {
        return coordinates;
    }

    @Override
    public GeometryType getType() {
        return GeometryType.POLYGON;
    }

    @Override
    public List<Position> getPositions() {
        return coordinates == null ? List.of() : coordinates.stream().flatMap(List::stream).toList();
    }
}
