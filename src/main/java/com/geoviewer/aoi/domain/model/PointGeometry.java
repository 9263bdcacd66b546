package com.geoviewer.aoi.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.List;

@EqualsAndHashCode(callSuper = false)
@ToString
public final class PointGeometry extends Geometry {

    @NotNull(message = "Point coordinates are required")
    @JsonProperty("coordinates")
    private final Position coordinates;

    @JsonCreator
    public PointGeometry(@JsonProperty("coordinates") Position coordinates) {
        this.coordinates = coordinates;
    }

    public Position getCoordinates() {
        return coordinates;
    }

    @Override
    public GeometryType getType() {
        return GeometryType.POINT;
    }

    @Override
    public List<Position> getPositions() {
        return coordinates == null ? List.of() : List.of(coordinates);
    }
}
