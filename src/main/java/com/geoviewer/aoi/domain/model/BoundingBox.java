package com.geoviewer.aoi.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Axis-aligned box in lng/lat degrees.
 */
@Getter
@EqualsAndHashCode
@ToString
public class BoundingBox {

    private final double minLng;
    private final double minLat;
    private final double maxLng;
    private final double maxLat;

    public BoundingBox(double minLng, double minLat, double maxLng, double maxLat) {
        this.minLng = minLng;
        this.minLat = minLat;
        this.maxLng = maxLng;
        this.maxLat = maxLat;
    }

    /**
     * Parses the {@code minLng,minLat,maxLng,maxLat} form used by map clients.
     *
     * @throws InvalidBoundingBoxException if the value is not four finite numbers
     */
    public static BoundingBox parse(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidBoundingBoxException("Invalid bbox parameter: value is empty");
        }
        String[] parts = value.split(",", -1);
        if (parts.length != 4) {
            throw new InvalidBoundingBoxException("Invalid bbox parameter: expected minLng,minLat,maxLng,maxLat");
        }
        double[] numbers = new double[4];
        for (int i = 0; i < parts.length; i++) {
            try {
                numbers[i] = Double.parseDouble(parts[i].trim());
            } catch (NumberFormatException e) {
                throw new InvalidBoundingBoxException("Invalid bbox parameter: '" + parts[i] + "' is not a number");
            }
            if (!Double.isFinite(numbers[i])) {
                throw new InvalidBoundingBoxException("Invalid bbox parameter: '" + parts[i] + "' is not finite");
            }
        }
        return new BoundingBox(numbers[0], numbers[1], numbers[2], numbers[3]);
    }

    public static BoundingBox enclosing(List<Position> positions) {
        if (positions.isEmpty()) {
            throw new IllegalArgumentException("Cannot compute the envelope of an empty geometry");
        }
        double minLng = Double.POSITIVE_INFINITY;
        double minLat = Double.POSITIVE_INFINITY;
        double maxLng = Double.NEGATIVE_INFINITY;
        double maxLat = Double.NEGATIVE_INFINITY;
        for (Position position : positions) {
            minLng = Math.min(minLng, position.getLng());
            minLat = Math.min(minLat, position.getLat());
            maxLng = Math.max(maxLng, position.getLng());
            maxLat = Math.max(maxLat, position.getLat());
        }
        return new BoundingBox(minLng, minLat, maxLng, maxLat);
    }

    public boolean intersects(BoundingBox other) {
        return minLng <= other.maxLng && maxLng >= other.minLng
            && minLat <= other.maxLat && maxLat >= other.minLat;
    }

    /**
     * Exception thrown when a bbox query parameter cannot be parsed.
     */
    public static class InvalidBoundingBoxException extends RuntimeException {
        public InvalidBoundingBoxException(String message) {
            super(message);
        }
    }
}
