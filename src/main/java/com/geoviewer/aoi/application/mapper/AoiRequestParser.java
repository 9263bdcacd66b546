package com.geoviewer.aoi.application.mapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geoviewer.aoi.application.dto.AoiDraft;
import com.geoviewer.aoi.domain.model.Geometry;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Parses the body of POST /aoi.
 *
 * Accepted shapes:
 * - GeoJSON Feature: {type: "Feature", geometry, properties?}
 * - Bare geometry: {type: "Polygon"|"MultiPolygon"|"Point", coordinates}
 * - Wrapper: {geometry, name?, description?, properties?}
 *
 * Name and description come from {@code properties} first, then the top level.
 */
@Component
public class AoiRequestParser {

    private static final String FEATURE_TYPE = "Feature";
    private static final Set<String> GEOMETRY_TYPES = Set.of("Point", "Polygon", "MultiPolygon");

    private final ObjectMapper objectMapper;
    private final Validator validator;

    public AoiRequestParser(ObjectMapper objectMapper, Validator validator) {
        this.objectMapper = objectMapper;
        this.validator = validator;
    }

    /**
     * @throws InvalidGeoJsonException if the body matches none of the accepted shapes
     */
    public AoiDraft parse(JsonNode body) {
        if (body == null || !body.isObject()) {
            throw new InvalidGeoJsonException(List.of("Request body must be a JSON object"));
        }

        String type = body.path("type").isTextual() ? body.get("type").asText() : null;
        JsonNode geometryNode;
        if (FEATURE_TYPE.equals(type)) {
            geometryNode = body.get("geometry");
        } else if (type != null && GEOMETRY_TYPES.contains(type)) {
            geometryNode = body;
        } else if (type == null && body.has("geometry")) {
            geometryNode = body.get("geometry");
        } else {
            throw new InvalidGeoJsonException(List.of(
                    "Expected a Feature, a Point/Polygon/MultiPolygon geometry, or an object with a geometry field"));
        }

        Geometry geometry = readGeometry(geometryNode);
        return new AoiDraft(geometry, textField(body, "name"), textField(body, "description"));
    }

    private Geometry readGeometry(JsonNode geometryNode) {
        if (geometryNode == null || !geometryNode.isObject()) {
            throw new InvalidGeoJsonException(List.of("geometry must be a JSON object"));
        }
        String type = geometryNode.path("type").asText(null);
        if (type == null || !GEOMETRY_TYPES.contains(type)) {
            throw new InvalidGeoJsonException(List.of("geometry.type must be one of " + GEOMETRY_TYPES.stream().sorted().toList()));
        }

        Geometry geometry;
        try {
            geometry = objectMapper.treeToValue(geometryNode, Geometry.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new InvalidGeoJsonException(List.of("Malformed " + type + " coordinates: " + rootMessage(e)));
        }
        if (geometry == null) {
            throw new InvalidGeoJsonException(List.of("geometry is required"));
        }

        Set<ConstraintViolation<Geometry>> violations = validator.validate(geometry);
        if (!violations.isEmpty()) {
            throw new InvalidGeoJsonException(violations.stream()
                    .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                    .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                    .toList());
        }
        return geometry;
    }

    private static String textField(JsonNode body, String field) {
        JsonNode fromProperties = body.path("properties").path(field);
        if (fromProperties.isTextual() && !fromProperties.asText().isEmpty()) {
            return fromProperties.asText();
        }
        JsonNode topLevel = body.path(field);
        return topLevel.isTextual() ? topLevel.asText() : "";
    }

    private static String rootMessage(Exception e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = root.getMessage();
        if (message == null) {
            return root.getClass().getSimpleName();
        }
        int newline = message.indexOf('\n');
        return newline >= 0 ? message.substring(0, newline) : message;
    }

    /**
     * Exception thrown when the request body is not acceptable GeoJSON.
     */
    public static class InvalidGeoJsonException extends RuntimeException {
        private final List<String> details;

        public InvalidGeoJsonException(List<String> details) {
            super("Invalid GeoJSON");
            this.details = List.copyOf(details);
        }

        public List<String> getDetails() {
            return details;
        }
    }
}
