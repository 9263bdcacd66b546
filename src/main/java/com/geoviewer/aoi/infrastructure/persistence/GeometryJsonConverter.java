package com.geoviewer.aoi.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geoviewer.aoi.domain.model.Geometry;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores geometry as its GeoJSON text.
 */
@Converter
public class GeometryJsonConverter implements AttributeConverter<Geometry, String> {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    @Override
    public String convertToDatabaseColumn(Geometry geometry) {
        if (geometry == null) {
            return null;
        }
        try {
            return OBJECT_MAPPER.writeValueAsString(geometry);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize geometry", e);
        }
    }

    @Override
    public Geometry convertToEntityAttribute(String json) {
        if (json == null) {
            return null;
        }
        try {
            return OBJECT_MAPPER.readValue(json, Geometry.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize stored geometry", e);
        }
    }
}
