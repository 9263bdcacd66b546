package com.geoviewer.aoi.application.mapper;

import com.geoviewer.aoi.api.dto.AoiResponseDto;
import com.geoviewer.aoi.domain.model.Aoi;
import org.springframework.stereotype.Component;

/**
 * Mapper for converting between domain models and DTOs.
 */
@Component
public class AoiMapper {

    public AoiResponseDto toDto(Aoi aoi) {
        return new AoiResponseDto(
                aoi.getId(),
                aoi.getUserId(),
                aoi.getName(),
                aoi.getDescription(),
                aoi.getGeometry(),
                aoi.getCreatedAt(),
                aoi.getUpdatedAt());
    }
}
