package com.geoviewer.aoi.application.port.in;

import com.geoviewer.aoi.api.dto.AoiResponseDto;
import com.geoviewer.aoi.application.dto.AoiDraft;

/**
 * Input port for storing a user-drawn AOI.
 */
public interface CreateAoiUseCase {

    /**
     * Normalize the draft geometry and persist the AOI.
     *
     * @param userId Owner of the new AOI
     * @param draft Parsed request
     * @return Stored AOI
     */
    AoiResponseDto createAoi(String userId, AoiDraft draft);
}
