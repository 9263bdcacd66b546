package com.geoviewer.aoi.application.port.in;

import com.geoviewer.aoi.api.dto.AoiResponseDto;

import java.util.List;

/**
 * Input port for listing AOIs visible to a user.
 */
public interface QueryAoisUseCase {

    /**
     * List the user's AOIs and the public samples, newest first.
     *
     * @param userId Requesting user
     * @param bbox Optional {@code minLng,minLat,maxLng,maxLat} filter, may be null
     */
    List<AoiResponseDto> listAois(String userId, String bbox);
}
