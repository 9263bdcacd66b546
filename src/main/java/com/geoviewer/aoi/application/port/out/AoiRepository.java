package com.geoviewer.aoi.application.port.out;

import com.geoviewer.aoi.domain.model.Aoi;

import java.util.Collection;
import java.util.List;

/**
 * Output port for AOI persistence.
 */
public interface AoiRepository {

    /**
     * All AOIs owned by any of the given users, newest first.
     */
    List<Aoi> findOwnedBy(Collection<String> userIds);

    /**
     * AOIs owned by any of the given users whose envelope intersects the box, newest first.
     */
    List<Aoi> findOwnedByWithin(
            Collection<String> userIds,
            double minLng,
            double minLat,
            double maxLng,
            double maxLat);

    /**
     * Count AOIs owned by a user. Used by the sample-data seeder.
     */
    long countByUserId(String userId);

    Aoi save(Aoi aoi);
}
