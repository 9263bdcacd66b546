package com.geoviewer.aoi.infrastructure.persistence;

import com.geoviewer.aoi.application.port.out.AoiRepository;
import com.geoviewer.aoi.domain.model.Aoi;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * JPA implementation of AoiRepository output port.
 */
@Repository
public interface AoiJpaRepository extends JpaRepository<Aoi, UUID>, AoiRepository {

    @Override
    @Query("SELECT a FROM Aoi a WHERE a.userId IN :userIds ORDER BY a.createdAt DESC")
    List<Aoi> findOwnedBy(@Param("userIds") Collection<String> userIds);

    /**
     * Envelope intersection: both ranges overlap on each axis.
     */
    @Override
    @Query("SELECT a FROM Aoi a WHERE a.userId IN :userIds "
        + "AND a.minLng <= :maxLng AND a.maxLng >= :minLng "
        + "AND a.minLat <= :maxLat AND a.maxLat >= :minLat "
        + "ORDER BY a.createdAt DESC")
    List<Aoi> findOwnedByWithin(
        @Param("userIds") Collection<String> userIds,
        @Param("minLng") double minLng,
        @Param("minLat") double minLat,
        @Param("maxLng") double maxLng,
        @Param("maxLat") double maxLat
    );

    @Override
    long countByUserId(String userId);
}
