package com.geoviewer.aoi.domain.model;

import com.geoviewer.aoi.infrastructure.persistence.GeometryJsonConverter;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * User-drawn Area of Interest.
 *
 * The envelope columns mirror the stored geometry and back the bbox listing query.
 */
@Entity
@Table(name = "aoi", indexes = {
        @Index(name = "idx_aoi_user", columnList = "user_id"),
        @Index(name = "idx_aoi_envelope", columnList = "min_lng,min_lat,max_lng,max_lat")
})
@EntityListeners(AuditingEntityListener.class)
@Getter
@Setter
@NoArgsConstructor
public class Aoi {

    public static final String PUBLIC_USER_ID = "public";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false, length = 255)
    private String userId;

    @Column(name = "name", nullable = false, length = 500)
    private String name = "";

    @Column(name = "description", nullable = false, length = 2000)
    private String description = "";

    @Convert(converter = GeometryJsonConverter.class)
    @Column(name = "geometry_json", nullable = false, length = 1_000_000)
    private Geometry geometry;

    @Column(name = "min_lng", nullable = false)
    private double minLng;

    @Column(name = "min_lat", nullable = false)
    private double minLat;

    @Column(name = "max_lng", nullable = false)
    private double maxLng;

    @Column(name = "max_lat", nullable = false)
    private double maxLat;

    @CreatedDate
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @LastModifiedDate
    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    public Aoi(String userId, String name, String description, Geometry geometry) {
        this.userId = userId;
        this.name = name == null ? "" : name;
        this.description = description == null ? "" : description;
        setGeometry(geometry);
    }

    /**
     * Replaces the geometry and recomputes the envelope.
     */
    public void setGeometry(Geometry geometry) {
        this.geometry = geometry;
        BoundingBox envelope = geometry.getEnvelope();
        this.minLng = envelope.getMinLng();
        this.minLat = envelope.getMinLat();
        this.maxLng = envelope.getMaxLng();
        this.maxLat = envelope.getMaxLat();
    }
}
