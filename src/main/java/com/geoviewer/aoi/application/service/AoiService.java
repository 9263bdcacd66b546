package com.geoviewer.aoi.application.service;

import com.geoviewer.aoi.api.dto.AoiResponseDto;
import com.geoviewer.aoi.application.dto.AoiDraft;
import com.geoviewer.aoi.application.mapper.AoiMapper;
import com.geoviewer.aoi.application.port.in.CreateAoiUseCase;
import com.geoviewer.aoi.application.port.in.QueryAoisUseCase;
import com.geoviewer.aoi.application.port.out.AoiRepository;
import com.geoviewer.aoi.domain.model.Aoi;
import com.geoviewer.aoi.domain.model.BoundingBox;
import com.geoviewer.aoi.domain.model.Geometry;
import com.geoviewer.aoi.domain.service.GeometryNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Application service for storing and listing AOIs.
 */
@Service
public class AoiService implements CreateAoiUseCase, QueryAoisUseCase {

    private static final Logger logger = LoggerFactory.getLogger(AoiService.class);

    private final GeometryNormalizer geometryNormalizer;
    private final AoiRepository aoiRepository;
    private final AoiMapper aoiMapper;

    public AoiService(GeometryNormalizer geometryNormalizer, AoiRepository aoiRepository, AoiMapper aoiMapper) {
        this.geometryNormalizer = geometryNormalizer;
        this.aoiRepository = aoiRepository;
        this.aoiMapper = aoiMapper;
    }

    /**
     * Geometry is normalized before anything is written; rejected geometry is never stored.
     *
     * @throws GeometryNormalizer.OutOfBoundsException if coordinates fall outside WGS84 bounds
     */
    @Override
    @Transactional
    public AoiResponseDto createAoi(String userId, AoiDraft draft) {
        Geometry normalized = geometryNormalizer.normalize(draft.getGeometry());

        Aoi saved = aoiRepository.save(new Aoi(userId, draft.getName(), draft.getDescription(), normalized));
        logger.info("Created AOI {} ({}) for user {}", saved.getId(), normalized.getType().getGeoJsonName(), userId);
        return aoiMapper.toDto(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public List<AoiResponseDto> listAois(String userId, String bbox) {
        List<String> owners = List.of(userId, Aoi.PUBLIC_USER_ID);

        List<Aoi> aois;
        if (bbox == null) {
            aois = aoiRepository.findOwnedBy(owners);
        } else {
            BoundingBox box = BoundingBox.parse(bbox);
            aois = aoiRepository.findOwnedByWithin(
                owners, box.getMinLng(), box.getMinLat(), box.getMaxLng(), box.getMaxLat());
        }

        logger.debug("Found {} AOIs for user {} (bbox={})", aois.size(), userId, bbox);
        return aois.stream()
            .map(aoiMapper::toDto)
            .toList();
    }
}
