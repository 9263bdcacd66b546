package com.geoviewer.aoi.api.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.geoviewer.aoi.api.dto.AoiResponseDto;
import com.geoviewer.aoi.application.dto.AoiDraft;
import com.geoviewer.aoi.application.mapper.AoiRequestParser;
import com.geoviewer.aoi.application.port.in.CreateAoiUseCase;
import com.geoviewer.aoi.application.port.in.QueryAoisUseCase;
import com.geoviewer.aoi.infrastructure.security.BearerTokenFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Controller for Area of Interest endpoints. Both require a Bearer token.
 */
@RestController
@RequestMapping("/aoi")
public class AoiController {

    private static final Logger logger = LoggerFactory.getLogger(AoiController.class);

    private final CreateAoiUseCase createAoiUseCase;
    private final QueryAoisUseCase queryAoisUseCase;
    private final AoiRequestParser aoiRequestParser;

    public AoiController(
            CreateAoiUseCase createAoiUseCase,
            QueryAoisUseCase queryAoisUseCase,
            AoiRequestParser aoiRequestParser) {
        this.createAoiUseCase = createAoiUseCase;
        this.queryAoisUseCase = queryAoisUseCase;
        this.aoiRequestParser = aoiRequestParser;
    }

    /**
     * POST /aoi
     *
     * Accepts a GeoJSON Feature, a bare geometry, or {geometry, name, description}.
     * Rings are closed and simplified before storage.
     *
     * @return 201 with the stored AOI, 400 for invalid or out-of-bounds geometry
     */
    @PostMapping
    public ResponseEntity<AoiResponseDto> createAoi(
            @RequestAttribute(BearerTokenFilter.USER_ID_ATTRIBUTE) String userId,
            @RequestBody JsonNode body) {
        AoiDraft draft = aoiRequestParser.parse(body);
        logger.info("Creating AOI for user {}: type={}, name='{}'",
                userId, draft.getGeometry().getType().getGeoJsonName(), draft.getName());

        AoiResponseDto created = createAoiUseCase.createAoi(userId, draft);
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    /**
     * GET /aoi?bbox=minLng,minLat,maxLng,maxLat
     *
     * Returns the caller's AOIs plus the public samples, newest first. With a bbox,
     * only AOIs whose extent intersects it.
     */
    @GetMapping
    public ResponseEntity<List<AoiResponseDto>> listAois(
            @RequestAttribute(BearerTokenFilter.USER_ID_ATTRIBUTE) String userId,
            @RequestParam(name = "bbox", required = false) String bbox) {
        logger.info("Listing AOIs for user {} (bbox={})", userId, bbox);
        return ResponseEntity.ok(queryAoisUseCase.listAois(userId, bbox));
    }
}
