package com.geoviewer.aoi.api.controller;

import com.geoviewer.aoi.api.dto.FeatureInfoRequestDto;
import com.geoviewer.aoi.application.dto.FeatureInfoResult;
import com.geoviewer.aoi.application.port.in.QueryFeatureInfoUseCase;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Controller for the WMS GetFeatureInfo proxy.
 */
@RestController
@RequestMapping("/wms")
public class FeatureInfoController {

    private static final Logger logger = LoggerFactory.getLogger(FeatureInfoController.class);

    static final String CACHE_HEADER = "X-Cache";

    private final QueryFeatureInfoUseCase queryFeatureInfoUseCase;

    public FeatureInfoController(QueryFeatureInfoUseCase queryFeatureInfoUseCase) {
        this.queryFeatureInfoUseCase = queryFeatureInfoUseCase;
    }

    /**
     * GET /wms/feature-info?x=&y=&bbox=&width=&height=&layers=
     *
     * Strategy: Cache-first → WMS fallback → populate cache
     *
     * @return Upstream JSON, with X-Cache HIT or MISS
     */
    @GetMapping("/feature-info")
    public ResponseEntity<String> getFeatureInfo(@Valid @ModelAttribute FeatureInfoRequestDto request) {
        logger.info("Feature info request: layers={}, x={}, y={}, bbox={}",
                request.getLayers(), request.getX(), request.getY(), request.getBbox());

        FeatureInfoResult result = queryFeatureInfoUseCase.getFeatureInfo(request.toQuery());
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .header(CACHE_HEADER, result.isCached() ? "HIT" : "MISS")
                .body(result.getBody());
    }
}
