package com.geoviewer.aoi.presentation.exception;

import com.geoviewer.aoi.application.mapper.AoiRequestParser;
import com.geoviewer.aoi.domain.model.BoundingBox;
import com.geoviewer.aoi.domain.service.GeometryNormalizer;
import com.geoviewer.aoi.infrastructure.external.WmsClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.Map;

/**
 * Global exception handler providing consistent JSON error responses.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Covers MethodArgumentNotValidException as well as binding type mismatches.
     */
    @ExceptionHandler(BindException.class)
    public ResponseEntity<Map<String, Object>> handleBindException(BindException ex) {
        logger.debug("Validation error", ex);

        Map<String, Object> error = new HashMap<>();
        error.put("error", "VALIDATION_ERROR");

        Map<String, String> fieldErrors = new HashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(fieldError -> {
            String message = fieldError.isBindingFailure()
                ? "Invalid value for " + fieldError.getField()
                : fieldError.getDefaultMessage();
            fieldErrors.putIfAbsent(fieldError.getField(), message);
        });
        error.put("fieldErrors", fieldErrors);
        error.put("message", "Invalid query parameters");

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(HttpMessageNotReadableException ex) {
        logger.debug("Unreadable request body", ex);

        Map<String, Object> error = new HashMap<>();
        error.put("error", "INVALID_JSON");
        error.put("message", "Request body is not valid JSON");

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(AoiRequestParser.InvalidGeoJsonException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidGeoJson(AoiRequestParser.InvalidGeoJsonException ex) {
        logger.warn("Rejected AOI geometry: {}", ex.getDetails());

        Map<String, Object> error = new HashMap<>();
        error.put("error", "INVALID_GEOJSON");
        error.put("message", ex.getMessage());
        error.put("details", ex.getDetails());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(GeometryNormalizer.OutOfBoundsException.class)
    public ResponseEntity<Map<String, Object>> handleOutOfBounds(GeometryNormalizer.OutOfBoundsException ex) {
        logger.warn("Rejected AOI geometry: {}", ex.getMessage());

        Map<String, Object> error = new HashMap<>();
        error.put("error", "COORDINATES_OUT_OF_BOUNDS");
        error.put("message", ex.getMessage());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(BoundingBox.InvalidBoundingBoxException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidBoundingBox(BoundingBox.InvalidBoundingBoxException ex) {
        logger.debug("Invalid bbox", ex);

        Map<String, Object> error = new HashMap<>();
        error.put("error", "INVALID_BBOX");
        error.put("message", ex.getMessage());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgumentException(IllegalArgumentException ex) {
        logger.debug("Illegal argument error", ex);

        Map<String, Object> error = new HashMap<>();
        error.put("error", "INVALID_INPUT");
        error.put("message", ex.getMessage());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(WmsClient.WmsException.class)
    public ResponseEntity<Map<String, Object>> handleWmsException(WmsClient.WmsException ex) {
        logger.error("WMS error", ex);

        Map<String, Object> error = new HashMap<>();
        error.put("error", "WMS_ERROR");
        error.put("message", "Failed to fetch feature information: " + ex.getMessage());

        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        logger.error("Unexpected error", ex);

        Map<String, Object> error = new HashMap<>();
        error.put("error", "INTERNAL_ERROR");
        error.put("message", "An unexpected error occurred");

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }
}
