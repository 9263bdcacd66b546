package com.geoviewer.aoi.api.controller;

import com.geoviewer.aoi.api.dto.HealthResponseDto;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Liveness endpoint polled by the map client.
 */
@RestController
public class HealthController {

    private final Clock clock;
    private final Instant startedAt;
    private final String environment;

    public HealthController(Clock clock, @Value("${app.environment:development}") String environment) {
        this.clock = clock;
        this.startedAt = clock.instant();
        this.environment = environment;
    }

    @GetMapping("/health")
    public HealthResponseDto health() {
        Instant now = clock.instant();
        return new HealthResponseDto(true, now, Duration.between(startedAt, now).toSeconds(), environment);
    }
}
