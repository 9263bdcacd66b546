package com.geoviewer.aoi.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class HealthResponseDto {

    @JsonProperty("ok")
    private boolean ok;

    @JsonProperty("timestamp")
    private Instant timestamp;

    @JsonProperty("uptimeSeconds")
    private long uptimeSeconds;

    @JsonProperty("environment")
    private String environment;
}
