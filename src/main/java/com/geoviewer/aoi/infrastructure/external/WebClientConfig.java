package com.geoviewer.aoi.infrastructure.external;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.unit.DataSize;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * WebClient configuration.
 *
 * GetFeatureInfo responses can carry full feature geometries, so the in-memory
 * buffer limit is raised above the 256KB codec default.
 */
@Configuration
public class WebClientConfig {

    @Bean
    public WebClient.Builder webClientBuilder(
        @Value("${app.wms.max-response-size:4MB}") DataSize maxResponseSize
    ) {
        return WebClient.builder()
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize((int) maxResponseSize.toBytes()));
    }
}
