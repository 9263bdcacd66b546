package com.geoviewer.aoi.infrastructure.persistence;

import com.geoviewer.aoi.application.port.out.AoiRepository;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Configuration for wiring JPA repositories to application ports.
 * This adapter layer bridges infrastructure (JPA) with application ports.
 */
@Configuration
public class PersistenceAdapterConfig {

    /**
     * Wire JPA repository to AoiRepository port.
     */
    @Bean
    @Primary
    public AoiRepository aoiRepository(AoiJpaRepository jpaRepository) {
        return jpaRepository;
    }
}
