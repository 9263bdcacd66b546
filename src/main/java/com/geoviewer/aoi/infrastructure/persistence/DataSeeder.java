package com.geoviewer.aoi.infrastructure.persistence;

import com.geoviewer.aoi.application.port.out.AoiRepository;
import com.geoviewer.aoi.domain.model.Aoi;
import com.geoviewer.aoi.domain.model.PointGeometry;
import com.geoviewer.aoi.domain.model.PolygonGeometry;
import com.geoviewer.aoi.domain.model.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Seeds the public sample AOIs shown to every user.
 * Runs when app.seeding.enabled=true and no public AOI exists yet.
 */
@Configuration
public class DataSeeder {

    private static final Logger logger = LoggerFactory.getLogger(DataSeeder.class);

    @Bean
    @ConditionalOnProperty(name = "app.seeding.enabled", havingValue = "true", matchIfMissing = false)
    public CommandLineRunner seedPublicAois(AoiRepository aoiRepository) {
        return args -> {
            try {
                long existing = aoiRepository.countByUserId(Aoi.PUBLIC_USER_ID);
                if (existing > 0) {
                    logger.info("Public sample AOIs already exist ({}), skipping...", existing);
                    return;
                }

                logger.info("Seeding public sample AOIs...");

                PolygonGeometry downtown = new PolygonGeometry(List.of(List.of(
                    new Position(91.2805, 23.8352),
                    new Position(91.288, 23.8352),
                    new Position(91.288, 23.8408),
                    new Position(91.2805, 23.8408),
                    new Position(91.2805, 23.8352)
                )));
                aoiRepository.save(new Aoi(Aoi.PUBLIC_USER_ID, "Sample AOI - Downtown",
                    "Demo polygon near city center", downtown));

                aoiRepository.save(new Aoi(Aoi.PUBLIC_USER_ID, "Sample AOI - Park Marker",
                    "Demo point for a park", new PointGeometry(new Position(91.295, 23.84))));

                logger.info("Seeded public sample AOIs");
            } catch (RuntimeException e) {
                // Startup continues without samples when the store is unavailable
                logger.warn("Sample AOI seeding skipped: {}", e.getMessage());
            }
        };
    }
}
