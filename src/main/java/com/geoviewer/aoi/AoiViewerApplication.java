package com.geoviewer.aoi;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class AoiViewerApplication {

    public static void main(String[] args) {
        SpringApplication.run(AoiViewerApplication.class, args);
    }
}
