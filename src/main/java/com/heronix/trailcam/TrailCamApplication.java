package com.heronix.trailcam;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

import com.heronix.trailcam.config.TrailCamProperties;

/**
 * Heronix TrailCam - Session and Synchronization Coordinator
 *
 * Keeps a logged-in session with the camera vendor's cloud, polls every
 * registered trail camera on a fixed interval and publishes the merged result
 * as camera entities for a home automation platform.
 */
@SpringBootApplication
@EnableConfigurationProperties(TrailCamProperties.class)
@EnableScheduling
public class TrailCamApplication {

    public static void main(String[] args) {
        SpringApplication.run(TrailCamApplication.class, args);
    }
}
