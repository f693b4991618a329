package com.example.exod_detector.config;

import com.example.exod_detector.engine.Edet2SkyCoordinateResolver;
import com.example.exod_detector.engine.Interfaces.SkyCoordinateResolver;
import com.example.exod_detector.engine.NoopSkyCoordinateResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class EngineConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(EngineConfig.class);

    @Bean
    public SkyCoordinateResolver skyCoordinateResolver(DetectorProperties properties) {
        DetectorProperties.Astrometry astrometry = properties.getAstrometry();
        if (!astrometry.isEnabled()) {
            LOGGER.info("Astrometry disabled, sources keep raw coordinates only");
            return new NoopSkyCoordinateResolver();
        }
        return new Edet2SkyCoordinateResolver(astrometry.getCommand(), astrometry.getEnvironment(), astrometry.timeout());
    }

    /** Stamps the run date written into the image header. */
    @Bean
    public Clock runClock() {
        return Clock.systemUTC();
    }
}
