package com.example.exod_detector.runner;

import com.example.exod_detector.config.DetectorProperties;
import com.example.exod_detector.detector.DetectionParameters;
import com.example.exod_detector.exception.InvalidConfigurationException;
import com.example.exod_detector.service.DetectionRun;
import com.example.exod_detector.service.VariabilityDetectionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Runs one detection on startup with the values bound from {@code detector.*}.
 * Exceptions escape so Spring Boot exits with their exit code.
 */
@Component
@ConditionalOnProperty(prefix = "detector.runner", name = "enabled", havingValue = "true", matchIfMissing = true)
public class DetectorCommandLineRunner implements CommandLineRunner {
    private static final Logger LOGGER = LoggerFactory.getLogger(DetectorCommandLineRunner.class);

    private final DetectorProperties properties;
    private final VariabilityDetectionService detectionService;

    public DetectorCommandLineRunner(DetectorProperties properties, VariabilityDetectionService detectionService) {
        this.properties = properties;
        this.detectionService = detectionService;
    }

    @Override
    public void run(String... args) {
        DetectionParameters params = properties.toParameters();
        DetectionRun run = toRun(properties);
        LOGGER.info("""

                        INSTRUMENT      = {}
                        DETECTION LEVEL = {}
                        TIME WINDOW     = {}
                        BOX SIZE        = {}
                        GOOD TIME RATIO = {}
                """, params.instrument(), params.detectionLevel(), params.timeWindow(), params.boxSize(), params.goodTimeRatio());
        LOGGER.info("Writing output to folder '{}'", run.outputDir());
        detectionService.run(run, params);
    }

    static DetectionRun toRun(DetectorProperties properties) {
        if (isBlank(properties.getEventsFile())) {
            throw InvalidConfigurationException.invalidParameter("events-file", properties.getEventsFile(), "a path to the event list");
        }
        if (isBlank(properties.getDeadTimeFile())) {
            throw InvalidConfigurationException.invalidParameter("dead-time-file", properties.getDeadTimeFile(), "a path to the dead-time file");
        }
        Path events = Path.of(properties.getEventsFile());
        return new DetectionRun(events, Path.of(properties.getDeadTimeFile()), properties.resolveOutputDir(), properties.getCreator(),
                isBlank(properties.getObservation()) ? null : properties.getObservation(),
                properties.getAstrometry().getCalibrationImage());
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
