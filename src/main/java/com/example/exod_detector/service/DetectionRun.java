package com.example.exod_detector.service;

import java.nio.file.Path;

/**
 * Files and provenance of one run.
 *
 * @param eventsFile       cleaned event list.
 * @param deadTimeFile     dead-time intervals.
 * @param outputDir        folder receiving the products.
 * @param creator          user recorded in the output header.
 * @param observationId    observation identifier, or {@code null} to take {@code OBS_ID} from the header.
 * @param calibrationImage image handed to the astrometry tool, may be {@code null}.
 */
public record DetectionRun(Path eventsFile,
                           Path deadTimeFile,
                           Path outputDir,
                           String creator,
                           String observationId,
                           String calibrationImage) {
}
