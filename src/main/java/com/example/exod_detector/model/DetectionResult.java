package com.example.exod_detector.model;

import java.util.List;

/**
 * Everything a run produces before it is written to disk.
 *
 * @param image         sky-aligned variability image.
 * @param sources       detected sources ordered by id.
 * @param effectiveMedian global median after the floor clamp.
 * @param runParameters values embedded in the output raster header.
 */
public record DetectionResult(Raster image, List<Source> sources, double effectiveMedian, RunParameters runParameters) {

    public DetectionResult {
        sources = List.copyOf(sources);
    }
}
