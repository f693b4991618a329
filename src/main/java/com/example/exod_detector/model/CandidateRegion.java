package com.example.exod_detector.model;

/**
 * Group of connected variable boxes on one tile, before numbering.
 *
 * @param tileId       tile the region was found on.
 * @param centroidRawX variability-weighted centroid along raw X.
 * @param centroidRawY variability-weighted centroid along raw Y.
 * @param pixelRadius  radius of the disc with the same area as the region pixels above the detection level.
 * @param peakCount    summed variability of those pixels.
 */
public record CandidateRegion(int tileId,
                              double centroidRawX,
                              double centroidRawY,
                              double pixelRadius,
                              double peakCount) {
}
