package com.example.exod_detector.model;

/**
 * Single photon event as delivered by the photon extractor.
 *
 * @param time   arrival time in seconds (mission time).
 * @param rawX   zero-based raw X pixel on the tile.
 * @param rawY   zero-based raw Y pixel on the tile.
 * @param tileId zero-based CCD index.
 */
public record Event(double time, int rawX, int rawY, int tileId) {
}
