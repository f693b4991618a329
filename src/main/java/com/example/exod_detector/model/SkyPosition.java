package com.example.exod_detector.model;

/**
 * Output of the astrometry collaborator for one source.
 *
 * @param x   sky pixel X.
 * @param y   sky pixel Y.
 * @param ra  right ascension in degrees.
 * @param dec declination in degrees.
 */
public record SkyPosition(double x, double y, double ra, double dec) {
}
