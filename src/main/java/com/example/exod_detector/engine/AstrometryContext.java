package com.example.exod_detector.engine;

/**
 * Calibration context shared by every astrometry call of a run.
 *
 * @param observationId    observation identifier.
 * @param observationDir   folder holding the observation data files.
 * @param calibrationImage image file whose calibration the conversion uses, may be {@code null}.
 * @param sourceId         id of the source being converted, for tracing.
 */
public record AstrometryContext(String observationId, String observationDir, String calibrationImage, int sourceId) {

    public AstrometryContext forSource(int id) {
        return new AstrometryContext(observationId, observationDir, calibrationImage, id);
    }
}
