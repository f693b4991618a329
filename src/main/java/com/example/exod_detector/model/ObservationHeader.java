package com.example.exod_detector.model;

import java.util.Map;

/**
 * Header values of the event list consumed by the pipeline.
 *
 * @param observationId  {@code OBS_ID}.
 * @param pointingAngle  {@code PA_PNT} in degrees.
 * @param submode        acquisition submode, e.g. {@code PrimeFullWindow}.
 * @param limits         projected and legal sky pixel limits.
 * @param raw            every header card as read, for provenance.
 */
public record ObservationHeader(String observationId,
                                double pointingAngle,
                                String submode,
                                CalibrationLimits limits,
                                Map<String, String> raw) {

    public ObservationHeader {
        raw = raw == null ? Map.of() : Map.copyOf(raw);
    }

    /**
     * {@code TDMIN/TDMAX} (projected) and {@code TLMIN/TLMAX} (legal) limits of the sky X (6) and Y (7) columns.
     */
    public record CalibrationLimits(double projectedMinX, double projectedMaxX,
                                    double projectedMinY, double projectedMaxY,
                                    double legalMinX, double legalMaxX,
                                    double legalMinY, double legalMaxY) {

        public CalibrationLimits {
            if (legalMaxX <= legalMinX || legalMaxY <= legalMinY) {
                throw new IllegalArgumentException("Legal limits must span a positive range");
            }
        }
    }
}
