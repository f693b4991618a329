package com.example.exod_detector.detector;

import com.example.exod_detector.exception.InvalidConfigurationException;
import com.example.exod_detector.util.Instrument;

/**
 * Validated core parameters of one detection run.
 *
 * @param boxSize             side of the detection box in pixels.
 * @param boxStride           step between box origins; equal to {@code boxSize} for a non-overlapping tiling.
 * @param detectionLevel      multiple of the median variability a box must exceed, per pixel.
 * @param timeWindow          width of the time windows in seconds.
 * @param goodTimeRatio       minimum valid fraction of a window, in {@code [0, 1]}.
 * @param maxThreads          upper bound on concurrent per-tile tasks.
 * @param neighbourhoodRadius radius of the spatial box summed before the variability statistic.
 * @param instrument          camera family.
 */
public record DetectionParameters(int boxSize,
                                  int boxStride,
                                  double detectionLevel,
                                  double timeWindow,
                                  double goodTimeRatio,
                                  int maxThreads,
                                  int neighbourhoodRadius,
                                  Instrument instrument) {

    public static final int DEFAULT_BOX_SIZE = 3;
    public static final double DEFAULT_DETECTION_LEVEL = 10.0;
    public static final double DEFAULT_TIME_WINDOW = 100.0;
    public static final double DEFAULT_GOOD_TIME_RATIO = 1.0;
    public static final int DEFAULT_MAX_THREADS = 8;
    public static final int DEFAULT_NEIGHBOURHOOD_RADIUS = 1;

    public DetectionParameters {
        if (boxSize < 1) {
            throw InvalidConfigurationException.invalidParameter("box-size", boxSize, "an integer >= 1");
        }
        if (boxStride < 1) {
            throw InvalidConfigurationException.invalidParameter("box-stride", boxStride, "an integer >= 1");
        }
        if (!(detectionLevel > 0) || Double.isInfinite(detectionLevel)) {
            throw InvalidConfigurationException.invalidParameter("detection-level", detectionLevel, "a finite value > 0");
        }
        if (!(timeWindow > 0) || Double.isInfinite(timeWindow)) {
            throw InvalidConfigurationException.invalidParameter("time-window", timeWindow, "a finite value > 0");
        }
        if (!(goodTimeRatio >= 0.0 && goodTimeRatio <= 1.0)) {
            throw InvalidConfigurationException.invalidParameter("good-time-ratio", goodTimeRatio, "a value in [0, 1]");
        }
        if (maxThreads < 1) {
            throw InvalidConfigurationException.invalidParameter("max-threads", maxThreads, "an integer >= 1");
        }
        if (neighbourhoodRadius < 0) {
            throw InvalidConfigurationException.invalidParameter("neighbourhood-radius", neighbourhoodRadius, "an integer >= 0");
        }
        if (instrument == null) {
            throw InvalidConfigurationException.invalidParameter("instrument", null, "PN, M1 or M2");
        }
    }

    /**
     * Defaults of the command-line tool for the given camera.
     */
    public static DetectionParameters defaults(Instrument instrument) {
        return new DetectionParameters(DEFAULT_BOX_SIZE, DEFAULT_BOX_SIZE, DEFAULT_DETECTION_LEVEL, DEFAULT_TIME_WINDOW,
                DEFAULT_GOOD_TIME_RATIO, DEFAULT_MAX_THREADS, DEFAULT_NEIGHBOURHOOD_RADIUS, instrument);
    }

    /** Threshold a box sum must exceed. */
    public double boxThreshold(double median) {
        return detectionLevel * median * boxSize * boxSize;
    }
}
