package com.example.exod_detector.detector;

import com.example.exod_detector.model.Raster;

import java.util.Arrays;
import java.util.List;

/**
 * Observation-wide statistics computed once before per-tile detection.
 */
public final class VariabilityStatistics {

    /** Lowest median used for thresholds; near-empty fields would otherwise trigger on noise. */
    public static final double MEDIAN_FLOOR = 0.75;

    private VariabilityStatistics() {
    }

    /**
     * Median of every pixel value of every tile.
     */
    public static double globalMedian(List<Raster> matrices) {
        int size = 0;
        for (Raster matrix : matrices) {
            size += matrix.rows() * matrix.cols();
        }
        if (size == 0) {
            return 0.0;
        }
        double[] all = new double[size];
        int pos = 0;
        for (Raster matrix : matrices) {
            pos = matrix.copyInto(all, pos);
        }
        Arrays.sort(all);
        int mid = size / 2;
        return size % 2 == 1 ? all[mid] : 0.5 * (all[mid - 1] + all[mid]);
    }

    public static double clampMedian(double median) {
        return Double.isNaN(median) || median < MEDIAN_FLOOR ? MEDIAN_FLOOR : median;
    }

    public static double effectiveMedian(List<Raster> matrices) {
        return clampMedian(globalMedian(matrices));
    }
}
