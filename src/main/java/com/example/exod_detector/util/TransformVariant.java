package com.example.exod_detector.util;

/**
 * Calibration variant of the geometric transform.
 */
public enum TransformVariant {
    /** Canvas grows to hold the rotated raster; resampled to the projected span (EPIC-pn). */
    EXPANDED_CANVAS,
    /** Canvas keeps its size during rotation; resampled to a fixed 500 pixel square (EPIC-MOS). */
    FIXED_CANVAS
}
