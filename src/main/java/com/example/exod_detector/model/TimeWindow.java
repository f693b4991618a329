package com.example.exod_detector.model;

/**
 * Fixed-width slice of the observation span.
 *
 * @param index                position of the window in the tiling of {@code [t0, tf]}.
 * @param start                window start in seconds.
 * @param duration             window length in seconds; shorter than the configured width for the last window.
 * @param validDurationRatio   fraction of the window not covered by dead time, in {@code [0, 1]}.
 */
public record TimeWindow(int index, double start, double duration, double validDurationRatio) {

    public double end() {
        return start + duration;
    }
}
