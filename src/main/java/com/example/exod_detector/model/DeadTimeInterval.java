package com.example.exod_detector.model;

/**
 * Span during which a tile recorded no valid events.
 *
 * @param start start time in seconds (inclusive).
 * @param end   end time in seconds (exclusive).
 */
public record DeadTimeInterval(double start, double end) {

    public DeadTimeInterval {
        if (end < start) {
            throw new IllegalArgumentException("Dead-time interval ends before it starts: [" + start + ", " + end + "]");
        }
    }

    public double duration() {
        return end - start;
    }
}
