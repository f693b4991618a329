package com.example.exod_detector.detector;

import com.example.exod_detector.model.DeadTimeInterval;
import com.example.exod_detector.model.TimeWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Tiles the observation span into fixed-width windows and keeps those with enough good time.
 */
@Component
public class TimeWindowFilter {
    private static final Logger LOGGER = LoggerFactory.getLogger(TimeWindowFilter.class);

    /**
     * Every window tiling {@code [t0, tf]}, accepted or not, with its valid-duration ratio.
     * The last window is cut at {@code tf}; when {@code t0 == tf} a single empty window is returned.
     */
    public List<TimeWindow> windows(double t0, double tf, double width, List<DeadTimeInterval> deadTimes) {
        if (!(width > 0)) {
            throw new IllegalArgumentException("Window width must be positive: " + width);
        }
        if (tf < t0) {
            throw new IllegalArgumentException("Observation ends before it starts: t0=" + t0 + " tf=" + tf);
        }
        List<DeadTimeInterval> merged = merge(deadTimes);
        List<TimeWindow> out = new ArrayList<>();
        int count = Math.max(1, (int) Math.ceil((tf - t0) / width));
        for (int k = 0; k < count; k++) {
            double start = t0 + k * width;
            double end = Math.min(start + width, tf);
            double duration = Math.max(0.0, end - start);
            out.add(new TimeWindow(k, start, duration, validRatio(start, end, merged)));
        }
        return out;
    }

    /**
     * Accepted windows of one tile, ordered by start time.
     *
     * @param t0            first event time of the observation.
     * @param tf            last event time of the observation.
     * @param width         configured window width in seconds.
     * @param deadTimes     dead-time intervals of the tile, in any order, possibly overlapping.
     * @param goodTimeRatio inclusive acceptance threshold.
     * @return accepted windows.
     */
    public List<TimeWindow> acceptedWindows(double t0, double tf, double width, List<DeadTimeInterval> deadTimes, double goodTimeRatio) {
        List<TimeWindow> all = windows(t0, tf, width, deadTimes);
        List<TimeWindow> accepted = new ArrayList<>(all.size());
        for (TimeWindow window : all) {
            if (isAccepted(window, goodTimeRatio)) {
                accepted.add(window);
            }
        }
        LOGGER.debug("TIME WINDOWS total={} accepted={} gtr={} deadIntervals={}", all.size(), accepted.size(), goodTimeRatio, deadTimes.size());
        return accepted;
    }

    /** A window counts iff it has a positive duration and its valid ratio reaches the threshold. */
    public static boolean isAccepted(TimeWindow window, double goodTimeRatio) {
        return window.duration() > 0.0 && window.validDurationRatio() >= goodTimeRatio;
    }

    static double validRatio(double start, double end, List<DeadTimeInterval> merged) {
        double duration = end - start;
        if (duration <= 0.0) {
            return 0.0;
        }
        double dead = 0.0;
        for (DeadTimeInterval interval : merged) {
            if (interval.start() >= end) {
                break;
            }
            double overlap = Math.min(end, interval.end()) - Math.max(start, interval.start());
            if (overlap > 0) {
                dead += overlap;
            }
        }
        return Math.max(0.0, Math.min(1.0, (duration - dead) / duration));
    }

    /** Sorted, non-overlapping union of the given intervals. */
    static List<DeadTimeInterval> merge(List<DeadTimeInterval> intervals) {
        List<DeadTimeInterval> sorted = new ArrayList<>(intervals);
        sorted.sort(Comparator.comparingDouble(DeadTimeInterval::start));
        List<DeadTimeInterval> merged = new ArrayList<>();
        for (DeadTimeInterval interval : sorted) {
            if (!merged.isEmpty() && interval.start() <= merged.get(merged.size() - 1).end()) {
                DeadTimeInterval last = merged.remove(merged.size() - 1);
                merged.add(new DeadTimeInterval(last.start(), Math.max(last.end(), interval.end())));
            } else {
                merged.add(interval);
            }
        }
        return merged;
    }
}
