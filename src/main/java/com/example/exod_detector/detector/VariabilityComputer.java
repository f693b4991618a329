package com.example.exod_detector.detector;

import com.example.exod_detector.model.Event;
import com.example.exod_detector.model.Raster;
import com.example.exod_detector.model.TimeWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Computes the variability matrix of one CCD.
 * <p>
 * For every pixel the events of each accepted window are counted, corrected for dead time
 * (divided by the window's valid ratio) and summed over a square neighbourhood. With
 * {@code Cmin}, {@code Cmed} and {@code Cmax} the minimum, median and maximum of those
 * per-window counts, the pixel value is {@code max(Cmax - Cmed, Cmed - Cmin) / Cmed}, or
 * {@code Cmax} when the median is zero. Uniform counts give 0; a single burst gives a large value.
 * <p>
 * Counts are kept sparse per pixel, so memory grows with the number of events rather than
 * with windows times pixels. Instances hold no state and may be shared between tile tasks.
 */
@Component
public class VariabilityComputer {
    private static final Logger LOGGER = LoggerFactory.getLogger(VariabilityComputer.class);

    public Raster compute(int tileId, List<Event> events, List<TimeWindow> acceptedWindows, double t0, DetectionParameters params) {
        return compute(tileId, events, acceptedWindows, t0, params.timeWindow(),
                params.instrument().tileRows(), params.instrument().tileCols(), params.neighbourhoodRadius());
    }

    /**
     * @param tileId          tile the events belong to, for logging.
     * @param events          events of that tile.
     * @param acceptedWindows accepted windows in start order.
     * @param t0              start of the observation span.
     * @param width           configured window width.
     * @param rows            raw X extent of the tile.
     * @param cols            raw Y extent of the tile.
     * @param radius          neighbourhood radius; 0 uses single pixels.
     * @return variability matrix of shape {@code rows x cols}.
     */
    public Raster compute(int tileId, List<Event> events, List<TimeWindow> acceptedWindows,
                          double t0, double width, int rows, int cols, int radius) {
        double[][] out = new double[rows][cols];
        int windowCount = acceptedWindows.size();
        if (windowCount == 0 || events.isEmpty()) {
            LOGGER.debug("VARIABILITY tile={} windows={} events={} -> empty matrix", tileId, windowCount, events.size());
            return Raster.wrap(out);
        }

        int[] positionByIndex = positionsByIndex(acceptedWindows);
        int pixels = rows * cols;

        // CSR layout: contributions of pixel p live in [offsets[p], offsets[p+1])
        int[] binned = new int[events.size()];
        double[] weights = new double[events.size()];
        int[] perPixel = new int[pixels + 1];
        int dropped = 0;
        int outside = 0;
        for (int e = 0; e < events.size(); e++) {
            Event evt = events.get(e);
            binned[e] = -1;
            if (evt.rawX() < 0 || evt.rawX() >= rows || evt.rawY() < 0 || evt.rawY() >= cols) {
                outside++;
                continue;
            }
            int pos = windowPosition(evt.time(), t0, width, positionByIndex, acceptedWindows);
            if (pos < 0) {
                dropped++;
                continue;
            }
            double ratio = acceptedWindows.get(pos).validDurationRatio();
            if (ratio <= 0) {
                dropped++;
                continue;
            }
            binned[e] = pos;
            weights[e] = 1.0 / ratio;
            forEachNeighbour(evt.rawX(), evt.rawY(), rows, cols, radius, p -> perPixel[p + 1]++);
        }
        for (int p = 0; p < pixels; p++) {
            perPixel[p + 1] += perPixel[p];
        }
        int[] offsets = perPixel;
        int[] cursor = Arrays.copyOf(offsets, pixels);
        int[] contribWindow = new int[offsets[pixels]];
        double[] contribWeight = new double[offsets[pixels]];
        for (int e = 0; e < events.size(); e++) {
            if (binned[e] < 0) {
                continue;
            }
            Event evt = events.get(e);
            int pos = binned[e];
            double w = weights[e];
            forEachNeighbour(evt.rawX(), evt.rawY(), rows, cols, radius, p -> {
                int slot = cursor[p]++;
                contribWindow[slot] = pos;
                contribWeight[slot] = w;
            });
        }

        double[] scratch = new double[windowCount];
        int[] touched = new int[windowCount];
        double[] values = new double[windowCount];
        for (int p = 0; p < pixels; p++) {
            int from = offsets[p];
            int to = offsets[p + 1];
            if (from == to) {
                continue;
            }
            int k = 0;
            for (int i = from; i < to; i++) {
                int wpos = contribWindow[i];
                if (scratch[wpos] == 0.0) {
                    touched[k++] = wpos;
                }
                scratch[wpos] += contribWeight[i];
            }
            for (int i = 0; i < k; i++) {
                values[i] = scratch[touched[i]];
                scratch[touched[i]] = 0.0;
            }
            out[p / cols][p % cols] = statistic(values, k, windowCount);
        }

        if (outside > 0 || dropped > 0) {
            LOGGER.debug("VARIABILITY tile={} ignored events outsideGrid={} outsideAcceptedWindows={}", tileId, outside, dropped);
        }
        LOGGER.debug("VARIABILITY tile={} events={} windows={} radius={}", tileId, events.size(), windowCount, radius);
        return Raster.wrap(out);
    }

    /**
     * Variability of one pixel whose {@code k} non-zero window counts are the first {@code k}
     * entries of {@code nonZero}; the other {@code total - k} windows counted nothing.
     * Reorders the first {@code k} entries of {@code nonZero}.
     */
    static double statistic(double[] nonZero, int k, int total) {
        if (k == 0) {
            return 0.0;
        }
        Arrays.sort(nonZero, 0, k);
        int zeros = total - k;
        double min = zeros > 0 ? 0.0 : nonZero[0];
        double max = nonZero[k - 1];
        double median;
        if (total % 2 == 1) {
            median = sortedAt(nonZero, zeros, total / 2);
        } else {
            median = 0.5 * (sortedAt(nonZero, zeros, total / 2 - 1) + sortedAt(nonZero, zeros, total / 2));
        }
        if (median <= 0.0) {
            return max;
        }
        return Math.max(max - median, median - min) / median;
    }

    private static double sortedAt(double[] nonZero, int zeros, int i) {
        return i < zeros ? 0.0 : nonZero[i - zeros];
    }

    private static int[] positionsByIndex(List<TimeWindow> accepted) {
        int maxIndex = accepted.get(accepted.size() - 1).index();
        int[] positions = new int[maxIndex + 1];
        Arrays.fill(positions, -1);
        for (int pos = 0; pos < accepted.size(); pos++) {
            positions[accepted.get(pos).index()] = pos;
        }
        return positions;
    }

    /** Position in the accepted list of the window holding {@code time}, or -1. */
    private static int windowPosition(double time, double t0, double width, int[] positionByIndex, List<TimeWindow> accepted) {
        if (time < t0) {
            return -1;
        }
        int index = (int) Math.floor((time - t0) / width);
        if (index < positionByIndex.length && positionByIndex[index] >= 0) {
            return positionByIndex[index];
        }
        // the last event sits exactly on the end of the final window
        int previous = index - 1;
        if (previous >= 0 && previous < positionByIndex.length && positionByIndex[previous] >= 0) {
            TimeWindow window = accepted.get(positionByIndex[previous]);
            if (time <= window.end()) {
                return positionByIndex[previous];
            }
        }
        return -1;
    }

    private static void forEachNeighbour(int x, int y, int rows, int cols, int radius, PixelConsumer consumer) {
        int x0 = Math.max(0, x - radius);
        int x1 = Math.min(rows - 1, x + radius);
        int y0 = Math.max(0, y - radius);
        int y1 = Math.min(cols - 1, y + radius);
        for (int i = x0; i <= x1; i++) {
            for (int j = y0; j <= y1; j++) {
                consumer.accept(i * cols + j);
            }
        }
    }

    @FunctionalInterface
    private interface PixelConsumer {
        void accept(int pixel);
    }
}
