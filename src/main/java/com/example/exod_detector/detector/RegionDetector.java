package com.example.exod_detector.detector;

import com.example.exod_detector.model.CandidateRegion;
import com.example.exod_detector.model.Raster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;

/**
 * Flags boxes of one variability matrix whose summed value exceeds
 * {@code detectionLevel * median * boxSize^2} and merges touching flagged boxes into regions.
 * <p>
 * Box origins lie on a lattice with step {@code boxStride}; the default stride equals the box
 * size, a non-overlapping tiling. Boxes on the last row or column are clipped to the matrix but
 * keep the full-box threshold. Two flagged boxes belong to the same region when their extents
 * overlap or share an edge or a corner.
 * <p>
 * Box footprints only decide which boxes merge. Area and count of a region come from the pixels
 * of the merged footprint above {@code detectionLevel * median}, so a burst gives the same radius
 * wherever it sits relative to the box lattice.
 */
@Component
public class RegionDetector {
    private static final Logger LOGGER = LoggerFactory.getLogger(RegionDetector.class);

    public static final Comparator<CandidateRegion> DETECTION_ORDER = Comparator
            .comparingInt(CandidateRegion::tileId)
            .thenComparingDouble(CandidateRegion::centroidRawY)
            .thenComparingDouble(CandidateRegion::centroidRawX);

    /**
     * @param tileId tile the matrix belongs to.
     * @param matrix variability matrix of that tile.
     * @param median effective global median (already clamped).
     * @param params box size, stride and detection level.
     * @return regions in detection order.
     */
    public List<CandidateRegion> detect(int tileId, Raster matrix, double median, DetectionParameters params) {
        int box = params.boxSize();
        int stride = params.boxStride();
        double threshold = params.boxThreshold(median);
        double pixelLevel = params.detectionLevel() * median;
        int rows = matrix.rows();
        int cols = matrix.cols();
        if (rows == 0 || cols == 0) {
            return List.of();
        }
        double[][] integral = integral(matrix);

        int latticeRows = (rows + stride - 1) / stride;
        int latticeCols = (cols + stride - 1) / stride;
        boolean[][] flagged = new boolean[latticeRows][latticeCols];
        int flaggedCount = 0;
        for (int i = 0; i < latticeRows; i++) {
            for (int j = 0; j < latticeCols; j++) {
                int r0 = i * stride;
                int c0 = j * stride;
                double sum = boxSum(integral, r0, Math.min(r0 + box, rows), c0, Math.min(c0 + box, cols));
                if (sum > threshold) {
                    flagged[i][j] = true;
                    flaggedCount++;
                }
            }
        }
        if (flaggedCount == 0) {
            LOGGER.debug("REGIONS tile={} threshold={} flaggedBoxes=0", tileId, threshold);
            return List.of();
        }

        // boxes i and i' touch iff |i - i'| * stride <= box
        int reach = box / stride;
        boolean[][] visited = new boolean[latticeRows][latticeCols];
        List<CandidateRegion> regions = new ArrayList<>();
        for (int i = 0; i < latticeRows; i++) {
            for (int j = 0; j < latticeCols; j++) {
                if (!flagged[i][j] || visited[i][j]) {
                    continue;
                }
                List<int[]> component = component(flagged, visited, i, j, reach);
                regions.add(toRegion(tileId, matrix, component, box, stride, pixelLevel));
            }
        }
        regions.sort(DETECTION_ORDER);
        LOGGER.debug("REGIONS tile={} threshold={} flaggedBoxes={} regions={}", tileId, threshold, flaggedCount, regions.size());
        return regions;
    }

    private static List<int[]> component(boolean[][] flagged, boolean[][] visited, int si, int sj, int reach) {
        List<int[]> members = new ArrayList<>();
        Deque<int[]> queue = new ArrayDeque<>();
        visited[si][sj] = true;
        queue.add(new int[]{si, sj});
        while (!queue.isEmpty()) {
            int[] cell = queue.poll();
            members.add(cell);
            for (int di = -reach; di <= reach; di++) {
                for (int dj = -reach; dj <= reach; dj++) {
                    int ni = cell[0] + di;
                    int nj = cell[1] + dj;
                    if (ni < 0 || nj < 0 || ni >= flagged.length || nj >= flagged[0].length) {
                        continue;
                    }
                    if (flagged[ni][nj] && !visited[ni][nj]) {
                        visited[ni][nj] = true;
                        queue.add(new int[]{ni, nj});
                    }
                }
            }
        }
        return members;
    }

    private static CandidateRegion toRegion(int tileId, Raster matrix, List<int[]> boxes, int box, int stride, double pixelLevel) {
        int rows = matrix.rows();
        int cols = matrix.cols();
        int minR = rows, maxR = 0, minC = cols, maxC = 0;
        for (int[] b : boxes) {
            minR = Math.min(minR, b[0] * stride);
            maxR = Math.max(maxR, Math.min(b[0] * stride + box, rows));
            minC = Math.min(minC, b[1] * stride);
            maxC = Math.max(maxC, Math.min(b[1] * stride + box, cols));
        }
        boolean[][] covered = new boolean[maxR - minR][maxC - minC];
        for (int[] b : boxes) {
            int r0 = b[0] * stride;
            int c0 = b[1] * stride;
            for (int r = r0; r < Math.min(r0 + box, rows); r++) {
                for (int c = c0; c < Math.min(c0 + box, cols); c++) {
                    covered[r - minR][c - minC] = true;
                }
            }
        }
        int area = 0;
        double count = 0.0;
        double weight = 0.0;
        double sumX = 0.0;
        double sumY = 0.0;
        for (int r = minR; r < maxR; r++) {
            for (int c = minC; c < maxC; c++) {
                if (!covered[r - minR][c - minC]) {
                    continue;
                }
                double v = matrix.get(r, c);
                weight += v;
                sumX += v * r;
                sumY += v * c;
                if (v > pixelLevel) {
                    area++;
                    count += v;
                }
            }
        }
        // a flagged box averages above the pixel level, so at least one pixel is counted
        double radius = Math.sqrt(Math.max(area, 1) / Math.PI);
        return new CandidateRegion(tileId, sumX / weight, sumY / weight, radius, count);
    }

    /** Summed-area table with a zero first row and column. */
    private static double[][] integral(Raster matrix) {
        int rows = matrix.rows();
        int cols = matrix.cols();
        double[][] s = new double[rows + 1][cols + 1];
        for (int r = 0; r < rows; r++) {
            double rowSum = 0.0;
            for (int c = 0; c < cols; c++) {
                rowSum += matrix.get(r, c);
                s[r + 1][c + 1] = s[r][c + 1] + rowSum;
            }
        }
        return s;
    }

    private static double boxSum(double[][] s, int r0, int r1, int c0, int c1) {
        return s[r1][c1] - s[r0][c1] - s[r1][c0] + s[r0][c0];
    }
}
