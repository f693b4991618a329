package com.example.exod_detector.service;

import com.example.exod_detector.exception.OutputWriteException;
import com.example.exod_detector.model.DetectionResult;
import com.example.exod_detector.model.Raster;
import com.example.exod_detector.model.Source;
import ij.ImagePlus;
import ij.io.FileSaver;
import ij.process.FloatProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.BufferedWriter;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * Writes the products of a finished run into the output folder.
 */
@Service
public class DetectionOutputWriter {
    private static final Logger LOGGER = LoggerFactory.getLogger(DetectionOutputWriter.class);

    public static final String VARIABILITY_FILE = "variability.bin";
    public static final String REGION_FILE = "regions.txt";
    public static final String BEST_MATCH_FILE = "best_match.txt";
    public static final String IMAGE_FILE = "variability.tif";

    static final String REGION_HEADER = "# id;ccd;rawx;rawy;radius;count";
    static final String BEST_MATCH_HEADER = "# id;name;type;ra;dec;separation";

    public void write(Path outputDir, DetectionResult result) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new OutputWriteException(outputDir, e);
        }
        writeVariability(outputDir.resolve(VARIABILITY_FILE), result.image());
        writeRegions(outputDir.resolve(REGION_FILE), result);
        writeBestMatchPlaceholder(outputDir.resolve(BEST_MATCH_FILE));
        writeImage(outputDir.resolve(IMAGE_FILE), result);
        LOGGER.info("Outputs written to {} ({} sources)", outputDir, result.sources().size());
    }

    /** Big-endian {@code rows}, {@code cols}, then row-major values. */
    void writeVariability(Path target, Raster image) {
        try (var out = new DataOutputStream(new BufferedOutputStream(Files.newOutputStream(target)))) {
            out.writeInt(image.rows());
            out.writeInt(image.cols());
            for (int r = 0; r < image.rows(); r++) {
                for (int c = 0; c < image.cols(); c++) {
                    out.writeDouble(image.get(r, c));
                }
            }
        } catch (IOException e) {
            throw new OutputWriteException(target, e);
        }
    }

    /**
     * Reads a file written by {@link #writeVariability(Path, Raster)}.
     */
    public static Raster readVariability(Path file) throws IOException {
        try (var in = new DataInputStream(new BufferedInputStream(Files.newInputStream(file)))) {
            int rows = in.readInt();
            int cols = in.readInt();
            if (rows < 0 || cols < 0) {
                throw new IOException("Corrupt variability file " + file + ": shape " + rows + "x" + cols);
            }
            double[][] values = new double[rows][cols];
            for (int r = 0; r < rows; r++) {
                for (int c = 0; c < cols; c++) {
                    values[r][c] = in.readDouble();
                }
            }
            return Raster.wrap(values);
        }
    }

    void writeRegions(Path target, DetectionResult result) {
        try (BufferedWriter w = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            w.write(REGION_HEADER);
            w.newLine();
            for (Source s : result.sources()) {
                w.write(regionLine(s));
                w.newLine();
            }
        } catch (IOException e) {
            throw new OutputWriteException(target, e);
        }
    }

    static String regionLine(Source s) {
        return String.format(Locale.ROOT, "%d;%d;%.2f;%.2f;%.2f;%.2f",
                s.id(), s.tileId(), s.rawX(), s.rawY(), s.radiusRaw(), s.photonCount());
    }

    void writeBestMatchPlaceholder(Path target) {
        try {
            Files.writeString(target, BEST_MATCH_HEADER + System.lineSeparator(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new OutputWriteException(target, e);
        }
    }

    /**
     * 32-bit TIFF of the transformed image; run parameters and the full source table (raw, sky and
     * variability-frame positions, radii, counts) go into the ImageJ Info property.
     */
    void writeImage(Path target, DetectionResult result) {
        Raster image = result.image();
        float[] pixels = new float[image.rows() * image.cols()];
        int k = 0;
        for (int r = 0; r < image.rows(); r++) {
            for (int c = 0; c < image.cols(); c++) {
                pixels[k++] = (float) image.get(r, c);
            }
        }
        ImagePlus imp = new ImagePlus("variability", new FloatProcessor(image.cols(), image.rows(), pixels));
        imp.setProperty("Info", info(result));
        if (!new FileSaver(imp).saveAsTiff(target.toString())) {
            throw new OutputWriteException(target, new IOException("ImageJ could not save " + target));
        }
    }

    static String info(DetectionResult result) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> card : result.runParameters().asHeaderCards().entrySet()) {
            sb.append(String.format(Locale.ROOT, "%-8s= %s%n", card.getKey(), card.getValue()));
        }
        sb.append(String.format(Locale.ROOT, "%-8s= %s%n", "MEDIAN", result.effectiveMedian()));
        sb.append(String.format(Locale.ROOT, "%-8s= %d%n", "NSRC", result.sources().size()));
        for (Source s : result.sources()) {
            sb.append(String.format(Locale.ROOT,
                    "SRC%-5d= ccd=%d rawx=%.2f rawy=%.2f r=%.2f rsky=%.2f rarcsec=%.2f varx=%.2f vary=%.2f count=%.2f x=%s y=%s ra=%s dec=%s%n",
                    s.id(), s.tileId(), s.rawX(), s.rawY(), s.radiusRaw(), s.radiusSky(), s.radiusArcsec(),
                    s.varRawX(), s.varRawY(), s.photonCount(), s.x(), s.y(), s.ra(), s.dec()));
        }
        return sb.toString();
    }
}
