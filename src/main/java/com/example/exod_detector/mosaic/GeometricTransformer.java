package com.example.exod_detector.mosaic;

import com.example.exod_detector.model.ObservationHeader;
import com.example.exod_detector.model.Raster;
import com.example.exod_detector.util.TransformVariant;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns an assembled mosaic into the 648 x 648 sky-aligned canonical image.
 * <p>
 * Steps: rotate by the pointing angle, flip vertically, resample, zero-pad. Rotation and
 * resampling are bilinear, done by ImageJ on a 32-bit {@link FloatProcessor}.
 */
@Component
public class GeometricTransformer {
    private static final Logger LOGGER = LoggerFactory.getLogger(GeometricTransformer.class);

    /** Pixel span of the canonical output image. */
    public static final int CANONICAL_SIZE = 648;
    /** MOS images are resampled to this square before padding. */
    public static final int MOS_IMAGE_SIZE = 500;

    public Raster transform(Raster mosaic, ObservationHeader header, TransformVariant variant) {
        ObservationHeader.CalibrationLimits lim = header.limits();
        double sx = CANONICAL_SIZE / (lim.legalMaxX() - lim.legalMinX());
        double sy = CANONICAL_SIZE / (lim.legalMaxY() - lim.legalMinY());
        int[] interX = {(int) ((lim.projectedMinX() - lim.legalMinX()) * sx), (int) ((lim.legalMaxX() - lim.projectedMaxX()) * sx)};
        int[] interY = {(int) ((lim.projectedMinY() - lim.legalMinY()) * sy), (int) ((lim.legalMaxY() - lim.projectedMaxY()) * sy)};

        Raster result = switch (variant) {
            case EXPANDED_CANVAS -> {
                int pixX = CANONICAL_SIZE - (interX[0] + interX[1]);
                int pixY = CANONICAL_SIZE - (interY[0] + interY[1]);
                Raster rotated = rotate(mosaic, header.pointingAngle(), true).flipRows();
                yield resize(rotated, pixY, pixX).pad(interY[0], interY[1], interX[0], interX[1]);
            }
            case FIXED_CANVAS -> {
                int margin = CANONICAL_SIZE - MOS_IMAGE_SIZE;
                int numX = (margin - (interX[0] + interX[1])) / 2;
                int numY = (margin - (interY[0] + interY[1])) / 2;
                int padLeft = interX[0] + numX;
                int padTop = interY[0] + numY;
                Raster rotated = rotate(mosaic, header.pointingAngle(), false).flipRows();
                yield resize(rotated, MOS_IMAGE_SIZE, MOS_IMAGE_SIZE).pad(padTop, margin - padTop, padLeft, margin - padLeft);
            }
        };
        LOGGER.debug("TRANSFORM variant={} angle={} in={} out={} sx={} sy={}", variant, header.pointingAngle(), mosaic, result, sx, sy);
        return result;
    }

    /**
     * Rotates counter-clockwise by {@code angleDeg} about the raster centre. With {@code expand}
     * the canvas grows to the bounding box of the rotated raster, otherwise corners are clipped.
     */
    Raster rotate(Raster raster, double angleDeg, boolean expand) {
        FloatProcessor fp = toProcessor(raster);
        if (expand) {
            double rad = Math.toRadians(angleDeg);
            double cos = Math.abs(Math.cos(rad));
            double sin = Math.abs(Math.sin(rad));
            int width = (int) (raster.cols() * cos + raster.rows() * sin + 0.5);
            int height = (int) (raster.cols() * sin + raster.rows() * cos + 0.5);
            width = Math.max(width, 1);
            height = Math.max(height, 1);
            // the work canvas holds both the source and the rotated bounding box
            int canvasWidth = Math.max(width, raster.cols());
            int canvasHeight = Math.max(height, raster.rows());
            FloatProcessor canvas = new FloatProcessor(canvasWidth, canvasHeight);
            canvas.insert(fp, (canvasWidth - raster.cols()) / 2, (canvasHeight - raster.rows()) / 2);
            turn(canvas, angleDeg);
            canvas.setRoi((canvasWidth - width) / 2, (canvasHeight - height) / 2, width, height);
            return toRaster(canvas.crop());
        }
        turn(fp, angleDeg);
        return toRaster(fp);
    }

    private static void turn(FloatProcessor fp, double angleDeg) {
        fp.setInterpolationMethod(ImageProcessor.BILINEAR);
        fp.setBackgroundValue(0.0);
        // ImageJ turns clockwise for positive angles
        fp.rotate(-angleDeg);
    }

    Raster resize(Raster raster, int rows, int cols) {
        if (rows < 1 || cols < 1) {
            throw new IllegalArgumentException("Calibration limits leave no room for the image: " + rows + "x" + cols);
        }
        FloatProcessor fp = toProcessor(raster);
        fp.setInterpolationMethod(ImageProcessor.BILINEAR);
        return toRaster(fp.resize(cols, rows));
    }

    static FloatProcessor toProcessor(Raster raster) {
        float[] pixels = new float[raster.rows() * raster.cols()];
        int k = 0;
        for (int r = 0; r < raster.rows(); r++) {
            for (int c = 0; c < raster.cols(); c++) {
                pixels[k++] = (float) raster.get(r, c);
            }
        }
        return new FloatProcessor(raster.cols(), raster.rows(), pixels);
    }

    static Raster toRaster(ImageProcessor ip) {
        float[] pixels = (float[]) ip.getPixels();
        int width = ip.getWidth();
        double[][] out = new double[ip.getHeight()][width];
        for (int r = 0; r < out.length; r++) {
            for (int c = 0; c < width; c++) {
                float v = pixels[r * width + c];
                out[r][c] = Float.isNaN(v) || v < 0 ? 0.0 : v;
            }
        }
        return Raster.wrap(out);
    }
}
