package com.example.exod_detector.mosaic;

import com.example.exod_detector.model.Raster;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * EPIC-pn arrangement: two columns of six 64 x 200 CCDs, giving a 384 x 400 raster.
 */
public final class PnMosaicLayout implements MosaicLayout {

    public static final PnMosaicLayout INSTANCE = new PnMosaicLayout();

    // tiles stacked top to bottom in each half
    private static final int[] LEFT = {8, 7, 6, 9, 10, 11};
    private static final int[] RIGHT = {5, 4, 3, 0, 1, 2};

    private PnMosaicLayout() {
    }

    @Override
    public Raster assemble(List<Raster> tiles) {
        if (tiles.size() != LEFT.length + RIGHT.length) {
            throw new IllegalArgumentException("EPIC-pn expects 12 CCDs, got " + tiles.size());
        }
        List<Raster> left = new ArrayList<>();
        for (int ccd : LEFT) {
            left.add(tiles.get(ccd).flipRows());
        }
        List<Raster> right = new ArrayList<>();
        for (int ccd : RIGHT) {
            right.add(tiles.get(ccd).flipCols());
        }
        return Raster.stackCols(List.of(Raster.stackRows(left), Raster.stackRows(right)));
    }

    @Override
    public List<Raster> disassemble(Raster mosaic) {
        int halfCols = mosaic.cols() / 2;
        int ccdRows = mosaic.rows() / LEFT.length;
        Raster[] tiles = new Raster[LEFT.length + RIGHT.length];
        for (int k = 0; k < LEFT.length; k++) {
            tiles[LEFT[k]] = mosaic.crop(k * ccdRows, (k + 1) * ccdRows, 0, halfCols).flipRows();
            tiles[RIGHT[k]] = mosaic.crop(k * ccdRows, (k + 1) * ccdRows, halfCols, mosaic.cols()).flipCols();
        }
        return Arrays.asList(tiles);
    }

    @Override
    public Raster applySubmode(Raster mosaic, String submode) {
        if ("PrimeLargeWindow".equals(submode)) {
            return mosaic.crop(0, mosaic.rows(), 100, 300);
        }
        if ("PrimeSmallWindow".equals(submode)) {
            return mosaic.crop(128, 192, 200, 264);
        }
        return mosaic;
    }
}
