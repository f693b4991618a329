package com.example.exod_detector.mosaic;

import com.example.exod_detector.model.Raster;

import java.util.List;

/**
 * EPIC-MOS arrangement: seven 600 x 600 CCDs in a cross, the four corners filled with zeros.
 * <p>
 * The cross is built as three 1800 x 600 strips side by side. MOS1 then turns it a quarter
 * counter-clockwise, MOS2 flips it on both axes.
 */
public final class MosMosaicLayout implements MosaicLayout {

    public static final MosMosaicLayout MOS1 = new MosMosaicLayout(true);
    public static final MosMosaicLayout MOS2 = new MosMosaicLayout(false);

    private final boolean quarterTurn;

    private MosMosaicLayout(boolean quarterTurn) {
        this.quarterTurn = quarterTurn;
    }

    @Override
    public Raster assemble(List<Raster> tiles) {
        if (tiles.size() != 7) {
            throw new IllegalArgumentException("EPIC-MOS expects 7 CCDs, got " + tiles.size());
        }
        int ccd = tiles.get(0).rows();
        for (Raster tile : tiles) {
            if (tile.rows() != ccd || tile.cols() != ccd) {
                throw new IllegalArgumentException("EPIC-MOS CCDs must be square and equal, got " + tile);
            }
        }
        Raster corner = Raster.zeros(ccd / 2, ccd);
        Raster left = Raster.stackRows(List.of(corner, tiles.get(1).transpose(), tiles.get(6).transpose().flip(), corner));
        Raster middle = Raster.stackRows(List.of(tiles.get(2).transpose(), tiles.get(0).flipRows(), tiles.get(5).transpose().flip()));
        Raster right = Raster.stackRows(List.of(corner, tiles.get(3).transpose(), tiles.get(4).transpose().flip(), corner));
        Raster cross = Raster.stackCols(List.of(left, middle, right));
        return quarterTurn ? cross.rotate90() : cross.flip();
    }

    @Override
    public List<Raster> disassemble(Raster mosaic) {
        Raster cross = quarterTurn ? mosaic.rotate270() : mosaic.flip();
        int ccd = cross.cols() / 3;
        int strip = ccd;
        int corner = ccd / 2;
        Raster left = cross.crop(0, cross.rows(), 0, strip);
        Raster middle = cross.crop(0, cross.rows(), strip, 2 * strip);
        Raster right = cross.crop(0, cross.rows(), 2 * strip, 3 * strip);

        Raster t0 = middle.crop(ccd, 2 * ccd, 0, strip).flipRows();
        Raster t1 = left.crop(corner, corner + ccd, 0, strip).transpose();
        Raster t2 = middle.crop(0, ccd, 0, strip).transpose();
        Raster t3 = right.crop(corner, corner + ccd, 0, strip).transpose();
        Raster t4 = right.crop(corner + ccd, corner + 2 * ccd, 0, strip).flip().transpose();
        Raster t5 = middle.crop(2 * ccd, 3 * ccd, 0, strip).flip().transpose();
        Raster t6 = left.crop(corner + ccd, corner + 2 * ccd, 0, strip).flip().transpose();
        return List.of(t0, t1, t2, t3, t4, t5, t6);
    }
}
