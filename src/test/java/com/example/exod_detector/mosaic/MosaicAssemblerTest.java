package com.example.exod_detector.mosaic;

import com.example.exod_detector.model.Raster;
import com.example.exod_detector.util.Instrument;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MosaicAssemblerTest {

    private final MosaicAssembler assembler = new MosaicAssembler();

    @Test
    void pnMosaicHasTwoColumnsOfSixCcds() {
        List<Raster> tiles = labelledTiles(12, 64, 200);

        Raster mosaic = assembler.assemble(Instrument.PN, tiles, "PrimeFullWindow");

        assertThat(mosaic.rows()).isEqualTo(384);
        assertThat(mosaic.cols()).isEqualTo(400);
        // top-left block is CCD 8 flipped upside down, top-right is CCD 5 mirrored
        assertThat(mosaic.get(0, 0)).isEqualTo(tiles.get(8).get(63, 0));
        assertThat(mosaic.get(0, 200)).isEqualTo(tiles.get(5).get(0, 199));
        // fourth row of the right column is CCD 0
        assertThat(mosaic.get(192, 399)).isEqualTo(tiles.get(0).get(0, 0));
    }

    @Test
    void pnRoundTripRestoresEveryTile() {
        List<Raster> tiles = labelledTiles(12, 64, 200);

        Raster mosaic = assembler.assemble(Instrument.PN, tiles, null);

        assertThat(assembler.disassemble(Instrument.PN, mosaic)).containsExactlyElementsOf(tiles);
    }

    @Test
    void pnSubmodesNarrowTheReadoutArea() {
        List<Raster> tiles = labelledTiles(12, 64, 200);
        Raster full = assembler.assemble(Instrument.PN, tiles, null);

        Raster large = assembler.assemble(Instrument.PN, tiles, "PrimeLargeWindow");
        Raster small = assembler.assemble(Instrument.PN, tiles, "PrimeSmallWindow");

        assertThat(large.rows()).isEqualTo(384);
        assertThat(large.cols()).isEqualTo(200);
        assertThat(large.get(0, 0)).isEqualTo(full.get(0, 100));
        assertThat(small.rows()).isEqualTo(64);
        assertThat(small.cols()).isEqualTo(64);
        assertThat(small.get(0, 0)).isEqualTo(full.get(128, 200));
    }

    @Test
    void mosRoundTripRestoresEveryTileForBothCameras() {
        List<Raster> tiles = labelledTiles(7, 6, 6);

        for (Instrument mos : List.of(Instrument.M1, Instrument.M2)) {
            Raster mosaic = assembler.assemble(mos, tiles, null);

            assertThat(mosaic.rows()).isEqualTo(18);
            assertThat(mosaic.cols()).isEqualTo(18);
            assertThat(assembler.disassemble(mos, mosaic)).containsExactlyElementsOf(tiles);
        }
    }

    @Test
    void mosCornersAreEmpty() {
        List<Raster> tiles = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            tiles.add(constant(6, 6, 1.0));
        }

        Raster mosaic = assembler.assemble(Instrument.M2, tiles, null);

        assertThat(mosaic.sum()).isEqualTo(7 * 36.0);
        assertThat(mosaic.get(0, 0)).isZero();
        assertThat(mosaic.get(17, 17)).isZero();
        assertThat(mosaic.get(9, 9)).isEqualTo(1.0);
    }

    @Test
    void rejectsWrongTileCountOrShape() {
        assertThatThrownBy(() -> assembler.assemble(Instrument.PN, labelledTiles(7, 64, 200), null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("expects 12");

        List<Raster> mixed = new ArrayList<>(labelledTiles(7, 6, 6));
        mixed.set(3, Raster.zeros(5, 6));
        assertThatThrownBy(() -> assembler.assemble(Instrument.M1, mixed, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Tile 3");
    }

    /** Every pixel of every tile holds a distinct value. */
    private static List<Raster> labelledTiles(int count, int rows, int cols) {
        List<Raster> tiles = new ArrayList<>();
        for (int t = 0; t < count; t++) {
            double[][] m = new double[rows][cols];
            for (int r = 0; r < rows; r++) {
                for (int c = 0; c < cols; c++) {
                    m[r][c] = t * 1_000_000 + r * 1_000 + c;
                }
            }
            tiles.add(Raster.of(m));
        }
        return tiles;
    }

    private static Raster constant(int rows, int cols, double value) {
        double[][] m = new double[rows][cols];
        for (double[] row : m) {
            java.util.Arrays.fill(row, value);
        }
        return Raster.of(m);
    }
}
