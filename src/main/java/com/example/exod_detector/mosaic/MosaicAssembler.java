package com.example.exod_detector.mosaic;

import com.example.exod_detector.model.Raster;
import com.example.exod_detector.util.Instrument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Places per-CCD rasters into the camera-shaped mosaic of the selected instrument.
 */
@Component
public class MosaicAssembler {
    private static final Logger LOGGER = LoggerFactory.getLogger(MosaicAssembler.class);

    /**
     * Assembles the full frame and narrows it to the readout area of {@code submode}.
     *
     * @param instrument camera family, fixes the recipe.
     * @param tiles      per-CCD rasters indexed by tile id.
     * @param submode    acquisition submode from the event list header, may be {@code null}.
     * @return assembled raster.
     */
    public Raster assemble(Instrument instrument, List<Raster> tiles, String submode) {
        checkTiles(instrument, tiles);
        Raster full = instrument.layout().assemble(tiles);
        Raster narrowed = instrument.layout().applySubmode(full, submode);
        LOGGER.debug("MOSAIC inst={} submode={} full={} kept={}", instrument, submode, full, narrowed);
        return narrowed;
    }

    /**
     * Slices a full-frame mosaic back into per-CCD rasters.
     */
    public List<Raster> disassemble(Instrument instrument, Raster mosaic) {
        return instrument.layout().disassemble(mosaic);
    }

    private static void checkTiles(Instrument instrument, List<Raster> tiles) {
        if (tiles.size() != instrument.tileCount()) {
            throw new IllegalArgumentException(instrument + " expects " + instrument.tileCount() + " tiles, got " + tiles.size());
        }
        Raster first = tiles.get(0);
        for (int i = 1; i < tiles.size(); i++) {
            Raster tile = tiles.get(i);
            if (tile.rows() != first.rows() || tile.cols() != first.cols()) {
                throw new IllegalArgumentException("Tile " + i + " is " + tile + " but tile 0 is " + first);
            }
        }
    }
}
