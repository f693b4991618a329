package com.example.exod_detector.mosaic;

import com.example.exod_detector.model.Raster;

import java.util.List;

/**
 * Fixed geometric recipe placing the CCDs of one camera into a single raster.
 */
public interface MosaicLayout {

    /**
     * Builds the full-frame mosaic.
     *
     * @param tiles one raster per CCD, indexed by tile id.
     * @return assembled raster.
     */
    Raster assemble(List<Raster> tiles);

    /**
     * Inverse of {@link #assemble(List)}: slices a full-frame mosaic back into per-CCD rasters.
     */
    List<Raster> disassemble(Raster mosaic);

    /**
     * Narrows a full-frame mosaic to the area read out in the given acquisition submode.
     * The default keeps the whole frame.
     */
    default Raster applySubmode(Raster mosaic, String submode) {
        return mosaic;
    }
}
