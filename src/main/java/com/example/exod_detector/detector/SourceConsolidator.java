package com.example.exod_detector.detector;

import com.example.exod_detector.model.CandidateRegion;
import com.example.exod_detector.model.Source;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Numbers the regions of all tiles and derives the source fields.
 * <p>
 * CCDs are physically disjoint, so regions are never merged across tiles.
 */
@Component
public class SourceConsolidator {
    private static final Logger LOGGER = LoggerFactory.getLogger(SourceConsolidator.class);

    /** Sky pixels per raw pixel. */
    public static final double SKY_PIXELS_PER_RAW_PIXEL = 64.0;
    /** Arcseconds per sky pixel. */
    public static final double ARCSEC_PER_SKY_PIXEL = 0.05;
    /** Offset applied to raw coordinates for the variability-frame position. */
    public static final double VARIABILITY_FRAME_OFFSET = 3.0;

    /**
     * @param regionsPerTile regions of each tile, indexed by tile id.
     * @return sources with ids starting at 1, in tile, raw Y, raw X order.
     */
    public List<Source> consolidate(List<List<CandidateRegion>> regionsPerTile) {
        List<CandidateRegion> all = new ArrayList<>();
        regionsPerTile.forEach(all::addAll);
        all.sort(RegionDetector.DETECTION_ORDER);

        List<Source> sources = new ArrayList<>(all.size());
        int id = 1;
        for (CandidateRegion region : all) {
            sources.add(toSource(id++, region));
        }
        LOGGER.debug("CONSOLIDATE tiles={} sources={}", regionsPerTile.size(), sources.size());
        return sources;
    }

    static Source toSource(int id, CandidateRegion region) {
        double radiusRaw = Math.max(0.0, region.pixelRadius());
        double radiusSky = radiusRaw * SKY_PIXELS_PER_RAW_PIXEL;
        return new Source(id,
                region.tileId(),
                region.centroidRawX(),
                region.centroidRawY(),
                radiusRaw,
                radiusSky,
                radiusSky * ARCSEC_PER_SKY_PIXEL,
                region.centroidRawX() + VARIABILITY_FRAME_OFFSET,
                region.centroidRawY() + VARIABILITY_FRAME_OFFSET,
                region.peakCount(),
                null, null, null, null);
    }
}
