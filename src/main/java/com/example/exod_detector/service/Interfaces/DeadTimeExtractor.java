package com.example.exod_detector.service.Interfaces;

import com.example.exod_detector.model.DeadTimeInterval;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads the per-CCD dead-time (deleted period) intervals of one observation.
 */
public interface DeadTimeExtractor {

    /**
     * @return one interval list per tile, indexed by tile id; tiles without dead time get an empty list.
     * @throws IOException when the file is unreadable or malformed.
     */
    List<List<DeadTimeInterval>> extract(Path deadTimeFile, int tileCount) throws IOException;
}
