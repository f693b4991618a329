package com.example.exod_detector.service.Interfaces;

import com.example.exod_detector.model.ObservationData;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads the cleaned event list of one observation.
 */
public interface PhotonExtractor {

    /**
     * @param eventsFile event list to read.
     * @param tileCount  number of CCDs of the selected instrument.
     * @return header plus one time-ordered event list per tile.
     * @throws IOException when the file is unreadable or malformed.
     */
    ObservationData extract(Path eventsFile, int tileCount) throws IOException;
}
