package com.example.exod_detector.model;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Provenance of one run, embedded in the final raster.
 */
public record RunParameters(String creator,
                            String date,
                            String observationId,
                            String instrument,
                            double timeWindow,
                            double goodTimeRatio,
                            double detectionLevel,
                            int boxSize) {

    public Map<String, String> asHeaderCards() {
        Map<String, String> cards = new LinkedHashMap<>();
        cards.put("CREATOR", creator);
        cards.put("DATE", date);
        cards.put("OBS_ID", observationId);
        cards.put("INST", instrument);
        cards.put("TW", String.format(Locale.ROOT, "%s", timeWindow));
        cards.put("GTR", String.format(Locale.ROOT, "%s", goodTimeRatio));
        cards.put("DL", String.format(Locale.ROOT, "%s", detectionLevel));
        cards.put("BS", Integer.toString(boxSize));
        return cards;
    }
}
