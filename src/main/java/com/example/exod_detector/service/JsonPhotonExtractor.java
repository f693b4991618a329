package com.example.exod_detector.service;

import com.example.exod_detector.model.Event;
import com.example.exod_detector.model.ObservationData;
import com.example.exod_detector.model.ObservationHeader;
import com.example.exod_detector.service.Interfaces.PhotonExtractor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads event lists exported as JSON:
 * <pre>
 * { "header": { "OBS_ID": "0123456789", "PA_PNT": 245.1, "SUBMODE": "PrimeFullWindow",
 *               "TDMIN6": ..., "TDMAX6": ..., "TDMIN7": ..., "TDMAX7": ...,
 *               "TLMIN6": ..., "TLMAX6": ..., "TLMIN7": ..., "TLMAX7": ... },
 *   "events": [ { "time": 1.0, "rawX": 12, "rawY": 140, "ccd": 3 }, ... ] }
 * </pre>
 */
@Service
public class JsonPhotonExtractor implements PhotonExtractor {
    private static final Logger LOGGER = LoggerFactory.getLogger(JsonPhotonExtractor.class);

    private final ObjectMapper objectMapper;

    public JsonPhotonExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public ObservationData extract(Path eventsFile, int tileCount) throws IOException {
        if (!Files.isRegularFile(eventsFile)) {
            throw new IOException("Event list not found: " + eventsFile);
        }
        JsonNode root = objectMapper.readTree(eventsFile.toFile());
        ObservationHeader header = header(root.path("header"));

        List<List<Event>> perTile = new ArrayList<>(tileCount);
        for (int i = 0; i < tileCount; i++) {
            perTile.add(new ArrayList<>());
        }
        JsonNode events = root.path("events");
        if (!events.isArray()) {
            throw new IOException("Event list has no 'events' array: " + eventsFile);
        }
        for (JsonNode node : events) {
            int ccd = requireInt(node, "ccd");
            if (ccd < 0 || ccd >= tileCount) {
                throw new IOException("Event on CCD " + ccd + " outside [0, " + tileCount + ")");
            }
            perTile.get(ccd).add(new Event(requireDouble(node, "time"), requireInt(node, "rawX"), requireInt(node, "rawY"), ccd));
        }
        if (events.isEmpty()) {
            throw new IOException("Event list has no events: " + eventsFile);
        }
        perTile.forEach(list -> list.sort(Comparator.comparingDouble(Event::time)));
        LOGGER.info("Recovered {} events over {} CCDs from {}", events.size(), tileCount, eventsFile.getFileName());
        return new ObservationData(header, perTile);
    }

    private ObservationHeader header(JsonNode node) throws IOException {
        if (!node.isObject()) {
            throw new IOException("Event list has no 'header' object");
        }
        Map<String, String> raw = new LinkedHashMap<>();
        node.fields().forEachRemaining(e -> raw.put(e.getKey(), e.getValue().asText()));
        ObservationHeader.CalibrationLimits limits;
        try {
            limits = new ObservationHeader.CalibrationLimits(
                    requireDouble(node, "TDMIN6"), requireDouble(node, "TDMAX6"),
                    requireDouble(node, "TDMIN7"), requireDouble(node, "TDMAX7"),
                    requireDouble(node, "TLMIN6"), requireDouble(node, "TLMAX6"),
                    requireDouble(node, "TLMIN7"), requireDouble(node, "TLMAX7"));
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid coordinate limits in header: " + e.getMessage(), e);
        }
        String obsId = node.hasNonNull("OBS_ID") ? node.get("OBS_ID").asText() : null;
        String submode = node.hasNonNull("SUBMODE") ? node.get("SUBMODE").asText() : null;
        return new ObservationHeader(obsId, requireDouble(node, "PA_PNT"), submode, limits, raw);
    }

    private static double requireDouble(JsonNode node, String field) throws IOException {
        JsonNode value = node.get(field);
        if (value == null || !value.isNumber()) {
            throw new IOException("Missing or non-numeric field '" + field + "'");
        }
        return value.asDouble();
    }

    private static int requireInt(JsonNode node, String field) throws IOException {
        JsonNode value = node.get(field);
        if (value == null || !value.canConvertToInt()) {
            throw new IOException("Missing or non-integer field '" + field + "'");
        }
        return value.asInt();
    }
}
