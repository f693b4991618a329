package com.example.exod_detector.service;

import com.example.exod_detector.model.DeadTimeInterval;
import com.example.exod_detector.service.Interfaces.DeadTimeExtractor;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads dead-time intervals exported as {@code {"intervals": [{"ccd": 0, "start": 10.0, "end": 12.5}]}}.
 */
@Service
public class JsonDeadTimeExtractor implements DeadTimeExtractor {

    private final ObjectMapper objectMapper;

    public JsonDeadTimeExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public List<List<DeadTimeInterval>> extract(Path deadTimeFile, int tileCount) throws IOException {
        if (!Files.isRegularFile(deadTimeFile)) {
            throw new IOException("Dead-time file not found: " + deadTimeFile);
        }
        DeadTimeDocument doc = objectMapper.readValue(deadTimeFile.toFile(), DeadTimeDocument.class);
        if (doc == null || doc.intervals() == null) {
            throw new IOException("Dead-time file has no 'intervals' array: " + deadTimeFile);
        }
        List<List<DeadTimeInterval>> perTile = new ArrayList<>(tileCount);
        for (int i = 0; i < tileCount; i++) {
            perTile.add(new ArrayList<>());
        }
        for (IntervalEntry entry : doc.intervals()) {
            if (entry.ccd() == null || entry.start() == null || entry.end() == null) {
                throw new IOException("Incomplete dead-time interval: " + entry);
            }
            if (entry.ccd() < 0 || entry.ccd() >= tileCount) {
                throw new IOException("Dead-time interval on CCD " + entry.ccd() + " outside [0, " + tileCount + ")");
            }
            try {
                perTile.get(entry.ccd()).add(new DeadTimeInterval(entry.start(), entry.end()));
            } catch (IllegalArgumentException e) {
                throw new IOException(e.getMessage(), e);
            }
        }
        return perTile;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record DeadTimeDocument(List<IntervalEntry> intervals) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record IntervalEntry(Integer ccd, Double start, Double end) {
    }
}
