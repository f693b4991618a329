package com.example.exod_detector.service;

import com.example.exod_detector.model.Event;
import com.example.exod_detector.model.ObservationData;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonPhotonExtractorTest {

    private static final String HEADER = """
            "header": {"OBS_ID": "0123456789", "PA_PNT": 245.5, "SUBMODE": "PrimeFullWindow",
                       "TDMIN6": 3649, "TDMAX6": 48106, "TDMIN7": 3649, "TDMAX7": 48106,
                       "TLMIN6": 1, "TLMAX6": 51840, "TLMIN7": 1, "TLMAX7": 51840}
            """;

    private final JsonPhotonExtractor extractor = new JsonPhotonExtractor(new ObjectMapper());

    @TempDir
    Path tempDir;

    @Test
    void groupsEventsPerCcdInTimeOrder() throws IOException {
        Path file = write("""
                {%s,
                 "events": [
                   {"time": 30.0, "rawX": 5, "rawY": 7, "ccd": 2},
                   {"time": 10.0, "rawX": 1, "rawY": 2, "ccd": 2},
                   {"time": 20.0, "rawX": 63, "rawY": 199, "ccd": 11}
                 ]}
                """.formatted(HEADER));

        ObservationData data = extractor.extract(file, 12);

        assertThat(data.tileCount()).isEqualTo(12);
        assertThat(data.eventsPerTile().get(2)).containsExactly(new Event(10.0, 1, 2, 2), new Event(30.0, 5, 7, 2));
        assertThat(data.eventsPerTile().get(11)).containsExactly(new Event(20.0, 63, 199, 11));
        assertThat(data.eventsPerTile().get(0)).isEmpty();
        assertThat(data.firstEventTime()).isEqualTo(10.0);
        assertThat(data.lastEventTime()).isEqualTo(30.0);
    }

    @Test
    void readsHeaderCards() throws IOException {
        Path file = write("{%s, \"events\": [{\"time\": 1.0, \"rawX\": 0, \"rawY\": 0, \"ccd\": 0}]}".formatted(HEADER));

        ObservationData data = extractor.extract(file, 12);

        assertThat(data.header().observationId()).isEqualTo("0123456789");
        assertThat(data.header().pointingAngle()).isEqualTo(245.5);
        assertThat(data.header().submode()).isEqualTo("PrimeFullWindow");
        assertThat(data.header().limits().projectedMaxX()).isEqualTo(48106.0);
        assertThat(data.header().limits().legalMaxY()).isEqualTo(51840.0);
        assertThat(data.header().raw()).containsEntry("OBS_ID", "0123456789");
    }

    @Test
    void rejectsEventsOnUnknownCcd() throws IOException {
        Path file = write("{%s, \"events\": [{\"time\": 1.0, \"rawX\": 0, \"rawY\": 0, \"ccd\": 7}]}".formatted(HEADER));

        assertThatThrownBy(() -> extractor.extract(file, 7))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("CCD 7");
    }

    @Test
    void rejectsMissingFieldsAndFiles() throws IOException {
        Path noLimits = write("{\"header\": {\"PA_PNT\": 10}, \"events\": []}");
        Path noEvents = write("{%s}".formatted(HEADER));

        assertThatThrownBy(() -> extractor.extract(noLimits, 12)).isInstanceOf(IOException.class).hasMessageContaining("TDMIN6");
        assertThatThrownBy(() -> extractor.extract(noEvents, 12)).isInstanceOf(IOException.class).hasMessageContaining("events");
        assertThatThrownBy(() -> extractor.extract(tempDir.resolve("missing.json"), 12)).isInstanceOf(IOException.class);
    }

    @Test
    void rejectsEventListWithoutEvents() throws IOException {
        Path file = write("{%s, \"events\": []}".formatted(HEADER));

        assertThatThrownBy(() -> extractor.extract(file, 12))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("no events");
    }

    private Path write(String json) throws IOException {
        Path file = Files.createTempFile(tempDir, "events", ".json");
        Files.writeString(file, json);
        return file;
    }
}
