package com.example.exod_detector.service;

import com.example.exod_detector.detector.DetectionParameters;
import com.example.exod_detector.detector.RegionDetector;
import com.example.exod_detector.detector.SourceConsolidator;
import com.example.exod_detector.detector.TimeWindowFilter;
import com.example.exod_detector.detector.VariabilityComputer;
import com.example.exod_detector.engine.AstrometryContext;
import com.example.exod_detector.engine.Interfaces.SkyCoordinateResolver;
import com.example.exod_detector.exception.InputExtractionException;
import com.example.exod_detector.exception.TileComputationException;
import com.example.exod_detector.model.DeadTimeInterval;
import com.example.exod_detector.model.DetectionResult;
import com.example.exod_detector.model.Event;
import com.example.exod_detector.model.ObservationData;
import com.example.exod_detector.model.ObservationHeader;
import com.example.exod_detector.model.Raster;
import com.example.exod_detector.model.SkyPosition;
import com.example.exod_detector.model.Source;
import com.example.exod_detector.model.TimeWindow;
import com.example.exod_detector.mosaic.GeometricTransformer;
import com.example.exod_detector.mosaic.MosaicAssembler;
import com.example.exod_detector.service.Interfaces.DeadTimeExtractor;
import com.example.exod_detector.service.Interfaces.PhotonExtractor;
import com.example.exod_detector.util.Instrument;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class VariabilityDetectionServiceTest {

    private static final Path EVENTS = Path.of("/data/0123456789/PN_pattern_clean.json");
    private static final Path DEAD_TIME = Path.of("/data/0123456789/PN_deadtime.json");
    private static final Path OUTPUT = Path.of("/data/0123456789/results");
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-02T03:04:05Z"), ZoneOffset.UTC);

    @Mock
    private PhotonExtractor photonExtractor;
    @Mock
    private DeadTimeExtractor deadTimeExtractor;
    @Mock
    private SkyCoordinateResolver skyCoordinateResolver;
    @Mock
    private DetectionOutputWriter outputWriter;

    private final DetectionParameters params = DetectionParameters.defaults(Instrument.PN);

    @Test
    void burstOnOneCcdIsDetectedResolvedAndWritten() throws Exception {
        when(photonExtractor.extract(EVENTS, 12)).thenReturn(burstObservation());
        when(deadTimeExtractor.extract(DEAD_TIME, 12)).thenReturn(noDeadTime());
        when(skyCoordinateResolver.resolve(anyDouble(), anyDouble(), eq(5), any()))
                .thenReturn(Optional.of(new SkyPosition(25000, 26000, 83.63, 22.01)));

        DetectionResult result = service(new VariabilityComputer(), Runnable::run)
                .run(new DetectionRun(EVENTS, DEAD_TIME, OUTPUT, "tester", null, null), params);

        assertThat(result.sources()).hasSize(1);
        Source source = result.sources().get(0);
        assertThat(source.id()).isEqualTo(1);
        assertThat(source.tileId()).isEqualTo(5);
        assertThat(source.rawX()).isCloseTo(31.0, within(1e-9));
        assertThat(source.rawY()).isCloseTo(100.0, within(1e-9));
        assertThat(source.ra()).isEqualTo(83.63);
        assertThat(source.x()).isEqualTo(25000.0);
        assertThat(result.effectiveMedian()).isEqualTo(0.75);
        assertThat(result.image().rows()).isEqualTo(648);
        assertThat(result.image().cols()).isEqualTo(648);
        assertThat(result.runParameters().observationId()).isEqualTo("0123456789");
        assertThat(result.runParameters().date()).isEqualTo("2026-01-02 03:04:05");
        assertThat(result.runParameters().creator()).isEqualTo("tester");

        ArgumentCaptor<AstrometryContext> context = ArgumentCaptor.forClass(AstrometryContext.class);
        verify(skyCoordinateResolver).resolve(eq(31.0), eq(100.0), eq(5), context.capture());
        assertThat(context.getValue().sourceId()).isEqualTo(1);
        assertThat(context.getValue().observationDir()).isEqualTo(EVENTS.getParent().toString());
        verify(outputWriter).write(OUTPUT, result);
    }

    @Test
    void resultDoesNotDependOnThreadScheduling() {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            DetectionResult sequential = service(new VariabilityComputer(), Runnable::run)
                    .detect(burstObservation(), noDeadTime(), params, null);
            DetectionResult parallel = service(new VariabilityComputer(), pool)
                    .detect(burstObservation(), noDeadTime(), params, null);

            assertThat(parallel.sources()).isEqualTo(sequential.sources());
            assertThat(parallel.image()).isEqualTo(sequential.image());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void unreadableEventsAbortBeforeAnyOutput() throws Exception {
        when(photonExtractor.extract(any(), anyInt())).thenThrow(new IOException("truncated file"));

        assertThatThrownBy(() -> service(new VariabilityComputer(), Runnable::run)
                .run(new DetectionRun(EVENTS, DEAD_TIME, OUTPUT, "tester", null, null), params))
                .isInstanceOfSatisfying(InputExtractionException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(InputExtractionException.InputKind.EVENTS);
                    assertThat(e.getExitCode()).isEqualTo(65);
                    assertThat(e.getCause()).hasMessage("truncated file");
                });
        verify(outputWriter, never()).write(any(), any());
    }

    @Test
    void unreadableDeadTimeAbortsWithItsOwnExitCode() throws Exception {
        when(photonExtractor.extract(EVENTS, 12)).thenReturn(burstObservation());
        when(deadTimeExtractor.extract(any(), anyInt())).thenThrow(new IOException("no GTI extension"));

        assertThatThrownBy(() -> service(new VariabilityComputer(), Runnable::run)
                .run(new DetectionRun(EVENTS, DEAD_TIME, OUTPUT, "tester", "override", null), params))
                .isInstanceOfSatisfying(InputExtractionException.class,
                        e -> assertThat(e.getExitCode()).isEqualTo(66));
        verify(outputWriter, never()).write(any(), any());
    }

    @Test
    void eventListWithoutEventsIsAnInputError() throws Exception {
        when(photonExtractor.extract(EVENTS, 12)).thenReturn(emptyObservation());

        assertThatThrownBy(() -> service(new VariabilityComputer(), Runnable::run)
                .run(new DetectionRun(EVENTS, DEAD_TIME, OUTPUT, "tester", null, null), params))
                .isInstanceOfSatisfying(InputExtractionException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(InputExtractionException.InputKind.EVENTS);
                    assertThat(e.getExitCode()).isEqualTo(65);
                });
        verify(outputWriter, never()).write(any(), any());
    }

    @Test
    void detectingOnNoEventsGivesAnEmptyResult() {
        DetectionResult result = service(new VariabilityComputer(), Runnable::run)
                .detect(emptyObservation(), noDeadTime(), params, null);

        assertThat(result.sources()).isEmpty();
        assertThat(result.image().rows()).isEqualTo(648);
        assertThat(result.image().max()).isZero();
        assertThat(result.effectiveMedian()).isEqualTo(0.75);
    }

    @Test
    void failingTileAbortsTheRun() {
        VariabilityComputer broken = new VariabilityComputer() {
            @Override
            public Raster compute(int tileId, List<Event> events, List<TimeWindow> accepted, double t0, DetectionParameters p) {
                if (tileId == 3) {
                    throw new IllegalStateException("corrupt tile");
                }
                return super.compute(tileId, events, accepted, t0, p);
            }
        };

        assertThatThrownBy(() -> service(broken, Runnable::run).detect(burstObservation(), noDeadTime(), params, null))
                .isInstanceOfSatisfying(TileComputationException.class, e -> {
                    assertThat(e.getTileId()).isEqualTo(3);
                    assertThat(e.getExitCode()).isEqualTo(70);
                    assertThat(e.getCause()).hasMessage("corrupt tile");
                });
    }

    @Test
    void tileCountMustMatchTheInstrument() {
        DetectionParameters mos = DetectionParameters.defaults(Instrument.M1);

        assertThatThrownBy(() -> service(new VariabilityComputer(), Runnable::run)
                .detect(burstObservation(), noDeadTime(), mos, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("expects 7");
    }

    @Test
    void failedAstrometryLeavesSkyFieldsEmpty() {
        Source a = source(1);
        Source b = source(2);
        when(skyCoordinateResolver.resolve(anyDouble(), anyDouble(), anyInt(), any()))
                .thenThrow(new IllegalStateException("tool crashed"))
                .thenReturn(Optional.empty());

        List<Source> enriched = service(new VariabilityComputer(), Runnable::run)
                .enrich(List.of(a, b), new AstrometryContext("obs", null, null, 0));

        assertThat(enriched).containsExactly(a, b);
        assertThat(enriched).noneMatch(Source::hasSkyPosition);
    }

    private VariabilityDetectionService service(VariabilityComputer computer, Executor executor) {
        return new VariabilityDetectionService(photonExtractor, deadTimeExtractor, new TimeWindowFilter(), computer,
                new MosaicAssembler(), new GeometricTransformer(), new RegionDetector(), new SourceConsolidator(),
                skyCoordinateResolver, outputWriter, executor, CLOCK);
    }

    /** 60 photons on one pixel of CCD 5 within a single window, plus two events fixing the span. */
    private static ObservationData burstObservation() {
        List<List<Event>> perTile = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            perTile.add(new ArrayList<>());
        }
        perTile.get(0).add(new Event(0.0, 0, 0, 0));
        for (int k = 0; k < 60; k++) {
            perTile.get(5).add(new Event(500.0 + k, 31, 100, 5));
        }
        perTile.get(0).add(new Event(1000.0, 0, 0, 0));
        ObservationHeader header = new ObservationHeader("0123456789", 0.0, "PrimeFullWindow",
                new ObservationHeader.CalibrationLimits(100, 548, 100, 548, 0, 648, 0, 648), Map.of());
        return new ObservationData(header, perTile);
    }

    private static ObservationData emptyObservation() {
        List<List<Event>> perTile = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            perTile.add(List.of());
        }
        ObservationHeader header = new ObservationHeader("0123456789", 0.0, "PrimeFullWindow",
                new ObservationHeader.CalibrationLimits(100, 548, 100, 548, 0, 648, 0, 648), Map.of());
        return new ObservationData(header, perTile);
    }

    private static List<List<DeadTimeInterval>> noDeadTime() {
        List<List<DeadTimeInterval>> out = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            out.add(List.of());
        }
        return out;
    }

    private static Source source(int id) {
        return new Source(id, 0, 10, 20, 1, 64, 3.2, 13, 23, 80, null, null, null, null);
    }
}
