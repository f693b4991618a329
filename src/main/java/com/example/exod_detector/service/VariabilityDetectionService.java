package com.example.exod_detector.service;

import com.example.exod_detector.detector.DetectionParameters;
import com.example.exod_detector.detector.RegionDetector;
import com.example.exod_detector.detector.SourceConsolidator;
import com.example.exod_detector.detector.TimeWindowFilter;
import com.example.exod_detector.detector.VariabilityComputer;
import com.example.exod_detector.detector.VariabilityStatistics;
import com.example.exod_detector.engine.AstrometryContext;
import com.example.exod_detector.engine.Interfaces.SkyCoordinateResolver;
import com.example.exod_detector.exception.InputExtractionException;
import com.example.exod_detector.exception.TileComputationException;
import com.example.exod_detector.model.CandidateRegion;
import com.example.exod_detector.model.DeadTimeInterval;
import com.example.exod_detector.model.DetectionResult;
import com.example.exod_detector.model.ObservationData;
import com.example.exod_detector.model.Raster;
import com.example.exod_detector.model.RunParameters;
import com.example.exod_detector.model.SkyPosition;
import com.example.exod_detector.model.Source;
import com.example.exod_detector.model.TimeWindow;
import com.example.exod_detector.mosaic.GeometricTransformer;
import com.example.exod_detector.mosaic.MosaicAssembler;
import com.example.exod_detector.service.Interfaces.DeadTimeExtractor;
import com.example.exod_detector.service.Interfaces.PhotonExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.IntFunction;

/**
 * Runs the detector: time windows, per-tile variability, mosaic and transform, per-tile region
 * detection, numbering and astrometry.
 * <p>
 * Per-tile work is submitted to the tile executor and joined in tile order, so the result does
 * not depend on completion order. A failing tile aborts the run; a failing astrometry call only
 * leaves that source without sky coordinates.
 */
@Service
public class VariabilityDetectionService {
    private static final Logger LOGGER = LoggerFactory.getLogger(VariabilityDetectionService.class);
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    private final PhotonExtractor photonExtractor;
    private final DeadTimeExtractor deadTimeExtractor;
    private final TimeWindowFilter timeWindowFilter;
    private final VariabilityComputer variabilityComputer;
    private final MosaicAssembler mosaicAssembler;
    private final GeometricTransformer geometricTransformer;
    private final RegionDetector regionDetector;
    private final SourceConsolidator sourceConsolidator;
    private final SkyCoordinateResolver skyCoordinateResolver;
    private final DetectionOutputWriter outputWriter;
    private final Executor tileExecutor;
    private final Clock clock;

    public VariabilityDetectionService(PhotonExtractor photonExtractor,
                                       DeadTimeExtractor deadTimeExtractor,
                                       TimeWindowFilter timeWindowFilter,
                                       VariabilityComputer variabilityComputer,
                                       MosaicAssembler mosaicAssembler,
                                       GeometricTransformer geometricTransformer,
                                       RegionDetector regionDetector,
                                       SourceConsolidator sourceConsolidator,
                                       SkyCoordinateResolver skyCoordinateResolver,
                                       DetectionOutputWriter outputWriter,
                                       @Qualifier("tileTaskExecutor") Executor tileExecutor,
                                       Clock clock) {
        this.photonExtractor = photonExtractor;
        this.deadTimeExtractor = deadTimeExtractor;
        this.timeWindowFilter = timeWindowFilter;
        this.variabilityComputer = variabilityComputer;
        this.mosaicAssembler = mosaicAssembler;
        this.geometricTransformer = geometricTransformer;
        this.regionDetector = regionDetector;
        this.sourceConsolidator = sourceConsolidator;
        this.skyCoordinateResolver = skyCoordinateResolver;
        this.outputWriter = outputWriter;
        this.tileExecutor = tileExecutor;
        this.clock = clock;
    }

    /**
     * Full run: reads the inputs, detects, and writes the outputs only once everything succeeded.
     */
    public DetectionResult run(DetectionRun run, DetectionParameters params) {
        long t0 = System.nanoTime();
        LOGGER.info("RUN START inst={} dl={} tw={} bs={} gtr={} out={}", params.instrument(), params.detectionLevel(),
                params.timeWindow(), params.boxSize(), params.goodTimeRatio(), run.outputDir());

        int tiles = params.instrument().tileCount();
        ObservationData data;
        try {
            data = photonExtractor.extract(run.eventsFile(), tiles);
            if (data.eventsPerTile().stream().allMatch(List::isEmpty)) {
                throw new IOException("Event list has no events");
            }
        } catch (IOException | RuntimeException e) {
            LOGGER.error("Impossible to extract photons from {}. ABORTING.", run.eventsFile(), e);
            throw InputExtractionException.events(run.eventsFile(), e);
        }
        LOGGER.info("Events recovered in {}ms", elapsedMs(t0));

        List<List<DeadTimeInterval>> deadTimes;
        try {
            deadTimes = deadTimeExtractor.extract(run.deadTimeFile(), tiles);
        } catch (IOException | RuntimeException e) {
            LOGGER.error("Impossible to extract dead-time intervals from {}. ABORTING.", run.deadTimeFile(), e);
            throw InputExtractionException.deadTime(run.deadTimeFile(), e);
        }
        LOGGER.info("Dead time recovered in {}ms", elapsedMs(t0));

        String observationId = run.observationId() != null ? run.observationId() : data.header().observationId();
        RunParameters runParameters = new RunParameters(run.creator(), DATE_FORMAT.format(clock.instant()), observationId,
                params.instrument().name(), params.timeWindow(), params.goodTimeRatio(), params.detectionLevel(), params.boxSize());

        DetectionResult detected = detect(data, deadTimes, params, runParameters);
        String observationDir = run.eventsFile().toAbsolutePath().getParent() != null
                ? run.eventsFile().toAbsolutePath().getParent().toString() : null;
        List<Source> enriched = enrich(detected.sources(), new AstrometryContext(observationId, observationDir, run.calibrationImage(), 0));
        DetectionResult result = new DetectionResult(detected.image(), enriched, detected.effectiveMedian(), runParameters);

        outputWriter.write(run.outputDir(), result);
        LOGGER.info("RUN DONE obs={} sources={} in={}ms", observationId, result.sources().size(), elapsedMs(t0));
        return result;
    }

    /**
     * Detection on already extracted inputs, without astrometry or file output.
     *
     * @param data          header and per-tile events.
     * @param deadTimes     per-tile dead-time intervals.
     * @param params        detection parameters.
     * @param runParameters provenance carried into the result.
     * @return transformed image and numbered sources with empty sky fields.
     */
    public DetectionResult detect(ObservationData data, List<List<DeadTimeInterval>> deadTimes,
                                  DetectionParameters params, RunParameters runParameters) {
        int tiles = params.instrument().tileCount();
        if (data.tileCount() != tiles || deadTimes.size() != tiles) {
            throw new IllegalArgumentException(params.instrument() + " expects " + tiles + " tiles, got events for "
                    + data.tileCount() + " and dead time for " + deadTimes.size());
        }
        if (data.eventsPerTile().stream().allMatch(List::isEmpty)) {
            LOGGER.warn("Observation {} has no events, nothing to detect", data.header().observationId());
            Raster empty = Raster.zeros(GeometricTransformer.CANONICAL_SIZE, GeometricTransformer.CANONICAL_SIZE);
            return new DetectionResult(empty, List.of(), VariabilityStatistics.MEDIAN_FLOOR, runParameters);
        }
        long start = System.nanoTime();
        double t0 = data.firstEventTime();
        double tf = data.lastEventTime();

        List<List<TimeWindow>> windows = new ArrayList<>(tiles);
        for (int tile = 0; tile < tiles; tile++) {
            windows.add(timeWindowFilter.acceptedWindows(t0, tf, params.timeWindow(), deadTimes.get(tile), params.goodTimeRatio()));
        }
        LOGGER.info("Computing variability t0={} tf={} windows(tile0)={}", t0, tf, windows.get(0).size());

        List<Raster> matrices = perTile(tiles, "Variability computation", tile ->
                variabilityComputer.compute(tile, data.eventsPerTile().get(tile), windows.get(tile), t0, params));
        LOGGER.info("Variability computed in {}ms", elapsedMs(start));

        Raster mosaic = mosaicAssembler.assemble(params.instrument(), matrices, data.header().submode());
        Raster image = geometricTransformer.transform(mosaic, data.header(), params.instrument().transformVariant());

        double median = VariabilityStatistics.globalMedian(matrices);
        double effective = VariabilityStatistics.clampMedian(median);
        LOGGER.info("Median {}{}", median, effective != median ? " switched to " + effective : "");
        LOGGER.info("Box counts {}", params.boxThreshold(1.0));

        List<List<CandidateRegion>> regions = perTile(tiles, "Region detection", tile ->
                regionDetector.detect(tile, matrices.get(tile), effective, params));
        List<Source> sources = sourceConsolidator.consolidate(regions);
        LOGGER.info("Variable sources detected count={} in={}ms", sources.size(), elapsedMs(start));
        return new DetectionResult(image, sources, effective, runParameters);
    }

    /**
     * Resolves sky coordinates source by source; failures leave the sky fields empty.
     */
    List<Source> enrich(List<Source> sources, AstrometryContext context) {
        List<Source> out = new ArrayList<>(sources.size());
        int resolved = 0;
        for (Source source : sources) {
            Optional<SkyPosition> position;
            try {
                position = skyCoordinateResolver.resolve(source.rawX(), source.rawY(), source.tileId(), context.forSource(source.id()));
            } catch (RuntimeException e) {
                LOGGER.warn("ASTROMETRY source={} failed: {}", source.id(), e.toString());
                position = Optional.empty();
            }
            if (position.isPresent()) {
                resolved++;
                out.add(source.withSkyPosition(position.get()));
            } else {
                out.add(source);
            }
        }
        LOGGER.info("Astrometry resolved {}/{} sources", resolved, sources.size());
        return out;
    }

    private <T> List<T> perTile(int tiles, String stage, IntFunction<T> task) {
        List<CompletableFuture<T>> futures = new ArrayList<>(tiles);
        for (int tile = 0; tile < tiles; tile++) {
            final int id = tile;
            futures.add(CompletableFuture.supplyAsync(() -> task.apply(id), tileExecutor));
        }
        List<T> results = new ArrayList<>(tiles);
        for (int tile = 0; tile < tiles; tile++) {
            try {
                results.add(futures.get(tile).join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                LOGGER.error("{} failed on tile {}. ABORTING.", stage, tile, cause);
                throw new TileComputationException(tile, stage, cause);
            }
        }
        return results;
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
