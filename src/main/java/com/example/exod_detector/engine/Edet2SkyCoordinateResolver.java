package com.example.exod_detector.engine;

import com.example.exod_detector.engine.Interfaces.SkyCoordinateResolver;
import com.example.exod_detector.model.SkyPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Runs the SAS {@code edet2sky} task (or any command printing the same blocks) once per source.
 * <p>
 * Command tokens may contain {@code {rawx}}, {@code {rawy}}, {@code {ccd}}, {@code {calinfoset}},
 * {@code {obsdir}} and {@code {id}}. The CCD number handed to the tool is one-based. The process is
 * killed when it outlives the timeout; the source then keeps empty sky fields.
 */
public class Edet2SkyCoordinateResolver implements SkyCoordinateResolver {
    private static final Logger LOGGER = LoggerFactory.getLogger(Edet2SkyCoordinateResolver.class);

    static final String RA_DEC_MARKER = "# RA (deg) DEC (deg)";
    static final String SKY_PIXEL_MARKER = "# Sky X Y pixel";

    private final List<String> commandTemplate;
    private final Map<String, String> environment;
    private final Duration timeout;

    public Edet2SkyCoordinateResolver(List<String> commandTemplate, Map<String, String> environment, Duration timeout) {
        if (commandTemplate == null || commandTemplate.isEmpty()) {
            throw new IllegalArgumentException("edet2sky command must not be empty");
        }
        this.commandTemplate = List.copyOf(commandTemplate);
        this.environment = environment != null ? Map.copyOf(environment) : Map.of();
        this.timeout = timeout != null ? timeout : Duration.ofSeconds(15);
    }

    @Override
    public Optional<SkyPosition> resolve(double rawX, double rawY, int tileId, AstrometryContext context) {
        List<String> cmd = command(rawX, rawY, tileId, context);
        LOGGER.debug("ASTROMETRY source={} exec: {}", context.sourceId(), String.join(" ", cmd));
        Process process;
        try {
            ProcessBuilder pb = new ProcessBuilder(cmd).redirectErrorStream(true);
            pb.environment().putAll(environment);
            process = pb.start();
        } catch (IOException e) {
            LOGGER.warn("ASTROMETRY source={} could not start {}: {}", context.sourceId(), cmd.get(0), e.toString());
            return Optional.empty();
        }

        List<String> lines = Collections.synchronizedList(new ArrayList<>());
        Thread reader = new Thread(() -> {
            try (var br = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                br.lines().forEach(line -> {
                    LOGGER.trace("[edet2sky] {}", line);
                    lines.add(line);
                });
            } catch (IOException e) {
                LOGGER.debug("ASTROMETRY source={} output stream closed: {}", context.sourceId(), e.toString());
            }
        }, "edet2sky-reader-" + context.sourceId());
        reader.setDaemon(true);
        reader.start();

        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                LOGGER.warn("ASTROMETRY source={} timed out after {}s, sky position left unset", context.sourceId(), timeout.toSeconds());
                return Optional.empty();
            }
            reader.join(TimeUnit.SECONDS.toMillis(1));
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            LOGGER.warn("ASTROMETRY source={} interrupted", context.sourceId());
            return Optional.empty();
        }

        if (process.exitValue() != 0) {
            LOGGER.warn("ASTROMETRY source={} failed with exit={}", context.sourceId(), process.exitValue());
            return Optional.empty();
        }
        List<String> snapshot;
        synchronized (lines) {
            snapshot = List.copyOf(lines);
        }
        Optional<SkyPosition> position = parse(snapshot);
        if (position.isEmpty()) {
            LOGGER.warn("ASTROMETRY source={} produced no usable coordinates ({} lines)", context.sourceId(), snapshot.size());
        }
        return position;
    }

    List<String> command(double rawX, double rawY, int tileId, AstrometryContext context) {
        List<String> cmd = new ArrayList<>(commandTemplate.size());
        for (String token : commandTemplate) {
            cmd.add(token
                    .replace("{rawx}", format(rawX))
                    .replace("{rawy}", format(rawY))
                    .replace("{ccd}", Integer.toString(tileId + 1))
                    .replace("{calinfoset}", nullToEmpty(context.calibrationImage()))
                    .replace("{obsdir}", nullToEmpty(context.observationDir()))
                    .replace("{id}", Integer.toString(context.sourceId())));
        }
        return cmd;
    }

    /**
     * Reads the value lines following the RA/DEC and sky pixel headers.
     */
    static Optional<SkyPosition> parse(List<String> lines) {
        double[] raDec = null;
        double[] xy = null;
        for (int i = 0; i < lines.size() - 1; i++) {
            String header = normalize(lines.get(i));
            if (RA_DEC_MARKER.equals(header)) {
                raDec = pair(lines.get(i + 1));
            } else if (SKY_PIXEL_MARKER.equals(header)) {
                xy = pair(lines.get(i + 1));
            }
        }
        if (raDec == null || xy == null) {
            return Optional.empty();
        }
        return Optional.of(new SkyPosition(xy[0], xy[1], raDec[0], raDec[1]));
    }

    private static double[] pair(String line) {
        String[] toks = line.trim().split("\\s+");
        if (toks.length < 2) {
            return null;
        }
        try {
            return new double[]{Double.parseDouble(toks[0]), Double.parseDouble(toks[1])};
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String normalize(String line) {
        return line.trim().replaceAll("\\s+", " ");
    }

    private static String format(double v) {
        return String.format(Locale.ROOT, "%.3f", v);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
