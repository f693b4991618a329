package com.example.exod_detector.config;

import com.example.exod_detector.detector.DetectionParameters;
import com.example.exod_detector.util.Instrument;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Detector parameters and input/output locations.
 */
@Validated
@ConfigurationProperties(prefix = "detector")
public class DetectorProperties {

    @Min(1)
    private int boxSize = DetectionParameters.DEFAULT_BOX_SIZE;
    /** 0 means "same as box size". */
    @Min(0)
    private int boxStride = 0;
    @Positive
    private double detectionLevel = DetectionParameters.DEFAULT_DETECTION_LEVEL;
    @Positive
    private double timeWindow = DetectionParameters.DEFAULT_TIME_WINDOW;
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double goodTimeRatio = DetectionParameters.DEFAULT_GOOD_TIME_RATIO;
    @Min(1)
    private int maxThreads = DetectionParameters.DEFAULT_MAX_THREADS;
    @Min(0)
    private int neighbourhoodRadius = DetectionParameters.DEFAULT_NEIGHBOURHOOD_RADIUS;
    @NotBlank
    private String instrument = Instrument.PN.name();

    private String creator = System.getenv().getOrDefault("USER", "unknown");
    private String observation;
    private String eventsFile;
    private String deadTimeFile;
    private String outputDir;

    @Valid
    private Astrometry astrometry = new Astrometry();

    /**
     * Converts to the core parameter record; rejects unknown instruments.
     */
    public DetectionParameters toParameters() {
        int stride = boxStride > 0 ? boxStride : boxSize;
        return new DetectionParameters(boxSize, stride, detectionLevel, timeWindow, goodTimeRatio, maxThreads,
                neighbourhoodRadius, Instrument.fromCode(instrument));
    }

    /**
     * Folder name used when no output directory is configured, e.g. {@code 10_100_3_1.0_PN}.
     */
    public String defaultOutputFolderName() {
        return String.format(Locale.ROOT, "%d_%d_%d_%s_%s", (int) detectionLevel, (int) timeWindow, boxSize,
                goodTimeRatio, instrument.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Configured output folder, or {@link #defaultOutputFolderName()} next to the event list.
     *
     * @return output folder, {@code null} when neither it nor the event list is set.
     */
    public Path resolveOutputDir() {
        if (outputDir != null && !outputDir.isBlank()) {
            return Path.of(outputDir);
        }
        if (eventsFile == null || eventsFile.isBlank()) {
            return null;
        }
        Path parent = Path.of(eventsFile).toAbsolutePath().getParent();
        return (parent != null ? parent : Path.of(".")).resolve(defaultOutputFolderName());
    }

    public int getBoxSize() { return boxSize; }
    public void setBoxSize(int boxSize) { this.boxSize = boxSize; }

    public int getBoxStride() { return boxStride; }
    public void setBoxStride(int boxStride) { this.boxStride = boxStride; }

    public double getDetectionLevel() { return detectionLevel; }
    public void setDetectionLevel(double detectionLevel) { this.detectionLevel = detectionLevel; }

    public double getTimeWindow() { return timeWindow; }
    public void setTimeWindow(double timeWindow) { this.timeWindow = timeWindow; }

    public double getGoodTimeRatio() { return goodTimeRatio; }
    public void setGoodTimeRatio(double goodTimeRatio) { this.goodTimeRatio = goodTimeRatio; }

    public int getMaxThreads() { return maxThreads; }
    public void setMaxThreads(int maxThreads) { this.maxThreads = maxThreads; }

    public int getNeighbourhoodRadius() { return neighbourhoodRadius; }
    public void setNeighbourhoodRadius(int neighbourhoodRadius) { this.neighbourhoodRadius = neighbourhoodRadius; }

    public String getInstrument() { return instrument; }
    public void setInstrument(String instrument) { this.instrument = instrument; }

    public String getCreator() { return creator; }
    public void setCreator(String creator) { this.creator = creator; }

    public String getObservation() { return observation; }
    public void setObservation(String observation) { this.observation = observation; }

    public String getEventsFile() { return eventsFile; }
    public void setEventsFile(String eventsFile) { this.eventsFile = eventsFile; }

    public String getDeadTimeFile() { return deadTimeFile; }
    public void setDeadTimeFile(String deadTimeFile) { this.deadTimeFile = deadTimeFile; }

    public String getOutputDir() { return outputDir; }
    public void setOutputDir(String outputDir) { this.outputDir = outputDir; }

    public Astrometry getAstrometry() { return astrometry; }
    public void setAstrometry(Astrometry astrometry) { this.astrometry = astrometry; }

    /**
     * External raw-to-sky conversion.
     */
    public static class Astrometry {
        private boolean enabled = false;
        private List<String> command = new ArrayList<>(List.of(
                "edet2sky", "datastyle=user", "inputunit=raw",
                "X={rawx}", "Y={rawy}", "ccd={ccd}", "calinfoset={calinfoset}", "-V", "0"));
        private Map<String, String> environment = new LinkedHashMap<>();
        private String calibrationImage;
        @Min(1)
        private long timeoutSeconds = 15;

        public Duration timeout() {
            return Duration.ofSeconds(Math.max(1, timeoutSeconds));
        }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public List<String> getCommand() { return command; }
        public void setCommand(List<String> command) { this.command = command; }

        public Map<String, String> getEnvironment() { return environment; }
        public void setEnvironment(Map<String, String> environment) { this.environment = environment; }

        public String getCalibrationImage() { return calibrationImage; }
        public void setCalibrationImage(String calibrationImage) { this.calibrationImage = calibrationImage; }

        public long getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(long timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    }
}
