package com.example.exod_detector.exception;

import java.nio.file.Path;

/**
 * An input file could not be read or is malformed. The run is aborted before any output is written.
 */
public class InputExtractionException extends DetectorException {

    public static final int EVENTS_EXIT_CODE = 65;
    public static final int DEAD_TIME_EXIT_CODE = 66;

    private final InputKind kind;

    public InputExtractionException(InputKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static InputExtractionException events(Path file, Throwable cause) {
        return new InputExtractionException(InputKind.EVENTS, "Impossible to extract photons from " + file, cause);
    }

    public static InputExtractionException deadTime(Path file, Throwable cause) {
        return new InputExtractionException(InputKind.DEAD_TIME, "Impossible to extract dead-time intervals from " + file, cause);
    }

    public InputKind getKind() {
        return kind;
    }

    @Override
    public int getExitCode() {
        return kind == InputKind.EVENTS ? EVENTS_EXIT_CODE : DEAD_TIME_EXIT_CODE;
    }

    public enum InputKind {
        EVENTS,
        DEAD_TIME
    }
}
