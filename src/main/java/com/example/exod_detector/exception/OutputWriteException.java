package com.example.exod_detector.exception;

import java.nio.file.Path;

public class OutputWriteException extends DetectorException {

    public static final int EXIT_CODE = 74;

    public OutputWriteException(Path target, Throwable cause) {
        super("Unable to write " + target, cause);
    }

    @Override
    public int getExitCode() {
        return EXIT_CODE;
    }
}
