package com.example.exod_detector.exception;

import org.springframework.boot.ExitCodeGenerator;

/**
 * Base unchecked exception for errors that abort a detection run.
 *
 * <p>Every subtype carries the process exit code Spring Boot reports when the exception
 * escapes the command-line runner.
 */
public abstract class DetectorException extends RuntimeException implements ExitCodeGenerator {

    protected DetectorException(String message) {
        super(message);
    }

    protected DetectorException(String message, Throwable cause) {
        super(message, cause);
    }
}
