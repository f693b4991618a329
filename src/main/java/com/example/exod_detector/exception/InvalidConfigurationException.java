package com.example.exod_detector.exception;

/**
 * Detector parameters are out of range or name an unsupported instrument.
 */
public class InvalidConfigurationException extends DetectorException {

    public static final int EXIT_CODE = 64;

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public static InvalidConfigurationException invalidParameter(String paramName, Object value, String expected) {
        return new InvalidConfigurationException(
                String.format("Invalid parameter '%s': got '%s', expected %s", paramName, value, expected));
    }

    @Override
    public int getExitCode() {
        return EXIT_CODE;
    }
}
