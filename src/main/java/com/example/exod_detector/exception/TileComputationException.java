package com.example.exod_detector.exception;

/**
 * A per-tile task failed. A missing tile breaks the mosaic geometry, so the whole run stops.
 */
public class TileComputationException extends DetectorException {

    public static final int EXIT_CODE = 70;

    private final int tileId;

    public TileComputationException(int tileId, String stage, Throwable cause) {
        super(stage + " failed on tile " + tileId + ": " + cause, cause);
        this.tileId = tileId;
    }

    public int getTileId() {
        return tileId;
    }

    @Override
    public int getExitCode() {
        return EXIT_CODE;
    }
}
