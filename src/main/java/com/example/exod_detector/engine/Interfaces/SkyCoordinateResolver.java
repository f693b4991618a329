package com.example.exod_detector.engine.Interfaces;

import com.example.exod_detector.engine.AstrometryContext;
import com.example.exod_detector.model.SkyPosition;

import java.util.Optional;

/**
 * Converts raw detector coordinates of a source into sky coordinates.
 * <p>
 * Callers pass the raw centroid ({@code Source.rawX/rawY}); the variability-frame position
 * ({@code varRawX/varRawY}) is only written to the outputs.
 */
public interface SkyCoordinateResolver {

    /**
     * Resolves one position. Implementations never throw for a failed conversion.
     *
     * @param rawX    raw X on the tile.
     * @param rawY    raw Y on the tile.
     * @param tileId  zero-based CCD index.
     * @param context observation-level calibration context.
     * @return sky position, or empty on timeout or unusable output.
     */
    Optional<SkyPosition> resolve(double rawX, double rawY, int tileId, AstrometryContext context);
}
