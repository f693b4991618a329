package com.example.exod_detector.engine;

import com.example.exod_detector.engine.Interfaces.SkyCoordinateResolver;
import com.example.exod_detector.model.SkyPosition;

import java.util.Optional;

/**
 * Used when astrometry is disabled; every source keeps empty sky fields.
 */
public class NoopSkyCoordinateResolver implements SkyCoordinateResolver {

    @Override
    public Optional<SkyPosition> resolve(double rawX, double rawY, int tileId, AstrometryContext context) {
        return Optional.empty();
    }
}
