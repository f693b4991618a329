package com.example.exod_detector.model;

/**
 * Detected variable source.
 * <p>
 * Raw fields come from region detection; {@code x}, {@code y}, {@code ra} and {@code dec} stay
 * {@code null} until the astrometry collaborator resolves them.
 */
public record Source(int id,
                     int tileId,
                     double rawX,
                     double rawY,
                     double radiusRaw,
                     double radiusSky,
                     double radiusArcsec,
                     double varRawX,
                     double varRawY,
                     double photonCount,
                     Double x,
                     Double y,
                     Double ra,
                     Double dec) {

    public Source {
        if (radiusRaw < 0 || radiusSky < 0 || radiusArcsec < 0) {
            throw new IllegalArgumentException("Source " + id + " has a negative radius");
        }
    }

    public boolean hasSkyPosition() {
        return ra != null && dec != null;
    }

    public Source withSkyPosition(SkyPosition position) {
        return new Source(id, tileId, rawX, rawY, radiusRaw, radiusSky, radiusArcsec, varRawX, varRawY, photonCount,
                position.x(), position.y(), position.ra(), position.dec());
    }
}
