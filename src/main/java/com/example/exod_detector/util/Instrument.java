package com.example.exod_detector.util;

import com.example.exod_detector.exception.InvalidConfigurationException;
import com.example.exod_detector.mosaic.MosMosaicLayout;
import com.example.exod_detector.mosaic.MosaicLayout;
import com.example.exod_detector.mosaic.PnMosaicLayout;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Supported EPIC camera families. Each value fixes the CCD count, the raw grid of one CCD,
 * the mosaic recipe and the transform variant, so nothing downstream re-dispatches on a string.
 */
public enum Instrument {
    PN(12, 64, 200, PnMosaicLayout.INSTANCE, TransformVariant.EXPANDED_CANVAS),
    M1(7, 600, 600, MosMosaicLayout.MOS1, TransformVariant.FIXED_CANVAS),
    M2(7, 600, 600, MosMosaicLayout.MOS2, TransformVariant.FIXED_CANVAS);

    private final int tileCount;
    private final int tileRows;
    private final int tileCols;
    private final MosaicLayout layout;
    private final TransformVariant transformVariant;

    Instrument(int tileCount, int tileRows, int tileCols, MosaicLayout layout, TransformVariant transformVariant) {
        this.tileCount = tileCount;
        this.tileRows = tileRows;
        this.tileCols = tileCols;
        this.layout = layout;
        this.transformVariant = transformVariant;
    }

    public int tileCount() {
        return tileCount;
    }

    /** Raw X extent of one CCD. */
    public int tileRows() {
        return tileRows;
    }

    /** Raw Y extent of one CCD. */
    public int tileCols() {
        return tileCols;
    }

    public MosaicLayout layout() {
        return layout;
    }

    public TransformVariant transformVariant() {
        return transformVariant;
    }

    /**
     * Resolves an instrument code case-insensitively.
     *
     * @throws InvalidConfigurationException for blank or unknown codes.
     */
    public static Instrument fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw InvalidConfigurationException.invalidParameter("instrument", code, supported());
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        for (Instrument instrument : values()) {
            if (instrument.name().equals(normalized)) {
                return instrument;
            }
        }
        throw InvalidConfigurationException.invalidParameter("instrument", code, supported());
    }

    private static String supported() {
        return "one of " + Arrays.stream(values()).map(Enum::name).collect(Collectors.joining(", "));
    }
}
