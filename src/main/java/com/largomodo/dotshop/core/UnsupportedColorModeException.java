package com.largomodo.dotshop.core;

/**
 * Thrown when no quantizer strategy is registered for the profile's color mode.
 */
public class UnsupportedColorModeException extends ModulationException {

    private final ColorMode colorMode;

    public UnsupportedColorModeException(ColorMode colorMode, String profileId) {
        super("No quantizer registered for color mode " + colorMode, profileId, NO_FRAME, "quantize", null);
        this.colorMode = colorMode;
    }

    public ColorMode getColorMode() {
        return colorMode;
    }
}
