package com.largomodo.dotshop.quantize;

import com.largomodo.dotshop.core.ColorMode;
import com.largomodo.dotshop.core.PixelGrid;

/**
 * Linear requantization of luminance to the levels of a grayscale mode, rounding to the
 * nearest level with ties rounding up.
 */
public class GrayscaleQuantizer implements ColorQuantizer {

    private final ColorMode mode;
    private final int levels;

    /**
     * @param mode {@link ColorMode#GRAY4} (16 levels) or {@link ColorMode#GRAY8} (256 levels)
     */
    public GrayscaleQuantizer(ColorMode mode) {
        if (mode != ColorMode.GRAY4 && mode != ColorMode.GRAY8) {
            throw new IllegalArgumentException("Not a grayscale mode: " + mode);
        }
        this.mode = mode;
        this.levels = (int) mode.maxSample() + 1;
    }

    @Override
    public ColorMode colorMode() {
        return mode;
    }

    @Override
    public PixelGrid quantize(int[] rgb, int width, int height, QuantizerOptions options) {
        int[] samples = new int[rgb.length];
        for (int i = 0; i < rgb.length; i++) {
            samples[i] = ColorMath.requantize(ColorMath.luminance(rgb[i]), levels);
        }
        return new PixelGrid(width, height, mode, samples);
    }
}
