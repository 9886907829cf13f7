package com.largomodo.dotshop.quantize;

import com.largomodo.dotshop.core.ColorMode;
import com.largomodo.dotshop.core.PixelGrid;

/**
 * Truncates each channel to its 565 bit depth ({@code r >> 3}, {@code g >> 2}, {@code b >> 3})
 * and combines them into {@code RRRRRGGGGGGBBBBB}. Truncation, not rounding, matches what
 * common embedded display libraries do.
 */
public class Rgb565Quantizer implements ColorQuantizer {

    @Override
    public ColorMode colorMode() {
        return ColorMode.RGB565;
    }

    @Override
    public PixelGrid quantize(int[] rgb, int width, int height, QuantizerOptions options) {
        int[] samples = new int[rgb.length];
        for (int i = 0; i < rgb.length; i++) {
            samples[i] = toRgb565(rgb[i]);
        }
        return new PixelGrid(width, height, ColorMode.RGB565, samples);
    }

    static int toRgb565(int rgb) {
        int r = (rgb >> 19) & 0x1F;
        int g = (rgb >> 10) & 0x3F;
        int b = (rgb >> 3) & 0x1F;
        return (r << 11) | (g << 5) | b;
    }
}
