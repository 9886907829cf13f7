package com.largomodo.dotshop.quantize;

import com.largomodo.dotshop.core.ColorMode;
import com.largomodo.dotshop.core.PixelGrid;

/**
 * Keeps the full 8 bits per channel; only strips alpha.
 */
public class Rgb888Quantizer implements ColorQuantizer {

    @Override
    public ColorMode colorMode() {
        return ColorMode.RGB888;
    }

    @Override
    public PixelGrid quantize(int[] rgb, int width, int height, QuantizerOptions options) {
        int[] samples = new int[rgb.length];
        for (int i = 0; i < rgb.length; i++) {
            samples[i] = rgb[i] & 0xFFFFFF;
        }
        return new PixelGrid(width, height, ColorMode.RGB888, samples);
    }
}
