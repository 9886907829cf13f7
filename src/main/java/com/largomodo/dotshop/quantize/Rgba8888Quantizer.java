package com.largomodo.dotshop.quantize;

import com.largomodo.dotshop.core.ColorMode;
import com.largomodo.dotshop.core.PixelGrid;

/**
 * Keeps all four channels, alpha included, reordered from {@code 0xAARRGGBB} to
 * {@code 0xRRGGBBAA} so alpha packs last.
 */
public class Rgba8888Quantizer implements ColorQuantizer {

    @Override
    public ColorMode colorMode() {
        return ColorMode.RGBA8888;
    }

    @Override
    public boolean keepsAlpha() {
        return true;
    }

    @Override
    public PixelGrid quantize(int[] argb, int width, int height, QuantizerOptions options) {
        int[] samples = new int[argb.length];
        for (int i = 0; i < argb.length; i++) {
            samples[i] = (argb[i] << 8) | (argb[i] >>> 24);
        }
        return new PixelGrid(width, height, ColorMode.RGBA8888, samples);
    }
}
