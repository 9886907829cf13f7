package com.largomodo.dotshop.quantize;

import com.largomodo.dotshop.core.ColorMode;
import com.largomodo.dotshop.core.PixelGrid;

/**
 * Strategy reducing opaque RGB pixels to the samples of one color mode. Strategies that
 * {@linkplain #keepsAlpha() keep alpha} receive the resampled ARGB pixels instead.
 */
public interface ColorQuantizer {

    /**
     * @return the color mode this strategy produces
     */
    ColorMode colorMode();

    /**
     * @return true if the mode stores alpha, so pixels must not be composited over the background
     */
    default boolean keepsAlpha() {
        return false;
    }

    /**
     * Quantizes pixels already resampled to the target resolution.
     *
     * @param rgb     {@code width * height} pixels, row-major: opaque {@code 0xRRGGBB}, or
     *                {@code 0xAARRGGBB} when {@link #keepsAlpha()}
     * @param options Quantizer tuning
     * @return grid in {@link #colorMode()}
     */
    PixelGrid quantize(int[] rgb, int width, int height, QuantizerOptions options);
}
