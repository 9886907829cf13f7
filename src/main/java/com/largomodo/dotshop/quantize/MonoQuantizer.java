package com.largomodo.dotshop.quantize;

import com.largomodo.dotshop.core.ColorMode;
import com.largomodo.dotshop.core.PixelGrid;

import java.util.Random;

/**
 * Reduces pixels to 1-bit on/off samples, with optional ordered or error-diffusion dithering.
 * <p>
 * A pixel is on (1) when its (possibly dither-adjusted) luminance is at or above the
 * threshold. Error diffusion works on integer luminance with truncating division, so identical
 * input always produces identical output.
 */
public class MonoQuantizer implements ColorQuantizer {

    private static final int[][] BAYER_4X4 = {
            {0, 8, 2, 10},
            {12, 4, 14, 6},
            {3, 11, 1, 9},
            {15, 7, 13, 5}
    };

    private static final int[][] BAYER_8X8 = {
            {0, 32, 8, 40, 2, 34, 10, 42},
            {48, 16, 56, 24, 50, 18, 58, 26},
            {12, 44, 4, 36, 14, 46, 6, 38},
            {60, 28, 52, 20, 62, 30, 54, 22},
            {3, 35, 11, 43, 1, 33, 9, 41},
            {51, 19, 59, 27, 49, 17, 57, 25},
            {15, 47, 7, 39, 13, 45, 5, 37},
            {63, 31, 55, 23, 61, 29, 53, 21}
    };

    @Override
    public ColorMode colorMode() {
        return ColorMode.MONO;
    }

    @Override
    public PixelGrid quantize(int[] rgb, int width, int height, QuantizerOptions options) {
        int[] luma = new int[rgb.length];
        for (int i = 0; i < rgb.length; i++) {
            luma[i] = ColorMath.luminance(rgb[i]);
        }

        int[] bits = switch (options.dither()) {
            case THRESHOLD -> threshold(luma, options.threshold());
            case BAYER_4X4 -> ordered(luma, width, height, options.threshold(), BAYER_4X4);
            case BAYER_8X8 -> ordered(luma, width, height, options.threshold(), BAYER_8X8);
            case FLOYD_STEINBERG -> floydSteinberg(luma, width, height, options.threshold());
            case ATKINSON -> atkinson(luma, width, height, options.threshold());
            case RANDOM -> random(luma, options.seed());
        };

        if (options.invert()) {
            for (int i = 0; i < bits.length; i++) {
                bits[i] ^= 1;
            }
        }
        return new PixelGrid(width, height, ColorMode.MONO, bits);
    }

    private int[] threshold(int[] luma, int threshold) {
        int[] bits = new int[luma.length];
        for (int i = 0; i < luma.length; i++) {
            bits[i] = luma[i] >= threshold ? 1 : 0;
        }
        return bits;
    }

    /**
     * Matrix cell {@code m} of an n x n matrix shifts the threshold by
     * {@code (2m + 1) * 256 / (2n²) - 128}, spreading thresholds evenly around the configured one.
     */
    private int[] ordered(int[] luma, int width, int height, int threshold, int[][] matrix) {
        int n = matrix.length;
        int cells = n * n;
        int[] bits = new int[luma.length];
        for (int y = 0; y < height; y++) {
            int[] matrixRow = matrix[y % n];
            for (int x = 0; x < width; x++) {
                int local = threshold + ((2 * matrixRow[x % n] + 1) * 256) / (2 * cells) - 128;
                int i = y * width + x;
                bits[i] = luma[i] >= local ? 1 : 0;
            }
        }
        return bits;
    }

    private int[] floydSteinberg(int[] luma, int width, int height, int threshold) {
        int[] work = luma.clone();
        int[] bits = new int[luma.length];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int i = y * width + x;
                int old = ColorMath.clamp(work[i]);
                int on = old >= threshold ? 1 : 0;
                bits[i] = on;
                int error = old - (on == 1 ? 255 : 0);

                // Right 7/16, below-left 3/16, below 5/16, below-right 1/16
                if (x + 1 < width) {
                    work[i + 1] += error * 7 / 16;
                }
                if (y + 1 < height) {
                    if (x > 0) {
                        work[i + width - 1] += error * 3 / 16;
                    }
                    work[i + width] += error * 5 / 16;
                    if (x + 1 < width) {
                        work[i + width + 1] += error / 16;
                    }
                }
            }
        }
        return bits;
    }

    private int[] atkinson(int[] luma, int width, int height, int threshold) {
        int[] work = luma.clone();
        int[] bits = new int[luma.length];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int i = y * width + x;
                int old = ColorMath.clamp(work[i]);
                int on = old >= threshold ? 1 : 0;
                bits[i] = on;
                int share = (old - (on == 1 ? 255 : 0)) / 8;

                // 1/8 each to x+1, x+2, (x-1, x, x+1) on the next row, x two rows down
                if (x + 1 < width) work[i + 1] += share;
                if (x + 2 < width) work[i + 2] += share;
                if (y + 1 < height) {
                    if (x > 0) work[i + width - 1] += share;
                    work[i + width] += share;
                    if (x + 1 < width) work[i + width + 1] += share;
                }
                if (y + 2 < height) work[i + 2 * width] += share;
            }
        }
        return bits;
    }

    /**
     * Thresholds each pixel at a uniform draw from 1..255: black stays off, white stays on.
     */
    private int[] random(int[] luma, long seed) {
        Random generator = new Random(seed);
        int[] bits = new int[luma.length];
        for (int i = 0; i < luma.length; i++) {
            bits[i] = luma[i] >= generator.nextInt(255) + 1 ? 1 : 0;
        }
        return bits;
    }
}
