package com.largomodo.dotshop.quantize;

/**
 * Integer color helpers shared by the quantizer strategies.
 */
public final class ColorMath {

    private ColorMath() {
    }

    /**
     * BT.601 luma in integer arithmetic: {@code (299 R + 587 G + 114 B + 500) / 1000}.
     *
     * @param rgb color as {@code 0xRRGGBB}; alpha bits are ignored
     * @return luminance 0..255
     */
    public static int luminance(int rgb) {
        int r = (rgb >> 16) & 0xFF;
        int g = (rgb >> 8) & 0xFF;
        int b = rgb & 0xFF;
        return (299 * r + 587 * g + 114 * b + 500) / 1000;
    }

    /**
     * Composites an ARGB pixel over an opaque background. Fully opaque pixels pass through
     * unchanged, fully transparent ones become the background.
     *
     * @return opaque {@code 0xRRGGBB}
     */
    public static int composite(int argb, int background) {
        int alpha = (argb >>> 24) & 0xFF;
        if (alpha == 0xFF) {
            return argb & 0xFFFFFF;
        }
        if (alpha == 0) {
            return background & 0xFFFFFF;
        }
        int r = blend((argb >> 16) & 0xFF, (background >> 16) & 0xFF, alpha);
        int g = blend((argb >> 8) & 0xFF, (background >> 8) & 0xFF, alpha);
        int b = blend(argb & 0xFF, background & 0xFF, alpha);
        return (r << 16) | (g << 8) | b;
    }

    private static int blend(int fg, int bg, int alpha) {
        return (fg * alpha + bg * (255 - alpha) + 127) / 255;
    }

    /**
     * Requantizes an 8-bit luminance to {@code levels} evenly spaced levels, rounding to the
     * nearest level with ties rounding up: {@code floor((2 * lum * (levels - 1) + 255) / 510)}.
     */
    public static int requantize(int luminance, int levels) {
        return (2 * luminance * (levels - 1) + 255) / 510;
    }

    static int clamp(int value) {
        if (value < 0) return 0;
        if (value > 255) return 255;
        return value;
    }
}
