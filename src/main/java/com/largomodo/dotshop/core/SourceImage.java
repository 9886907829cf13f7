package com.largomodo.dotshop.core;

import java.util.Arrays;
import java.util.Objects;

/**
 * Decoded source pixels as delivered by a frame source, at any resolution.
 * <p>
 * Pixels are packed ARGB ({@code 0xAARRGGBB}) in row-major order. The array is not copied;
 * producers hand over ownership and must not mutate it afterwards.
 *
 * @param width  Width in pixels, positive
 * @param height Height in pixels, positive
 * @param argb   {@code width * height} ARGB pixels
 */
public record SourceImage(int width, int height, int[] argb) {

    public SourceImage {
        Objects.requireNonNull(argb, "argb must not be null");
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Image dimensions must be positive, got: " + width + "x" + height);
        }
        if (argb.length != width * height) {
            throw new IllegalArgumentException(
                    "Pixel count " + argb.length + " does not match " + width + "x" + height);
        }
    }

    /**
     * Creates an image filled with one ARGB color.
     */
    public static SourceImage filled(int width, int height, int argbColor) {
        int[] pixels = new int[width * height];
        Arrays.fill(pixels, argbColor);
        return new SourceImage(width, height, pixels);
    }

    public int pixel(int x, int y) {
        return argb[y * width + x];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SourceImage that = (SourceImage) o;
        return width == that.width && height == that.height && Arrays.equals(argb, that.argb);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(width, height) + Arrays.hashCode(argb);
    }

    @Override
    public String toString() {
        return "SourceImage{" + width + "x" + height + '}';
    }
}
