package com.largomodo.dotshop.core;

import java.util.Arrays;
import java.util.Objects;

/**
 * Quantized pixels at the target resolution, one integer sample per pixel in row-major order.
 * <p>
 * Sample meaning depends on the color mode: mono 0/1, gray4 0..15, gray8 0..255, rgb565 the
 * 16-bit {@code RRRRRGGGGGGBBBBB} word, rgb888 the 24-bit {@code 0xRRGGBB} word, rgba8888 the
 * 32-bit {@code 0xRRGGBBAA} word (negative as a Java int when red is 0x80 or more). Samples are
 * range-checked as unsigned values on construction, so a grid always fits its mode.
 */
public final class PixelGrid {

    private final int width;
    private final int height;
    private final ColorMode colorMode;
    private final int[] samples;

    /**
     * @param samples {@code width * height} samples; copied
     * @throws IllegalArgumentException if dimensions disagree or a sample is out of range
     */
    public PixelGrid(int width, int height, ColorMode colorMode, int[] samples) {
        Objects.requireNonNull(colorMode, "colorMode must not be null");
        Objects.requireNonNull(samples, "samples must not be null");
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Grid dimensions must be positive, got: " + width + "x" + height);
        }
        if (samples.length != width * height) {
            throw new IllegalArgumentException(
                    "Sample count " + samples.length + " does not match " + width + "x" + height);
        }
        long max = colorMode.maxSample();
        for (int i = 0; i < samples.length; i++) {
            if (Integer.toUnsignedLong(samples[i]) > max) {
                throw new IllegalArgumentException(String.format(
                        "Sample %d at index %d is out of range for %s (0..%d)", samples[i], i, colorMode, max));
            }
        }
        this.width = width;
        this.height = height;
        this.colorMode = colorMode;
        this.samples = samples.clone();
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public ColorMode getColorMode() {
        return colorMode;
    }

    public int get(int x, int y) {
        if (x < 0 || x >= width || y < 0 || y >= height) {
            throw new IndexOutOfBoundsException(
                    "Coordinate (" + x + ", " + y + ") outside " + width + "x" + height);
        }
        return samples[y * width + x];
    }

    /**
     * @param index row-major index {@code y * width + x}
     */
    public int sample(int index) {
        return samples[index];
    }

    public int[] toArray() {
        return samples.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PixelGrid that = (PixelGrid) o;
        return width == that.width && height == that.height
                && colorMode == that.colorMode && Arrays.equals(samples, that.samples);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(width, height, colorMode) + Arrays.hashCode(samples);
    }

    @Override
    public String toString() {
        return "PixelGrid{" + width + "x" + height + ", mode=" + colorMode + '}';
    }
}
