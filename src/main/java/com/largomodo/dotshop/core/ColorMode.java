package com.largomodo.dotshop.core;

import java.util.Locale;

/**
 * Color encodings supported by target displays.
 * <p>
 * Each mode fixes the number of bits one quantized sample occupies in a packed buffer and the
 * value range of samples in a {@link PixelGrid}.
 */
public enum ColorMode {
    MONO("mono", 1),        // 1 bit, 0 = off, 1 = on
    GRAY4("gray4", 4),      // 16 luminance levels
    GRAY8("gray8", 8),      // 256 luminance levels
    RGB565("rgb565", 16),   // RRRRRGGG GGGBBBBB
    RGB888("rgb888", 24),   // RRRRRRRR GGGGGGGG BBBBBBBB
    RGBA8888("rgba8888", 32); // RRRRRRRR GGGGGGGG BBBBBBBB AAAAAAAA

    private final String id;
    private final int bitsPerPixel;

    ColorMode(String id, int bitsPerPixel) {
        this.id = id;
        this.bitsPerPixel = bitsPerPixel;
    }

    /**
     * Resolves a mode from its profile identifier ("mono", "gray4", ...), case-insensitive.
     *
     * @throws IllegalArgumentException if the identifier names no mode
     */
    public static ColorMode fromId(String id) {
        if (id == null) {
            throw new IllegalArgumentException("Color mode cannot be null. Supported: " + supportedIds());
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (ColorMode mode : values()) {
            if (mode.id.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Invalid color mode: " + id + ". Supported: " + supportedIds());
    }

    private static String supportedIds() {
        StringBuilder ids = new StringBuilder();
        for (ColorMode mode : values()) {
            if (ids.length() > 0) {
                ids.append(", ");
            }
            ids.append(mode.id);
        }
        return ids.toString();
    }

    public String getId() {
        return id;
    }

    public int getBitsPerPixel() {
        return bitsPerPixel;
    }

    /**
     * @return true if several samples share one byte (mono, gray4)
     */
    public boolean isSubByte() {
        return bitsPerPixel < 8;
    }

    /**
     * @return largest sample value a quantized grid may hold in this mode, read as unsigned;
     * rgba8888 uses all 32 bits of the int sample
     */
    public long maxSample() {
        return (1L << bitsPerPixel) - 1;
    }

    @Override
    public String toString() {
        return id;
    }
}
