package com.largomodo.dotshop.core;

import java.util.Objects;

/**
 * One decoded frame in source order.
 *
 * @param image      Decoded pixels
 * @param durationMs Display duration in milliseconds, 0 for static content
 * @param ordinal    0-based position in the source's temporal order
 */
public record SourceFrame(SourceImage image, long durationMs, long ordinal) {

    public SourceFrame {
        Objects.requireNonNull(image, "image must not be null");
        if (durationMs < 0) {
            throw new IllegalArgumentException("durationMs must not be negative, got: " + durationMs);
        }
        if (ordinal < 0) {
            throw new IllegalArgumentException("ordinal must not be negative, got: " + ordinal);
        }
    }

    /**
     * Creates the single frame of static content (text, still image).
     */
    public static SourceFrame still(SourceImage image) {
        return new SourceFrame(image, 0, 0);
    }
}
