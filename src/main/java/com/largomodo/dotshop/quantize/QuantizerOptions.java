package com.largomodo.dotshop.quantize;

import java.util.Objects;

/**
 * Tuning knobs of the quantizer. Immutable and shared across frame workers.
 *
 * @param dither     Monochrome strategy
 * @param threshold  Luminance at or above which a mono pixel is on, 0..255 (default 128)
 * @param seed       Generator seed, required for {@link DitherAlgorithm#RANDOM}, otherwise ignored
 * @param invert     Flip mono output (1 = dark) for displays whose lit state is 0
 * @param background Opaque RGB color transparent pixels are composited against
 */
public record QuantizerOptions(DitherAlgorithm dither, int threshold, Long seed, boolean invert, int background) {

    public static final int DEFAULT_THRESHOLD = 128;

    public QuantizerOptions {
        Objects.requireNonNull(dither, "dither must not be null");
        if (threshold < 0 || threshold > 255) {
            throw new IllegalArgumentException("threshold must be within 0..255, got: " + threshold);
        }
        if (dither == DitherAlgorithm.RANDOM && seed == null) {
            throw new IllegalArgumentException("RANDOM dithering requires an explicit seed");
        }
        background &= 0xFFFFFF;
    }

    /**
     * Threshold 128, no dithering, black background.
     */
    public static QuantizerOptions defaults() {
        return new QuantizerOptions(DitherAlgorithm.THRESHOLD, DEFAULT_THRESHOLD, null, false, 0x000000);
    }

    public QuantizerOptions withDither(DitherAlgorithm algorithm) {
        return new QuantizerOptions(algorithm, threshold, seed, invert, background);
    }

    public QuantizerOptions withSeed(long randomSeed) {
        return new QuantizerOptions(dither, threshold, randomSeed, invert, background);
    }
}
