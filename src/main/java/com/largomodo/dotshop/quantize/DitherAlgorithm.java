package com.largomodo.dotshop.quantize;

/**
 * Monochrome reduction strategies. Every algorithm is deterministic; {@link #RANDOM} draws
 * from a generator seeded by {@link QuantizerOptions#seed()}.
 */
public enum DitherAlgorithm {
    /** Fixed luminance threshold, no dithering. */
    THRESHOLD,
    /** Ordered dithering with a 4x4 Bayer matrix. */
    BAYER_4X4,
    /** Ordered dithering with an 8x8 Bayer matrix. */
    BAYER_8X8,
    /** Error diffusion, 7/16 3/16 5/16 1/16 kernel. */
    FLOYD_STEINBERG,
    /** Error diffusion spreading 6/8 of the error, keeps highlights crisp on small OLEDs. */
    ATKINSON,
    /** Per-pixel random threshold, reproducible for a given seed. */
    RANDOM
}
