package com.largomodo.dotshop.sequence;

/**
 * Sequencer policy knobs.
 *
 * @param lookAhead           Maximum frames pulled from the source but not yet released to the consumer
 * @param workers             Worker threads for per-frame encoding; 1 runs everything on the consumer thread
 * @param corruptionTolerance Maximum ratio of skipped corrupt frames to frames read, 0.0..1.0
 */
public record SequencerOptions(int lookAhead, int workers, double corruptionTolerance) {

    public static final int DEFAULT_LOOK_AHEAD = 1;
    public static final int DEFAULT_WORKERS = 1;
    public static final double DEFAULT_CORRUPTION_TOLERANCE = 0.10;

    public SequencerOptions {
        if (lookAhead < 1) {
            throw new IllegalArgumentException("lookAhead must be at least 1, got: " + lookAhead);
        }
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be at least 1, got: " + workers);
        }
        if (Double.isNaN(corruptionTolerance) || corruptionTolerance < 0.0 || corruptionTolerance > 1.0) {
            throw new IllegalArgumentException("corruptionTolerance must be within 0.0..1.0, got: " + corruptionTolerance);
        }
    }

    public static SequencerOptions defaults() {
        return new SequencerOptions(DEFAULT_LOOK_AHEAD, DEFAULT_WORKERS, DEFAULT_CORRUPTION_TOLERANCE);
    }
}
