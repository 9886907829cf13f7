package com.largomodo.dotshop.core;

/**
 * Thrown when the share of skipped corrupt frames exceeds the configured tolerance.
 * Fails the whole sequence.
 */
public class ExcessiveFrameCorruptionException extends ModulationException {

    private final long corruptFrames;
    private final long totalFrames;
    private final double tolerance;

    public ExcessiveFrameCorruptionException(String profileId, long corruptFrames, long totalFrames, double tolerance) {
        super(String.format("%d of %d frames were corrupt, exceeding tolerance %.2f",
                        corruptFrames, totalFrames, tolerance),
                profileId, NO_FRAME, "sequence", null);
        this.corruptFrames = corruptFrames;
        this.totalFrames = totalFrames;
        this.tolerance = tolerance;
    }

    public long getCorruptFrames() {
        return corruptFrames;
    }

    public long getTotalFrames() {
        return totalFrames;
    }

    public double getTolerance() {
        return tolerance;
    }
}
