package com.largomodo.dotshop.core;

/**
 * Wraps an unexpected failure inside one per-frame stage (resample, quantize, pack, transform).
 */
public class FrameProcessingException extends ModulationException {

    public FrameProcessingException(String message, String profileId, long frameOrdinal, String stage, Throwable cause) {
        super(message, profileId, frameOrdinal, stage, cause);
    }
}
