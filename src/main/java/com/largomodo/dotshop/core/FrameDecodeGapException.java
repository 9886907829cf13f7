package com.largomodo.dotshop.core;

/**
 * Signals a missing or corrupt frame reported by a frame source.
 * <p>
 * Recoverable: the sequencer skips the frame, logs a warning and continues. The source must
 * remain usable after throwing this exception.
 */
public class FrameDecodeGapException extends ModulationException {

    public FrameDecodeGapException(String message, long frameOrdinal) {
        super(message, null, frameOrdinal, "decode", null);
    }

    public FrameDecodeGapException(String message, long frameOrdinal, Throwable cause) {
        super(message, null, frameOrdinal, "decode", cause);
    }
}
