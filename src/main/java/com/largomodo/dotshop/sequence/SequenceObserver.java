package com.largomodo.dotshop.sequence;

import com.largomodo.dotshop.core.EncodedFrame;
import com.largomodo.dotshop.core.FrameDecodeGapException;

/**
 * Observer interface for frame sequencing events.
 * <p>
 * All methods have default no-op implementations, allowing consumers to override only the
 * events they care about. Callbacks run on the consumer thread, in frame order.
 *
 * @see FrameSequencer
 */
public interface SequenceObserver {

    SequenceObserver NONE = new SequenceObserver() {
    };

    /**
     * Called when a frame is released to the consumer.
     *
     * @param frame the encoded frame
     */
    default void onFrameEncoded(EncodedFrame frame) {}

    /**
     * Called when a corrupt frame is skipped.
     *
     * @param ordinal ordinal reported by the source
     * @param e       the decode failure
     */
    default void onFrameSkipped(long ordinal, FrameDecodeGapException e) {}

    /**
     * Called once the source reports end of stream and the corruption tolerance held.
     *
     * @param encoded number of frames released
     * @param skipped number of corrupt frames skipped
     */
    default void onComplete(long encoded, long skipped) {}
}
