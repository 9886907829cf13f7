package com.largomodo.dotshop.sequence;

import com.largomodo.dotshop.core.SourceFrame;

import java.io.IOException;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Pull-based supplier of decoded frames in source order.
 * <p>
 * Decoding belongs to the implementation; the sequencer only pulls. A source is single-pass;
 * use a {@link FrameSourceFactory} when the sequence must be replayable.
 */
public interface FrameSource extends AutoCloseable {

    /**
     * Pulls the next frame. May block on I/O.
     *
     * @return the next frame, or empty at end of stream
     * @throws com.largomodo.dotshop.core.FrameDecodeGapException if the next frame is corrupt;
     *                                                              the source stays usable and the following call moves past it
     * @throws IOException                                          on unrecoverable read failure
     */
    Optional<SourceFrame> next() throws IOException;

    /**
     * @return total number of frames including corrupt ones, or empty when unknown up front
     */
    default OptionalLong frameCount() {
        return OptionalLong.empty();
    }

    @Override
    default void close() throws IOException {
    }
}
