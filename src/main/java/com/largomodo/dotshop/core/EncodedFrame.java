package com.largomodo.dotshop.core;

import java.util.Objects;

/**
 * Per-frame result of the sequencer: the final buffer plus the timing metadata of its source
 * frame.
 *
 * @param ordinal        Ordinal of the source frame
 * @param durationMs     Display duration copied from the source frame
 * @param buffer         Packed and transformed bytes
 * @param packedLength   Buffer length straight out of the packer, before transforms
 * @param sizePreserving True when every transform kept the length unchanged
 */
public record EncodedFrame(long ordinal, long durationMs, PackedBuffer buffer, int packedLength, boolean sizePreserving) {

    public EncodedFrame {
        Objects.requireNonNull(buffer, "buffer must not be null");
        if (sizePreserving && buffer.length() != packedLength) {
            throw new IllegalArgumentException("Size-preserving frame changed length from "
                    + packedLength + " to " + buffer.length());
        }
    }
}
