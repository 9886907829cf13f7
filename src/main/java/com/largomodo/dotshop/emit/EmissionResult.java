package com.largomodo.dotshop.emit;

import java.util.List;
import java.util.Objects;

/**
 * Emitted source text plus the metadata a sink needs without parsing it.
 *
 * @param targetId    Language the text was rendered for
 * @param text        Complete source text
 * @param bufferSizes Byte size of each emitted buffer, in frame order
 */
public record EmissionResult(String targetId, String text, List<Integer> bufferSizes) {

    public EmissionResult {
        Objects.requireNonNull(targetId, "targetId must not be null");
        Objects.requireNonNull(text, "text must not be null");
        bufferSizes = List.copyOf(bufferSizes);
    }

    public int bufferCount() {
        return bufferSizes.size();
    }

    public long totalBytes() {
        return bufferSizes.stream().mapToLong(Integer::longValue).sum();
    }
}
