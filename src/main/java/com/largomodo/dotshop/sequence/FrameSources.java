package com.largomodo.dotshop.sequence;

import com.largomodo.dotshop.core.SourceFrame;

import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * In-memory frame sources.
 */
public final class FrameSources {

    private FrameSources() {
    }

    /**
     * @return restartable factory replaying the frames in the given order
     */
    public static FrameSourceFactory of(SourceFrame... frames) {
        return of(List.of(frames));
    }

    public static FrameSourceFactory of(List<SourceFrame> frames) {
        List<SourceFrame> copy = List.copyOf(frames);
        return () -> {
            Iterator<SourceFrame> iterator = copy.iterator();
            return () -> iterator.hasNext() ? Optional.of(iterator.next()) : Optional.empty();
        };
    }
}
