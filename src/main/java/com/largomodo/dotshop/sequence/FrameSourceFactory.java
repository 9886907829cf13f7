package com.largomodo.dotshop.sequence;

import java.io.IOException;

/**
 * Opens a fresh {@link FrameSource} positioned at the first frame. Restartable sequences
 * re-open their source through this factory on every iteration.
 */
@FunctionalInterface
public interface FrameSourceFactory {

    FrameSource open() throws IOException;
}
