package com.largomodo.dotshop.emit;

import com.largomodo.dotshop.core.EncodedFrame;
import com.largomodo.dotshop.core.PackedBuffer;
import com.largomodo.dotshop.core.ScreenProfile;

import java.util.List;

/**
 * Renders encoded frames as source code of one target language. Adding a target means adding
 * one implementation and registering it with an {@link EmitterRegistry}.
 */
public interface FormatEmitter {

    /**
     * @return lowercase registry id, e.g. "c"
     */
    String targetId();

    /**
     * Renders one named array or literal holding the buffer's bytes.
     */
    String renderBuffer(String name, PackedBuffer buffer, EmissionRequest request);

    /**
     * Renders a complete source file: header comment, one array per frame and, for more than
     * one frame, a frame table with durations.
     *
     * @param frames Frames in display order, at least one
     */
    EmissionResult emit(List<EncodedFrame> frames, ScreenProfile profile, EmissionRequest request);
}
