package com.largomodo.dotshop.quantize;

import com.largomodo.dotshop.core.ColorMode;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GrayscaleQuantizerTest {

    @Test
    void gray4RoundsToNearestLevel() {
        GrayscaleQuantizer gray4 = new GrayscaleQuantizer(ColorMode.GRAY4);
        // luminance 8 is 0.47 of a step, 9 is 0.53
        int[] pixels = {0x000000, 0x080808, 0x090909, 0xFFFFFF};

        assertArrayEquals(new int[]{0, 0, 1, 15},
                gray4.quantize(pixels, 4, 1, QuantizerOptions.defaults()).toArray());
    }

    @Test
    void requantizeRoundsTiesUp() {
        // 3 levels: step 127.5, luminance 64 is 0.502 of a step, 63 is 0.494
        assertEquals(1, ColorMath.requantize(64, 3));
        assertEquals(0, ColorMath.requantize(63, 3));
        // 2 levels: the midpoint 127.5 falls between 127 and 128
        assertEquals(1, ColorMath.requantize(128, 2));
        assertEquals(0, ColorMath.requantize(127, 2));
    }

    @Property
    void gray8KeepsLuminance(@ForAll @IntRange(min = 0, max = 255) int level) {
        GrayscaleQuantizer gray8 = new GrayscaleQuantizer(ColorMode.GRAY8);
        int rgb = level * 0x010101;

        assertEquals(level, gray8.quantize(new int[]{rgb}, 1, 1, QuantizerOptions.defaults()).sample(0));
    }

    @Test
    void rejectsNonGrayMode() {
        assertThrows(IllegalArgumentException.class, () -> new GrayscaleQuantizer(ColorMode.RGB565));
    }
}
