package com.largomodo.dotshop.quantize;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ColorQuantizerTest {

    @Test
    void rgb565TruncatesChannels() {
        int[] pixels = {0xFF0000, 0x00FF00, 0x0000FF, 0xFFFFFF, 0x070307, 0xF8FCF8};

        int[] samples = new Rgb565Quantizer().quantize(pixels, 6, 1, QuantizerOptions.defaults()).toArray();

        assertArrayEquals(new int[]{0xF800, 0x07E0, 0x001F, 0xFFFF, 0x0000, 0xFFFF}, samples);
    }

    @Test
    void rgb565KeepsHighBitsOfEachChannel() {
        // r = 0x8F >> 3 = 0x11, g = 0x4D >> 2 = 0x13, b = 0x21 >> 3 = 0x04
        assertEquals((0x11 << 11) | (0x13 << 5) | 0x04, Rgb565Quantizer.toRgb565(0x8F4D21));
    }

    @Test
    void rgb888PassesColorsThrough() {
        int[] samples = new Rgb888Quantizer().quantize(new int[]{0x123456, 0xABCDEF}, 2, 1,
                QuantizerOptions.defaults()).toArray();

        assertArrayEquals(new int[]{0x123456, 0xABCDEF}, samples);
    }

    @Test
    void rgba8888MovesAlphaToTheLowByte() {
        Rgba8888Quantizer quantizer = new Rgba8888Quantizer();

        int[] samples = quantizer.quantize(new int[]{0x80112233, 0xFFAABBCC, 0x00000000}, 3, 1,
                QuantizerOptions.defaults()).toArray();

        assertTrue(quantizer.keepsAlpha());
        assertArrayEquals(new int[]{0x11223380, 0xAABBCCFF, 0x00000000}, samples);
    }

    @Test
    void luminanceUsesBt601Weights() {
        assertEquals(255, ColorMath.luminance(0xFFFFFF));
        assertEquals(0, ColorMath.luminance(0x000000));
        assertEquals(76, ColorMath.luminance(0xFF0000));
        assertEquals(150, ColorMath.luminance(0x00FF00));
        assertEquals(29, ColorMath.luminance(0x0000FF));
    }

    @Test
    void compositeBlendsAlphaOverBackground() {
        assertEquals(0xFFFFFF, ColorMath.composite(0x00123456, 0xFFFFFF));
        assertEquals(0x123456, ColorMath.composite(0xFF123456, 0xFFFFFF));
        assertEquals(0x808080, ColorMath.composite(0x80FFFFFF, 0x000000));
    }
}
