package com.largomodo.dotshop.quantize;

import com.largomodo.dotshop.core.ColorMode;
import com.largomodo.dotshop.core.PixelGrid;
import com.largomodo.dotshop.core.ScreenProfile;
import com.largomodo.dotshop.core.SourceImage;
import com.largomodo.dotshop.core.UnsupportedColorModeException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class QuantizerTest {

    private final ScreenProfile mono4x4 = ScreenProfile.of("mono4x4", 4, 4, ColorMode.MONO);

    @Test
    void upscalesWithNearestNeighbour() {
        SourceImage source = new SourceImage(2, 2, new int[]{
                0xFFFFFFFF, 0xFF000000,
                0xFF000000, 0xFFFFFFFF});

        PixelGrid grid = Quantizer.create(QuantizerOptions.defaults()).quantize(source, mono4x4);

        assertArrayEquals(new int[]{
                1, 1, 0, 0,
                1, 1, 0, 0,
                0, 0, 1, 1,
                0, 0, 1, 1}, grid.toArray());
    }

    @Test
    void downscalePicksPixelCentres() {
        Resampler resampler = new Resampler();
        SourceImage source = new SourceImage(4, 1, new int[]{1, 2, 3, 4});

        assertArrayEquals(new int[]{2, 4}, resampler.resize(source, 2, 1).argb());
    }

    @Test
    void transparentPixelsTakeBackgroundColor() {
        SourceImage transparent = SourceImage.filled(4, 4, 0x00000000);
        QuantizerOptions whiteBackground = new QuantizerOptions(DitherAlgorithm.THRESHOLD, 128, null, false, 0xFFFFFF);

        PixelGrid onWhite = Quantizer.create(whiteBackground).quantize(transparent, mono4x4);
        PixelGrid onBlack = Quantizer.create(QuantizerOptions.defaults()).quantize(transparent, mono4x4);

        assertEquals(16, Arrays.stream(onWhite.toArray()).sum());
        assertEquals(0, Arrays.stream(onBlack.toArray()).sum());
    }

    @Test
    void outputAlwaysMatchesProfileModeAndSize() {
        ScreenProfile tft = ScreenProfile.of("tft", 3, 2, ColorMode.RGB565);

        PixelGrid grid = Quantizer.create(QuantizerOptions.defaults()).quantize(SourceImage.filled(7, 5, 0xFFFF0000), tft);

        assertEquals(3, grid.getWidth());
        assertEquals(2, grid.getHeight());
        assertEquals(ColorMode.RGB565, grid.getColorMode());
        assertEquals(0xF800, grid.get(2, 1));
    }

    @Test
    void unregisteredModeFailsWithProfileContext() {
        Quantizer quantizer = new Quantizer(new QuantizerFactory().register(new MonoQuantizer()),
                new Resampler(), QuantizerOptions.defaults());
        ScreenProfile gray = ScreenProfile.of("gray-panel", 4, 4, ColorMode.GRAY4);

        UnsupportedColorModeException e = assertThrows(UnsupportedColorModeException.class,
                () -> quantizer.validate(gray));

        assertEquals(ColorMode.GRAY4, e.getColorMode());
        assertEquals("gray-panel", e.getProfileId());
        assertDoesNotThrow(() -> quantizer.validate(mono4x4));
    }

    @Test
    void rgba8888KeepsTransparencyInsteadOfCompositing() {
        Quantizer quantizer = Quantizer.create(
                new QuantizerOptions(DitherAlgorithm.THRESHOLD, 128, null, false, 0xFFFFFF));
        ScreenProfile rgba = ScreenProfile.of("rgba", 2, 1, ColorMode.RGBA8888);
        ScreenProfile rgb = ScreenProfile.of("rgb", 2, 1, ColorMode.RGB888);
        SourceImage source = new SourceImage(2, 1, new int[]{0x00123456, 0x80FF0000});

        assertArrayEquals(new int[]{0x12345600, 0xFF000080}, quantizer.quantize(source, rgba).toArray());
        assertEquals(0xFFFFFF, quantizer.quantize(source, rgb).sample(0));
    }

    @Test
    void defaultFactorySupportsEveryMode() {
        QuantizerFactory factory = QuantizerFactory.withDefaults();

        for (ColorMode mode : ColorMode.values()) {
            assertTrue(factory.supports(mode), "No strategy for " + mode);
            assertEquals(mode, factory.get(mode, "p").colorMode());
        }
    }
}
