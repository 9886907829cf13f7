package com.largomodo.dotshop.service;

import com.largomodo.dotshop.core.ColorMode;
import com.largomodo.dotshop.core.SourceFrame;
import com.largomodo.dotshop.core.SourceImage;
import com.largomodo.dotshop.core.ScreenProfile;
import com.largomodo.dotshop.core.UnknownTransformException;
import com.largomodo.dotshop.core.UnsupportedColorModeException;
import com.largomodo.dotshop.core.UnsupportedTargetException;
import com.largomodo.dotshop.emit.EmissionRequest;
import com.largomodo.dotshop.emit.EmissionResult;
import com.largomodo.dotshop.emit.EmitterRegistry;
import com.largomodo.dotshop.quantize.MonoQuantizer;
import com.largomodo.dotshop.quantize.QuantizerFactory;
import com.largomodo.dotshop.quantize.QuantizerOptions;
import com.largomodo.dotshop.sequence.CancellationSignal;
import com.largomodo.dotshop.sequence.FrameSourceFactory;
import com.largomodo.dotshop.sequence.FrameSources;
import com.largomodo.dotshop.sequence.SequenceObserver;
import com.largomodo.dotshop.sequence.SequencerOptions;
import com.largomodo.dotshop.transform.TransformRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ConversionJobTest {

    @TempDir
    Path tempDir;

    private static final ScreenProfile MONO_8X2 = ScreenProfile.of("mono-8x2", 8, 2, ColorMode.MONO);

    private static ConversionJob job(ScreenProfile profile, List<String> transforms, EmissionRequest request) {
        return new ConversionJob(profile, QuantizerOptions.defaults(), SequencerOptions.defaults(), transforms,
                request, SequenceObserver.NONE, new CancellationSignal());
    }

    private static FrameSourceFactory white(int width, int height) {
        return FrameSources.of(SourceFrame.still(SourceImage.filled(width, height, 0xFFFFFFFF)));
    }

    @Test
    void whiteImageBecomesAllOnBuffer() throws IOException {
        EmissionResult result = job(MONO_8X2, List.of(), EmissionRequest.of("c")).run(white(8, 2));

        assertEquals(List.of(2), result.bufferSizes());
        assertTrue(result.text().contains("const uint8_t image[2] = {\n    0xff, 0xff,\n};"));
    }

    @Test
    void transformsRunBeforeEmission() throws IOException {
        EmissionResult result = job(MONO_8X2, List.of("invert"), EmissionRequest.of("python")).run(white(8, 2));

        assertTrue(result.text().contains("image = bytes([\n    0x00, 0x00,\n])"));
    }

    @Test
    void animatedGifEndToEnd() throws IOException {
        BufferedImage[] images = {
                TestImages.solid(16, 16, Color.WHITE),
                TestImages.solid(16, 16, Color.BLACK),
                TestImages.solid(16, 16, Color.WHITE)
        };
        Path gif = TestImages.writeGif(tempDir.resolve("blink.gif"), images, new int[]{10, 15, 10});
        ScreenProfile profile = ScreenProfile.of("mono-8x8", 8, 8, ColorMode.MONO);
        SequenceObserver observer = mock(SequenceObserver.class);
        ConversionJob job = new ConversionJob(profile, QuantizerOptions.defaults(), new SequencerOptions(2, 2, 0.1),
                List.of(), EmissionRequest.of("javascript").withSymbol("blink"), observer, new CancellationSignal());

        EmissionResult result = job.run(ImageIoFrameSource.factory(gif));

        assertEquals(List.of(8, 8, 8), result.bufferSizes());
        assertTrue(result.text().contains("export const blink_durations_ms = [100, 150, 100];"));
        assertTrue(result.text().contains("export const blink_frame_1 = new Uint8Array([\n"
                + "    0x00, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00,\n]);"));
        verify(observer, times(3)).onFrameEncoded(any());
        verify(observer).onComplete(3, 0);
    }

    @Test
    void unknownTransformFailsAtConstruction() {
        UnknownTransformException e = assertThrows(UnknownTransformException.class,
                () -> job(MONO_8X2, List.of("rle"), EmissionRequest.of("c")));

        assertEquals("rle", e.getTransformName());
        assertEquals("transform", e.getStage());
    }

    @Test
    void unknownTargetFailsAtConstruction() {
        assertThrows(UnsupportedTargetException.class, () -> job(MONO_8X2, List.of(), EmissionRequest.of("cobol")));
    }

    @Test
    void unsupportedColorModeFailsAtConstruction() {
        ScreenProfile rgb = ScreenProfile.of("rgb", 2, 2, ColorMode.RGB565);

        UnsupportedColorModeException e = assertThrows(UnsupportedColorModeException.class,
                () -> new ConversionJob(rgb, QuantizerOptions.defaults(), SequencerOptions.defaults(), List.of(),
                        EmissionRequest.of("c"), SequenceObserver.NONE, new CancellationSignal(),
                        new QuantizerFactory().register(new MonoQuantizer()),
                        TransformRegistry.withDefaults(), EmitterRegistry.withDefaults()));

        assertEquals("rgb", e.getProfileId());
    }

    @Test
    void cancelledJobStopsWithoutOutput() {
        CancellationSignal signal = new CancellationSignal();
        signal.cancel();
        ConversionJob job = new ConversionJob(MONO_8X2, QuantizerOptions.defaults(), SequencerOptions.defaults(),
                List.of(), EmissionRequest.of("c"), SequenceObserver.NONE, signal);

        assertThrows(CancellationException.class, () -> job.run(white(8, 2)));
    }

    @Test
    void missingInputSurfacesAsIoException() {
        ConversionJob job = job(MONO_8X2, List.of(), EmissionRequest.of("c"));

        assertThrows(IOException.class, () -> job.run(ImageIoFrameSource.factory(tempDir.resolve("gone.gif"))));
    }
}
