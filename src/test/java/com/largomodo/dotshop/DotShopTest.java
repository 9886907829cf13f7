package com.largomodo.dotshop;

import com.largomodo.dotshop.quantize.DitherAlgorithm;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import picocli.CommandLine;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for DotShop CLI argument parsing and exit codes.
 * <p>
 * Exit codes: 0 on success, 1 on conversion failure, 2 on invalid arguments.
 */
class DotShopTest {

    @TempDir
    Path tempDir;

    private Path whitePng;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() throws IOException {
        BufferedImage image = new BufferedImage(8, 8, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < 8; y++) {
            for (int x = 0; x < 8; x++) {
                image.setRGB(x, y, 0xFFFFFF);
            }
        }
        whitePng = tempDir.resolve("My Logo.png");
        ImageIO.write(image, "png", whitePng.toFile());
        out = new StringWriter();
        err = new StringWriter();
    }

    private int run(String... args) {
        CommandLine cmd = DotShop.newCommandLine(new DotShop());
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    @Test
    void testDefaults() {
        DotShop dotShop = new DotShop();
        DotShop.newCommandLine(dotShop).parseArgs(whitePng.toString(), "-p", "max7219-8x8");

        assertEquals("c", dotShop.target);
        assertEquals(DitherAlgorithm.THRESHOLD, dotShop.dither);
        assertEquals(128, dotShop.threshold);
        assertEquals(1, dotShop.lookAhead);
        assertEquals(1, dotShop.workers);
        assertEquals(0.10, dotShop.corruptionTolerance);
        assertEquals(100, dotShop.lineWrap);
        assertEquals(16, dotShop.chunkSize);
        assertNull(dotShop.symbol);
        assertTrue(dotShop.transforms.isEmpty());
    }

    @Test
    void testEnumParsingIsCaseInsensitive() {
        DotShop dotShop = new DotShop();
        DotShop.newCommandLine(dotShop).parseArgs(whitePng.toString(), "-p", "x", "--dither", "floyd_steinberg");

        assertEquals(DitherAlgorithm.FLOYD_STEINBERG, dotShop.dither);
    }

    @Test
    void testRepeatableTransformsKeepOrder() {
        DotShop dotShop = new DotShop();
        DotShop.newCommandLine(dotShop).parseArgs(whitePng.toString(), "-p", "x",
                "--transform", "reverse-bits", "--transform", "invert");

        assertEquals(List.of("reverse-bits", "invert"), dotShop.transforms);
    }

    @Test
    void testWritesCodeToStdoutWithDerivedSymbol() {
        int exitCode = run(whitePng.toString(), "-p", "max7219-8x8");

        assertEquals(0, exitCode, err.toString());
        String code = out.toString();
        assertTrue(code.contains("#define MY_LOGO_WIDTH 8"));
        assertTrue(code.contains("const uint8_t my_logo[8] = {\n"
                + "    0xff, 0xff, 0xff, 0xff, 0xff, 0xff, 0xff, 0xff,\n};"));
    }

    @Test
    void testReservedWordFileNameGetsSuffixedSymbol() throws IOException {
        Path reserved = Files.copy(whitePng, tempDir.resolve("int.png"));

        int exitCode = run(reserved.toString(), "-p", "max7219-8x8");

        assertEquals(0, exitCode, err.toString());
        assertTrue(out.toString().contains("const uint8_t int_img[8] = {"));
        assertTrue(out.toString().contains("#define INT_IMG_WIDTH 8"));
    }

    @Test
    void testReservedWordSymbolIsUsageError() {
        assertEquals(2, run(whitePng.toString(), "-p", "max7219-8x8", "-t", "python", "--symbol", "class"));
        assertTrue(err.toString().contains("reserved word"));
        assertEquals("", out.toString());
    }

    @Test
    void testWritesCodeToOutputFile() throws IOException {
        Path target = tempDir.resolve("gen/logo.py");

        int exitCode = run(whitePng.toString(), "-p", "max7219-8x8", "-t", "python", "-s", "splash",
                "--transform", "invert", "-o", target.toString());

        assertEquals(0, exitCode, err.toString());
        assertEquals("", out.toString());
        String code = Files.readString(target);
        assertTrue(code.startsWith("# Generated by DotShop"));
        assertTrue(code.contains("splash = bytes([\n    0x00, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00,\n])"));
    }

    @Test
    void testProfileFromJsonFile() throws IOException {
        Path profile = Files.writeString(tempDir.resolve("panel.json"),
                "{\"id\": \"panel\", \"width\": 4, \"height\": 2, \"colorMode\": \"gray8\"}");

        int exitCode = run(whitePng.toString(), "-p", profile.toString(), "-t", "javascript");

        assertEquals(0, exitCode, err.toString());
        assertTrue(out.toString().contains("export const my_logo = new Uint8Array([\n"
                + "    0xff, 0xff, 0xff, 0xff, 0xff, 0xff, 0xff, 0xff,\n]);"));
    }

    @Test
    void testListProfiles() {
        int exitCode = run("--list-profiles");

        assertEquals(0, exitCode);
        assertTrue(out.toString().contains("ssd1306-128x64"));
        assertTrue(out.toString().contains("max7219-8x8"));
    }

    @Test
    void testMissingInputIsUsageError() {
        assertEquals(2, run("-p", "max7219-8x8"));
        assertTrue(err.toString().contains("INPUT"));
    }

    @Test
    void testMissingProfileIsUsageError() {
        assertEquals(2, run(whitePng.toString()));
        assertTrue(err.toString().contains("--profile"));
    }

    @Test
    void testNonexistentInputIsUsageError() {
        assertEquals(2, run(tempDir.resolve("absent.png").toString(), "-p", "max7219-8x8"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"--threshold=300", "--background=zz", "--workers=0", "--symbol=9lives",
            "--dither=RANDOM", "--corruption-tolerance=2", "--chunk-size=0", "--dither=sierra"})
    void testInvalidOptionIsUsageError(String option) {
        assertEquals(2, run(whitePng.toString(), "-p", "max7219-8x8", option));
        assertEquals("", out.toString());
    }

    @Test
    void testRandomDitherWithSeedSucceeds() {
        assertEquals(0, run(whitePng.toString(), "-p", "max7219-8x8", "--dither", "random", "--seed", "42"));
    }

    @Test
    void testUnknownProfileFails() {
        assertEquals(1, run(whitePng.toString(), "-p", "no-such-display"));
        assertEquals("", out.toString());
    }

    @Test
    void testUnknownTargetFailsWithoutOutput() {
        Path target = tempDir.resolve("out.rs");

        assertEquals(1, run(whitePng.toString(), "-p", "max7219-8x8", "-t", "rust", "-o", target.toString()));
        assertFalse(Files.exists(target));
    }

    @Test
    void testUnknownTransformFails() {
        assertEquals(1, run(whitePng.toString(), "-p", "max7219-8x8", "--transform", "rle"));
    }

    @Test
    void testUndecodableInputFails() throws IOException {
        Path bogus = Files.writeString(tempDir.resolve("bogus.png"), "not an image");

        assertEquals(1, run(bogus.toString(), "-p", "max7219-8x8"));
    }

    @Test
    void testOutputDirectoryIsUsageError() {
        assertEquals(2, run(whitePng.toString(), "-p", "max7219-8x8", "-o", tempDir.toString()));
    }
}
