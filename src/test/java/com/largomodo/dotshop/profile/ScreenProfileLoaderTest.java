package com.largomodo.dotshop.profile;

import com.largomodo.dotshop.core.BitOrder;
import com.largomodo.dotshop.core.ColorMode;
import com.largomodo.dotshop.core.InvalidScreenProfileException;
import com.largomodo.dotshop.core.ScanDirection;
import com.largomodo.dotshop.core.ScreenProfile;
import com.largomodo.dotshop.core.ScreenType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScreenProfileLoaderTest {

    @TempDir
    Path tempDir;

    private final ScreenProfileLoader loader = new ScreenProfileLoader();

    @Test
    void builtinSsd1306UsesPagedLsbLayout() {
        ScreenProfile profile = loader.builtin("ssd1306-128x64");

        assertEquals(128, profile.width());
        assertEquals(64, profile.height());
        assertEquals(ColorMode.MONO, profile.colorMode());
        assertEquals(ScanDirection.PAGE, profile.scanDirection());
        assertEquals(BitOrder.LSB_FIRST, profile.bitOrder());
        assertEquals(ScreenType.OLED, profile.screenType());
        assertEquals(1024, profile.packedBufferLength());
    }

    @Test
    void everyBuiltinProfileIsValidAndUnique() {
        List<ScreenProfile> builtins = loader.builtins();

        assertTrue(builtins.size() >= 10, "catalog should ship the common controllers");
        assertEquals(builtins.size(), builtins.stream().map(ScreenProfile::id).distinct().count());
        for (ScreenProfile profile : builtins) {
            assertTrue(profile.packedBufferLength() > 0, profile.id());
        }
        assertEquals("ssd1306-128x64", builtins.get(0).id());
    }

    @Test
    void rgbaProfileIgnoresControllerOffsets() {
        ScreenProfile profile = loader.parse(new StringReader("""
                {"id": "panel", "width": 4, "height": 2, "colorMode": "rgba8888",
                 "row_offset": 2, "col_offset": 26}
                """));

        assertEquals(ColorMode.RGBA8888, profile.colorMode());
        assertEquals(32, profile.packedBufferLength());
    }

    @Test
    void unknownBuiltinListsAvailableIds() {
        InvalidScreenProfileException e = assertThrows(InvalidScreenProfileException.class,
                () -> loader.builtin("nope-1x1"));

        assertEquals("nope-1x1", e.getProfileId());
        assertTrue(e.getMessage().contains("ssd1306-128x64"));
    }

    @Test
    void minimalDocumentFallsBackToDefaults() {
        ScreenProfile profile = loader.parse(new StringReader(
                "{\"id\": \"panel\", \"width\": 10, \"height\": 3, \"colorMode\": \"GRAY4\"}"));

        assertEquals("panel", profile.displayName());
        assertEquals(ColorMode.GRAY4, profile.colorMode());
        assertEquals(ScanDirection.ROW_MAJOR, profile.scanDirection());
        assertEquals(BitOrder.MSB_FIRST, profile.bitOrder());
        assertEquals(8, profile.alignment());
        assertEquals(ScreenType.LCD, profile.screenType());
        assertEquals("", profile.description());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "{\"width\": 8, \"height\": 8, \"colorMode\": \"mono\"}",
            "{\"id\": \"p\", \"height\": 8, \"colorMode\": \"mono\"}",
            "{\"id\": \"p\", \"width\": 8, \"height\": 8}",
            "{\"id\": \"p\", \"width\": 0, \"height\": 8, \"colorMode\": \"mono\"}",
            "{\"id\": \"p\", \"width\": 8.5, \"height\": 8, \"colorMode\": \"mono\"}",
            "{\"id\": \"p\", \"width\": \"8\", \"height\": 8, \"colorMode\": \"mono\"}",
            "{\"id\": \"p\", \"width\": 8, \"height\": 8, \"colorMode\": \"cmyk\"}",
            "{\"id\": \"p\", \"width\": 8, \"height\": 8, \"colorMode\": \"mono\", \"scanDirection\": \"spiral\"}",
            "{\"id\": \"p\", \"width\": 8, \"height\": 8, \"colorMode\": \"mono\", \"alignment\": 12}",
            "{\"id\": \"p\", \"width\": 8, \"height\": 12, \"colorMode\": \"mono\", \"scanDirection\": \"page\"}",
            "[1, 2]",
            "{\"id\": ",
            ""
    })
    void invalidDocumentIsRejected(String json) {
        assertThrows(InvalidScreenProfileException.class, () -> loader.parse(new StringReader(json)));
    }

    @Test
    void rejectedFieldIsNamedWithProfileContext() {
        InvalidScreenProfileException e = assertThrows(InvalidScreenProfileException.class,
                () -> loader.parse(new StringReader(
                        "{\"id\": \"p\", \"width\": 8, \"height\": 8, \"colorMode\": \"mono\", \"bitOrder\": \"middle\"}")));

        assertTrue(e.getMessage().contains("bitOrder"));
        assertEquals("p", e.getProfileId());
        assertEquals("profile", e.getStage());
    }

    @Test
    void catalogAcceptsBareArray() {
        List<ScreenProfile> profiles = loader.parseCatalog(new StringReader("""
                [
                  {"id": "a", "width": 8, "height": 8, "colorMode": "mono"},
                  {"id": "b", "width": 4, "height": 4, "colorMode": "rgb565", "bitOrder": "lsb-first"}
                ]
                """));

        assertEquals(List.of("a", "b"), profiles.stream().map(ScreenProfile::id).toList());
        assertEquals(BitOrder.LSB_FIRST, profiles.get(1).bitOrder());
    }

    @Test
    void resolveReadsFileBeforeBuiltinId() throws IOException {
        Path file = tempDir.resolve("custom.json");
        Files.writeString(file, """
                {
                  "id": "custom-16x8",
                  "name": "Custom panel",
                  "width": 16,
                  "height": 8,
                  "colorMode": "mono",
                  "scanDirection": "column-major",
                  "alignment": 16,
                  "screenType": "led-matrix",
                  "description": "Two chained 8x8 matrices"
                }
                """);

        ScreenProfile profile = loader.resolve(file.toString());

        assertEquals("custom-16x8", profile.id());
        assertEquals("Custom panel", profile.displayName());
        assertEquals(ScanDirection.COLUMN_MAJOR, profile.scanDirection());
        assertEquals(16, profile.alignment());
        assertEquals(ScreenType.LED_MATRIX, profile.screenType());
        assertEquals("Two chained 8x8 matrices", profile.description());
        assertEquals(32, profile.packedBufferLength());

        assertEquals("sh1106-128x64", loader.resolve("sh1106-128x64").id());
    }

    @Test
    void missingCatalogResourceFailsLoudly() {
        ScreenProfileLoader broken = new ScreenProfileLoader("/profiles/does-not-exist.json");

        assertThrows(IllegalStateException.class, broken::builtins);
    }
}
