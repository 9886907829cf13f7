package com.largomodo.dotshop.core;

import java.util.Set;

/**
 * Immutable description of a target display's geometry and encoding rules.
 * <p>
 * Resolution, color mode, scan direction and alignment fully determine the packed buffer
 * length; see {@link #packedBufferLength()}.
 *
 * @param id            Stable identifier, used in diagnostics and emitted headers
 * @param displayName   Human-readable name
 * @param width         Width in pixels, positive
 * @param height        Height in pixels, positive
 * @param colorMode     Sample encoding
 * @param scanDirection Pixel visiting order
 * @param bitOrder      Sample placement within a byte / byte order of multi-byte samples
 * @param alignment     Line pad boundary in pixels: 1, 8, 16 or 32
 * @param screenType    Display technology tag (informational)
 * @param description   Free-form notes, never null (empty when absent)
 */
public record ScreenProfile(
        String id,
        String displayName,
        int width,
        int height,
        ColorMode colorMode,
        ScanDirection scanDirection,
        BitOrder bitOrder,
        int alignment,
        ScreenType screenType,
        String description
) {

    public static final Set<Integer> SUPPORTED_ALIGNMENTS = Set.of(1, 8, 16, 32);

    public static final ScanDirection DEFAULT_SCAN = ScanDirection.ROW_MAJOR;
    public static final BitOrder DEFAULT_BIT_ORDER = BitOrder.MSB_FIRST;
    public static final int DEFAULT_ALIGNMENT = 8;

    public ScreenProfile {
        if (id == null || id.isBlank()) {
            throw new InvalidScreenProfileException("Profile id must not be null or blank", id);
        }
        if (displayName == null || displayName.isBlank()) {
            displayName = id;
        }
        if (width <= 0 || height <= 0) {
            throw new InvalidScreenProfileException(
                    "Resolution must be positive, got: " + width + "x" + height, id);
        }
        if (colorMode == null) {
            throw new InvalidScreenProfileException("colorMode must not be null", id);
        }
        if (scanDirection == null) {
            scanDirection = DEFAULT_SCAN;
        }
        if (bitOrder == null) {
            bitOrder = DEFAULT_BIT_ORDER;
        }
        if (!SUPPORTED_ALIGNMENTS.contains(alignment)) {
            throw new InvalidScreenProfileException(
                    "Alignment must be one of 1, 8, 16, 32, got: " + alignment, id);
        }
        if (scanDirection.isPaged() && height % ScanDirection.PAGE_HEIGHT != 0) {
            throw new InvalidScreenProfileException(
                    "Page scan requires a height that is a multiple of 8, got: " + height, id);
        }
        if (screenType == null) {
            screenType = ScreenType.LCD;
        }
        if (description == null) {
            description = "";
        }
        long bits = (long) scanDirection.lineCount(width, height)
                * paddedLength(scanDirection.lineLength(width, height), alignment)
                * colorMode.getBitsPerPixel();
        if ((bits + 7) / 8 > Integer.MAX_VALUE) {
            throw new InvalidScreenProfileException(
                    "Resolution " + width + "x" + height + " exceeds the maximum buffer size", id);
        }
    }

    /**
     * Creates a profile with row-major scan, MSB-first order and 8-pixel alignment.
     */
    public static ScreenProfile of(String id, int width, int height, ColorMode colorMode) {
        return new ScreenProfile(id, id, width, height, colorMode,
                DEFAULT_SCAN, DEFAULT_BIT_ORDER, DEFAULT_ALIGNMENT, ScreenType.LCD, "");
    }

    public ScreenProfile withScan(ScanDirection direction, BitOrder order, int pixelAlignment) {
        return new ScreenProfile(id, displayName, width, height, colorMode,
                direction, order, pixelAlignment, screenType, description);
    }

    public int pixelCount() {
        return width * height;
    }

    public int lineCount() {
        return scanDirection.lineCount(width, height);
    }

    public int lineLength() {
        return scanDirection.lineLength(width, height);
    }

    /**
     * @return line length in pixels after padding to the alignment boundary
     */
    public int paddedLineLength() {
        return paddedLength(lineLength(), alignment);
    }

    /**
     * Exact length of a packed buffer for this profile:
     * {@code ceil(lines * paddedLineLength * bitsPerPixel / 8)}.
     * <p>
     * For a row-major mono profile with alignment 8 this is
     * {@code ceil(width / 8) * 8 * height / 8}.
     */
    public int packedBufferLength() {
        long bits = (long) lineCount() * paddedLineLength() * colorMode.getBitsPerPixel();
        return (int) ((bits + 7) / 8);
    }

    private static int paddedLength(int length, int alignment) {
        return ((length + alignment - 1) / alignment) * alignment;
    }
}
