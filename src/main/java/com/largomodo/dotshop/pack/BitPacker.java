package com.largomodo.dotshop.pack;

import com.largomodo.dotshop.core.BitOrder;
import com.largomodo.dotshop.core.BufferSizeMismatchException;
import com.largomodo.dotshop.core.ColorMode;
import com.largomodo.dotshop.core.PackedBuffer;
import com.largomodo.dotshop.core.PixelGrid;
import com.largomodo.dotshop.core.ScanDirection;
import com.largomodo.dotshop.core.ScreenProfile;

/**
 * Serializes a quantized pixel grid into the byte layout a display controller expects.
 * <p>
 * The grid is walked line by line in the profile's scan order. Every line is padded with zero
 * samples up to the alignment boundary, so padding bits are always zero.
 * <p>
 * Sample placement:
 * <ul>
 *   <li>Sub-byte modes (mono, gray4): the first sample of a byte occupies the high bits with
 *       {@link BitOrder#MSB_FIRST} and the low bits with {@link BitOrder#LSB_FIRST}. A sample
 *       never straddles a byte boundary because 8 is a multiple of its width.</li>
 *   <li>Whole-byte modes (gray8, rgb565, rgb888, rgba8888): MSB_FIRST writes big-endian, LSB_FIRST
 *       little-endian.</li>
 * </ul>
 * Stateless and thread-safe.
 */
public class BitPacker {

    /**
     * @throws IllegalArgumentException     if the grid does not match the profile resolution or color mode
     * @throws BufferSizeMismatchException if the bytes written disagree with {@link ScreenProfile#packedBufferLength()}
     */
    public PackedBuffer pack(PixelGrid grid, ScreenProfile profile) {
        if (grid.getWidth() != profile.width() || grid.getHeight() != profile.height()) {
            throw new IllegalArgumentException(String.format(
                    "Grid %dx%d does not match profile %s resolution %dx%d",
                    grid.getWidth(), grid.getHeight(), profile.id(), profile.width(), profile.height()));
        }
        if (grid.getColorMode() != profile.colorMode()) {
            throw new IllegalArgumentException("Grid color mode " + grid.getColorMode()
                    + " does not match profile " + profile.id() + " color mode " + profile.colorMode());
        }

        int expectedLength = profile.packedBufferLength();
        byte[] out = new byte[expectedLength];

        ColorMode mode = profile.colorMode();
        ScanDirection scan = profile.scanDirection();
        int bpp = mode.getBitsPerPixel();
        int width = profile.width();
        int height = profile.height();
        int lines = profile.lineCount();
        int lineLength = profile.lineLength();
        int paddedLength = profile.paddedLineLength();

        long bitCursor = 0;
        for (int line = 0; line < lines; line++) {
            for (int position = 0; position < lineLength; position++) {
                int sample = grid.sample(scan.pixelIndex(line, position, width, height));
                if (mode.isSubByte()) {
                    writeSubByte(out, bitCursor, sample, bpp, profile.bitOrder());
                } else {
                    writeWholeBytes(out, (int) (bitCursor >>> 3), sample, bpp >>> 3, profile.bitOrder());
                }
                bitCursor += bpp;
            }
            // Padding samples are zero; the array already is
            bitCursor += (long) (paddedLength - lineLength) * bpp;
        }

        int written = (int) ((bitCursor + 7) >>> 3);
        if (written != expectedLength) {
            throw new BufferSizeMismatchException(profile.id(), expectedLength, written);
        }
        return PackedBuffer.copyOf(out);
    }

    private static void writeSubByte(byte[] out, long bitCursor, int sample, int bpp, BitOrder order) {
        int byteIndex = (int) (bitCursor >>> 3);
        int offset = (int) (bitCursor & 7);
        int shift = order == BitOrder.MSB_FIRST ? 8 - bpp - offset : offset;
        out[byteIndex] |= (byte) (sample << shift);
    }

    private static void writeWholeBytes(byte[] out, int byteIndex, int sample, int byteCount, BitOrder order) {
        for (int i = 0; i < byteCount; i++) {
            int shift = order == BitOrder.MSB_FIRST ? (byteCount - 1 - i) * 8 : i * 8;
            out[byteIndex + i] = (byte) (sample >>> shift);
        }
    }
}
