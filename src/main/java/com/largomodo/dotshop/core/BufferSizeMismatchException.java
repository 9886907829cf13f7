package com.largomodo.dotshop.core;

/**
 * Internal invariant violation: the packer produced a different number of bytes than the
 * profile's buffer length formula. Always fatal; indicates a packing bug, never bad input.
 */
public class BufferSizeMismatchException extends ModulationException {

    private final int expectedLength;
    private final int actualLength;

    public BufferSizeMismatchException(String profileId, int expectedLength, int actualLength) {
        super("Packed buffer length " + actualLength + " does not match expected " + expectedLength,
                profileId, NO_FRAME, "pack", null);
        this.expectedLength = expectedLength;
        this.actualLength = actualLength;
    }

    public int getExpectedLength() {
        return expectedLength;
    }

    public int getActualLength() {
        return actualLength;
    }
}
