package com.largomodo.dotshop.transform;

/**
 * Mirrors the bits within each byte (bit 7 swaps with bit 0), converting MSB-first sub-byte
 * data into LSB-first and back.
 */
public class ReverseBitsTransform implements ByteTransform {

    public static final String NAME = "reverse-bits";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public byte[] apply(byte[] input) {
        byte[] output = new byte[input.length];
        for (int i = 0; i < input.length; i++) {
            output[i] = (byte) (Integer.reverse(input[i] & 0xFF) >>> 24);
        }
        return output;
    }

    @Override
    public boolean sizePreserving() {
        return true;
    }
}
