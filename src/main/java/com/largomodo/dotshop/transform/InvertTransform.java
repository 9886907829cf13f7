package com.largomodo.dotshop.transform;

/**
 * Bitwise NOT of every byte, for panels whose lit state is 0.
 */
public class InvertTransform implements ByteTransform {

    public static final String NAME = "invert";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public byte[] apply(byte[] input) {
        byte[] output = new byte[input.length];
        for (int i = 0; i < input.length; i++) {
            output[i] = (byte) ~input[i];
        }
        return output;
    }

    @Override
    public boolean sizePreserving() {
        return true;
    }
}
