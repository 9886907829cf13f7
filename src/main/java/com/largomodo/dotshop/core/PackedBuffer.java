package com.largomodo.dotshop.core;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable byte sequence produced by packing (and optionally transforming) one frame.
 */
public final class PackedBuffer {

    private final byte[] bytes;

    private PackedBuffer(byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * Wraps a copy of the given bytes.
     */
    public static PackedBuffer copyOf(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes must not be null");
        return new PackedBuffer(bytes.clone());
    }

    public int length() {
        return bytes.length;
    }

    /**
     * @return byte at index as an unsigned value 0..255
     */
    public int get(int index) {
        return bytes[index] & 0xFF;
    }

    public byte[] toByteArray() {
        return bytes.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(bytes, ((PackedBuffer) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "PackedBuffer{length=" + bytes.length + '}';
    }
}
