package com.largomodo.dotshop.core;

import java.util.Locale;

/**
 * Placement of the first sample inside a byte.
 * <p>
 * For sub-byte modes the first sample in scan order lands in the most (MSB_FIRST) or least
 * (LSB_FIRST) significant bits. For whole-byte modes the order selects the byte order of a
 * multi-byte sample: MSB_FIRST is big-endian, LSB_FIRST little-endian.
 */
public enum BitOrder {
    MSB_FIRST("msb-first"),
    LSB_FIRST("lsb-first");

    private final String id;

    BitOrder(String id) {
        this.id = id;
    }

    public static BitOrder fromId(String id) {
        if (id == null) {
            throw new IllegalArgumentException("Bit order cannot be null. Supported: msb-first, lsb-first");
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (BitOrder order : values()) {
            if (order.id.equals(normalized)) {
                return order;
            }
        }
        throw new IllegalArgumentException("Invalid bit order: " + id + ". Supported: msb-first, lsb-first");
    }

    public String getId() {
        return id;
    }

    @Override
    public String toString() {
        return id;
    }
}
