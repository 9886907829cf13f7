package com.largomodo.dotshop.core;

import java.util.Locale;

/**
 * Display technology tag carried by a profile. Informational only; it is echoed in emitted
 * headers and never changes packing.
 */
public enum ScreenType {
    LCD,
    OLED,
    E_PAPER,
    LED_MATRIX;

    public static ScreenType fromId(String id) {
        if (id == null) {
            throw new IllegalArgumentException("Screen type cannot be null");
        }
        try {
            return valueOf(id.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid screen type: " + id + ". Supported: lcd, oled, e-paper, led-matrix");
        }
    }

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
