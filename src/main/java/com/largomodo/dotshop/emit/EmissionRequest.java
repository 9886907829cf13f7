package com.largomodo.dotshop.emit;

import com.largomodo.dotshop.util.IdentifierUtil;

import java.util.Locale;

/**
 * Pure configuration of one emission.
 *
 * @param targetId      Target language id, e.g. "c" or "python" (case-insensitive)
 * @param symbolName    Base identifier of the emitted arrays
 * @param lineWrapWidth Maximum characters per data line, indent included
 * @param chunkSize     Maximum byte literals per data line
 */
public record EmissionRequest(String targetId, String symbolName, int lineWrapWidth, int chunkSize) {

    public static final String DEFAULT_TARGET = "c";
    public static final String DEFAULT_SYMBOL = "image";
    public static final int DEFAULT_LINE_WRAP = 100;
    public static final int DEFAULT_CHUNK_SIZE = 16;

    public EmissionRequest {
        if (targetId == null || targetId.isBlank()) {
            throw new IllegalArgumentException("targetId must not be null or blank");
        }
        targetId = targetId.trim().toLowerCase(Locale.ROOT);
        IdentifierUtil.requireValid(symbolName);
        if (lineWrapWidth < 1) {
            throw new IllegalArgumentException("lineWrapWidth must be positive, got: " + lineWrapWidth);
        }
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize must be positive, got: " + chunkSize);
        }
    }

    /**
     * Symbol "image", wrap at 100 characters, 16 values per line.
     */
    public static EmissionRequest of(String targetId) {
        return new EmissionRequest(targetId, DEFAULT_SYMBOL, DEFAULT_LINE_WRAP, DEFAULT_CHUNK_SIZE);
    }

    public EmissionRequest withSymbol(String symbol) {
        return new EmissionRequest(targetId, symbol, lineWrapWidth, chunkSize);
    }
}
