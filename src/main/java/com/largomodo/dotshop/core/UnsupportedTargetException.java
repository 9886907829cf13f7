package com.largomodo.dotshop.core;

import java.util.Collection;

/**
 * Thrown when emission is requested for a language id no emitter is registered under.
 */
public class UnsupportedTargetException extends ModulationException {

    private final String targetId;

    public UnsupportedTargetException(String targetId, Collection<String> supported) {
        super("Unsupported target language: " + targetId + ". Supported: " + String.join(", ", supported),
                null, NO_FRAME, "emit", null);
        this.targetId = targetId;
    }

    public String getTargetId() {
        return targetId;
    }
}
