package com.largomodo.dotshop.core;

import java.util.Collection;

/**
 * Thrown while building a transform pipeline that names an unregistered transform.
 */
public class UnknownTransformException extends ModulationException {

    private final String transformName;

    public UnknownTransformException(String transformName, Collection<String> registered) {
        super("Unknown transform: " + transformName + ". Registered: " + String.join(", ", registered),
                null, NO_FRAME, "transform", null);
        this.transformName = transformName;
    }

    public String getTransformName() {
        return transformName;
    }
}
