package com.largomodo.dotshop.core;

/**
 * Thrown when a screen profile is missing a field, carries a non-positive dimension, names an
 * unknown enum value or combines settings the packer cannot honor.
 * <p>
 * Raised while loading or building a profile, before any frame is processed.
 */
public class InvalidScreenProfileException extends ModulationException {

    public InvalidScreenProfileException(String message, String profileId) {
        super(message, profileId, NO_FRAME, "profile", null);
    }

    public InvalidScreenProfileException(String message, String profileId, Throwable cause) {
        super(message, profileId, NO_FRAME, "profile", cause);
    }
}
