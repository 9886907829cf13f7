package com.largomodo.dotshop.transform;

/**
 * Named post-packing transformation of a buffer, such as compression or polarity inversion.
 * <p>
 * Implementations must be pure and deterministic: the same input always yields the same
 * output, and the input array is never modified.
 */
public interface ByteTransform {

    /**
     * @return registry name, e.g. "invert"
     */
    String name();

    byte[] apply(byte[] input);

    /**
     * @return true if {@link #apply(byte[])} always returns an array of the input's length
     */
    boolean sizePreserving();
}
