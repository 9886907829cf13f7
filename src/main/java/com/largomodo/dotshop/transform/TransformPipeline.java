package com.largomodo.dotshop.transform;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered chain of byte transforms applied to every packed buffer before emission.
 * <p>
 * All names are resolved at construction, so an unknown transform fails the job before any
 * frame is read. Immutable and shared across frame workers.
 */
public final class TransformPipeline {

    private static final TransformPipeline EMPTY = new TransformPipeline(List.of());

    private final List<ByteTransform> transforms;

    private TransformPipeline(List<ByteTransform> transforms) {
        this.transforms = List.copyOf(transforms);
    }

    public static TransformPipeline empty() {
        return EMPTY;
    }

    /**
     * Resolves the names against the registry, in order.
     *
     * @throws com.largomodo.dotshop.core.UnknownTransformException for the first unknown name
     */
    public static TransformPipeline of(TransformRegistry registry, List<String> names) {
        Objects.requireNonNull(registry, "registry must not be null");
        Objects.requireNonNull(names, "names must not be null");
        List<ByteTransform> resolved = new ArrayList<>(names.size());
        for (String name : names) {
            resolved.add(registry.get(name));
        }
        return new TransformPipeline(resolved);
    }

    /**
     * Runs every transform in registration order. The input is left untouched.
     */
    public byte[] apply(byte[] input) {
        byte[] current = input;
        for (ByteTransform transform : transforms) {
            current = transform.apply(current);
        }
        return current == input ? input.clone() : current;
    }

    /**
     * @return true only if every transform preserves size (an empty pipeline does)
     */
    public boolean sizePreserving() {
        return transforms.stream().allMatch(ByteTransform::sizePreserving);
    }

    public boolean isEmpty() {
        return transforms.isEmpty();
    }

    public List<String> names() {
        return transforms.stream().map(ByteTransform::name).toList();
    }
}
