package com.largomodo.dotshop.transform;

import com.largomodo.dotshop.core.UnknownTransformException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Explicit name-to-transform registry. Nothing is discovered implicitly; callers register what
 * they want available, or start from {@link #withDefaults()}.
 * <p>
 * Registration is meant to happen during setup. Lookups after setup are safe from any thread
 * as long as no further registration happens concurrently.
 */
public class TransformRegistry {

    private final Map<String, ByteTransform> transforms = new LinkedHashMap<>();

    /**
     * Registry holding the built-in {@code invert} and {@code reverse-bits} transforms.
     */
    public static TransformRegistry withDefaults() {
        return new TransformRegistry()
                .register(new InvertTransform())
                .register(new ReverseBitsTransform());
    }

    /**
     * @throws IllegalArgumentException if the name is blank or already registered
     */
    public TransformRegistry register(ByteTransform transform) {
        Objects.requireNonNull(transform, "transform must not be null");
        String name = transform.name();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Transform name must not be null or blank");
        }
        if (transforms.containsKey(name)) {
            throw new IllegalArgumentException("Transform already registered: " + name);
        }
        transforms.put(name, transform);
        return this;
    }

    /**
     * @throws UnknownTransformException if no transform has this name
     */
    public ByteTransform get(String name) {
        ByteTransform transform = transforms.get(name);
        if (transform == null) {
            throw new UnknownTransformException(name, transforms.keySet());
        }
        return transform;
    }

    public Set<String> names() {
        return Set.copyOf(transforms.keySet());
    }
}
