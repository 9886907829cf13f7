package com.largomodo.dotshop.emit;

import com.largomodo.dotshop.core.EncodedFrame;
import com.largomodo.dotshop.core.ScreenProfile;
import com.largomodo.dotshop.core.UnsupportedTargetException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Maps target language ids to emitters. Populated during setup, then only read.
 */
public class EmitterRegistry {

    private final Map<String, FormatEmitter> emitters = new LinkedHashMap<>();

    /**
     * Registry with the c, arduino, python and javascript emitters.
     */
    public static EmitterRegistry withDefaults() {
        return new EmitterRegistry()
                .register(new CEmitter())
                .register(new ArduinoEmitter())
                .register(new PythonEmitter())
                .register(new JavaScriptEmitter());
    }

    /**
     * Registers an emitter, replacing any previous one with the same id.
     */
    public EmitterRegistry register(FormatEmitter emitter) {
        Objects.requireNonNull(emitter, "emitter must not be null");
        emitters.put(emitter.targetId().toLowerCase(Locale.ROOT), emitter);
        return this;
    }

    /**
     * @throws UnsupportedTargetException if no emitter has this id
     */
    public FormatEmitter get(String targetId) {
        FormatEmitter emitter = targetId == null ? null : emitters.get(targetId.trim().toLowerCase(Locale.ROOT));
        if (emitter == null) {
            throw new UnsupportedTargetException(targetId, emitters.keySet());
        }
        return emitter;
    }

    public Set<String> targetIds() {
        return Set.copyOf(emitters.keySet());
    }

    /**
     * Resolves the request's target, then renders. An unknown target fails before any text is
     * produced.
     */
    public EmissionResult emit(List<EncodedFrame> frames, ScreenProfile profile, EmissionRequest request) {
        return get(request.targetId()).emit(frames, profile, request);
    }
}
