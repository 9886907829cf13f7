package com.largomodo.dotshop.quantize;

import com.largomodo.dotshop.core.ColorMode;
import com.largomodo.dotshop.core.UnsupportedColorModeException;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Registry of color quantizer strategies keyed by color mode.
 */
public class QuantizerFactory {

    private final Map<ColorMode, ColorQuantizer> strategies = new EnumMap<>(ColorMode.class);

    /**
     * Creates a factory with no strategies; use {@link #withDefaults()} for the built-in set.
     */
    public QuantizerFactory() {
    }

    /**
     * @return factory with strategies for every {@link ColorMode}
     */
    public static QuantizerFactory withDefaults() {
        QuantizerFactory factory = new QuantizerFactory();
        factory.register(new MonoQuantizer());
        factory.register(new GrayscaleQuantizer(ColorMode.GRAY4));
        factory.register(new GrayscaleQuantizer(ColorMode.GRAY8));
        factory.register(new Rgb565Quantizer());
        factory.register(new Rgb888Quantizer());
        factory.register(new Rgba8888Quantizer());
        return factory;
    }

    /**
     * Registers a strategy, replacing any previous one for the same mode.
     */
    public QuantizerFactory register(ColorQuantizer quantizer) {
        Objects.requireNonNull(quantizer, "quantizer must not be null");
        strategies.put(quantizer.colorMode(), quantizer);
        return this;
    }

    public boolean supports(ColorMode mode) {
        return strategies.containsKey(mode);
    }

    /**
     * @param profileId profile being served, reported in the exception
     * @throws UnsupportedColorModeException if no strategy is registered for the mode
     */
    public ColorQuantizer get(ColorMode mode, String profileId) {
        ColorQuantizer quantizer = strategies.get(mode);
        if (quantizer == null) {
            throw new UnsupportedColorModeException(mode, profileId);
        }
        return quantizer;
    }
}
