package com.largomodo.dotshop.quantize;

import com.largomodo.dotshop.core.PixelGrid;
import com.largomodo.dotshop.core.ScreenProfile;
import com.largomodo.dotshop.core.SourceImage;

import java.util.Objects;

/**
 * Maps a source image of any size onto a profile's resolution and color mode.
 * <p>
 * Three steps: resample to the profile resolution, composite alpha over the background, then
 * delegate to the mode's {@link ColorQuantizer}. Modes that store alpha skip compositing. Stateless apart from its immutable
 * collaborators, so one instance is shared by all frame workers.
 */
public class Quantizer {

    private final QuantizerFactory factory;
    private final Resampler resampler;
    private final QuantizerOptions options;

    public Quantizer(QuantizerFactory factory, Resampler resampler, QuantizerOptions options) {
        this.factory = Objects.requireNonNull(factory, "factory must not be null");
        this.resampler = Objects.requireNonNull(resampler, "resampler must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    /**
     * Default strategies, nearest-neighbour resampling and the given options.
     */
    public static Quantizer create(QuantizerOptions options) {
        return new Quantizer(QuantizerFactory.withDefaults(), new Resampler(), options);
    }

    /**
     * Fails fast when the profile's color mode has no registered strategy.
     *
     * @throws com.largomodo.dotshop.core.UnsupportedColorModeException if unsupported
     */
    public void validate(ScreenProfile profile) {
        factory.get(profile.colorMode(), profile.id());
    }

    public PixelGrid quantize(SourceImage source, ScreenProfile profile) {
        ColorQuantizer strategy = factory.get(profile.colorMode(), profile.id());
        SourceImage resized = resampler.resize(source, profile.width(), profile.height());

        int[] argb = resized.argb();
        if (strategy.keepsAlpha()) {
            return strategy.quantize(argb, profile.width(), profile.height(), options);
        }
        int[] rgb = new int[argb.length];
        for (int i = 0; i < argb.length; i++) {
            rgb[i] = ColorMath.composite(argb[i], options.background());
        }
        return strategy.quantize(rgb, profile.width(), profile.height(), options);
    }
}
