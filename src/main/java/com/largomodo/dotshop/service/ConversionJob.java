package com.largomodo.dotshop.service;

import com.largomodo.dotshop.core.EncodedFrame;
import com.largomodo.dotshop.core.ScreenProfile;
import com.largomodo.dotshop.emit.EmissionRequest;
import com.largomodo.dotshop.emit.EmissionResult;
import com.largomodo.dotshop.emit.EmitterRegistry;
import com.largomodo.dotshop.emit.FormatEmitter;
import com.largomodo.dotshop.pack.BitPacker;
import com.largomodo.dotshop.quantize.Quantizer;
import com.largomodo.dotshop.quantize.QuantizerFactory;
import com.largomodo.dotshop.quantize.QuantizerOptions;
import com.largomodo.dotshop.quantize.Resampler;
import com.largomodo.dotshop.sequence.CancellationSignal;
import com.largomodo.dotshop.sequence.FrameEncoder;
import com.largomodo.dotshop.sequence.FrameSequencer;
import com.largomodo.dotshop.sequence.FrameSourceFactory;
import com.largomodo.dotshop.sequence.SequenceObserver;
import com.largomodo.dotshop.sequence.SequencerOptions;
import com.largomodo.dotshop.transform.TransformPipeline;
import com.largomodo.dotshop.transform.TransformRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * One conversion from frame source to source code text.
 * <p>
 * Coordinates the workflow:
 * 1. Resolve transforms, emitter and quantizer strategy (constructor, before any frame is read)
 * 2. Sequence frames through quantize, pack and transform
 * 3. Render all encoded frames with the target emitter
 * <p>
 * Configuration errors surface from the constructor, so a job that was built will only fail on
 * per-frame problems or I/O.
 */
public class ConversionJob {

    private static final Logger log = LoggerFactory.getLogger(ConversionJob.class);

    private final ScreenProfile profile;
    private final EmissionRequest request;
    private final FormatEmitter emitter;
    private final FrameSequencer sequencer;

    /**
     * Job using the built-in quantizers, transforms and emitters.
     */
    public ConversionJob(ScreenProfile profile, QuantizerOptions quantizerOptions, SequencerOptions sequencerOptions,
                         List<String> transformNames, EmissionRequest request,
                         SequenceObserver observer, CancellationSignal cancellation) {
        this(profile, quantizerOptions, sequencerOptions, transformNames, request, observer, cancellation,
                QuantizerFactory.withDefaults(), TransformRegistry.withDefaults(), EmitterRegistry.withDefaults());
    }

    public ConversionJob(ScreenProfile profile, QuantizerOptions quantizerOptions, SequencerOptions sequencerOptions,
                         List<String> transformNames, EmissionRequest request,
                         SequenceObserver observer, CancellationSignal cancellation,
                         QuantizerFactory quantizers, TransformRegistry transforms, EmitterRegistry emitters) {
        this.profile = Objects.requireNonNull(profile, "profile must not be null");
        this.request = Objects.requireNonNull(request, "request must not be null");

        TransformPipeline pipeline = TransformPipeline.of(transforms, transformNames);
        this.emitter = emitters.get(request.targetId());
        Quantizer quantizer = new Quantizer(quantizers, new Resampler(), quantizerOptions);
        quantizer.validate(profile);

        FrameEncoder encoder = new FrameEncoder(quantizer, new BitPacker(), pipeline);
        this.sequencer = new FrameSequencer(encoder, sequencerOptions, observer, cancellation);
        log.debug("Job ready: profile={}, target={}, transforms={}, {}", profile.id(), emitter.targetId(),
                pipeline.names(), sequencerOptions);
    }

    /**
     * Runs the whole job. Encoded frames are collected before rendering, since the header needs
     * the frame count.
     *
     * @throws IOException if the source cannot be opened or read
     */
    public EmissionResult run(FrameSourceFactory sourceFactory) throws IOException {
        log.info("Converting for {} ({}x{} {}, {} scan)", profile.id(), profile.width(), profile.height(),
                profile.colorMode(), profile.scanDirection());

        List<EncodedFrame> frames = sequencer.encodeAll(sourceFactory, profile);

        EmissionResult result = emitter.emit(frames, profile, request);
        log.info("Emitted {} buffer(s), {} bytes as {}", result.bufferCount(), result.totalBytes(), result.targetId());
        return result;
    }
}
