package com.largomodo.dotshop.sequence;

import com.largomodo.dotshop.core.EncodedFrame;
import com.largomodo.dotshop.core.ScreenProfile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Drives frames from a source through a {@link FrameEncoder}, yielding encoded frames lazily
 * and strictly in source order.
 * <p>
 * Memory is bounded by {@link SequencerOptions#lookAhead()}: the sequence never holds more
 * frames than that between pulling them from the source and handing them to the consumer.
 * With more than one worker, frames inside the window are encoded in parallel and released
 * in submission order.
 * <p>
 * Corrupt frames are skipped with a warning. Once the source ends, the sequence fails with
 * {@link com.largomodo.dotshop.core.ExcessiveFrameCorruptionException} if the share of
 * skipped frames exceeds the configured tolerance.
 */
public class FrameSequencer {

    private final FrameEncoder encoder;
    private final SequencerOptions options;
    private final SequenceObserver observer;
    private final CancellationSignal cancellation;

    public FrameSequencer(FrameEncoder encoder, SequencerOptions options) {
        this(encoder, options, SequenceObserver.NONE, new CancellationSignal());
    }

    public FrameSequencer(FrameEncoder encoder, SequencerOptions options,
                          SequenceObserver observer, CancellationSignal cancellation) {
        this.encoder = Objects.requireNonNull(encoder, "encoder must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.observer = Objects.requireNonNull(observer, "observer must not be null");
        this.cancellation = Objects.requireNonNull(cancellation, "cancellation must not be null");
    }

    /**
     * Single-pass sequence over an open source. Closing the returned sequence closes the
     * source; the sequence also closes itself when exhausted or failed.
     *
     * @throws com.largomodo.dotshop.core.ModulationException if the profile cannot be served
     */
    public FrameSequence sequence(FrameSource source, ScreenProfile profile) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(profile, "profile must not be null");
        encoder.validate(profile);
        return new FrameSequence(source, profile, encoder, options, observer, cancellation);
    }

    /**
     * Restartable sequence: every call to {@code iterator()} opens a fresh source.
     * Iteration throws {@link UncheckedIOException} if the source cannot be opened or read.
     * Closing the returned sequence closes every pass left open.
     */
    public ReplayableSequence sequence(FrameSourceFactory factory, ScreenProfile profile) {
        Objects.requireNonNull(factory, "factory must not be null");
        Objects.requireNonNull(profile, "profile must not be null");
        encoder.validate(profile);
        return new ReplayableSequence(this, factory, profile);
    }

    /**
     * Runs a whole sequence and collects the results.
     */
    public List<EncodedFrame> encodeAll(FrameSourceFactory factory, ScreenProfile profile) throws IOException {
        encoder.validate(profile);
        List<EncodedFrame> frames = new ArrayList<>();
        try (FrameSequence sequence = sequence(factory.open(), profile)) {
            while (sequence.hasNext()) {
                frames.add(sequence.next());
            }
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        return frames;
    }
}
