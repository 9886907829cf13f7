package com.largomodo.dotshop.sequence;

import com.largomodo.dotshop.core.EncodedFrame;
import com.largomodo.dotshop.core.ScreenProfile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Restartable sequence: every call to {@link #iterator()} opens a fresh source and returns a
 * new {@link FrameSequence} over it.
 * <p>
 * A pass that runs to the end or fails closes itself. A pass abandoned early (a {@code break}
 * out of a for-each loop) keeps its source open until {@link #close()}, so use this in a
 * try-with-resources block. Worker threads of an abandoned pass exit on their own once idle.
 */
public final class ReplayableSequence implements Iterable<EncodedFrame>, AutoCloseable {

    private final FrameSequencer sequencer;
    private final FrameSourceFactory factory;
    private final ScreenProfile profile;
    private final List<FrameSequence> passes = new ArrayList<>();

    private boolean closed;

    ReplayableSequence(FrameSequencer sequencer, FrameSourceFactory factory, ScreenProfile profile) {
        this.sequencer = sequencer;
        this.factory = factory;
        this.profile = profile;
    }

    /**
     * @throws IllegalStateException if this sequence was closed
     * @throws UncheckedIOException  if the source cannot be opened
     */
    @Override
    public synchronized FrameSequence iterator() {
        if (closed) {
            throw new IllegalStateException("Sequence for profile " + profile.id() + " is closed");
        }
        passes.removeIf(FrameSequence::isClosed);
        FrameSource source;
        try {
            source = factory.open();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot open frame source", e);
        }
        FrameSequence pass = sequencer.sequence(source, profile);
        passes.add(pass);
        return pass;
    }

    /**
     * @return number of passes still holding a source open
     */
    public synchronized int openPasses() {
        passes.removeIf(FrameSequence::isClosed);
        return passes.size();
    }

    /**
     * Closes every pass still open. Idempotent.
     *
     * @throws UncheckedIOException if closing a source fails; the remaining passes are closed first
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        UncheckedIOException failure = null;
        for (FrameSequence pass : passes) {
            try {
                pass.close();
            } catch (UncheckedIOException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        passes.clear();
        if (failure != null) {
            throw failure;
        }
    }
}
