package com.largomodo.dotshop.sequence;

import com.largomodo.dotshop.core.EncodedFrame;
import com.largomodo.dotshop.core.ExcessiveFrameCorruptionException;
import com.largomodo.dotshop.core.FrameDecodeGapException;
import com.largomodo.dotshop.core.FrameProcessingException;
import com.largomodo.dotshop.core.ModulationException;
import com.largomodo.dotshop.core.ScreenProfile;
import com.largomodo.dotshop.core.SourceFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One pass over a frame source. Not thread-safe: a single consumer iterates it.
 * <p>
 * Frames are pulled on the consumer thread. With one worker they are also encoded there;
 * otherwise encoding runs on a fixed pool and the FIFO window of futures doubles as the
 * reorder buffer, releasing results in submission order whatever order workers finish in.
 * Pool threads exit after {@link #WORKER_KEEP_ALIVE_MS} idle, so a pass abandoned without
 * {@link #close()} does not pin them.
 */
public final class FrameSequence implements Iterator<EncodedFrame>, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FrameSequence.class);

    static final long WORKER_KEEP_ALIVE_MS = 500;

    private static final AtomicInteger POOL_COUNTER = new AtomicInteger();

    private final FrameSource source;
    private final ScreenProfile profile;
    private final FrameEncoder encoder;
    private final SequencerOptions options;
    private final SequenceObserver observer;
    private final CancellationSignal cancellation;
    private final ExecutorService executor;
    private final Deque<Future<EncodedFrame>> window = new ArrayDeque<>();

    private EncodedFrame ready;
    private boolean endOfStream;
    private volatile boolean closed;
    private long encoded;
    private long skipped;

    FrameSequence(FrameSource source, ScreenProfile profile, FrameEncoder encoder, SequencerOptions options,
                  SequenceObserver observer, CancellationSignal cancellation) {
        this.source = source;
        this.profile = profile;
        this.encoder = encoder;
        this.options = options;
        this.observer = observer;
        this.cancellation = cancellation;
        this.executor = options.workers() > 1 ? newExecutor(options) : null;
    }

    /**
     * Fixed pool with a queue bounded by the look-ahead window. CallerRunsPolicy never kicks in
     * while the window holds, but keeps submission safe if it ever overflows.
     */
    private static ExecutorService newExecutor(SequencerOptions options) {
        int poolId = POOL_COUNTER.incrementAndGet();
        AtomicInteger threadCounter = new AtomicInteger();
        ThreadFactory threads = runnable -> {
            Thread thread = new Thread(runnable, "dotshop-frames-" + poolId + "-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                options.workers(),
                options.workers(),
                WORKER_KEEP_ALIVE_MS,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(options.lookAhead()),
                threads,
                new ThreadPoolExecutor.CallerRunsPolicy()
        );
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }

    /**
     * @throws CancellationException          if the sequence was cancelled
     * @throws UncheckedIOException            if the source fails
     * @throws ExcessiveFrameCorruptionException when too many frames were skipped: at end of stream,
     *                                           or earlier when the source reports its frame count
     */
    @Override
    public boolean hasNext() {
        if (ready != null) {
            return true;
        }
        if (closed) {
            return false;
        }
        try {
            ready = advance();
        } catch (RuntimeException e) {
            try {
                close();
            } catch (UncheckedIOException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
        if (ready == null) {
            close();
            return false;
        }
        return true;
    }

    @Override
    public EncodedFrame next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Frame sequence exhausted");
        }
        EncodedFrame frame = ready;
        ready = null;
        encoded++;
        observer.onFrameEncoded(frame);
        return frame;
    }

    /**
     * @return number of frames released so far
     */
    public long getEncodedCount() {
        return encoded;
    }

    /**
     * @return number of corrupt frames skipped so far
     */
    public long getSkippedCount() {
        return skipped;
    }

    /**
     * @return true once the sequence is exhausted, failed or closed
     */
    public boolean isClosed() {
        return closed;
    }

    private EncodedFrame advance() {
        if (executor == null) {
            Optional<SourceFrame> frame = pull();
            if (frame.isPresent()) {
                return encoder.encode(frame.get(), profile);
            }
            finish();
            return null;
        }

        while (window.size() < options.lookAhead()) {
            Optional<SourceFrame> frame = pull();
            if (frame.isEmpty()) {
                break;
            }
            SourceFrame sourceFrame = frame.get();
            window.addLast(executor.submit(() -> encoder.encode(sourceFrame, profile)));
        }
        if (window.isEmpty()) {
            finish();
            return null;
        }
        return await(window.removeFirst());
    }

    /**
     * Pulls the next intact frame, skipping corrupt ones. Checks for cancellation first.
     */
    private Optional<SourceFrame> pull() {
        while (!endOfStream) {
            if (cancellation.isCancelled() || Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Frame sequence for profile " + profile.id() + " was cancelled");
            }
            try {
                Optional<SourceFrame> frame = source.next();
                if (frame.isPresent()) {
                    return frame;
                }
                endOfStream = true;
            } catch (FrameDecodeGapException e) {
                skipped++;
                log.warn("Skipping corrupt frame {}: {}", e.getFrameOrdinal(), e.getMessage());
                observer.onFrameSkipped(e.getFrameOrdinal(), e);
                failIfToleranceExceeded();
            } catch (IOException e) {
                throw new UncheckedIOException("Frame source failed after " + (encoded + skipped) + " frames", e);
            }
        }
        return Optional.empty();
    }

    private EncodedFrame await(Future<EncodedFrame> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for frame of profile " + profile.id());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ModulationException modulation) {
                throw modulation;
            }
            throw new FrameProcessingException("Frame worker failed: " + cause, profile.id(),
                    ModulationException.NO_FRAME, "encode", cause);
        }
    }

    /**
     * When the source knows its length, the final skip ratio can be no lower than
     * skipped / total, so the sequence fails as soon as that alone breaks the tolerance.
     */
    private void failIfToleranceExceeded() {
        OptionalLong total = source.frameCount();
        if (total.isPresent() && total.getAsLong() > 0
                && (double) skipped / total.getAsLong() > options.corruptionTolerance()) {
            throw new ExcessiveFrameCorruptionException(profile.id(), skipped, total.getAsLong(),
                    options.corruptionTolerance());
        }
    }

    private void finish() {
        long read = encoded + skipped;
        if (read > 0 && (double) skipped / read > options.corruptionTolerance()) {
            throw new ExcessiveFrameCorruptionException(profile.id(), skipped, read, options.corruptionTolerance());
        }
        log.debug("Frame source exhausted: {} encoded, {} skipped", encoded, skipped);
        observer.onComplete(encoded, skipped);
    }

    /**
     * Discards in-flight frames, stops workers and closes the source. Idempotent.
     *
     * @throws UncheckedIOException if closing the source fails
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        window.forEach(future -> future.cancel(true));
        window.clear();
        if (executor != null) {
            executor.shutdownNow();
        }
        try {
            source.close();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot close frame source", e);
        }
    }
}
