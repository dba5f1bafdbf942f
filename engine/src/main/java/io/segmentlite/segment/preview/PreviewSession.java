package io.segmentlite.segment.preview;

import io.segmentlite.segment.model.SegmentDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Consumer;

/**
 * Previews for one editing session, where only the most recent request matters.
 *
 * Each {@link #request} supersedes the preview still running. A superseded preview is
 * never published, even if it finishes after the newer one was requested.
 *
 * Cancellation never interrupts a running preview: the executor usually borrows one
 * JDBC connection, and interrupting a thread inside a driver call can break that
 * connection for every other user. A running query is left to finish and its result
 * dropped; a queued one does not start.
 */
public final class PreviewSession implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(PreviewSession.class);

    private final PreviewService service;
    private final ExecutorService executor;
    private final Consumer<SegmentPreview> listener;

    private final Object lock = new Object();
    private long generation;
    private Future<?> inFlight;
    private SegmentPreview latest;
    private boolean closed;

    /**
     * @param executor Runs the previews; owned by the caller
     * @param listener Receives each preview that is still current when it completes;
     *                 called while the session lock is held
     */
    public PreviewSession(PreviewService service, ExecutorService executor, Consumer<SegmentPreview> listener) {
        this.service = Objects.requireNonNull(service, "Preview service cannot be null");
        this.executor = Objects.requireNonNull(executor, "Executor cannot be null");
        this.listener = Objects.requireNonNull(listener, "Listener cannot be null");
    }

    public PreviewSession(PreviewService service, ExecutorService executor) {
        this(service, executor, preview -> { });
    }

    /**
     * Schedules a preview of the definition, superseding any earlier request.
     *
     * @return The scheduled task, for callers that want to wait on it
     */
    public Future<?> request(SegmentDefinition definition) {
        Objects.requireNonNull(definition, "Segment definition cannot be null");
        synchronized (lock) {
            if (closed) {
                throw new IllegalStateException("Preview session is closed");
            }
            long requested = ++generation;
            if (inFlight != null && !inFlight.isDone()) {
                logger.debug("Superseding preview {} with {}", requested - 1, requested);
                inFlight.cancel(false);
            }
            inFlight = executor.submit(() -> run(requested, definition));
            return inFlight;
        }
    }

    /**
     * The last preview published, if any.
     */
    public Optional<SegmentPreview> latest() {
        synchronized (lock) {
            return Optional.ofNullable(latest);
        }
    }

    private void run(long requested, SegmentDefinition definition) {
        SegmentPreview preview = service.preview(definition);
        synchronized (lock) {
            if (closed || requested != generation) {
                logger.debug("Dropping superseded preview {}", requested);
                return;
            }
            latest = preview;
            listener.accept(preview);
        }
    }

    @Override
    public void close() {
        synchronized (lock) {
            closed = true;
            generation++;
            if (inFlight != null) {
                inFlight.cancel(false);
            }
        }
    }
}
