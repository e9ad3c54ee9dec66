package de.mirkosertic.mcp.reranklearn.feedback;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Thread-safe accumulator for incoming feedback events.
 * <p>
 * When the buffer reaches the batch threshold, the accumulated events are detached and appended
 * to a queue of detached batches inside the same critical section that appended the last event.
 * Two producers can therefore never both observe the threshold for the same generation, and no
 * event can be lost or counted twice across a flush boundary.
 * <p>
 * The lock is only held for the append and the swap. Consumers take detached batches with
 * {@link #pollDetached()} in detach order, so whoever hands them on to processing can do so
 * without holding the buffer lock.
 */
public class FeedbackBuffer {

    private static final Logger logger = LoggerFactory.getLogger(FeedbackBuffer.class);

    private final int batchThreshold;
    private final Object lock = new Object();
    private final Deque<List<FeedbackEvent>> detached = new ArrayDeque<>();

    private List<FeedbackEvent> pending;
    private long generation = 0;

    public FeedbackBuffer(final int batchThreshold) {
        if (batchThreshold < 1) {
            throw new IllegalArgumentException("batchThreshold must be at least 1");
        }
        this.batchThreshold = batchThreshold;
        this.pending = new ArrayList<>(batchThreshold);
    }

    /**
     * Append an event. If this append fills the buffer, the batch is detached.
     *
     * @param event the event to append, never null
     * @return true if a batch was detached and is waiting in {@link #pollDetached()}
     */
    public boolean collect(final FeedbackEvent event) {
        if (event == null) {
            throw new InvalidFeedbackException("feedback event must not be null");
        }
        synchronized (lock) {
            pending.add(event);
            if (pending.size() >= batchThreshold) {
                detach();
                logger.debug("Batch threshold {} reached, detached generation {}", batchThreshold, generation);
                return true;
            }
            return false;
        }
    }

    /**
     * Detach whatever is buffered, regardless of size. An empty buffer detaches nothing.
     *
     * @return the number of events detached
     */
    public int detachPending() {
        synchronized (lock) {
            final int size = pending.size();
            if (size > 0) {
                detach();
            }
            return size;
        }
    }

    /**
     * Take the oldest detached batch.
     *
     * @return the batch, or null if no batch is waiting
     */
    public @Nullable List<FeedbackEvent> pollDetached() {
        synchronized (lock) {
            return detached.pollFirst();
        }
    }

    /** Number of events not yet detached. */
    public int size() {
        synchronized (lock) {
            return pending.size();
        }
    }

    /** Number of detached batches not yet taken. */
    public int detachedCount() {
        synchronized (lock) {
            return detached.size();
        }
    }

    /** Number of batches detached so far. */
    public long getGeneration() {
        synchronized (lock) {
            return generation;
        }
    }

    private void detach() {
        detached.addLast(List.copyOf(pending));
        pending = new ArrayList<>(batchThreshold);
        generation++;
    }
}
