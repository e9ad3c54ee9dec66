package de.mirkosertic.mcp.reranklearn;

import de.mirkosertic.mcp.reranklearn.adaptation.AdaptationAlgorithm;
import de.mirkosertic.mcp.reranklearn.adaptation.AdaptiveAlgorithms;
import de.mirkosertic.mcp.reranklearn.adaptation.AdaptiveWeights;
import de.mirkosertic.mcp.reranklearn.adaptation.EmptyBatchException;
import de.mirkosertic.mcp.reranklearn.adaptation.WeightAdaptationEngine;
import de.mirkosertic.mcp.reranklearn.config.ApplicationConfig;
import de.mirkosertic.mcp.reranklearn.feedback.FeedbackBuffer;
import de.mirkosertic.mcp.reranklearn.feedback.FeedbackEvent;
import de.mirkosertic.mcp.reranklearn.feedback.InvalidFeedbackException;
import de.mirkosertic.mcp.reranklearn.model.ModelStore;
import de.mirkosertic.mcp.reranklearn.model.ModelStoreException;
import de.mirkosertic.mcp.reranklearn.model.ModelVersion;
import de.mirkosertic.mcp.reranklearn.monitor.PerformanceMonitor;
import de.mirkosertic.mcp.reranklearn.monitor.PerformanceSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Orchestrates the feedback learning loop: buffers feedback, adapts the live weights batch by
 * batch, checkpoints them in the model store and keeps the performance statistics.
 * <p>
 * Producers only touch the feedback buffer. Detached batches are handed to a single flush
 * thread through a bounded queue, so at most one flush cycle is ever in flight and the live
 * weights have exactly one writer besides explicit load and rollback calls. Those calls and the
 * commit step of a flush share {@link #weightLock}. Readers of the live weights never lock.
 * <p>
 * Every detach submits one drain task. A drain task processes all batches detached so far, in
 * detach order, so a task may find nothing left to do. Submission happens after the buffer lock is
 * released: when the hand-off queue is full, only the producer that detached the batch waits for
 * space, while other producers and readers of the buffer carry on.
 */
public class LearningService implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(LearningService.class);

    /**
     * Whether a flush cycle is currently running.
     */
    public enum State {
        IDLE,
        FLUSHING
    }

    private final WeightAdaptationEngine engine;
    private final ModelStore modelStore;
    private final PerformanceMonitor monitor;
    private final AdaptationAlgorithm algorithm;
    private final boolean checkpointOnFlush;
    private final long flushIntervalMs;

    private final FeedbackBuffer buffer;
    private final ThreadPoolExecutor flushExecutor;
    private final ScheduledExecutorService flushTimer;

    private final ReentrantLock weightLock = new ReentrantLock();
    private final ReentrantReadWriteLock lifecycleLock = new ReentrantReadWriteLock();
    private final AtomicLong completedFlushCycles = new AtomicLong(0);

    private volatile AdaptiveWeights liveWeights;
    private volatile State state = State.IDLE;
    private volatile boolean closed = false;

    public LearningService(final ApplicationConfig config,
                           final WeightAdaptationEngine engine,
                           final ModelStore modelStore,
                           final PerformanceMonitor monitor) {
        this.engine = engine;
        this.modelStore = modelStore;
        this.monitor = monitor;
        this.algorithm = config.getAlgorithm();
        this.checkpointOnFlush = config.isCheckpointOnFlush();
        this.flushIntervalMs = config.getFlushIntervalMs();
        this.liveWeights = modelStore.getDefaults();

        this.flushExecutor = new ThreadPoolExecutor(
                1, 1,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(config.getFlushQueueCapacity()),
                r -> {
                    final Thread thread = new Thread(r, "feedback-flush");
                    thread.setDaemon(false);
                    return thread;
                },
                waitForQueueSpace());

        this.flushTimer = Executors.newSingleThreadScheduledExecutor(r -> {
            final Thread t = new Thread(r, "feedback-flush-timer");
            t.setDaemon(true);
            return t;
        });

        this.buffer = new FeedbackBuffer(config.getBatchThreshold());

        logger.info("LearningService created: batchThreshold={}, algorithm={}, features={}",
                config.getBatchThreshold(), algorithm, liveWeights.featureNames());
    }

    /**
     * Read the model history and start the flush timer. The live weights stay at their defaults
     * until {@link #loadModel()} is called.
     *
     * @throws ModelStoreException if the model repository is unavailable
     */
    public void init() throws ModelStoreException {
        modelStore.init();
        if (flushIntervalMs > 0) {
            flushTimer.scheduleAtFixedRate(this::timedFlush, flushIntervalMs, flushIntervalMs, TimeUnit.MILLISECONDS);
            logger.debug("Started timed feedback flush every {}ms", flushIntervalMs);
        }
    }

    /**
     * Buffer one feedback event. Never waits for a running flush cycle; only the call that
     * detaches a batch while the hand-off queue is full waits for queue space.
     *
     * @throws InvalidFeedbackException if the event is null
     * @throws IllegalStateException    if the service has been closed
     */
    public void collectFeedback(final FeedbackEvent feedback) {
        if (feedback == null) {
            throw new InvalidFeedbackException("feedback event must not be null");
        }
        lifecycleLock.readLock().lock();
        try {
            if (closed) {
                throw new IllegalStateException("LearningService is closed");
            }
            if (buffer.collect(feedback)) {
                flushExecutor.execute(this::drainDetachedBatches);
            }
        } finally {
            lifecycleLock.readLock().unlock();
        }
        logger.debug("Feedback collected: query='{}', resultId={}, relevanceScore={}",
                feedback.query(), feedback.resultId(), feedback.relevanceScore());
    }

    /**
     * Process whatever is buffered and wait until that cycle, and every cycle queued before it,
     * has completed.
     *
     * @return the number of buffered events that were flushed
     * @throws InterruptedException if interrupted while waiting
     */
    public int flushFeedbackBuffer() throws InterruptedException {
        if (flushExecutor.isShutdown()) {
            logger.debug("Flush requested after shutdown, nothing to do");
            return 0;
        }
        final int flushed = buffer.detachPending();
        final Future<?> cycle = flushExecutor.submit(this::drainDetachedBatches);
        try {
            cycle.get();
        } catch (final ExecutionException e) {
            // runFlushCycle handles its own failures, so this only signals a broken executor
            throw new IllegalStateException("Feedback flush failed", e.getCause());
        }
        logger.info("Flushed feedback buffer: {} events", flushed);
        return flushed;
    }

    /**
     * Read-only view of the live weights.
     */
    public AdaptiveWeights getAdaptiveWeights() {
        return liveWeights;
    }

    public AdaptiveAlgorithms getAdaptiveAlgorithms() {
        return engine.getAlgorithms();
    }

    /** Algorithm used by every flush cycle. */
    public AdaptationAlgorithm getAlgorithm() {
        return algorithm;
    }

    /**
     * Snapshot the live weights as a new model version.
     *
     * @throws ModelStoreException if the snapshot cannot be persisted
     */
    public ModelVersion saveModel() throws ModelStoreException {
        weightLock.lock();
        try {
            final ModelVersion version = modelStore.save(liveWeights);
            logger.info("Learning model saved: version={}", version.versionId());
            return version;
        } catch (final ModelStoreException e) {
            logger.error("Failed to save learning model", e);
            monitor.recordStorageFailure(e.getMessage());
            throw e;
        } finally {
            weightLock.unlock();
        }
    }

    /**
     * Replace the live weights with the current stored version, or the defaults if none exists.
     * On failure the live weights are left untouched.
     *
     * @throws ModelStoreException if the stored version cannot be read or deserialized
     */
    public AdaptiveWeights loadModel() throws ModelStoreException {
        weightLock.lock();
        try {
            final AdaptiveWeights loaded = modelStore.load();
            liveWeights = loaded;
            logger.info("Learning model loaded: version={}", modelStore.currentVersionId().orElse("defaults"));
            return loaded;
        } catch (final ModelStoreException e) {
            logger.error("Failed to load learning model", e);
            throw e;
        } finally {
            weightLock.unlock();
        }
    }

    /**
     * Make an earlier model version live.
     *
     * @return false if the version is unknown, live weights are then unchanged
     * @throws ModelStoreException if the version exists but cannot be read, or the pointer cannot be stored
     */
    public boolean rollbackToVersion(final String versionId) throws ModelStoreException {
        logger.info("Rolling back model version: {}", versionId);
        weightLock.lock();
        try {
            final Optional<ModelVersion> target = modelStore.rollback(versionId);
            if (target.isEmpty()) {
                logger.warn("Rollback rejected, unknown model version: {}", versionId);
                return false;
            }
            liveWeights = target.get().weights();
            logger.info("Model rollback completed: version={}", versionId);
            return true;
        } catch (final ModelStoreException e) {
            logger.error("Model rollback to {} failed", versionId, e);
            throw e;
        } finally {
            weightLock.unlock();
        }
    }

    public PerformanceSnapshot getPerformanceMonitoring() {
        return monitor.snapshot();
    }

    public List<ModelVersion> getModelHistory() {
        return modelStore.history();
    }

    public Optional<String> getCurrentVersionId() {
        return modelStore.currentVersionId();
    }

    public State getState() {
        return state;
    }

    public int getPendingFeedbackCount() {
        return buffer.size();
    }

    /** Number of flush cycles that committed a non-empty batch. */
    public long getCompletedFlushCycles() {
        return completedFlushCycles.get();
    }

    /**
     * Stop accepting feedback, process everything still buffered and stop the flush thread.
     */
    @Override
    public void close() {
        lifecycleLock.writeLock().lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
        } finally {
            lifecycleLock.writeLock().unlock();
        }

        logger.info("Shutting down LearningService");
        flushTimer.shutdownNow();
        try {
            flushFeedbackBuffer();
        } catch (final InterruptedException e) {
            logger.warn("Interrupted while flushing feedback on shutdown");
            Thread.currentThread().interrupt();
        }

        flushExecutor.shutdown();
        try {
            if (!flushExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("Flush executor did not terminate in time, forcing shutdown");
                flushExecutor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            logger.error("Interrupted while waiting for the flush executor to terminate", e);
            flushExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Drain task of the flush thread. Processes every batch detached so far, oldest first.
     */
    private void drainDetachedBatches() {
        List<FeedbackEvent> batch;
        while ((batch = buffer.pollDetached()) != null) {
            runFlushCycle(batch);
        }
    }

    private void timedFlush() {
        try {
            final int detached = buffer.detachPending();
            if (detached > 0) {
                logger.debug("Timed flush of {} buffered events", detached);
                flushExecutor.execute(this::drainDetachedBatches);
            }
        } catch (final Exception e) {
            // ScheduledExecutorService cancels the periodic task if it throws
            logger.error("Timed feedback flush failed", e);
        }
    }

    /**
     * One flush cycle. Runs on the flush thread only.
     */
    private void runFlushCycle(final List<FeedbackEvent> batch) {
        if (batch.isEmpty()) {
            return;
        }
        state = State.FLUSHING;
        logger.info("Processing feedback batch: {} events", batch.size());
        weightLock.lock();
        try {
            final AdaptiveWeights updated = engine.apply(batch, liveWeights, algorithm);
            liveWeights = updated;
            monitor.record(batch);
            completedFlushCycles.incrementAndGet();
            final String versionId = checkpointOnFlush ? checkpoint(updated) : null;
            logger.info("Feedback batch committed: events={}, algorithm={}, version={}",
                    batch.size(), algorithm, versionId);
        } catch (final EmptyBatchException e) {
            logger.debug("Skipped feedback batch: {}", e.getMessage());
        } catch (final RuntimeException e) {
            logger.error("Failed to process feedback batch of {} events", batch.size(), e);
        } finally {
            weightLock.unlock();
            state = State.IDLE;
        }
    }

    /**
     * Persist a committed update. A failure keeps the in-memory update and is only recorded.
     */
    private String checkpoint(final AdaptiveWeights weights) {
        try {
            return modelStore.save(weights).versionId();
        } catch (final ModelStoreException e) {
            logger.error("Failed to checkpoint committed weights, keeping in-memory update", e);
            monitor.recordStorageFailure(e.getMessage());
            return null;
        }
    }

    private static RejectedExecutionHandler waitForQueueSpace() {
        return (task, executor) -> {
            if (executor.isShutdown()) {
                throw new RejectedExecutionException("Flush executor is shut down");
            }
            try {
                executor.getQueue().put(task);
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RejectedExecutionException("Interrupted while waiting for flush queue space", e);
            }
        };
    }
}
