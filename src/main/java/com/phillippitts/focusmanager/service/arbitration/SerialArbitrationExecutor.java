package com.phillippitts.focusmanager.service.arbitration;

import com.phillippitts.focusmanager.exception.ArbitrationRejectedException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.core.task.TaskDecorator;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.Comparator;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single-worker executor that runs arbitration tasks one at a time on a dedicated thread.
 *
 * <p>Backed by a {@link ThreadPoolTaskExecutor} with exactly one thread and a two-lane queue.
 * Tasks enter through one of two lanes:
 * <ul>
 *   <li><b>Normal</b> ({@link #submit(Runnable)}) - FIFO among themselves</li>
 *   <li><b>Urgent</b> ({@link #submitToFront(Runnable)}) - run before every normal task that has
 *       not started yet, FIFO among themselves. A task that is already running is never interrupted.</li>
 * </ul>
 *
 * <p><b>Task Decoration:</b> the {@link TaskDecorator} is applied on the submitting thread before the
 * task is tagged with its lane, so the queue can still order decorated tasks.
 *
 * <p><b>Failure Handling:</b> an exception escaping a task is logged and the worker moves on to the
 * next task.
 *
 * <p><b>Shutdown:</b> {@link #shutdown()} rejects further submissions with
 * {@link ArbitrationRejectedException}; tasks already queued are still executed before the worker
 * exits, so pending release futures always complete.
 *
 * @since 1.0
 */
public class SerialArbitrationExecutor implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(SerialArbitrationExecutor.class);

    private static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

    private static final Comparator<Runnable> LANE_ORDER = Comparator
            .comparingInt((Runnable task) -> ((LaneTask) task).lane.ordinal())
            .thenComparingLong(task -> ((LaneTask) task).sequence);

    private enum Lane { URGENT, NORMAL }

    private final TaskDecorator taskDecorator;
    private final AtomicLong sequence = new AtomicLong();
    private final ThreadPoolTaskExecutor executor;
    private volatile Thread worker;
    private final String name;

    /**
     * Creates an executor with no task decoration and the default shutdown timeout.
     *
     * @param threadNamePrefix prefix for the worker thread name
     */
    public SerialArbitrationExecutor(String threadNamePrefix) {
        this(threadNamePrefix, null, DEFAULT_SHUTDOWN_TIMEOUT);
    }

    /**
     * Creates and starts an executor.
     *
     * @param threadNamePrefix prefix for the worker thread name (e.g., "audio-focus-")
     * @param taskDecorator decorator applied on the submitting thread (nullable)
     * @param shutdownTimeout how long {@link #close()} waits for queued work to drain
     */
    public SerialArbitrationExecutor(String threadNamePrefix, TaskDecorator taskDecorator, Duration shutdownTimeout) {
        Objects.requireNonNull(threadNamePrefix, "threadNamePrefix must not be null");
        Objects.requireNonNull(shutdownTimeout, "shutdownTimeout must not be null");
        this.taskDecorator = taskDecorator != null ? taskDecorator : runnable -> runnable;

        ThreadPoolTaskExecutor laneExecutor = new LaneThreadPoolTaskExecutor();
        laneExecutor.setCorePoolSize(1);
        laneExecutor.setMaxPoolSize(1);
        laneExecutor.setThreadNamePrefix(threadNamePrefix);
        laneExecutor.setDaemon(true);
        laneExecutor.setWaitForTasksToCompleteOnShutdown(true);
        laneExecutor.setAwaitTerminationMillis(shutdownTimeout.toMillis());
        laneExecutor.initialize();
        this.executor = laneExecutor;

        // Start the worker now so its name is known before the first task
        executor.getThreadPoolExecutor().prestartCoreThread();
        this.name = worker.getName();
        LOG.debug("Arbitration executor started (thread={})", name);
    }

    /**
     * Queues a task on the normal lane.
     *
     * @throws ArbitrationRejectedException if the executor has been shut down
     */
    public void submit(Runnable task) {
        enqueue(Lane.NORMAL, task);
    }

    /**
     * Queues a task on the urgent lane, ahead of all normal tasks not yet started.
     *
     * @throws ArbitrationRejectedException if the executor has been shut down
     */
    public void submitToFront(Runnable task) {
        enqueue(Lane.URGENT, task);
    }

    private void enqueue(Lane lane, Runnable task) {
        Objects.requireNonNull(task, "task must not be null");
        LaneTask laneTask = new LaneTask(lane, sequence.getAndIncrement(), taskDecorator.decorate(task));
        try {
            executor.execute(laneTask);
        } catch (TaskRejectedException e) {
            throw new ArbitrationRejectedException(name, e);
        }
    }

    /**
     * Stops accepting new tasks without waiting. Tasks already queued still run.
     */
    public void shutdown() {
        ThreadPoolExecutor pool = executor.getThreadPoolExecutor();
        if (!pool.isShutdown()) {
            LOG.info("Arbitration executor shutting down (thread={}, pending={})", name, pool.getQueue().size());
        }
        pool.shutdown();
    }

    /**
     * Waits for the worker to finish draining after {@link #shutdown()}.
     *
     * @return {@code true} if the worker exited within the timeout
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return executor.getThreadPoolExecutor().awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Shuts down and waits up to the configured timeout for queued work to drain.
     * Called from the worker itself, it only initiates shutdown.
     */
    @Override
    public void close() {
        shutdown();
        if (Thread.currentThread() != worker) {
            executor.shutdown();
        }
    }

    public String getName() {
        return name;
    }

    /**
     * @return {@code true} until shutdown has been initiated
     */
    public boolean isRunning() {
        return !executor.getThreadPoolExecutor().isShutdown();
    }

    public int getPendingUrgentCount() {
        return countPending(Lane.URGENT);
    }

    public int getPendingNormalCount() {
        return countPending(Lane.NORMAL);
    }

    /**
     * @return the underlying pool, for metrics
     */
    public ThreadPoolExecutor getThreadPoolExecutor() {
        return executor.getThreadPoolExecutor();
    }

    private int countPending(Lane lane) {
        int count = 0;
        for (Runnable task : executor.getThreadPoolExecutor().getQueue()) {
            if (((LaneTask) task).lane == lane) {
                count++;
            }
        }
        return count;
    }

    private final class LaneThreadPoolTaskExecutor extends ThreadPoolTaskExecutor {

        @Override
        protected BlockingQueue<Runnable> createQueue(int queueCapacity) {
            return new PriorityBlockingQueue<>(11, LANE_ORDER);
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = super.newThread(runnable);
            worker = thread;
            return thread;
        }
    }

    private final class LaneTask implements Runnable {
        private final Lane lane;
        private final long sequence;
        private final Runnable task;

        LaneTask(Lane lane, long sequence, Runnable task) {
            this.lane = lane;
            this.sequence = sequence;
            this.task = task;
        }

        @Override
        public void run() {
            try {
                task.run();
            } catch (RuntimeException e) {
                LOG.error("Arbitration task failed (thread={}, lane={})", name, lane, e);
            }
        }
    }
}
