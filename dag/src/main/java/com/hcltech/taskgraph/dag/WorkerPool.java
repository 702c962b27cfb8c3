package com.hcltech.taskgraph.dag;

import com.hcltech.taskgraph.common.ITimeService;
import com.hcltech.taskgraph.common.async.ExecutorServiceFactory;
import com.hcltech.taskgraph.common.function.ThrowingConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fixed set of long-lived workers between two queues. Each worker takes an admitted node from
 * the task queue, runs the work function on its value and posts a {@link Completion} to the
 * done queue, whatever the work function did. Workers never touch graph state.
 */
final class WorkerPool<T> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    static final String THREAD_PREFIX = "taskgraph-worker";

    private final BlockingQueue<TaskNode<T>> tasks = new LinkedBlockingQueue<>();
    private final BlockingQueue<Completion<T>> done = new LinkedBlockingQueue<>();
    private final AtomicBoolean running = new AtomicBoolean(true);

    private final ThrowingConsumer<T> process;
    private final ITimeService time;
    private final Duration shutdownTimeout;
    private final ExecutorService executor;

    WorkerPool(int threads,
               ExecutorServiceFactory factory,
               ThrowingConsumer<T> process,
               ITimeService time,
               Duration shutdownTimeout) {
        if (threads <= 0) throw new IllegalArgumentException("threads must be > 0");
        this.process = Objects.requireNonNull(process, "process");
        this.time = Objects.requireNonNull(time, "time");
        this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
        this.executor = Objects.requireNonNull(factory, "factory").create(threads, THREAD_PREFIX);
        for (int i = 0; i < threads; i++) executor.execute(this::workLoop);
    }

    void submit(TaskNode<T> node) {
        if (!running.get()) throw new IllegalStateException("WorkerPool is shut down");
        tasks.add(node);
    }

    /** Waits up to {@code timeoutNanos} for the next completion; null if none arrived. */
    Completion<T> poll(long timeoutNanos) throws InterruptedException {
        return done.poll(timeoutNanos, TimeUnit.NANOSECONDS);
    }

    /** Next completion if one is already waiting, otherwise null. */
    Completion<T> pollNow() {
        return done.poll();
    }

    /**
     * Runs until {@link #shutdown()}. Only shutdown ends a worker: an interrupt left behind by a
     * work function is cleared before the next take.
     */
    private void workLoop() {
        while (running.get()) {
            TaskNode<T> node;
            try {
                node = tasks.take();
            } catch (InterruptedException e) {
                if (!running.get()) return;
                log.debug("Worker {} interrupted while idle; carrying on", Thread.currentThread().getName());
                continue;
            }
            done.add(execute(node));
            Thread.interrupted();
        }
    }

    Completion<T> execute(TaskNode<T> node) {
        long start = time.currentTimeNanos();
        try {
            process.accept(node.value());
            return Completion.success(node, time.currentTimeNanos() - start);
        } catch (Throwable t) {
            return Completion.failure(node, t, time.currentTimeNanos() - start);
        }
    }

    /**
     * Stops the workers, interrupting any that are still inside the work function, and waits for
     * them up to the shutdown timeout.
     *
     * @return true if every worker stopped in time
     */
    boolean shutdown() {
        running.set(false);
        executor.shutdownNow();
        try {
            boolean stopped = executor.awaitTermination(shutdownTimeout.toNanos(), TimeUnit.NANOSECONDS);
            if (!stopped) {
                log.warn("Workers did not stop within {}; {} tasks were still queued", shutdownTimeout, tasks.size());
            }
            return stopped;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for workers to stop");
            return false;
        }
    }

    @Override
    public void close() {
        shutdown();
    }
}
