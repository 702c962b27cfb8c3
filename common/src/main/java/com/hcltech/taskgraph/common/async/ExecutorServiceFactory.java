package com.hcltech.taskgraph.common.async;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Pluggable factory for the thread pools that run long-lived workers.
 *
 * Example:
 *   ExecutorService pool = ExecutorServiceFactory.fixed().create(4, "taskgraph-worker");
 */
@FunctionalInterface
public interface ExecutorServiceFactory {

    /**
     * Create an executor able to run {@code threads} tasks at the same time.
     * @param threads          number of threads, at least 1
     * @param threadNamePrefix prefix for thread names
     */
    ExecutorService create(int threads, String threadNamePrefix);

    /** Fixed thread pool of daemon threads named {@code prefix-1..n}. */
    static ExecutorServiceFactory fixed() {
        return new FixedImpl();
    }

    /** Worker count that leaves one core to the orchestrating thread. */
    static int defaultWorkerThreads() {
        return Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
    }

    final class FixedImpl implements ExecutorServiceFactory {
        @Override
        public ExecutorService create(int threads, String prefix) {
            int n = Math.max(1, threads);
            return Executors.newFixedThreadPool(n, namedDaemon(Objects.requireNonNullElse(prefix, "pool")));
        }

        private static ThreadFactory namedDaemon(String prefix) {
            AtomicInteger seq = new AtomicInteger(1);
            return r -> {
                Thread t = new Thread(r, prefix + "-" + seq.getAndIncrement());
                t.setDaemon(true);
                return t;
            };
        }
    }
}
