package com.hcltech.taskgraph.dag;

import com.hcltech.taskgraph.common.IEnvGetter;
import com.hcltech.taskgraph.common.async.ExecutorServiceFactory;
import com.hcltech.taskgraph.common.async.IntervalResetTokenBucket;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for {@link DagScheduler}.
 *
 * @param maxTokens       most nodes admitted but not yet finished at any instant (>0)
 * @param refillInterval  minimum time between token bucket resets (>0)
 * @param workerThreads   long-lived worker threads (>0)
 * @param runTimeout      whole-run limit; {@link Duration#ZERO} disables it (>=0)
 * @param pollInterval    longest the orchestrator waits for a completion before rechecking
 *                        cancellation and timeout (>0)
 * @param shutdownTimeout how long to wait for workers to stop once the run is over (>=0)
 */
public record SchedulerConfig(
        int maxTokens,
        Duration refillInterval,
        int workerThreads,
        Duration runTimeout,
        Duration pollInterval,
        Duration shutdownTimeout
) {
    public static final String MAX_TOKENS_ENV = "TASKGRAPH_MAX_TOKENS";
    public static final String REFILL_MILLIS_ENV = "TASKGRAPH_REFILL_MILLIS";
    public static final String WORKER_THREADS_ENV = "TASKGRAPH_WORKER_THREADS";
    public static final String RUN_TIMEOUT_MILLIS_ENV = "TASKGRAPH_RUN_TIMEOUT_MILLIS";
    public static final String POLL_MILLIS_ENV = "TASKGRAPH_POLL_MILLIS";
    public static final String SHUTDOWN_TIMEOUT_MILLIS_ENV = "TASKGRAPH_SHUTDOWN_TIMEOUT_MILLIS";

    public static final Duration DEFAULT_REFILL_INTERVAL = Duration.ofMillis(100);
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(50);
    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);
    /** Upper bound for every duration, so deadlines computed in nanoseconds cannot overflow. */
    public static final Duration MAX_DURATION = IntervalResetTokenBucket.MAX_REFILL_INTERVAL;

    public SchedulerConfig {
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be > 0");
        }
        Objects.requireNonNull(refillInterval, "refillInterval");
        if (refillInterval.isZero() || refillInterval.isNegative()) {
            throw new IllegalArgumentException("refillInterval must be > 0");
        }
        requireAtMostMax("refillInterval", refillInterval);
        if (workerThreads <= 0) {
            throw new IllegalArgumentException("workerThreads must be > 0");
        }
        Objects.requireNonNull(runTimeout, "runTimeout");
        if (runTimeout.isNegative()) {
            throw new IllegalArgumentException("runTimeout must be >= 0");
        }
        requireAtMostMax("runTimeout", runTimeout);
        Objects.requireNonNull(pollInterval, "pollInterval");
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be > 0");
        }
        requireAtMostMax("pollInterval", pollInterval);
        Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
        if (shutdownTimeout.isNegative()) {
            throw new IllegalArgumentException("shutdownTimeout must be >= 0");
        }
        requireAtMostMax("shutdownTimeout", shutdownTimeout);
    }

    private static void requireAtMostMax(String name, Duration d) {
        if (d.compareTo(MAX_DURATION) > 0) {
            throw new IllegalArgumentException(name + " must be <= " + MAX_DURATION);
        }
    }

    /** Defaults for everything but the admission parameters. */
    public static SchedulerConfig of(int maxTokens, Duration refillInterval) {
        return new SchedulerConfig(maxTokens, refillInterval, ExecutorServiceFactory.defaultWorkerThreads(),
                Duration.ZERO, DEFAULT_POLL_INTERVAL, DEFAULT_SHUTDOWN_TIMEOUT);
    }

    /** Reads the {@code TASKGRAPH_*} variables. Only the token count is required. */
    public static SchedulerConfig fromEnv(IEnvGetter env) {
        return new SchedulerConfig(
                IEnvGetter.getInt(env, MAX_TOKENS_ENV),
                IEnvGetter.getMillisOr(env, REFILL_MILLIS_ENV, DEFAULT_REFILL_INTERVAL),
                IEnvGetter.getIntOr(env, WORKER_THREADS_ENV, ExecutorServiceFactory.defaultWorkerThreads()),
                IEnvGetter.getMillisOr(env, RUN_TIMEOUT_MILLIS_ENV, Duration.ZERO),
                IEnvGetter.getMillisOr(env, POLL_MILLIS_ENV, DEFAULT_POLL_INTERVAL),
                IEnvGetter.getMillisOr(env, SHUTDOWN_TIMEOUT_MILLIS_ENV, DEFAULT_SHUTDOWN_TIMEOUT));
    }

    public SchedulerConfig withWorkerThreads(int threads) {
        return new SchedulerConfig(maxTokens, refillInterval, threads, runTimeout, pollInterval, shutdownTimeout);
    }

    public SchedulerConfig withRunTimeout(Duration timeout) {
        return new SchedulerConfig(maxTokens, refillInterval, workerThreads, timeout, pollInterval, shutdownTimeout);
    }

    public boolean hasRunTimeout() {
        return !runTimeout.isZero();
    }
}
