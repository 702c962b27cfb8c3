package com.hcltech.taskgraph.dag;

import com.hcltech.taskgraph.common.ITimeService;
import com.hcltech.taskgraph.common.async.ExecutorServiceFactory;
import com.hcltech.taskgraph.common.async.IntervalResetTokenBucket;
import com.hcltech.taskgraph.common.async.TokenBucket;
import com.hcltech.taskgraph.common.function.ThrowingConsumer;
import com.hcltech.taskgraph.common.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs a {@link TaskGraph} on a pool of workers.
 * <p>
 * The calling thread is the orchestrator: it alone owns the {@link GraphRun} and the token
 * bucket. It loops over two phases until every node is finished:
 * <ol>
 *   <li>admission: while nodes are ready and the bucket grants a token, hand the oldest ready
 *   node to the workers;</li>
 *   <li>completion: wait for a completion, then drain every completion already posted, marking
 *   nodes succeeded (releasing dependents) or failed (blocking everything downstream).</li>
 * </ol>
 * At most {@code maxTokens} nodes are in flight at any instant. A failed node only takes its own
 * subtree down; independent branches keep running and the run ends with a {@link RunReport}.
 */
public final class DagScheduler {
    private static final Logger log = LoggerFactory.getLogger(DagScheduler.class);

    private final SchedulerConfig config;
    private final Metrics metrics;
    private final ITimeService time;
    private final ExecutorServiceFactory executorFactory;

    /** Cancellation flag of the run in progress; null when idle. */
    private final AtomicReference<AtomicBoolean> currentRun = new AtomicReference<>();

    public DagScheduler(SchedulerConfig config) {
        this(config, Metrics.nullMetrics);
    }

    public DagScheduler(SchedulerConfig config, Metrics metrics) {
        this(config, metrics, ITimeService.real, ExecutorServiceFactory.fixed());
    }

    public DagScheduler(SchedulerConfig config, Metrics metrics, ITimeService time, ExecutorServiceFactory executorFactory) {
        this.config = Objects.requireNonNull(config, "config");
        this.metrics = metrics == null ? Metrics.nullMetrics : metrics;
        this.time = Objects.requireNonNull(time, "time");
        this.executorFactory = Objects.requireNonNull(executorFactory, "executorFactory");
    }

    public SchedulerConfig config() {
        return config;
    }

    /**
     * Asks the run in progress to stop. Nothing new is admitted, every unfinished node is
     * reported {@link NodeOutcome#CANCELLED} and workers still inside the work function are
     * interrupted. Safe to call from any thread; no effect when nothing is running.
     */
    public void cancel() {
        AtomicBoolean cancelRequested = currentRun.get();
        if (cancelRequested != null) cancelRequested.set(true);
    }

    public boolean isRunning() {
        return currentRun.get() != null;
    }

    /**
     * Processes every node of {@code graph} exactly once, each only after all of its
     * dependencies succeeded. Blocks until the graph drains, the run is cancelled or the run
     * timeout expires.
     *
     * @throws CycleDetectedException if the graph has a cycle; no worker is started
     * @throws IllegalStateException  if this scheduler is already running a graph
     */
    public <T> RunReport<T> run(TaskGraph<T> graph, ThrowingConsumer<T> process) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(process, "process");
        AtomicBoolean cancelRequested = new AtomicBoolean(false);
        if (!currentRun.compareAndSet(null, cancelRequested)) {
            throw new IllegalStateException("DagScheduler is already running a graph");
        }
        try {
            graph.topologicalGenerations();
            GraphRun<T> run = graph.newRun();
            if (run.isComplete()) return run.report(Duration.ZERO, false, false);
            return orchestrate(graph, run, process, cancelRequested);
        } finally {
            currentRun.set(null);
        }
    }

    private <T> RunReport<T> orchestrate(TaskGraph<T> graph, GraphRun<T> run, ThrowingConsumer<T> process,
                                         AtomicBoolean cancelRequested) {
        long start = time.currentTimeNanos();
        long deadline = config.hasRunTimeout() ? start + config.runTimeout().toNanos() : Long.MAX_VALUE;
        long pollNanos = config.pollInterval().toNanos();
        TokenBucket bucket = new IntervalResetTokenBucket(config.maxTokens(), config.refillInterval(), time);

        log.info("Running {} tasks on {} workers (maxTokens={}, refillInterval={})",
                graph.size(), config.workerThreads(), config.maxTokens(), config.refillInterval());

        boolean timedOut = false;
        boolean cancelled = false;
        int inFlight = 0;

        try (WorkerPool<T> pool = new WorkerPool<>(config.workerThreads(), executorFactory, process, time, config.shutdownTimeout())) {
            while (!run.isComplete()) {
                while (run.hasReady() && bucket.tryAcquire(inFlight)) {
                    TaskNode<T> node = run.pollReady();
                    inFlight++;
                    if (inFlight > config.maxTokens()) {
                        throw new IllegalStateException("In flight " + inFlight + " exceeds maxTokens " + config.maxTokens());
                    }
                    metrics.increment("taskgraph.admitted");
                    metrics.histogram("taskgraph.inflight", inFlight);
                    log.debug("Admitted {} (inFlight={}, tokens={})", node.value(), inFlight, bucket.availableTokens());
                    pool.submit(node);
                }

                if (inFlight == 0 && !run.hasReady()) {
                    throw new IllegalStateException("Scheduler stalled: " + (run.size() - run.finishedCount())
                            + " tasks unfinished with nothing ready or in flight");
                }

                long wait = run.hasReady() ? Math.min(pollNanos, bucket.nanosUntilRefill()) : pollNanos;
                if (deadline != Long.MAX_VALUE) {
                    wait = Math.max(0L, Math.min(wait, deadline - time.currentTimeNanos()));
                }
                Completion<T> completion;
                try {
                    completion = pool.poll(wait);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Orchestrator interrupted; cancelling run");
                    cancelled = true;
                    break;
                }
                while (completion != null) {
                    inFlight--;
                    apply(run, completion);
                    completion = pool.pollNow();
                }

                if (run.isComplete()) break;
                if (cancelRequested.get()) {
                    cancelled = true;
                    break;
                }
                if (time.currentTimeNanos() >= deadline) {
                    timedOut = true;
                    break;
                }
            }

            if (cancelled || timedOut) {
                List<T> dropped = run.cancelRemaining();
                dropped.forEach(v -> metrics.increment("taskgraph.cancelled"));
                log.warn("Run {} with {} tasks unfinished: {}", timedOut ? "timed out after " + config.runTimeout() : "cancelled",
                        dropped.size(), dropped);
            }
        }

        RunReport<T> report = run.report(Duration.ofNanos(time.currentTimeNanos() - start), timedOut, cancelled);
        if (report.isSuccess()) {
            log.info("Run finished: {}", report);
        } else {
            log.warn("Run finished with problems: {}", report);
        }
        return report;
    }

    private <T> void apply(GraphRun<T> run, Completion<T> completion) {
        TaskNode<T> node = completion.node();
        metrics.histogram("taskgraph.task.millis", TimeUnit.NANOSECONDS.toMillis(completion.durationNanos()));
        if (completion.isSuccess()) {
            List<T> promoted = run.finish(node);
            metrics.increment("taskgraph.succeeded");
            log.debug("Finished {} ({}/{}), now ready: {}", node.value(), run.finishedCount(), run.size(), promoted);
        } else {
            log.warn("Task {} failed", node.value(), completion.error());
            List<T> blocked = run.fail(node, completion.error());
            metrics.increment("taskgraph.failed");
            blocked.forEach(v -> metrics.increment("taskgraph.blocked"));
            if (!blocked.isEmpty()) log.warn("Blocked {} dependents of {}: {}", blocked.size(), node.value(), blocked);
        }
    }
}
