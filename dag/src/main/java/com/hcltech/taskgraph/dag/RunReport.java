package com.hcltech.taskgraph.dag;

import com.hcltech.taskgraph.common.errorsor.ErrorsOr;

import java.time.Duration;
import java.util.*;

/**
 * Outcome of one run: what happened to every node, why the unsuccessful ones did not succeed,
 * and whether the run was cut short.
 *
 * @param outcomes  every node of the graph, in graph order
 * @param failures  work function failures, in the order they were reported
 * @param blockedBy for each blocked node, the failed nodes it transitively depends on
 * @param elapsed   wall-clock duration of the run
 * @param timedOut  the run hit its configured timeout
 * @param cancelled the run was cancelled by a caller
 */
public record RunReport<T>(
        Map<T, NodeOutcome> outcomes,
        List<TaskFailure<T>> failures,
        Map<T, Set<T>> blockedBy,
        Duration elapsed,
        boolean timedOut,
        boolean cancelled
) {
    public RunReport {
        outcomes = Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
        failures = List.copyOf(failures);
        Map<T, Set<T>> copy = new LinkedHashMap<>();
        blockedBy.forEach((k, v) -> copy.put(k, Collections.unmodifiableSet(new LinkedHashSet<>(v))));
        blockedBy = Collections.unmodifiableMap(copy);
        Objects.requireNonNull(elapsed, "elapsed");
    }

    public boolean isSuccess() {
        return outcomes.values().stream().allMatch(o -> o == NodeOutcome.SUCCEEDED);
    }

    public Optional<NodeOutcome> outcome(T value) {
        return Optional.ofNullable(outcomes.get(value));
    }

    public List<T> valuesWith(NodeOutcome outcome) {
        List<T> result = new ArrayList<>();
        outcomes.forEach((v, o) -> {
            if (o == outcome) result.add(v);
        });
        return result;
    }

    public int count(NodeOutcome outcome) {
        return valuesWith(outcome).size();
    }

    /** One line per failed, blocked or cancelled node; empty when the run succeeded. */
    public List<String> errorMessages() {
        List<String> messages = new ArrayList<>();
        for (TaskFailure<T> f : failures) messages.add(f.message());
        blockedBy.forEach((v, roots) -> messages.add("Task " + v + " blocked by failed " + roots));
        for (T v : valuesWith(NodeOutcome.CANCELLED)) {
            messages.add("Task " + v + (timedOut ? " cancelled by run timeout" : " cancelled"));
        }
        return messages;
    }

    public ErrorsOr<RunReport<T>> toErrorsOr() {
        return ErrorsOr.valueOrErrors(this, errorMessages());
    }

    public void throwIfFailed() {
        if (!isSuccess()) throw new TaskGraphFailedException(this);
    }

    @Override
    public String toString() {
        return "RunReport(succeeded=" + count(NodeOutcome.SUCCEEDED)
                + ", failed=" + count(NodeOutcome.FAILED)
                + ", blocked=" + count(NodeOutcome.BLOCKED)
                + ", cancelled=" + count(NodeOutcome.CANCELLED)
                + ", elapsed=" + elapsed.toMillis() + "ms"
                + (timedOut ? ", timedOut" : "") + (cancelled ? ", cancelled" : "") + ")";
    }
}
