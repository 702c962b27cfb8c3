package com.hcltech.taskgraph.dag;

import java.time.Duration;
import java.util.*;

/**
 * Mutable state of one execution of a {@link TaskGraph}.
 * <p>
 * Nodes move {@code WAITING -> READY -> ADMITTED -> FINISHED}; a node reaches READY exactly once,
 * when its last pending dependency finishes, and is finished exactly once.
 * <p>
 * Not thread-safe: a single orchestrating thread owns it. Workers only ever see node values.
 */
public final class GraphRun<T> {

    public enum State {WAITING, READY, ADMITTED, FINISHED}

    private final TaskGraph<T> graph;
    private final int[] pending;
    private final State[] state;
    private final NodeOutcome[] outcome;
    private final Deque<Integer> ready = new ArrayDeque<>();
    private final List<TaskFailure<T>> failures = new ArrayList<>();
    private final Map<Integer, Set<T>> blockedBy = new LinkedHashMap<>();
    private int finishedCount;

    GraphRun(TaskGraph<T> graph) {
        this.graph = graph;
        int n = graph.size();
        this.pending = new int[n];
        this.state = new State[n];
        this.outcome = new NodeOutcome[n];
        for (TaskNode<T> node : graph.nodes()) {
            pending[node.index()] = node.dependencyCount();
            state[node.index()] = State.WAITING;
            if (pending[node.index()] == 0) markReady(node.index());
        }
    }

    public int size() { return pending.length; }

    public int finishedCount() { return finishedCount; }

    public boolean isComplete() { return finishedCount == pending.length; }

    public boolean hasReady() { return !ready.isEmpty(); }

    public int pendingCount(T value) { return pending[graph.node(value).index()]; }

    public State state(T value) { return state[graph.node(value).index()]; }

    public Optional<NodeOutcome> outcome(T value) {
        return Optional.ofNullable(outcome[graph.node(value).index()]);
    }

    /** Ready values in the order they will be admitted. */
    public List<T> readyValues() {
        List<T> result = new ArrayList<>(ready.size());
        for (int i : ready) result.add(graph.node(i).value());
        return result;
    }

    /** Removes the oldest ready node and marks it admitted, or returns null if none is ready. */
    public TaskNode<T> pollReady() {
        Integer idx = ready.poll();
        if (idx == null) return null;
        state[idx] = State.ADMITTED;
        return graph.node(idx);
    }

    /**
     * Marks an admitted node as succeeded and releases its dependents.
     *
     * @return the dependents that became ready as a result
     */
    public List<T> finish(T value) {
        return finish(graph.node(value));
    }

    List<T> finish(TaskNode<T> node) {
        int idx = node.index();
        requireAdmitted(idx);
        complete(idx, NodeOutcome.SUCCEEDED);

        List<T> promoted = new ArrayList<>();
        for (int d : node.dependentIndexes()) {
            if (--pending[d] < 0) throw new IllegalStateException("Pending count of " + graph.node(d).value() + " went negative");
            if (pending[d] == 0 && state[d] == State.WAITING) {
                markReady(d);
                promoted.add(graph.node(d).value());
            }
        }
        return promoted;
    }

    /**
     * Marks an admitted node as failed and every node that transitively depends on it as
     * blocked. Blocked nodes count as finished and are never made ready.
     *
     * @return the values newly blocked by this failure
     */
    public List<T> fail(T value, Throwable cause) {
        return fail(graph.node(value), cause);
    }

    List<T> fail(TaskNode<T> node, Throwable cause) {
        int idx = node.index();
        requireAdmitted(idx);
        complete(idx, NodeOutcome.FAILED);
        failures.add(new TaskFailure<>(node.value(), cause));

        List<T> newlyBlocked = new ArrayList<>();
        Set<Integer> seen = new HashSet<>();
        Deque<Integer> todo = new ArrayDeque<>();
        for (int d : node.dependentIndexes()) todo.add(d);
        while (!todo.isEmpty()) {
            int d = todo.poll();
            if (!seen.add(d)) continue;
            blockedBy.computeIfAbsent(d, k -> new LinkedHashSet<>()).add(node.value());
            if (state[d] == State.WAITING) {
                complete(d, NodeOutcome.BLOCKED);
                newlyBlocked.add(graph.node(d).value());
            } else if (outcome[d] != NodeOutcome.BLOCKED) {
                throw new IllegalStateException("Dependent " + graph.node(d).value() + " of failed " + node.value() + " is " + state[d]);
            }
            for (int dd : graph.node(d).dependentIndexes()) todo.add(dd);
        }
        return newlyBlocked;
    }

    /**
     * Marks every unfinished node cancelled, including admitted ones whose results will be
     * ignored.
     *
     * @return the cancelled values
     */
    public List<T> cancelRemaining() {
        List<T> cancelled = new ArrayList<>();
        for (int i = 0; i < state.length; i++) {
            if (state[i] != State.FINISHED) {
                complete(i, NodeOutcome.CANCELLED);
                cancelled.add(graph.node(i).value());
            }
        }
        ready.clear();
        return cancelled;
    }

    public RunReport<T> report(Duration elapsed, boolean timedOut, boolean cancelled) {
        if (!isComplete()) {
            throw new IllegalStateException("Run not complete: " + finishedCount + " of " + size() + " finished");
        }
        Map<T, NodeOutcome> outcomes = new LinkedHashMap<>();
        for (TaskNode<T> n : graph.nodes()) outcomes.put(n.value(), outcome[n.index()]);
        Map<T, Set<T>> blocked = new LinkedHashMap<>();
        for (Map.Entry<Integer, Set<T>> e : blockedBy.entrySet()) {
            blocked.put(graph.node(e.getKey()).value(), e.getValue());
        }
        return new RunReport<>(outcomes, failures, blocked, elapsed, timedOut, cancelled);
    }

    private void markReady(int idx) {
        state[idx] = State.READY;
        ready.add(idx);
    }

    private void requireAdmitted(int idx) {
        if (state[idx] != State.ADMITTED) {
            throw new IllegalStateException("Cannot finish " + graph.node(idx).value() + " in state " + state[idx]);
        }
    }

    private void complete(int idx, NodeOutcome result) {
        state[idx] = State.FINISHED;
        outcome[idx] = result;
        finishedCount++;
    }
}
