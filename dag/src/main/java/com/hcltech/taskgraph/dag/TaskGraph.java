package com.hcltech.taskgraph.dag;

import com.hcltech.taskgraph.common.errorsor.ErrorsOr;
import com.hcltech.taskgraph.common.function.ThrowingConsumer;

import java.time.Duration;
import java.util.*;

/**
 * Immutable dependency graph built from an adjacency list of {@code value -> dependencies}.
 * <p>
 * A value becomes a node the first time it is referenced, as a key or as a dependency, so
 * dependencies that are never declared as keys are valid nodes with no dependencies of their
 * own. Node order is the order of first reference.
 * <p>
 * The graph holds no run state. {@link #newRun()} hands out a fresh {@link GraphRun}, so the
 * same graph can be executed any number of times.
 */
public final class TaskGraph<T> {
    private final List<TaskNode<T>> nodes;
    private final Map<T, TaskNode<T>> byValue;

    private TaskGraph(List<TaskNode<T>> nodes) {
        this.nodes = List.copyOf(nodes);
        Map<T, TaskNode<T>> map = new LinkedHashMap<>();
        for (TaskNode<T> n : nodes) map.put(n.value(), n);
        this.byValue = Collections.unmodifiableMap(map);
    }

    /**
     * Builds the graph. For each {@code (value, deps)} pair the node for {@code value} gets one
     * pending dependency per distinct entry of {@code deps}, and each dependency records
     * {@code value} as a dependent. Repeated entries in one list count once.
     */
    public static <T> TaskGraph<T> of(Map<T, ? extends Collection<T>> dependencyGraph) {
        Objects.requireNonNull(dependencyGraph, "dependencyGraph");
        Map<T, Integer> indexOf = new LinkedHashMap<>();
        List<T> values = new ArrayList<>();
        List<List<Integer>> deps = new ArrayList<>();
        List<List<Integer>> dependents = new ArrayList<>();

        for (Map.Entry<T, ? extends Collection<T>> e : dependencyGraph.entrySet()) {
            T value = Objects.requireNonNull(e.getKey(), "dependency graph contains a null key");
            Collection<T> declared = Objects.requireNonNull(e.getValue(), () -> "dependencies of " + value + " are null");
            int to = indexFor(value, indexOf, values, deps, dependents);
            for (T dep : new LinkedHashSet<>(declared)) {
                Objects.requireNonNull(dep, () -> "dependencies of " + value + " contain null");
                int from = indexFor(dep, indexOf, values, deps, dependents);
                deps.get(to).add(from);
                dependents.get(from).add(to);
            }
        }

        List<TaskNode<T>> nodes = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++) {
            nodes.add(new TaskNode<>(i, values.get(i), toArray(deps.get(i)), toArray(dependents.get(i))));
        }
        return new TaskGraph<>(nodes);
    }

    private static <T> int indexFor(T value, Map<T, Integer> indexOf, List<T> values,
                                    List<List<Integer>> deps, List<List<Integer>> dependents) {
        Integer existing = indexOf.get(value);
        if (existing != null) return existing;
        int idx = values.size();
        indexOf.put(value, idx);
        values.add(value);
        deps.add(new ArrayList<>());
        dependents.add(new ArrayList<>());
        return idx;
    }

    private static int[] toArray(List<Integer> list) {
        return list.stream().mapToInt(Integer::intValue).toArray();
    }

    public int size() { return nodes.size(); }

    public boolean contains(T value) { return byValue.containsKey(value); }

    /** All values in node order. */
    public List<T> values() {
        return nodes.stream().map(TaskNode::value).toList();
    }

    public TaskNode<T> node(T value) {
        TaskNode<T> n = byValue.get(value);
        if (n == null) throw new IllegalArgumentException("Unknown node " + value);
        return n;
    }

    TaskNode<T> node(int index) { return nodes.get(index); }

    List<TaskNode<T>> nodes() { return nodes; }

    public List<T> dependenciesOf(T value) {
        return valuesOf(node(value).dependencyIndexes());
    }

    public List<T> dependentsOf(T value) {
        return valuesOf(node(value).dependentIndexes());
    }

    List<T> valuesOf(int[] indexes) {
        List<T> result = new ArrayList<>(indexes.length);
        for (int i : indexes) result.add(nodes.get(i).value());
        return result;
    }

    /** Values with no dependencies, in node order: what a run starts with. */
    public List<T> initialReady() {
        List<T> ready = new ArrayList<>();
        for (TaskNode<T> n : nodes) if (n.dependencyCount() == 0) ready.add(n.value());
        return ready;
    }

    /**
     * Dry run of Kahn's algorithm. Each generation holds the values whose dependencies all lie
     * in earlier generations, so generation {@code i} could run once generations {@code 0..i-1}
     * have finished.
     *
     * @throws CycleDetectedException naming every value left with unfinished dependencies
     */
    public List<Set<T>> topologicalGenerations() {
        int[] pending = new int[nodes.size()];
        List<Integer> current = new ArrayList<>();
        for (TaskNode<T> n : nodes) {
            pending[n.index()] = n.dependencyCount();
            if (pending[n.index()] == 0) current.add(n.index());
        }

        List<Set<T>> gens = new ArrayList<>();
        int placed = 0;
        while (!current.isEmpty()) {
            Set<T> gen = new LinkedHashSet<>();
            List<Integer> next = new ArrayList<>();
            for (int i : current) {
                gen.add(nodes.get(i).value());
                for (int d : nodes.get(i).dependentIndexes()) {
                    if (--pending[d] == 0) next.add(d);
                }
            }
            gens.add(Collections.unmodifiableSet(gen));
            placed += gen.size();
            current = next;
        }

        if (placed != nodes.size()) {
            List<T> stuck = new ArrayList<>();
            for (TaskNode<T> n : nodes) if (pending[n.index()] > 0) stuck.add(n.value());
            throw new CycleDetectedException(stuck);
        }
        return Collections.unmodifiableList(gens);
    }

    /** {@link #topologicalGenerations()} as a validation: this graph, or the cycle error. */
    public ErrorsOr<TaskGraph<T>> checkAcyclic() {
        try {
            topologicalGenerations();
            return ErrorsOr.lift(this);
        } catch (CycleDetectedException e) {
            return ErrorsOr.error(e.getMessage());
        }
    }

    /** Adjacency list of every node, including implicit ones, in node order. */
    public Map<T, List<T>> toAdjacency() {
        Map<T, List<T>> result = new LinkedHashMap<>();
        for (TaskNode<T> n : nodes) result.put(n.value(), valuesOf(n.dependencyIndexes()));
        return result;
    }

    public GraphRun<T> newRun() {
        return new GraphRun<>(this);
    }

    /**
     * Processes every node exactly once, each only after all its dependencies succeeded, with at
     * most {@code maxTokens} nodes in flight. Blocks until the graph drains.
     *
     * @return the report, only when every node succeeded
     * @throws CycleDetectedException   if the graph has a cycle; nothing is processed
     * @throws TaskGraphFailedException if any node failed; independent branches still ran
     */
    public RunReport<T> run(ThrowingConsumer<T> process, int maxTokens, Duration refillInterval) {
        RunReport<T> report = new DagScheduler(SchedulerConfig.of(maxTokens, refillInterval)).run(this, process);
        report.throwIfFailed();
        return report;
    }

    @Override
    public String toString() {
        return "TaskGraph(" + toAdjacency() + ")";
    }
}
