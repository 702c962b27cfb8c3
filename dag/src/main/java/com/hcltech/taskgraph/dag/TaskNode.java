package com.hcltech.taskgraph.dag;

import java.util.Arrays;
import java.util.Objects;

/**
 * One vertex of a {@link TaskGraph}. Immutable.
 * <p>
 * Edges are stored as indexes into the graph's node list rather than as references, so a
 * node can be shared by any number of runs; the per-run pending counter lives in {@link GraphRun}.
 */
public final class TaskNode<T> {
    private final int index;
    private final T value;
    private final int[] dependencies;
    private final int[] dependents;

    TaskNode(int index, T value, int[] dependencies, int[] dependents) {
        this.index = index;
        this.value = Objects.requireNonNull(value, "value");
        this.dependencies = dependencies;
        this.dependents = dependents;
    }

    public int index() { return index; }

    public T value() { return value; }

    /** Number of declared (de-duplicated) dependencies: the pending count a run starts with. */
    public int dependencyCount() { return dependencies.length; }

    int[] dependencyIndexes() { return dependencies; }

    int[] dependentIndexes() { return dependents; }

    @Override
    public String toString() {
        return "TaskNode(" + value + ", deps=" + Arrays.toString(dependencies) + ", dependents=" + Arrays.toString(dependents) + ")";
    }
}
