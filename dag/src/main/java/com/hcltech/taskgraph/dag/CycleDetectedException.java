package com.hcltech.taskgraph.dag;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The dependency graph has at least one cycle. Raised before any work starts.
 * {@link #stuck()} holds every value that can never become ready: the cycle members and
 * everything downstream of them.
 */
public class CycleDetectedException extends IllegalStateException {
    private final Set<Object> stuck;

    public CycleDetectedException(Collection<?> stuck) {
        super("Cycle detected among nodes: " + stuck);
        this.stuck = Collections.unmodifiableSet(new LinkedHashSet<>(stuck));
    }

    public Set<Object> stuck() {
        return stuck;
    }
}
