package com.hcltech.taskgraph.dag;

/** How a node left a run. Every node of a finished run has exactly one outcome. */
public enum NodeOutcome {
    /** The work function returned normally. */
    SUCCEEDED,
    /** The work function threw. */
    FAILED,
    /** Never started because a dependency (direct or transitive) failed. */
    BLOCKED,
    /** Not finished when the run was cancelled or timed out. */
    CANCELLED
}
