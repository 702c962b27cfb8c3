package com.hcltech.taskgraph.common.async;

/**
 * Admission throttle in front of a worker pool. Non-blocking: the caller asks for
 * one token per launch and decides what to do when none is granted.
 * <p>
 * The caller passes its current in-flight count because the bucket's capacity is
 * measured against work that has been admitted but not yet finished.
 */
public interface TokenBucket {
    /** Try to take one token without blocking. Returns true on success. */
    boolean tryAcquire(int inFlight);

    /** Nanos until the bucket is next allowed to refill; 0 if a refill is already due. */
    long nanosUntilRefill();

    /** Tokens left in the current interval (for metrics/observability). */
    int availableTokens();

    /** Configured capacity. */
    int maxTokens();
}
