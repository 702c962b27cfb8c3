package com.hcltech.taskgraph.common.async;

import com.hcltech.taskgraph.common.ITimeService;

import java.time.Duration;
import java.util.Objects;

/**
 * Token bucket that refills by resetting, not by accruing.
 * <p>
 * At most once per {@code refillInterval} the token count is recomputed as
 * {@code maxTokens - inFlight}. Between resets every acquisition just spends a token,
 * so admissions form a step function: bursts of up to {@code maxTokens} concurrent
 * launches, re-evaluated once per interval.
 * <p>
 * Because tokens are only ever set to {@code maxTokens - inFlight} and each grant is
 * matched by the caller incrementing its in-flight count, {@code inFlight + tokens}
 * never exceeds {@code maxTokens}.
 * <p>
 * Not thread-safe: owned by a single orchestrating thread.
 */
public final class IntervalResetTokenBucket implements TokenBucket {
    /** Longest accepted interval; keeps the nanosecond arithmetic far from overflow. */
    public static final Duration MAX_REFILL_INTERVAL = Duration.ofDays(365);

    private final int maxTokens;
    private final long refillIntervalNanos;
    private final ITimeService time;

    private int tokens;
    private long lastRefillNanos;

    public IntervalResetTokenBucket(int maxTokens, Duration refillInterval, ITimeService time) {
        if (maxTokens <= 0) throw new IllegalArgumentException("maxTokens must be > 0");
        Objects.requireNonNull(refillInterval, "refillInterval");
        if (refillInterval.isNegative() || refillInterval.isZero()) {
            throw new IllegalArgumentException("refillInterval must be > 0");
        }
        if (refillInterval.compareTo(MAX_REFILL_INTERVAL) > 0) {
            throw new IllegalArgumentException("refillInterval must be <= " + MAX_REFILL_INTERVAL);
        }
        this.maxTokens = maxTokens;
        this.refillIntervalNanos = refillInterval.toNanos();
        this.time = Objects.requireNonNull(time, "time");
        this.tokens = maxTokens;
        this.lastRefillNanos = time.currentTimeNanos();
    }

    @Override
    public boolean tryAcquire(int inFlight) {
        if (inFlight < 0) throw new IllegalArgumentException("inFlight must be >= 0");
        long now = time.currentTimeNanos();
        if (now - lastRefillNanos > refillIntervalNanos) {
            tokens = Math.max(0, maxTokens - inFlight);
            lastRefillNanos = now;
        }
        if (tokens == 0) return false;
        tokens--;
        return true;
    }

    @Override
    public long nanosUntilRefill() {
        long elapsed = time.currentTimeNanos() - lastRefillNanos;
        // strictly greater than the interval is required before the next reset
        return Math.max(0L, refillIntervalNanos - elapsed + 1);
    }

    @Override
    public int availableTokens() {
        return tokens;
    }

    @Override
    public int maxTokens() {
        return maxTokens;
    }

    @Override
    public String toString() {
        return "IntervalResetTokenBucket(" + tokens + "/" + maxTokens + ", every " + refillIntervalNanos + "ns)";
    }
}
