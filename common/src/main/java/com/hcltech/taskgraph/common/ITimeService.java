package com.hcltech.taskgraph.common;

/** Nanosecond clock. Injected wherever elapsed time drives behaviour, so tests can move time by hand. */
public interface ITimeService {
    long currentTimeNanos();

    ITimeService real = System::nanoTime;

    static ITimeService fixed(long fixedTimeNanos) {
        return () -> fixedTimeNanos;
    }
}
