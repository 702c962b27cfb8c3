package com.hcltech.taskgraph.dag;

import com.hcltech.taskgraph.common.function.ThrowingConsumer;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/** Work function for tests: records when each value ran and how many ran at once. */
final class Recorder<T> implements ThrowingConsumer<T> {
    private final long origin = System.nanoTime();
    private final ThrowingConsumer<T> body;
    private final Map<T, AtomicInteger> calls = new ConcurrentHashMap<>();
    private final Map<T, Long> startMillis = new ConcurrentHashMap<>();
    private final Map<T, Long> endMillis = new ConcurrentHashMap<>();
    private final Queue<T> startOrder = new ConcurrentLinkedQueue<>();
    private final Set<T> succeeded = ConcurrentHashMap.newKeySet();
    private final AtomicInteger current = new AtomicInteger();
    private final AtomicInteger peak = new AtomicInteger();

    Recorder(ThrowingConsumer<T> body) {
        this.body = body;
    }

    static <T> Recorder<T> sleeping(long millis) {
        return new Recorder<>(v -> Thread.sleep(millis));
    }

    static <T> Recorder<T> instant() {
        return new Recorder<>(v -> {});
    }

    @Override
    public void accept(T value) throws Exception {
        calls.computeIfAbsent(value, k -> new AtomicInteger()).incrementAndGet();
        startMillis.put(value, elapsedMillis());
        startOrder.add(value);
        int now = current.incrementAndGet();
        peak.accumulateAndGet(now, Math::max);
        try {
            body.accept(value);
            succeeded.add(value);
        } finally {
            current.decrementAndGet();
            endMillis.put(value, elapsedMillis());
        }
    }

    private long elapsedMillis() {
        return (System.nanoTime() - origin) / 1_000_000L;
    }

    int calls(T value) {
        AtomicInteger n = calls.get(value);
        return n == null ? 0 : n.get();
    }

    Set<T> called() { return Set.copyOf(calls.keySet()); }

    Set<T> succeeded() { return Set.copyOf(succeeded); }

    long start(T value) { return startMillis.get(value); }

    long end(T value) { return endMillis.get(value); }

    List<T> startOrder() { return List.copyOf(startOrder); }

    int peak() { return peak.get(); }
}
