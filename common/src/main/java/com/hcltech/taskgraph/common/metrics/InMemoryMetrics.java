package com.hcltech.taskgraph.common.metrics;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Keeps everything in maps. Meant for tests and for dumping a summary after a run. */
public final class InMemoryMetrics implements Metrics {
    private final Map<String, Long> counters = new HashMap<>();
    private final Map<String, List<Long>> histograms = new HashMap<>();

    @Override
    public synchronized void increment(String name) {
        counters.merge(name, 1L, Long::sum);
    }

    @Override
    public synchronized void histogram(String name, long value) {
        histograms.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
    }

    public synchronized long counter(String name) {
        return counters.getOrDefault(name, 0L);
    }

    public synchronized List<Long> histogramValues(String name) {
        return List.copyOf(histograms.getOrDefault(name, List.of()));
    }

    public synchronized long max(String name) {
        return histograms.getOrDefault(name, List.of()).stream().mapToLong(Long::longValue).max().orElse(0L);
    }
}
