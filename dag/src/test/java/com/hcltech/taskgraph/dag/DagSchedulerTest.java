package com.hcltech.taskgraph.dag;

import com.hcltech.taskgraph.common.metrics.InMemoryMetrics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.hcltech.taskgraph.dag.TaskGraphTest.graph;
import static org.junit.jupiter.api.Assertions.*;

@Timeout(60)
class DagSchedulerTest {

    static SchedulerConfig config(int maxTokens, int workers) {
        return new SchedulerConfig(maxTokens, Duration.ofMillis(5), workers, Duration.ZERO,
                Duration.ofMillis(20), Duration.ofSeconds(5));
    }

    static final Map<String, List<String>> CI = graph(
            "A", List.of(),
            "B", List.of("A"),
            "C", List.of(),
            "D", List.of("A", "B", "C"));

    @Test
    @DisplayName("two tokens: A and C together, then B, then D")
    void ciGraphRunsInDependencyOrderTwoAtATime() {
        Recorder<String> rec = Recorder.sleeping(250);
        RunReport<String> report = new DagScheduler(config(2, 4)).run(TaskGraph.of(CI), rec);

        assertTrue(report.isSuccess(), report::toString);
        assertEquals(2, rec.peak());
        assertTrue(rec.start("A") < 150 && rec.start("C") < 150, "A and C start straight away");
        assertTrue(rec.start("B") >= rec.end("A"), "B after A");
        assertTrue(rec.start("B") >= 240 && rec.start("B") < 600, "B starts at about 250ms: " + rec.start("B"));
        assertTrue(rec.start("D") >= rec.end("B"), "D after B");
        assertTrue(rec.start("D") >= rec.end("C"), "D after C");
        assertTrue(rec.start("D") >= 490 && rec.start("D") < 1100, "D starts at about 500ms: " + rec.start("D"));
    }

    @Test
    void selfCycleIsReportedBeforeAnyWork() {
        Recorder<String> rec = Recorder.instant();
        DagScheduler scheduler = new DagScheduler(config(2, 2));
        TaskGraph<String> g = TaskGraph.of(Map.of("A", List.of("A")));

        CycleDetectedException ex = assertTimeoutPreemptively(Duration.ofSeconds(2),
                () -> assertThrows(CycleDetectedException.class, () -> scheduler.run(g, rec)));
        assertEquals(Set.of("A"), ex.stuck());
        assertEquals(Set.of(), rec.called());
        assertFalse(scheduler.isRunning());
    }

    @Test
    void cycleBehindAValidPrefixStillRunsNothing() {
        Recorder<String> rec = Recorder.instant();
        TaskGraph<String> g = TaskGraph.of(graph("ok", List.of(), "x", List.of("ok", "y"), "y", List.of("x")));
        assertThrows(CycleDetectedException.class, () -> new DagScheduler(config(2, 2)).run(g, rec));
        assertEquals(Set.of(), rec.called());
    }

    @Test
    @DisplayName("one token on a diamond: strictly one at a time, A first, D last")
    void diamondWithOneToken() {
        Recorder<String> rec = Recorder.sleeping(20);
        TaskGraph<String> g = TaskGraph.of(graph(
                "A", List.of(), "B", List.of("A"), "C", List.of("A"), "D", List.of("B", "C")));

        RunReport<String> report = new DagScheduler(config(1, 4)).run(g, rec);

        assertTrue(report.isSuccess());
        assertEquals(1, rec.peak());
        List<String> order = rec.startOrder();
        assertEquals("A", order.get(0));
        assertEquals(Set.of("B", "C"), Set.copyOf(order.subList(1, 3)));
        assertEquals("D", order.get(3));
    }

    @Test
    @DisplayName("fan-out of 1000 runs in batches, not one by one")
    void largeFanOutRunsEveryChildOnceInBatches() {
        Map<String, List<String>> m = new LinkedHashMap<>();
        m.put("root", List.of());
        for (int i = 0; i < 1000; i++) m.put("child-" + i, List.of("root"));
        TaskGraph<String> g = TaskGraph.of(m);
        Recorder<String> rec = Recorder.sleeping(10);
        int maxTokens = 50;

        long start = System.nanoTime();
        RunReport<String> report = new DagScheduler(new SchedulerConfig(maxTokens, Duration.ofMillis(1), maxTokens,
                Duration.ZERO, Duration.ofMillis(20), Duration.ofSeconds(5))).run(g, rec);
        long elapsedMillis = (System.nanoTime() - start) / 1_000_000L;

        assertTrue(report.isSuccess());
        assertEquals(1001, rec.called().size());
        for (String v : g.values()) assertEquals(1, rec.calls(v), v);
        assertTrue(rec.peak() <= maxTokens, "peak " + rec.peak());
        // sequential would be ~10s; ceil(1000/50) = 20 batches of 10ms
        assertTrue(elapsedMillis < 5_000, "took " + elapsedMillis + "ms");
    }

    @Test
    void randomDagRunsEachNodeOnceAfterAllItsDependencies() {
        Random random = new Random(42);
        Map<Integer, List<Integer>> m = new LinkedHashMap<>();
        for (int i = 0; i < 300; i++) {
            List<Integer> deps = new ArrayList<>();
            for (int j = 0; j < i; j++) if (random.nextInt(100) < 2) deps.add(j);
            m.put(i, deps);
        }
        TaskGraph<Integer> g = TaskGraph.of(m);
        Set<Integer> done = Collections.synchronizedSet(new HashSet<>());
        AtomicBoolean violated = new AtomicBoolean(false);
        Recorder<Integer> rec = new Recorder<>(v -> {
            if (!done.containsAll(m.get(v))) violated.set(true);
            Thread.sleep(1);
            done.add(v);
        });

        RunReport<Integer> report = new DagScheduler(config(6, 4)).run(g, rec);

        assertTrue(report.isSuccess());
        assertFalse(violated.get(), "a node started before one of its dependencies finished");
        for (int v : g.values()) assertEquals(1, rec.calls(v), "node " + v);
        assertTrue(rec.peak() <= 4);
    }

    @Test
    void inFlightNeverExceedsMaxTokensEvenWithMoreWorkers() {
        Map<String, List<String>> m = new LinkedHashMap<>();
        for (int i = 0; i < 60; i++) m.put("n" + i, i < 10 ? List.of() : List.of("n" + (i % 10)));
        InMemoryMetrics metrics = new InMemoryMetrics();
        Recorder<String> rec = Recorder.sleeping(5);

        RunReport<String> report = new DagScheduler(config(3, 8), metrics).run(TaskGraph.of(m), rec);

        assertTrue(report.isSuccess());
        assertTrue(rec.peak() <= 3, "peak " + rec.peak());
        assertTrue(metrics.max("taskgraph.inflight") <= 3);
        assertEquals(60, metrics.counter("taskgraph.admitted"));
        assertEquals(60, metrics.counter("taskgraph.succeeded"));
        assertEquals(60, metrics.histogramValues("taskgraph.task.millis").size());
    }

    @Test
    @DisplayName("tokens come back only once per refill interval")
    void admissionsAreGatedByTheRefillInterval() {
        Map<String, List<String>> m = new LinkedHashMap<>();
        for (String v : List.of("a", "b", "c", "d", "e", "f")) m.put(v, List.of());
        Recorder<String> rec = Recorder.instant();
        SchedulerConfig cfg = new SchedulerConfig(2, Duration.ofMillis(300), 2, Duration.ZERO,
                Duration.ofMillis(20), Duration.ofSeconds(5));

        RunReport<String> report = new DagScheduler(cfg).run(TaskGraph.of(m), rec);

        assertTrue(report.isSuccess());
        List<String> order = rec.startOrder();
        long third = rec.start(order.get(2));
        long fifth = rec.start(order.get(4));
        assertTrue(third >= 280, "third admission waits for a refill: " + third);
        assertTrue(fifth >= 580, "fifth admission waits for a second refill: " + fifth);
        assertTrue(report.elapsed().toMillis() >= 580);
    }

    @Test
    void sameGraphTwiceGivesSameCompletionSet() {
        TaskGraph<String> g = TaskGraph.of(CI);
        Recorder<String> first = Recorder.instant();
        Recorder<String> second = Recorder.instant();
        DagScheduler scheduler = new DagScheduler(config(2, 2));

        scheduler.run(g, first);
        scheduler.run(g, second);

        assertEquals(first.succeeded(), second.succeeded());
        assertEquals(Set.of("A", "B", "C", "D"), first.succeeded());
    }

    @Test
    void emptyGraphReturnsAnEmptySuccessfulReport() {
        RunReport<String> report = new DagScheduler(config(1, 1)).run(TaskGraph.<String>of(Map.of()), Recorder.instant());
        assertTrue(report.isSuccess());
        assertTrue(report.outcomes().isEmpty());
    }

    @Test
    void graphRunConvenienceReturnsReportOnSuccess() {
        Recorder<String> rec = Recorder.instant();
        RunReport<String> report = TaskGraph.of(CI).run(rec, 2, Duration.ofMillis(1));
        assertEquals(4, report.count(NodeOutcome.SUCCEEDED));
        assertEquals(Set.of("A", "B", "C", "D"), rec.called());
    }

    @Test
    void argumentsAreChecked() {
        DagScheduler scheduler = new DagScheduler(config(1, 1));
        assertThrows(NullPointerException.class, () -> scheduler.run(null, Recorder.instant()));
        assertThrows(NullPointerException.class, () -> scheduler.run(TaskGraph.of(CI), null));
        assertThrows(NullPointerException.class, () -> new DagScheduler(null));
    }
}
