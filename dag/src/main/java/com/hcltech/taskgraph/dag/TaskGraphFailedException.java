package com.hcltech.taskgraph.dag;

import java.util.List;

/**
 * Aggregate error for a run in which some nodes did not succeed. The first failure's cause is
 * the exception cause; the causes of any further failures are attached as suppressed.
 */
public class TaskGraphFailedException extends RuntimeException {
    private final transient RunReport<?> report;

    public TaskGraphFailedException(RunReport<?> report) {
        super(describe(report), report.failures().isEmpty() ? null : report.failures().get(0).cause());
        this.report = report;
        List<? extends TaskFailure<?>> failures = report.failures();
        for (int i = 1; i < failures.size(); i++) addSuppressed(failures.get(i).cause());
    }

    public RunReport<?> report() {
        return report;
    }

    private static String describe(RunReport<?> report) {
        List<String> messages = report.errorMessages();
        int notOk = report.outcomes().size() - report.count(NodeOutcome.SUCCEEDED);
        return notOk + " of " + report.outcomes().size() + " tasks did not succeed: " + String.join("; ", messages);
    }
}
