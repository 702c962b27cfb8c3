package com.hcltech.taskgraph.dag;

/** What a worker sends back for one node: success, or the throwable the work function raised. */
record Completion<T>(TaskNode<T> node, Throwable error, long durationNanos) {

    static <T> Completion<T> success(TaskNode<T> node, long durationNanos) {
        return new Completion<>(node, null, durationNanos);
    }

    static <T> Completion<T> failure(TaskNode<T> node, Throwable error, long durationNanos) {
        return new Completion<>(node, error, durationNanos);
    }

    boolean isSuccess() {
        return error == null;
    }
}
