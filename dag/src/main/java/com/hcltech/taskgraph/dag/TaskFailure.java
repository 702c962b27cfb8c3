package com.hcltech.taskgraph.dag;

import java.util.Objects;

/** A work function call that threw. */
public record TaskFailure<T>(T value, Throwable cause) {
    public TaskFailure {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(cause, "cause");
    }

    public String message() {
        return "Task " + value + " failed: " + cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }
}
