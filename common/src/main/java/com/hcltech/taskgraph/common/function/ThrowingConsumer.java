package com.hcltech.taskgraph.common.function;

@FunctionalInterface
public interface ThrowingConsumer<A> {
    void accept(A a) throws Exception;
}
