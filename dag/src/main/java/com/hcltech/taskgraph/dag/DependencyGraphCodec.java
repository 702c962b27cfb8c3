package com.hcltech.taskgraph.dag;

import com.fasterxml.jackson.core.type.TypeReference;
import com.hcltech.taskgraph.common.codec.Codec;
import com.hcltech.taskgraph.common.errorsor.ErrorsOr;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON form of a dependency graph: an object mapping each value to the array of values it
 * depends on, e.g. {@code {"B": ["A"], "A": []}}. Key order is preserved.
 */
public final class DependencyGraphCodec implements Codec<Map<String, List<String>>, String> {

    private final Codec<Map<String, List<String>>, String> json =
            Codec.typeRefCodec(new TypeReference<Map<String, List<String>>>() {});

    @Override
    public ErrorsOr<String> encode(Map<String, List<String>> adjacency) {
        return json.encode(new LinkedHashMap<>(adjacency));
    }

    /** Decodes and checks shape: every value must be an array of non-null strings. */
    @Override
    public ErrorsOr<Map<String, List<String>>> decode(String text) {
        return json.decode(text).flatMap(DependencyGraphCodec::validate);
    }

    /** Decodes, builds the graph and rejects cycles. */
    public ErrorsOr<TaskGraph<String>> parseGraph(String text) {
        return decode(text).map(TaskGraph::of).flatMap(TaskGraph::checkAcyclic);
    }

    public ErrorsOr<String> encodeGraph(TaskGraph<String> graph) {
        return encode(graph.toAdjacency());
    }

    private static ErrorsOr<Map<String, List<String>>> validate(Map<String, List<String>> adjacency) {
        List<String> errors = new ArrayList<>();
        adjacency.forEach((value, deps) -> {
            if (deps == null) {
                errors.add("Dependencies of '" + value + "' must be an array, got null");
            } else if (deps.contains(null)) {
                errors.add("Dependencies of '" + value + "' contain null");
            }
        });
        return ErrorsOr.valueOrErrors(adjacency, errors);
    }
}
