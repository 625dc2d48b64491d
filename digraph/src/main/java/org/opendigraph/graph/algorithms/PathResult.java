package org.opendigraph.graph.algorithms;

import java.util.List;

/** A path between two nodes, both included, and its length in edges. */
public record PathResult(int distance, List<Integer> path) {
    public PathResult {
        path = List.copyOf(path);
    }
}
