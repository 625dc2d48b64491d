package org.opendigraph.graph.algorithms;

import org.opendigraph.graph.OpenDigraph;
import org.opendigraph.graph.errors.CyclicGraphError;
import org.opendigraph.graph.errors.UnreachableTargetError;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Longest paths, measured in edges, between two nodes. */
public final class LongestPaths {
    private LongestPaths() {}

    static List<Integer> walkBack(Map<Integer, Integer> predecessors, int u, int v) {
        List<Integer> path = new ArrayList<>();
        int current = v;
        path.add(current);
        while (current != u) {
            current = predecessors.get(current);
            path.add(current);
        }
        Collections.reverse(path);
        return path;
    }

    /** Longest path from u to v, relaxing edges level by level.
     * @param levels  The result of {@link OpenDigraph#topologicalSort()} for this graph. */
    public static PathResult longestPath(OpenDigraph graph, int u, int v, List<Set<Integer>> levels) {
        graph.checkExists(v);
        if (graph.isCyclic())
            throw new CyclicGraphError("Longest paths are not defined in a cyclic graph");
        int start = graph.nodeDepth(u, levels);
        Map<Integer, Integer> distances = new HashMap<>();
        Map<Integer, Integer> predecessors = new HashMap<>();
        distances.put(u, 0);
        for (int k = start + 1; k < levels.size() && u != v; k++) {
            for (int w: levels.get(k)) {
                for (int parent: graph.getParents(w).keySet()) {
                    Integer parentDistance = distances.get(parent);
                    if (parentDistance == null)
                        continue;
                    Integer current = distances.get(w);
                    if (current == null || parentDistance + 1 > current) {
                        distances.put(w, parentDistance + 1);
                        predecessors.put(w, parent);
                    }
                }
            }
            if (distances.containsKey(v))
                break;
        }
        if (!distances.containsKey(v))
            throw new UnreachableTargetError(u, v);
        return new PathResult(distances.get(v), walkBack(predecessors, u, v));
    }

    /** Greedy search: repeatedly expand the open node farthest from u,
     * until v is the farthest open node. */
    public static PathResult maxPathAndDistance(OpenDigraph graph, int u, int v) {
        graph.checkExists(u);
        graph.checkExists(v);
        Map<Integer, Integer> distances = new HashMap<>();
        Map<Integer, Integer> predecessors = new HashMap<>();
        Set<Integer> open = new LinkedHashSet<>(graph.getNodeIds());
        distances.put(u, 0);
        while (true) {
            int farthest = -1;
            int best = -1;
            for (int id: open) {
                Integer distance = distances.get(id);
                if (distance != null && distance > best) {
                    best = distance;
                    farthest = id;
                }
            }
            if (best < 0)
                break;
            if (farthest == v)
                return new PathResult(best, walkBack(predecessors, u, v));
            open.remove(farthest);
            for (int child: graph.getChildren(farthest).keySet()) {
                if (!open.contains(child))
                    continue;
                Integer current = distances.get(child);
                if (current == null || best + 1 > current) {
                    distances.put(child, best + 1);
                    predecessors.put(child, farthest);
                }
            }
        }
        throw new UnreachableTargetError(u, v);
    }
}
