package org.opendigraph.graph.algorithms;

import org.opendigraph.graph.Direction;
import org.opendigraph.graph.OpenDigraph;
import org.opendigraph.graph.errors.UnreachableTargetError;
import org.opendigraph.util.graph.DiGraph;
import org.opendigraph.util.graph.Port;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeMap;

/** Result of a single-source shortest path search where every edge has length 1.
 * 'distances' maps each reached node to its distance from the source;
 * 'predecessors' maps each reached node except the source to the node preceding it. */
public record ShortestPaths(int source, Map<Integer, Integer> distances, Map<Integer, Integer> predecessors) {
    /** Distances of a common ancestor from two nodes. */
    public record AncestorDistances(int fromFirst, int fromSecond) {}

    record Entry(int distance, int node) {}

    /** Dijkstra's algorithm from 'source'.
     * @param direction  Edges to follow.
     * @param target     If not null, stop as soon as this node is reached. */
    public static ShortestPaths dijkstra(OpenDigraph graph, int source, Direction direction, @Nullable Integer target) {
        graph.checkExists(source);
        DiGraph<Integer> view = graph.view(direction);
        Map<Integer, Integer> distances = new HashMap<>();
        Map<Integer, Integer> predecessors = new HashMap<>();
        Set<Integer> done = new HashSet<>();
        PriorityQueue<Entry> queue = new PriorityQueue<>(
                Comparator.comparingInt(Entry::distance).thenComparingInt(Entry::node));
        distances.put(source, 0);
        queue.add(new Entry(0, source));
        while (!queue.isEmpty()) {
            Entry entry = queue.poll();
            int u = entry.node();
            if (!done.add(u))
                continue;
            if (target != null && u == target)
                break;
            for (Port<Integer> port: view.getSuccessors(u)) {
                int v = port.node();
                int distance = entry.distance() + 1;
                Integer current = distances.get(v);
                if (current == null || distance < current) {
                    distances.put(v, distance);
                    predecessors.put(v, u);
                    queue.add(new Entry(distance, v));
                }
            }
        }
        return new ShortestPaths(source, distances, predecessors);
    }

    /** The path from the source to 'target', both included.
     * @throws UnreachableTargetError if the search did not reach 'target'. */
    public List<Integer> pathTo(int target) {
        if (!this.distances.containsKey(target))
            throw new UnreachableTargetError(this.source, target);
        List<Integer> path = new ArrayList<>();
        int current = target;
        path.add(current);
        while (current != this.source) {
            current = this.predecessors.get(current);
            path.add(current);
        }
        Collections.reverse(path);
        return path;
    }

    public static List<Integer> shortestPath(OpenDigraph graph, int u, int v, Direction direction) {
        graph.checkExists(v);
        if (u == v) {
            graph.checkExists(u);
            return List.of(u);
        }
        return dijkstra(graph, u, direction, v).pathTo(v);
    }

    /** Nodes reached by following parent edges from both 'a' and 'b',
     * each with its distance from 'a' and from 'b'. */
    public static Map<Integer, AncestorDistances> commonAncestorsDistances(OpenDigraph graph, int a, int b) {
        ShortestPaths first = dijkstra(graph, a, Direction.PARENTS, null);
        ShortestPaths second = dijkstra(graph, b, Direction.PARENTS, null);
        Map<Integer, AncestorDistances> result = new TreeMap<>();
        for (int ancestor: first.predecessors.keySet()) {
            if (second.predecessors.containsKey(ancestor))
                result.put(ancestor, new AncestorDistances(
                        first.distances.get(ancestor), second.distances.get(ancestor)));
        }
        return result;
    }
}
