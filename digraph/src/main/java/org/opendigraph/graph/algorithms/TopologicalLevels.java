package org.opendigraph.graph.algorithms;

import org.opendigraph.graph.OpenDigraph;
import org.opendigraph.graph.errors.CyclicGraphError;
import org.opendigraph.util.IWritesLogs;
import org.opendigraph.util.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Partitions the nodes of an acyclic graph into levels.
 *
 * <p>The first frontier holds the inputs, followed by all other nodes without parents.
 * Each frontier becomes a level; a node that shows up again in a later frontier
 * moves to that later level.  The candidates for the next frontier are the children
 * of the current one; a candidate is admitted only if none of its parents is itself
 * a candidate.  The level of each node ends up being the length of the longest path
 * reaching it from a node without parents. */
public class TopologicalLevels implements IWritesLogs {
    final OpenDigraph graph;
    final List<Set<Integer>> levels;
    final Map<Integer, Integer> levelOf;

    public TopologicalLevels(OpenDigraph graph) {
        this.graph = graph;
        this.levels = new ArrayList<>();
        this.levelOf = new HashMap<>();
    }

    Set<Integer> initialFrontier() {
        Set<Integer> frontier = new LinkedHashSet<>(this.graph.getInputs());
        for (int id: this.graph.getNodeIds())
            if (this.graph.indegree(id) == 0)
                frontier.add(id);
        return frontier;
    }

    void place(Set<Integer> frontier) {
        int index = this.levels.size();
        for (int id: frontier) {
            Integer previous = this.levelOf.put(id, index);
            if (previous != null)
                this.levels.get(previous).remove(id);
        }
        this.levels.add(frontier);
    }

    Set<Integer> next(Set<Integer> frontier) {
        Set<Integer> candidates = new LinkedHashSet<>();
        for (int id: frontier)
            candidates.addAll(this.graph.getChildren(id).keySet());
        Set<Integer> result = new LinkedHashSet<>();
        for (int candidate: candidates) {
            boolean blocked = false;
            for (int parent: this.graph.getParents(candidate).keySet()) {
                if (candidates.contains(parent)) {
                    blocked = true;
                    break;
                }
            }
            if (!blocked)
                result.add(candidate);
        }
        return result;
    }

    /** @return The non-empty levels, in order. */
    public List<Set<Integer>> compute() {
        Set<Integer> frontier = this.initialFrontier();
        while (!frontier.isEmpty()) {
            if (this.levels.size() >= this.graph.size())
                throw new CyclicGraphError("More levels than nodes");
            this.place(frontier);
            frontier = this.next(frontier);
        }
        if (this.levelOf.size() != this.graph.size())
            throw new CyclicGraphError((this.graph.size() - this.levelOf.size()) + " nodes cannot be placed in any level");
        this.levels.removeIf(Set::isEmpty);
        Map<Integer, Integer> compact = new HashMap<>();
        for (int i = 0; i < this.levels.size(); i++)
            for (int id: this.levels.get(i))
                compact.put(id, i);
        for (int id: this.graph.getNodeIds()) {
            for (int child: this.graph.getChildren(id).keySet()) {
                if (compact.get(id) >= compact.get(child))
                    throw new CyclicGraphError("Edge " + id + " -> " + child + " does not go to a deeper level");
            }
        }
        Logger.INSTANCE.belowLevel(this, 2)
                .append("Levels: ")
                .append(this.levels.toString())
                .newline();
        return this.levels;
    }
}
