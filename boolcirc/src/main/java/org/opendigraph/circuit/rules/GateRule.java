package org.opendigraph.circuit.rules;

import org.opendigraph.circuit.Gate;
import org.opendigraph.graph.OpenDigraph;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Base class for rules that fire only on nodes carrying a given gate. */
public abstract class GateRule implements RewriteRule {
    final Gate gate;

    protected GateRule(Gate gate) {
        this.gate = gate;
    }

    @Override
    public boolean apply(OpenDigraph graph, int node) {
        if (!graph.getLabel(node).equals(this.gate.label))
            return false;
        return this.rewrite(graph, node);
    }

    /** Called only for nodes labeled with this rule's gate. */
    protected abstract boolean rewrite(OpenDigraph graph, int node);

    /** Snapshot of the parents of a node and their multiplicities. */
    static List<Map.Entry<Integer, Integer>> parents(OpenDigraph graph, int node) {
        return new ArrayList<>(Map.copyOf(graph.getParents(node)).entrySet());
    }

    static void detachParents(OpenDigraph graph, int node) {
        for (int parent: List.copyOf(graph.getParents(node).keySet()))
            graph.removeParallelEdges(parent, node);
    }

    /** Replace the node by a constant. */
    static void becomeConstant(OpenDigraph graph, int node, boolean value) {
        detachParents(graph, node);
        graph.setLabel(node, Gate.constant(value));
    }

    /** Keep at most one edge from each parent. */
    static boolean dropDuplicateEdges(OpenDigraph graph, int node) {
        boolean changed = false;
        for (var e: parents(graph, node)) {
            for (int i = 1; i < e.getValue(); i++) {
                graph.removeEdge(e.getKey(), node);
                changed = true;
            }
        }
        return changed;
    }

    /** True if the node has a parent 'a' and a parent labeled ~ whose only input is 'a'. */
    static boolean hasComplementaryParents(OpenDigraph graph, int node) {
        Map<Integer, Integer> parents = graph.getParents(node);
        for (int parent: parents.keySet()) {
            if (!graph.getLabel(parent).equals(Gate.NOT.label))
                continue;
            Map<Integer, Integer> negated = graph.getParents(parent);
            if (negated.size() != 1)
                continue;
            int operand = negated.keySet().iterator().next();
            if (negated.get(operand) == 1 && operand != node && parents.containsKey(operand))
                return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return this.getName();
    }
}
