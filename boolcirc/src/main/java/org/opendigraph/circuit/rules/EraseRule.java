package org.opendigraph.circuit.rules;

import org.opendigraph.circuit.Gate;
import org.opendigraph.graph.OpenDigraph;

import java.util.Map;

/** Splices out an inner copy node with a single input and a single output. */
public class EraseRule extends GateRule {
    public EraseRule() {
        super(Gate.COPY);
    }

    @Override
    public String getName() {
        return "erase";
    }

    @Override
    protected boolean rewrite(OpenDigraph graph, int node) {
        if (graph.getInputs().contains(node) || graph.getOutputs().contains(node))
            return false;
        Map<Integer, Integer> parents = graph.getParents(node);
        Map<Integer, Integer> children = graph.getChildren(node);
        if (parents.size() != 1 || children.size() != 1)
            return false;
        int parent = parents.keySet().iterator().next();
        int child = children.keySet().iterator().next();
        if (parents.get(parent) != 1 || children.get(child) != 1 || parent == node)
            return false;
        graph.removeNode(node);
        graph.addEdge(parent, child);
        return true;
    }
}
