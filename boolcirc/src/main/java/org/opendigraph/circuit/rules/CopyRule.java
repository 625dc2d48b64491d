package org.opendigraph.circuit.rules;

import org.opendigraph.circuit.Gate;
import org.opendigraph.graph.OpenDigraph;

import java.util.Map;

/** A copy node whose only input is a constant becomes that constant. */
public class CopyRule extends GateRule {
    public CopyRule() {
        super(Gate.COPY);
    }

    @Override
    public String getName() {
        return "copy";
    }

    @Override
    protected boolean rewrite(OpenDigraph graph, int node) {
        Map<Integer, Integer> parents = graph.getParents(node);
        if (parents.size() != 1)
            return false;
        int parent = parents.keySet().iterator().next();
        String label = graph.getLabel(parent);
        if (parents.get(parent) != 1 || !Gate.isConstant(label))
            return false;
        graph.removeParallelEdges(parent, node);
        graph.setLabel(node, label);
        return true;
    }
}
