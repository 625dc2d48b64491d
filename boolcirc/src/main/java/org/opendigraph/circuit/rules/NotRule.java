package org.opendigraph.circuit.rules;

import org.opendigraph.circuit.Gate;
import org.opendigraph.graph.OpenDigraph;

import java.util.Map;

/** ~0 = 1, ~1 = 0 */
public class NotRule extends GateRule {
    public NotRule() {
        super(Gate.NOT);
    }

    @Override
    public String getName() {
        return "not";
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
        becomeConstant(graph, node, !Gate.value(label));
        return true;
    }
}
