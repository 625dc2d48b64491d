package org.opendigraph.circuit.rules;

import org.opendigraph.circuit.Gate;
import org.opendigraph.graph.OpenDigraph;

/** x | ~x = 1 */
public class NeutralOrRule extends GateRule {
    public NeutralOrRule() {
        super(Gate.OR);
    }

    @Override
    public String getName() {
        return "neutralOr";
    }

    @Override
    protected boolean rewrite(OpenDigraph graph, int node) {
        if (!hasComplementaryParents(graph, node))
            return false;
        becomeConstant(graph, node, true);
        return true;
    }
}
