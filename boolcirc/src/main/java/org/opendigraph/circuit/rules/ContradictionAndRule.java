package org.opendigraph.circuit.rules;

import org.opendigraph.circuit.Gate;
import org.opendigraph.graph.OpenDigraph;

/** x &amp; ~x = 0 */
public class ContradictionAndRule extends GateRule {
    public ContradictionAndRule() {
        super(Gate.AND);
    }

    @Override
    public String getName() {
        return "contradictionAnd";
    }

    @Override
    protected boolean rewrite(OpenDigraph graph, int node) {
        if (!hasComplementaryParents(graph, node))
            return false;
        becomeConstant(graph, node, false);
        return true;
    }
}
