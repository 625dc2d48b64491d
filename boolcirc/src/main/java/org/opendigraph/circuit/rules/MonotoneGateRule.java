package org.opendigraph.circuit.rules;

import org.opendigraph.circuit.Gate;
import org.opendigraph.graph.OpenDigraph;

/** Simplification of AND and OR gates, which differ only in their absorbing element.
 * A gate with an absorbing operand becomes that constant; identity operands and
 * repeated operands are dropped; a gate left with no operand becomes the identity
 * constant, and one left with a single operand becomes a copy node. */
public abstract class MonotoneGateRule extends GateRule {
    /** x & 0 = 0; x | 1 = 1 */
    final boolean absorbing;

    protected MonotoneGateRule(Gate gate, boolean absorbing) {
        super(gate);
        this.absorbing = absorbing;
    }

    @Override
    protected boolean rewrite(OpenDigraph graph, int node) {
        String absorbingLabel = Gate.constant(this.absorbing);
        String identityLabel = Gate.constant(!this.absorbing);
        for (var e: parents(graph, node)) {
            if (graph.getLabel(e.getKey()).equals(absorbingLabel)) {
                becomeConstant(graph, node, this.absorbing);
                return true;
            }
        }
        boolean changed = false;
        for (var e: parents(graph, node)) {
            if (graph.getLabel(e.getKey()).equals(identityLabel)) {
                graph.removeParallelEdges(e.getKey(), node);
                changed = true;
            }
        }
        changed |= dropDuplicateEdges(graph, node);
        int operands = graph.indegree(node);
        if (operands == 0) {
            graph.setLabel(node, identityLabel);
            return true;
        }
        if (operands == 1) {
            graph.setLabel(node, Gate.COPY.label);
            return true;
        }
        return changed;
    }
}
