package org.opendigraph.circuit.rules;

import org.opendigraph.circuit.Gate;
import org.opendigraph.graph.OpenDigraph;

import java.util.ArrayList;
import java.util.List;

/** Simplification of XOR gates.
 * Constant operands are folded into a parity bit, and an operand connected
 * an even number of times cancels out.  What remains is rebuilt from the
 * surviving operands and the parity: a constant, a copy or negation of a
 * single operand, or a negation of a smaller XOR. */
public class XorRule extends GateRule {
    public XorRule() {
        super(Gate.XOR);
    }

    @Override
    public String getName() {
        return "xor";
    }

    @Override
    protected boolean rewrite(OpenDigraph graph, int node) {
        boolean changed = false;
        boolean parity = false;
        for (var e: parents(graph, node)) {
            String label = graph.getLabel(e.getKey());
            if (Gate.isConstant(label)) {
                if (Gate.value(label) && e.getValue() % 2 == 1)
                    parity = !parity;
                graph.removeParallelEdges(e.getKey(), node);
                changed = true;
            } else if (e.getValue() > 1) {
                // x ^ x = 0
                graph.removeParallelEdges(e.getKey(), node);
                if (e.getValue() % 2 == 1)
                    graph.addEdge(e.getKey(), node);
                changed = true;
            }
        }
        List<Integer> operands = new ArrayList<>(graph.getParents(node).keySet());
        if (operands.isEmpty()) {
            graph.setLabel(node, Gate.constant(parity));
            return true;
        }
        if (operands.size() == 1) {
            graph.setLabel(node, parity ? Gate.NOT.label : Gate.COPY.label);
            return true;
        }
        if (parity) {
            for (int operand: operands)
                graph.removeEdge(operand, node);
            graph.addNode(Gate.XOR.label, operands, List.of(node));
            graph.setLabel(node, Gate.NOT.label);
        }
        return changed;
    }
}
