package org.opendigraph.circuit.rules;

import org.opendigraph.circuit.Gate;
import org.opendigraph.graph.OpenDigraph;

import java.util.ArrayList;
import java.util.List;

/** Replaces a XOR with more than two operands by a XOR of pairwise XORs:
 * the operands at positions 2i and 2i+1 feed a new XOR node. */
public class XorFanInRule extends GateRule {
    public XorFanInRule() {
        super(Gate.XOR);
    }

    @Override
    public String getName() {
        return "xorFanIn";
    }

    @Override
    protected boolean rewrite(OpenDigraph graph, int node) {
        List<Integer> operands = new ArrayList<>();
        for (var e: parents(graph, node)) {
            for (int i = 0; i < e.getValue(); i++)
                operands.add(e.getKey());
        }
        if (operands.size() <= 2)
            return false;
        operands.sort(Integer::compare);
        for (int i = 0; i + 1 < operands.size(); i += 2) {
            int left = operands.get(i);
            int right = operands.get(i + 1);
            graph.removeEdge(left, node);
            graph.removeEdge(right, node);
            graph.addNode(Gate.XOR.label, List.of(left, right), List.of(node));
        }
        return true;
    }
}
