package org.opendigraph.circuit.rules;

import org.opendigraph.graph.OpenDigraph;

import java.util.List;

/** A local rewrite of a circuit around a single node.
 * A rule inspects the node and its neighbors and, when it matches,
 * changes the graph in place. */
public interface RewriteRule {
    /** Short name, used for logging and for disabling the rule. */
    String getName();

    /** Try to rewrite the circuit around a node.
     * @param graph  Graph of the circuit.
     * @param node   Id of a node that exists in the graph.
     * @return       True if the graph was changed. */
    boolean apply(OpenDigraph graph, int node);

    /** All rules, in the order the evaluator tries them. */
    static List<RewriteRule> all() {
        return List.of(
                new CopyRule(),
                new EraseRule(),
                new NotRule(),
                new AndRule(),
                new ContradictionAndRule(),
                new OrRule(),
                new NeutralOrRule(),
                new XorRule(),
                new XorFanInRule());
    }
}
