package org.opendigraph.circuit;

import org.opendigraph.circuit.rules.RewriteRule;
import org.opendigraph.graph.OpenDigraph;
import org.opendigraph.util.IWritesLogs;
import org.opendigraph.util.Logger;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Applies rewrite rules to a circuit until none fires.
 * Nodes to visit are kept in a worklist, initially holding every node.
 * When a rule rewrites a node, the node, its neighbors before and after
 * the rewrite, and every node the rule created are visited again. */
public class Evaluator implements IWritesLogs {
    final List<RewriteRule> rules;
    final CircuitOptions options;
    final Map<String, Integer> firings;

    public Evaluator(CircuitOptions options) {
        this.options = options;
        this.rules = options.enabledRules();
        this.firings = new HashMap<>();
    }

    static int edgeCount(OpenDigraph graph) {
        int result = 0;
        for (int id: graph.getNodeIds())
            for (int m: graph.getChildren(id).values())
                result += m;
        return result;
    }

    /** How many times each rule fired in the last evaluation. */
    public Map<String, Integer> getFirings() {
        return Collections.unmodifiableMap(this.firings);
    }

    static class Worklist {
        final Deque<Integer> queue = new ArrayDeque<>();
        final Set<Integer> queued = new HashSet<>();

        void add(int id) {
            if (this.queued.add(id))
                this.queue.add(id);
        }

        void addAll(Iterable<Integer> ids) {
            for (int id: ids)
                this.add(id);
        }

        boolean isEmpty() {
            return this.queue.isEmpty();
        }

        int remove() {
            int result = this.queue.remove();
            this.queued.remove(result);
            return result;
        }
    }

    /** @return The number of rules that fired.
     * @throws RewriteLimitExceededError if the circuit does not reach a fixpoint
     * within the number of steps allowed by the options. */
    public int evaluate(BoolCircuit circuit) {
        OpenDigraph graph = circuit.getGraph();
        int limit = this.options.rewriteLimit(graph.size(), edgeCount(graph));
        this.firings.clear();
        Worklist worklist = new Worklist();
        worklist.addAll(graph.getNodeIds());
        int steps = 0;
        while (!worklist.isEmpty()) {
            int node = worklist.remove();
            if (!graph.contains(node))
                continue;
            Set<Integer> neighbors = new HashSet<>(graph.getParents(node).keySet());
            neighbors.addAll(graph.getChildren(node).keySet());
            int firstNew = graph.newId();
            for (RewriteRule rule: this.rules) {
                if (!rule.apply(graph, node))
                    continue;
                steps++;
                if (steps > limit)
                    throw new RewriteLimitExceededError(limit);
                this.firings.merge(rule.getName(), 1, Integer::sum);
                Logger.INSTANCE.belowLevel(this, 2)
                        .append("Rule ")
                        .append(rule.getName())
                        .append(" rewrote node ")
                        .append(node)
                        .newline();
                if (graph.contains(node)) {
                    worklist.add(node);
                    neighbors.addAll(graph.getParents(node).keySet());
                    neighbors.addAll(graph.getChildren(node).keySet());
                }
                for (int id: neighbors)
                    if (graph.contains(id))
                        worklist.add(id);
                for (int id = firstNew; id < graph.newId(); id++)
                    if (graph.contains(id))
                        worklist.add(id);
                break;
            }
        }
        Logger.INSTANCE.belowLevel(this, 1)
                .append("Evaluation finished after ")
                .append(steps)
                .append(" rewrites: ")
                .append(this.firings.toString())
                .newline();
        return steps;
    }
}
