package org.opendigraph.util.graph;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Set;

/** Depth-first traversal of a whole graph, recording whether some edge closes a cycle.
 * The traversal uses an explicit stack, so deep graphs do not overflow the call stack. */
public class DFSOrder<Node> {
    final Set<Node> marked;
    /** Nodes whose traversal has started but not finished */
    final Set<Node> onStack;
    boolean backEdge;

    public DFSOrder(DiGraph<Node> graph) {
        this.marked = new HashSet<>();
        this.onStack = new HashSet<>();
        this.backEdge = false;
        for (Node v: graph.getNodes())
            if (!this.marked.contains(v))
                this.dfs(graph, v);
    }

    private void enter(DiGraph<Node> graph, Node v, Deque<Frame<Node>> stack) {
        this.marked.add(v);
        this.onStack.add(v);
        stack.push(new Frame<>(v, graph.getSuccessors(v).iterator()));
    }

    private void dfs(DiGraph<Node> graph, Node v) {
        Deque<Frame<Node>> stack = new ArrayDeque<>();
        this.enter(graph, v, stack);
        while (!stack.isEmpty()) {
            Frame<Node> top = stack.peek();
            if (top.successors.hasNext()) {
                Node w = top.successors.next().node();
                if (this.onStack.contains(w)) {
                    this.backEdge = true;
                } else if (!this.marked.contains(w)) {
                    this.enter(graph, w, stack);
                }
            } else {
                stack.pop();
                this.onStack.remove(top.node);
            }
        }
    }

    /** True if some edge points to a node whose traversal is in progress. */
    public boolean hasBackEdge() {
        return this.backEdge;
    }

    static final class Frame<Node> {
        final Node node;
        final Iterator<Port<Node>> successors;

        Frame(Node node, Iterator<Port<Node>> successors) {
            this.node = node;
            this.successors = successors;
        }
    }
}
