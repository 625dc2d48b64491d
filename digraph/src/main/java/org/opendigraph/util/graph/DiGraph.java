package org.opendigraph.util.graph;

import java.util.List;

/** Abstract representation of a graph. */
public interface DiGraph<Node> {
    /** Returns an iterator over the graph nodes */
    Iterable<Node> getNodes();

    /** Returns the successors of a node */
    List<Port<Node>> getSuccessors(Node node);
}
