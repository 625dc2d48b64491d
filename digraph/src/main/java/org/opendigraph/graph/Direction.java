package org.opendigraph.graph;

/** Which edges a traversal follows. */
public enum Direction {
    /** Parents and children alike; the graph is treated as undirected. */
    BOTH,
    PARENTS,
    CHILDREN
}
