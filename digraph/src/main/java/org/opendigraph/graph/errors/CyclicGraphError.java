package org.opendigraph.graph.errors;

/** An algorithm which requires an acyclic graph was given a graph with a cycle. */
public final class CyclicGraphError extends BaseGraphException {
    public CyclicGraphError(String message) {
        super(message);
    }

    @Override
    public String getErrorKind() {
        return "Cyclic graph";
    }
}
