package org.opendigraph.graph.errors;

/** An operation names a node id that is not in the graph, or one that is already taken. */
public final class InvalidReferenceError extends BaseGraphException {
    public final int nodeId;

    public InvalidReferenceError(String message, int nodeId) {
        super(message);
        this.nodeId = nodeId;
    }

    public static InvalidReferenceError missing(int nodeId) {
        return new InvalidReferenceError("Node " + nodeId + " does not exist", nodeId);
    }

    @Override
    public String getErrorKind() {
        return "Invalid reference";
    }
}
