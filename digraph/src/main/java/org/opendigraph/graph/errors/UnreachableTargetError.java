package org.opendigraph.graph.errors;

public final class UnreachableTargetError extends BaseGraphException {
    public final int source;
    public final int target;

    public UnreachableTargetError(int source, int target) {
        super("Node " + target + " is not reachable from node " + source);
        this.source = source;
        this.target = target;
    }

    @Override
    public String getErrorKind() {
        return "Unreachable target";
    }
}
