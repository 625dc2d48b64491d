package org.opendigraph.circuit;

import org.opendigraph.graph.errors.BaseGraphException;

public final class RewriteLimitExceededError extends BaseGraphException {
    public final int limit;

    public RewriteLimitExceededError(int limit) {
        super("Circuit did not reach a fixpoint after " + limit + " rewrite steps");
        this.limit = limit;
    }

    @Override
    public String getErrorKind() {
        return "Rewrite limit exceeded";
    }
}
