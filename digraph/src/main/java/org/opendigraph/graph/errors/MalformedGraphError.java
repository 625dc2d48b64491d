package org.opendigraph.graph.errors;

public final class MalformedGraphError extends BaseGraphException {
    public MalformedGraphError(String message) {
        super(message);
    }

    @Override
    public String getErrorKind() {
        return "Malformed graph";
    }
}
