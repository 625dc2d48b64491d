package org.opendigraph.graph.errors;

/** Composition of graphs whose interfaces have different sizes. */
public final class ArityMismatchError extends BaseGraphException {
    public final int expected;
    public final int actual;

    public ArityMismatchError(String message, int expected, int actual) {
        super(message + ": expected " + expected + ", got " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    @Override
    public String getErrorKind() {
        return "Arity mismatch";
    }
}
