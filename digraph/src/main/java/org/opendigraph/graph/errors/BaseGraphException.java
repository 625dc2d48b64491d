package org.opendigraph.graph.errors;

import javax.annotation.Nullable;

/** Base class for exceptions which are thrown by graph and circuit operations. */
public abstract class BaseGraphException extends RuntimeException {
    protected BaseGraphException(String message, @Nullable Throwable throwable) {
        super(message, throwable);
    }

    protected BaseGraphException(String message) {
        this(message, null);
    }

    public abstract String getErrorKind();

    @Override
    public String toString() {
        return this.getErrorKind() + ": " + this.getMessage();
    }
}
