package org.opendigraph.circuit;

import org.opendigraph.graph.errors.BaseGraphException;

/** A formula handed to the parser is not well-formed. */
public final class FormulaSyntaxError extends BaseGraphException {
    public final String formula;
    /** Offset of the offending character, or the formula length if the error is at the end. */
    public final int position;

    public FormulaSyntaxError(String message, String formula, int position) {
        super(message + " at position " + position + " in " + formula);
        this.formula = formula;
        this.position = position;
    }

    @Override
    public String getErrorKind() {
        return "Syntax error";
    }
}
