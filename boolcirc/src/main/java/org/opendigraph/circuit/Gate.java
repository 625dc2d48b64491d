package org.opendigraph.circuit;

import javax.annotation.Nullable;

/** The labels a circuit node may carry. */
public enum Gate {
    ZERO("0"),
    ONE("1"),
    NOT("~"),
    AND("&"),
    OR("|"),
    XOR("^"),
    /** Unlabeled node: copies its single input to all its children */
    COPY("");

    public final String label;

    Gate(String label) {
        this.label = label;
    }

    @Nullable
    public static Gate fromLabel(String label) {
        for (Gate gate: Gate.values())
            if (gate.label.equals(label))
                return gate;
        return null;
    }

    @Nullable
    public static Gate fromOperator(char c) {
        switch (c) {
            case '~': return NOT;
            case '&': return AND;
            case '|': return OR;
            case '^': return XOR;
            default: return null;
        }
    }

    public static boolean isConstant(String label) {
        return label.equals(ZERO.label) || label.equals(ONE.label);
    }

    public static String constant(boolean value) {
        return value ? ONE.label : ZERO.label;
    }

    /** The value of a constant label. */
    public static boolean value(String label) {
        if (label.equals(ONE.label))
            return true;
        if (label.equals(ZERO.label))
            return false;
        throw new IllegalArgumentException("Not a constant: " + label);
    }

    public boolean isOperator() {
        return this == NOT || this == AND || this == OR || this == XOR;
    }
}
