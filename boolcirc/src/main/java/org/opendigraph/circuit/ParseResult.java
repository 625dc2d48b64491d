package org.opendigraph.circuit;

import java.util.List;

/** A circuit and the variables of the formula that was parsed into it, in order of first use. */
public record ParseResult(BoolCircuit circuit, List<String> variables) {
    public ParseResult {
        variables = List.copyOf(variables);
    }
}
