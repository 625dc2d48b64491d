package org.opendigraph.circuit.rules;

import org.opendigraph.circuit.Gate;

public class AndRule extends MonotoneGateRule {
    public AndRule() {
        super(Gate.AND, false);
    }

    @Override
    public String getName() {
        return "and";
    }
}
