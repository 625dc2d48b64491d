package org.opendigraph.circuit.rules;

import org.opendigraph.circuit.Gate;

public class OrRule extends MonotoneGateRule {
    public OrRule() {
        super(Gate.OR, true);
    }

    @Override
    public String getName() {
        return "or";
    }
}
