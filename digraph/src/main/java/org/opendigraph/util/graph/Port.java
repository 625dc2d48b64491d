package org.opendigraph.util.graph;

import java.util.Objects;

/** An edge endpoint: a destination node and the number of parallel edges leading to it */
public class Port<Node> {
    protected final Node node;
    protected final int multiplicity;

    public Port(Node node, int multiplicity) {
        this.node = node;
        this.multiplicity = multiplicity;
    }

    public Node node() {
        return this.node;
    }

    public int multiplicity() {
        return this.multiplicity;
    }

    @SuppressWarnings("rawtypes")
    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (obj == null || obj.getClass() != this.getClass()) return false;
        var that = (Port) obj;
        return Objects.equals(this.node, that.node) &&
                this.multiplicity == that.multiplicity;
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.node, this.multiplicity);
    }

    @Override
    public String toString() {
        return "Port[" +
                "node=" + this.node + ", " +
                "multiplicity=" + this.multiplicity + ']';
    }
}
