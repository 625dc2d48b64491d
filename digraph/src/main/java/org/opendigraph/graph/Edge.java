package org.opendigraph.graph;

/** A single directed edge between two node ids. */
public record Edge(int source, int target) {
    @Override
    public String toString() {
        return this.source + " -> " + this.target;
    }
}
