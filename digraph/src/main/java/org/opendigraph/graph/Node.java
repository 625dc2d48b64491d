package org.opendigraph.graph;

import org.opendigraph.util.IIndentStream;
import org.opendigraph.util.ToIndentableString;
import org.opendigraph.util.Utilities;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.IntUnaryOperator;

/** A vertex of an {@link OpenDigraph}.
 * A node has an id, a label, and two maps from neighbor ids to the number
 * of parallel edges connecting it to each neighbor.
 * Nodes know nothing about the graph that owns them. */
public final class Node implements ToIndentableString {
    int id;
    String label;
    final Map<Integer, Integer> parents;
    final Map<Integer, Integer> children;

    public Node(int id, String label, Map<Integer, Integer> parents, Map<Integer, Integer> children) {
        this.id = id;
        this.label = Objects.requireNonNull(label);
        this.parents = new LinkedHashMap<>();
        this.children = new LinkedHashMap<>();
        parents.forEach(this::setParentMultiplicity);
        children.forEach(this::setChildMultiplicity);
    }

    public Node(int id, String label) {
        this(id, label, Map.of(), Map.of());
    }

    public int getId() {
        return this.id;
    }

    public void setId(int id) {
        this.id = id;
    }

    public String getLabel() {
        return this.label;
    }

    public void setLabel(String label) {
        this.label = Objects.requireNonNull(label);
    }

    /** Read-only view of the parent multiplicities. */
    public Map<Integer, Integer> getParents() {
        return Collections.unmodifiableMap(this.parents);
    }

    /** Read-only view of the child multiplicities. */
    public Map<Integer, Integer> getChildren() {
        return Collections.unmodifiableMap(this.children);
    }

    public List<Integer> getParentIds() {
        return new ArrayList<>(this.parents.keySet());
    }

    public List<Integer> getChildIds() {
        return new ArrayList<>(this.children.keySet());
    }

    public int parentMultiplicity(int parent) {
        return this.parents.getOrDefault(parent, 0);
    }

    public int childMultiplicity(int child) {
        return this.children.getOrDefault(child, 0);
    }

    static void setMultiplicity(Map<Integer, Integer> map, int id, int multiplicity) {
        Utilities.enforce(multiplicity >= 0, "Negative multiplicity " + multiplicity);
        if (multiplicity == 0)
            map.remove(id);
        else
            map.put(id, multiplicity);
    }

    /** Set the number of edges from the parent to this node; 0 removes the parent. */
    public void setParentMultiplicity(int parent, int multiplicity) {
        setMultiplicity(this.parents, parent, multiplicity);
    }

    /** Set the number of edges from this node to the child; 0 removes the child. */
    public void setChildMultiplicity(int child, int multiplicity) {
        setMultiplicity(this.children, child, multiplicity);
    }

    public void addParent(int parent) {
        this.parents.merge(parent, 1, Integer::sum);
    }

    public void addChild(int child) {
        this.children.merge(child, 1, Integer::sum);
    }

    public void removeParentOnce(int parent) {
        this.setParentMultiplicity(parent, Math.max(0, this.parentMultiplicity(parent) - 1));
    }

    public void removeChildOnce(int child) {
        this.setChildMultiplicity(child, Math.max(0, this.childMultiplicity(child) - 1));
    }

    public void removeParentId(int parent) {
        this.parents.remove(parent);
    }

    public void removeChildId(int child) {
        this.children.remove(child);
    }

    /** Number of distinct parents. */
    public int indegree() {
        return this.parents.size();
    }

    /** Number of distinct children. */
    public int outdegree() {
        return this.children.size();
    }

    public int degree() {
        return this.indegree() + this.outdegree();
    }

    public Node copy() {
        return new Node(this.id, this.label, this.parents, this.children);
    }

    /** A copy of this node where every id, including its own, is mapped through 'rename'. */
    public Node renamed(IntUnaryOperator rename) {
        Node result = new Node(rename.applyAsInt(this.id), this.label);
        this.parents.forEach((p, m) -> result.setParentMultiplicity(rename.applyAsInt(p), m));
        this.children.forEach((c, m) -> result.setChildMultiplicity(rename.applyAsInt(c), m));
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Node that = (Node) o;
        return this.id == that.id &&
                this.label.equals(that.label) &&
                this.parents.equals(that.parents) &&
                this.children.equals(that.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.id, this.label, this.parents, this.children);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.id)
                .append(" ")
                .append(Utilities.doubleQuote(this.label))
                .append(" parents=")
                .append(this.parents.toString())
                .append(" children=")
                .append(this.children.toString());
    }

    @Override
    public String toString() {
        return "Node(" + this.id + ", " + Utilities.doubleQuote(this.label) +
                ", " + this.parents + ", " + this.children + ")";
    }
}
