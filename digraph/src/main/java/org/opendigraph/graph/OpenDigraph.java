package org.opendigraph.graph;

import org.opendigraph.graph.algorithms.ConnectedComponents;
import org.opendigraph.graph.algorithms.LongestPaths;
import org.opendigraph.graph.algorithms.PathResult;
import org.opendigraph.graph.algorithms.ShortestPaths;
import org.opendigraph.graph.algorithms.TopologicalLevels;
import org.opendigraph.graph.errors.ArityMismatchError;
import org.opendigraph.graph.errors.InvalidReferenceError;
import org.opendigraph.graph.errors.MalformedGraphError;
import org.opendigraph.util.IIndentStream;
import org.opendigraph.util.IndentStream;
import org.opendigraph.util.Linq;
import org.opendigraph.util.ToIndentableString;
import org.opendigraph.util.Utilities;
import org.opendigraph.util.graph.DFSOrder;
import org.opendigraph.util.graph.DiGraph;
import org.opendigraph.util.graph.Port;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/** A directed multigraph with two ordered interfaces: inputs and outputs.
 *
 * <p>The graph owns its nodes; callers refer to them only through their ids.
 * Every edge update goes through {@link #adjustEdge}, which writes the same
 * multiplicity on both endpoints.
 *
 * <p>A graph is well-formed when
 * <ol>
 *     <li>every input and output id is a node of the graph</li>
 *     <li>every input has no parent and exactly one child, with multiplicity 1</li>
 *     <li>every output has no child and exactly one parent, with multiplicity 1</li>
 *     <li>every node is stored under its own id</li>
 *     <li>the parent and child maps are inverses of each other, with the same multiplicities</li>
 * </ol>
 * A node that is both an input and an output may instead carry a single self loop.
 * Well-formedness is not maintained by the mutators; it is checked on demand. */
public class OpenDigraph implements ToIndentableString {
    private final TreeMap<Integer, Node> nodes;
    private final List<Integer> inputs;
    private final List<Integer> outputs;

    public OpenDigraph() {
        this.nodes = new TreeMap<>();
        this.inputs = new ArrayList<>();
        this.outputs = new ArrayList<>();
    }

    /** Build a graph from copies of the supplied nodes.
     * @param inputs   Input ids; each must be one of the nodes.
     * @param outputs  Output ids; each must be one of the nodes.
     * @param nodes    Nodes; their neighbor maps are copied as they are. */
    public OpenDigraph(List<Integer> inputs, List<Integer> outputs, Collection<Node> nodes) {
        this();
        for (Node node: nodes)
            this.nodes.put(node.getId(), node.copy());
        this.setInputs(inputs);
        this.setOutputs(outputs);
    }

    public static OpenDigraph empty() {
        return new OpenDigraph();
    }

    /** The identity graph on n wires: nodes 0..n-1, each with a self loop,
     * which are at the same time the inputs and the outputs. */
    public static OpenDigraph identity(int n) {
        if (n < 0)
            throw new IllegalArgumentException("Negative size " + n);
        OpenDigraph result = new OpenDigraph();
        for (int i = 0; i < n; i++) {
            result.nodes.put(i, new Node(i, ""));
            result.addEdge(i, i);
        }
        result.setInputs(Linq.range(0, n));
        result.setOutputs(Linq.range(0, n));
        return result;
    }

    //////////////////// Node access

    Node node(int id) {
        Node result = this.nodes.get(id);
        if (result == null)
            throw InvalidReferenceError.missing(id);
        return result;
    }

    public boolean contains(int id) {
        return this.nodes.containsKey(id);
    }

    /** A copy of the node with the specified id. */
    public Node getNode(int id) {
        return this.node(id).copy();
    }

    /** Copies of all nodes, in ascending id order. */
    public List<Node> getNodes() {
        return Linq.map(this.nodes.values(), Node::copy);
    }

    /** All node ids, in ascending order. */
    public List<Integer> getNodeIds() {
        return new ArrayList<>(this.nodes.keySet());
    }

    public int size() {
        return this.nodes.size();
    }

    public boolean isEmpty() {
        return this.nodes.isEmpty();
    }

    public String getLabel(int id) {
        return this.node(id).getLabel();
    }

    public void setLabel(int id, String label) {
        this.node(id).setLabel(label);
    }

    /** Read-only view of the parents of a node and their multiplicities. */
    public Map<Integer, Integer> getParents(int id) {
        return this.node(id).getParents();
    }

    /** Read-only view of the children of a node and their multiplicities. */
    public Map<Integer, Integer> getChildren(int id) {
        return this.node(id).getChildren();
    }

    public int indegree(int id) {
        return this.node(id).indegree();
    }

    public int outdegree(int id) {
        return this.node(id).outdegree();
    }

    public int degree(int id) {
        return this.node(id).degree();
    }

    /** Number of parallel edges from source to target. */
    public int multiplicity(int source, int target) {
        this.node(target);
        return this.node(source).childMultiplicity(target);
    }

    public int minId() {
        if (this.nodes.isEmpty())
            throw new MalformedGraphError("Empty graph has no smallest id");
        return this.nodes.firstKey();
    }

    public int maxId() {
        if (this.nodes.isEmpty())
            throw new MalformedGraphError("Empty graph has no largest id");
        return this.nodes.lastKey();
    }

    /** Ids used anywhere in the graph: node keys and interface entries. */
    public Set<Integer> usedIds() {
        Set<Integer> result = new HashSet<>(this.nodes.keySet());
        result.addAll(this.inputs);
        result.addAll(this.outputs);
        return result;
    }

    /** The smallest id strictly larger than every id in use, or 0 for an empty graph. */
    public int newId() {
        int result = 0;
        for (int id: this.usedIds())
            result = Math.max(result, id + 1);
        return result;
    }

    //////////////////// Interfaces

    public List<Integer> getInputs() {
        return Collections.unmodifiableList(this.inputs);
    }

    public List<Integer> getOutputs() {
        return Collections.unmodifiableList(this.outputs);
    }

    /** @throws InvalidReferenceError if there is no node with this id. */
    public void checkExists(int id) {
        this.node(id);
    }

    void checkExist(Collection<Integer> ids) {
        for (int id: ids)
            this.node(id);
    }

    public void setInputs(List<Integer> inputs) {
        this.checkExist(inputs);
        List<Integer> ids = new ArrayList<>(inputs);
        this.inputs.clear();
        this.inputs.addAll(ids);
    }

    public void setOutputs(List<Integer> outputs) {
        this.checkExist(outputs);
        List<Integer> ids = new ArrayList<>(outputs);
        this.outputs.clear();
        this.outputs.addAll(ids);
    }

    public void addInputId(int id) {
        this.node(id);
        this.inputs.add(id);
    }

    public void addOutputId(int id) {
        this.node(id);
        this.outputs.add(id);
    }

    //////////////////// Edges

    /** The only place where edges change.  Adds 'delta' edges from
     * source to target, or removes them if 'delta' is negative.
     * The multiplicity never goes below zero. */
    private void adjustEdge(int source, int target, int delta) {
        Node src = this.node(source);
        Node tgt = this.node(target);
        int current = src.childMultiplicity(target);
        Utilities.enforce(current == tgt.parentMultiplicity(source),
                "Edge " + source + " -> " + target + " recorded with different multiplicities");
        int updated = Math.max(0, current + delta);
        src.setChildMultiplicity(target, updated);
        tgt.setParentMultiplicity(source, updated);
    }

    public void addEdge(int source, int target) {
        this.adjustEdge(source, target, 1);
    }

    public void addEdges(Collection<Edge> edges) {
        for (Edge edge: edges)
            this.addEdge(edge.source(), edge.target());
    }

    /** Remove one edge from source to target, if there is one. */
    public void removeEdge(int source, int target) {
        this.adjustEdge(source, target, -1);
    }

    public void removeEdges(Collection<Edge> edges) {
        for (Edge edge: edges)
            this.removeEdge(edge.source(), edge.target());
    }

    /** Remove all edges from source to target. */
    public void removeParallelEdges(int source, int target) {
        this.adjustEdge(source, target, -this.multiplicity(source, target));
    }

    //////////////////// Nodes

    /** Add a node with a fresh id.
     * @param label     Label of the new node.
     * @param parents   Each occurrence of an id adds one edge from that node.
     * @param children  Each occurrence of an id adds one edge to that node.
     * @return          The id of the new node. */
    public int addNode(String label, List<Integer> parents, List<Integer> children) {
        this.checkExist(parents);
        this.checkExist(children);
        int id = this.newId();
        this.nodes.put(id, new Node(id, label));
        for (int parent: parents)
            this.addEdge(parent, id);
        for (int child: children)
            this.addEdge(id, child);
        return id;
    }

    public int addNode(String label) {
        return this.addNode(label, List.of(), List.of());
    }

    /** Add an unlabeled input node with the specified id, feeding 'child'. */
    public void addInputNode(int id, int child) {
        if (this.contains(id))
            throw new InvalidReferenceError("Node " + id + " already exists", id);
        this.node(child);
        this.nodes.put(id, new Node(id, ""));
        this.addEdge(id, child);
        this.inputs.add(id);
    }

    /** Add an unlabeled input node with a fresh id, feeding 'child'.
     * @return The id of the new input. */
    public int addInputNode(int child) {
        this.node(child);
        int id = this.newId();
        this.addInputNode(id, child);
        return id;
    }

    /** Add an unlabeled output node with the specified id, fed by 'parent'. */
    public void addOutputNode(int id, int parent) {
        if (this.contains(id))
            throw new InvalidReferenceError("Node " + id + " already exists", id);
        this.node(parent);
        this.nodes.put(id, new Node(id, ""));
        this.addEdge(parent, id);
        this.outputs.add(id);
    }

    public int addOutputNode(int parent) {
        this.node(parent);
        int id = this.newId();
        this.addOutputNode(id, parent);
        return id;
    }

    /** Remove every edge incident to the node. */
    private void detach(int id) {
        Node node = this.node(id);
        for (int parent: node.getParentIds())
            this.removeParallelEdges(parent, id);
        for (int child: node.getChildIds())
            this.removeParallelEdges(id, child);
    }

    /** Remove a node with all its edges, and drop it from the interfaces. */
    public void removeNode(int id) {
        this.detach(id);
        this.nodes.remove(id);
        this.inputs.removeIf(i -> i == id);
        this.outputs.removeIf(o -> o == id);
    }

    public void removeNodes(Collection<Integer> ids) {
        for (int id: ids)
            this.removeNode(id);
    }

    /** Merge node 'absorbed' into node 'kept'.
     * Every edge incident to 'absorbed' is redirected to 'kept'; multiplicities add up,
     * and edges between the two become self loops.  'absorbed' is removed and its
     * occurrences in the interfaces are replaced by 'kept'.
     * @param label  If not null, the new label of 'kept'.
     * @return       'kept'. */
    public int mergeNodes(int kept, int absorbed, @Nullable String label) {
        Node target = this.node(kept);
        Node source = this.node(absorbed);
        if (label != null)
            target.setLabel(label);
        if (kept == absorbed)
            return kept;
        Map<Integer, Integer> parents = Map.copyOf(source.getParents());
        Map<Integer, Integer> children = Map.copyOf(source.getChildren());
        this.detach(absorbed);
        this.nodes.remove(absorbed);
        parents.forEach((p, m) -> {
            // a self loop on 'absorbed' shows up in both maps; add it once
            if (p != absorbed)
                this.adjustEdge(p, kept, m);
        });
        children.forEach((c, m) -> {
            int child = (c == absorbed) ? kept : c;
            this.adjustEdge(kept, child, m);
        });
        this.inputs.replaceAll(i -> i == absorbed ? kept : i);
        this.outputs.replaceAll(o -> o == absorbed ? kept : o);
        return kept;
    }

    public int mergeNodes(int kept, int absorbed) {
        return this.mergeNodes(kept, absorbed, null);
    }

    //////////////////// Well-formedness

    /** A node that is both an input and an output, whose only edge is a single self loop.
     * Such a node passes its input straight through, as in {@link #identity(int)}. */
    boolean isWire(Node node) {
        int id = node.getId();
        return this.inputs.contains(id) && this.outputs.contains(id) &&
                node.getParents().equals(Map.of(id, 1)) &&
                node.getChildren().equals(Map.of(id, 1));
    }

    /** Describes the first violated well-formedness condition, or returns null. */
    @Nullable
    public String firstViolation() {
        for (int id: Utilities.concat(this.inputs, this.outputs)) {
            if (!this.contains(id))
                return "Interface id " + id + " is not a node";
        }
        for (int id: this.inputs) {
            Node node = this.nodes.get(id);
            if (this.isWire(node))
                continue;
            if (node.indegree() != 0)
                return "Input " + id + " has parents";
            if (node.outdegree() != 1 || node.getChildren().values().iterator().next() != 1)
                return "Input " + id + " does not have exactly one child";
        }
        for (int id: this.outputs) {
            Node node = this.nodes.get(id);
            if (this.isWire(node))
                continue;
            if (node.outdegree() != 0)
                return "Output " + id + " has children";
            if (node.indegree() != 1 || node.getParents().values().iterator().next() != 1)
                return "Output " + id + " does not have exactly one parent";
        }
        for (Map.Entry<Integer, Node> e: this.nodes.entrySet()) {
            if (e.getKey() != e.getValue().getId())
                return "Node " + e.getValue().getId() + " is stored under id " + e.getKey();
        }
        for (Node node: this.nodes.values()) {
            for (Map.Entry<Integer, Integer> child: node.getChildren().entrySet()) {
                Node other = this.nodes.get(child.getKey());
                if (other == null)
                    return "Node " + node.getId() + " has missing child " + child.getKey();
                if (other.parentMultiplicity(node.getId()) != child.getValue())
                    return "Edge " + node.getId() + " -> " + child.getKey() + " is not recorded on both ends";
            }
            for (Map.Entry<Integer, Integer> parent: node.getParents().entrySet()) {
                Node other = this.nodes.get(parent.getKey());
                if (other == null)
                    return "Node " + node.getId() + " has missing parent " + parent.getKey();
                if (other.childMultiplicity(node.getId()) != parent.getValue())
                    return "Edge " + parent.getKey() + " -> " + node.getId() + " is not recorded on both ends";
            }
        }
        return null;
    }

    public boolean isWellFormed() {
        return this.firstViolation() == null;
    }

    public void assertIsWellFormed() {
        String violation = this.firstViolation();
        if (violation != null)
            throw new MalformedGraphError(violation);
    }

    //////////////////// Algorithms

    /** A view of the graph where the successors of a node are its neighbors in 'direction'.
     * With {@link Direction#BOTH} the multiplicities of both directions add up. */
    public DiGraph<Integer> view(Direction direction) {
        return new DiGraph<>() {
            @Override
            public Iterable<Integer> getNodes() {
                return OpenDigraph.this.getNodeIds();
            }

            @Override
            public List<Port<Integer>> getSuccessors(Integer id) {
                Node node = OpenDigraph.this.node(id);
                Map<Integer, Integer> neighbors = new TreeMap<>();
                if (direction != Direction.PARENTS)
                    node.getChildren().forEach((c, m) -> neighbors.merge(c, m, Integer::sum));
                if (direction != Direction.CHILDREN)
                    node.getParents().forEach((p, m) -> neighbors.merge(p, m, Integer::sum));
                List<Port<Integer>> result = new ArrayList<>(neighbors.size());
                neighbors.forEach((n, m) -> result.add(new Port<>(n, m)));
                return result;
            }
        };
    }

    /** True if the graph has a directed cycle; self loops count. */
    public boolean isCyclic() {
        return new DFSOrder<>(this.view(Direction.CHILDREN)).hasBackEdge();
    }

    /** Partition the nodes into levels such that every edge goes from a lower to a higher level. */
    public List<Set<Integer>> topologicalSort() {
        return new TopologicalLevels(this).compute();
    }

    public int graphDepth() {
        return this.topologicalSort().size();
    }

    /** Index of the level containing a node. */
    public int nodeDepth(int id, List<Set<Integer>> levels) {
        this.node(id);
        for (int i = 0; i < levels.size(); i++)
            if (levels.get(i).contains(id))
                return i;
        throw new InvalidReferenceError("Node " + id + " is in no level", id);
    }

    public int nodeDepth(int id) {
        return this.nodeDepth(id, this.topologicalSort());
    }

    public ShortestPaths dijkstra(int source, Direction direction, @Nullable Integer target) {
        return ShortestPaths.dijkstra(this, source, direction, target);
    }

    public ShortestPaths dijkstra(int source, Direction direction) {
        return this.dijkstra(source, direction, null);
    }

    /** Shortest path from u to v, both included, following edges in 'direction'. */
    public List<Integer> shortestPath(int u, int v, Direction direction) {
        return ShortestPaths.shortestPath(this, u, v, direction);
    }

    /** Shortest path from u to v ignoring edge directions. */
    public List<Integer> shortestPath(int u, int v) {
        return this.shortestPath(u, v, Direction.BOTH);
    }

    public Map<Integer, ShortestPaths.AncestorDistances> commonAncestorsDistances(int a, int b) {
        return ShortestPaths.commonAncestorsDistances(this, a, b);
    }

    public PathResult longestPath(int u, int v, List<Set<Integer>> levels) {
        return LongestPaths.longestPath(this, u, v, levels);
    }

    public PathResult longestPath(int u, int v) {
        return this.longestPath(u, v, this.topologicalSort());
    }

    public PathResult maxPathAndDistance(int u, int v) {
        return LongestPaths.maxPathAndDistance(this, u, v);
    }

    public ConnectedComponents connectedComponents() {
        return new ConnectedComponents(this);
    }

    //////////////////// Composition

    /** Add 'offset' to every id in the graph. */
    public void shiftIndices(int offset) {
        List<Node> shifted = Linq.map(this.nodes.values(), n -> n.renamed(id -> id + offset));
        this.nodes.clear();
        for (Node node: shifted)
            this.nodes.put(node.getId(), node);
        this.inputs.replaceAll(i -> i + offset);
        this.outputs.replaceAll(o -> o + offset);
    }

    /** Insert copies of all nodes of 'other' under fresh ids.
     * @return The translation from the ids of 'other' to the new ids. */
    private IdAllocator absorb(OpenDigraph other) {
        IdAllocator allocator = new IdAllocator(this.usedIds());
        for (Node node: other.nodes.values()) {
            Node copy = node.renamed(allocator::translate);
            Utilities.putNew(this.nodes, copy.getId(), copy);
        }
        return allocator;
    }

    /** Place a copy of 'other' next to this graph; its interfaces are appended after ours.
     * @return The translation from the ids of 'other' to the new ids. */
    public Map<Integer, Integer> iparallel(OpenDigraph other) {
        OpenDigraph source = other == this ? other.copy() : other;
        IdAllocator allocator = this.absorb(source);
        for (int i: source.inputs)
            this.inputs.add(allocator.translate(i));
        for (int o: source.outputs)
            this.outputs.add(allocator.translate(o));
        return allocator.getTranslation();
    }

    public static OpenDigraph parallel(OpenDigraph first, OpenDigraph second) {
        OpenDigraph result = first.copy();
        result.iparallel(second);
        return result;
    }

    /** Plug a copy of 'feeder' in front of this graph: the i-th output of 'feeder'
     * is connected to our i-th input.  Afterwards the inputs are those of 'feeder',
     * and our ids are unchanged.
     * @return The translation from the ids of 'feeder' to the new ids. */
    public Map<Integer, Integer> icompose(OpenDigraph feeder) {
        if (feeder.outputs.size() != this.inputs.size())
            throw new ArityMismatchError("Composed graph outputs do not match inputs",
                    this.inputs.size(), feeder.outputs.size());
        OpenDigraph source = feeder == this ? feeder.copy() : feeder;
        IdAllocator allocator = this.absorb(source);
        for (int i = 0; i < this.inputs.size(); i++)
            this.addEdge(allocator.translate(source.outputs.get(i)), this.inputs.get(i));
        this.inputs.clear();
        for (int i: source.inputs)
            this.inputs.add(allocator.translate(i));
        return allocator.getTranslation();
    }

    /** A new graph where the outputs of 'second' feed the inputs of 'first'. */
    public static OpenDigraph compose(OpenDigraph first, OpenDigraph second) {
        OpenDigraph result = first.copy();
        result.icompose(second);
        return result;
    }

    //////////////////// Object

    public OpenDigraph copy() {
        return new OpenDigraph(this.inputs, this.outputs, this.nodes.values());
    }

    /** Replace the contents of this graph by copies of the nodes and interfaces of 'other'. */
    public void assign(OpenDigraph other) {
        if (other == this)
            return;
        this.nodes.clear();
        for (Node node: other.nodes.values())
            this.nodes.put(node.getId(), node.copy());
        this.inputs.clear();
        this.inputs.addAll(other.inputs);
        this.outputs.clear();
        this.outputs.addAll(other.outputs);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OpenDigraph that = (OpenDigraph) o;
        return this.nodes.equals(that.nodes) &&
                this.inputs.equals(that.inputs) &&
                this.outputs.equals(that.outputs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.nodes, this.inputs, this.outputs);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("OpenDigraph inputs=")
                .append(this.inputs.toString())
                .append(" outputs=")
                .append(this.outputs.toString())
                .append(" {")
                .increase();
        for (Node node: this.nodes.values())
            builder.append(node).newline();
        return builder.decrease().append("}");
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        this.toString(new IndentStream(builder));
        return builder.toString();
    }
}
