package org.opendigraph.graph.algorithms;

import org.opendigraph.graph.Direction;
import org.opendigraph.graph.Node;
import org.opendigraph.graph.OpenDigraph;
import org.opendigraph.util.Linq;
import org.opendigraph.util.Utilities;
import org.opendigraph.util.graph.DiGraph;
import org.opendigraph.util.graph.Port;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Connected components of a graph, ignoring the direction of edges */
public class ConnectedComponents {
    /** Count of connected components */
    public int count = 0;
    /** Visited nodes */
    final Set<Integer> marked = new HashSet<>();
    /** Maps each node to the component id */
    public final Map<Integer, Integer> componentId = new HashMap<>();
    /** The nodes in each component, in ascending order */
    public final Map<Integer, List<Integer>> component = new HashMap<>();
    final OpenDigraph graph;

    public ConnectedComponents(OpenDigraph graph) {
        this.graph = graph;
        DiGraph<Integer> undirected = graph.view(Direction.BOTH);
        for (int v: undirected.getNodes()) {
            if (!this.marked.contains(v)) {
                this.dfs(undirected, v);
                this.count++;
            }
        }
        for (List<Integer> nodes: this.component.values())
            nodes.sort(Integer::compare);
    }

    void dfs(DiGraph<Integer> graph, int start) {
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(start);
        this.marked.add(start);
        Utilities.putNew(this.component, this.count, new ArrayList<>());
        while (!stack.isEmpty()) {
            int v = stack.pop();
            Utilities.putNew(this.componentId, v, this.count);
            this.component.get(this.count).add(v);
            for (Port<Integer> w : graph.getSuccessors(v)) {
                if (this.marked.add(w.node()))
                    stack.push(w.node());
            }
        }
    }

    /** One graph per component, in component order.  The nodes of each
     * component are renumbered 0, 1, ... in ascending order of their original
     * ids; inputs and outputs keep their relative order. */
    public List<OpenDigraph> graphs() {
        List<OpenDigraph> result = new ArrayList<>();
        for (int c = 0; c < this.count; c++) {
            List<Integer> members = this.component.get(c);
            Map<Integer, Integer> renumber = new HashMap<>();
            for (int i = 0; i < members.size(); i++)
                renumber.put(members.get(i), i);
            List<Node> nodes = Linq.map(members, id -> this.graph.getNode(id).renamed(renumber::get));
            List<Integer> inputs = Linq.map(
                    Linq.where(this.graph.getInputs(), renumber::containsKey), renumber::get);
            List<Integer> outputs = Linq.map(
                    Linq.where(this.graph.getOutputs(), renumber::containsKey), renumber::get);
            result.add(new OpenDigraph(inputs, outputs, nodes));
        }
        return result;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        for (var e : this.component.entrySet()) {
            builder.append(e.getKey())
                    .append("=>")
                    .append(e.getValue().toString())
                    .append("\n");
        }
        return builder.toString();
    }
}
