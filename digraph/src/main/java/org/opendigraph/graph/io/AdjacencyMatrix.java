package org.opendigraph.graph.io;

import org.opendigraph.graph.Node;
import org.opendigraph.graph.OpenDigraph;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Conversion between graphs and square integer matrices.
 * Entry (i, j) of the matrix is the number of edges from node i to node j. */
public final class AdjacencyMatrix {
    private AdjacencyMatrix() {}

    /** Rows and columns follow the ascending order of the node ids. */
    public static int[][] toMatrix(OpenDigraph graph) {
        List<Integer> ids = graph.getNodeIds();
        Map<Integer, Integer> index = new HashMap<>();
        for (int i = 0; i < ids.size(); i++)
            index.put(ids.get(i), i);
        int[][] result = new int[ids.size()][ids.size()];
        for (int i = 0; i < ids.size(); i++) {
            for (Map.Entry<Integer, Integer> child: graph.getChildren(ids.get(i)).entrySet())
                result[i][index.get(child.getKey())] = child.getValue();
        }
        return result;
    }

    /** A graph without inputs or outputs; node i is labeled with the decimal form of i. */
    public static OpenDigraph toGraph(int[][] matrix) {
        int n = matrix.length;
        for (int[] row: matrix)
            if (row.length != n)
                throw new IllegalArgumentException("Matrix is not square: " + n + " rows, a row has " + row.length + " columns");
        List<Node> nodes = new ArrayList<>(n);
        for (int i = 0; i < n; i++)
            nodes.add(new Node(i, Integer.toString(i)));
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                int count = matrix[i][j];
                if (count < 0)
                    throw new IllegalArgumentException("Negative entry " + count + " at (" + i + ", " + j + ")");
                if (count > 0) {
                    nodes.get(i).setChildMultiplicity(j, count);
                    nodes.get(j).setParentMultiplicity(i, count);
                }
            }
        }
        return new OpenDigraph(List.of(), List.of(), nodes);
    }
}
