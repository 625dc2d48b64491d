package org.opendigraph.graph.io;

import org.junit.Assert;
import org.junit.Test;
import org.opendigraph.graph.OpenDigraph;

import java.util.List;
import java.util.Map;

public class AdjacencyMatrixTests {
    @Test
    public void toGraph() {
        int[][] matrix = {
                { 0, 2, 0 },
                { 0, 0, 1 },
                { 1, 0, 1 }
        };
        OpenDigraph graph = AdjacencyMatrix.toGraph(matrix);
        Assert.assertEquals(List.of(0, 1, 2), graph.getNodeIds());
        Assert.assertEquals("2", graph.getLabel(2));
        Assert.assertEquals(2, graph.multiplicity(0, 1));
        Assert.assertEquals(Map.of(1, 1, 2, 1), graph.getParents(2));
        Assert.assertTrue(graph.getInputs().isEmpty());
        Assert.assertTrue(graph.isWellFormed());
        Assert.assertTrue(graph.isCyclic());
        Assert.assertArrayEquals(matrix, AdjacencyMatrix.toMatrix(graph));
    }

    @Test
    public void toMatrixFollowsIdOrder() {
        OpenDigraph graph = new OpenDigraph();
        int a = graph.addNode("a");
        int b = graph.addNode("b", List.of(a), List.of());
        graph.shiftIndices(5);
        graph.addEdge(b + 5, b + 5);
        Assert.assertArrayEquals(new int[][] { { 0, 1 }, { 0, 1 } }, AdjacencyMatrix.toMatrix(graph));
    }

    @Test
    public void invalidMatrices() {
        Assert.assertThrows(IllegalArgumentException.class,
                () -> AdjacencyMatrix.toGraph(new int[][] { { 0, 1 }, { 0 } }));
        Assert.assertThrows(IllegalArgumentException.class,
                () -> AdjacencyMatrix.toGraph(new int[][] { { 0, -1 }, { 0, 0 } }));
        Assert.assertTrue(AdjacencyMatrix.toGraph(new int[0][]).isEmpty());
    }
}
