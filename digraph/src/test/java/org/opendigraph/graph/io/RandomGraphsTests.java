package org.opendigraph.graph.io;

import org.junit.Assert;
import org.junit.Test;
import org.opendigraph.graph.OpenDigraph;

import java.util.HashSet;
import java.util.List;
import java.util.Random;

public class RandomGraphsTests {
    @Test
    public void lists() {
        Random random = new Random(1);
        List<Integer> values = RandomGraphs.randomIntList(random, 10, 3, false);
        Assert.assertEquals(10, values.size());
        for (int value: values)
            Assert.assertTrue(value >= 0 && value <= 3);
        List<Integer> unique = RandomGraphs.randomIntList(random, 6, 5, true);
        Assert.assertEquals(6, new HashSet<>(unique).size());
        Assert.assertThrows(IllegalArgumentException.class,
                () -> RandomGraphs.randomIntList(random, 7, 5, true));
    }

    @Test
    public void reproducible() {
        int[][] first = RandomGraphs.randomIntMatrix(new Random(7), 6, 3, GraphForm.FREE);
        int[][] second = RandomGraphs.randomIntMatrix(new Random(7), 6, 3, GraphForm.FREE);
        Assert.assertArrayEquals(first, second);
    }

    @Test
    public void forms() {
        Random random = new Random(3);
        for (int iteration = 0; iteration < 20; iteration++) {
            int n = 1 + random.nextInt(8);
            int[][] dag = RandomGraphs.randomIntMatrix(random, n, 2, GraphForm.DAG);
            int[][] oriented = RandomGraphs.randomIntMatrix(random, n, 2, GraphForm.ORIENTED);
            int[][] loopFree = RandomGraphs.randomIntMatrix(random, n, 2, GraphForm.LOOP_FREE);
            int[][] undirected = RandomGraphs.randomIntMatrix(random, n, 2, GraphForm.UNDIRECTED);
            int[][] simple = RandomGraphs.randomIntMatrix(random, n, 2, GraphForm.LOOP_FREE_UNDIRECTED);
            for (int i = 0; i < n; i++) {
                Assert.assertEquals(0, loopFree[i][i]);
                Assert.assertEquals(0, simple[i][i]);
                Assert.assertEquals(0, oriented[i][i]);
                for (int j = 0; j < n; j++) {
                    if (j < i)
                        Assert.assertEquals(0, dag[i][j]);
                    Assert.assertEquals(undirected[i][j], undirected[j][i]);
                    Assert.assertEquals(simple[i][j], simple[j][i]);
                    Assert.assertFalse(oriented[i][j] > 0 && oriented[j][i] > 0);
                }
            }
            Assert.assertFalse(AdjacencyMatrix.toGraph(dag).isCyclic());
        }
        Assert.assertThrows(IllegalArgumentException.class,
                () -> RandomGraphs.randomIntMatrix(random, 3, 1, true, true, false, true));
    }

    @Test
    public void randomGraphsAreWellFormed() {
        Random random = new Random(11);
        for (GraphForm form: GraphForm.values()) {
            OpenDigraph graph = RandomGraphs.random(random, 7, 2, 2, 3, form);
            Assert.assertEquals(12, graph.size());
            Assert.assertEquals(2, graph.getInputs().size());
            Assert.assertEquals(3, graph.getOutputs().size());
            Assert.assertTrue(graph.isWellFormed());
            if (form == GraphForm.DAG)
                Assert.assertFalse(graph.isCyclic());
        }
        Assert.assertThrows(IllegalArgumentException.class,
                () -> RandomGraphs.random(random, 0, 1, 1, 0, GraphForm.FREE));
    }
}
