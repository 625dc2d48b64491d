package org.opendigraph.graph;

import org.junit.Assert;
import org.junit.Test;
import org.opendigraph.graph.errors.ArityMismatchError;

import java.util.List;
import java.util.Map;

public class CompositionTests {
    /** input 0 -> ~ (1) -> output 2 */
    static OpenDigraph negation() {
        OpenDigraph graph = new OpenDigraph();
        int not = graph.addNode("~");
        graph.addInputNode(not);
        graph.addOutputNode(not);
        return graph;
    }

    @Test
    public void negationShape() {
        OpenDigraph graph = negation();
        Assert.assertEquals(List.of(1), graph.getInputs());
        Assert.assertEquals(List.of(2), graph.getOutputs());
        Assert.assertEquals("~", graph.getLabel(0));
    }

    @Test
    public void composeKeepsFirstOutputs() {
        OpenDigraph first = negation();
        OpenDigraph second = negation();
        OpenDigraph result = OpenDigraph.compose(first, second);
        Assert.assertEquals(first.getOutputs(), result.getOutputs());
        Assert.assertEquals(6, result.size());
        Assert.assertTrue(result.isWellFormed());
        // the first operand keeps its ids; the output of the second feeds the old input
        Assert.assertEquals(List.of(0, 1, 2), result.getNodeIds().subList(0, 3));
        Assert.assertEquals("~", result.getLabel(0));
        int feeder = result.getParents(1).keySet().iterator().next();
        Assert.assertEquals(Map.of(1, 1), result.getChildren(feeder));
        Assert.assertEquals(5, feeder);
        Assert.assertEquals(List.of(4), result.getInputs());
        Assert.assertEquals(List.of(4, 3, 5, 1, 0, 2), result.shortestPath(4, 2));
        // operands are not modified
        Assert.assertEquals(negation(), first);
        Assert.assertEquals(negation(), second);
    }

    @Test
    public void icomposeTranslation() {
        OpenDigraph graph = negation();
        Map<Integer, Integer> translation = graph.icompose(negation());
        Assert.assertEquals(Map.of(0, 3, 1, 4, 2, 5), translation);
        Assert.assertEquals(List.of(4), graph.getInputs());
        Assert.assertEquals(List.of(2), graph.getOutputs());
        Assert.assertEquals(1, graph.multiplicity(5, 1));
        Assert.assertEquals(6, graph.graphDepth());
    }

    @Test
    public void composeWithItself() {
        OpenDigraph graph = negation();
        Map<Integer, Integer> translation = graph.icompose(graph);
        Assert.assertEquals(Map.of(0, 3, 1, 4, 2, 5), translation);
        Assert.assertEquals(List.of(4), graph.getInputs());
        Assert.assertEquals(List.of(2), graph.getOutputs());
        Assert.assertEquals(List.of(4, 3, 5, 1, 0, 2), graph.shortestPath(4, 2));
        Assert.assertTrue(graph.isWellFormed());
    }

    @Test
    public void parallelWithItself() {
        OpenDigraph graph = OpenDigraph.identity(2);
        graph.iparallel(graph);
        Assert.assertEquals(4, graph.size());
        Assert.assertEquals(List.of(0, 1, 2, 3), graph.getInputs());
        Assert.assertEquals(List.of(0, 1, 2, 3), graph.getOutputs());
        Assert.assertTrue(graph.isWellFormed());

        OpenDigraph twice = negation();
        twice.iparallel(twice);
        Assert.assertEquals(OpenDigraph.parallel(negation(), negation()), twice);
    }

    @Test
    public void arityMismatch() {
        OpenDigraph pair = OpenDigraph.parallel(negation(), negation());
        ArityMismatchError error = Assert.assertThrows(ArityMismatchError.class,
                () -> OpenDigraph.compose(negation(), pair));
        Assert.assertEquals(1, error.expected);
        Assert.assertEquals(2, error.actual);
        Assert.assertEquals("Arity mismatch", error.getErrorKind());
        OpenDigraph graph = negation();
        Assert.assertThrows(ArityMismatchError.class, () -> graph.icompose(pair));
        Assert.assertEquals(negation(), graph);
    }

    @Test
    public void parallel() {
        OpenDigraph result = OpenDigraph.parallel(negation(), negation());
        Assert.assertEquals(List.of(1, 4), result.getInputs());
        Assert.assertEquals(List.of(2, 5), result.getOutputs());
        Assert.assertEquals(6, result.size());
        Assert.assertTrue(result.isWellFormed());
        Assert.assertEquals(2, result.connectedComponents().count);
        Assert.assertEquals(OpenDigraph.compose(result, result).getOutputs(), result.getOutputs());
    }

    @Test
    public void iparallelAvoidsInterfaceIds() {
        OpenDigraph graph = negation();
        OpenDigraph other = new OpenDigraph();
        other.addNode("x");
        Map<Integer, Integer> translation = graph.iparallel(other);
        Assert.assertEquals(Map.of(0, 3), translation);
        Assert.assertEquals("x", graph.getLabel(3));
    }

    @Test
    public void shiftIndices() {
        OpenDigraph graph = negation();
        graph.shiftIndices(10);
        Assert.assertEquals(List.of(10, 11, 12), graph.getNodeIds());
        Assert.assertEquals(List.of(11), graph.getInputs());
        Assert.assertEquals(List.of(12), graph.getOutputs());
        Assert.assertEquals(Map.of(11, 1), graph.getParents(10));
        Assert.assertTrue(graph.isWellFormed());
        graph.shiftIndices(-10);
        Assert.assertEquals(negation(), graph);
    }
}
