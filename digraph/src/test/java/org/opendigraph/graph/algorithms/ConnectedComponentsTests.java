package org.opendigraph.graph.algorithms;

import org.junit.Assert;
import org.junit.Test;
import org.opendigraph.graph.OpenDigraph;

import java.util.List;
import java.util.Map;

public class ConnectedComponentsTests {
    @Test
    public void components() {
        OpenDigraph graph = new OpenDigraph();
        int a = graph.addNode("a");
        graph.addNode("b", List.of(a), List.of());
        int c = graph.addNode("c");
        graph.addNode("d", List.of(c), List.of());
        graph.addInputNode(c);
        graph.addOutputNode(1);
        graph.addNode("e");

        ConnectedComponents components = graph.connectedComponents();
        Assert.assertEquals(3, components.count);
        Assert.assertEquals(List.of(0, 1, 5), components.component.get(0));
        Assert.assertEquals(List.of(2, 3, 4), components.component.get(1));
        Assert.assertEquals(List.of(6), components.component.get(2));
        Assert.assertEquals(1, components.componentId.get(4).intValue());

        List<OpenDigraph> graphs = components.graphs();
        Assert.assertEquals(3, graphs.size());
        OpenDigraph first = graphs.get(0);
        Assert.assertEquals(List.of(0, 1, 2), first.getNodeIds());
        Assert.assertEquals(List.of(), first.getInputs());
        Assert.assertEquals(List.of(2), first.getOutputs());
        Assert.assertEquals(Map.of(1, 1), first.getParents(2));
        OpenDigraph second = graphs.get(1);
        Assert.assertEquals(List.of(2), second.getInputs());
        Assert.assertEquals("c", second.getLabel(0));
        Assert.assertEquals(Map.of(0, 1), second.getChildren(2));
        for (OpenDigraph g: graphs)
            Assert.assertTrue(g.isWellFormed());
        Assert.assertEquals("e", graphs.get(2).getLabel(0));
    }

    @Test
    public void undirectedReachability() {
        OpenDigraph graph = TopologicalLevelsTests.fromEdges(3, new int[][] { {0, 2}, {1, 2} });
        Assert.assertEquals(1, graph.connectedComponents().count);
        Assert.assertEquals(0, OpenDigraph.empty().connectedComponents().count);
    }
}
