package org.opendigraph.graph;

import org.junit.Assert;
import org.junit.Test;

import java.util.List;
import java.util.Map;

public class NodeTests {
    @Test
    public void multiplicities() {
        Node node = new Node(3, "&");
        node.addParent(1);
        node.addParent(1);
        node.addParent(2);
        node.addChild(4);
        Assert.assertEquals(2, node.parentMultiplicity(1));
        Assert.assertEquals(1, node.parentMultiplicity(2));
        Assert.assertEquals(0, node.parentMultiplicity(7));
        Assert.assertEquals(2, node.indegree());
        Assert.assertEquals(1, node.outdegree());
        Assert.assertEquals(3, node.degree());

        node.removeParentOnce(1);
        Assert.assertEquals(1, node.parentMultiplicity(1));
        node.removeParentOnce(1);
        Assert.assertFalse(node.getParents().containsKey(1));
        node.removeParentOnce(1);
        Assert.assertEquals(List.of(2), node.getParentIds());

        node.addChild(5);
        node.addChild(5);
        node.removeChildId(5);
        Assert.assertEquals(List.of(4), node.getChildIds());
        node.setChildMultiplicity(4, 0);
        Assert.assertTrue(node.getChildren().isEmpty());
    }

    @Test
    public void copyIsDeep() {
        Node node = new Node(0, "x", Map.of(1, 2), Map.of(3, 1));
        Node copy = node.copy();
        Assert.assertEquals(node, copy);
        Assert.assertEquals(node.hashCode(), copy.hashCode());
        copy.addParent(1);
        copy.setLabel("y");
        Assert.assertNotEquals(node, copy);
        Assert.assertEquals(2, node.parentMultiplicity(1));
        Assert.assertEquals("x", node.getLabel());
    }

    @Test(expected = UnsupportedOperationException.class)
    public void viewsAreReadOnly() {
        Node node = new Node(0, "");
        node.getChildren().put(1, 1);
    }

    @Test
    public void renamed() {
        Node node = new Node(1, "~", Map.of(0, 1), Map.of(1, 1, 2, 3));
        Node renamed = node.renamed(id -> id + 10);
        Assert.assertEquals(11, renamed.getId());
        Assert.assertEquals(Map.of(10, 1), renamed.getParents());
        Assert.assertEquals(Map.of(11, 1, 12, 3), renamed.getChildren());
        Assert.assertEquals("Node(5, \"~\", {4=1}, {6=2})",
                new Node(5, "~", Map.of(4, 1), Map.of(6, 2)).toString());
    }
}
