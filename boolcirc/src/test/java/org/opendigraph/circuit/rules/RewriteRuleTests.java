package org.opendigraph.circuit.rules;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.opendigraph.graph.OpenDigraph;
import org.opendigraph.util.Linq;

import java.util.List;
import java.util.Map;

public class RewriteRuleTests {
    OpenDigraph graph;
    int x;
    int y;
    int zero;
    int one;

    @Before
    public void setUp() {
        this.graph = new OpenDigraph();
        this.x = this.graph.addNode("");
        this.y = this.graph.addNode("");
        this.zero = this.graph.addNode("0");
        this.one = this.graph.addNode("1");
    }

    int gate(String label, Integer... parents) {
        return this.graph.addNode(label, List.of(parents), List.of());
    }

    @Test
    public void order() {
        Assert.assertEquals(
                List.of("copy", "erase", "not", "and", "contradictionAnd", "or", "neutralOr", "xor", "xorFanIn"),
                Linq.map(RewriteRule.all(), RewriteRule::getName));
    }

    @Test
    public void onlyMatchingGates() {
        int and = this.gate("&", this.x, this.zero);
        Assert.assertFalse(new OrRule().apply(this.graph, and));
        Assert.assertFalse(new XorRule().apply(this.graph, and));
        Assert.assertFalse(new NotRule().apply(this.graph, and));
        Assert.assertEquals("&", this.graph.getLabel(and));
        Assert.assertEquals(2, this.graph.indegree(and));
    }

    @Test
    public void not() {
        int not = this.gate("~", this.one);
        Assert.assertTrue(new NotRule().apply(this.graph, not));
        Assert.assertEquals("0", this.graph.getLabel(not));
        Assert.assertEquals(0, this.graph.indegree(not));

        int open = this.gate("~", this.x);
        Assert.assertFalse(new NotRule().apply(this.graph, open));
    }

    @Test
    public void andAbsorbs() {
        int and = this.gate("&", this.x, this.zero, this.y);
        Assert.assertTrue(new AndRule().apply(this.graph, and));
        Assert.assertEquals("0", this.graph.getLabel(and));
        Assert.assertEquals(0, this.graph.indegree(and));
        // the operands survive, without the edge
        Assert.assertTrue(this.graph.getChildren(this.x).isEmpty());
    }

    @Test
    public void andDropsIdentityAndDuplicates() {
        int and = this.gate("&", this.x, this.one, this.x);
        Assert.assertTrue(new AndRule().apply(this.graph, and));
        Assert.assertEquals("", this.graph.getLabel(and));
        Assert.assertEquals(Map.of(this.x, 1), this.graph.getParents(and));

        int empty = this.gate("&");
        Assert.assertTrue(new AndRule().apply(this.graph, empty));
        Assert.assertEquals("1", this.graph.getLabel(empty));

        int plain = this.gate("&", this.x, this.y);
        Assert.assertFalse(new AndRule().apply(this.graph, plain));
    }

    @Test
    public void or() {
        int absorbed = this.gate("|", this.x, this.one);
        Assert.assertTrue(new OrRule().apply(this.graph, absorbed));
        Assert.assertEquals("1", this.graph.getLabel(absorbed));

        int reduced = this.gate("|", this.x, this.zero, this.y);
        Assert.assertTrue(new OrRule().apply(this.graph, reduced));
        Assert.assertEquals("|", this.graph.getLabel(reduced));
        Assert.assertEquals(Map.of(this.x, 1, this.y, 1), this.graph.getParents(reduced));
        Assert.assertFalse(new OrRule().apply(this.graph, reduced));
    }

    @Test
    public void xorFoldsConstantsAndPairs() {
        int constant = this.gate("^", this.x, this.x, this.one);
        Assert.assertTrue(new XorRule().apply(this.graph, constant));
        Assert.assertEquals("1", this.graph.getLabel(constant));
        Assert.assertEquals(0, this.graph.indegree(constant));

        int copy = this.gate("^", this.y, this.zero, this.x, this.x, this.x);
        Assert.assertTrue(new XorRule().apply(this.graph, copy));
        Assert.assertEquals("^", this.graph.getLabel(copy));
        Assert.assertEquals(Map.of(this.x, 1, this.y, 1), this.graph.getParents(copy));

        int single = this.gate("^", this.y, this.zero);
        Assert.assertTrue(new XorRule().apply(this.graph, single));
        Assert.assertEquals("", this.graph.getLabel(single));
        Assert.assertFalse(new XorRule().apply(this.graph, this.gate("^", this.x, this.y)));
    }

    @Test
    public void xorWithOddParityIsNegated() {
        int xor = this.gate("^", this.x, this.y, this.one);
        Assert.assertTrue(new XorRule().apply(this.graph, xor));
        Assert.assertEquals("~", this.graph.getLabel(xor));
        Map<Integer, Integer> parents = this.graph.getParents(xor);
        Assert.assertEquals(1, parents.size());
        int inner = parents.keySet().iterator().next();
        Assert.assertEquals("^", this.graph.getLabel(inner));
        Assert.assertEquals(Map.of(this.x, 1, this.y, 1), this.graph.getParents(inner));

        int negated = this.gate("^", this.x, this.one);
        Assert.assertTrue(new XorRule().apply(this.graph, negated));
        Assert.assertEquals("~", this.graph.getLabel(negated));
        Assert.assertEquals(Map.of(this.x, 1), this.graph.getParents(negated));
    }

    @Test
    public void xorFanIn() {
        int a = this.gate("~", this.x);
        int b = this.gate("~", this.y);
        int xor = this.gate("^", this.x, this.y, a, b);
        Assert.assertTrue(new XorFanInRule().apply(this.graph, xor));
        Map<Integer, Integer> parents = this.graph.getParents(xor);
        Assert.assertEquals(2, parents.size());
        for (int parent: parents.keySet()) {
            Assert.assertEquals("^", this.graph.getLabel(parent));
            Assert.assertEquals(2, this.graph.indegree(parent));
        }
        Assert.assertFalse(new XorFanInRule().apply(this.graph, xor));
    }

    @Test
    public void xorFanInKeepsOddOperand() {
        int xor = this.gate("^", this.x, this.y, this.zero);
        Assert.assertTrue(new XorFanInRule().apply(this.graph, xor));
        Map<Integer, Integer> parents = this.graph.getParents(xor);
        Assert.assertEquals(2, parents.size());
        Assert.assertTrue(parents.containsKey(this.zero));
    }

    @Test
    public void copy() {
        int copy = this.gate("", this.one);
        Assert.assertTrue(new CopyRule().apply(this.graph, copy));
        Assert.assertEquals("1", this.graph.getLabel(copy));
        Assert.assertEquals(0, this.graph.indegree(copy));
        Assert.assertFalse(new CopyRule().apply(this.graph, this.gate("", this.x)));
        Assert.assertFalse(new CopyRule().apply(this.graph, this.gate("", this.one, this.zero)));
    }

    @Test
    public void erase() {
        int and = this.gate("&", this.x, this.y);
        int copy = this.gate("", and);
        int not = this.gate("~", copy);
        Assert.assertTrue(new EraseRule().apply(this.graph, copy));
        Assert.assertFalse(this.graph.contains(copy));
        Assert.assertEquals(1, this.graph.multiplicity(and, not));

        int fanOut = this.gate("", and);
        this.gate("~", fanOut);
        this.gate("~", fanOut);
        Assert.assertFalse(new EraseRule().apply(this.graph, fanOut));
    }

    @Test
    public void eraseKeepsInterfaces() {
        int copy = this.gate("", this.x);
        this.gate("~", copy);
        this.graph.setOutputs(List.of(copy));
        Assert.assertFalse(new EraseRule().apply(this.graph, copy));
        Assert.assertTrue(this.graph.contains(copy));
    }

    @Test
    public void complementaryOperands() {
        int not = this.gate("~", this.x);
        int or = this.gate("|", this.x, not, this.y);
        Assert.assertFalse(new ContradictionAndRule().apply(this.graph, or));
        Assert.assertTrue(new NeutralOrRule().apply(this.graph, or));
        Assert.assertEquals("1", this.graph.getLabel(or));
        Assert.assertEquals(0, this.graph.indegree(or));

        int and = this.gate("&", not, this.x);
        Assert.assertTrue(new ContradictionAndRule().apply(this.graph, and));
        Assert.assertEquals("0", this.graph.getLabel(and));

        int unrelated = this.gate("&", not, this.y);
        Assert.assertFalse(new ContradictionAndRule().apply(this.graph, unrelated));
    }
}
