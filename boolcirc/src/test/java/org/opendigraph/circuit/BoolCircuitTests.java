package org.opendigraph.circuit;

import org.junit.Assert;
import org.junit.Test;
import org.opendigraph.graph.OpenDigraph;
import org.opendigraph.graph.errors.ArityMismatchError;
import org.opendigraph.graph.errors.InvalidReferenceError;
import org.opendigraph.graph.errors.MalformedGraphError;

import java.util.List;

public class BoolCircuitTests {
    @Test
    public void constantsFlowToOutputs() {
        OpenDigraph graph = new OpenDigraph();
        int a = graph.addNode("1");
        int b = graph.addNode("0");
        int c = graph.addNode("&", List.of(a, b), List.of());
        graph.addOutputNode(c);
        BoolCircuit circuit = new BoolCircuit(graph);
        Assert.assertSame(graph, circuit.getGraph());
        circuit.evaluate();
        Assert.assertEquals("0", graph.getLabel(c));
        Assert.assertEquals(List.of("0"), circuit.readOutputs());
        Assert.assertEquals(List.of(false), circuit.readBits());
    }

    @Test
    public void validation() {
        OpenDigraph graph = new OpenDigraph();
        graph.addNode("x");
        MalformedGraphError error = Assert.assertThrows(MalformedGraphError.class, () -> new BoolCircuit(graph));
        Assert.assertEquals("Node 0 has label \"x\" which is not a gate", error.getMessage());

        OpenDigraph merge = new OpenDigraph();
        int one = merge.addNode("1");
        int zero = merge.addNode("0");
        merge.addNode("", List.of(one, zero), List.of());
        error = Assert.assertThrows(MalformedGraphError.class, () -> new BoolCircuit(merge));
        Assert.assertEquals("Copy node 2 has 2 incoming edges", error.getMessage());

        OpenDigraph cycle = new OpenDigraph();
        int first = cycle.addNode("~");
        cycle.addNode("~", List.of(first), List.of(first));
        Assert.assertTrue(cycle.isWellFormed());
        error = Assert.assertThrows(MalformedGraphError.class, () -> new BoolCircuit(cycle));
        Assert.assertEquals("Circuit has a cycle", error.getMessage());

        OpenDigraph ports = new OpenDigraph();
        int and = ports.addNode("&");
        ports.addInputNode(and);
        ports.addInputNode(and);
        ports.addOutputNode(and);
        Assert.assertTrue(new BoolCircuit(ports).isWellFormed());
    }

    @Test
    public void binding() {
        BoolCircuit circuit = new BoolCircuit();
        circuit.declare("p", "q");
        circuit.parse("(q & p)");
        Assert.assertEquals(List.of("p", "q"), circuit.getVariables());
        ArityMismatchError arity = Assert.assertThrows(ArityMismatchError.class, () -> circuit.bindInputs(true));
        Assert.assertEquals(2, arity.expected);
        Assert.assertEquals(1, arity.actual);
        Assert.assertThrows(IllegalArgumentException.class, () -> circuit.bind("r", true));
        Assert.assertThrows(IllegalArgumentException.class, () -> circuit.declare("1x"));
        Assert.assertThrows(MalformedGraphError.class, circuit::readBits);

        circuit.bind("p", true);
        Assert.assertEquals(List.of(circuit.getVariablePort("q")), circuit.getGraph().getInputs());
        Assert.assertThrows(InvalidReferenceError.class, () -> circuit.bind("p", false));
        circuit.evaluate();
        // q is still unknown
        Assert.assertEquals(List.of(""), circuit.readOutputs());
        circuit.bindInputs(false);
        circuit.evaluate();
        Assert.assertEquals(List.of(false), circuit.readBits());
    }

    @Test
    public void failedParseLeavesCircuitUnchanged() {
        BoolCircuit circuit = new BoolCircuit();
        circuit.parse("(a & b)");
        OpenDigraph before = circuit.getGraph().copy();
        Assert.assertThrows(FormulaSyntaxError.class, () -> circuit.parse("(a c)"));
        Assert.assertThrows(FormulaSyntaxError.class, () -> circuit.parse("((b | d)"));
        Assert.assertEquals(before, circuit.getGraph());
        Assert.assertEquals(List.of("a", "b"), circuit.getVariables());
        Assert.assertTrue(circuit.isWellFormed());
        circuit.bindInputs(true, true);
        circuit.evaluate();
        Assert.assertEquals(List.of(true), circuit.readBits());
    }

    @Test
    public void copy() {
        BoolCircuit circuit = BoolCircuit.parseParentheses("(a | b)").circuit();
        BoolCircuit copy = circuit.copy();
        copy.bindInputs(false, true);
        copy.evaluate();
        Assert.assertEquals(List.of(true), copy.readBits());
        Assert.assertEquals(2, circuit.getGraph().getInputs().size());
        Assert.assertEquals(List.of(""), circuit.readOutputs());
        // evaluated circuits can be copied too
        Assert.assertEquals(List.of(true), copy.copy().readBits());
        Assert.assertEquals(circuit.getVariables(), copy.getVariables());
    }

    @Test
    public void compose() {
        BoolCircuit negate = BoolCircuit.parseParentheses("(~x)").circuit();
        BoolCircuit conjunction = BoolCircuit.parseParentheses("(a & b)").circuit();
        for (boolean a: new boolean[] { false, true }) {
            for (boolean b: new boolean[] { false, true }) {
                BoolCircuit nand = BoolCircuit.compose(negate, conjunction);
                Assert.assertEquals(List.of("a", "b"), nand.getVariables());
                Assert.assertTrue(nand.isWellFormed());
                nand.bind("a", a);
                nand.bind("b", b);
                nand.evaluate();
                Assert.assertEquals(List.of(!(a & b)), nand.readBits());
            }
        }
        Assert.assertThrows(ArityMismatchError.class, () -> BoolCircuit.compose(conjunction, negate));
    }

    @Test
    public void print() {
        BoolCircuit circuit = BoolCircuit.parseParentheses("a").circuit();
        String text = circuit.toString();
        Assert.assertTrue(text.startsWith("BoolCircuit variables={a=2}\nOpenDigraph inputs=[2] outputs=[3] {"));
    }
}
