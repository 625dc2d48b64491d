package org.opendigraph.circuit;

import org.opendigraph.graph.OpenDigraph;
import org.opendigraph.graph.io.AdjacencyMatrix;
import org.opendigraph.graph.io.GraphForm;
import org.opendigraph.graph.io.RandomGraphs;
import org.opendigraph.util.Linq;
import org.opendigraph.util.Utilities;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

/** Builders for common circuits.  Every circuit is produced by parsing formulas.
 * Registers are little-endian: bit 0 is the least significant one.
 * Inputs are declared before parsing, so {@link BoolCircuit#bindInputs} takes
 * the values in the order documented on each builder. */
public final class CircuitBuilders {
    private CircuitBuilders() {}

    static List<String> register(String prefix, int size) {
        return Linq.map(Linq.range(0, size), i -> prefix + i);
    }

    static String group(String operator, List<String> operands) {
        if (operands.size() == 1)
            return operands.get(0);
        return "(" + String.join(" " + operator + " ", operands) + ")";
    }

    static String xor(String left, String right) {
        return "(" + left + " ^ " + right + ")";
    }

    static String and(String left, String right) {
        return "(" + left + " & " + right + ")";
    }

    static BoolCircuit build(CircuitOptions options, List<String> inputs, List<String> formulas) {
        BoolCircuit result = new BoolCircuit(options);
        result.declare(inputs.toArray(new String[0]));
        for (String formula: formulas)
            result.parse(formula);
        return result;
    }

    /** Inputs a, b.  Outputs: sum, carry. */
    public static BoolCircuit halfAdder(CircuitOptions options) {
        return build(options, List.of("a", "b"), List.of("(a ^ b)", "(a & b)"));
    }

    /** Inputs a, b, carry-in c.  Outputs: sum, carry. */
    public static BoolCircuit fullAdder(CircuitOptions options) {
        return build(options, List.of("a", "b", "c"),
                List.of("(a ^ b ^ c)", "((a & b) | (c & (a ^ b)))"));
    }

    /** Ripple-carry adder for two registers of 2^n bits.
     * Inputs: a0..a(m-1), b0..b(m-1), carry-in c.  Outputs: s0..s(m-1), carry-out. */
    public static BoolCircuit adder(CircuitOptions options, int n) {
        if (n < 0 || n > 5)
            throw new IllegalArgumentException("Adder size must be between 2^0 and 2^5 bits: " + n);
        int size = 1 << n;
        List<String> a = register("a", size);
        List<String> b = register("b", size);
        List<String> formulas = new ArrayList<>();
        String carry = "c";
        for (int i = 0; i < size; i++) {
            String propagate = xor(a.get(i), b.get(i));
            formulas.add(xor(propagate, carry));
            carry = "(" + and(a.get(i), b.get(i)) + " | " + and(carry, propagate) + ")";
        }
        formulas.add(carry);
        List<String> inputs = Utilities.concat(a, b);
        inputs.add("c");
        return build(options, inputs, formulas);
    }

    /** Carry into bit i of a carry-lookahead block, computed from the generate and
     * propagate signals of the lower bits and the carry into the block. */
    static String lookaheadCarry(List<String> generate, List<String> propagate, String carryIn, int i) {
        if (i == 0)
            return carryIn;
        List<String> terms = new ArrayList<>();
        for (int j = 0; j < i; j++) {
            List<String> factors = new ArrayList<>();
            factors.add(generate.get(j));
            for (int k = j + 1; k < i; k++)
                factors.add(propagate.get(k));
            terms.add(group("&", factors));
        }
        List<String> factors = new ArrayList<>();
        factors.add(carryIn);
        for (int k = 0; k < i; k++)
            factors.add(propagate.get(k));
        terms.add(group("&", factors));
        return group("|", terms);
    }

    /** Formulas of the sums of a 4-bit carry-lookahead block, followed by its carry-out. */
    static List<String> lookaheadBlock(List<String> a, List<String> b, String carryIn) {
        List<String> generate = Linq.zipSameLength(a, b, CircuitBuilders::and);
        List<String> propagate = Linq.zipSameLength(a, b, CircuitBuilders::xor);
        List<String> result = new ArrayList<>();
        for (int i = 0; i < a.size(); i++)
            result.add(xor(propagate.get(i), lookaheadCarry(generate, propagate, carryIn, i)));
        result.add(lookaheadCarry(generate, propagate, carryIn, a.size()));
        return result;
    }

    /** 4-bit carry-lookahead adder.
     * Inputs: a0..a3, b0..b3, carry-in c.  Outputs: s0..s3, carry-out. */
    public static BoolCircuit carryLookaheadAdder4(CircuitOptions options) {
        return carryLookaheadAdder(options, 1);
    }

    /** Carry-lookahead adder for two registers of 4n bits, made of n chained 4-bit blocks.
     * Inputs: a0..a(4n-1), b0..b(4n-1), carry-in c.  Outputs: s0..s(4n-1), carry-out. */
    public static BoolCircuit carryLookaheadAdder(CircuitOptions options, int n) {
        if (n <= 0 || n > 8)
            throw new IllegalArgumentException("Number of 4-bit blocks must be between 1 and 8: " + n);
        List<String> a = register("a", 4 * n);
        List<String> b = register("b", 4 * n);
        List<String> formulas = new ArrayList<>();
        String carry = "c";
        for (int block = 0; block < n; block++) {
            List<String> outputs = lookaheadBlock(
                    a.subList(4 * block, 4 * block + 4), b.subList(4 * block, 4 * block + 4), carry);
            formulas.addAll(outputs.subList(0, 4));
            carry = outputs.get(4);
        }
        formulas.add(carry);
        List<String> inputs = Utilities.concat(a, b);
        inputs.add("c");
        return build(options, inputs, formulas);
    }

    /** A circuit without inputs whose outputs are the bits of 'value'. */
    public static BoolCircuit register(CircuitOptions options, int value, int size) {
        if (size <= 0 || size > 31 || value < 0 || value >= (1 << size))
            throw new IllegalArgumentException("Value " + value + " does not fit in " + size + " bits");
        List<String> formulas = new ArrayList<>();
        for (int i = 0; i < size; i++)
            formulas.add(((value >> i) & 1) == 1 ? Gate.ONE.label : Gate.ZERO.label);
        return build(options, List.of(), formulas);
    }

    static final String[] DATA = { "d1", "d2", "d3", "d4" };

    /** Hamming(7,4) encoder.  Inputs: d1..d4.
     * Outputs: the codeword p1 p2 d1 p3 d2 d3 d4, where parity bit
     * p covers the positions whose index has the corresponding bit set. */
    public static BoolCircuit hammingEncoder(CircuitOptions options) {
        return build(options, List.of(DATA), List.of(
                "(d1 ^ d2 ^ d4)",
                "(d1 ^ d3 ^ d4)",
                "d1",
                "(d2 ^ d3 ^ d4)",
                "d2",
                "d3",
                "d4"));
    }

    /** Hamming(7,4) decoder correcting a single flipped bit.
     * Inputs: the codeword x1..x7.  Outputs: d1..d4. */
    public static BoolCircuit hammingDecoder(CircuitOptions options) {
        String s1 = "(x1 ^ x3 ^ x5 ^ x7)";
        String s2 = "(x2 ^ x3 ^ x6 ^ x7)";
        String s3 = "(x4 ^ x5 ^ x6 ^ x7)";
        String n1 = "(~" + s1 + ")";
        String n2 = "(~" + s2 + ")";
        String n3 = "(~" + s3 + ")";
        // data bits sit at positions 3, 5, 6 and 7; the syndrome is the position of the error
        return build(options, register("x", 8).subList(1, 8), List.of(
                xor("x3", group("&", List.of(s1, s2, n3))),
                xor("x5", group("&", List.of(s1, n2, s3))),
                xor("x6", group("&", List.of(n1, s2, s3))),
                xor("x7", group("&", List.of(s1, s2, s3)))));
    }

    static final List<Gate> UNARY = List.of(Gate.NOT, Gate.COPY);
    static final List<Gate> BINARY = List.of(Gate.AND, Gate.OR, Gate.XOR);

    static Gate pick(Random random, List<Gate> gates) {
        return gates.get(random.nextInt(gates.size()));
    }

    /** A random circuit built on a random acyclic graph with n inner nodes.
     * Inputs are named x0..x(inputs-1).  Every inner node without parents is fed
     * by one of the inputs.  Then each inner node is labeled from its degrees:
     * with a single parent it gets a random gate from 'unary', or becomes a copy
     * node if it has several children; with several parents it gets a random gate
     * from 'binary', and if it also has several children a copy node is inserted
     * between the gate and its children.  Each output is fed by a node without
     * children, distinct ones first.
     * @param unary   Gates allowed on nodes with one parent: NOT or COPY.
     * @param binary  Gates allowed on nodes with several parents: AND, OR or XOR. */
    public static BoolCircuit random(CircuitOptions options, Random random, int n, int inputs, int outputs,
                                     List<Gate> unary, List<Gate> binary) {
        if (n <= 0 || inputs <= 0 || outputs <= 0)
            throw new IllegalArgumentException("A random circuit needs at least one node, input and output; got " +
                    n + ", " + inputs + ", " + outputs);
        if (unary.isEmpty() || !UNARY.containsAll(unary))
            throw new IllegalArgumentException("Unary gates must be chosen among " + UNARY + ": " + unary);
        if (binary.isEmpty() || !BINARY.containsAll(binary))
            throw new IllegalArgumentException("Binary gates must be chosen among " + BINARY + ": " + binary);

        BoolCircuit result = new BoolCircuit(options);
        result.declare(register("x", inputs).toArray(new String[0]));
        OpenDigraph graph = result.getGraph();
        List<Integer> fanouts = new ArrayList<>();
        for (int port: graph.getInputs())
            fanouts.add(graph.getChildren(port).keySet().iterator().next());

        OpenDigraph dag = AdjacencyMatrix.toGraph(RandomGraphs.randomIntMatrix(random, n, 1, GraphForm.DAG));
        Map<Integer, Integer> translation = graph.iparallel(dag);
        List<Integer> nodes = Linq.map(dag.getNodeIds(), translation::get);
        for (int node: nodes) {
            if (graph.indegree(node) == 0)
                graph.addEdge(fanouts.get(random.nextInt(inputs)), node);
        }
        List<Integer> sinks = Linq.where(nodes, node -> graph.outdegree(node) == 0);
        for (int node: nodes) {
            boolean fanOut = graph.outdegree(node) > 1;
            if (graph.indegree(node) == 1) {
                graph.setLabel(node, fanOut ? Gate.COPY.label : pick(random, unary).label);
                continue;
            }
            graph.setLabel(node, pick(random, binary).label);
            if (fanOut) {
                List<Integer> children = new ArrayList<>(graph.getChildren(node).keySet());
                int copy = graph.addNode(Gate.COPY.label, List.of(node), List.of());
                for (int child: children) {
                    graph.removeParallelEdges(node, child);
                    graph.addEdge(copy, child);
                }
            }
        }
        for (int i = 0; i < outputs; i++)
            graph.addOutputNode(sinks.get(i < sinks.size() ? i : random.nextInt(sinks.size())));
        result.assertIsWellFormed();
        return result;
    }

    public static BoolCircuit random(CircuitOptions options, Random random, int n, int inputs, int outputs) {
        return random(options, random, n, inputs, outputs, UNARY, BINARY);
    }
}
