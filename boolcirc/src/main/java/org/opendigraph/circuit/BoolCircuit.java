package org.opendigraph.circuit;

import org.opendigraph.graph.OpenDigraph;
import org.opendigraph.graph.errors.ArityMismatchError;
import org.opendigraph.graph.errors.InvalidReferenceError;
import org.opendigraph.graph.errors.MalformedGraphError;
import org.opendigraph.util.IIndentStream;
import org.opendigraph.util.IndentStream;
import org.opendigraph.util.Linq;
import org.opendigraph.util.ToIndentableString;
import org.opendigraph.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** A boolean circuit: an acyclic open digraph whose labels are gates.
 *
 * <p>Inputs are unlabeled port nodes.  Formulas parsed into the circuit
 * refer to inputs by variable name; the circuit remembers which input port
 * stands for each variable.  Binding a variable turns its port into a
 * constant and removes it from the inputs; evaluation then rewrites the
 * circuit until no rule applies, which leaves the outputs labeled with
 * constants when all inputs are bound.  An evaluated output has no parent,
 * so an evaluated circuit is in general no longer a well-formed open digraph. */
public class BoolCircuit implements ToIndentableString {
    final OpenDigraph graph;
    final CircuitOptions options;
    /** Input port of each variable, in order of first use */
    final Map<String, Integer> variables;

    /** Wrap a graph, which becomes owned by the circuit.
     * @throws MalformedGraphError if the graph is not a well-formed circuit. */
    public BoolCircuit(OpenDigraph graph, CircuitOptions options) {
        this(graph, options, true);
    }

    private BoolCircuit(OpenDigraph graph, CircuitOptions options, boolean validate) {
        this.graph = graph;
        this.options = options;
        this.variables = new LinkedHashMap<>();
        if (validate)
            this.assertIsWellFormed();
    }

    public BoolCircuit(OpenDigraph graph) {
        this(graph, new CircuitOptions());
    }

    public BoolCircuit(CircuitOptions options) {
        this(new OpenDigraph(), options);
    }

    public BoolCircuit() {
        this(new CircuitOptions());
    }

    /** The underlying graph.  Changes made through it are not validated. */
    public OpenDigraph getGraph() {
        return this.graph;
    }

    public CircuitOptions getOptions() {
        return this.options;
    }

    /** Describes the first reason why this is not a well-formed circuit, or returns null. */
    @Nullable
    public String firstViolation() {
        String violation = this.graph.firstViolation();
        if (violation != null)
            return violation;
        for (int id: this.graph.getNodeIds()) {
            String label = this.graph.getLabel(id);
            Gate gate = Gate.fromLabel(label);
            if (gate == null)
                return "Node " + id + " has label " + Utilities.doubleQuote(label) + " which is not a gate";
            if (gate == Gate.COPY && !this.graph.getInputs().contains(id)) {
                int incoming = 0;
                for (int m: this.graph.getParents(id).values())
                    incoming += m;
                if (incoming != 1)
                    return "Copy node " + id + " has " + incoming + " incoming edges";
            }
        }
        if (this.graph.isCyclic())
            return "Circuit has a cycle";
        return null;
    }

    public boolean isWellFormed() {
        return this.firstViolation() == null;
    }

    public void assertIsWellFormed() {
        String violation = this.firstViolation();
        if (violation != null)
            throw new MalformedGraphError(violation);
    }

    //////////////////// Formulas

    /** Parse a formula into this circuit; the formula's value becomes a new output.
     * Variables already known to the circuit are shared with earlier formulas.
     * @throws FormulaSyntaxError if the formula is malformed; the circuit is then left as it was. */
    public ParseResult parse(String formula) {
        OpenDigraph saved = this.graph.copy();
        Map<String, Integer> savedVariables = new LinkedHashMap<>(this.variables);
        try {
            List<String> vars = new FormulaParser(this, formula).parse();
            return new ParseResult(this, vars);
        } catch (FormulaSyntaxError ex) {
            this.graph.assign(saved);
            this.variables.clear();
            this.variables.putAll(savedVariables);
            throw ex;
        }
    }

    /** A new circuit with one output for each formula, in order.
     * The variables are those of all formulas, in order of first use. */
    public static ParseResult parseParentheses(CircuitOptions options, String... formulas) {
        BoolCircuit circuit = new BoolCircuit(options);
        for (String formula: formulas)
            circuit.parse(formula);
        return new ParseResult(circuit, circuit.getVariables());
    }

    public static ParseResult parseParentheses(String... formulas) {
        return parseParentheses(new CircuitOptions(), formulas);
    }

    /** The input port standing for a variable, created on first use. */
    int variablePort(String name) {
        Integer port = this.variables.get(name);
        if (port != null)
            return port;
        int fanout = this.graph.addNode(Gate.COPY.label);
        int result = this.graph.addInputNode(fanout);
        Utilities.putNew(this.variables, name, result);
        return result;
    }

    /** Create the input ports of variables that are not known yet, in order.
     * Declaring variables before parsing fixes the order of the inputs. */
    public void declare(String... names) {
        for (String name: names) {
            if (!FormulaParser.IDENTIFIER.matcher(name).matches())
                throw new IllegalArgumentException("Invalid variable name " + Utilities.singleQuote(name));
            this.variablePort(name);
        }
    }

    /** Variable names, in order of first use. */
    public List<String> getVariables() {
        return new ArrayList<>(this.variables.keySet());
    }

    public int getVariablePort(String name) {
        Integer port = this.variables.get(name);
        if (port == null)
            throw new IllegalArgumentException("Unknown variable " + Utilities.singleQuote(name));
        return port;
    }

    //////////////////// Evaluation

    /** Turn an input port into a constant. */
    void bindPort(int port, boolean value) {
        if (!this.graph.getInputs().contains(port))
            throw new InvalidReferenceError("Node " + port + " is not an input", port);
        this.graph.setLabel(port, Gate.constant(value));
        List<Integer> inputs = new ArrayList<>(this.graph.getInputs());
        inputs.remove(Integer.valueOf(port));
        this.graph.setInputs(inputs);
    }

    /** Bind all inputs, in order.
     * @throws ArityMismatchError if the number of values differs from the number of inputs. */
    public void bindInputs(boolean... values) {
        List<Integer> inputs = List.copyOf(this.graph.getInputs());
        if (values.length != inputs.size())
            throw new ArityMismatchError("Wrong number of input values", inputs.size(), values.length);
        for (int i = 0; i < values.length; i++)
            this.bindPort(inputs.get(i), values[i]);
    }

    public void bind(String variable, boolean value) {
        this.bindPort(this.getVariablePort(variable), value);
    }

    /** Bind variables from a map. */
    public void bind(Map<String, Boolean> values) {
        values.forEach(this::bind);
    }

    /** Rewrite the circuit until no rule applies.
     * @return The number of rules that fired. */
    public int evaluate() {
        return new Evaluator(this.options).evaluate(this);
    }

    /** Labels of the outputs, in order. */
    public List<String> readOutputs() {
        return Linq.map(this.graph.getOutputs(), this.graph::getLabel);
    }

    /** Values of the outputs, in order.
     * @throws MalformedGraphError if some output is not a constant. */
    public List<Boolean> readBits() {
        List<Boolean> result = new ArrayList<>();
        for (int output: this.graph.getOutputs()) {
            String label = this.graph.getLabel(output);
            if (!Gate.isConstant(label))
                throw new MalformedGraphError("Output " + output + " has not been evaluated");
            result.add(Gate.value(label));
        }
        return Collections.unmodifiableList(result);
    }

    /** A new circuit where the outputs of 'feeder' are connected to the inputs of 'consumer'.
     * The result has the inputs and the variables of 'feeder', and the outputs of 'consumer'. */
    public static BoolCircuit compose(BoolCircuit consumer, BoolCircuit feeder) {
        OpenDigraph graph = consumer.graph.copy();
        Map<Integer, Integer> translation = graph.icompose(feeder.graph);
        BoolCircuit result = new BoolCircuit(graph, consumer.options);
        feeder.variables.forEach((name, port) -> result.variables.put(name, translation.get(port)));
        return result;
    }

    public BoolCircuit copy() {
        BoolCircuit result = new BoolCircuit(this.graph.copy(), this.options, false);
        result.variables.putAll(this.variables);
        return result;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("BoolCircuit variables=")
                .append(this.variables.toString())
                .newline()
                .append(this.graph);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        this.toString(new IndentStream(builder));
        return builder.toString();
    }
}
