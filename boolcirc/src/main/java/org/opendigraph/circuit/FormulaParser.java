package org.opendigraph.circuit;

import org.opendigraph.graph.OpenDigraph;
import org.opendigraph.util.IWritesLogs;
import org.opendigraph.util.Logger;
import org.opendigraph.util.Utilities;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/** Parses a fully parenthesized formula into a {@link BoolCircuit}.
 *
 * <p>The grammar is
 * <pre>
 *   formula  ::= operand (op operand)*  |  '~' operand
 *   operand  ::= variable | '0' | '1' | '(' formula ')'
 *   op       ::= '&amp;' | '|' | '^'
 * </pre>
 * All binary operators inside one pair of parentheses must be the same.
 *
 * <p>The parser keeps a cursor: the node whose operands are being read.
 * An opening parenthesis creates a new node feeding the cursor and moves
 * the cursor there; the closing parenthesis moves it back to the node that
 * the group feeds.  Each variable occurrence creates a leaf that is merged
 * into the fan-out node of the variable, so all occurrences share a single
 * input port.  When parsing ends the root node gets an output port. */
public class FormulaParser implements IWritesLogs {
    static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z][A-Za-z0-9_]*");

    final BoolCircuit circuit;
    final OpenDigraph graph;
    final String formula;
    /** Variables of this formula, in order of first use */
    final List<String> variables;
    final StringBuilder accumulator;
    int cursor;
    int depth;
    int position;

    public FormulaParser(BoolCircuit circuit, String formula) {
        this.circuit = circuit;
        this.graph = circuit.getGraph();
        this.formula = formula;
        this.variables = new ArrayList<>();
        this.accumulator = new StringBuilder();
        this.depth = 0;
        this.position = 0;
    }

    FormulaSyntaxError error(String message, int position) {
        return new FormulaSyntaxError(message, Utilities.singleQuote(this.formula), position);
    }

    /** Parse the formula and attach an output to its root.
     * @return The variables of the formula, in order of first use. */
    public List<String> parse() {
        if (this.formula.isBlank())
            throw this.error("Empty formula", 0);
        int root = this.graph.addNode(Gate.COPY.label);
        this.cursor = root;
        for (this.position = 0; this.position < this.formula.length(); this.position++) {
            char c = this.formula.charAt(this.position);
            if (c == '(') {
                this.flush();
                this.cursor = this.graph.addNode(Gate.COPY.label, List.of(), List.of(this.cursor));
                this.depth++;
            } else if (c == ')') {
                this.flush();
                if (this.depth == 0)
                    throw this.error("Unbalanced ')'", this.position);
                int group = this.cursor;
                this.cursor = this.enclosing(group);
                this.depth--;
                this.closeGroup(group);
            } else if (Character.isLetterOrDigit(c) || c == '_') {
                this.accumulator.append(c);
            } else if (Character.isWhitespace(c)) {
                this.flush();
            } else {
                Gate operator = Gate.fromOperator(c);
                if (operator == null)
                    throw this.error("Unexpected character " + Utilities.singleQuote(Character.toString(c)), this.position);
                this.flush();
                this.setOperator(operator);
            }
        }
        this.flush();
        if (this.depth != 0)
            throw this.error("Unbalanced '('", this.formula.length());
        this.checkGroup(root);
        int output = this.graph.addOutputNode(root);
        Logger.INSTANCE.belowLevel(this, 1)
                .append("Parsed ")
                .append(Utilities.singleQuote(this.formula))
                .append(" into output ")
                .append(output)
                .append(" with variables ")
                .append(this.variables.toString())
                .newline();
        return this.variables;
    }

    /** The node fed by a group. */
    int enclosing(int group) {
        Map<Integer, Integer> children = this.graph.getChildren(group);
        Utilities.enforce(children.size() == 1, "Group node " + group + " feeds " + children.size() + " nodes");
        return children.keySet().iterator().next();
    }

    int operandCount(int node) {
        int result = 0;
        for (int m: this.graph.getParents(node).values())
            result += m;
        return result;
    }

    /** Check that a group has a sensible number of operands for its operator. */
    void checkGroup(int node) {
        Gate gate = Gate.fromLabel(this.graph.getLabel(node));
        Utilities.enforce(gate != null);
        int operands = this.operandCount(node);
        switch (gate) {
            case COPY:
                if (operands == 0)
                    throw this.error("Empty group", this.position);
                if (operands > 1)
                    throw this.error("Missing operator between " + operands + " operands", this.position);
                break;
            case NOT:
                if (operands != 1)
                    throw this.error("'~' applied to " + operands + " operands", this.position);
                break;
            default:
                if (operands == 0)
                    throw this.error("Operator " + Utilities.singleQuote(gate.label) + " without operands", this.position);
                break;
        }
    }

    /** At a closing parenthesis: a group holding a single operand is replaced by the operand. */
    void closeGroup(int group) {
        this.checkGroup(group);
        if (!this.graph.getLabel(group).equals(Gate.COPY.label))
            return;
        int operand = this.graph.getParents(group).keySet().iterator().next();
        this.graph.removeNode(group);
        this.graph.addEdge(operand, this.cursor);
    }

    void setOperator(Gate operator) {
        String current = this.graph.getLabel(this.cursor);
        if (current.equals(Gate.COPY.label)) {
            this.graph.setLabel(this.cursor, operator.label);
            return;
        }
        if (current.equals(operator.label) && operator != Gate.NOT)
            return;
        throw this.error("Operator " + Utilities.singleQuote(operator.label) +
                " cannot be mixed with " + Utilities.singleQuote(current) + " in one group", this.position);
    }

    /** Turn the accumulated characters into an operand of the cursor. */
    void flush() {
        if (this.accumulator.length() == 0)
            return;
        String token = this.accumulator.toString();
        this.accumulator.setLength(0);
        if (Gate.isConstant(token)) {
            this.graph.addNode(token, List.of(), List.of(this.cursor));
        } else if (IDENTIFIER.matcher(token).matches()) {
            this.variable(token);
        } else {
            throw this.error("Invalid token " + Utilities.singleQuote(token), this.position - token.length());
        }
    }

    void variable(String name) {
        int port = this.circuit.variablePort(name);
        int fanout = this.fanout(port);
        int leaf = this.graph.addNode(Gate.COPY.label, List.of(), List.of(this.cursor));
        this.graph.mergeNodes(fanout, leaf);
        if (!this.variables.contains(name))
            this.variables.add(name);
    }

    /** The copy node fed by an input port.  If rewriting removed it, a new one
     * is inserted between the port and its children. */
    int fanout(int port) {
        Map<Integer, Integer> children = this.graph.getChildren(port);
        if (children.size() == 1) {
            int child = children.keySet().iterator().next();
            if (this.graph.getLabel(child).equals(Gate.COPY.label) &&
                    !this.graph.getInputs().contains(child) &&
                    !this.graph.getOutputs().contains(child))
                return child;
        }
        int result = this.graph.addNode(Gate.COPY.label);
        for (var e: Map.copyOf(children).entrySet()) {
            this.graph.removeParallelEdges(port, e.getKey());
            for (int i = 0; i < e.getValue(); i++)
                this.graph.addEdge(result, e.getKey());
        }
        this.graph.addEdge(port, result);
        return result;
    }
}
