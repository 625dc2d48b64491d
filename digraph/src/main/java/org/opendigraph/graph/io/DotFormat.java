package org.opendigraph.graph.io;

import org.opendigraph.graph.Node;
import org.opendigraph.graph.OpenDigraph;
import org.opendigraph.graph.errors.InvalidReferenceError;
import org.opendigraph.graph.errors.MalformedGraphError;
import org.opendigraph.util.IIndentStream;
import org.opendigraph.util.IndentStream;
import org.opendigraph.util.Linq;
import org.opendigraph.util.Utilities;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Reads and writes graphs in a subset of the graphviz dot format.
 *
 * <pre>
 * digraph G {
 *     // inputs 3
 *     // outputs 4
 *     v0 [label="&amp;"];
 *     v0 -> v4 [label="1"];
 * }
 * </pre>
 * The edge label is the multiplicity of the edge.  The comment lines
 * record the interfaces, which dot itself ignores. */
public final class DotFormat {
    private DotFormat() {}

    static final Pattern NODE = Pattern.compile("v(-?\\d+)\\s*\\[label=\"((?:[^\"\\\\]|\\\\.)*)\"];");
    static final Pattern EDGE = Pattern.compile("v(-?\\d+)\\s*->\\s*v(-?\\d+)\\s*\\[label=\"(\\d+)\"];");
    static final String INPUTS = "// inputs";
    static final String OUTPUTS = "// outputs";

    public static void write(OpenDigraph graph, IIndentStream stream, boolean verbose) {
        stream.append("digraph G {")
                .increase()
                .append(INPUTS)
                .append(interfaceLine(graph.getInputs()))
                .newline()
                .append(OUTPUTS)
                .append(interfaceLine(graph.getOutputs()))
                .newline();
        for (Node node: graph.getNodes()) {
            String label = node.getLabel();
            if (verbose)
                label = label + " (id: " + node.getId() + ")";
            stream.append("v")
                    .append(node.getId())
                    .append(" [label=")
                    .append(Utilities.doubleQuote(label))
                    .append("];")
                    .newline();
        }
        for (Node node: graph.getNodes()) {
            for (Map.Entry<Integer, Integer> child: node.getChildren().entrySet()) {
                stream.append("v")
                        .append(node.getId())
                        .append(" -> v")
                        .append((int) child.getKey())
                        .append(" [label=\"")
                        .append((int) child.getValue())
                        .append("\"];")
                        .newline();
            }
        }
        stream.decrease().append("}").newline();
    }

    static String interfaceLine(List<Integer> ids) {
        StringBuilder builder = new StringBuilder();
        for (int id: ids)
            builder.append(" ").append(id);
        return builder.toString();
    }

    public static String toDot(OpenDigraph graph, boolean verbose) {
        StringBuilder builder = new StringBuilder();
        write(graph, new IndentStream(builder), verbose);
        return builder.toString();
    }

    public static String toDot(OpenDigraph graph) {
        return toDot(graph, false);
    }

    public static void save(OpenDigraph graph, Path path, boolean verbose) throws IOException {
        Utilities.writeFile(path, toDot(graph, verbose));
    }

    static List<Integer> parseInterface(String rest, int lineNo) {
        List<Integer> result = new ArrayList<>();
        for (String part: rest.trim().split("\\s+")) {
            if (part.isEmpty())
                continue;
            try {
                result.add(Integer.parseInt(part));
            } catch (NumberFormatException ex) {
                throw new MalformedGraphError("Line " + lineNo + ": invalid node id " + Utilities.singleQuote(part));
            }
        }
        return result;
    }

    /** Parse the text produced by {@link #toDot(OpenDigraph)}.
     * Labels written in verbose mode keep their id suffix. */
    public static OpenDigraph fromDot(String text) {
        Map<Integer, Node> nodes = new LinkedHashMap<>();
        List<Integer> inputs = new ArrayList<>();
        List<Integer> outputs = new ArrayList<>();
        List<int[]> edges = new ArrayList<>();
        String[] lines = text.split("\\R");
        for (int i = 0; i < lines.length; i++) {
            int lineNo = i + 1;
            String line = lines[i].trim();
            if (line.isEmpty() || line.equals("}") || line.startsWith("digraph"))
                continue;
            if (line.startsWith(INPUTS)) {
                inputs.addAll(parseInterface(line.substring(INPUTS.length()), lineNo));
                continue;
            }
            if (line.startsWith(OUTPUTS)) {
                outputs.addAll(parseInterface(line.substring(OUTPUTS.length()), lineNo));
                continue;
            }
            if (line.startsWith("//"))
                continue;
            Matcher edge = EDGE.matcher(line);
            if (edge.matches()) {
                edges.add(new int[] {
                        Integer.parseInt(edge.group(1)),
                        Integer.parseInt(edge.group(2)),
                        Integer.parseInt(edge.group(3)) });
                continue;
            }
            Matcher node = NODE.matcher(line);
            if (node.matches()) {
                int id = Integer.parseInt(node.group(1));
                if (nodes.containsKey(id))
                    throw new MalformedGraphError("Line " + lineNo + ": node " + id + " declared twice");
                nodes.put(id, new Node(id, Utilities.unescape(node.group(2))));
                continue;
            }
            throw new MalformedGraphError("Line " + lineNo + ": cannot parse " + Utilities.singleQuote(line));
        }
        for (int[] edge: edges) {
            Node source = nodes.get(edge[0]);
            Node target = nodes.get(edge[1]);
            if (source == null)
                throw InvalidReferenceError.missing(edge[0]);
            if (target == null)
                throw InvalidReferenceError.missing(edge[1]);
            source.setChildMultiplicity(edge[1], source.childMultiplicity(edge[1]) + edge[2]);
            target.setParentMultiplicity(edge[0], target.parentMultiplicity(edge[0]) + edge[2]);
        }
        return new OpenDigraph(inputs, outputs, Linq.list(nodes.values()));
    }

    public static OpenDigraph load(Path path) throws IOException {
        return fromDot(Utilities.readFile(path));
    }
}
