package org.opendigraph.graph.io;

import org.junit.Assert;
import org.junit.Test;
import org.opendigraph.graph.OpenDigraph;
import org.opendigraph.graph.errors.InvalidReferenceError;
import org.opendigraph.graph.errors.MalformedGraphError;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Random;

public class DotFormatTests {
    static OpenDigraph negation() {
        OpenDigraph graph = new OpenDigraph();
        int not = graph.addNode("~");
        graph.addInputNode(not);
        graph.addOutputNode(not);
        return graph;
    }

    @Test
    public void write() {
        String dot = DotFormat.toDot(negation());
        Assert.assertEquals("""
                digraph G {
                    // inputs 1
                    // outputs 2
                    v0 [label="~"];
                    v1 [label=""];
                    v2 [label=""];
                    v0 -> v2 [label="1"];
                    v1 -> v0 [label="1"];
                }
                """, dot);
        String verbose = DotFormat.toDot(negation(), true);
        Assert.assertTrue(verbose.contains("v0 [label=\"~ (id: 0)\"];"));
    }

    @Test
    public void read() {
        Assert.assertEquals(negation(), DotFormat.fromDot(DotFormat.toDot(negation())));

        OpenDigraph graph = DotFormat.fromDot("""
                digraph G {
                    v3 [label="a\\"b"];
                    v7 [label="&"];
                    // not an interface line
                    v3 -> v7 [label="2"];
                    v3 -> v7 [label="1"];
                }
                """);
        Assert.assertEquals(List.of(3, 7), graph.getNodeIds());
        Assert.assertEquals("a\"b", graph.getLabel(3));
        Assert.assertEquals(3, graph.multiplicity(3, 7));
        Assert.assertTrue(graph.getInputs().isEmpty());
        Assert.assertEquals(graph, DotFormat.fromDot(DotFormat.toDot(graph)));
    }

    @Test
    public void randomGraphs() {
        Random random = new Random(5);
        for (int i = 0; i < 10; i++) {
            OpenDigraph graph = RandomGraphs.random(random, 6, 3, 2, 2, GraphForm.FREE);
            Assert.assertEquals(graph, DotFormat.fromDot(DotFormat.toDot(graph)));
        }
    }

    @Test
    public void errors() {
        Assert.assertThrows(InvalidReferenceError.class, () -> DotFormat.fromDot("""
                digraph G {
                    v0 [label=""];
                    v0 -> v9 [label="1"];
                }
                """));
        MalformedGraphError error = Assert.assertThrows(MalformedGraphError.class,
                () -> DotFormat.fromDot("digraph G {\n    v0 -> \n}"));
        Assert.assertTrue(error.getMessage().startsWith("Line 2:"));
        Assert.assertThrows(MalformedGraphError.class, () -> DotFormat.fromDot("""
                v0 [label="x"];
                v0 [label="y"];
                """));
        Assert.assertThrows(MalformedGraphError.class, () -> DotFormat.fromDot("// inputs 1 x"));
        Assert.assertThrows(InvalidReferenceError.class, () -> DotFormat.fromDot("// outputs 4"));
    }

    @Test
    public void saveAndLoad() throws IOException {
        Path file = Files.createTempFile("graph", ".dot");
        try {
            DotFormat.save(negation(), file, false);
            Assert.assertEquals(negation(), DotFormat.load(file));
        } finally {
            Files.delete(file);
        }
    }

    @Test
    public void saveAndLoadUnicodeLabels() throws IOException {
        OpenDigraph graph = new OpenDigraph();
        int and = graph.addNode("∧");
        graph.addNode("café", List.of(and), List.of());
        Path file = Files.createTempFile("unicode", ".dot");
        try {
            DotFormat.save(graph, file, false);
            Assert.assertTrue(Files.readString(file, StandardCharsets.UTF_8).contains("café"));
            Assert.assertEquals(graph, DotFormat.load(file));
        } finally {
            Files.delete(file);
        }
    }
}
