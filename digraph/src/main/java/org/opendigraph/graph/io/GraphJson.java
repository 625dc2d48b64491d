package org.opendigraph.graph.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.opendigraph.graph.Node;
import org.opendigraph.graph.OpenDigraph;
import org.opendigraph.graph.errors.MalformedGraphError;
import org.opendigraph.util.Linq;
import org.opendigraph.util.Utilities;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/** JSON rendering of a graph, for diagnostics. */
public final class GraphJson {
    private GraphJson() {}

    static ObjectNode multiplicities(ObjectMapper mapper, Map<Integer, Integer> map) {
        ObjectNode result = mapper.createObjectNode();
        for (var e: map.entrySet())
            result.put(Integer.toString(e.getKey()), e.getValue());
        return result;
    }

    public static JsonNode asJson(OpenDigraph graph) {
        ObjectMapper mapper = Utilities.deterministicObjectMapper();
        ObjectNode result = mapper.createObjectNode();
        ArrayNode inputs = result.putArray("inputs");
        for (int id: graph.getInputs())
            inputs.add(id);
        ArrayNode outputs = result.putArray("outputs");
        for (int id: graph.getOutputs())
            outputs.add(id);
        ArrayNode nodes = result.putArray("nodes");
        for (Node node: graph.getNodes()) {
            ObjectNode object = nodes.addObject();
            object.put("id", node.getId());
            object.put("label", node.getLabel());
            object.set("parents", multiplicities(mapper, node.getParents()));
            object.set("children", multiplicities(mapper, node.getChildren()));
        }
        return result;
    }

    public static String toJson(OpenDigraph graph) {
        try {
            return Utilities.deterministicObjectMapper()
                    .writerWithDefaultPrettyPrinter()
                    .writeValueAsString(asJson(graph));
        } catch (JsonProcessingException ex) {
            throw new RuntimeException(ex);
        }
    }

    static List<Integer> ids(JsonNode array) {
        return Linq.map(Linq.list(array.elements()), JsonNode::asInt);
    }

    public static OpenDigraph fromJson(JsonNode json) {
        List<Node> nodes = new ArrayList<>();
        for (JsonNode object: Utilities.getProperty(json, "nodes")) {
            Node node = new Node(Utilities.getIntProperty(object, "id"),
                    Utilities.getStringProperty(object, "label"));
            Iterator<Map.Entry<String, JsonNode>> parents = Utilities.getProperty(object, "parents").fields();
            while (parents.hasNext()) {
                var e = parents.next();
                node.setParentMultiplicity(Integer.parseInt(e.getKey()), e.getValue().asInt());
            }
            Iterator<Map.Entry<String, JsonNode>> children = Utilities.getProperty(object, "children").fields();
            while (children.hasNext()) {
                var e = children.next();
                node.setChildMultiplicity(Integer.parseInt(e.getKey()), e.getValue().asInt());
            }
            nodes.add(node);
        }
        return new OpenDigraph(ids(Utilities.getProperty(json, "inputs")),
                ids(Utilities.getProperty(json, "outputs")), nodes);
    }

    public static OpenDigraph fromJson(String json) {
        try {
            return fromJson(Utilities.deterministicObjectMapper().readTree(json));
        } catch (JsonProcessingException ex) {
            throw new MalformedGraphError("Invalid JSON: " + ex.getMessage());
        }
    }
}
