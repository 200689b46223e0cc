package com.entity.graph.json;

import com.entity.graph.core.model.GraphStructureException;
import com.entity.graph.instruction.GraphInstruction;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON interchange for graphs and instruction batches. The engine itself never reads or writes
 * files; callers use these helpers at the persistence boundary.
 */
public final class GraphJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private GraphJson() {
        // utility class
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Parses a JSON document whose root must be an object.
     *
     * @throws GraphStructureException on malformed JSON or a non-object root
     */
    public static ObjectNode parse(String json) {
        if (json == null) {
            throw new GraphStructureException("JSON document is null");
        }
        try {
            return requireObject(MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            throw malformed(e);
        }
    }

    public static ObjectNode parse(byte[] json) {
        if (json == null) {
            throw new GraphStructureException("JSON document is null");
        }
        try {
            return requireObject(MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            throw malformed(e);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static ObjectNode parse(InputStream input) {
        if (input == null) {
            throw new GraphStructureException("JSON input stream is null");
        }
        try {
            return requireObject(MAPPER.readTree(input));
        } catch (JsonProcessingException e) {
            throw malformed(e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read JSON document", e);
        }
    }

    public static String write(JsonNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new GraphStructureException("Failed to serialize graph: " + e.getOriginalMessage(), e);
        }
    }

    public static String writePretty(JsonNode node) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new GraphStructureException("Failed to serialize graph: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Writes the graph as UTF-8 JSON. The stream is left open.
     */
    public static void write(JsonNode node, OutputStream output) {
        try {
            MAPPER.writer()
                    .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
                    .writeValue(output, node);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write JSON document", e);
        }
    }

    /**
     * Parses instructions from either a JSON array or an object holding an {@code instructions} array.
     *
     * @throws GraphStructureException on malformed JSON or an instruction that cannot be read
     */
    public static List<GraphInstruction> parseInstructions(String json) {
        if (json == null) {
            throw new GraphStructureException("JSON document is null");
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw malformed(e);
        }

        JsonNode list = root.isObject() ? root.get("instructions") : root;
        if (list == null || !list.isArray()) {
            throw GraphStructureException.unexpectedType("instructions", "array", root.getNodeType().toString());
        }

        List<GraphInstruction> instructions = new ArrayList<>();
        for (int i = 0; i < list.size(); i++) {
            try {
                instructions.add(MAPPER.treeToValue(list.get(i), GraphInstruction.class));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                throw new GraphStructureException("Invalid instruction at index " + i + ": " + e.getMessage(),
                        "instructions[" + i + "]");
            }
        }
        return instructions;
    }

    private static ObjectNode requireObject(JsonNode root) {
        if (root instanceof ObjectNode object) {
            return object;
        }
        throw GraphStructureException.unexpectedType("", "object", root == null ? "nothing" : root.getNodeType().toString());
    }

    private static GraphStructureException malformed(JsonProcessingException e) {
        return new GraphStructureException("Malformed JSON: " + e.getOriginalMessage(), e);
    }
}
