package com.entity.graph.json;

import com.entity.graph.cascade.PathSegment;
import com.entity.graph.core.model.GraphStructureException;
import com.entity.graph.instruction.GraphInstruction;
import com.entity.graph.instruction.InstructionAction;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GraphJson Tests")
class GraphJsonTest {

    private static String quoted(String json) {
        return json.replace('\'', '"');
    }

    @Nested
    @DisplayName("Graph documents")
    class GraphDocumentTests {

        @Test
        @DisplayName("Parses strings, bytes and streams alike")
        void parsesAllSources() {
            String json = quoted("{'name':'Maple Court','units':[{'unitNumber':'A1'}]}");
            byte[] bytes = json.getBytes(StandardCharsets.UTF_8);

            ObjectNode fromString = GraphJson.parse(json);

            assertEquals("A1", fromString.get("units").get(0).get("unitNumber").asText());
            assertEquals(fromString, GraphJson.parse(bytes));
            assertEquals(fromString, GraphJson.parse(new ByteArrayInputStream(bytes)));
        }

        @Test
        @DisplayName("Rejects malformed JSON")
        void rejectsMalformed() {
            GraphStructureException e = assertThrows(GraphStructureException.class,
                    () -> GraphJson.parse("{\"name\": "));
            assertTrue(e.getMessage().startsWith("Malformed JSON"));
        }

        @Test
        @DisplayName("Rejects a root that is not an object")
        void rejectsNonObjectRoot() {
            assertThrows(GraphStructureException.class, () -> GraphJson.parse("[1,2]"));
            assertThrows(GraphStructureException.class, () -> GraphJson.parse("42"));
            assertThrows(GraphStructureException.class, () -> GraphJson.parse((String) null));
        }

        @Test
        @DisplayName("Writes compact and pretty output that parses back")
        void writes() {
            ObjectNode graph = GraphJson.parse(quoted("{'id':'p1','rent':1450.5}"));

            assertEquals(quoted("{'id':'p1','rent':1450.5}"), GraphJson.write(graph));
            assertTrue(GraphJson.writePretty(graph).contains("\n"));
            assertEquals(graph, GraphJson.parse(GraphJson.writePretty(graph)));
        }

        @Test
        @DisplayName("Writes to a stream without closing it")
        void writesToStream() {
            ObjectNode graph = GraphJson.parse(quoted("{'id':'p1'}"));
            ByteArrayOutputStream out = new ByteArrayOutputStream();

            GraphJson.write(graph, out);
            out.write('\n');

            assertEquals(quoted("{'id':'p1'}\n"), out.toString(StandardCharsets.UTF_8));
        }
    }

    @Nested
    @DisplayName("Instructions")
    class InstructionTests {

        @Test
        @DisplayName("Reads a bare array of instructions")
        void readsArray() {
            List<GraphInstruction> instructions = GraphJson.parseInstructions(quoted(
                    "[{'action':'upsert','path':[{'collection':'units','identifier':'B1'},{'collection':'lease'}],"
                            + "'fields':{'rentAmount':1450}}]"));

            assertEquals(1, instructions.size());
            GraphInstruction instruction = instructions.get(0);
            assertEquals(InstructionAction.UPSERT, instruction.action());
            assertEquals(List.of(PathSegment.of("units", "B1"), PathSegment.of("lease")), instruction.path());
            assertEquals(1450, instruction.fields().get("rentAmount").asInt());
        }

        @Test
        @DisplayName("Reads a wrapped instruction list and fills defaults")
        void readsWrapped() {
            List<GraphInstruction> instructions = GraphJson.parseInstructions(quoted(
                    "{'instructions':[{'action':'update'},{'action':'create','path':[]}]}"));

            assertEquals(2, instructions.size());
            assertTrue(instructions.get(0).path().isEmpty());
            assertTrue(instructions.get(0).fields().isEmpty());
        }

        @ParameterizedTest
        @CsvSource({
                "create, CREATE",
                "Update, UPDATE",
                "' UPSERT ', UPSERT"
        })
        @DisplayName("Reads actions case-insensitively")
        void caseInsensitiveActions(String raw, InstructionAction expected) {
            assertEquals(expected, InstructionAction.fromValue(raw));
        }

        @Test
        @DisplayName("Writes actions in lower case")
        void writesLowerCase() {
            GraphInstruction instruction = GraphInstruction.update(List.of(PathSegment.of("units", "A1")), null);

            String json = GraphJson.write(GraphJson.mapper().valueToTree(instruction));

            assertTrue(json.contains(quoted("'action':'update'")));
            assertTrue(json.contains(quoted("'collection':'units'")));
        }

        @Test
        @DisplayName("Reports the index of an unreadable instruction")
        void reportsBadInstruction() {
            GraphStructureException e = assertThrows(GraphStructureException.class,
                    () -> GraphJson.parseInstructions(quoted("[{'action':'upsert'},{'action':'delete'}]")));

            assertEquals("instructions[1]", e.getPath());
        }

        @Test
        @DisplayName("Rejects a document without an instruction list")
        void rejectsMissingList() {
            assertThrows(GraphStructureException.class, () -> GraphJson.parseInstructions(quoted("{'items':[]}")));
            assertThrows(GraphStructureException.class, () -> GraphJson.parseInstructions("[{"));
        }
    }
}
