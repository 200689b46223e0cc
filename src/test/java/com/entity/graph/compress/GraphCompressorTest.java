package com.entity.graph.compress;

import com.entity.graph.core.model.GraphStructureException;
import com.entity.graph.json.GraphJson;
import com.entity.graph.metrics.MetricsService;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("GraphCompressor Tests")
class GraphCompressorTest {

    private final GraphCompressor compressor = new GraphCompressor();

    private static ObjectNode json(String json) {
        return GraphJson.parse(json.replace('\'', '"'));
    }

    @Test
    @DisplayName("Should drop empty fields next to the id")
    void testDropsEmptyFields() {
        assertEquals(json("{'id':'u1'}"), compressor.compress(json("{'id':'u1','photos':[],'description':''}")));
    }

    @Test
    @DisplayName("Should remove objects that become empty, bottom-up")
    void testCascadesEmptiness() {
        ObjectNode compressed = compressor.compress(json(
                "{'name':'Maple Court','owner':{'contactInfo':{'phone':null}},"
                        + "'units':[{'notes':''},{'unitNumber':'A1','rent':0,'pets':false}]}"));

        assertEquals(json("{'name':'Maple Court','units':[{'unitNumber':'A1','pets':false}]}"), compressed);
    }

    @ParameterizedTest
    @ValueSource(strings = {"null", "''", "'   '", "[]", "{}", "0", "0.0", "[null,'',{}]"})
    @DisplayName("Should treat the value as empty")
    void testEmptyValues(String value) {
        assertEquals(json("{'keep':true}"), compressor.compress(json("{'keep':true,'field':" + value + "}")));
    }

    @Test
    @DisplayName("Should keep the id field verbatim even when empty")
    void testKeepsIdField() {
        ObjectNode compressed = compressor.compress(json("{'id':'','units':[{'id':null,'name':'x'}]}"));

        assertTrue(compressed.has("id"));
        assertTrue(compressed.get("units").get(0).get("id").isNull());
    }

    @Test
    @DisplayName("Should give the same graph when compressing twice")
    void testFixedPoint() {
        ObjectNode once = compressor.compress(json(
                "{'a':{'b':[{'c':[]},1,'',{'d':{'e':0}}]},'f':'x'}"));

        assertEquals(json("{'a':{'b':[1]},'f':'x'}"), once);
        assertEquals(once, compressor.compress(once));
    }

    @Test
    @DisplayName("Should not modify the input graph")
    void testInputUntouched() {
        ObjectNode graph = json("{'a':'','b':{'c':[]}}");
        ObjectNode before = graph.deepCopy();

        compressor.compress(graph);

        assertEquals(before, graph);
    }

    @Test
    @DisplayName("Should record how many values were removed")
    void testRecordsRemovals() {
        MetricsService metrics = mock(MetricsService.class);
        GraphCompressor counting = new GraphCompressor("id", 64, metrics);

        counting.compress(json("{'a':'','b':{'c':[]},'d':[0,1]}"));
        counting.compress(json("{'a':1}"));

        // c, b, a and the zero in d
        verify(metrics).recordElementsRemoved(4);
        verifyNoMoreInteractions(metrics);
    }

    @Test
    @DisplayName("Should stop at the depth limit")
    void testDepthLimit() {
        GraphCompressor shallow = new GraphCompressor("id", 2, null);

        GraphStructureException e = assertThrows(GraphStructureException.class,
                () -> shallow.compress(json("{'a':{'b':{'c':{}}}}")));
        assertEquals("a.b.c", e.getPath());
    }
}
