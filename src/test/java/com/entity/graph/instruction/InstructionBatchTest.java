package com.entity.graph.instruction;

import com.entity.graph.cascade.CascadeResult;
import com.entity.graph.cascade.CascadeSchema;
import com.entity.graph.cascade.EntityCascade;
import com.entity.graph.cascade.PathSegment;
import com.entity.graph.core.model.GraphStructureException;
import com.entity.graph.json.GraphJson;
import com.entity.graph.metrics.MetricsService;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("InstructionBatch Tests")
class InstructionBatchTest {

    private static ObjectNode json(String json) {
        return GraphJson.parse(json.replace('\'', '"'));
    }

    private static ObjectNode mapleCourt() {
        return json("{'name':'Maple Court','units':[{'unitNumber':'A1'}]}");
    }

    @Nested
    @DisplayName("Against the real-estate schema")
    class RealEstateTests {

        private final InstructionBatch batch = new InstructionBatch(new EntityCascade(CascadeSchema.realEstate()));

        @Test
        @DisplayName("Applies instructions in order on a copy")
        void appliesInOrder() {
            ObjectNode graph = mapleCourt();
            ObjectNode before = graph.deepCopy();

            BatchResult result = batch.apply(graph, List.of(
                    GraphInstruction.upsert(List.of(PathSegment.of("units", "B1")), json("{'bedrooms':2}")),
                    GraphInstruction.update(List.of(PathSegment.of("units", "B1")), json("{'bedrooms':3}")),
                    GraphInstruction.create(List.of(PathSegment.of("units", "B1"), PathSegment.of("tenants", "Bob")),
                            json("{'phone':'555'}"))));

            assertTrue(result.isSuccess());
            assertEquals(3, result.succeeded());
            assertEquals(before, graph);
            ObjectNode b1 = (ObjectNode) result.graph().get("units").get(1);
            assertEquals(3, b1.get("bedrooms").asInt());
            assertEquals("Bob", b1.get("tenants").get(0).get("name").asText());
        }

        @Test
        @DisplayName("A failed instruction does not undo earlier ones")
        void failureKeepsEarlierSiblings() {
            BatchResult result = batch.apply(mapleCourt(), List.of(
                    GraphInstruction.upsert(List.of(PathSegment.of("units", "B1")), json("{'floor':1}")),
                    GraphInstruction.update(List.of(PathSegment.of("units", "Z9")), json("{'floor':2}")),
                    GraphInstruction.upsert(List.of(PathSegment.of("units", "A1")), json("{'floor':3}"))));

            assertFalse(result.isSuccess());
            assertEquals(1, result.failed());
            assertEquals(List.of(true, false, true),
                    result.outcomes().stream().map(InstructionOutcome::success).toList());
            assertEquals(2, result.graph().get("units").size());
            assertTrue(result.errors().get(0).startsWith("#1: "));
        }

        @Test
        @DisplayName("Structural errors fail only their instruction")
        void structuralErrorIsolated() {
            ObjectNode graph = json("{'name':'Maple Court','units':'none','owner':{}}");

            BatchResult result = batch.apply(graph, List.of(
                    GraphInstruction.upsert(List.of(PathSegment.of("units", "B1")), json("{}")),
                    GraphInstruction.upsert(List.of(PathSegment.of("owner", "Alice")), json("{'phone':'1'}"))));

            assertEquals(1, result.failed());
            assertEquals("Alice", result.graph().get("owner").get("name").asText());
        }

        @Test
        @DisplayName("Collects warnings from successful instructions")
        void collectsWarnings() {
            BatchResult result = batch.apply(mapleCourt(), List.of(
                    GraphInstruction.upsert(List.of(PathSegment.of("units", "A1"), PathSegment.of("lease")),
                            json("{'rentAmount':'tbd'}"))));

            assertTrue(result.isSuccess());
            assertEquals(2, result.warnings().size());
        }
    }

    @Nested
    @ExtendWith(MockitoExtension.class)
    @DisplayName("Collaborators")
    class CollaboratorTests {

        @Mock
        private EntityCascade cascade;

        @Mock
        private MetricsService metricsService;

        @Test
        @DisplayName("Dispatches each action to the matching cascade operation")
        void dispatchesActions() {
            when(cascade.upsert(any(), any(), any())).thenReturn(CascadeResult.success(null, List.of(), List.of()));
            when(cascade.update(any(), any(), any())).thenReturn(CascadeResult.success(null, List.of(), List.of()));
            when(cascade.create(any(), any(), any())).thenReturn(CascadeResult.aborted(0, null, "exists"));
            InstructionBatch batch = new InstructionBatch(cascade, metricsService);
            List<PathSegment> path = List.of(PathSegment.of("units", "A1"));

            BatchResult result = batch.apply(mapleCourt(), List.of(
                    GraphInstruction.upsert(path, null),
                    GraphInstruction.update(path, null),
                    GraphInstruction.create(path, null)));

            verify(cascade).upsert(any(), eq(path), any());
            verify(cascade).update(any(), eq(path), any());
            verify(cascade).create(any(), eq(path), any());
            verify(metricsService).recordBatchSize(3);
            assertEquals(1, result.failed());
            assertEquals("exists", result.outcomes().get(2).message());
        }

        @Test
        @DisplayName("Records a GraphStructureException as a failed outcome")
        void recordsStructureFailure() {
            when(cascade.upsert(any(), any(), any())).thenThrow(new GraphStructureException("bad", "units"));
            InstructionBatch batch = new InstructionBatch(cascade, metricsService);

            BatchResult result = batch.apply(mapleCourt(), List.of(
                    GraphInstruction.upsert(List.of(PathSegment.of("units", "A1")), null)));

            assertFalse(result.outcomes().get(0).success());
            assertEquals("bad", result.outcomes().get(0).message());
        }
    }

    @Test
    @DisplayName("Should return an unchanged copy for an empty batch")
    void testEmptyBatch() {
        InstructionBatch batch = new InstructionBatch(new EntityCascade(CascadeSchema.realEstate()));
        ObjectNode graph = mapleCourt();

        BatchResult result = batch.apply(graph, null);

        assertTrue(result.isSuccess());
        assertEquals(graph, result.graph());
        assertNotSame(graph, result.graph());
    }
}
