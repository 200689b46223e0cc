package com.entity.graph.resolve;

import com.entity.graph.json.GraphJson;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("IdentifierResolver Tests")
class IdentifierResolverTest {

    private final IdentifierResolver resolver = new IdentifierResolver();

    private static ArrayNode units(String... unitNumbers) {
        ArrayNode units = GraphJson.mapper().createArrayNode();
        for (String unitNumber : unitNumbers) {
            units.addObject().put("unitNumber", unitNumber);
        }
        return units;
    }

    @Nested
    @DisplayName("Rule precedence")
    class PrecedenceTests {

        @Test
        @DisplayName("Exact match beats an earlier case-insensitive match")
        void exactBeatsCaseInsensitive() {
            ArrayNode units = units("unit a", "Unit A");

            ResolvedEntity hit = resolver.resolve(units, "unitNumber", "Unit A").orElseThrow();

            assertEquals(MatchRule.EXACT, hit.rule());
            assertEquals(1, hit.index());
            assertTrue(hit.isExact());
        }

        @Test
        @DisplayName("Case-insensitive match keeps the stored casing")
        void caseInsensitive() {
            ArrayNode units = units("B1", "Woodbridge Unit A");

            ResolvedEntity hit = resolver.resolve(units, "unitNumber", "woodbridge unit a").orElseThrow();

            assertEquals(MatchRule.CASE_INSENSITIVE, hit.rule());
            assertEquals("Woodbridge Unit A", hit.node().get("unitNumber").asText());
        }

        @Test
        @DisplayName("Suffix match on the last token of the key")
        void suffix() {
            ArrayNode units = units("B1", "Woodbridge Unit A");

            ResolvedEntity hit = resolver.resolve(units, "unitNumber", "Unit A").orElseThrow();

            assertEquals(MatchRule.SUFFIX, hit.rule());
            assertEquals(1, hit.index());
            assertFalse(hit.isExact());
        }

        @Test
        @DisplayName("Case-insensitive rule is tried before the suffix rule")
        void caseInsensitiveBeforeSuffix() {
            ArrayNode units = units("Woodbridge Unit A", "unit a");

            ResolvedEntity hit = resolver.resolve(units, "unitNumber", "Unit A").orElseThrow();

            assertEquals(MatchRule.CASE_INSENSITIVE, hit.rule());
            assertEquals(1, hit.index());
        }
    }

    @Nested
    @DisplayName("Not found")
    class NotFoundTests {

        @ParameterizedTest
        @CsvSource(value = {
                "C3",
                "Unit Z",
                "''"
        })
        @DisplayName("Returns empty when no rule matches")
        void noMatch(String key) {
            assertTrue(resolver.resolve(units("B1", "Woodbridge Unit A"), "unitNumber", key).isEmpty());
        }

        @Test
        @DisplayName("Null and empty collections resolve to nothing")
        void emptyCollections() {
            assertTrue(resolver.resolve(null, "unitNumber", "B1").isEmpty());
            assertTrue(resolver.resolve(units(), "unitNumber", "B1").isEmpty());
        }

        @Test
        @DisplayName("Skips non-object elements and elements without the key")
        void skipsMalformedElements() {
            ArrayNode units = units("B1");
            units.insert(0, "B1");
            units.insertObject(0).put("name", "B1");

            ResolvedEntity hit = resolver.resolve(units, "unitNumber", "B1").orElseThrow();
            assertEquals(2, hit.index());
        }

        @Test
        @DisplayName("Numeric keys are compared by their text")
        void numericKeys() {
            ArrayNode documents = GraphJson.mapper().createArrayNode();
            documents.addObject().put("id", 42);

            assertTrue(resolver.resolve(documents, "id", "42").isPresent());
        }
    }

    @Nested
    @DisplayName("Ambiguous suffix matches")
    class SuffixPolicyTests {

        private final ArrayNode units = units("Woodbridge Unit A", "Unit A Annex", "Maple Unit A");

        @Test
        @DisplayName("MOST_SPECIFIC picks the shortest candidate")
        void mostSpecific() {
            ResolvedEntity hit = resolver.resolve(units, "unitNumber", "Block A").orElseThrow();
            assertEquals("Maple Unit A", hit.node().get("unitNumber").asText());
        }

        @Test
        @DisplayName("FIRST picks the first candidate in list order")
        void first() {
            IdentifierResolver first = new IdentifierResolver(SuffixMatchPolicy.FIRST);
            ResolvedEntity hit = first.resolve(units, "unitNumber", "Block A").orElseThrow();
            assertEquals(0, hit.index());
        }

        @Test
        @DisplayName("REJECT_AMBIGUOUS refuses to guess")
        void rejectAmbiguous() {
            IdentifierResolver strict = new IdentifierResolver(SuffixMatchPolicy.REJECT_AMBIGUOUS);
            assertTrue(strict.resolve(units, "unitNumber", "Block A").isEmpty());
            assertTrue(strict.resolve(units, "unitNumber", "Annex").isPresent());
        }
    }

    @Test
    @DisplayName("Should match an entity stored directly as an object in resolveSingle")
    void testResolveSingle() {
        ObjectNode property = GraphJson.parse("{\"name\": \"Maple Court\"}");

        Optional<ResolvedEntity> hit = resolver.resolveSingle(property, "name", "maple court");

        assertTrue(hit.isPresent());
        assertSame(property, hit.get().node());
        assertEquals(MatchRule.CASE_INSENSITIVE, hit.get().rule());
        assertTrue(resolver.resolveSingle(property, "name", "Oak Street").isEmpty());
        assertTrue(resolver.resolveSingle(null, "name", "Maple Court").isEmpty());
    }
}
