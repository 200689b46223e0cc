package com.entity.graph.api;

import com.entity.graph.cascade.PlaceholderNamingPolicy;
import com.entity.graph.link.UuidIdGenerator;
import com.entity.graph.resolve.SuffixMatchPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class NormalizationOptionsTest {

    @Test
    @DisplayName("Should create default options")
    void testDefaultOptions() {
        NormalizationOptions options = NormalizationOptions.defaults();

        assertEquals("id", options.getIdField());
        assertEquals("id", options.getKeyField());
        assertEquals(64, options.getMaxDepth());
        assertEquals(SuffixMatchPolicy.MOST_SPECIFIC, options.getSuffixMatchPolicy());
        assertEquals("root", options.getRootTypeName());
        assertFalse(options.isIncludeListReferences());
        assertInstanceOf(UuidIdGenerator.class, options.getIdGenerator());
        assertNotNull(options.getPlaceholderNaming());
    }

    @Test
    @DisplayName("Should create strict options")
    void testStrict() {
        NormalizationOptions options = NormalizationOptions.strict();

        assertEquals(SuffixMatchPolicy.REJECT_AMBIGUOUS, options.getSuffixMatchPolicy());
    }

    @Test
    @DisplayName("Should allow custom settings")
    void testCustomSettings() {
        PlaceholderNamingPolicy naming = (collection, lineage) -> "TBD";
        NormalizationOptions options = NormalizationOptions.builder()
                .idField("key")
                .keyField("unitNumber")
                .maxDepth(8)
                .rootTypeName("property")
                .includeListReferences(true)
                .idGenerator(() -> "fixed")
                .placeholderNaming(naming)
                .build();

        assertEquals("key", options.getIdField());
        assertEquals("unitNumber", options.getKeyField());
        assertEquals(8, options.getMaxDepth());
        assertEquals("property", options.getRootTypeName());
        assertTrue(options.isIncludeListReferences());
        assertEquals("fixed", options.getIdGenerator().nextId());
        assertSame(naming, options.getPlaceholderNaming());
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1})
    @DisplayName("Should reject a non-positive depth limit")
    void testInvalidDepth(int maxDepth) {
        assertThrows(IllegalArgumentException.class, () ->
                NormalizationOptions.builder().maxDepth(maxDepth));
    }

    @Test
    @DisplayName("Should reject blank or missing settings")
    void testBlankSettings() {
        assertThrows(IllegalArgumentException.class, () -> NormalizationOptions.builder().idField(" "));
        assertThrows(IllegalArgumentException.class, () -> NormalizationOptions.builder().keyField(null));
        assertThrows(IllegalArgumentException.class, () -> NormalizationOptions.builder().rootTypeName(""));
        assertThrows(IllegalArgumentException.class, () -> NormalizationOptions.builder().suffixMatchPolicy(null));
        assertThrows(IllegalArgumentException.class, () -> NormalizationOptions.builder().idGenerator(null));
        assertThrows(IllegalArgumentException.class, () -> NormalizationOptions.builder().placeholderNaming(null));
    }

    @ParameterizedTest
    @ValueSource(strings = {"entityId", "entityIds"})
    @DisplayName("Should reject an id field that looks like a reference")
    void testReferenceLikeIdField(String idField) {
        assertThrows(IllegalArgumentException.class, () ->
                NormalizationOptions.builder().idField(idField).build());
    }
}
