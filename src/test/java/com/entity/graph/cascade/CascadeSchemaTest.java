package com.entity.graph.cascade;

import com.entity.graph.merge.FieldHandlers;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CascadeSchema Tests")
class CascadeSchemaTest {

    private final CascadeSchema schema = CascadeSchema.realEstate();

    @Test
    @DisplayName("Should declare the property hierarchy in the real-estate schema")
    void testRealEstateHierarchy() {
        assertEquals("property", schema.getRootSpec().getCollectionKey());
        assertEquals("name", schema.getRootSpec().getIdentifierField());

        CollectionSpec units = schema.spec("units");
        assertEquals("unitNumber", units.getIdentifierField());
        assertFalse(units.isSingleObject());
        assertEquals(Map.of("propertyId", "property"), units.getInheritedKeys());
        assertTrue(units.getFieldHandlers().containsKey("photos"));

        CollectionSpec lease = schema.spec("lease");
        assertTrue(lease.isSingleObject());
        assertFalse(lease.hasIdentifier());
        assertEquals("tenants", lease.getImpliedParent());
        assertEquals(Set.of("rentAmount", "securityDeposit", "nextRentAmount"), lease.getNumericFields());
        assertEquals(Set.of("propertyId", "unitId", "tenantId"), lease.getInheritedKeys().keySet());
    }

    @Test
    @DisplayName("Should give unknown collections list defaults keyed by id")
    void testUnknownCollectionDefaults() {
        CollectionSpec parking = schema.spec("parkingSpots");

        assertFalse(schema.knows("parkingSpots"));
        assertEquals("id", parking.getIdentifierField());
        assertFalse(parking.isSingleObject());
        assertTrue(parking.getInheritedKeys().isEmpty());
    }

    @Test
    @DisplayName("Should require an identifying field for list collections")
    void testListRequiresIdentifier() {
        assertThrows(IllegalArgumentException.class, () ->
                CollectionSpec.builder("units").identifierField(null).build());
    }

    @Test
    @DisplayName("Should register custom collections through the builder")
    void testCustomSchema() {
        CascadeSchema custom = CascadeSchema.builder()
                .collection(CollectionSpec.builder("buildings")
                        .identifierField("code")
                        .fieldHandler("photos", FieldHandlers.appendToList())
                        .build())
                .build();

        assertTrue(custom.knows("buildings"));
        assertNull(custom.getRootSpec());
        assertEquals("code", custom.spec("buildings").getIdentifierField());
    }
}
