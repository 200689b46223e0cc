package com.entity.graph.cascade;

import com.entity.graph.merge.FieldHandlers;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered set of {@link CollectionSpec}s consumed by {@link EntityCascade}, plus the spec
 * describing the graph root itself.
 */
public final class CascadeSchema {
    private final CollectionSpec rootSpec;
    private final Map<String, CollectionSpec> collections;

    private CascadeSchema(Builder builder) {
        this.rootSpec = builder.rootSpec;
        this.collections = Collections.unmodifiableMap(new LinkedHashMap<>(builder.collections));
    }

    /**
     * Schema for property-management graphs:
     * property → owner, units → tenants → lease, with documents and photos on any level.
     */
    public static CascadeSchema realEstate() {
        CollectionSpec property = CollectionSpec.builder("property")
                .identifierField("name")
                .singleObject(true)
                .fieldHandler("documents", FieldHandlers.appendToList())
                .build();
        return builder()
                .root(property)
                .collection(property)
                .collection(CollectionSpec.builder("owner")
                        .identifierField("name")
                        .singleObject(true)
                        .build())
                .collection(CollectionSpec.builder("units")
                        .identifierField("unitNumber")
                        .inherits("propertyId", "property")
                        .fieldHandler("photos", FieldHandlers.appendToList())
                        .fieldHandler("documents", FieldHandlers.appendToList())
                        .build())
                .collection(CollectionSpec.builder("tenants")
                        .identifierField("name")
                        .fieldHandler("documents", FieldHandlers.appendToList())
                        .build())
                .collection(CollectionSpec.builder("lease")
                        .singleObject(true)
                        .inherits("propertyId", "property")
                        .inherits("unitId", "units")
                        .inherits("tenantId", "tenants")
                        .impliedParent("tenants")
                        .numericFields("rentAmount", "securityDeposit", "nextRentAmount")
                        .fieldHandler("documents", FieldHandlers.appendToList())
                        .build())
                .collection(CollectionSpec.builder("documents").identifierField("id").build())
                .collection(CollectionSpec.builder("photos").identifierField("id").build())
                .build();
    }

    /**
     * Spec for a collection key; unknown keys get {@link CollectionSpec#defaults(String)}.
     */
    public CollectionSpec spec(String collectionKey) {
        CollectionSpec spec = collections.get(collectionKey);
        return spec != null ? spec : CollectionSpec.defaults(collectionKey);
    }

    public boolean knows(String collectionKey) {
        return collections.containsKey(collectionKey);
    }

    /**
     * Spec of the entity the graph root represents, or null when the root is a plain container.
     */
    public CollectionSpec getRootSpec() {
        return rootSpec;
    }

    public Map<String, CollectionSpec> getCollections() {
        return collections;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private CollectionSpec rootSpec;
        private final Map<String, CollectionSpec> collections = new LinkedHashMap<>();

        public Builder root(CollectionSpec rootSpec) {
            this.rootSpec = rootSpec;
            return this;
        }

        public Builder collection(CollectionSpec spec) {
            Objects.requireNonNull(spec, "spec is required");
            collections.put(spec.getCollectionKey(), spec);
            return this;
        }

        public CascadeSchema build() {
            if (rootSpec != null && !rootSpec.hasIdentifier()) {
                throw new IllegalArgumentException("Root spec requires an identifier field");
            }
            return new CascadeSchema(this);
        }
    }
}
