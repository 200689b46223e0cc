package com.entity.graph.cascade;

import com.entity.graph.merge.FieldHandler;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Declarative description of one collection in a {@link CascadeSchema}: where its entities
 * live, how they are identified, which foreign keys a new entity inherits from its ancestors
 * and how updates to it are applied.
 */
public final class CollectionSpec {
    private final String collectionKey;
    private final String identifierField;
    private final boolean singleObject;
    private final Map<String, String> inheritedKeys;
    private final String impliedParent;
    private final Map<String, FieldHandler> fieldHandlers;
    private final Set<String> numericFields;

    private CollectionSpec(Builder builder) {
        this.collectionKey = builder.collectionKey;
        this.identifierField = builder.identifierField;
        this.singleObject = builder.singleObject;
        this.inheritedKeys = Collections.unmodifiableMap(new LinkedHashMap<>(builder.inheritedKeys));
        this.impliedParent = builder.impliedParent;
        this.fieldHandlers = Map.copyOf(builder.fieldHandlers);
        this.numericFields = Set.copyOf(builder.numericFields);
    }

    /**
     * Spec used for collection keys the schema does not know: a list identified by {@code id}.
     */
    public static CollectionSpec defaults(String collectionKey) {
        return builder(collectionKey).identifierField("id").build();
    }

    public String getCollectionKey() {
        return collectionKey;
    }

    /**
     * Identifying field, or null for a single-object slot that is not identified (e.g. {@code lease}).
     */
    public String getIdentifierField() {
        return identifierField;
    }

    public boolean hasIdentifier() {
        return identifierField != null;
    }

    public boolean isSingleObject() {
        return singleObject;
    }

    /**
     * Foreign key field → collection key of the ancestor whose identifier it inherits.
     */
    public Map<String, String> getInheritedKeys() {
        return inheritedKeys;
    }

    /**
     * Collection that must exist between the previous path level and this one, or null.
     */
    public String getImpliedParent() {
        return impliedParent;
    }

    public Map<String, FieldHandler> getFieldHandlers() {
        return fieldHandlers;
    }

    public Set<String> getNumericFields() {
        return numericFields;
    }

    @Override
    public String toString() {
        return "CollectionSpec{" +
                "collectionKey='" + collectionKey + '\'' +
                ", identifierField='" + identifierField + '\'' +
                ", singleObject=" + singleObject +
                ", inheritedKeys=" + inheritedKeys.keySet() +
                ", impliedParent='" + impliedParent + '\'' +
                '}';
    }

    public static Builder builder(String collectionKey) {
        return new Builder(collectionKey);
    }

    public static class Builder {
        private final String collectionKey;
        private String identifierField;
        private boolean singleObject = false;
        private final Map<String, String> inheritedKeys = new LinkedHashMap<>();
        private String impliedParent;
        private final Map<String, FieldHandler> fieldHandlers = new LinkedHashMap<>();
        private Set<String> numericFields = Set.of();

        private Builder(String collectionKey) {
            this.collectionKey = Objects.requireNonNull(collectionKey, "collectionKey is required");
        }

        public Builder identifierField(String identifierField) {
            this.identifierField = identifierField;
            return this;
        }

        public Builder singleObject(boolean singleObject) {
            this.singleObject = singleObject;
            return this;
        }

        public Builder inherits(String foreignKeyField, String ancestorCollectionKey) {
            inheritedKeys.put(
                    Objects.requireNonNull(foreignKeyField, "foreignKeyField is required"),
                    Objects.requireNonNull(ancestorCollectionKey, "ancestorCollectionKey is required"));
            return this;
        }

        public Builder impliedParent(String impliedParent) {
            this.impliedParent = impliedParent;
            return this;
        }

        public Builder fieldHandler(String field, FieldHandler handler) {
            fieldHandlers.put(
                    Objects.requireNonNull(field, "field is required"),
                    Objects.requireNonNull(handler, "handler is required"));
            return this;
        }

        public Builder numericFields(String... fields) {
            this.numericFields = Set.of(fields);
            return this;
        }

        public CollectionSpec build() {
            if (!singleObject && identifierField == null) {
                throw new IllegalArgumentException(
                        "List collection '" + collectionKey + "' requires an identifier field");
            }
            return new CollectionSpec(this);
        }
    }
}
