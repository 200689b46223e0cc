package com.entity.graph.api;

import com.entity.graph.analyze.RelationshipAnalyzer;
import com.entity.graph.cascade.PlaceholderNamingPolicy;
import com.entity.graph.link.IdGenerator;
import com.entity.graph.link.UuidIdGenerator;
import com.entity.graph.merge.RecursiveMerger;
import com.entity.graph.merge.StructuralMerger;
import com.entity.graph.resolve.SuffixMatchPolicy;

/**
 * Options for graph normalization.
 * Configures field conventions, matching policy, the recursion limit and identifier generation.
 */
public class NormalizationOptions {

    private static final String DEFAULT_ID_FIELD = "id";

    private final String idField;
    private final String keyField;
    private final int maxDepth;
    private final SuffixMatchPolicy suffixMatchPolicy;
    private final String rootTypeName;
    private final boolean includeListReferences;
    private final IdGenerator idGenerator;
    private final PlaceholderNamingPolicy placeholderNaming;

    private NormalizationOptions(Builder builder) {
        this.idField = builder.idField;
        this.keyField = builder.keyField;
        this.maxDepth = builder.maxDepth;
        this.suffixMatchPolicy = builder.suffixMatchPolicy;
        this.rootTypeName = builder.rootTypeName;
        this.includeListReferences = builder.includeListReferences;
        this.idGenerator = builder.idGenerator;
        this.placeholderNaming = builder.placeholderNaming;
    }

    public String getIdField() {
        return idField;
    }

    public String getKeyField() {
        return keyField;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public SuffixMatchPolicy getSuffixMatchPolicy() {
        return suffixMatchPolicy;
    }

    public String getRootTypeName() {
        return rootTypeName;
    }

    public boolean isIncludeListReferences() {
        return includeListReferences;
    }

    public IdGenerator getIdGenerator() {
        return idGenerator;
    }

    public PlaceholderNamingPolicy getPlaceholderNaming() {
        return placeholderNaming;
    }

    /**
     * Creates default options.
     */
    public static NormalizationOptions defaults() {
        return builder().build();
    }

    /**
     * Creates strict options: an ambiguous suffix match resolves to nothing instead of a guess.
     */
    public static NormalizationOptions strict() {
        return builder()
                .suffixMatchPolicy(SuffixMatchPolicy.REJECT_AMBIGUOUS)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String idField = DEFAULT_ID_FIELD;
        private String keyField = StructuralMerger.DEFAULT_KEY_FIELD;
        private int maxDepth = RecursiveMerger.DEFAULT_MAX_DEPTH;
        private SuffixMatchPolicy suffixMatchPolicy = SuffixMatchPolicy.MOST_SPECIFIC;
        private String rootTypeName = RelationshipAnalyzer.DEFAULT_ROOT_TYPE;
        private boolean includeListReferences = false;
        private IdGenerator idGenerator = new UuidIdGenerator();
        private PlaceholderNamingPolicy placeholderNaming = PlaceholderNamingPolicy.typeAndParent();

        public Builder idField(String idField) {
            this.idField = requireText(idField, "idField");
            return this;
        }

        public Builder keyField(String keyField) {
            this.keyField = requireText(keyField, "keyField");
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            if (maxDepth <= 0) {
                throw new IllegalArgumentException("maxDepth must be positive");
            }
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder suffixMatchPolicy(SuffixMatchPolicy suffixMatchPolicy) {
            if (suffixMatchPolicy == null) {
                throw new IllegalArgumentException("suffixMatchPolicy is required");
            }
            this.suffixMatchPolicy = suffixMatchPolicy;
            return this;
        }

        public Builder rootTypeName(String rootTypeName) {
            this.rootTypeName = requireText(rootTypeName, "rootTypeName");
            return this;
        }

        public Builder includeListReferences(boolean includeListReferences) {
            this.includeListReferences = includeListReferences;
            return this;
        }

        public Builder idGenerator(IdGenerator idGenerator) {
            if (idGenerator == null) {
                throw new IllegalArgumentException("idGenerator is required");
            }
            this.idGenerator = idGenerator;
            return this;
        }

        public Builder placeholderNaming(PlaceholderNamingPolicy placeholderNaming) {
            if (placeholderNaming == null) {
                throw new IllegalArgumentException("placeholderNaming is required");
            }
            this.placeholderNaming = placeholderNaming;
            return this;
        }

        public NormalizationOptions build() {
            if (idField.endsWith("Id") || idField.endsWith("Ids")) {
                throw new IllegalArgumentException(
                        "idField must not look like a reference field: " + idField);
            }
            return new NormalizationOptions(this);
        }

        private static String requireText(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be blank");
            }
            return value;
        }
    }
}
