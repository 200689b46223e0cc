package com.entity.graph.api;

import com.entity.graph.analyze.RelationshipAnalyzer;
import com.entity.graph.analyze.RelationshipReport;
import com.entity.graph.cascade.CascadeResult;
import com.entity.graph.cascade.CascadeSchema;
import com.entity.graph.cascade.EntityCascade;
import com.entity.graph.cascade.PathSegment;
import com.entity.graph.compress.GraphCompressor;
import com.entity.graph.core.model.GraphWarning;
import com.entity.graph.instruction.BatchResult;
import com.entity.graph.instruction.GraphInstruction;
import com.entity.graph.instruction.InstructionBatch;
import com.entity.graph.link.IdReferenceLinker;
import com.entity.graph.link.LinkResult;
import com.entity.graph.logging.LogContext;
import com.entity.graph.merge.MergeResult;
import com.entity.graph.merge.NodeFactory;
import com.entity.graph.merge.RecursiveMerger;
import com.entity.graph.merge.StructuralMerger;
import com.entity.graph.metrics.MetricsService;
import com.entity.graph.metrics.NoOpMetricsService;
import com.entity.graph.resolve.IdentifierResolver;
import com.entity.graph.resolve.ResolvedEntity;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Main entry point for the graph normalization library.
 * Wires every component from one {@link NormalizationOptions} and exposes them behind a single API.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * GraphEngine engine = GraphEngine.builder()
 *     .schema(CascadeSchema.realEstate())
 *     .build();
 *
 * ObjectNode graph = GraphJson.parse(json);
 * engine.upsert(graph,
 *         List.of(PathSegment.of("units", "B1"), PathSegment.of("tenants", "Bob")),
 *         fields);
 *
 * // Reconcile an independently produced version of the same graph
 * MergeResult reconciled = engine.reconcile(graph, incoming);
 * </pre>
 *
 * <p>The engine holds no graph state. Each graph must be owned by one operation at a time;
 * concurrent producers should work on copies and join them with {@link #merge}.</p>
 */
public class GraphEngine {
    private static final Logger log = LoggerFactory.getLogger(GraphEngine.class);

    private final NormalizationOptions options;
    private final MetricsService metricsService;
    private final IdentifierResolver resolver;
    private final EntityCascade cascade;
    private final InstructionBatch instructionBatch;
    private final IdReferenceLinker linker;
    private final RelationshipAnalyzer analyzer;
    private final StructuralMerger structuralMerger;
    private final GraphCompressor compressor;

    private GraphEngine(Builder builder) {
        this.options = builder.options;
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();

        NodeFactory nodeFactory = builder.nodeFactory != null ? builder.nodeFactory : NodeFactory.empty();
        CascadeSchema schema = builder.schema != null ? builder.schema : CascadeSchema.realEstate();

        this.resolver = new IdentifierResolver(options.getSuffixMatchPolicy());
        RecursiveMerger recursiveMerger = new RecursiveMerger(nodeFactory, options.getMaxDepth());
        this.cascade = new EntityCascade(schema, resolver, recursiveMerger,
                options.getPlaceholderNaming(), metricsService);
        this.instructionBatch = new InstructionBatch(cascade, metricsService);
        this.linker = new IdReferenceLinker(options.getIdGenerator(), options.getIdField(), options.getMaxDepth());
        this.analyzer = new RelationshipAnalyzer(options.getIdField(), options.getRootTypeName(),
                options.isIncludeListReferences(), options.getMaxDepth());
        this.structuralMerger = new StructuralMerger(options.getKeyField(), options.getMaxDepth());
        this.compressor = new GraphCompressor(options.getIdField(), options.getMaxDepth(), metricsService);

        log.info("GraphEngine initialized with schema collections: {}", schema.getCollections().keySet());
    }

    /**
     * Finds the element of {@code collection} whose {@code keyField} matches {@code keyValue}.
     * An empty result means "not found, create it".
     */
    public Optional<ResolvedEntity> resolve(ArrayNode collection, String keyField, String keyValue) {
        return timed("resolve", () -> resolver.resolve(collection, keyField, keyValue));
    }

    /**
     * Resolves or creates every level of {@code path} in place and merges {@code fields} into the leaf.
     */
    public CascadeResult upsert(ObjectNode graph, List<PathSegment> path, ObjectNode fields) {
        CascadeResult result = timed("upsert", () -> cascade.upsert(graph, path, fields));
        recordWarnings(result.warnings());
        return result;
    }

    /**
     * Applies instructions in order to a copy of {@code graph}.
     */
    public BatchResult applyInstructions(ObjectNode graph, List<GraphInstruction> instructions) {
        BatchResult result = timed("instructions", () -> instructionBatch.apply(graph, instructions));
        recordWarnings(result.warnings());
        return result;
    }

    /**
     * Returns a linked copy of {@code graph} with ids assigned and back-references repaired.
     */
    public LinkResult link(ObjectNode graph) {
        LinkResult result = timed("link", () -> linker.link(graph));
        metricsService.recordIdsAssigned(result.idsAssigned());
        metricsService.recordReferencesRepaired(result.referencesRepaired());
        recordWarnings(result.warnings());
        return result;
    }

    public RelationshipReport analyze(ObjectNode graph) {
        return timed("analyze", () -> analyzer.analyze(graph));
    }

    /**
     * Fill-empty-only merge of {@code incoming} into a copy of {@code base}.
     */
    public MergeResult merge(ObjectNode base, ObjectNode incoming) {
        MergeResult result = timed("merge", () -> structuralMerger.merge(base, incoming));
        recordWarnings(result.warnings());
        return result;
    }

    public MergeResult merge(ObjectNode base, ObjectNode incoming, String keyField) {
        MergeResult result = timed("merge", () -> structuralMerger.merge(base, incoming, keyField));
        recordWarnings(result.warnings());
        return result;
    }

    public ObjectNode compress(ObjectNode graph) {
        return timed("compress", () -> compressor.compress(graph));
    }

    /**
     * Joins two versions of a graph: structural merge, then linking, then compression.
     * Neither input is modified.
     */
    public MergeResult reconcile(ObjectNode base, ObjectNode incoming) {
        return timed("reconcile", () -> {
            MergeResult merged = structuralMerger.merge(base, incoming);
            LinkResult linked = linker.link(merged.node());
            ObjectNode compressed = compressor.compress(linked.graph());

            List<GraphWarning> warnings = new ArrayList<>(merged.warnings());
            warnings.addAll(linked.warnings());
            metricsService.recordIdsAssigned(linked.idsAssigned());
            metricsService.recordReferencesRepaired(linked.referencesRepaired());
            recordWarnings(warnings);
            log.info("reconcile.completed idsAssigned={} referencesRepaired={} warnings={}",
                    linked.idsAssigned(), linked.referencesRepaired(), warnings.size());
            return new MergeResult(compressed, warnings);
        });
    }

    public NormalizationOptions getOptions() {
        return options;
    }

    public EntityCascade getCascade() {
        return cascade;
    }

    private <T> T timed(String operation, Supplier<T> action) {
        long start = System.nanoTime();
        boolean success = false;
        try (LogContext logCtx = LogContext.forOperation(LogContext.generateCorrelationId(), operation)) {
            T result = action.get();
            success = true;
            return result;
        } finally {
            metricsService.recordOperationDuration(operation, success, Duration.ofNanos(System.nanoTime() - start));
        }
    }

    private void recordWarnings(List<GraphWarning> warnings) {
        for (GraphWarning warning : warnings) {
            metricsService.incrementWarning(warning.kind());
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private NormalizationOptions options = NormalizationOptions.defaults();
        private CascadeSchema schema;
        private NodeFactory nodeFactory;
        private MetricsService metricsService;

        public Builder options(NormalizationOptions options) {
            this.options = options;
            return this;
        }

        /**
         * Sets the cascade schema. Defaults to {@link CascadeSchema#realEstate()} if not set.
         */
        public Builder schema(CascadeSchema schema) {
            this.schema = schema;
            return this;
        }

        /**
         * Sets the templates used to materialize nested objects during updates.
         * Defaults to {@link NodeFactory#empty()} if not set.
         */
        public Builder nodeFactory(NodeFactory nodeFactory) {
            this.nodeFactory = nodeFactory;
            return this;
        }

        /**
         * Sets a custom metrics service.
         * Defaults to {@link NoOpMetricsService} if not set.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public GraphEngine build() {
            if (options == null) {
                throw new IllegalStateException("NormalizationOptions are required");
            }
            return new GraphEngine(this);
        }
    }
}
