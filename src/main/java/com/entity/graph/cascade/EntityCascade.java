package com.entity.graph.cascade;

import com.entity.graph.core.model.GraphStructureException;
import com.entity.graph.core.model.GraphWarning;
import com.entity.graph.core.model.JsonValues;
import com.entity.graph.core.model.WarningKind;
import com.entity.graph.logging.LogContext;
import com.entity.graph.merge.FieldHandler;
import com.entity.graph.merge.MergeResult;
import com.entity.graph.merge.RecursiveMerger;
import com.entity.graph.metrics.MetricsService;
import com.entity.graph.metrics.NoOpMetricsService;
import com.entity.graph.resolve.IdentifierResolver;
import com.entity.graph.resolve.ResolvedEntity;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Multi-level update-or-create over a {@link CascadeSchema}.
 *
 * <p>A path such as {@code [units[B1], tenants[Bob], lease]} is walked top-down. Each level is
 * resolved with {@link IdentifierResolver}; a missing level is created with only its identifying
 * field and the foreign keys it inherits from the levels above. The leaf is then updated with
 * {@link RecursiveMerger}.</p>
 *
 * <p>Identifiers are validated before the graph is touched, and every mutation is registered
 * with a {@link CascadeTransaction}, so an aborted or failed cascade leaves the graph as it was.</p>
 *
 * <p>Instances are stateless and can be shared, but a graph must only be mutated by one
 * operation at a time.</p>
 */
public class EntityCascade {
    private static final Logger log = LoggerFactory.getLogger(EntityCascade.class);

    private final CascadeSchema schema;
    private final IdentifierResolver resolver;
    private final RecursiveMerger merger;
    private final PlaceholderNamingPolicy placeholderNaming;
    private final MetricsService metricsService;

    public EntityCascade(CascadeSchema schema) {
        this(schema, new IdentifierResolver(), new RecursiveMerger(),
                PlaceholderNamingPolicy.typeAndParent(), new NoOpMetricsService());
    }

    public EntityCascade(CascadeSchema schema,
                         IdentifierResolver resolver,
                         RecursiveMerger merger,
                         PlaceholderNamingPolicy placeholderNaming,
                         MetricsService metricsService) {
        this.schema = Objects.requireNonNull(schema, "schema is required");
        this.resolver = Objects.requireNonNull(resolver, "resolver is required");
        this.merger = Objects.requireNonNull(merger, "merger is required");
        this.placeholderNaming = Objects.requireNonNull(placeholderNaming, "placeholderNaming is required");
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
    }

    /**
     * Resolves or creates every level of {@code path} and merges {@code fields} into the leaf.
     * An empty path updates the graph root.
     *
     * @return success with the leaf entity, or an aborted result naming the failing level
     * @throws GraphStructureException if the graph holds an unexpected value where a collection
     *                                 was expected; the graph is rolled back first
     */
    public CascadeResult upsert(ObjectNode graph, List<PathSegment> path, ObjectNode fields) {
        Objects.requireNonNull(graph, "graph is required");
        List<PathSegment> segments = path != null ? path : List.of();
        Optional<CascadeResult> invalid = validate(segments);
        if (invalid.isPresent()) {
            return invalid.get();
        }

        String description = describe(segments);
        try (LogContext logCtx = LogContext.forCascade(LogContext.generateCorrelationId(), description)) {
            log.debug("cascade.starting path={}", description);
            try (CascadeTransaction tx = new CascadeTransaction()) {
                Walk walk = new Walk(graph, tx);
                for (int i = 0; i < segments.size(); i++) {
                    walk.step(i, segments.get(i), true);
                }
                MergeResult merged = mergeLeaf(walk.current, leafSpec(segments), fields, tx, description);
                tx.markSuccess();

                List<GraphWarning> warnings = new ArrayList<>(walk.warnings);
                warnings.addAll(merged.warnings());
                log.info("cascade.completed path={} created={} warnings={}",
                        description, walk.created.size(), warnings.size());
                return CascadeResult.success(walk.current, walk.created, warnings);
            } catch (CascadeAbortException e) {
                log.warn("cascade.aborted path={} segmentIndex={} reason={}",
                        description, e.getSegmentIndex(), e.getMessage());
                return CascadeResult.aborted(e.getSegmentIndex(), e.getSegment(), e.getMessage());
            }
        }
    }

    /**
     * Updates an entity that must already exist. Never creates any level.
     */
    public CascadeResult update(ObjectNode graph, List<PathSegment> path, ObjectNode fields) {
        Objects.requireNonNull(graph, "graph is required");
        List<PathSegment> segments = path != null ? path : List.of();
        Optional<CascadeResult> invalid = validate(segments);
        if (invalid.isPresent()) {
            return invalid.get();
        }

        String description = describe(segments);
        Walk walk = new Walk(graph, null);
        for (int i = 0; i < segments.size(); i++) {
            if (!walk.step(i, segments.get(i), false)) {
                log.info("cascade.update.notFound path={} segmentIndex={}", description, i);
                return CascadeResult.aborted(i, segments.get(i), segments.get(i) + " not found");
            }
        }
        try (CascadeTransaction tx = new CascadeTransaction()) {
            MergeResult merged = mergeLeaf(walk.current, leafSpec(segments), fields, tx, description);
            tx.markSuccess();
            log.info("cascade.updated path={} warnings={}", description, merged.warnings().size());
            return CascadeResult.success(walk.current, List.of(), merged.warnings());
        }
    }

    /**
     * Creates the leaf of {@code path}, failing when it already exists. Missing ancestors
     * are created as in {@link #upsert}.
     */
    public CascadeResult create(ObjectNode graph, List<PathSegment> path, ObjectNode fields) {
        Objects.requireNonNull(graph, "graph is required");
        if (path == null || path.isEmpty()) {
            return CascadeResult.aborted(0, null, "Cannot create the graph root");
        }
        int leafIndex = path.size() - 1;
        if (locate(graph, path).isPresent()) {
            return CascadeResult.aborted(leafIndex, path.get(leafIndex), path.get(leafIndex) + " already exists");
        }
        return upsert(graph, path, fields);
    }

    /**
     * Finds the entity at the end of {@code path} without changing the graph.
     */
    public Optional<ObjectNode> locate(ObjectNode graph, List<PathSegment> path) {
        Objects.requireNonNull(graph, "graph is required");
        List<PathSegment> segments = path != null ? path : List.of();
        if (validate(segments).isPresent()) {
            return Optional.empty();
        }
        Walk walk = new Walk(graph, null);
        for (int i = 0; i < segments.size(); i++) {
            if (!walk.step(i, segments.get(i), false)) {
                return Optional.empty();
            }
        }
        return Optional.of(walk.current);
    }

    public CascadeSchema getSchema() {
        return schema;
    }

    private MergeResult mergeLeaf(ObjectNode leaf, CollectionSpec leafSpec, ObjectNode fields,
                                  CascadeTransaction tx, String description) {
        Map<String, FieldHandler> handlers = leafSpec != null ? leafSpec.getFieldHandlers() : Map.of();
        Set<String> numericFields = leafSpec != null ? leafSpec.getNumericFields() : Set.of();
        ObjectNode snapshot = leaf.deepCopy();
        MergeResult[] holder = {null};
        tx.execute("merge fields into " + description,
                () -> holder[0] = merger.merge(leaf, fields, handlers, numericFields),
                () -> {
                    leaf.removeAll();
                    leaf.setAll(snapshot);
                });
        return holder[0];
    }

    private CollectionSpec leafSpec(List<PathSegment> segments) {
        if (segments.isEmpty()) {
            return schema.getRootSpec();
        }
        return schema.spec(segments.get(segments.size() - 1).collectionKey());
    }

    private Optional<CascadeResult> validate(List<PathSegment> segments) {
        for (int i = 0; i < segments.size(); i++) {
            PathSegment segment = segments.get(i);
            if (segment == null || segment.collectionKey().isBlank()) {
                return Optional.of(CascadeResult.aborted(i, segment, "Collection key is missing at level " + i));
            }
            CollectionSpec spec = schema.spec(segment.collectionKey());
            if (spec.hasIdentifier() && (segment.identifier() == null || segment.identifier().isBlank())) {
                log.warn("cascade.invalid segmentIndex={} collection={} identifierField={}",
                        i, segment.collectionKey(), spec.getIdentifierField());
                return Optional.of(CascadeResult.aborted(i, segment,
                        "Identifying field '" + spec.getIdentifierField() + "' is empty for '"
                                + segment.collectionKey() + "'"));
            }
        }
        return Optional.empty();
    }

    private static String describe(List<PathSegment> segments) {
        if (segments.isEmpty()) {
            return "<root>";
        }
        return segments.stream().map(PathSegment::toString).collect(Collectors.joining(" > "));
    }

    /**
     * State of one walk down the graph. A null transaction means read-only.
     */
    private final class Walk {
        private final CascadeTransaction tx;
        private final Map<String, String> lineage = new LinkedHashMap<>();
        private final List<PathSegment> created = new ArrayList<>();
        private final List<GraphWarning> warnings = new ArrayList<>();
        private ObjectNode current;
        private String path = "";

        Walk(ObjectNode root, CascadeTransaction tx) {
            this.current = root;
            this.tx = tx;
            CollectionSpec rootSpec = schema.getRootSpec();
            if (rootSpec != null && JsonValues.isIdentifier(root.get(rootSpec.getIdentifierField()))) {
                lineage.put(rootSpec.getCollectionKey(),
                        JsonValues.scalarText(root.get(rootSpec.getIdentifierField())));
            }
        }

        /**
         * Moves one level down. Returns false only in read-only mode when the level is missing.
         */
        boolean step(int index, PathSegment segment, boolean create) {
            CollectionSpec spec = schema.spec(segment.collectionKey());
            String impliedParent = spec.getImpliedParent();
            if (impliedParent != null && !lineage.containsKey(impliedParent)
                    && !enterImpliedParent(index, impliedParent, create)) {
                return false;
            }

            ObjectNode next = find(spec, segment);
            if (next == null) {
                if (!create) {
                    return false;
                }
                next = createIn(spec, segment, index);
            } else if (create) {
                adoptIdentifier(spec, segment, next);
            }
            enter(spec, segment, next);
            return true;
        }

        private ObjectNode find(CollectionSpec spec, PathSegment segment) {
            String key = spec.getCollectionKey();
            JsonNode slot = current.get(key);
            if (slot == null || slot.isNull()) {
                return null;
            }
            String slotPath = JsonValues.childPath(path, key);

            if (spec.isSingleObject()) {
                if (!(slot instanceof ObjectNode node)) {
                    throw GraphStructureException.unexpectedType(slotPath, "object", slot.getNodeType().toString());
                }
                if (!spec.hasIdentifier() || !JsonValues.isIdentifier(node.get(spec.getIdentifierField()))) {
                    return node;
                }
                return resolver.resolveSingle(node, spec.getIdentifierField(), segment.identifier())
                        .map(ResolvedEntity::node)
                        .orElse(null);
            }

            if (!(slot instanceof ArrayNode list)) {
                throw GraphStructureException.unexpectedType(slotPath, "array", slot.getNodeType().toString());
            }
            Optional<ResolvedEntity> hit = resolver.resolve(list, spec.getIdentifierField(), segment.identifier());
            hit.ifPresent(r -> log.debug("cascade.resolved segment={} rule={} index={}",
                    segment, r.rule(), r.index()));
            return hit.map(ResolvedEntity::node).orElse(null);
        }

        private ObjectNode createIn(CollectionSpec spec, PathSegment segment, int index) {
            String key = spec.getCollectionKey();
            ObjectNode container = current;
            JsonNode previous = container.get(key);
            ObjectNode entity = newEntity(spec, segment);

            if (spec.isSingleObject()) {
                if (previous != null && !previous.isNull()) {
                    throw new CascadeAbortException(index, segment,
                            "'" + key + "' is already occupied by another entity");
                }
                tx.execute("create " + segment,
                        () -> container.set(key, entity),
                        () -> restore(container, key, previous));
            } else {
                tx.execute("append " + segment,
                        () -> {
                            ArrayNode list = previous instanceof ArrayNode existing ? existing : container.putArray(key);
                            list.add(entity);
                        },
                        () -> {
                            if (previous instanceof ArrayNode existing) {
                                removeByIdentity(existing, entity);
                            } else {
                                restore(container, key, previous);
                            }
                        });
            }

            created.add(segment);
            metricsService.incrementEntityCreated(key);
            log.debug("cascade.created segment={} under={}", segment, path.isEmpty() ? "<root>" : path);
            return entity;
        }

        private ObjectNode newEntity(CollectionSpec spec, PathSegment segment) {
            ObjectNode entity = JsonNodeFactory.instance.objectNode();
            if (spec.hasIdentifier()) {
                entity.put(spec.getIdentifierField(), segment.identifier());
            }
            for (Map.Entry<String, String> inherited : spec.getInheritedKeys().entrySet()) {
                String value = lineage.get(inherited.getValue());
                if (value != null && !value.isBlank()) {
                    entity.put(inherited.getKey(), value);
                } else {
                    warnings.add(GraphWarning.of(WarningKind.UNRESOLVED_REFERENCE,
                            JsonValues.childPath(path, segment.toString()),
                            inherited.getKey() + " not set: no '" + inherited.getValue() + "' level above"));
                }
            }
            return entity;
        }

        private void adoptIdentifier(CollectionSpec spec, PathSegment segment, ObjectNode node) {
            if (!spec.hasIdentifier() || JsonValues.isIdentifier(node.get(spec.getIdentifierField()))) {
                return;
            }
            String field = spec.getIdentifierField();
            JsonNode previous = node.get(field);
            tx.execute("set " + field + " on " + segment,
                    () -> node.put(field, segment.identifier()),
                    () -> restore(node, field, previous));
        }

        private boolean enterImpliedParent(int index, String parentKey, boolean create) {
            CollectionSpec parentSpec = schema.spec(parentKey);
            JsonNode slot = current.get(parentKey);
            ObjectNode parent = null;
            if (slot instanceof ArrayNode list) {
                for (JsonNode element : list) {
                    if (element instanceof ObjectNode node) {
                        parent = node;
                        break;
                    }
                }
            } else if (slot instanceof ObjectNode node) {
                parent = node;
            } else if (slot != null && !slot.isNull()) {
                throw GraphStructureException.unexpectedType(JsonValues.childPath(path, parentKey),
                        "array or object", slot.getNodeType().toString());
            }

            if (parent == null) {
                if (!create) {
                    return false;
                }
                String name = placeholderNaming.nameFor(parentKey, Collections.unmodifiableMap(lineage));
                PathSegment placeholder = PathSegment.of(parentKey, name);
                parent = createIn(parentSpec, placeholder, index);
                warnings.add(GraphWarning.of(WarningKind.PLACEHOLDER_CREATED,
                        JsonValues.childPath(path, placeholder.toString()),
                        "Created placeholder " + parentKey + " '" + name + "'"));
                log.info("cascade.placeholder collection={} name={}", parentKey, name);
            }

            String identifier = parentSpec.hasIdentifier()
                    ? JsonValues.scalarText(parent.get(parentSpec.getIdentifierField())) : null;
            enter(parentSpec, PathSegment.of(parentKey, identifier), parent);
            return true;
        }

        private void enter(CollectionSpec spec, PathSegment segment, ObjectNode node) {
            String identifier = spec.hasIdentifier()
                    ? JsonValues.scalarText(node.get(spec.getIdentifierField())) : null;
            lineage.put(spec.getCollectionKey(), identifier);
            path = JsonValues.childPath(path, segment.toString());
            current = node;
        }
    }

    private static void restore(ObjectNode container, String key, JsonNode previous) {
        if (previous == null) {
            container.remove(key);
        } else {
            container.set(key, previous);
        }
    }

    private static void removeByIdentity(ArrayNode list, JsonNode element) {
        for (int i = list.size() - 1; i >= 0; i--) {
            if (list.get(i) == element) {
                list.remove(i);
                return;
            }
        }
    }
}
