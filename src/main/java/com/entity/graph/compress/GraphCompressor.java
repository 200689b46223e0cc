package com.entity.graph.compress;

import com.entity.graph.core.model.GraphStructureException;
import com.entity.graph.core.model.JsonValues;
import com.entity.graph.merge.RecursiveMerger;
import com.entity.graph.metrics.MetricsService;
import com.entity.graph.metrics.NoOpMetricsService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

/**
 * Strips empty values from a graph, bottom-up, into a new graph.
 *
 * <p>A field is dropped when its compressed value is empty (null, blank string, empty array,
 * empty object or zero). Array elements are dropped on the same rule, so an element that
 * compresses to {@code {}} disappears from its list. The {@code id} field is always kept verbatim.</p>
 *
 * <p>{@code compress(compress(g))} equals {@code compress(g)}.</p>
 */
public class GraphCompressor {
    private static final Logger log = LoggerFactory.getLogger(GraphCompressor.class);

    private final String idField;
    private final int maxDepth;
    private final MetricsService metricsService;

    public GraphCompressor() {
        this("id", RecursiveMerger.DEFAULT_MAX_DEPTH, new NoOpMetricsService());
    }

    public GraphCompressor(String idField, int maxDepth, MetricsService metricsService) {
        this.idField = Objects.requireNonNull(idField, "idField is required");
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive");
        }
        this.maxDepth = maxDepth;
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
    }

    /**
     * @throws GraphStructureException if the graph nests deeper than the configured limit
     */
    public ObjectNode compress(ObjectNode graph) {
        Objects.requireNonNull(graph, "graph is required");
        int[] removed = {0};
        ObjectNode compressed = compressObject(graph, "", 0, removed);
        if (removed[0] > 0) {
            metricsService.recordElementsRemoved(removed[0]);
        }
        log.debug("compress.completed removed={}", removed[0]);
        return compressed;
    }

    private ObjectNode compressObject(ObjectNode source, String path, int depth, int[] removed) {
        if (depth > maxDepth) {
            throw GraphStructureException.depthExceeded(path, maxDepth);
        }
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        Iterator<Map.Entry<String, JsonNode>> fields = source.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            String field = entry.getKey();
            if (field.equals(idField)) {
                result.set(field, entry.getValue().deepCopy());
                continue;
            }
            JsonNode compressed = compressValue(entry.getValue(), JsonValues.childPath(path, field), depth, removed);
            if (JsonValues.isEmpty(compressed)) {
                removed[0]++;
            } else {
                result.set(field, compressed);
            }
        }
        return result;
    }

    private ArrayNode compressArray(ArrayNode source, String path, int depth, int[] removed) {
        if (depth > maxDepth) {
            throw GraphStructureException.depthExceeded(path, maxDepth);
        }
        ArrayNode result = JsonNodeFactory.instance.arrayNode();
        for (int i = 0; i < source.size(); i++) {
            JsonNode compressed = compressValue(source.get(i), JsonValues.elementPath(path, i), depth, removed);
            if (JsonValues.isEmpty(compressed)) {
                removed[0]++;
            } else {
                result.add(compressed);
            }
        }
        return result;
    }

    private JsonNode compressValue(JsonNode value, String path, int depth, int[] removed) {
        if (value instanceof ObjectNode node) {
            return compressObject(node, path, depth + 1, removed);
        }
        if (value instanceof ArrayNode list) {
            return compressArray(list, path, depth + 1, removed);
        }
        return value;
    }
}
