package com.entity.graph.merge;

import com.entity.graph.core.model.GraphWarning;
import com.entity.graph.core.model.JsonValues;
import com.entity.graph.core.model.WarningKind;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Mutable state of a single {@link RecursiveMerger#merge} call: the numeric field set and
 * the warnings collected so far.
 */
public class MergeContext {
    private static final Logger log = LoggerFactory.getLogger(MergeContext.class);

    private final Set<String> numericFields;
    private final String basePath;
    private final List<GraphWarning> warnings = new ArrayList<>();

    public MergeContext(Set<String> numericFields) {
        this(numericFields, "");
    }

    /**
     * @param basePath dotted path of the merge target inside its graph, empty for the root
     */
    public MergeContext(Set<String> numericFields, String basePath) {
        this.numericFields = numericFields != null ? Set.copyOf(numericFields) : Set.of();
        this.basePath = basePath != null ? basePath : "";
    }

    public String getBasePath() {
        return basePath;
    }

    /**
     * Dotted path of a top-level field of the merge target.
     */
    public String pathOf(String field) {
        return JsonValues.childPath(basePath, field);
    }

    public boolean isNumericField(String field) {
        return numericFields.contains(field);
    }

    /**
     * Coerces a value to a floating point number. Strings are trimmed and stripped of
     * {@code $} and thousands separators first. A value that cannot be parsed is returned
     * unchanged and a {@link WarningKind#COERCION} warning is recorded.
     */
    public JsonNode coerceNumeric(String path, JsonNode value) {
        if (value == null || value.isNull()) {
            return value;
        }
        if (value.isNumber()) {
            return DoubleNode.valueOf(value.doubleValue());
        }
        if (value.isTextual()) {
            String cleaned = value.textValue().trim().replace("$", "").replace(",", "");
            try {
                // BigDecimal rejects NaN, Infinity and type suffixes such as "500d"
                double parsed = new BigDecimal(cleaned).doubleValue();
                if (Double.isFinite(parsed)) {
                    return DoubleNode.valueOf(parsed);
                }
            } catch (NumberFormatException e) {
                log.debug("merge.coercion.unparseable path={} value='{}'", path, value.textValue());
            }
            warn(WarningKind.COERCION, path,
                    "Could not convert '" + value.textValue() + "' to a number; keeping it as a string");
            return value;
        }
        warn(WarningKind.COERCION, path, "Expected a number but found " + value.getNodeType());
        return value;
    }

    public void warn(WarningKind kind, String path, String message) {
        log.warn("merge.warning kind={} path={} message={}", kind, path, message);
        warnings.add(GraphWarning.of(kind, path, message));
    }

    public List<GraphWarning> warnings() {
        return List.copyOf(warnings);
    }
}
