package com.entity.graph.cascade;

import com.entity.graph.core.model.FieldNames;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Names the placeholder entity synthesized when a cascade needs an implied parent that does
 * not exist yet (a lease written before any tenant is known).
 */
@FunctionalInterface
public interface PlaceholderNamingPolicy {

    /**
     * @param collectionKey collection the placeholder is created in (e.g. {@code tenants})
     * @param lineage       identifiers of the levels walked so far, keyed by collection, outermost first
     */
    String nameFor(String collectionKey, Map<String, String> lineage);

    /**
     * {@code <Type>_<identifier of the nearest identified ancestor>}, e.g. {@code Tenant_B1}.
     */
    static PlaceholderNamingPolicy typeAndParent() {
        return (collectionKey, lineage) -> {
            String type = FieldNames.typeNameOf(collectionKey);
            List<String> identifiers = new ArrayList<>();
            for (String value : lineage.values()) {
                if (value != null && !value.isBlank()) {
                    identifiers.add(value);
                }
            }
            return identifiers.isEmpty() ? type + "_1" : type + "_" + identifiers.get(identifiers.size() - 1);
        };
    }

    /**
     * Always the same name, for callers that rename placeholders later.
     */
    static PlaceholderNamingPolicy fixed(String name) {
        return (collectionKey, lineage) -> name;
    }
}
