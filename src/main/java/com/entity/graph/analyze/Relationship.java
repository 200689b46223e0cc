package com.entity.graph.analyze;

/**
 * One id reference found in the graph: an entity pointing at another entity by id.
 *
 * @param entityType     type of the referencing entity, derived from its enclosing field
 * @param entityId       id of the referencing entity
 * @param referencedType reference field name without its {@code Id} suffix
 * @param referencedId   value of the reference field
 */
public record Relationship(
        String entityType,
        String entityId,
        String referencedType,
        String referencedId
) {

    /**
     * Renders the relationship as an edge-list sentence, e.g.
     * {@code tenant with ID 't1' references unit with ID 'u1'}.
     */
    public String describe() {
        return entityType + " with ID '" + entityId + "' references "
                + referencedType + " with ID '" + referencedId + "'";
    }

    @Override
    public String toString() {
        return describe();
    }
}
