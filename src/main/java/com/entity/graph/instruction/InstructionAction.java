package com.entity.graph.instruction;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * What an instruction does with the entity at the end of its path.
 */
public enum InstructionAction {
    /** Creates the leaf entity; fails when it already exists. */
    CREATE,
    /** Updates an existing entity; fails when any level of the path is missing. */
    UPDATE,
    /** Updates the entity, creating it and any missing ancestor first. */
    UPSERT;

    @JsonCreator
    public static InstructionAction fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Instruction action is required");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
