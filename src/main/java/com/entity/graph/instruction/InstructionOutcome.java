package com.entity.graph.instruction;

import com.entity.graph.cascade.PathSegment;
import com.entity.graph.core.model.GraphWarning;

import java.util.List;

/**
 * Outcome of one instruction within a batch.
 */
public record InstructionOutcome(
        int index,
        GraphInstruction instruction,
        boolean success,
        String message,
        List<PathSegment> createdSegments,
        List<GraphWarning> warnings
) {
    public InstructionOutcome {
        createdSegments = createdSegments != null ? List.copyOf(createdSegments) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public static InstructionOutcome success(int index, GraphInstruction instruction,
                                             List<PathSegment> createdSegments, List<GraphWarning> warnings) {
        String message = createdSegments == null || createdSegments.isEmpty()
                ? "Applied " + instruction.action().toValue()
                : "Applied " + instruction.action().toValue() + ", created " + createdSegments;
        return new InstructionOutcome(index, instruction, true, message, createdSegments, warnings);
    }

    public static InstructionOutcome failure(int index, GraphInstruction instruction, String message) {
        return new InstructionOutcome(index, instruction, false, message, List.of(), List.of());
    }
}
