package com.entity.graph.instruction;

import com.entity.graph.core.model.GraphWarning;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Result of applying an instruction batch: the updated copy of the graph and one outcome
 * per instruction, in order.
 */
public record BatchResult(
        ObjectNode graph,
        List<InstructionOutcome> outcomes,
        List<GraphWarning> warnings
) {
    public BatchResult {
        outcomes = outcomes != null ? List.copyOf(outcomes) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public long succeeded() {
        return outcomes.stream().filter(InstructionOutcome::success).count();
    }

    public long failed() {
        return outcomes.size() - succeeded();
    }

    /**
     * Returns true if every instruction was applied.
     */
    public boolean isSuccess() {
        return failed() == 0;
    }

    public boolean hasErrors() {
        return failed() > 0;
    }

    /**
     * Messages of the failed instructions, prefixed with their position in the batch.
     */
    public List<String> errors() {
        return outcomes.stream()
                .filter(outcome -> !outcome.success())
                .map(outcome -> "#" + outcome.index() + ": " + outcome.message())
                .toList();
    }

    @Override
    public String toString() {
        return "BatchResult{" +
                "instructions=" + outcomes.size() +
                ", succeeded=" + succeeded() +
                ", failed=" + failed() +
                ", warnings=" + warnings.size() +
                '}';
    }
}
