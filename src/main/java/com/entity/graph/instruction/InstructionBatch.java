package com.entity.graph.instruction;

import com.entity.graph.cascade.CascadeResult;
import com.entity.graph.cascade.EntityCascade;
import com.entity.graph.core.model.GraphStructureException;
import com.entity.graph.core.model.GraphWarning;
import com.entity.graph.logging.LogContext;
import com.entity.graph.metrics.MetricsService;
import com.entity.graph.metrics.NoOpMetricsService;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Applies a sequence of instructions to a copy of a graph.
 *
 * <p>Instructions run in order. A failed instruction is recorded and skipped; instructions that
 * already succeeded stay applied. The caller's graph is never modified.</p>
 */
public class InstructionBatch {
    private static final Logger log = LoggerFactory.getLogger(InstructionBatch.class);

    private final EntityCascade cascade;
    private final MetricsService metricsService;

    public InstructionBatch(EntityCascade cascade) {
        this(cascade, new NoOpMetricsService());
    }

    public InstructionBatch(EntityCascade cascade, MetricsService metricsService) {
        this.cascade = Objects.requireNonNull(cascade, "cascade is required");
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
    }

    public BatchResult apply(ObjectNode graph, List<GraphInstruction> instructions) {
        Objects.requireNonNull(graph, "graph is required");
        List<GraphInstruction> batch = instructions != null ? instructions : List.of();
        ObjectNode working = graph.deepCopy();
        List<InstructionOutcome> outcomes = new ArrayList<>();
        List<GraphWarning> warnings = new ArrayList<>();

        try (LogContext logCtx = LogContext.forBatch(LogContext.generateCorrelationId())) {
            log.info("batch.starting instructions={}", batch.size());
            metricsService.recordBatchSize(batch.size());

            for (int i = 0; i < batch.size(); i++) {
                GraphInstruction instruction = batch.get(i);
                try {
                    CascadeResult result = execute(working, instruction);
                    if (result.isSuccess()) {
                        outcomes.add(InstructionOutcome.success(i, instruction,
                                result.createdSegments(), result.warnings()));
                        warnings.addAll(result.warnings());
                    } else {
                        log.warn("batch.instruction.rejected index={} action={} reason={}",
                                i, instruction.action(), result.errorMessage());
                        outcomes.add(InstructionOutcome.failure(i, instruction, result.errorMessage()));
                    }
                } catch (GraphStructureException e) {
                    log.warn("batch.instruction.failed index={} action={} path={} reason={}",
                            i, instruction.action(), e.getPath(), e.getMessage());
                    outcomes.add(InstructionOutcome.failure(i, instruction, e.getMessage()));
                }
            }

            BatchResult result = new BatchResult(working, outcomes, warnings);
            log.info("batch.completed succeeded={} failed={} warnings={}",
                    result.succeeded(), result.failed(), warnings.size());
            return result;
        }
    }

    private CascadeResult execute(ObjectNode graph, GraphInstruction instruction) {
        CascadeResult result;
        switch (instruction.action()) {
            case CREATE -> result = cascade.create(graph, instruction.path(), instruction.fields());
            case UPDATE -> result = cascade.update(graph, instruction.path(), instruction.fields());
            default -> result = cascade.upsert(graph, instruction.path(), instruction.fields());
        }
        return result;
    }
}
