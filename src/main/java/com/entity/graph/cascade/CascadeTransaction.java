package com.entity.graph.cascade;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Compensating transaction for cascade mutations.
 * Every graph mutation registers an undo action; if the transaction is closed without
 * {@link #markSuccess()}, the undo actions run in reverse order and the graph is back to
 * where it started.
 *
 * <pre>
 * try (CascadeTransaction tx = new CascadeTransaction()) {
 *     tx.execute("append units[B1]", () -> units.add(unit), () -> units.remove(index));
 *     tx.markSuccess();
 * }
 * </pre>
 */
public class CascadeTransaction implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CascadeTransaction.class);

    private final Deque<CompensatingAction> compensationStack = new ArrayDeque<>();
    private boolean success = false;
    private boolean closed = false;

    /**
     * Executes a mutation and registers its compensation.
     * If the mutation fails, all previously registered compensations run in reverse order
     * and the exception is rethrown.
     *
     * @param description  human-readable description of the step
     * @param operation    the mutation to perform
     * @param compensation the action that undoes it
     */
    public void execute(String description, Runnable operation, Runnable compensation) {
        if (closed) {
            throw new IllegalStateException("Transaction is already closed");
        }

        try {
            log.debug("Executing cascade step: {}", description);
            operation.run();
            compensationStack.push(new CompensatingAction(description, compensation));
        } catch (RuntimeException e) {
            log.warn("Cascade step '{}' failed: {}. Running compensations.", description, e.getMessage());
            runCompensations();
            throw e;
        }
    }

    public void markSuccess() {
        this.success = true;
    }

    public boolean isSuccess() {
        return success;
    }

    /**
     * Number of steps that would be undone if the transaction were closed now.
     */
    public int pendingCompensations() {
        return compensationStack.size();
    }

    @Override
    public void close() {
        if (!closed && !success && !compensationStack.isEmpty()) {
            log.info("cascade.rollback steps={}", compensationStack.size());
            runCompensations();
        }
        closed = true;
    }

    private void runCompensations() {
        while (!compensationStack.isEmpty()) {
            CompensatingAction action = compensationStack.pop();
            try {
                log.debug("Running compensation: {}", action.description);
                action.compensation.run();
            } catch (RuntimeException e) {
                log.error("Compensation '{}' failed (best-effort): {}", action.description, e.getMessage());
            }
        }
    }

    private record CompensatingAction(String description, Runnable compensation) {}
}
