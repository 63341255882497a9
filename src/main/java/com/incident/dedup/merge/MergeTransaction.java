package com.incident.dedup.merge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Supplier;

/**
 * Compensating unit of work around the two writes of a merge.
 *
 * <p>Each completed step registers an undo action. If a later step throws, or the
 * transaction is closed without {@link #commit()}, the undo actions run newest-first.</p>
 *
 * <pre>
 * try (MergeTransaction tx = new MergeTransaction(runId)) {
 *     tx.step("mark secondary merged_into", () -> markSecondary(), () -> unmarkSecondary());
 *     tx.step("write primary fields", () -> writePrimary(), null);
 *     tx.commit();
 * }
 * </pre>
 */
public class MergeTransaction implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MergeTransaction.class);

    private final String label;
    private final Deque<Undo> undoStack = new ArrayDeque<>();
    private final List<String> completedSteps = new ArrayList<>();
    private final List<String> failedCompensations = new ArrayList<>();
    private boolean committed = false;
    private boolean rolledBack = false;
    private boolean closed = false;

    public MergeTransaction(String label) {
        this.label = label;
    }

    /**
     * Runs a step and registers its undo action (null when the step needs none).
     * On failure the already-registered undo actions run and the exception is rethrown.
     */
    public void step(String name, Runnable action, Runnable undo) {
        step(name, () -> {
            action.run();
            return null;
        }, undo);
    }

    /**
     * Variant of {@link #step(String, Runnable, Runnable)} that returns the step's result.
     */
    public <T> T step(String name, Supplier<T> action, Runnable undo) {
        ensureOpen();
        try {
            log.debug("merge.tx.step tx={} step={}", label, name);
            T result = action.get();
            completedSteps.add(name);
            if (undo != null) {
                undoStack.push(new Undo(name, undo));
            }
            return result;
        } catch (RuntimeException e) {
            log.warn("merge.tx.stepFailed tx={} step={} error={}", label, name, e.getMessage());
            rollback();
            throw e;
        }
    }

    public void commit() {
        ensureOpen();
        committed = true;
    }

    public boolean isCommitted() {
        return committed;
    }

    public boolean isRolledBack() {
        return rolledBack;
    }

    public List<String> getCompletedSteps() {
        return List.copyOf(completedSteps);
    }

    /**
     * Names of undo actions that themselves failed during rollback.
     */
    public List<String> getFailedCompensations() {
        return List.copyOf(failedCompensations);
    }

    @Override
    public void close() {
        if (!closed && !committed && !undoStack.isEmpty()) {
            log.warn("merge.tx.closedWithoutCommit tx={} steps={}", label, completedSteps);
            rollback();
        }
        closed = true;
    }

    private void rollback() {
        if (!undoStack.isEmpty()) {
            rolledBack = true;
        }
        while (!undoStack.isEmpty()) {
            Undo undo = undoStack.pop();
            try {
                log.debug("merge.tx.undo tx={} step={}", label, undo.step());
                undo.action().run();
            } catch (RuntimeException e) {
                failedCompensations.add(undo.step());
                log.error("merge.tx.undoFailed tx={} step={} error={}", label, undo.step(), e.getMessage(), e);
            }
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Transaction is already closed: " + label);
        }
    }

    private record Undo(String step, Runnable action) {}
}
