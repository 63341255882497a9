package com.incident.dedup.merge;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the compensating merge transaction.
 */
class MergeTransactionTest {

    @Test
    void committedTransaction_noUndoRuns() {
        List<String> log = new ArrayList<>();

        try (MergeTransaction tx = new MergeTransaction("p<-s")) {
            tx.step("step1", () -> log.add("op1"), () -> log.add("undo1"));
            tx.step("step2", () -> log.add("op2"), () -> log.add("undo2"));
            tx.commit();
            assertTrue(tx.isCommitted());
        }

        assertEquals(List.of("op1", "op2"), log);
    }

    @Test
    void failedStep_runsUndoInReverse() {
        List<String> log = new ArrayList<>();
        MergeTransaction tx = new MergeTransaction("p<-s");

        assertThrows(IllegalStateException.class, () -> {
            try (tx) {
                tx.step("step1", () -> log.add("op1"), () -> log.add("undo1"));
                tx.step("step2", () -> log.add("op2"), () -> log.add("undo2"));
                tx.step("step3", () -> {
                    throw new IllegalStateException("step3 failed");
                }, () -> log.add("undo3"));
            }
        });

        assertEquals(List.of("op1", "op2", "undo2", "undo1"), log);
        assertTrue(tx.isRolledBack());
        assertEquals(List.of("step1", "step2"), tx.getCompletedSteps());
    }

    @Test
    void closedWithoutCommit_runsAllUndo() {
        List<String> log = new ArrayList<>();

        MergeTransaction tx = new MergeTransaction("p<-s");
        tx.step("step1", () -> log.add("op1"), () -> log.add("undo1"));
        tx.step("step2", () -> log.add("op2"), () -> log.add("undo2"));
        tx.close();

        assertEquals(List.of("op1", "op2", "undo2", "undo1"), log);
        assertTrue(tx.isRolledBack());
    }

    @Test
    void stepWithoutUndo_isNotCompensated() {
        List<String> log = new ArrayList<>();

        try (MergeTransaction tx = new MergeTransaction("p<-s")) {
            tx.step("step1", () -> log.add("op1"), () -> log.add("undo1"));
            tx.step("step2", () -> log.add("op2"), null);
        }

        assertEquals(List.of("op1", "op2", "undo1"), log);
    }

    @Test
    void failedUndo_continuesRemainingUndo() {
        List<String> log = new ArrayList<>();

        MergeTransaction tx = new MergeTransaction("p<-s");
        tx.step("step1", () -> log.add("op1"), () -> log.add("undo1"));
        tx.step("step2", () -> log.add("op2"), () -> {
            throw new IllegalStateException("undo failed");
        });
        tx.close();

        assertEquals(List.of("op1", "op2", "undo1"), log);
        assertEquals(List.of("step2"), tx.getFailedCompensations());
    }

    @Test
    void supplierStep_returnsValue() {
        try (MergeTransaction tx = new MergeTransaction("p<-s")) {
            String value = tx.step("read", () -> "result", null);
            tx.commit();
            assertEquals("result", value);
        }
    }

    @Test
    void closedTransaction_rejectsFurtherSteps() {
        MergeTransaction tx = new MergeTransaction("p<-s");
        tx.commit();
        tx.close();

        assertThrows(IllegalStateException.class, () -> tx.step("late", () -> { }, null));
        assertFalse(tx.isRolledBack());
    }
}
