package bigo.conductor.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Task lifecycle status. Transitions only move forward:
 * pending -> working -> (validating -> approved|rejected) -> done|failed.
 */
public enum TaskStatus {
    /** Task created and classified, no worker started yet */
    PENDING,
    /** A worker is executing the task */
    WORKING,
    /** Execution finished, waiting for validator approval */
    VALIDATING,
    /** Validators reached the required approvals */
    APPROVED,
    /** Validators rejected the execution */
    REJECTED,
    /** Task completed successfully */
    DONE,
    /** Task failed */
    FAILED;

    /** Value stored in the status column. */
    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }

    /**
     * Check if this status can move to the target status.
     */
    public boolean canTransitionTo(TaskStatus target) {
        return switch (this) {
            case PENDING -> target == WORKING || target == FAILED;
            case WORKING -> target == VALIDATING || target == DONE || target == FAILED;
            case VALIDATING -> target == APPROVED || target == REJECTED || target == FAILED;
            case APPROVED -> target == DONE;
            case REJECTED -> target == FAILED;
            case DONE, FAILED -> false;
        };
    }

    /** All statuses from which the target status can be reached in one step. */
    public static Set<TaskStatus> predecessorsOf(TaskStatus target) {
        Set<TaskStatus> result = EnumSet.noneOf(TaskStatus.class);
        for (TaskStatus s : values()) {
            if (s.canTransitionTo(target)) {
                result.add(s);
            }
        }
        return result;
    }

    /** Statuses counted as pending work in ledger statistics. */
    public static Set<TaskStatus> nonTerminal() {
        return EnumSet.complementOf(EnumSet.of(DONE, FAILED));
    }

    public static TaskStatus fromDb(String value) {
        if (value == null) {
            throw new IllegalArgumentException("status is required");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    @Override
    public String toString() {
        return dbValue();
    }
}
