package com.agrigrid.core.agents;

/**
 * Result of a worker's task-specific effect.
 *
 * @param kind   whether the effect ran
 * @param action short verb reported with the completion (e.g. "sown")
 * @param yield  harvested units
 */
public record ExecutionOutcome(Kind kind, String action, int yield) {

    public enum Kind {
        APPLIED,
        /** Deliberately postponed; still reported as completed. */
        DELAYED,
        /** Precondition no longer held; nothing was changed. */
        SKIPPED
    }

    public static ExecutionOutcome applied(String action) {
        return new ExecutionOutcome(Kind.APPLIED, action, 0);
    }

    public static ExecutionOutcome harvested(int yield) {
        return new ExecutionOutcome(Kind.APPLIED, "harvested", yield);
    }

    public static ExecutionOutcome delayed(String action) {
        return new ExecutionOutcome(Kind.DELAYED, action, 0);
    }

    public static ExecutionOutcome skipped() {
        return new ExecutionOutcome(Kind.SKIPPED, "skipped", 0);
    }

    public boolean completed() {
        return kind != Kind.SKIPPED;
    }
}
