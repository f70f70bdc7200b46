package com.agrigrid.core.scheduler;

import java.util.List;

/**
 * Outcome of one batch: what was placed, which task ids found no slot, and the scheduler's
 * metrics after the batch.
 */
public record ScheduleResult(
    List<TaskAssignment> assignments,
    List<String> rejected,
    ScheduleMetrics metrics
) {

    public ScheduleResult {
        assignments = List.copyOf(assignments);
        rejected = List.copyOf(rejected);
    }
}
