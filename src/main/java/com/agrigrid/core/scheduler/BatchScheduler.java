package com.agrigrid.core.scheduler;

import com.agrigrid.core.model.AgentType;

import java.util.List;
import java.util.Map;

/**
 * Offline scheduler that places a batch of tasks onto agents' time slots while drawing down
 * shared resource pools.
 */
public interface BatchScheduler {

    /**
     * Places as many requests as fit. Reservations and pool consumption persist until {@link #reset()}.
     *
     * @param requests tasks to place
     * @param roster   agent ids per agent type, in preference order
     */
    ScheduleResult scheduleTasks(List<ScheduleRequest> requests, Map<AgentType, List<String>> roster);

    ScheduleMetrics metrics();

    List<TaskAssignment> assignments();

    int horizon();

    /** Drops assignments and reservations and refills every pool. */
    void reset();
}
