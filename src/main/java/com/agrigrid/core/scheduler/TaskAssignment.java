package com.agrigrid.core.scheduler;

import com.agrigrid.core.model.Position;
import com.agrigrid.core.model.TaskType;

/**
 * A placed task: agent and slot range {@code [startSlot, startSlot + duration)}.
 */
public record TaskAssignment(
    String taskId,
    TaskType taskType,
    String agentId,
    Position targetCell,
    int startSlot,
    int duration,
    int priority
) {

    public int endSlot() {
        return startSlot + duration;
    }
}
