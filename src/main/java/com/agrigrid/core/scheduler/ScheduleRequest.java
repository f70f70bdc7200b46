package com.agrigrid.core.scheduler;

import com.agrigrid.core.model.Position;
import com.agrigrid.core.model.TaskType;

import java.util.EnumMap;
import java.util.Map;

/**
 * A task to place on the schedule.
 *
 * @param duration  number of consecutive slots the task occupies
 * @param resources amount drawn from each pool when the task is placed
 */
public record ScheduleRequest(
    String taskId,
    TaskType taskType,
    Position targetCell,
    int priority,
    int duration,
    Map<ResourceType, Double> resources
) {

    public ScheduleRequest {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId is required");
        }
        if (taskType == null) {
            throw new IllegalArgumentException("taskType is required for " + taskId);
        }
        if (duration <= 0) {
            throw new IllegalArgumentException("duration must be positive for " + taskId + ": " + duration);
        }
        if (resources != null) {
            resources.forEach((type, amount) -> {
                if (type == null || amount == null || amount < 0 || amount.isNaN()) {
                    throw new IllegalArgumentException("Resource draw must be a non-negative amount for "
                            + taskId + ": " + type + "=" + amount);
                }
            });
        }
        resources = resources == null || resources.isEmpty()
                ? Map.of()
                : Map.copyOf(new EnumMap<>(resources));
    }
}
