package com.agrigrid.core.model;

/**
 * A single unit of work targeting one cell.
 *
 * @param id          unique, monotonic identifier (e.g. "task-12")
 * @param type        kind of work
 * @param targetCell  cell the work is performed on
 * @param priority    scheduling priority, higher is more urgent
 * @param status      current status
 * @param assignedTo  id of the worker holding the task, null until assigned
 * @param createdAt   tick the task was created
 * @param completedAt tick the task finished, null while open
 */
public record FarmTask(
    String id,
    TaskType type,
    Position targetCell,
    int priority,
    TaskStatus status,
    String assignedTo,
    long createdAt,
    Long completedAt
) {

    public static FarmTask pending(String id, TaskType type, Position targetCell, int priority, long createdAt) {
        return new FarmTask(id, type, targetCell, priority, TaskStatus.PENDING, null, createdAt, null);
    }

    public FarmTask assignedTo(String workerId) {
        return new FarmTask(id, type, targetCell, priority, TaskStatus.ASSIGNED, workerId, createdAt, null);
    }

    public FarmTask finished(TaskStatus finalStatus, long tick) {
        return new FarmTask(id, type, targetCell, priority, finalStatus, assignedTo, createdAt, tick);
    }
}
