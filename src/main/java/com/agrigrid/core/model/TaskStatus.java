package com.agrigrid.core.model;

/**
 * Status of a task owned by the master planner.
 */
public enum TaskStatus {
    PENDING,
    ASSIGNED,
    COMPLETED,
    FAILED,  // worker reported it could not finish (no path, precondition mismatch)
    DROPPED
}
