package com.agrigrid.core.events;

import com.agrigrid.core.model.Position;

/**
 * A worker could not carry out a task.
 */
public record TaskFailedPayload(String taskId, Position cell, Reason reason) implements MessagePayload {

    public enum Reason {
        /** No route to the target cell. */
        NO_PATH,
        /** The cell was no longer in a state the task applies to. */
        PRECONDITION_FAILED,
        /** The offer reached a worker that already holds a task. */
        WORKER_BUSY
    }
}
