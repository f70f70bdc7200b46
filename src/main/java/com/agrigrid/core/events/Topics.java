package com.agrigrid.core.events;

/**
 * Topic keys used on the {@link MessageChannel}.
 */
public final class Topics {

    /** Planner offers a task to a worker type. Payload: {@link AssignmentPayload}. */
    public static final String TASK_ASSIGNED = "task.assigned";

    /** Worker finished a task. Payload: {@link CompletionPayload}. */
    public static final String TASK_COMPLETED = "task.completed";

    /** Worker gave up on a task. Payload: {@link TaskFailedPayload}. */
    public static final String TASK_FAILED = "task.failed";

    /** Periodic worker status. Payload: {@link StatusReportPayload}. */
    public static final String STATUS_UPDATE = "status.update";

    /** Drone detected disease on a cell. Payload: {@link DiseaseAlertPayload}. */
    public static final String ALERT_DISEASE = "alert.disease";

    private Topics() {}
}
