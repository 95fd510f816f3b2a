package com.tasklane.core.events;

/**
 * Event type names published on the {@link EventBus}.
 */
public final class EventTypes {

    private EventTypes() {}

    public static final String RUN_STARTED = "run.started";
    public static final String RUN_PAUSED = "run.paused";
    public static final String RUN_RESUMED = "run.resumed";
    public static final String RUN_COMPLETED = "run.completed";
    public static final String RUN_FAILED = "run.failed";
    public static final String RUN_CANCELLED = "run.cancelled";

    public static final String WAVE_READY = "wave.ready";
    public static final String WAVE_STARTED = "wave.started";
    public static final String WAVE_COMPLETED = "wave.completed";

    public static final String TASK_STARTED = "task.started";
    public static final String TASK_PROGRESS = "task.progress";
    public static final String TASK_COMPLETED = "task.completed";
    public static final String TASK_RETRYING = "task.retrying";
    public static final String TASK_FAILED = "task.failed";
    public static final String TASK_BLOCKED = "task.blocked";
    public static final String TASK_CANCELLED = "task.cancelled";
    public static final String TASK_ESCALATED = "task.escalated";

    public static final String WORKER_SPAWNED = "worker.spawned";
    public static final String WORKER_STUCK = "worker.stuck";
    public static final String WORKER_TERMINATED = "worker.terminated";

    public static final String LIST_STATUS_CHANGED = "list.status_changed";
}
