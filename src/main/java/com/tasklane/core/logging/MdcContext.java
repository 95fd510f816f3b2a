package com.tasklane.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Tasklane MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String RUN_ID = "runId";
    public static final String TASK_LIST_ID = "taskListId";
    public static final String WAVE_NUMBER = "waveNumber";
    public static final String TASK_ID = "taskId";
    public static final String WORKER_ID = "workerId";

    private MdcContext() {}

    public static void setRun(String taskListId, String runId) {
        MDC.put(TASK_LIST_ID, taskListId);
        MDC.put(RUN_ID, runId);
    }

    public static void setWave(String runId, int waveNumber) {
        MDC.put(RUN_ID, runId);
        MDC.put(WAVE_NUMBER, String.valueOf(waveNumber));
    }

    public static void setWorker(String runId, String taskId, String workerId) {
        MDC.put(RUN_ID, runId);
        MDC.put(TASK_ID, taskId);
        MDC.put(WORKER_ID, workerId);
    }

    public static void clearWorker() {
        MDC.remove(TASK_ID);
        MDC.remove(WORKER_ID);
    }

    public static void clear() {
        MDC.remove(RUN_ID);
        MDC.remove(TASK_LIST_ID);
        MDC.remove(WAVE_NUMBER);
        MDC.remove(TASK_ID);
        MDC.remove(WORKER_ID);
    }
}
