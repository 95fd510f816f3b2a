package com.tasklane.core.engine;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Coordinator limits and retry policy, bound from {@code tasklane.engine.*}.
 */
@Component
@ConfigurationProperties(prefix = "tasklane.engine")
public class EngineProperties {

    /** Attempts per task per run before the task fails permanently. */
    private int retryBudget = 3;
    /** Consecutive failed attempts (across runs) before the progress analyzer is consulted. */
    private int escalationThreshold = 3;
    /** Extra attempts granted beyond the retry budget while the analyzer still sees progress. */
    private int progressRetryAllowance = 2;
    private int maxConcurrentLists = 5;
    private int maxGlobalWorkers = 10;
    private boolean crossListConflictDetection = true;
    private int deadlineWindowDays = 3;
    /** Re-enter RUNNING runs that have no coordinator once the application is ready. */
    private boolean recoverOnStartup = true;

    public int getRetryBudget() { return retryBudget; }
    public void setRetryBudget(int retryBudget) { this.retryBudget = retryBudget; }
    public int getEscalationThreshold() { return escalationThreshold; }
    public void setEscalationThreshold(int escalationThreshold) { this.escalationThreshold = escalationThreshold; }
    public int getProgressRetryAllowance() { return progressRetryAllowance; }
    public void setProgressRetryAllowance(int progressRetryAllowance) { this.progressRetryAllowance = progressRetryAllowance; }
    public int getMaxConcurrentLists() { return maxConcurrentLists; }
    public void setMaxConcurrentLists(int maxConcurrentLists) { this.maxConcurrentLists = maxConcurrentLists; }
    public int getMaxGlobalWorkers() { return maxGlobalWorkers; }
    public void setMaxGlobalWorkers(int maxGlobalWorkers) { this.maxGlobalWorkers = maxGlobalWorkers; }
    public boolean isCrossListConflictDetection() { return crossListConflictDetection; }
    public void setCrossListConflictDetection(boolean crossListConflictDetection) { this.crossListConflictDetection = crossListConflictDetection; }
    public int getDeadlineWindowDays() { return deadlineWindowDays; }
    public void setDeadlineWindowDays(int deadlineWindowDays) { this.deadlineWindowDays = deadlineWindowDays; }
    public boolean isRecoverOnStartup() { return recoverOnStartup; }
    public void setRecoverOnStartup(boolean recoverOnStartup) { this.recoverOnStartup = recoverOnStartup; }
}
