package com.tasklane.worker;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Worker supervision settings and build agent provider, bound from {@code tasklane.worker.*}.
 */
@Component
@ConfigurationProperties(prefix = "tasklane.worker")
public class WorkerProperties {

    private String provider = "process";
    private int heartbeatIntervalSeconds = 5;
    private int maxMissedHeartbeats = 3;
    private int timeoutSeconds = 1800;
    private int logTailLines = 500;
    private List<String> command = new ArrayList<>();
    private String workingDirectory = ".";

    public String getProvider() { return provider; }
    public void setProvider(String provider) { this.provider = provider; }
    public int getHeartbeatIntervalSeconds() { return heartbeatIntervalSeconds; }
    public void setHeartbeatIntervalSeconds(int heartbeatIntervalSeconds) { this.heartbeatIntervalSeconds = heartbeatIntervalSeconds; }
    public int getMaxMissedHeartbeats() { return maxMissedHeartbeats; }
    public void setMaxMissedHeartbeats(int maxMissedHeartbeats) { this.maxMissedHeartbeats = maxMissedHeartbeats; }
    public int getTimeoutSeconds() { return timeoutSeconds; }
    public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    public int getLogTailLines() { return logTailLines; }
    public void setLogTailLines(int logTailLines) { this.logTailLines = logTailLines; }
    public List<String> getCommand() { return command; }
    public void setCommand(List<String> command) { this.command = command; }
    public String getWorkingDirectory() { return workingDirectory; }
    public void setWorkingDirectory(String workingDirectory) { this.workingDirectory = workingDirectory; }

    public boolean isCommandConfigured() {
        return command != null && !command.isEmpty();
    }
}
