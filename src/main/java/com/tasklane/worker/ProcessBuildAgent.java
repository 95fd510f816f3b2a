package com.tasklane.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tasklane.core.model.FailureReason;
import com.tasklane.core.model.LogEntryKind;
import com.tasklane.core.model.WorkerResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Runs each task as a local OS process.
 *
 * <p>The configured command is started in the working directory with the dispatch command written
 * to stdin as JSON. Stdout and stderr are read line by line:
 * <ul>
 *   <li>{@code @heartbeat <percent> <step>} reports liveness</li>
 *   <li>{@code @checkpoint <ref>} records a commit or checkpoint marker</li>
 *   <li>{@code @file <path>} records a modified file</li>
 *   <li>{@code @error <text>} records an error and becomes the last error</li>
 *   <li>anything else is logged as an action</li>
 * </ul>
 * Exit code 0 is success. The process is destroyed whenever the calling thread leaves before it
 * exits, including on interrupt.
 */
public class ProcessBuildAgent implements BuildAgent {

    private static final Logger log = LoggerFactory.getLogger(ProcessBuildAgent.class);

    private final List<String> command;
    private final Path workingDirectory;
    private final ObjectMapper objectMapper;

    public ProcessBuildAgent(List<String> command, Path workingDirectory, ObjectMapper objectMapper) {
        this.command = List.copyOf(command);
        this.workingDirectory = workingDirectory;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return "process";
    }

    @Override
    public boolean isAvailable() {
        return !command.isEmpty();
    }

    @Override
    public WorkerResult execute(DispatchCommand dispatch, WorkerChannel channel) throws InterruptedException {
        if (command.isEmpty()) {
            return WorkerResult.failure(FailureReason.INFRASTRUCTURE, "No worker command configured (tasklane.worker.command)");
        }

        var builder = new ProcessBuilder(command)
                .directory(workingDirectory.toFile())
                .redirectErrorStream(true);
        builder.environment().put("TASKLANE_RUN_ID", dispatch.runId());
        builder.environment().put("TASKLANE_TASK_ID", dispatch.task().id());
        builder.environment().put("TASKLANE_WORKER_ID", dispatch.workerId());
        builder.environment().put("TASKLANE_ATTEMPT", String.valueOf(dispatch.attempt()));

        byte[] payload;
        try {
            payload = objectMapper.writeValueAsBytes(dispatch);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize dispatch command for " + dispatch.task().id(), e);
        }

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            log.error("Failed to start worker process {}: {}", command, e.getMessage());
            return WorkerResult.failure(FailureReason.INFRASTRUCTURE, "Failed to start process: " + e.getMessage());
        }
        log.info("Started process {} for task {}", process.pid(), dispatch.task().id());

        var output = new OutputParser(channel);
        var reader = new Thread(() -> output.consume(process), "tasklane-process-" + process.pid());
        reader.setDaemon(true);
        reader.start();

        // Pipe writes ignore interrupts; keep them off the calling thread.
        var writer = new Thread(() -> writeStdin(process, payload), "tasklane-stdin-" + process.pid());
        writer.setDaemon(true);
        writer.start();

        boolean exited = false;
        try {
            int exitCode = process.waitFor();
            exited = true;
            reader.join();
            if (exitCode == 0) {
                return WorkerResult.success(output.files(), output.checkpoints());
            }
            String lastError = output.lastError() != null ? output.lastError() : "Process exited with code " + exitCode;
            return WorkerResult.failure(FailureReason.ERROR, lastError, output.files(), output.checkpoints());
        } finally {
            if (!exited) {
                log.info("Destroying process {} for task {}", process.pid(), dispatch.task().id());
                process.destroyForcibly();
            }
        }
    }

    private static void writeStdin(Process process, byte[] payload) {
        try (OutputStream stdin = process.getOutputStream()) {
            stdin.write(payload);
            stdin.write('\n');
        } catch (IOException e) {
            // The process may exit, or be destroyed, without reading its input.
            log.debug("Could not write dispatch command to process {} stdin: {}", process.pid(), e.getMessage());
        }
    }

    /**
     * Parses the stdout line protocol and forwards it to the worker channel.
     */
    static final class OutputParser {

        private final WorkerChannel channel;
        private final Set<String> files = new LinkedHashSet<>();
        private final List<String> checkpoints = new ArrayList<>();
        private volatile String lastError;

        OutputParser(WorkerChannel channel) {
            this.channel = channel;
        }

        void consume(Process process) {
            try (var in = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = in.readLine()) != null) {
                    accept(line);
                }
            } catch (IOException e) {
                log.debug("Process output closed: {}", e.getMessage());
            }
        }

        synchronized void accept(String line) {
            String trimmed = line.strip();
            if (trimmed.isEmpty()) return;

            if (trimmed.startsWith("@heartbeat")) {
                String[] parts = trimmed.split("\\s+", 3);
                int percent = 0;
                if (parts.length > 1) {
                    try {
                        percent = Integer.parseInt(parts[1]);
                    } catch (NumberFormatException e) {
                        log.debug("Malformed heartbeat percent '{}'", parts[1]);
                    }
                }
                channel.heartbeat(percent, parts.length > 2 ? parts[2] : null);
            } else if (trimmed.startsWith("@checkpoint ")) {
                String ref = trimmed.substring("@checkpoint ".length()).strip();
                checkpoints.add(ref);
                channel.log(LogEntryKind.CHECKPOINT, ref);
            } else if (trimmed.startsWith("@file ")) {
                String path = trimmed.substring("@file ".length()).strip();
                files.add(path);
                channel.log(LogEntryKind.FILE_CHANGE, path);
            } else if (trimmed.startsWith("@error ")) {
                lastError = trimmed.substring("@error ".length()).strip();
                channel.log(LogEntryKind.ERROR, lastError);
            } else {
                channel.log(LogEntryKind.ACTION, line);
            }
        }

        synchronized List<String> files() {
            return List.copyOf(files);
        }

        synchronized List<String> checkpoints() {
            return List.copyOf(checkpoints);
        }

        String lastError() {
            return lastError;
        }
    }
}
