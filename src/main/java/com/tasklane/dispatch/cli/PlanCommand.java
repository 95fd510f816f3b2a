package com.tasklane.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tasklane.core.error.TasklaneException;
import com.tasklane.core.model.Task;
import com.tasklane.core.scheduler.PriorityScorer;
import com.tasklane.core.scheduler.WavePlanner;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.concurrent.Callable;

/**
 * CLI command: tasklane plan &lt;task-list.json&gt;
 * <p>
 * Prints the wave plan and priority scores for a task list file without storing or executing it.
 */
@Command(name = "plan", mixinStandardHelpOptions = true, description = "Preview the wave plan of a task list file")
@Component
public class PlanCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Task list JSON file")
    private Path file;

    private final WavePlanner planner;
    private final PriorityScorer scorer;
    private final ObjectMapper objectMapper;

    public PlanCommand(WavePlanner planner, PriorityScorer scorer, ObjectMapper objectMapper) {
        this.planner = planner;
        this.scorer = scorer;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        try {
            var tasks = TaskListFiles.read(objectMapper, file).toTasks();
            var plan = planner.plan(tasks, tasks);
            var scores = scorer.scores(tasks);
            var byId = new HashMap<String, Task>();
            tasks.forEach(t -> byId.put(t.id(), t));

            for (var wave : plan.waves()) {
                ConsoleOutput.wave(wave.waveNumber(), wave.taskIds().size() + " task(s)");
                for (String taskId : wave.taskIds()) {
                    System.out.printf("  %-16s score %-4d %s%n", taskId, scores.getOrDefault(taskId, 0),
                            ConsoleOutput.truncate(byId.get(taskId).title(), 40));
                }
            }
            if (plan.deferrals() > 0) {
                ConsoleOutput.info(plan.deferrals() + " placement(s) deferred by file conflicts");
            }
            if (!plan.unplaceable().isEmpty()) {
                plan.unplaceable().forEach((id, deps) ->
                        ConsoleOutput.error(id + " can never run; waiting on " + deps));
                return 1;
            }
            return 0;
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read task list: " + e.getMessage());
            return 2;
        } catch (TasklaneException | IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
