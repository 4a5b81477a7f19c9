package com.taskflow.engine.step;

import com.taskflow.core.model.Task;
import com.taskflow.core.model.VariableMap;
import com.taskflow.core.model.WorkflowStep;
import com.taskflow.core.repository.TaskRepository;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Creates a task in the external task store.
 */
public class TaskStepHandler implements StepHandler {

    private final TaskRepository taskRepository;

    public TaskStepHandler(TaskRepository taskRepository) {
        this.taskRepository = taskRepository;
    }

    @Override
    public StepOutput execute(StepContext context) {
        WorkflowStep step = context.step();
        VariableMap config = step.config();

        Task task = taskRepository.create(Task.create(
            nonBlank(config.string("title").orElse(null), step.name()),
            nonBlank(config.string("description").orElse(null), step.description()),
            config.string("type").orElse(null),
            config.string("priority").orElse(null),
            context.variables().uuid("project_id").orElse(null),
            config.uuid("assignee_id").orElse(null),
            context.executedBy(),
            Map.of(
                "workflow_execution_id", String.valueOf(context.executionId()),
                "step_id", step.id().toString()
            )
        ));

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("task_id", task.id().toString());
        output.put("task_title", task.title());
        return StepOutput.completed(output);
    }

    /**
     * A blank configured value falls back to the step's own; the title is never null.
     */
    private static String nonBlank(String configured, String fallback) {
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        return fallback != null ? fallback : "";
    }
}
