package com.taskflow.engine.action;

import com.taskflow.core.exception.ActionExecutionException;
import com.taskflow.core.model.ActionType;
import com.taskflow.core.model.Task;
import com.taskflow.core.model.VariableMap;
import com.taskflow.core.model.WorkflowAction;
import com.taskflow.core.repository.TaskRepository;

import java.util.Map;

public class CreateTaskActionHandler implements ActionHandler {

    private final TaskRepository taskRepository;

    public CreateTaskActionHandler(TaskRepository taskRepository) {
        this.taskRepository = taskRepository;
    }

    @Override
    public ActionType type() {
        return ActionType.CREATE_TASK;
    }

    @Override
    public Map<String, Object> execute(WorkflowAction action, ActionContext context) {
        VariableMap params = action.params();
        String title = params.string("title")
            .orElseThrow(() -> new ActionExecutionException(type(), "parameter 'title' is required", false));

        Task task = taskRepository.create(Task.create(
            title,
            params.string("description").orElse(null),
            params.string("type").orElse(null),
            params.string("priority").orElse(null),
            params.uuid("project_id").orElse(null),
            params.uuid("assignee_id").orElse(null),
            context.executedBy(),
            Map.of("workflow_execution_id", String.valueOf(context.executionId()))
        ));

        return Map.of(
            "task_id", task.id().toString(),
            "task_title", task.title()
        );
    }
}
