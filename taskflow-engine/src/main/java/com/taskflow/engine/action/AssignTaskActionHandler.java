package com.taskflow.engine.action;

import com.taskflow.core.exception.ActionExecutionException;
import com.taskflow.core.model.ActionType;
import com.taskflow.core.model.Task;
import com.taskflow.core.model.WorkflowAction;
import com.taskflow.core.repository.TaskRepository;

import java.util.Map;
import java.util.UUID;

public class AssignTaskActionHandler implements ActionHandler {

    private final TaskRepository taskRepository;

    public AssignTaskActionHandler(TaskRepository taskRepository) {
        this.taskRepository = taskRepository;
    }

    @Override
    public ActionType type() {
        return ActionType.ASSIGN_TASK;
    }

    @Override
    public Map<String, Object> execute(WorkflowAction action, ActionContext context) {
        Task task = TaskActionSupport.loadTask(taskRepository, action, context);
        UUID assignee = action.params().uuid("assignee_id")
            .orElseThrow(() -> new ActionExecutionException(type(), "parameter 'assignee_id' is required", false));

        Task updated = taskRepository.update(task.withAssignee(assignee));

        return Map.of(
            "task_id", updated.id().toString(),
            "assigned_to", assignee.toString()
        );
    }
}
