package com.taskflow.engine.action;

import com.taskflow.core.exception.ActionExecutionException;
import com.taskflow.core.exception.NotFoundException;
import com.taskflow.core.model.Task;
import com.taskflow.core.model.WorkflowAction;
import com.taskflow.core.repository.TaskRepository;

import java.util.UUID;

/**
 * Task id lookup shared by the update and assign handlers:
 * the action target, then the {@code task_id} parameter, then the {@code task_id} variable.
 */
final class TaskActionSupport {

    static final String TASK_ID = "task_id";

    private TaskActionSupport() {
    }

    static Task loadTask(TaskRepository taskRepository, WorkflowAction action, ActionContext context) {
        UUID taskId = resolveTaskId(action, context);
        return taskRepository.findById(taskId)
            .orElseThrow(() -> new NotFoundException("Task", taskId));
    }

    private static UUID resolveTaskId(WorkflowAction action, ActionContext context) {
        if (action.hasTarget()) {
            try {
                return UUID.fromString(action.target());
            } catch (IllegalArgumentException e) {
                throw new ActionExecutionException(action.type(),
                    "target '" + action.target() + "' is not a task id", false);
            }
        }
        return action.params().uuid(TASK_ID)
            .or(() -> context.variables().uuid(TASK_ID))
            .orElseThrow(() -> new ActionExecutionException(action.type(), "no task id given", false));
    }
}
