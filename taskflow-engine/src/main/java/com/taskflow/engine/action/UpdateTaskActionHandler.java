package com.taskflow.engine.action;

import com.taskflow.core.model.ActionType;
import com.taskflow.core.model.Task;
import com.taskflow.core.model.VariableMap;
import com.taskflow.core.model.WorkflowAction;
import com.taskflow.core.repository.TaskRepository;

import java.util.Map;

public class UpdateTaskActionHandler implements ActionHandler {

    private final TaskRepository taskRepository;

    public UpdateTaskActionHandler(TaskRepository taskRepository) {
        this.taskRepository = taskRepository;
    }

    @Override
    public ActionType type() {
        return ActionType.UPDATE_TASK;
    }

    @Override
    public Map<String, Object> execute(WorkflowAction action, ActionContext context) {
        Task task = TaskActionSupport.loadTask(taskRepository, action, context);
        VariableMap params = action.params();

        Task updated = taskRepository.update(task.patch(
            params.string("title").orElse(null),
            params.string("description").orElse(null),
            params.string("status").orElse(null),
            params.string("priority").orElse(null)
        ));

        return Map.of(
            "task_id", updated.id().toString(),
            "task_status", updated.status()
        );
    }
}
