package com.taskflow.engine.persistence;

import com.taskflow.core.exception.NotFoundException;
import com.taskflow.core.model.Task;
import com.taskflow.core.repository.TaskRepository;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory task store used when no external task system is wired.
 */
public class InMemoryTaskRepository implements TaskRepository {

    private final Map<UUID, Task> tasks = new ConcurrentHashMap<>();

    @Override
    public Task create(Task task) {
        tasks.put(task.id(), task);
        return task;
    }

    @Override
    public Task update(Task task) {
        if (tasks.replace(task.id(), task) == null) {
            throw new NotFoundException("Task", task.id());
        }
        return task;
    }

    @Override
    public Optional<Task> findById(UUID taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }
}
