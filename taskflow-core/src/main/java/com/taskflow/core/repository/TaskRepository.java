package com.taskflow.core.repository;

import com.taskflow.core.model.Task;
import java.util.Optional;
import java.util.UUID;

/**
 * Contract for the external task store.
 */
public interface TaskRepository {

    Task create(Task task);

    /**
     * @throws com.taskflow.core.exception.NotFoundException if the task does not exist
     */
    Task update(Task task);

    Optional<Task> findById(UUID taskId);
}
