package bigo.conductor.repository;

import bigo.conductor.model.Task;
import bigo.conductor.model.TaskStatus;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Repository interface for Task persistence.
 */
public interface TaskRepository {

    /**
     * Save a new task.
     *
     * @param task the task to save
     */
    void save(Task task);

    /**
     * Find a task by ID.
     *
     * @param taskId the task ID
     * @return the task if found
     */
    Optional<Task> findById(String taskId);

    /**
     * Move a task to a new status, but only if its current status is one of the expected ones.
     * Always refreshes {@code updated_at} on success.
     *
     * @param taskId   the task ID
     * @param expected statuses the task may currently be in
     * @param target   new status
     * @return true if the row was updated, false if the task is missing or in another status
     */
    boolean updateStatus(String taskId, Set<TaskStatus> expected, TaskStatus target);

    /**
     * Most recently created tasks first.
     */
    List<Task> findRecent(int limit);

    int count();

    int countByStatuses(Set<TaskStatus> statuses);
}
