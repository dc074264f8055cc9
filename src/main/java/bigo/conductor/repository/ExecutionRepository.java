package bigo.conductor.repository;

import bigo.conductor.model.BackendClass;
import bigo.conductor.model.Execution;

import java.util.List;

/**
 * Repository interface for execution attempts.
 */
public interface ExecutionRepository {

    /** Completed execution count and summed cost of one backend class. */
    record BackendUsage(int executions, double costUsd) {
    }

    /**
     * Save an execution. The referenced task must exist.
     */
    void save(Execution execution);

    /** Attempts of a task, oldest first. */
    List<Execution> findByTaskId(String taskId);

    int count();

    /** Failed attempts are left out: they replaced no hosted work. */
    BackendUsage usageOf(BackendClass backendClass);
}
