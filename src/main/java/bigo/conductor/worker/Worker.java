package bigo.conductor.worker;

import bigo.conductor.model.Backend;
import bigo.conductor.model.ExecutionResult;
import bigo.conductor.model.Task;

/**
 * Execution backend handle. One handle serves one backend.
 */
public interface Worker {

    Backend backend();

    /** Whether the backend reports itself ready to take work. */
    boolean available();

    /**
     * Run the task. A backend that answered but failed the task returns a result
     * with {@code success == false}.
     *
     * @throws WorkerException if the backend could not be reached or the call timed out
     */
    ExecutionResult execute(ExecutionContext ctx, Task task) throws WorkerException;

    /**
     * Cheap pre-flight probe.
     *
     * @throws QuotaExceededException if the backend refuses work for quota or payment reasons
     * @throws WorkerException        for any other probe failure
     */
    void checkQuota(ExecutionContext ctx) throws WorkerException;
}
