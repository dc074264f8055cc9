package bigo.conductor.exception;

import bigo.conductor.model.TaskStatus;

/**
 * Thrown when a task status update is not an allowed forward transition.
 */
public class InvalidStateTransitionException extends ConductorException {

    public static final String ERROR_CODE = "INVALID_STATE_TRANSITION";

    public InvalidStateTransitionException(String taskId, TaskStatus currentStatus, TaskStatus targetStatus) {
        super(ERROR_CODE, String.format(
                "Cannot transition task %s from %s to %s",
                taskId, currentStatus, targetStatus));
    }
}
