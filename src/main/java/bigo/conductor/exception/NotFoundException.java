package bigo.conductor.exception;

/**
 * Thrown when a requested ledger record does not exist.
 */
public class NotFoundException extends ConductorException {

    public static final String ERROR_CODE = "NOT_FOUND";

    public NotFoundException(String entityType, String id) {
        super(ERROR_CODE, String.format("%s not found: %s", entityType, id));
    }
}
