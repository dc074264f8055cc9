package bigo.conductor.exception;

/**
 * Thrown when the ledger cannot be read or written.
 */
public class LedgerException extends ConductorException {

    public static final String ERROR_CODE = "LEDGER_ERROR";

    public LedgerException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
