package bigo.conductor.exception;

/**
 * Base exception for conductor errors.
 */
public class ConductorException extends RuntimeException {

    private final String errorCode;

    public ConductorException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ConductorException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
