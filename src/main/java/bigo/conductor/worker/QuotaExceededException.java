package bigo.conductor.worker;

/**
 * The backend refused work for quota, credit or payment reasons.
 */
public class QuotaExceededException extends WorkerException {

    public QuotaExceededException(String message) {
        super(message);
    }

    public QuotaExceededException(String message, Throwable cause) {
        super(message, cause);
    }
}
