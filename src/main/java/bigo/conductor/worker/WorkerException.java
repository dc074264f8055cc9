package bigo.conductor.worker;

/**
 * Transport or process failure of a backend adapter: the backend could not be
 * reached, timed out, or returned something unreadable.
 */
public class WorkerException extends Exception {

    public WorkerException(String message) {
        super(message);
    }

    public WorkerException(String message, Throwable cause) {
        super(message, cause);
    }
}
