package prism.worker.client;

/**
 * A control-plane call could not be completed.
 * The loop that made the call logs it and retries on its next tick.
 */
public class ControlPlaneException extends RuntimeException {

    private final int statusCode;

    public ControlPlaneException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public ControlPlaneException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /** HTTP status, or -1 when no response was received */
    public int statusCode() {
        return statusCode;
    }
}
