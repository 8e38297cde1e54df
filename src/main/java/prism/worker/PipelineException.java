package prism.worker;

/**
 * One job device could not be traced. Marks that job device failed and
 * leaves its siblings alone.
 */
public class PipelineException extends Exception {

    public enum FailureKind {
        DEVICE_UNREACHABLE,
        CONFIG_NOT_FOUND,
        COLLECTION_FAILED,
        UPLOAD_FAILED,
        PERSIST_FAILED
    }

    private final FailureKind kind;

    public PipelineException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public PipelineException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind kind() {
        return kind;
    }
}
