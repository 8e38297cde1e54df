package prism.coordinator.stream;

/**
 * Destination of one subscriber's server-sent event frames.
 */
public interface EventSink {

    /**
     * Write one complete frame.
     *
     * @return false if the subscriber is gone and the frame was dropped
     */
    boolean send(String frame);

    boolean isOpen();

    /**
     * End the stream. Idempotent.
     */
    void close();
}
