package prism.worker.device;

/**
 * One line of the host's device listing.
 *
 * @param state {@code device} when ready, otherwise e.g. {@code offline} or {@code unauthorized}
 */
public record AttachedDevice(String serial, String state) {

    public static final String READY = "device";

    public boolean isReady() {
        return READY.equals(state);
    }
}
