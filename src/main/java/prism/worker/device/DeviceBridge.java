package prism.worker.device;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Shell access to the devices physically attached to this host.
 */
public interface DeviceBridge {

    /** Every device the host currently sees, in any state */
    List<AttachedDevice> attachedDevices() throws IOException;

    /** True when the device is attached and ready for commands */
    default boolean isAttached(String serial) throws IOException {
        for (AttachedDevice device : attachedDevices()) {
            if (device.serial().equals(serial)) {
                return device.isReady();
            }
        }
        return false;
    }

    ShellResult shell(String serial, String command, Duration timeout) throws IOException;

    void push(String serial, Path local, String remote) throws IOException;

    void pull(String serial, String remote, Path local) throws IOException;
}
