package prism.worker.device;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory device bridge. Shell commands are recorded; pulls write a
 * fixed payload; {@code getprop ro.product.model} answers "Model-&lt;serial&gt;".
 */
public class FakeDeviceBridge implements DeviceBridge {

    public final Set<String> attached = ConcurrentHashMap.newKeySet();
    public final List<String> commands = new CopyOnWriteArrayList<>();
    public final Map<String, String> pushed = new ConcurrentHashMap<>();
    public volatile ShellResult toolResult = new ShellResult(0, "");
    public volatile byte[] pulledContent = "trace-bytes".getBytes(StandardCharsets.UTF_8);

    public FakeDeviceBridge(String... serials) {
        attached.addAll(List.of(serials));
    }

    @Override
    public List<AttachedDevice> attachedDevices() {
        List<AttachedDevice> devices = new ArrayList<>();
        for (String serial : attached) {
            devices.add(new AttachedDevice(serial, AttachedDevice.READY));
        }
        return devices;
    }

    @Override
    public ShellResult shell(String serial, String command, Duration timeout) throws IOException {
        requireAttached(serial);
        commands.add(serial + ": " + command);
        if (command.equals("getprop ro.product.model")) {
            return new ShellResult(0, "Model-" + serial + "\n");
        }
        if (command.startsWith("rm ")) {
            return new ShellResult(0, "");
        }
        return toolResult;
    }

    @Override
    public void push(String serial, Path local, String remote) throws IOException {
        requireAttached(serial);
        pushed.put(remote, Files.readString(local));
    }

    @Override
    public void pull(String serial, String remote, Path local) throws IOException {
        requireAttached(serial);
        Files.write(local, pulledContent);
    }

    private void requireAttached(String serial) throws IOException {
        if (!attached.contains(serial)) {
            throw new IOException("device '" + serial + "' not found");
        }
    }
}
