package prism.worker.device;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link DeviceBridge} backed by the {@code adb} command line tool.
 */
public class AdbDeviceBridge implements DeviceBridge {

    private static final Logger log = LoggerFactory.getLogger(AdbDeviceBridge.class);
    private static final Duration LIST_TIMEOUT = Duration.ofSeconds(15);
    private static final Duration TRANSFER_TIMEOUT = Duration.ofMinutes(5);

    private final String adbPath;
    /** One reader per running adb process; idle threads expire */
    private final ExecutorService readers;

    public AdbDeviceBridge(String adbPath) {
        this.adbPath = adbPath;
        AtomicInteger ids = new AtomicInteger();
        this.readers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "prism-adb-reader-" + ids.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public List<AttachedDevice> attachedDevices() throws IOException {
        ShellResult result = run(List.of(adbPath, "devices"), LIST_TIMEOUT);
        if (!result.succeeded()) {
            throw new IOException("adb devices exited with " + result.exitCode() + ": " + result.output().trim());
        }
        return parseDevices(result.output());
    }

    @Override
    public ShellResult shell(String serial, String command, Duration timeout) throws IOException {
        return run(List.of(adbPath, "-s", serial, "shell", command), timeout);
    }

    @Override
    public void push(String serial, Path local, String remote) throws IOException {
        ShellResult result = run(List.of(adbPath, "-s", serial, "push", local.toString(), remote), TRANSFER_TIMEOUT);
        if (!result.succeeded()) {
            throw new IOException("adb push to " + serial + " failed: " + result.output().trim());
        }
    }

    @Override
    public void pull(String serial, String remote, Path local) throws IOException {
        ShellResult result = run(List.of(adbPath, "-s", serial, "pull", remote, local.toString()), TRANSFER_TIMEOUT);
        if (!result.succeeded()) {
            throw new IOException("adb pull from " + serial + " failed: " + result.output().trim());
        }
    }

    /**
     * Parse {@code adb devices} output: a header line, then one
     * {@code <serial>\t<state>} line per device.
     */
    static List<AttachedDevice> parseDevices(String output) {
        List<AttachedDevice> devices = new ArrayList<>();
        String[] lines = output.split("\\R");
        for (String raw : lines) {
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("List of devices") || line.startsWith("*")) {
                continue;
            }
            String[] parts = line.split("\\s+", 2);
            if (parts.length < 2) {
                continue;
            }
            devices.add(new AttachedDevice(parts[0], parts[1].trim()));
        }
        return devices;
    }

    private ShellResult run(List<String> command, Duration timeout) throws IOException {
        log.debug("Running {}", command);
        Process process = new ProcessBuilder(command).redirectErrorStream(true).start();
        CompletableFuture<String> output = CompletableFuture.supplyAsync(
                () -> readAll(process.getInputStream()), readers);
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new IOException("Command timed out after " + timeout.toSeconds() + "s: " + command);
            }
            return new ShellResult(process.exitValue(), output.get(5, TimeUnit.SECONDS));
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while running " + command);
        } catch (ExecutionException | TimeoutException e) {
            throw new IOException("Could not read output of " + command, e);
        }
    }

    private static String readAll(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
