package prism.worker.collect;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import prism.coordinator.model.Configuration;
import prism.worker.device.DeviceBridge;
import prism.worker.device.ShellResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.UUID;

/**
 * Collects perfetto and simpleperf traces through a {@link DeviceBridge}.
 *
 * Perfetto: the config text is pushed with a {@code duration_ms} line
 * prepended, run with {@code perfetto --txt}, then the trace is pulled.
 * Simpleperf: the config text is JSON ({@link SimpleperfOptions}).
 * Device-side files are removed afterwards either way.
 */
public class AdbTraceCollector implements TraceCollector {

    private static final Logger log = LoggerFactory.getLogger(AdbTraceCollector.class);

    static final String PERFETTO_CONFIG_DIR = "/data/misc/perfetto-configs";
    static final String PERFETTO_TRACE_DIR = "/data/misc/perfetto-traces";
    static final String SIMPLEPERF_DIR = "/data/local/tmp";

    private final DeviceBridge bridge;
    private final Path workDir;
    private final Duration slack;
    private final ObjectMapper json = new ObjectMapper();

    public AdbTraceCollector(DeviceBridge bridge, Path workDir, Duration slack) {
        this.bridge = bridge;
        this.workDir = workDir;
        this.slack = slack;
    }

    @Override
    public CollectedTrace collect(String serial, Configuration configuration, int durationSeconds)
            throws IOException {
        Files.createDirectories(workDir);
        String token = UUID.randomUUID().toString().substring(0, 8);
        return switch (configuration.tool()) {
            case Configuration.PERFETTO -> collectPerfetto(serial, configuration, durationSeconds, token);
            case Configuration.SIMPLEPERF -> collectSimpleperf(serial, configuration, durationSeconds, token);
            default -> throw new IOException("Unsupported tracing tool: " + configuration.tool());
        };
    }

    private CollectedTrace collectPerfetto(String serial, Configuration configuration, int durationSeconds,
            String token) throws IOException {
        Path localConfig = workDir.resolve("perfetto_config_" + token + ".pbtxt");
        Path localTrace = workDir.resolve("trace_" + token + ".perfetto-trace");
        String remoteConfig = PERFETTO_CONFIG_DIR + "/perfetto_config_" + token + ".pbtxt";
        String remoteTrace = PERFETTO_TRACE_DIR + "/trace_" + token + ".perfetto-trace";

        Files.writeString(localConfig, perfettoConfigText(configuration.text(), durationSeconds),
                StandardCharsets.UTF_8);
        try {
            bridge.push(serial, localConfig, remoteConfig);
            log.info("Recording perfetto trace on {} for {}s", serial, durationSeconds);
            ShellResult result = bridge.shell(serial,
                    "perfetto -c " + remoteConfig + " -o " + remoteTrace + " --txt",
                    Duration.ofSeconds(durationSeconds).plus(slack));
            if (!result.succeeded()) {
                throw new IOException("perfetto exited with " + result.exitCode() + ": " + result.output().trim());
            }
            bridge.pull(serial, remoteTrace, localTrace);
        } finally {
            Files.deleteIfExists(localConfig);
            cleanUp(serial, remoteConfig + " " + remoteTrace);
        }
        return verified(localTrace, "perfetto-trace");
    }

    private CollectedTrace collectSimpleperf(String serial, Configuration configuration, int durationSeconds,
            String token) throws IOException {
        SimpleperfOptions options;
        try {
            options = json.readValue(configuration.text(), SimpleperfOptions.class);
        } catch (JsonProcessingException e) {
            throw new IOException("Invalid simpleperf configuration: " + e.getOriginalMessage(), e);
        }
        String remoteTrace = SIMPLEPERF_DIR + "/perf_" + token + ".data";
        Path localTrace = workDir.resolve("simpleperf_" + token + ".data");

        try {
            log.info("Recording simpleperf trace on {} for {}s", serial, durationSeconds);
            ShellResult result = bridge.shell(serial,
                    String.join(" ", options.commandLine(remoteTrace, durationSeconds)),
                    Duration.ofSeconds(durationSeconds).plus(slack));
            if (!result.succeeded()) {
                throw new IOException("simpleperf exited with " + result.exitCode() + ": " + result.output().trim());
            }
            bridge.pull(serial, remoteTrace, localTrace);
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid simpleperf configuration: " + e.getMessage(), e);
        } finally {
            cleanUp(serial, remoteTrace);
        }
        return verified(localTrace, "data");
    }

    /** Prepend the trace length so perfetto stops on its own */
    static String perfettoConfigText(String text, int durationSeconds) {
        return "duration_ms: " + (durationSeconds * 1000L) + "\n" + text;
    }

    private static CollectedTrace verified(Path file, String extension) throws IOException {
        if (!Files.exists(file) || Files.size(file) == 0) {
            throw new IOException("Trace file was not created or is empty");
        }
        return new CollectedTrace(file, extension);
    }

    private void cleanUp(String serial, String paths) {
        try {
            bridge.shell(serial, "rm -f " + paths, Duration.ofSeconds(15));
        } catch (IOException e) {
            log.warn("Could not remove {} from {}: {}", paths, serial, e.getMessage());
        }
    }
}
