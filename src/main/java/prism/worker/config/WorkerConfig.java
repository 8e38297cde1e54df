package prism.worker.config;

import prism.common.config.IniSettings;

import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration holder for a worker host.
 * All settings have sensible defaults; an INI file ({@code [worker]} section)
 * and then {@code PRISM_*} environment variables override them.
 */
public final class WorkerConfig {

    private String hostName = defaultHostName();
    private String coordinatorUrl = "http://localhost:8080";
    private String hostKey = null;

    // Loops
    private Duration livenessInterval = Duration.ofSeconds(5);
    private Duration workInterval = Duration.ofSeconds(5);
    private int maxParallelTraces = 4;
    private Duration shutdownGrace = Duration.ofSeconds(30);

    // Control plane HTTP
    private Duration requestTimeout = Duration.ofSeconds(30);

    // Device tools
    private String adbPath = "adb";
    private Duration collectSlack = Duration.ofSeconds(60);
    private String workDir = "./data/worker";

    private WorkerConfig() {
    }

    public static WorkerConfig defaults() {
        return new WorkerConfig();
    }

    public static WorkerConfig fromEnv() {
        WorkerConfig config = new WorkerConfig();
        config.applyEnv();
        return config;
    }

    public static WorkerConfig fromIni(Path file) throws IOException {
        WorkerConfig config = new WorkerConfig();
        IniSettings ini = IniSettings.load(file);
        String s = "worker";

        ini.string(s, "host_name").ifPresent(v -> config.hostName = v);
        ini.string(s, "coordinator_url").ifPresent(v -> config.coordinatorUrl = v);
        ini.string(s, "host_key").ifPresent(v -> config.hostKey = v);
        ini.seconds(s, "liveness_interval").ifPresent(v -> config.livenessInterval = v);
        ini.seconds(s, "work_interval").ifPresent(v -> config.workInterval = v);
        ini.integer(s, "max_parallel_traces").ifPresent(v -> config.maxParallelTraces = v);
        ini.seconds(s, "shutdown_grace").ifPresent(v -> config.shutdownGrace = v);
        ini.seconds(s, "request_timeout").ifPresent(v -> config.requestTimeout = v);
        ini.string(s, "adb_path").ifPresent(v -> config.adbPath = v);
        ini.seconds(s, "collect_slack").ifPresent(v -> config.collectSlack = v);
        ini.string(s, "work_dir").ifPresent(v -> config.workDir = v);

        config.applyEnv();
        config.validate();
        return config;
    }

    private void applyEnv() {
        String host = System.getenv("PRISM_HOST_NAME");
        if (host != null && !host.isBlank()) {
            hostName = host;
        }

        String url = System.getenv("PRISM_COORDINATOR_URL");
        if (url != null && !url.isBlank()) {
            coordinatorUrl = url;
        }

        String key = System.getenv("PRISM_HOST_KEY");
        if (key != null && !key.isBlank()) {
            hostKey = key;
        }

        String parallel = System.getenv("PRISM_MAX_PARALLEL_TRACES");
        if (parallel != null && !parallel.isBlank()) {
            maxParallelTraces = Integer.parseInt(parallel);
        }
    }

    private void validate() {
        if (maxParallelTraces <= 0) {
            throw new IllegalArgumentException("max_parallel_traces must be positive");
        }
        if (hostName == null || hostName.isBlank()) {
            throw new IllegalArgumentException("host_name is required");
        }
    }

    private static String defaultHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "worker";
        }
    }

    // Getters
    public String hostName() {
        return hostName;
    }

    public String coordinatorUrl() {
        return coordinatorUrl;
    }

    public String hostKey() {
        return hostKey;
    }

    public boolean hasHostKey() {
        return hostKey != null && !hostKey.isBlank();
    }

    public Duration livenessInterval() {
        return livenessInterval;
    }

    public Duration workInterval() {
        return workInterval;
    }

    public int maxParallelTraces() {
        return maxParallelTraces;
    }

    public Duration shutdownGrace() {
        return shutdownGrace;
    }

    public Duration requestTimeout() {
        return requestTimeout;
    }

    public String adbPath() {
        return adbPath;
    }

    public Duration collectSlack() {
        return collectSlack;
    }

    public Path workDir() {
        return Path.of(workDir);
    }

    // Fluent setters for testing/customization
    public WorkerConfig withHostName(String name) {
        this.hostName = name;
        return this;
    }

    public WorkerConfig withCoordinatorUrl(String url) {
        this.coordinatorUrl = url;
        return this;
    }

    public WorkerConfig withHostKey(String key) {
        this.hostKey = key;
        return this;
    }

    public WorkerConfig withMaxParallelTraces(int max) {
        if (max <= 0) {
            throw new IllegalArgumentException("max_parallel_traces must be positive");
        }
        this.maxParallelTraces = max;
        return this;
    }

    public WorkerConfig withLivenessInterval(Duration interval) {
        this.livenessInterval = interval;
        return this;
    }

    public WorkerConfig withWorkInterval(Duration interval) {
        this.workInterval = interval;
        return this;
    }

    public WorkerConfig withShutdownGrace(Duration grace) {
        this.shutdownGrace = grace;
        return this;
    }

    public WorkerConfig withWorkDir(String dir) {
        this.workDir = dir;
        return this;
    }

    @Override
    public String toString() {
        return "WorkerConfig{" +
                "host='" + hostName + '\'' +
                ", coordinator='" + coordinatorUrl + '\'' +
                ", hostKeySet=" + hasHostKey() +
                ", maxParallelTraces=" + maxParallelTraces +
                ", liveness=" + livenessInterval +
                ", work=" + workInterval +
                '}';
    }
}
