package prism.coordinator.config;

import prism.common.config.IniSettings;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration holder for Coordinator settings.
 * All settings have sensible defaults; an INI file and then
 * {@code PRISM_*} environment variables override them.
 */
public final class CoordinatorConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/prism;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";

    // Worker host auth: when enabled, /internal/v1 requires a registered host key
    private boolean hostAuthEnabled = false;

    // Device liveness
    private Duration deviceLivenessWindow = Duration.ofSeconds(30);
    private Duration livenessDecayInterval = Duration.ofSeconds(10);

    // Progress stream
    private Duration streamPollInterval = Duration.ofSeconds(1);
    private int streamMaxIdleHeartbeats = 60;
    private int streamThreads = 4;

    // Object storage
    private String storageRoot = "./data/objects";

    private CoordinatorConfig() {
    }

    public static CoordinatorConfig defaults() {
        return new CoordinatorConfig();
    }

    public static CoordinatorConfig fromEnv() {
        CoordinatorConfig config = new CoordinatorConfig();
        config.applyEnv();
        return config;
    }

    /**
     * Load settings from the {@code [coordinator]} section of an INI file,
     * then apply environment overrides.
     */
    public static CoordinatorConfig fromIni(Path file) throws IOException {
        CoordinatorConfig config = new CoordinatorConfig();
        IniSettings ini = IniSettings.load(file);
        String s = "coordinator";

        ini.string(s, "database_url").ifPresent(v -> config.databaseUrl = v);
        ini.integer(s, "database_pool_size").ifPresent(v -> config.databasePoolSize = v);
        ini.string(s, "host").ifPresent(v -> config.serverHost = v);
        ini.integer(s, "port").ifPresent(v -> config.serverPort = v);
        ini.bool(s, "host_auth").ifPresent(v -> config.hostAuthEnabled = v);
        ini.seconds(s, "device_liveness_window").ifPresent(v -> config.deviceLivenessWindow = v);
        ini.seconds(s, "liveness_decay_interval").ifPresent(v -> config.livenessDecayInterval = v);
        ini.seconds(s, "stream_poll_interval").ifPresent(v -> config.streamPollInterval = v);
        ini.integer(s, "stream_max_idle_heartbeats").ifPresent(v -> config.streamMaxIdleHeartbeats = v);
        ini.integer(s, "stream_threads").ifPresent(v -> config.streamThreads = v);
        ini.string(s, "storage_root").ifPresent(v -> config.storageRoot = v);

        config.applyEnv();
        return config;
    }

    private void applyEnv() {
        String dbUrl = System.getenv("PRISM_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            databaseUrl = dbUrl;
        }

        String port = System.getenv("PRISM_PORT");
        if (port != null && !port.isBlank()) {
            serverPort = Integer.parseInt(port);
        }

        String hostAuth = System.getenv("PRISM_HOST_AUTH");
        if (hostAuth != null && !hostAuth.isBlank()) {
            hostAuthEnabled = Boolean.parseBoolean(hostAuth);
        }

        String storage = System.getenv("PRISM_STORAGE_ROOT");
        if (storage != null && !storage.isBlank()) {
            storageRoot = storage;
        }
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public boolean hostAuthEnabled() {
        return hostAuthEnabled;
    }

    public Duration deviceLivenessWindow() {
        return deviceLivenessWindow;
    }

    public Duration livenessDecayInterval() {
        return livenessDecayInterval;
    }

    public Duration streamPollInterval() {
        return streamPollInterval;
    }

    public int streamMaxIdleHeartbeats() {
        return streamMaxIdleHeartbeats;
    }

    public int streamThreads() {
        return streamThreads;
    }

    public String storageRoot() {
        return storageRoot;
    }

    // Fluent setters for testing/customization
    public CoordinatorConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public CoordinatorConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public CoordinatorConfig withHostAuth(boolean enabled) {
        this.hostAuthEnabled = enabled;
        return this;
    }

    public CoordinatorConfig withDeviceLivenessWindow(Duration window) {
        this.deviceLivenessWindow = window;
        return this;
    }

    public CoordinatorConfig withStreamPollInterval(Duration interval) {
        this.streamPollInterval = interval;
        return this;
    }

    public CoordinatorConfig withStreamMaxIdleHeartbeats(int heartbeats) {
        this.streamMaxIdleHeartbeats = heartbeats;
        return this;
    }

    public CoordinatorConfig withStorageRoot(String root) {
        this.storageRoot = root;
        return this;
    }

    @Override
    public String toString() {
        return "CoordinatorConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", hostAuth=" + hostAuthEnabled +
                ", livenessWindow=" + deviceLivenessWindow +
                ", storageRoot='" + storageRoot + '\'' +
                '}';
    }
}
