package prism.coordinator.config;

import prism.coordinator.api.internal.v1.ArtifactController;
import prism.coordinator.api.internal.v1.HostDeviceController;
import prism.coordinator.api.internal.v1.WorkQueueController;
import prism.coordinator.api.v1.*;
import prism.coordinator.repository.*;
import prism.coordinator.scheduler.Scheduler;
import prism.coordinator.server.CoordinatorServer;
import prism.coordinator.server.RouterHandler;
import prism.coordinator.service.*;
import prism.coordinator.storage.FileSystemObjectStore;
import prism.coordinator.storage.ObjectStore;
import prism.coordinator.store.*;
import prism.coordinator.stream.ProgressStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Manual dependency injection container.
 * Creates and wires all coordinator dependencies; nothing is static.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(CoordinatorConfig.fromEnv());
 * deps.startScheduler(); // liveness decay
 * deps.server().start();
 * // ...
 * deps.close();
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final CoordinatorConfig config;
    private final Database database;

    private final DeviceRepository deviceRepository;
    private final HostRepository hostRepository;
    private final ConfigurationRepository configurationRepository;
    private final JobRepository jobRepository;
    private final JobUpdateRepository jobUpdateRepository;
    private final TraceRepository traceRepository;

    private final DeviceRegistry deviceRegistry;
    private final HostService hostService;
    private final ConfigurationService configurationService;
    private final JobService jobService;
    private final TraceService traceService;
    private final ObjectStore objectStore;
    private final ProgressStream progressStream;

    // Lazy-initialized
    private RouterHandler routerHandler;
    private CoordinatorServer server;
    private Scheduler scheduler;

    private Dependencies(CoordinatorConfig config) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);
        this.objectStore = new FileSystemObjectStore(Path.of(config.storageRoot()));

        // Repositories
        this.deviceRepository = new JdbcDeviceRepository(database);
        this.hostRepository = new JdbcHostRepository(database);
        this.configurationRepository = new JdbcConfigurationRepository(database);
        this.jobRepository = new JdbcJobRepository(database);
        this.jobUpdateRepository = new JdbcJobUpdateRepository(database);
        this.traceRepository = new JdbcTraceRepository(database);

        // Services
        this.deviceRegistry = new DeviceRegistry(deviceRepository);
        this.hostService = new HostService(hostRepository);
        this.configurationService = new ConfigurationService(configurationRepository);
        this.jobService = new JobService(jobRepository, jobUpdateRepository, configurationRepository,
                deviceRepository);
        this.traceService = new TraceService(traceRepository);
        this.progressStream = new ProgressStream(jobService, deviceRegistry, RouterHandler.mapper(),
                config.streamPollInterval(), config.streamMaxIdleHeartbeats(), config.streamThreads());

        log.info("Dependencies initialized successfully");
    }

    public static Dependencies create(CoordinatorConfig config) {
        return new Dependencies(config);
    }

    public static Dependencies create() {
        return create(CoordinatorConfig.fromEnv());
    }

    // Getters
    public CoordinatorConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public DeviceRegistry deviceRegistry() {
        return deviceRegistry;
    }

    public HostService hostService() {
        return hostService;
    }

    public ConfigurationService configurationService() {
        return configurationService;
    }

    public JobService jobService() {
        return jobService;
    }

    public TraceService traceService() {
        return traceService;
    }

    public ObjectStore objectStore() {
        return objectStore;
    }

    public ProgressStream progressStream() {
        return progressStream;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler(config, hostService)
                    // public API
                    .registerController(new HealthController(database, deviceRegistry, progressStream))
                    .registerController(new JobStreamController(progressStream))
                    .registerController(new JobController(jobService, configurationService))
                    .registerController(new ConfigurationController(configurationService))
                    .registerController(new DeviceController(deviceRegistry))
                    .registerController(new HostController(hostService))
                    .registerController(new TraceController(traceService))
                    // worker host API
                    .registerController(new WorkQueueController(jobService))
                    .registerController(new HostDeviceController(deviceRegistry))
                    .registerController(new ArtifactController(configurationService, traceService, objectStore));
            log.info("RouterHandler created with {} controllers", 10);
        }
        return routerHandler;
    }

    /**
     * Get the HTTP server bound to the configured host and port (not started).
     */
    public synchronized CoordinatorServer server() {
        if (server == null) {
            server = new CoordinatorServer(routerHandler(), config.serverHost(), config.serverPort());
        }
        return server;
    }

    public synchronized Scheduler scheduler() {
        if (scheduler == null) {
            scheduler = new Scheduler(deviceRegistry, config);
        }
        return scheduler;
    }

    /**
     * Start the background liveness decay.
     */
    public void startScheduler() {
        scheduler().start();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        if (server != null) {
            try {
                server.stop();
            } catch (RuntimeException e) {
                log.warn("Error stopping server: {}", e.getMessage());
            }
        }

        if (scheduler != null) {
            try {
                scheduler.stop();
            } catch (RuntimeException e) {
                log.warn("Error stopping scheduler: {}", e.getMessage());
            }
        }

        progressStream.close();

        try {
            database.close();
        } catch (RuntimeException e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
