package prism.coordinator.scheduler;

import prism.coordinator.config.CoordinatorConfig;
import prism.coordinator.service.DeviceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Coordinates background scheduled tasks:
 * - liveness decay: devices not seen within the liveness window go offline
 *
 * Uses a single-threaded executor to avoid concurrency issues.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final DeviceRegistry deviceRegistry;
    private final CoordinatorConfig config;

    private volatile boolean running = false;

    public Scheduler(DeviceRegistry deviceRegistry, CoordinatorConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "prism-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.deviceRegistry = deviceRegistry;
        this.config = config;
    }

    /**
     * Start the scheduler.
     */
    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        long decayIntervalMs = config.livenessDecayInterval().toMillis();
        executor.scheduleAtFixedRate(
                wrapRunnable("liveness-decay", this::decayLiveness),
                decayIntervalMs,
                decayIntervalMs,
                TimeUnit.MILLISECONDS);
        log.info("Liveness decay scheduled every {}ms (window {})", decayIntervalMs, config.deviceLivenessWindow());

        log.info("Scheduler started");
    }

    /**
     * Run one liveness decay pass.
     *
     * @return number of devices marked offline
     */
    public int decayLiveness() {
        return deviceRegistry.decayStale(config.deviceLivenessWindow());
    }

    /**
     * Stop the scheduler gracefully.
     */
    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}
