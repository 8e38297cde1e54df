package prism.worker;

import prism.coordinator.model.ClaimResult;
import prism.coordinator.model.Device;
import prism.coordinator.model.DeviceStatus;
import prism.coordinator.model.JobAggregate;
import prism.coordinator.model.PendingJobDevice;
import prism.worker.client.ControlPlane;
import prism.worker.client.ControlPlaneException;
import prism.worker.collect.TraceCollector;
import prism.worker.config.WorkerConfig;
import prism.worker.device.AttachedDevice;
import prism.worker.device.DeviceBridge;
import prism.worker.device.ShellResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker host agent. Two loops on their own threads:
 * <ul>
 * <li>liveness: report every attached device online and sweep the rest of
 * this host's devices offline</li>
 * <li>work: claim pending job devices attached here, trace them on a bounded
 * pool, then write each touched job's aggregate status</li>
 * </ul>
 * Devices that are tracing are reported {@code busy} and skipped by the
 * liveness loop, but still count as observed for the sweep.
 */
public class WorkerAgent implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerAgent.class);
    private static final Duration PROPERTY_TIMEOUT = Duration.ofSeconds(10);

    private final WorkerConfig config;
    private final ControlPlane controlPlane;
    private final DeviceBridge bridge;
    private final JobDevicePipeline pipeline;

    /** serial -> device id, for devices with a pipeline in flight */
    private final Map<String, String> tracing = new ConcurrentHashMap<>();
    private final Map<String, String> deviceNames = new ConcurrentHashMap<>();
    /** jobs whose aggregate write failed; retried at the start of each work pass */
    private final Set<String> unsettledJobs = ConcurrentHashMap.newKeySet();

    private final ScheduledExecutorService loops;
    private final ExecutorService pipelinePool;

    private volatile boolean running = false;

    public WorkerAgent(WorkerConfig config, ControlPlane controlPlane, DeviceBridge bridge,
            TraceCollector collector) {
        this(config, controlPlane, bridge, collector, Clock.systemUTC());
    }

    public WorkerAgent(WorkerConfig config, ControlPlane controlPlane, DeviceBridge bridge,
            TraceCollector collector, Clock clock) {
        this.config = config;
        this.controlPlane = controlPlane;
        this.bridge = bridge;
        this.pipeline = new JobDevicePipeline(controlPlane, bridge, collector, this::deviceName, clock);

        AtomicInteger loopIds = new AtomicInteger();
        this.loops = Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "prism-worker-loop-" + loopIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        AtomicInteger traceIds = new AtomicInteger();
        this.pipelinePool = Executors.newFixedThreadPool(config.maxParallelTraces(), r -> {
            Thread t = new Thread(r, "prism-trace-" + traceIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start both loops.
     */
    public void start() {
        if (running) {
            log.warn("Worker agent already running");
            return;
        }
        running = true;

        long livenessMs = config.livenessInterval().toMillis();
        loops.scheduleWithFixedDelay(wrapRunnable("liveness", this::runLivenessOnce),
                0, livenessMs, TimeUnit.MILLISECONDS);
        long workMs = config.workInterval().toMillis();
        loops.scheduleWithFixedDelay(wrapRunnable("work", this::runWorkOnce),
                0, workMs, TimeUnit.MILLISECONDS);

        log.info("Worker agent {} started (liveness every {}ms, work every {}ms, {} trace slots)",
                config.hostName(), livenessMs, workMs, config.maxParallelTraces());
    }

    /**
     * Stop both loops, then give in-flight pipelines up to the shutdown grace
     * period to finish.
     */
    public void stop() {
        if (!running) {
            return;
        }
        running = false;

        loops.shutdown();
        pipelinePool.shutdown();
        try {
            long graceMs = config.shutdownGrace().toMillis();
            if (!loops.awaitTermination(graceMs, TimeUnit.MILLISECONDS)
                    | !pipelinePool.awaitTermination(graceMs, TimeUnit.MILLISECONDS)) {
                loops.shutdownNow();
                pipelinePool.shutdownNow();
                log.warn("Worker agent forcefully stopped with {} traces in flight", tracing.size());
            } else {
                log.info("Worker agent stopped gracefully");
            }
        } catch (InterruptedException e) {
            loops.shutdownNow();
            pipelinePool.shutdownNow();
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

    /**
     * One liveness pass.
     *
     * @return number of devices reported online
     */
    public int runLivenessOnce() {
        List<AttachedDevice> attached;
        try {
            attached = bridge.attachedDevices();
        } catch (IOException e) {
            log.warn("Device scan failed: {}", e.getMessage());
            return 0;
        }

        Set<String> observed = new LinkedHashSet<>();
        int reported = 0;
        for (AttachedDevice device : attached) {
            if (!device.isReady() || tracing.containsKey(device.serial())) {
                continue;
            }
            try {
                Device registered = controlPlane.reportDevice(device.serial(), deviceName(device.serial()),
                        DeviceStatus.ONLINE);
                observed.add(registered.id());
                reported++;
            } catch (ControlPlaneException e) {
                log.warn("Liveness report for {} failed: {}", device.serial(), e.getMessage());
                observed.add(device.serial());
            }
        }
        observed.addAll(tracing.values());

        try {
            int swept = controlPlane.sweep(observed);
            if (swept > 0) {
                log.info("Swept {} devices offline on {}", swept, config.hostName());
            }
        } catch (ControlPlaneException e) {
            log.warn("Sweep failed: {}", e.getMessage());
        }
        return reported;
    }

    /**
     * One work pass: claim, trace, wait for the batch, write aggregates.
     *
     * @return number of job devices this pass claimed
     */
    public int runWorkOnce() {
        retryUnsettled();

        List<PendingJobDevice> pending = controlPlane.pendingWork();
        if (pending.isEmpty()) {
            return 0;
        }

        Set<String> ready;
        try {
            ready = readySerials();
        } catch (IOException e) {
            log.warn("Device scan failed, skipping work pass: {}", e.getMessage());
            return 0;
        }

        int free = config.maxParallelTraces() - tracing.size();
        Set<String> touchedJobs = new LinkedHashSet<>();
        List<Future<Boolean>> batch = new ArrayList<>();

        for (PendingJobDevice item : pending) {
            if (free <= 0) {
                break;
            }
            String serial = item.deviceSerial();
            // reserved before claiming so a concurrent liveness pass reports it busy, not online
            if (!ready.contains(serial) || tracing.putIfAbsent(serial, item.deviceId()) != null) {
                continue;
            }

            ClaimResult claim;
            try {
                claim = controlPlane.claim(item.jobDeviceId());
            } catch (ControlPlaneException e) {
                tracing.remove(serial);
                log.warn("Claim of {} failed: {}", item.jobDeviceId(), e.getMessage());
                continue;
            }
            if (claim != ClaimResult.CLAIMED) {
                tracing.remove(serial);
                log.debug("Claim of {} {}", item.jobDeviceId(), claim);
                continue;
            }

            free--;
            touchedJobs.add(item.jobId());
            markBusy(item);
            batch.add(pipelinePool.submit(() -> {
                try {
                    return pipeline.run(item);
                } finally {
                    tracing.remove(serial);
                }
            }));
        }

        if (batch.isEmpty()) {
            return 0;
        }
        log.info("Claimed {} job devices across {} jobs", batch.size(), touchedJobs.size());

        for (Future<Boolean> future : batch) {
            try {
                future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                unsettledJobs.addAll(touchedJobs);
                return batch.size();
            } catch (ExecutionException e) {
                log.error("Pipeline task failed", e.getCause());
            }
        }

        for (String jobId : touchedJobs) {
            recompute(jobId);
        }
        return batch.size();
    }

    /** Serials currently being traced on this host */
    public Set<String> tracingSerials() {
        return Set.copyOf(tracing.keySet());
    }

    /** Jobs waiting for an aggregate write that failed earlier */
    public Set<String> unsettledJobs() {
        return Set.copyOf(unsettledJobs);
    }

    private void retryUnsettled() {
        for (String jobId : List.copyOf(unsettledJobs)) {
            log.debug("Retrying aggregate update for job {}", jobId);
            recompute(jobId);
        }
    }

    /**
     * Write the job's aggregate once all of its devices are terminal. A job
     * still in progress is left to whichever host finishes its last device.
     */
    private void recompute(String jobId) {
        try {
            controlPlane.job(jobId)
                    .flatMap(JobAggregate::of)
                    .ifPresent(aggregate -> {
                        controlPlane.postJobStatus(jobId, aggregate.status(), aggregate.summary());
                        log.info("Job {} -> {} ({})", jobId, aggregate.status().wireName(), aggregate.summary());
                    });
            unsettledJobs.remove(jobId);
        } catch (ControlPlaneException e) {
            unsettledJobs.add(jobId);
            log.warn("Aggregate update for job {} failed, will retry: {}", jobId, e.getMessage());
        }
    }

    private void markBusy(PendingJobDevice item) {
        try {
            controlPlane.reportDevice(item.deviceSerial(), deviceName(item.deviceSerial()), DeviceStatus.BUSY);
        } catch (ControlPlaneException e) {
            log.warn("Could not mark {} busy: {}", item.deviceSerial(), e.getMessage());
        }
    }

    private Set<String> readySerials() throws IOException {
        Set<String> ready = new HashSet<>();
        for (AttachedDevice device : bridge.attachedDevices()) {
            if (device.isReady()) {
                ready.add(device.serial());
            }
        }
        return ready;
    }

    /** Product model for the serial, cached; the serial itself when unknown */
    private String deviceName(String serial) {
        String cached = deviceNames.get(serial);
        if (cached != null) {
            return cached;
        }
        String name = serial;
        try {
            ShellResult result = bridge.shell(serial, "getprop ro.product.model", PROPERTY_TIMEOUT);
            if (result.succeeded() && !result.output().isBlank()) {
                name = result.output().trim();
                deviceNames.put(serial, name);
            }
        } catch (IOException e) {
            log.debug("Could not read model of {}: {}", serial, e.getMessage());
        }
        return name;
    }

    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} loop error", name, e);
            }
        };
    }
}
