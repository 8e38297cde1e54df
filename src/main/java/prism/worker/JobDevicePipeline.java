package prism.worker;

import prism.coordinator.model.Configuration;
import prism.coordinator.model.JobDeviceStatus;
import prism.coordinator.model.PendingJobDevice;
import prism.coordinator.model.Trace;
import prism.coordinator.storage.ObjectStore;
import prism.worker.PipelineException.FailureKind;
import prism.worker.client.ControlPlane;
import prism.worker.client.ControlPlaneException;
import prism.worker.collect.TraceCollector;
import prism.worker.collect.TraceCollector.CollectedTrace;
import prism.worker.device.DeviceBridge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.time.Clock;
import java.util.UUID;
import java.util.function.Function;

/**
 * Traces one claimed job device end to end:
 * attachment check, configuration, collection, upload, trace row, completion.
 * Every step reports progress as a job update; any failure marks the job
 * device failed with the captured message.
 */
public class JobDevicePipeline {

    private static final Logger log = LoggerFactory.getLogger(JobDevicePipeline.class);

    static final String STARTING = "starting";
    static final String RUNNING = "running";
    static final String UPLOADING = "uploading";
    static final String COMPLETED = "completed";
    static final String FAILED = "failed";

    private final ControlPlane controlPlane;
    private final DeviceBridge bridge;
    private final TraceCollector collector;
    private final Function<String, String> deviceNames;
    private final Clock clock;

    /**
     * @param deviceNames display name for a serial, used in the trace name
     */
    public JobDevicePipeline(ControlPlane controlPlane, DeviceBridge bridge, TraceCollector collector,
            Function<String, String> deviceNames, Clock clock) {
        this.controlPlane = controlPlane;
        this.bridge = bridge;
        this.collector = collector;
        this.deviceNames = deviceNames;
        this.clock = clock;
    }

    /**
     * Run the pipeline for a job device this host has already claimed.
     *
     * @return true when the job device completed
     */
    public boolean run(PendingJobDevice item) {
        try {
            Trace trace = execute(item);
            controlPlane.finishJobDevice(item.jobDeviceId(), JobDeviceStatus.COMPLETED);
            update(item, COMPLETED, "Trace collected successfully", trace.id());
            log.info("Job device {} completed with trace {}", item.jobDeviceId(), trace.id());
            return true;
        } catch (PipelineException e) {
            log.warn("Job device {} failed ({}): {}", item.jobDeviceId(), e.kind(), e.getMessage());
            fail(item, e.getMessage());
            return false;
        } catch (ControlPlaneException e) {
            log.error("Job device {} could not be finished: {}", item.jobDeviceId(), e.getMessage());
            fail(item, e.getMessage());
            return false;
        } catch (RuntimeException e) {
            log.error("Job device {} pipeline error", item.jobDeviceId(), e);
            fail(item, e.toString());
            return false;
        }
    }

    private Trace execute(PendingJobDevice item) throws PipelineException {
        String serial = item.deviceSerial();
        try {
            if (!bridge.isAttached(serial)) {
                throw new PipelineException(FailureKind.DEVICE_UNREACHABLE, "Device " + serial + " is not attached");
            }
        } catch (IOException e) {
            throw new PipelineException(FailureKind.DEVICE_UNREACHABLE,
                    "Device " + serial + " is unreachable: " + e.getMessage(), e);
        }
        update(item, STARTING, "Starting trace on " + serial, null);

        Configuration configuration = controlPlane.configuration(item.configId())
                .orElseThrow(() -> new PipelineException(FailureKind.CONFIG_NOT_FOUND,
                        "Configuration not found: " + item.configId()));
        update(item, RUNNING, "Collecting trace...", null);

        CollectedTrace collected;
        try {
            collected = collector.collect(serial, configuration, item.duration());
        } catch (IOException e) {
            throw new PipelineException(FailureKind.COLLECTION_FAILED, "Trace collection failed: " + e.getMessage(), e);
        }

        try {
            update(item, UPLOADING, "Uploading trace...", null);
            String objectName = objectName(configuration, collected.extension());
            try {
                controlPlane.upload(ObjectStore.TRACES_BUCKET, objectName, Files.readAllBytes(collected.file()));
            } catch (IOException | ControlPlaneException e) {
                throw new PipelineException(FailureKind.UPLOAD_FAILED, "Upload failed: " + e.getMessage(), e);
            }

            try {
                return controlPlane.createTrace(
                        configuration.name() + " - " + deviceNames.apply(serial),
                        objectName,
                        item.deviceId(),
                        configuration.id(),
                        clock.instant());
            } catch (ControlPlaneException e) {
                throw new PipelineException(FailureKind.PERSIST_FAILED,
                        "Could not record trace " + objectName + ": " + e.getMessage(), e);
            }
        } finally {
            deleteQuietly(collected);
        }
    }

    /** {@code <uuid>-<config_name>.<ext>}, with the name reduced to path-safe characters */
    static String objectName(Configuration configuration, String extension) {
        String safeName = configuration.name().replaceAll("[^A-Za-z0-9._-]", "_");
        return UUID.randomUUID() + "-" + safeName + "." + extension;
    }

    private void fail(PendingJobDevice item, String message) {
        try {
            controlPlane.finishJobDevice(item.jobDeviceId(), JobDeviceStatus.FAILED);
        } catch (ControlPlaneException e) {
            log.error("Could not mark job device {} failed: {}", item.jobDeviceId(), e.getMessage());
        }
        update(item, FAILED, "Error: " + message, null);
    }

    /** Progress updates are best effort; a lost one does not fail the trace */
    private void update(PendingJobDevice item, String status, String message, String traceId) {
        try {
            controlPlane.postUpdate(item.jobId(), item.deviceId(), status, message, traceId);
        } catch (ControlPlaneException e) {
            log.warn("Could not post {} update for job {}: {}", status, item.jobId(), e.getMessage());
        }
    }

    private static void deleteQuietly(CollectedTrace collected) {
        try {
            Files.deleteIfExists(collected.file());
        } catch (IOException e) {
            log.warn("Could not delete local trace {}: {}", collected.file(), e.getMessage());
        }
    }
}
