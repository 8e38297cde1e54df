package prism.worker.client;

import prism.coordinator.model.ClaimResult;
import prism.coordinator.model.Configuration;
import prism.coordinator.model.Device;
import prism.coordinator.model.DeviceStatus;
import prism.coordinator.model.JobDeviceStatus;
import prism.coordinator.model.JobRequest;
import prism.coordinator.model.JobStatus;
import prism.coordinator.model.PendingJobDevice;
import prism.coordinator.model.Trace;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Everything a worker asks of the coordinator.
 * Transport failures surface as {@link ControlPlaneException}.
 */
public interface ControlPlane {

    /** Claimable job devices, oldest job first */
    List<PendingJobDevice> pendingWork();

    /** Try to take a pending job device for this host */
    ClaimResult claim(String jobDeviceId);

    /** Move a running job device to completed or failed */
    void finishJobDevice(String jobDeviceId, JobDeviceStatus status);

    void postUpdate(String jobId, String deviceId, String status, String message, String traceId);

    Optional<JobRequest> job(String jobId);

    void postJobStatus(String jobId, JobStatus status, String resultSummary);

    /** Upsert a device by serial and record its liveness under this host */
    Device reportDevice(String serial, String name, DeviceStatus status);

    /** Mark this host's devices that are not in {@code observed} offline */
    int sweep(Collection<String> observed);

    Optional<Configuration> configuration(String configId);

    void upload(String bucket, String objectName, byte[] content);

    Trace createTrace(String name, String filename, String deviceId, String configurationId, Instant timestamp);
}
