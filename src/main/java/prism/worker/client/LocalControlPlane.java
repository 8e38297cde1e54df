package prism.worker.client;

import prism.coordinator.config.Dependencies;
import prism.coordinator.model.ClaimResult;
import prism.coordinator.model.Configuration;
import prism.coordinator.model.Device;
import prism.coordinator.model.DeviceStatus;
import prism.coordinator.model.JobDeviceStatus;
import prism.coordinator.model.JobRequest;
import prism.coordinator.model.JobStatus;
import prism.coordinator.model.PendingJobDevice;
import prism.coordinator.model.Trace;
import prism.coordinator.service.ConfigurationService;
import prism.coordinator.service.DeviceRegistry;
import prism.coordinator.service.JobService;
import prism.coordinator.service.TraceService;
import prism.coordinator.storage.ObjectStore;

import java.io.IOException;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * {@link ControlPlane} that calls the coordinator services in-process.
 * Used by standalone mode, where one JVM runs both sides, and by tests.
 */
public class LocalControlPlane implements ControlPlane {

    private final String hostName;
    private final JobService jobService;
    private final DeviceRegistry deviceRegistry;
    private final ConfigurationService configurationService;
    private final TraceService traceService;
    private final ObjectStore objectStore;

    public LocalControlPlane(String hostName, Dependencies deps) {
        this(hostName, deps.jobService(), deps.deviceRegistry(), deps.configurationService(),
                deps.traceService(), deps.objectStore());
    }

    public LocalControlPlane(String hostName,
            JobService jobService,
            DeviceRegistry deviceRegistry,
            ConfigurationService configurationService,
            TraceService traceService,
            ObjectStore objectStore) {
        this.hostName = hostName;
        this.jobService = jobService;
        this.deviceRegistry = deviceRegistry;
        this.configurationService = configurationService;
        this.traceService = traceService;
        this.objectStore = objectStore;
    }

    @Override
    public List<PendingJobDevice> pendingWork() {
        return jobService.listPendingJobDevices();
    }

    @Override
    public ClaimResult claim(String jobDeviceId) {
        return jobService.claim(jobDeviceId, hostName);
    }

    @Override
    public void finishJobDevice(String jobDeviceId, JobDeviceStatus status) {
        jobService.updateJobDeviceStatus(jobDeviceId, status);
    }

    @Override
    public void postUpdate(String jobId, String deviceId, String status, String message, String traceId) {
        jobService.appendJobUpdate(jobId, deviceId, status, message, traceId);
    }

    @Override
    public Optional<JobRequest> job(String jobId) {
        return jobService.getJob(jobId);
    }

    @Override
    public void postJobStatus(String jobId, JobStatus status, String resultSummary) {
        jobService.updateJobStatus(jobId, status, resultSummary);
    }

    @Override
    public Device reportDevice(String serial, String name, DeviceStatus status) {
        Device device = deviceRegistry.upsert(serial, name);
        return deviceRegistry.reportLiveness(device.id(), status, hostName);
    }

    @Override
    public int sweep(Collection<String> observed) {
        return deviceRegistry.sweep(hostName, observed);
    }

    @Override
    public Optional<Configuration> configuration(String configId) {
        return configurationService.get(configId);
    }

    @Override
    public void upload(String bucket, String objectName, byte[] content) {
        try {
            objectStore.upload(bucket, objectName, content);
        } catch (IOException e) {
            throw new ControlPlaneException("Upload of " + bucket + "/" + objectName + " failed", e);
        }
    }

    @Override
    public Trace createTrace(String name, String filename, String deviceId, String configurationId,
            Instant timestamp) {
        return traceService.create(name, filename, deviceId, hostName, configurationId, timestamp);
    }
}
