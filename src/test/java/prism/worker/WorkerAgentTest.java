package prism.worker;

import prism.coordinator.config.CoordinatorConfig;
import prism.coordinator.config.Dependencies;
import prism.coordinator.model.*;
import prism.coordinator.storage.ObjectStore;
import prism.worker.client.ControlPlaneException;
import prism.worker.client.LocalControlPlane;
import prism.worker.config.WorkerConfig;
import prism.worker.device.FakeDeviceBridge;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class WorkerAgentTest {

    @TempDir
    Path tempDir;

    private Dependencies deps;
    private String configId;
    private FakeDeviceBridge bridgeA;
    private FakeDeviceBridge bridgeB;
    private FakeTraceCollector collector;
    private WorkerAgent agentA;
    private WorkerAgent agentB;

    @BeforeEach
    void setUp() {
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-worker-" + System.nanoTime()
                        + ";MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE;DB_CLOSE_DELAY=-1")
                .withStorageRoot(tempDir.resolve("objects").toString());
        deps = Dependencies.create(config);

        configId = deps.configurationService().save(null, "sched", "buffers {}", "perfetto", 10).id();
        deps.deviceRegistry().register("d1", "serial-1", "Pixel");
        deps.deviceRegistry().register("d2", "serial-2", "Galaxy");
        deps.deviceRegistry().register("d3", "serial-3", "Nowhere");

        bridgeA = new FakeDeviceBridge("serial-1");
        bridgeB = new FakeDeviceBridge("serial-2");
        collector = new FakeTraceCollector(tempDir);
        agentA = agent("host-a", bridgeA);
        agentB = agent("host-b", bridgeB);
    }

    @AfterEach
    void tearDown() {
        agentA.close();
        agentB.close();
        deps.close();
    }

    private WorkerAgent agent(String host, FakeDeviceBridge bridge) {
        WorkerConfig config = WorkerConfig.defaults().withHostName(host).withMaxParallelTraces(2);
        return new WorkerAgent(config, new LocalControlPlane(host, deps), bridge, collector);
    }

    @Test
    void twoHostsCompleteAJob() {
        JobRequest job = deps.jobService().createJob(configId, List.of("d1", "d2"), 10);

        assertEquals(1, agentA.runWorkOnce());
        assertEquals(JobStatus.RUNNING, job(job).status(), "d2 is still pending");

        assertEquals(1, agentB.runWorkOnce());

        JobRequest done = job(job);
        assertEquals(JobStatus.COMPLETED, done.status());
        assertEquals("Completed: 2/2 successful, 0/2 failed", done.resultSummary());
        for (JobDevice jd : done.devices()) {
            assertEquals(JobDeviceStatus.COMPLETED, jd.status());
        }
        assertEquals("host-a", deviceRow(done, "d1").claimedBy());
        assertEquals("host-b", deviceRow(done, "d2").claimedBy());

        Trace trace = deps.traceService().listByDevice("d1").get(0);
        assertEquals("sched - Model-serial-1", trace.name());
        assertEquals("host-a", trace.hostName());
        assertTrue(trace.filename().endsWith("-sched.perfetto-trace"));
        assertTrue(deps.objectStore().exists(ObjectStore.TRACES_BUCKET, trace.filename()));
        assertEquals(1, deps.traceService().listByDevice("d2").size());

        List<JobUpdate> d1Updates = deps.jobService().updatesAfter(job.id(), null).stream()
                .filter(u -> "d1".equals(u.deviceId()))
                .toList();
        assertEquals(List.of("starting", "running", "uploading", "completed"),
                d1Updates.stream().map(JobUpdate::status).toList());
        assertEquals("Starting trace on serial-1", d1Updates.get(0).message());
        assertEquals(trace.id(), d1Updates.get(3).traceId());
    }

    @Test
    void oneFailedDeviceMakesTheJobPartial() {
        collector.failing.add("serial-1");
        JobRequest job = deps.jobService().createJob(configId, List.of("d1", "d2"), 10);

        agentA.runWorkOnce();
        agentB.runWorkOnce();

        JobRequest done = job(job);
        assertEquals(JobStatus.PARTIAL, done.status());
        assertEquals("Completed: 1/2 successful, 1/2 failed", done.resultSummary());
        assertEquals(JobDeviceStatus.FAILED, deviceRow(done, "d1").status());
        assertEquals(JobDeviceStatus.COMPLETED, deviceRow(done, "d2").status());
        assertTrue(deps.traceService().listByDevice("d1").isEmpty());

        JobUpdate last = deps.jobService().updatesAfter(job.id(), null).stream()
                .filter(u -> "d1".equals(u.deviceId()))
                .reduce((a, b) -> b)
                .orElseThrow();
        assertEquals("failed", last.status());
        assertTrue(last.message().startsWith("Error: "), last.message());
    }

    @Test
    void unattachedDeviceStaysPending() {
        JobRequest job = deps.jobService().createJob(configId, List.of("d3"), 10);

        assertEquals(0, agentA.runWorkOnce());
        assertEquals(0, agentB.runWorkOnce());

        JobRequest still = job(job);
        assertEquals(JobStatus.PENDING, still.status());
        assertEquals(JobDeviceStatus.PENDING, still.devices().get(0).status());
    }

    @Test
    void deviceDetachedAfterClaimFailsOnlyThatDevice() {
        JobRequest job = deps.jobService().createJob(configId, List.of("d1"), 10);
        String jd = job.devices().get(0).id();
        assertEquals(ClaimResult.CLAIMED, deps.jobService().claim(jd, "host-a"));
        bridgeA.attached.clear();

        JobDevicePipeline pipeline = new JobDevicePipeline(new LocalControlPlane("host-a", deps), bridgeA,
                collector, serial -> serial, Clock.systemUTC());
        boolean completed = pipeline.run(
                new PendingJobDevice(jd, job.id(), configId, "d1", "serial-1", 10, JobDeviceStatus.RUNNING));

        assertFalse(completed);
        assertEquals(JobDeviceStatus.FAILED, deps.jobService().getJobDevice(jd).orElseThrow().status());
    }

    @Test
    void livenessReportsAttachedDevicesAndSweepsMissingOnes() {
        bridgeA.attached.add("serial-new");

        assertEquals(2, agentA.runLivenessOnce());
        Device fresh = deps.deviceRegistry().lookup("serial-new").orElseThrow();
        assertEquals(DeviceStatus.ONLINE, fresh.status());
        assertEquals("host-a", fresh.currentHost());
        assertEquals("Model-serial-new", fresh.name());

        bridgeA.attached.remove("serial-new");
        agentA.runLivenessOnce();

        assertEquals(DeviceStatus.OFFLINE, deps.deviceRegistry().lookup("serial-new").orElseThrow().status());
        assertEquals(DeviceStatus.ONLINE, deps.deviceRegistry().lookup("d1").orElseThrow().status());
    }

    @Test
    void tracingDeviceIsBusyAndNotSwept() throws Exception {
        agentA.runLivenessOnce();
        collector.release = new CountDownLatch(1);
        JobRequest job = deps.jobService().createJob(configId, List.of("d1"), 10);

        CompletableFuture<Integer> work = CompletableFuture.supplyAsync(agentA::runWorkOnce);
        assertTrue(collector.started.await(5, TimeUnit.SECONDS));

        agentA.runLivenessOnce();
        assertEquals(DeviceStatus.BUSY, deps.deviceRegistry().lookup("d1").orElseThrow().status());
        assertTrue(agentA.tracingSerials().contains("serial-1"));

        collector.release.countDown();
        assertEquals(1, work.get(10, TimeUnit.SECONDS));
        assertTrue(agentA.tracingSerials().isEmpty());
        assertEquals(JobStatus.COMPLETED, job(job).status());
    }

    @Test
    void claimTransportErrorDoesNotStrandOtherJobs() {
        JobRequest first = deps.jobService().createJob(configId, List.of("d1"), 10);
        JobRequest second = deps.jobService().createJob(configId, List.of("d2"), 10);
        FlakyControlPlane plane = new FlakyControlPlane("host-a");
        plane.failClaimsOf = second.devices().get(0).id();
        plane.claimFailures.set(1);
        WorkerAgent agent = new WorkerAgent(WorkerConfig.defaults().withHostName("host-a").withMaxParallelTraces(2),
                plane, new FakeDeviceBridge("serial-1", "serial-2"), collector);

        try {
            assertEquals(1, agent.runWorkOnce());
            assertEquals(JobStatus.COMPLETED, job(first).status());
            assertEquals(JobStatus.PENDING, job(second).status());
            assertTrue(agent.tracingSerials().isEmpty());

            assertEquals(1, agent.runWorkOnce());
            assertEquals(JobStatus.COMPLETED, job(second).status());
        } finally {
            agent.close();
        }
    }

    @Test
    void failedAggregateWriteIsRetriedNextPass() {
        JobRequest job = deps.jobService().createJob(configId, List.of("d1"), 10);
        FlakyControlPlane plane = new FlakyControlPlane("host-a");
        plane.statusFailures.set(1);
        WorkerAgent agent = new WorkerAgent(WorkerConfig.defaults().withHostName("host-a"),
                plane, new FakeDeviceBridge("serial-1"), collector);

        try {
            assertEquals(1, agent.runWorkOnce());
            assertEquals(JobDeviceStatus.COMPLETED, job(job).devices().get(0).status());
            assertEquals(JobStatus.RUNNING, job(job).status());
            assertEquals(Set.of(job.id()), agent.unsettledJobs());

            assertEquals(0, agent.runWorkOnce());
            JobRequest settled = job(job);
            assertEquals(JobStatus.COMPLETED, settled.status());
            assertEquals("Completed: 1/1 successful, 0/1 failed", settled.resultSummary());
            assertTrue(agent.unsettledJobs().isEmpty());
        } finally {
            agent.close();
        }
    }

    @Test
    void deviceIsReservedWhileItsClaimIsInFlight() throws Exception {
        JobRequest job = deps.jobService().createJob(configId, List.of("d1"), 10);
        FlakyControlPlane plane = new FlakyControlPlane("host-a");
        plane.claimStarted = new CountDownLatch(1);
        plane.claimRelease = new CountDownLatch(1);
        WorkerAgent agent = new WorkerAgent(WorkerConfig.defaults().withHostName("host-a"),
                plane, bridgeA, collector);

        try {
            CompletableFuture<Integer> work = CompletableFuture.supplyAsync(agent::runWorkOnce);
            assertTrue(plane.claimStarted.await(5, TimeUnit.SECONDS));

            assertTrue(agent.tracingSerials().contains("serial-1"));
            assertEquals(0, agent.runLivenessOnce(), "a device being claimed is not reported online");

            plane.claimRelease.countDown();
            assertEquals(1, work.get(10, TimeUnit.SECONDS));
            assertEquals(JobStatus.COMPLETED, job(job).status());
        } finally {
            agent.close();
        }
    }

    /** In-process control plane whose calls can be made to fail or pause. */
    private class FlakyControlPlane extends LocalControlPlane {

        volatile String failClaimsOf;
        final AtomicInteger claimFailures = new AtomicInteger();
        final AtomicInteger statusFailures = new AtomicInteger();
        volatile CountDownLatch claimStarted;
        volatile CountDownLatch claimRelease;

        FlakyControlPlane(String hostName) {
            super(hostName, deps);
        }

        @Override
        public ClaimResult claim(String jobDeviceId) {
            if (jobDeviceId.equals(failClaimsOf) && claimFailures.getAndDecrement() > 0) {
                throw new ControlPlaneException("claim " + jobDeviceId + " returned 503", 503);
            }
            if (claimStarted != null) {
                claimStarted.countDown();
                try {
                    claimRelease.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return super.claim(jobDeviceId);
        }

        @Override
        public void postJobStatus(String jobId, JobStatus status, String resultSummary) {
            if (statusFailures.getAndDecrement() > 0) {
                throw new ControlPlaneException("job status for " + jobId + " returned 502", 502);
            }
            super.postJobStatus(jobId, status, resultSummary);
        }
    }

    private JobRequest job(JobRequest job) {
        return deps.jobService().getJob(job.id()).orElseThrow();
    }

    private static JobDevice deviceRow(JobRequest job, String deviceId) {
        return job.devices().stream().filter(jd -> jd.deviceId().equals(deviceId)).findFirst().orElseThrow();
    }
}
