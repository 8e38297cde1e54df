package prism.coordinator.service;

import prism.coordinator.model.*;
import prism.coordinator.store.*;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JobServiceTest {

    private Database db;
    private JobService jobService;
    private DeviceRegistry registry;
    private String configId;

    @BeforeEach
    void setUp() {
        db = new Database("jdbc:h2:mem:test-jobservice-" + System.nanoTime()
                + ";MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE;DB_CLOSE_DELAY=-1", 4);
        JdbcDeviceRepository devices = new JdbcDeviceRepository(db);
        JdbcConfigurationRepository configs = new JdbcConfigurationRepository(db);
        registry = new DeviceRegistry(devices);
        jobService = new JobService(new JdbcJobRepository(db), new JdbcJobUpdateRepository(db), configs, devices);

        configId = new ConfigurationService(configs).save(null, "sched", "buffers {}", "perfetto", 10).id();
        registry.register("d1", "serial-1", "Pixel");
        registry.register("d2", "serial-2", "Galaxy");
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    @Test
    void createJobWithPendingDevices() {
        JobRequest job = jobService.createJob(configId, List.of("d1", "d2"), 10);

        assertEquals(JobStatus.PENDING, job.status());
        assertEquals(2, job.devices().size());
        assertEquals(2, jobService.listPendingJobDevices().size());
        assertTrue(jobService.getJob(job.id()).isPresent());
    }

    @Test
    void identicalCreatesGiveDistinctJobs() {
        JobRequest a = jobService.createJob(configId, List.of("d1"), 10);
        JobRequest b = jobService.createJob(configId, List.of("d1"), 10);
        assertNotEquals(a.id(), b.id());
        assertEquals(2, jobService.listRecent(0).size());
    }

    @Test
    void createJobValidation() {
        assertThrows(IllegalArgumentException.class, () -> jobService.createJob(configId, List.of(), 10));
        assertThrows(IllegalArgumentException.class, () -> jobService.createJob(configId, List.of("d1"), 0));
        assertThrows(IllegalArgumentException.class,
                () -> jobService.createJob(configId, List.of("d1", "d1"), 10));
        assertThrows(NotFoundException.class, () -> jobService.createJob("cfg-missing", List.of("d1"), 10));
        assertThrows(NotFoundException.class, () -> jobService.createJob(configId, List.of("d1", "ghost"), 10));
        assertTrue(jobService.listRecent(10).isEmpty(), "failed creates leave nothing behind");
    }

    @Test
    void aggregateIsWrittenOnceAllDevicesFinish() {
        JobRequest job = jobService.createJob(configId, List.of("d1", "d2"), 10);
        String jd1 = job.devices().get(0).id();
        String jd2 = job.devices().get(1).id();

        assertEquals(ClaimResult.CLAIMED, jobService.claim(jd1, "host-a"));
        assertEquals(ClaimResult.CLAIMED, jobService.claim(jd2, "host-b"));
        jobService.updateJobDeviceStatus(jd1, JobDeviceStatus.COMPLETED);
        assertEquals(Optional.empty(), jobService.recomputeAggregate(job.id()));
        assertEquals(JobStatus.RUNNING, jobService.getJob(job.id()).orElseThrow().status());

        jobService.updateJobDeviceStatus(jd2, JobDeviceStatus.FAILED);
        JobAggregate aggregate = jobService.recomputeAggregate(job.id()).orElseThrow();

        JobRequest done = jobService.getJob(job.id()).orElseThrow();
        assertEquals(JobStatus.PARTIAL, done.status());
        assertEquals("Completed: 1/2 successful, 1/2 failed", done.resultSummary());
        assertEquals(aggregate.summary(), done.resultSummary());
    }

    @Test
    void terminalJobIsNotReopened() {
        JobRequest job = jobService.createJob(configId, List.of("d1"), 10);
        assertTrue(jobService.updateJobStatus(job.id(), JobStatus.FAILED, "gave up"));
        assertFalse(jobService.updateJobStatus(job.id(), JobStatus.RUNNING, null));
        assertEquals(JobStatus.FAILED, jobService.getJob(job.id()).orElseThrow().status());
    }

    @Test
    void unknownJobStatusUpdate() {
        assertThrows(NotFoundException.class,
                () -> jobService.updateJobStatus("job-missing", JobStatus.COMPLETED, null));
        assertThrows(NotFoundException.class,
                () -> jobService.appendJobUpdate("job-missing", "d1", "running", null, null));
    }

    @Test
    void jobDeviceCannotBeMovedBackByStatusWrite() {
        JobRequest job = jobService.createJob(configId, List.of("d1"), 10);
        String jd = job.devices().get(0).id();
        assertThrows(IllegalArgumentException.class,
                () -> jobService.updateJobDeviceStatus(jd, JobDeviceStatus.PENDING));
        assertThrows(IllegalArgumentException.class,
                () -> jobService.updateJobDeviceStatus(jd, JobDeviceStatus.RUNNING));
    }

    @Test
    void updatesAreReturnedInOrder() {
        JobRequest job = jobService.createJob(configId, List.of("d1"), 10);
        JobUpdate first = jobService.appendJobUpdate(job.id(), "d1", "starting", "Starting trace on serial-1", null);
        jobService.appendJobUpdate(job.id(), "d1", "running", "Collecting trace...", null);

        List<JobUpdate> after = jobService.updatesAfter(job.id(), first.timestamp());
        assertEquals(1, after.size());
        assertEquals("running", after.get(0).status());
    }
}
