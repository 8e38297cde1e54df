package prism.coordinator.store;

import prism.coordinator.model.*;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class JdbcJobRepositoryTest {

    private static Database db;
    private static JdbcJobRepository jobs;
    private static JdbcJobUpdateRepository updates;
    private static JdbcDeviceRepository devices;
    private static JdbcConfigurationRepository configs;

    @BeforeAll
    static void setup() {
        db = new Database("jdbc:h2:mem:test-jobs;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE;DB_CLOSE_DELAY=-1", 10);
        jobs = new JdbcJobRepository(db);
        updates = new JdbcJobUpdateRepository(db);
        devices = new JdbcDeviceRepository(db);
        configs = new JdbcConfigurationRepository(db);

        configs.save(new Configuration("cfg-1", "sched", "buffers {}", Configuration.PERFETTO, 10, Instant.now()));
        for (String id : List.of("d1", "d2", "d3")) {
            devices.save(Device.builder().id(id).serial("serial-" + id).name(id).createdAt(Instant.now()).build());
        }
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanJobs() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM job_updates");
            st.execute("DELETE FROM job_devices");
            st.execute("DELETE FROM job_requests");
            conn.commit();
        }
    }

    @Test
    void createStoresOnePendingRowPerDevice() {
        JobRequest job = newJob(Instant.now(), "d1", "d2", "d3");
        jobs.create(job);

        JobRequest found = jobs.findById(job.id()).orElseThrow();
        assertEquals(JobStatus.PENDING, found.status());
        assertEquals(3, found.devices().size());
        for (JobDevice jd : found.devices()) {
            assertEquals(JobDeviceStatus.PENDING, jd.status());
            assertNull(jd.claimedBy());
        }
    }

    @Test
    void pendingIsOldestJobFirstWithSerials() {
        Instant now = Instant.now();
        JobRequest newer = newJob(now, "d1");
        JobRequest older = newJob(now.minusSeconds(60), "d2", "d3");
        jobs.create(newer);
        jobs.create(older);

        List<PendingJobDevice> pending = jobs.findPending();
        assertEquals(3, pending.size());
        assertEquals(older.id(), pending.get(0).jobId());
        assertEquals("d2", pending.get(0).deviceId());
        assertEquals("serial-d2", pending.get(0).deviceSerial());
        assertEquals(older.id(), pending.get(1).jobId());
        assertEquals("d3", pending.get(1).deviceId());
        assertEquals(newer.id(), pending.get(2).jobId());
        assertEquals(10, pending.get(2).duration());
    }

    @Test
    void claimMovesJobDeviceAndJobToRunning() {
        JobRequest job = newJob(Instant.now(), "d1");
        jobs.create(job);
        String jdId = job.devices().get(0).id();

        assertEquals(ClaimResult.CLAIMED, jobs.claim(jdId, "host-a", Instant.now()));

        JobDevice jd = jobs.findJobDevice(jdId).orElseThrow();
        assertEquals(JobDeviceStatus.RUNNING, jd.status());
        assertEquals("host-a", jd.claimedBy());
        assertEquals(JobStatus.RUNNING, jobs.findById(job.id()).orElseThrow().status());
        assertTrue(jobs.findPending().isEmpty());

        assertEquals(ClaimResult.LOST, jobs.claim(jdId, "host-b", Instant.now()));
        assertEquals(ClaimResult.NOT_FOUND, jobs.claim("jd-missing", "host-b", Instant.now()));
    }

    @Test
    void concurrentClaimsHaveExactlyOneWinner() throws Exception {
        JobRequest job = newJob(Instant.now(), "d1");
        jobs.create(job);
        String jdId = job.devices().get(0).id();

        int contenders = 8;
        ExecutorService pool = Executors.newFixedThreadPool(contenders);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<ClaimResult>> results = new ArrayList<>();
        for (int i = 0; i < contenders; i++) {
            String host = "host-" + i;
            Callable<ClaimResult> claim = () -> {
                start.await();
                return jobs.claim(jdId, host, Instant.now());
            };
            results.add(pool.submit(claim));
        }
        start.countDown();

        int won = 0;
        int lost = 0;
        for (Future<ClaimResult> result : results) {
            switch (result.get(10, TimeUnit.SECONDS)) {
                case CLAIMED -> won++;
                case LOST -> lost++;
                default -> fail("unexpected claim result");
            }
        }
        pool.shutdown();

        assertEquals(1, won);
        assertEquals(contenders - 1, lost);
    }

    @Test
    void finishIsTerminalOnce() {
        JobRequest job = newJob(Instant.now(), "d1");
        jobs.create(job);
        String jdId = job.devices().get(0).id();
        jobs.claim(jdId, "host-a", Instant.now());

        assertEquals(JobDeviceUpdateResult.UPDATED,
                jobs.finishJobDevice(jdId, JobDeviceStatus.COMPLETED, Instant.now()));
        assertEquals(JobDeviceUpdateResult.ALREADY_TERMINAL,
                jobs.finishJobDevice(jdId, JobDeviceStatus.FAILED, Instant.now()));
        assertEquals(JobDeviceStatus.COMPLETED, jobs.findJobDevice(jdId).orElseThrow().status());
        assertEquals(JobDeviceUpdateResult.NOT_FOUND,
                jobs.finishJobDevice("jd-missing", JobDeviceStatus.FAILED, Instant.now()));
    }

    @Test
    void terminalJobStatusNeverChanges() {
        JobRequest job = newJob(Instant.now(), "d1");
        jobs.create(job);

        assertTrue(jobs.updateStatus(job.id(), JobStatus.COMPLETED, "Completed: 1/1 successful, 0/1 failed",
                Instant.now()));
        assertFalse(jobs.updateStatus(job.id(), JobStatus.FAILED, "late", Instant.now()));

        JobRequest found = jobs.findById(job.id()).orElseThrow();
        assertEquals(JobStatus.COMPLETED, found.status());
        assertEquals("Completed: 1/1 successful, 0/1 failed", found.resultSummary());
    }

    @Test
    void updateTimestampsStrictlyIncrease() {
        JobRequest job = newJob(Instant.now(), "d1");
        jobs.create(job);

        List<JobUpdate> stored = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            stored.add(updates.append(new JobUpdate(null, job.id(), "d1", "running", "tick " + i, null, null)));
        }
        for (int i = 1; i < stored.size(); i++) {
            assertTrue(stored.get(i).timestamp().isAfter(stored.get(i - 1).timestamp()),
                    "timestamp " + i + " must be after " + (i - 1));
        }

        List<JobUpdate> all = updates.findAfter(job.id(), null);
        assertEquals(20, all.size());
        assertEquals("tick 0", all.get(0).message());

        List<JobUpdate> tail = updates.findAfter(job.id(), stored.get(14).timestamp());
        assertEquals(5, tail.size());
        assertEquals("tick 15", tail.get(0).message());
    }

    private static JobRequest newJob(Instant createdAt, String... deviceIds) {
        Instant at = createdAt.truncatedTo(ChronoUnit.MICROS);
        String jobId = jobs.generateId();
        List<JobDevice> jds = new ArrayList<>();
        for (String deviceId : deviceIds) {
            jds.add(JobDevice.pending(jobs.generateJobDeviceId(), jobId, deviceId, at));
        }
        return JobRequest.builder()
                .id(jobId)
                .configId("cfg-1")
                .status(JobStatus.PENDING)
                .duration(10)
                .createdAt(at)
                .updatedAt(at)
                .devices(jds)
                .build();
    }
}
