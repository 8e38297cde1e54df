package prism.coordinator.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import prism.coordinator.model.JobRequest;
import prism.coordinator.service.ConfigurationService;
import prism.coordinator.service.DeviceRegistry;
import prism.coordinator.service.JobService;
import prism.coordinator.service.NotFoundException;
import prism.coordinator.store.*;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ProgressStreamTest {

    private Database db;
    private JobService jobService;
    private ProgressStream stream;
    private JobRequest job;

    @BeforeEach
    void setUp() {
        db = new Database("jdbc:h2:mem:test-stream-" + System.nanoTime()
                + ";MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE;DB_CLOSE_DELAY=-1", 4);
        JdbcDeviceRepository devices = new JdbcDeviceRepository(db);
        JdbcConfigurationRepository configs = new JdbcConfigurationRepository(db);
        DeviceRegistry registry = new DeviceRegistry(devices);
        jobService = new JobService(new JdbcJobRepository(db), new JdbcJobUpdateRepository(db), configs, devices);
        stream = new ProgressStream(jobService, registry, new ObjectMapper(), Duration.ofMillis(20), 3, 2);

        String configId = new ConfigurationService(configs).save(null, "sched", "buffers {}", "perfetto", 5).id();
        registry.register("d1", "R58M123", "Pixel");
        job = jobService.createJob(configId, List.of("d1"), 5);
    }

    @AfterEach
    void tearDown() {
        stream.close();
        db.close();
    }

    @Test
    void unknownJobIsRejectedBeforeStreaming() {
        RecordingSink sink = new RecordingSink();
        assertThrows(NotFoundException.class, () -> stream.subscribe("job-missing", null, sink));
        assertTrue(sink.frames.isEmpty());
    }

    @Test
    void streamsUpdatesThenClosesWhenIdle() throws Exception {
        jobService.appendJobUpdate(job.id(), "d1", "starting", "Starting trace on R58M123", null);
        jobService.appendJobUpdate(job.id(), "d1", "running", "Collecting trace...", null);

        RecordingSink sink = new RecordingSink();
        stream.subscribe(job.id(), null, sink);

        assertTrue(sink.closed.await(5, TimeUnit.SECONDS), "idle stream should close");
        assertTrue(sink.frames.get(0).contains("\"type\":\"connected\""));
        assertTrue(sink.frames.get(1).contains("\"status\":\"starting\""));
        assertTrue(sink.frames.get(1).contains("\"device_serial\":\"R58M123\""));
        assertTrue(sink.frames.get(2).contains("\"status\":\"running\""));
        assertEquals(3, sink.count("heartbeat"));
        assertEquals(0, stream.activeSubscriptions());
    }

    @Test
    void subscribersAreIndependent() throws Exception {
        jobService.appendJobUpdate(job.id(), "d1", "starting", null, null);

        RecordingSink gone = new RecordingSink();
        gone.open = false;
        RecordingSink watching = new RecordingSink();
        stream.subscribe(job.id(), null, gone);
        stream.subscribe(job.id(), null, watching);

        assertTrue(watching.closed.await(5, TimeUnit.SECONDS));
        assertTrue(gone.frames.isEmpty());
        assertEquals(1, watching.count("starting"));
        assertEquals(0, stream.activeSubscriptions());
    }
}
