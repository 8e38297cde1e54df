package prism.coordinator.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import prism.coordinator.model.Device;
import prism.coordinator.service.DeviceRegistry;
import prism.coordinator.service.JobService;
import prism.coordinator.service.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Pushes a job's progress events to subscribers.
 * Each subscription polls the event log on a shared scheduled pool, never on
 * a network event loop. Subscribers are independent: one failing or slow
 * subscriber does not affect the others.
 */
public class ProgressStream implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProgressStream.class);

    private final JobService jobService;
    private final DeviceRegistry deviceRegistry;
    private final SseFrames frames;
    private final ScheduledExecutorService executor;
    private final Duration pollInterval;
    private final int maxIdleHeartbeats;
    private final AtomicInteger active = new AtomicInteger();

    public ProgressStream(JobService jobService, DeviceRegistry deviceRegistry, ObjectMapper mapper,
            Duration pollInterval, int maxIdleHeartbeats, int threads) {
        if (maxIdleHeartbeats <= 0) {
            throw new IllegalArgumentException("maxIdleHeartbeats must be positive");
        }
        this.jobService = jobService;
        this.deviceRegistry = deviceRegistry;
        this.frames = new SseFrames(mapper);
        this.pollInterval = pollInterval;
        this.maxIdleHeartbeats = maxIdleHeartbeats;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newScheduledThreadPool(threads, r -> {
            Thread t = new Thread(r, "prism-stream-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Open a subscription. Emits the connected frame immediately, then polls.
     *
     * @param since resume point; events at or before it are skipped. Null replays all.
     * @throws NotFoundException if the job does not exist
     */
    public StreamSubscription subscribe(String jobId, Instant since, EventSink sink) {
        if (jobService.getJob(jobId).isEmpty()) {
            throw NotFoundException.of("job", jobId);
        }

        StreamSubscription subscription = new StreamSubscription(
                jobId, since, sink, frames,
                jobService::updatesAfter,
                this::serialOf,
                maxIdleHeartbeats,
                () -> finished(jobId));

        int count = active.incrementAndGet();
        if (!sink.send(frames.connected())) {
            subscription.cancel();
            return subscription;
        }
        log.debug("Stream opened for job {} (since {}), {} active", jobId, since, count);

        subscription.attach(executor.scheduleWithFixedDelay(
                subscription::tick, 0, pollInterval.toMillis(), TimeUnit.MILLISECONDS));
        return subscription;
    }

    public int activeSubscriptions() {
        return active.get();
    }

    private void finished(String jobId) {
        int count = active.decrementAndGet();
        log.debug("Stream closed for job {}, {} active", jobId, count);
    }

    private String serialOf(String deviceId) {
        return deviceRegistry.lookup(deviceId).map(Device::serial).orElse(deviceId);
    }

    @Override
    public void close() {
        executor.shutdownNow();
        log.info("Progress stream stopped");
    }
}
