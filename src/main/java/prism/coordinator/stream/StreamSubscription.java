package prism.coordinator.stream;

import prism.coordinator.model.JobUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * One subscriber's polling state. Ticks run one at a time.
 */
public final class StreamSubscription {

    private static final Logger log = LoggerFactory.getLogger(StreamSubscription.class);

    private final String jobId;
    private final EventSink sink;
    private final SseFrames frames;
    private final UpdateSource source;
    private final Function<String, String> serialResolver;
    private final int maxIdleHeartbeats;
    private final Map<String, String> serials = new HashMap<>();

    private Instant lastTimestamp;
    private int idleHeartbeats;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final Runnable onCancel;
    private volatile ScheduledFuture<?> future;

    /** Reads a job's events newer than a timestamp */
    @FunctionalInterface
    public interface UpdateSource {
        List<JobUpdate> updatesAfter(String jobId, Instant after);
    }

    StreamSubscription(String jobId, Instant since, EventSink sink, SseFrames frames,
            UpdateSource source, Function<String, String> serialResolver, int maxIdleHeartbeats,
            Runnable onCancel) {
        this.jobId = jobId;
        this.lastTimestamp = since;
        this.sink = sink;
        this.frames = frames;
        this.source = source;
        this.serialResolver = serialResolver;
        this.maxIdleHeartbeats = maxIdleHeartbeats;
        this.onCancel = onCancel;
    }

    void attach(ScheduledFuture<?> future) {
        this.future = future;
        if (cancelled.get()) {
            future.cancel(false);
        }
    }

    /**
     * One poll: emit every new update, or a heartbeat when there is none.
     */
    void tick() {
        if (cancelled.get()) {
            return;
        }
        if (!sink.isOpen()) {
            log.debug("Subscriber of job {} disconnected", jobId);
            cancel();
            return;
        }

        try {
            List<JobUpdate> updates = source.updatesAfter(jobId, lastTimestamp);
            if (updates.isEmpty()) {
                heartbeat();
                return;
            }
            idleHeartbeats = 0;
            for (JobUpdate update : updates) {
                String serial = update.deviceId() == null ? null
                        : serials.computeIfAbsent(update.deviceId(), serialResolver);
                if (!sink.send(frames.update(update, serial))) {
                    cancel();
                    return;
                }
                lastTimestamp = update.timestamp();
            }
        } catch (RuntimeException e) {
            log.error("Progress stream read failed for job {}", jobId, e);
            sink.send(frames.error(e.getMessage()));
            cancel();
        }
    }

    private void heartbeat() {
        idleHeartbeats++;
        if (!sink.send(frames.heartbeat())) {
            cancel();
            return;
        }
        if (idleHeartbeats >= maxIdleHeartbeats) {
            log.debug("Closing idle stream of job {} after {} heartbeats", jobId, idleHeartbeats);
            cancel();
        }
    }

    /**
     * Stop polling and end the stream.
     */
    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        ScheduledFuture<?> f = future;
        if (f != null) {
            f.cancel(false);
        }
        // deregister first: a client that sees the close must not still count as active
        onCancel.run();
        sink.close();
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public String jobId() {
        return jobId;
    }

    Instant lastTimestamp() {
        return lastTimestamp;
    }
}
