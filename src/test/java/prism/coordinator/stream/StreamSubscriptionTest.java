package prism.coordinator.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import prism.coordinator.model.JobUpdate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class StreamSubscriptionTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private final SseFrames frames = new SseFrames(new ObjectMapper());
    private final List<JobUpdate> log = new ArrayList<>();
    private final AtomicInteger cancels = new AtomicInteger();
    private RecordingSink sink;

    @BeforeEach
    void setUp() {
        sink = new RecordingSink();
    }

    private StreamSubscription subscribe(Instant since, int maxIdle) {
        return new StreamSubscription("job-1", since, sink, frames,
                (jobId, after) -> log.stream()
                        .filter(u -> after == null || u.timestamp().isAfter(after))
                        .toList(),
                deviceId -> "serial-" + deviceId,
                maxIdle,
                cancels::incrementAndGet);
    }

    private void append(int offsetMillis, String status, String traceId) {
        log.add(new JobUpdate("u" + log.size(), "job-1", "d1", status, status + " msg",
                T0.plusMillis(offsetMillis), traceId));
    }

    @Test
    void emitsUpdatesInOrderAndOnlyOnce() {
        append(1, "starting", null);
        append(2, "running", null);
        StreamSubscription sub = subscribe(null, 5);

        sub.tick();
        append(3, "completed", "trace-9");
        sub.tick();
        sub.tick();

        assertEquals(4, sink.frames.size());
        assertTrue(sink.frames.get(0).contains("\"status\":\"starting\""));
        assertTrue(sink.frames.get(1).contains("\"status\":\"running\""));
        assertTrue(sink.frames.get(2).contains("\"trace_id\":\"trace-9\""));
        assertTrue(sink.frames.get(2).contains("\"device_serial\":\"serial-d1\""));
        assertTrue(sink.frames.get(2).startsWith("id: " + T0.plusMillis(3) + "\n"));
        assertTrue(sink.frames.get(3).contains("heartbeat"));
        assertEquals(T0.plusMillis(3), sub.lastTimestamp());
    }

    @Test
    void closesAfterMaxIdleHeartbeats() {
        StreamSubscription sub = subscribe(null, 3);
        for (int i = 0; i < 10; i++) {
            sub.tick();
        }
        assertEquals(3, sink.count("heartbeat"));
        assertTrue(sub.isCancelled());
        assertFalse(sink.isOpen());
        assertEquals(1, cancels.get());
    }

    @Test
    void anUpdateResetsTheIdleCount() {
        StreamSubscription sub = subscribe(null, 2);
        sub.tick();
        append(1, "running", null);
        sub.tick();
        sub.tick();
        assertFalse(sub.isCancelled());
        sub.tick();
        assertTrue(sub.isCancelled());
        assertEquals(3, sink.count("heartbeat"));
    }

    @Test
    void resumesAfterSince() {
        append(1, "starting", null);
        append(2, "running", null);
        append(3, "uploading", null);
        StreamSubscription sub = subscribe(T0.plusMillis(2), 5);

        sub.tick();

        assertEquals(1, sink.frames.size());
        assertTrue(sink.frames.get(0).contains("uploading"));
    }

    @Test
    void readFailureSendsErrorAndCloses() {
        StreamSubscription sub = new StreamSubscription("job-1", null, sink, frames,
                (jobId, after) -> {
                    throw new IllegalStateException("database unavailable");
                },
                deviceId -> deviceId, 5, cancels::incrementAndGet);

        sub.tick();

        assertEquals(1, sink.frames.size());
        assertTrue(sink.frames.get(0).contains("\"type\":\"error\""));
        assertTrue(sink.frames.get(0).contains("database unavailable"));
        assertTrue(sub.isCancelled());
        assertEquals(1, cancels.get());
    }

    @Test
    void disconnectedClientCancels() {
        StreamSubscription sub = subscribe(null, 5);
        sink.open = false;
        sub.tick();
        sub.cancel();
        assertTrue(sub.isCancelled());
        assertTrue(sink.frames.isEmpty());
        assertEquals(1, cancels.get());
    }

    @Test
    void resumePointParsing() {
        assertNull(SseFrames.parseResumePoint(null));
        assertNull(SseFrames.parseResumePoint(""));
        assertEquals(T0, SseFrames.parseResumePoint("2026-03-01T10:00:00Z"));
        assertThrows(IllegalArgumentException.class, () -> SseFrames.parseResumePoint("yesterday"));
    }

    @Test
    void deregistersBeforeClosingTheSink() {
        AtomicInteger cancelsSeenAtClose = new AtomicInteger(-1);
        sink = new RecordingSink() {
            @Override
            public void close() {
                cancelsSeenAtClose.set(cancels.get());
                super.close();
            }
        };
        StreamSubscription sub = subscribe(null, 1);

        sub.cancel();
        sub.cancel();

        assertEquals(1, cancelsSeenAtClose.get());
        assertEquals(1, cancels.get());
        assertTrue(sub.isCancelled());
    }
}
