package prism.coordinator.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static prism.coordinator.model.JobDeviceStatus.*;

class JobAggregateTest {

    @Test
    void allCompleted() {
        JobAggregate aggregate = JobAggregate.of(List.of(COMPLETED, COMPLETED)).orElseThrow();
        assertEquals(JobStatus.COMPLETED, aggregate.status());
        assertEquals("Completed: 2/2 successful, 0/2 failed", aggregate.summary());
    }

    @Test
    void allFailed() {
        JobAggregate aggregate = JobAggregate.of(List.of(FAILED, FAILED, FAILED)).orElseThrow();
        assertEquals(JobStatus.FAILED, aggregate.status());
        assertEquals("Completed: 0/3 successful, 3/3 failed", aggregate.summary());
    }

    @Test
    void mixedIsPartial() {
        JobAggregate aggregate = JobAggregate.of(List.of(COMPLETED, FAILED)).orElseThrow();
        assertEquals(JobStatus.PARTIAL, aggregate.status());
        assertEquals(1, aggregate.succeeded());
        assertEquals(1, aggregate.failed());
        assertEquals("Completed: 1/2 successful, 1/2 failed", aggregate.summary());
    }

    @Test
    void undecidedWhileAnyDeviceIsActive() {
        assertEquals(Optional.empty(), JobAggregate.of(List.of(COMPLETED, RUNNING)));
        assertEquals(Optional.empty(), JobAggregate.of(List.of(PENDING, FAILED)));
    }

    @Test
    void undecidedWithoutDevices() {
        assertTrue(JobAggregate.of(List.<JobDeviceStatus>of()).isEmpty());
    }
}
