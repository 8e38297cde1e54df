package prism.coordinator.repository;

import prism.coordinator.model.JobUpdate;

import java.time.Instant;
import java.util.List;

/**
 * Append-only store of job progress events.
 */
public interface JobUpdateRepository {

    /**
     * Insert a progress event. The store assigns the timestamp; timestamps of
     * one job are strictly increasing in insertion order.
     *
     * @param update the event; its id and timestamp are ignored
     * @return the stored event with id and timestamp filled in
     */
    JobUpdate append(JobUpdate update);

    /**
     * Get a job's events newer than {@code after}, oldest first.
     *
     * @param jobId the job id
     * @param after exclusive lower bound; null for all events
     */
    List<JobUpdate> findAfter(String jobId, Instant after);
}
