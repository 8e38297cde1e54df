package prism.coordinator.repository;

import prism.coordinator.model.Trace;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for collected trace metadata.
 */
public interface TraceRepository {

    void save(Trace trace);

    Optional<Trace> findById(String traceId);

    /**
     * @return traces collected from a device, newest first
     */
    List<Trace> findByDevice(String deviceId);

    String generateId();
}
