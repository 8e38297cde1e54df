package prism.coordinator.service;

import prism.coordinator.model.Trace;
import prism.coordinator.repository.TraceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persists and reads trace metadata. The artifact itself is in object storage.
 */
public class TraceService {

    private static final Logger log = LoggerFactory.getLogger(TraceService.class);

    private final TraceRepository repository;
    private final Clock clock;

    public TraceService(TraceRepository repository) {
        this(repository, Clock.systemUTC());
    }

    public TraceService(TraceRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * Record a collected trace.
     *
     * @param timestamp collection time, now when null
     */
    public Trace create(String name, String filename, String deviceId, String hostName,
            String configurationId, Instant timestamp) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("trace_name is required");
        }
        if (filename == null || filename.isBlank()) {
            throw new IllegalArgumentException("trace_filename is required");
        }
        Trace trace = new Trace(
                repository.generateId(),
                name,
                timestamp != null ? timestamp : clock.instant(),
                filename,
                deviceId,
                hostName,
                configurationId);
        repository.save(trace);
        log.info("Recorded trace {} ({}) from device {}", trace.id(), filename, deviceId);
        return trace;
    }

    public Optional<Trace> get(String traceId) {
        return repository.findById(traceId);
    }

    public List<Trace> listByDevice(String deviceId) {
        return repository.findByDevice(deviceId);
    }
}
