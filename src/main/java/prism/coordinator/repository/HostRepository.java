package prism.coordinator.repository;

import prism.coordinator.model.Host;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for registered worker hosts.
 */
public interface HostRepository {

    /**
     * Insert a host, or replace the key of an existing one.
     */
    void save(Host host);

    Optional<Host> findByName(String hostName);

    Optional<Host> findByKey(String hostKey);

    List<Host> findAll();

    /**
     * Record that the host just authenticated.
     */
    void touch(String hostName, Instant seenAt);
}
