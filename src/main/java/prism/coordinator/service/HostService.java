package prism.coordinator.service;

import prism.coordinator.model.Host;
import prism.coordinator.repository.HostRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

/**
 * Registers worker hosts and authenticates their keys.
 * Registering an existing host name rotates its key.
 */
public class HostService {

    private static final Logger log = LoggerFactory.getLogger(HostService.class);

    private final HostRepository repository;
    private final SecureRandom random = new SecureRandom();
    private final Clock clock;

    public HostService(HostRepository repository) {
        this(repository, Clock.systemUTC());
    }

    public HostService(HostRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    public Host register(String hostName) {
        if (hostName == null || hostName.isBlank()) {
            throw new IllegalArgumentException("host_name is required");
        }
        Instant now = clock.instant();
        Instant createdAt = repository.findByName(hostName).map(Host::createdAt).orElse(now);
        Host host = new Host(hostName, newKey(), null, createdAt);
        repository.save(host);
        log.info("Registered host {}", hostName);
        return host;
    }

    /**
     * Resolve a bearer key to its host and record the contact.
     */
    public Optional<Host> authenticate(String hostKey) {
        if (hostKey == null || hostKey.isBlank()) {
            return Optional.empty();
        }
        Optional<Host> host = repository.findByKey(hostKey);
        host.ifPresent(h -> repository.touch(h.name(), clock.instant()));
        return host;
    }

    public List<Host> list() {
        return repository.findAll();
    }

    private String newKey() {
        byte[] bytes = new byte[32];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
