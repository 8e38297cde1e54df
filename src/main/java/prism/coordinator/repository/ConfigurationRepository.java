package prism.coordinator.repository;

import prism.coordinator.model.Configuration;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for trace configurations.
 */
public interface ConfigurationRepository {

    /**
     * Insert a configuration, or overwrite it in place if the id exists.
     */
    void save(Configuration configuration);

    Optional<Configuration> findById(String configId);

    List<Configuration> findAll();

    String generateId();
}
