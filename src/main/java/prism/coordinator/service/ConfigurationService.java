package prism.coordinator.service;

import prism.coordinator.model.Configuration;
import prism.coordinator.repository.ConfigurationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Create, edit and read trace configurations. Edits overwrite in place.
 */
public class ConfigurationService {

    private static final Logger log = LoggerFactory.getLogger(ConfigurationService.class);

    private final ConfigurationRepository repository;
    private final Clock clock;

    public ConfigurationService(ConfigurationRepository repository) {
        this(repository, Clock.systemUTC());
    }

    public ConfigurationService(ConfigurationRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * Create a configuration, or overwrite the one with {@code configId}.
     *
     * @param configId existing id to overwrite, or null for a new configuration
     */
    public Configuration save(String configId, String name, String text, String tracingTool, Integer defaultDuration) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("config_name is required");
        }
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("config_text is required");
        }
        String tool = normalizeTool(tracingTool);
        if (defaultDuration != null && defaultDuration <= 0) {
            throw new IllegalArgumentException("default_duration must be positive");
        }

        boolean isNew = configId == null || configId.isBlank();
        String id = isNew ? repository.generateId() : configId;
        Configuration configuration = new Configuration(id, name, text, tool, defaultDuration, clock.instant());
        repository.save(configuration);
        log.info("{} configuration {} ({}, {})", isNew ? "Created" : "Saved", id, name, tool);
        return configuration;
    }

    public Optional<Configuration> get(String configId) {
        return repository.findById(configId);
    }

    public Configuration require(String configId) {
        return repository.findById(configId).orElseThrow(() -> NotFoundException.of("configuration", configId));
    }

    public List<Configuration> list() {
        return repository.findAll();
    }

    private static String normalizeTool(String tracingTool) {
        if (tracingTool == null || tracingTool.isBlank()) {
            return Configuration.PERFETTO;
        }
        String tool = tracingTool.trim().toLowerCase(Locale.ROOT);
        if (!tool.equals(Configuration.PERFETTO) && !tool.equals(Configuration.SIMPLEPERF)) {
            throw new IllegalArgumentException("unsupported tracing_tool: " + tracingTool);
        }
        return tool;
    }
}
