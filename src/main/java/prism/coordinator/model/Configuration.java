package prism.coordinator.model;

import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/**
 * A trace recipe: the collection tool plus the tool-specific config text.
 * Edits replace the row in place; no history is kept.
 */
public record Configuration(
        String id,
        String name,
        String text,
        String tracingTool,
        Integer defaultDuration,
        Instant updatedAt) {

    public static final String PERFETTO = "perfetto";
    public static final String SIMPLEPERF = "simpleperf";

    public Configuration {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(text, "text is required");
    }

    /** Tool name, defaulting to perfetto when the row predates the column */
    public String tool() {
        return tracingTool == null || tracingTool.isBlank()
                ? PERFETTO
                : tracingTool.toLowerCase(Locale.ROOT);
    }
}
