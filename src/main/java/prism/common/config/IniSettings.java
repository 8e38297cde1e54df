package prism.common.config;

import org.ini4j.Ini;
import org.ini4j.Profile;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * Read-only view over an INI file, shared by the coordinator and worker
 * configuration loaders. Blank values count as absent.
 */
public final class IniSettings {

    private final Ini ini;

    private IniSettings(Ini ini) {
        this.ini = ini;
    }

    public static IniSettings load(Path file) throws IOException {
        return new IniSettings(new Ini(file.toFile()));
    }

    public boolean hasSection(String section) {
        return ini.get(section) != null;
    }

    public Optional<String> string(String section, String key) {
        Profile.Section s = ini.get(section);
        if (s == null) {
            return Optional.empty();
        }
        String v = s.get(key);
        return (v == null || v.isBlank()) ? Optional.empty() : Optional.of(v.trim());
    }

    public Optional<Integer> integer(String section, String key) {
        return string(section, key).map(v -> parseInt(section, key, v));
    }

    public Optional<Boolean> bool(String section, String key) {
        return string(section, key).map(Boolean::parseBoolean);
    }

    /** Durations are written as whole seconds */
    public Optional<Duration> seconds(String section, String key) {
        return integer(section, key).map(Duration::ofSeconds);
    }

    private static int parseInt(String section, String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "[" + section + "] " + key + " must be an integer, got '" + value + "'", e);
        }
    }
}
