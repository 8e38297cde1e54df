package prism.coordinator.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class CoordinatorConfigTest {

    @Test
    void defaults() {
        CoordinatorConfig config = CoordinatorConfig.defaults();
        assertEquals(8080, config.serverPort());
        assertFalse(config.hostAuthEnabled());
        assertEquals(Duration.ofSeconds(30), config.deviceLivenessWindow());
        assertEquals(Duration.ofSeconds(1), config.streamPollInterval());
        assertEquals(60, config.streamMaxIdleHeartbeats());
    }

    @Test
    void iniOverridesDefaults(@TempDir Path dir) throws Exception {
        Path ini = dir.resolve("prism.ini");
        Files.writeString(ini, """
                [coordinator]
                port = 9090
                host_auth = true
                device_liveness_window = 45
                stream_max_idle_heartbeats = 10
                storage_root = /var/lib/prism/objects

                [worker]
                max_parallel_traces = 2
                """);

        CoordinatorConfig config = CoordinatorConfig.fromIni(ini);

        assertEquals(9090, config.serverPort());
        assertTrue(config.hostAuthEnabled());
        assertEquals(Duration.ofSeconds(45), config.deviceLivenessWindow());
        assertEquals(10, config.streamMaxIdleHeartbeats());
        assertEquals("/var/lib/prism/objects", config.storageRoot());
        assertEquals(Duration.ofSeconds(1), config.streamPollInterval(), "unset keys keep defaults");
    }

    @Test
    void badIntegerIsRejected(@TempDir Path dir) throws Exception {
        Path ini = dir.resolve("bad.ini");
        Files.writeString(ini, "[coordinator]\nport = eighty\n");
        assertThrows(IllegalArgumentException.class, () -> CoordinatorConfig.fromIni(ini));
    }
}
