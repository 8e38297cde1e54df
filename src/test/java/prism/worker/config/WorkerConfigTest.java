package prism.worker.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class WorkerConfigTest {

    @Test
    void defaults() {
        WorkerConfig config = WorkerConfig.defaults();
        assertEquals(4, config.maxParallelTraces());
        assertEquals(Duration.ofSeconds(5), config.livenessInterval());
        assertEquals(Duration.ofSeconds(5), config.workInterval());
        assertEquals("http://localhost:8080", config.coordinatorUrl());
        assertFalse(config.hasHostKey());
        assertFalse(config.hostName().isBlank());
    }

    @Test
    void readsWorkerSection(@TempDir Path dir) throws Exception {
        Path ini = dir.resolve("prism.ini");
        Files.writeString(ini, """
                [coordinator]
                port = 9090

                [worker]
                host_name = lab-host-3
                coordinator_url = http://prism.lab:9090
                host_key = s3cret
                max_parallel_traces = 2
                work_interval = 10
                adb_path = /opt/android/platform-tools/adb
                """);

        WorkerConfig config = WorkerConfig.fromIni(ini);

        assertEquals("lab-host-3", config.hostName());
        assertEquals("http://prism.lab:9090", config.coordinatorUrl());
        assertTrue(config.hasHostKey());
        assertEquals(2, config.maxParallelTraces());
        assertEquals(Duration.ofSeconds(10), config.workInterval());
        assertEquals("/opt/android/platform-tools/adb", config.adbPath());
    }

    @Test
    void parallelTracesMustBePositive(@TempDir Path dir) throws Exception {
        Path ini = dir.resolve("prism.ini");
        Files.writeString(ini, "[worker]\nmax_parallel_traces = 0\n");
        assertThrows(IllegalArgumentException.class, () -> WorkerConfig.fromIni(ini));
        assertThrows(IllegalArgumentException.class, () -> WorkerConfig.defaults().withMaxParallelTraces(-1));
    }
}
