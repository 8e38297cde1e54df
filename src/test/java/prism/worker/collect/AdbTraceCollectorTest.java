package prism.worker.collect;

import prism.coordinator.model.Configuration;
import prism.worker.collect.TraceCollector.CollectedTrace;
import prism.worker.device.FakeDeviceBridge;
import prism.worker.device.ShellResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class AdbTraceCollectorTest {

    @TempDir
    Path workDir;

    @Test
    void perfettoPushesConfigWithDurationAndPullsTrace() throws Exception {
        FakeDeviceBridge bridge = new FakeDeviceBridge("R58M123");
        AdbTraceCollector collector = new AdbTraceCollector(bridge, workDir, Duration.ofSeconds(30));
        Configuration config = new Configuration("cfg-1", "sched", "buffers { size_kb: 1024 }",
                Configuration.PERFETTO, null, Instant.now());

        CollectedTrace trace = collector.collect("R58M123", config, 12);

        assertEquals("perfetto-trace", trace.extension());
        assertEquals("trace-bytes", Files.readString(trace.file()));
        assertEquals(1, bridge.pushed.size());
        String pushedText = bridge.pushed.values().iterator().next();
        assertTrue(pushedText.startsWith("duration_ms: 12000\n"));
        assertTrue(pushedText.endsWith("buffers { size_kb: 1024 }"));
        assertTrue(bridge.commands.stream().anyMatch(c -> c.contains("perfetto -c ") && c.endsWith("--txt")));
        assertTrue(bridge.commands.stream().anyMatch(c -> c.contains("rm -f ")), "device files are removed");
    }

    @Test
    void simpleperfBuildsRecordCommand() throws Exception {
        FakeDeviceBridge bridge = new FakeDeviceBridge("R58M123");
        AdbTraceCollector collector = new AdbTraceCollector(bridge, workDir, Duration.ofSeconds(30));
        Configuration config = new Configuration("cfg-2", "cpu", """
                {"debug_app_id": "com.example.app", "events": ["cpu-clock"], "frequency": 1000}
                """, Configuration.SIMPLEPERF, 5, Instant.now());

        CollectedTrace trace = collector.collect("R58M123", config, 5);

        assertEquals("data", trace.extension());
        String record = bridge.commands.stream().filter(c -> c.contains("simpleperf record")).findFirst()
                .orElseThrow();
        assertTrue(record.contains("--app com.example.app"));
        assertTrue(record.contains("--duration 5"));
        assertTrue(record.contains("-f 1000"));
        assertTrue(record.contains("-e cpu-clock"));
        assertTrue(record.contains("--call-graph dwarf"));
    }

    @Test
    void toolFailureIsReported() {
        FakeDeviceBridge bridge = new FakeDeviceBridge("R58M123");
        bridge.toolResult = new ShellResult(1, "perfetto: permission denied");
        AdbTraceCollector collector = new AdbTraceCollector(bridge, workDir, Duration.ofSeconds(30));
        Configuration config = new Configuration("cfg-1", "sched", "buffers {}", null, null, Instant.now());

        IOException e = assertThrows(IOException.class, () -> collector.collect("R58M123", config, 1));
        assertTrue(e.getMessage().contains("permission denied"));
    }

    @Test
    void emptyTraceIsAFailure() {
        FakeDeviceBridge bridge = new FakeDeviceBridge("R58M123");
        bridge.pulledContent = new byte[0];
        AdbTraceCollector collector = new AdbTraceCollector(bridge, workDir, Duration.ofSeconds(30));
        Configuration config = new Configuration("cfg-1", "sched", "buffers {}", null, null, Instant.now());

        assertThrows(IOException.class, () -> collector.collect("R58M123", config, 1));
    }

    @Test
    void malformedSimpleperfConfig() {
        FakeDeviceBridge bridge = new FakeDeviceBridge("R58M123");
        AdbTraceCollector collector = new AdbTraceCollector(bridge, workDir, Duration.ofSeconds(30));
        Configuration config = new Configuration("cfg-2", "cpu", "not json", Configuration.SIMPLEPERF, null,
                Instant.now());

        assertThrows(IOException.class, () -> collector.collect("R58M123", config, 1));
    }
}
