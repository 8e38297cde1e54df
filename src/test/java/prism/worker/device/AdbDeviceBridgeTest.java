package prism.worker.device;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class AdbDeviceBridgeTest {

    @Test
    void parsesDeviceListing() {
        String output = """
                * daemon not running; starting now at tcp:5037
                * daemon started successfully
                List of devices attached
                R58M123ABC\tdevice
                emulator-5554\toffline
                0a1b2c3d\tunauthorized

                """;

        List<AttachedDevice> devices = AdbDeviceBridge.parseDevices(output);

        assertEquals(List.of(
                new AttachedDevice("R58M123ABC", "device"),
                new AttachedDevice("emulator-5554", "offline"),
                new AttachedDevice("0a1b2c3d", "unauthorized")), devices);
        assertTrue(devices.get(0).isReady());
        assertFalse(devices.get(1).isReady());
    }

    @Test
    void emptyListing() {
        assertTrue(AdbDeviceBridge.parseDevices("List of devices attached\n\n").isEmpty());
    }

    @Test
    @EnabledOnOs({ OS.LINUX, OS.MAC })
    void concurrentCommandsEachGetTheirOwnOutput() throws Exception {
        // echo stands in for adb: it prints the arguments it was given
        AdbDeviceBridge bridge = new AdbDeviceBridge("echo");
        ExecutorService callers = Executors.newFixedThreadPool(8);
        try {
            List<Future<ShellResult>> results = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                String serial = "serial-" + i;
                results.add(callers.submit(() -> bridge.shell(serial, "getprop", Duration.ofSeconds(10))));
            }
            for (int i = 0; i < 16; i++) {
                ShellResult result = results.get(i).get();
                assertTrue(result.succeeded());
                assertEquals("-s serial-" + i + " shell getprop", result.output().trim());
            }
        } finally {
            callers.shutdownNow();
        }
    }

    @Test
    @EnabledOnOs({ OS.LINUX, OS.MAC })
    void failingListingIsAnIoError() {
        AdbDeviceBridge bridge = new AdbDeviceBridge("false");
        assertThrows(IOException.class, bridge::attachedDevices);
    }
}
