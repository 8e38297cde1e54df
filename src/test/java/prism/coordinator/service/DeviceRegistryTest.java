package prism.coordinator.service;

import prism.coordinator.model.Device;
import prism.coordinator.model.DeviceStatus;
import prism.coordinator.store.Database;
import prism.coordinator.store.JdbcDeviceRepository;
import org.junit.jupiter.api.*;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DeviceRegistryTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private Database db;
    private JdbcDeviceRepository repo;
    private DeviceRegistry registry;

    @BeforeEach
    void setUp() {
        db = new Database("jdbc:h2:mem:test-devices-" + System.nanoTime()
                + ";MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE;DB_CLOSE_DELAY=-1", 4);
        repo = new JdbcDeviceRepository(db);
        registry = new DeviceRegistry(repo, Clock.fixed(T0, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    @Test
    void upsertIsIdempotentPerSerial() {
        Device first = registry.upsert("R58M123", "Pixel 7");
        Device second = registry.upsert("R58M123", "another name");

        assertEquals(first.id(), second.id());
        assertEquals("Pixel 7", second.name());
        assertEquals(1, registry.listAll().size());
        assertEquals(DeviceStatus.OFFLINE, first.status());
    }

    @Test
    void upsertRejectsBlankSerial() {
        assertThrows(IllegalArgumentException.class, () -> registry.upsert(" ", "x"));
    }

    @Test
    void reportLivenessRecordsHostAndTime() {
        Device device = registry.upsert("serial-1", null);
        registry.reportLiveness("serial-1", DeviceStatus.ONLINE, "host-a");

        Device stored = registry.lookup(device.id()).orElseThrow();
        assertEquals(DeviceStatus.ONLINE, stored.status());
        assertEquals("host-a", stored.currentHost());
        assertEquals(T0, stored.lastSeen());
        assertEquals("serial-1", stored.name());
    }

    @Test
    void reportLivenessForUnknownDevice() {
        assertThrows(NotFoundException.class,
                () -> registry.reportLiveness("nope", DeviceStatus.ONLINE, "host-a"));
    }

    @Test
    void sweepOnlyTouchesTheCallingHostsDevices() {
        Device kept = registry.upsert("kept", null);
        Device gone = registry.upsert("gone", null);
        Device moved = registry.upsert("moved", null);
        registry.reportLiveness(kept.id(), DeviceStatus.ONLINE, "host-a");
        registry.reportLiveness(gone.id(), DeviceStatus.ONLINE, "host-a");
        // moved was plugged into host-b after host-a saw it
        registry.reportLiveness(moved.id(), DeviceStatus.ONLINE, "host-a");
        registry.reportLiveness(moved.id(), DeviceStatus.BUSY, "host-b");

        int swept = registry.sweep("host-a", List.of(kept.id()));

        assertEquals(1, swept);
        assertEquals(DeviceStatus.ONLINE, registry.lookup(kept.id()).orElseThrow().status());
        assertEquals(DeviceStatus.OFFLINE, registry.lookup(gone.id()).orElseThrow().status());
        assertEquals(DeviceStatus.BUSY, registry.lookup(moved.id()).orElseThrow().status());
    }

    @Test
    void sweepAcceptsSerials() {
        Device device = registry.upsert("by-serial", null);
        registry.reportLiveness(device.id(), DeviceStatus.ONLINE, "host-a");

        assertEquals(0, registry.sweep("host-a", List.of("by-serial")));
        assertEquals(DeviceStatus.ONLINE, registry.lookup(device.id()).orElseThrow().status());
    }

    @Test
    void decayMarksStaleDevicesOffline() {
        Device stale = registry.upsert("stale", null);
        registry.reportLiveness(stale.id(), DeviceStatus.ONLINE, "host-a");

        DeviceRegistry later = new DeviceRegistry(repo, Clock.fixed(T0.plusSeconds(60), ZoneOffset.UTC));
        Device fresh = later.upsert("fresh", null);
        later.reportLiveness(fresh.id(), DeviceStatus.ONLINE, "host-a");

        assertEquals(1, later.decayStale(Duration.ofSeconds(30)));
        assertEquals(DeviceStatus.OFFLINE, later.lookup(stale.id()).orElseThrow().status());
        assertEquals(DeviceStatus.ONLINE, later.lookup(fresh.id()).orElseThrow().status());
        assertEquals(0, later.decayStale(Duration.ofSeconds(30)));
    }

    @Test
    void registerKeepsCallerChosenId() {
        Device device = registry.register("pixel-lab-1", "R58M999", "Lab Pixel");
        assertEquals("pixel-lab-1", device.id());
        assertEquals("R58M999", device.serial());
        assertEquals(device.id(), registry.upsert("R58M999", null).id());
    }
}
