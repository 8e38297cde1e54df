package prism.coordinator.service;

import prism.coordinator.model.Device;
import prism.coordinator.model.DeviceStatus;
import prism.coordinator.repository.DeviceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Authoritative record of which devices exist, which host owns each one,
 * and whether it is reachable.
 * Liveness reports are last-write-wins; there is no fencing between hosts.
 */
public class DeviceRegistry {

    private static final Logger log = LoggerFactory.getLogger(DeviceRegistry.class);

    private final DeviceRepository deviceRepository;
    private final Clock clock;

    public DeviceRegistry(DeviceRepository deviceRepository) {
        this(deviceRepository, Clock.systemUTC());
    }

    public DeviceRegistry(DeviceRepository deviceRepository, Clock clock) {
        this.deviceRepository = deviceRepository;
        this.clock = clock;
    }

    /**
     * Return the device with this serial (or id), creating it if unknown.
     * Calling twice with the same serial yields the same device.
     *
     * @param serial hardware serial as reported by the device bridge
     * @param name   display name for a newly created device; defaults to the serial
     */
    public synchronized Device upsert(String serial, String name) {
        requireText(serial, "device serial");
        Optional<Device> existing = deviceRepository.findBySerialOrId(serial);
        if (existing.isPresent()) {
            return existing.get();
        }
        return create(deviceRepository.generateId(), serial, name);
    }

    /**
     * Register a device with an optional caller-chosen id.
     * An existing device with the same id or serial is returned unchanged.
     */
    public synchronized Device register(String deviceId, String serial, String name) {
        if (deviceId != null && !deviceId.isBlank()) {
            Optional<Device> byId = deviceRepository.findById(deviceId);
            if (byId.isPresent()) {
                return byId.get();
            }
        }
        if (serial != null && !serial.isBlank()) {
            Optional<Device> bySerial = deviceRepository.findBySerialOrId(serial);
            if (bySerial.isPresent()) {
                return bySerial.get();
            }
        }
        if ((deviceId == null || deviceId.isBlank()) && (serial == null || serial.isBlank())) {
            throw new IllegalArgumentException("device_id or device_uuid is required");
        }
        String id = deviceId != null && !deviceId.isBlank() ? deviceId : deviceRepository.generateId();
        return create(id, serial, name);
    }

    /**
     * Record a liveness observation. Overwrites status, owning host and last-seen.
     *
     * @throws NotFoundException if no device matches
     */
    public Device reportLiveness(String serialOrId, DeviceStatus status, String hostName) {
        Device device = lookup(serialOrId).orElseThrow(() -> NotFoundException.of("device", serialOrId));
        Instant now = clock.instant();
        deviceRepository.updateLiveness(device.id(), status, hostName, now);
        log.debug("Device {} reported {} by {}", device.id(), status.wireName(), hostName);
        return device.toBuilder().status(status).currentHost(hostName).lastSeen(now).build();
    }

    /**
     * Apply a full update from a host: optional rename plus a liveness report.
     */
    public Device update(String deviceId, String name, DeviceStatus status, String hostName) {
        Device device = deviceRepository.findById(deviceId)
                .orElseThrow(() -> NotFoundException.of("device", deviceId));
        if (name != null && !name.isBlank() && !name.equals(device.name())) {
            deviceRepository.updateName(deviceId, name);
            device = device.toBuilder().name(name).build();
        }
        if (status != null) {
            Instant now = clock.instant();
            deviceRepository.updateLiveness(deviceId, status, hostName, now);
            device = device.toBuilder().status(status).currentHost(hostName).lastSeen(now).build();
        }
        return device;
    }

    /**
     * Mark offline every device attributed to {@code hostName} that the host
     * no longer observes. A device adopted by another host meanwhile is left alone.
     *
     * @param observed device ids (or serials) the host currently sees, including
     *                 devices it is tracing
     * @return number of devices marked offline
     */
    public int sweep(String hostName, Collection<String> observed) {
        requireText(hostName, "host name");
        int swept = 0;
        for (Device device : deviceRepository.findByHost(hostName)) {
            if (device.status() == DeviceStatus.OFFLINE) {
                continue;
            }
            if (observed.contains(device.id()) || observed.contains(device.serial())) {
                continue;
            }
            if (deviceRepository.markOfflineIfOwnedBy(device.id(), hostName)) {
                swept++;
            }
        }
        if (swept > 0) {
            log.info("Host {} sweep marked {} device(s) offline", hostName, swept);
        }
        return swept;
    }

    public Optional<Device> lookup(String serialOrId) {
        if (serialOrId == null || serialOrId.isBlank()) {
            return Optional.empty();
        }
        return deviceRepository.findBySerialOrId(serialOrId);
    }

    /**
     * Mark offline every device not seen within {@code window}.
     *
     * @return number of devices marked offline
     */
    public int decayStale(Duration window) {
        List<String> changed = deviceRepository.markStaleOffline(clock.instant().minus(window));
        if (!changed.isEmpty()) {
            log.warn("Marked {} stale device(s) offline: {}", changed.size(), changed);
        }
        return changed.size();
    }

    public List<Device> listAll() {
        return deviceRepository.findAll();
    }

    private Device create(String id, String serial, String name) {
        Device device = Device.builder()
                .id(id)
                .serial(serial)
                .name(name != null && !name.isBlank() ? name : (serial != null ? serial : id))
                .status(DeviceStatus.OFFLINE)
                .createdAt(clock.instant())
                .build();
        deviceRepository.save(device);
        log.info("Registered device {} (serial {})", device.id(), device.serial());
        return device;
    }

    private static void requireText(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(what + " is required");
        }
    }
}
