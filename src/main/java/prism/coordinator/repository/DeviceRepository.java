package prism.coordinator.repository;

import prism.coordinator.model.Device;
import prism.coordinator.model.DeviceStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Device persistence.
 */
public interface DeviceRepository {

    /**
     * Insert a new device.
     *
     * @param device the device to save
     */
    void save(Device device);

    /**
     * Find a device by its internal id.
     *
     * @param deviceId the device id
     * @return the device if found
     */
    Optional<Device> findById(String deviceId);

    /**
     * Find a device whose serial or id equals the given value.
     * Serial matches win over id matches.
     *
     * @param serialOrId hardware serial or internal id
     * @return the device if found
     */
    Optional<Device> findBySerialOrId(String serialOrId);

    /**
     * @return all devices, by name
     */
    List<Device> findAll();

    /**
     * Get devices currently attributed to a host.
     *
     * @param hostName the host name
     * @return devices whose current host is {@code hostName}
     */
    List<Device> findByHost(String hostName);

    /**
     * Overwrite the liveness fields of a device. Last write wins.
     *
     * @return true if the device exists
     */
    boolean updateLiveness(String deviceId, DeviceStatus status, String hostName, Instant seenAt);

    /**
     * Rename a device.
     *
     * @return true if the device exists
     */
    boolean updateName(String deviceId, String name);

    /**
     * Mark a device offline only if it is still attributed to the given host.
     *
     * @return true if the row changed
     */
    boolean markOfflineIfOwnedBy(String deviceId, String hostName);

    /**
     * Mark every non-offline device last seen before the cutoff as offline.
     *
     * @param cutoff liveness cutoff
     * @return ids of the devices that changed
     */
    List<String> markStaleOffline(Instant cutoff);

    /**
     * Generate a new unique device id.
     */
    String generateId();
}
