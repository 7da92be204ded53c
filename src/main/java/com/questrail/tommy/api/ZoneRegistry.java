package com.questrail.tommy.api;

import java.util.List;
import java.util.Optional;

/**
 * ZoneRegistry
 * =============================================================================
 * Host-provided device and entity registries, scoped to one hub session.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>Removal operations are idempotent: removing an unknown id is a no-op.</li>
 *   <li>Any operation may fail by throwing a {@link RuntimeException}; the
 *       reconciler isolates such failures per zone.</li>
 *   <li>All calls arrive on the consumer context.</li>
 * </ul>
 */
public interface ZoneRegistry
{
    /**
     * Returns every device registered for this session, hub included.
     */
    List<DeviceEntry> devices();

    Optional<DeviceEntry> lookupDevice(String identifier);

    Optional<EntityEntry> lookupEntityByUniqueId(String uniqueId);

    /**
     * Registers a device if its identifier is not known yet.
     *
     * @return the existing or newly created entry
     */
    DeviceEntry getOrCreateDevice(String identifier, String name);

    void removeEntity(String entityId);

    void removeDevice(String deviceId);

    void updateDeviceName(String deviceId, String name);

    void clearEntityLabelOverride(String entityId);
}
