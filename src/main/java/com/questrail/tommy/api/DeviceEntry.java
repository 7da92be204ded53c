package com.questrail.tommy.api;

import java.util.Objects;

/**
 * Registry view of a device.
 *
 * @param deviceId   registry-assigned device id
 * @param identifier integration identifier ({@code <session>} for the hub,
 *                   {@code <session>_<zone>} for a zone device)
 * @param name       current display name
 */
public record DeviceEntry(String deviceId, String identifier, String name)
{
    public DeviceEntry {
        Objects.requireNonNull(deviceId, "deviceId");
        Objects.requireNonNull(identifier, "identifier");
        Objects.requireNonNull(name, "name");
    }
}
