package com.questrail.tommy.api;

import java.util.Objects;

/**
 * Device descriptor attached to a zone's motion sensor.
 *
 * @param identifier    registry identifier of the zone device ({@code <session>_<zone>})
 * @param name          display name of the device
 * @param viaIdentifier identifier of the hub device the zone device hangs off
 */
public record DeviceInfo(String identifier, String name, String viaIdentifier)
{
    public DeviceInfo {
        Objects.requireNonNull(identifier, "identifier");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(viaIdentifier, "viaIdentifier");
    }
}
