package com.questrail.tommy.internal.zone;

import com.questrail.tommy.api.DeviceInfo;
import com.questrail.tommy.api.ZoneInfo;

import java.util.Optional;

/**
 * Identifier and display-name derivations shared by the reconciler and the
 * runtime. All values are scoped to one hub session id.
 */
public final class ZoneIdentifiers
{
    public static final String HUB_DEVICE_NAME = "TOMMY Hub";

    private ZoneIdentifiers() {
    }

    /**
     * {@code <session>_zone_<zone>_motion}
     */
    public static String entityUniqueId(String sessionId, String zoneId) {
        return sessionId + "_zone_" + zoneId + "_motion";
    }

    /**
     * {@code <session>_<zone>}
     */
    public static String zoneDeviceIdentifier(String sessionId, String zoneId) {
        return sessionId + "_" + zoneId;
    }

    public static String hubDeviceIdentifier(String sessionId) {
        return sessionId;
    }

    public static String zoneDeviceName(String zoneName) {
        return "TOMMY (" + zoneName + ")";
    }

    public static DeviceInfo zoneDeviceInfo(String sessionId, ZoneInfo zone) {
        return new DeviceInfo(
                zoneDeviceIdentifier(sessionId, zone.id()),
                zoneDeviceName(zone.name()),
                hubDeviceIdentifier(sessionId));
    }

    /**
     * Recovers the zone id from a device identifier of this session.
     *
     * @return empty for the hub device and for identifiers of other sessions
     */
    public static Optional<String> zoneIdOf(String sessionId, String deviceIdentifier) {
        if (deviceIdentifier.equals(hubDeviceIdentifier(sessionId))) {
            return Optional.empty();
        }
        String prefix = sessionId + "_";
        if (!deviceIdentifier.startsWith(prefix) || deviceIdentifier.length() == prefix.length()) {
            return Optional.empty();
        }
        return Optional.of(deviceIdentifier.substring(prefix.length()));
    }
}
