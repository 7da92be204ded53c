package com.questrail.tommy.internal.zone;

import com.questrail.tommy.api.DeviceEntry;
import com.questrail.tommy.api.SensorSpec;
import com.questrail.tommy.api.ZoneEntityPlatform;
import com.questrail.tommy.api.ZoneInfo;
import com.questrail.tommy.api.ZoneRegistry;
import com.questrail.tommy.internal.time.WallClock;
import com.questrail.tommy.observability.NullObservabilitySink;
import com.questrail.tommy.observability.ZoneErrorEvent;
import com.questrail.tommy.observability.ZoneLifecycleEvent;
import com.questrail.tommy.observability.ZoneObservabilitySink;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * ZoneReconciler
 * =============================================================================
 * Diffs each complete zone roster against the known-zone table and applies the
 * minimal create / remove / rename operations.
 *
 * <h2>Algorithm</h2>
 * <pre>
 *   newIds      = roster ids (last occurrence of a duplicate id wins)
 *   existingIds = table ids
 *
 *   1. added   = newIds − existingIds   → sensors created, one platform batch
 *   2. removed = existingIds − newIds   → table entry, entity, device dropped
 *   3. renamed = newIds ∩ existingIds with a different stored name
 *   4. snapshot = roster                (always)
 * </pre>
 *
 * <h2>Failure isolation</h2>
 * Registry and platform calls are made per zone and per operation; a failure
 * is reported to the sink and the remaining work proceeds. Table and snapshot
 * updates depend only on local state and always complete.
 *
 * <h2>Entity platform</h2>
 * The platform may be attached after the first roster arrives. Until then,
 * additions are skipped with a warning and retried on the next roster, since
 * the skipped ids never enter the table.
 *
 * <h2>Threading</h2>
 * Consumer context only. No locks.
 */
public final class ZoneReconciler
{
    private static final String ALL_ZONES = "*";

    private final String sessionId;
    private final ZoneRegistry registry;
    private final ZoneTable table;
    private final WallClock clock;
    private final ZoneObservabilitySink observabilitySink;

    private ZoneEntityPlatform entityPlatform;
    private List<ZoneInfo> snapshot = List.of();

    public ZoneReconciler(String sessionId,
                          ZoneRegistry registry,
                          ZoneTable table,
                          WallClock clock,
                          ZoneObservabilitySink observabilitySink)
    {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.table = Objects.requireNonNull(table, "table");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    public void attachEntityPlatform(ZoneEntityPlatform entityPlatform) {
        this.entityPlatform = Objects.requireNonNull(entityPlatform, "entityPlatform");
    }

    /**
     * Applies one complete roster. Identical rosters are a no-op; an empty
     * roster removes every known zone.
     */
    public ReconcileOutcome update(List<ZoneInfo> roster) {
        Objects.requireNonNull(roster, "roster");

        Map<String, ZoneInfo> incoming = new LinkedHashMap<>();
        for (ZoneInfo zone : roster) {
            incoming.put(zone.id(), zone);
        }

        Set<String> existingIds = new LinkedHashSet<>(table.ids());

        List<ZoneInfo> toAdd = new ArrayList<>();
        for (ZoneInfo zone : incoming.values()) {
            if (!existingIds.contains(zone.id())) {
                toAdd.add(zone);
            }
        }

        List<String> toRemove = new ArrayList<>();
        for (String id : existingIds) {
            if (!incoming.containsKey(id)) {
                toRemove.add(id);
            }
        }

        Set<String> added = toAdd.isEmpty() ? Set.of() : addZones(toAdd);
        Set<String> removed = toRemove.isEmpty() ? Set.of() : removeZones(toRemove);

        Set<String> renamed = new LinkedHashSet<>();
        for (ZoneInfo zone : incoming.values()) {
            if (!existingIds.contains(zone.id())) {
                continue;
            }
            table.get(zone.id())
                    .filter(record -> !record.info().name().equals(zone.name()))
                    .ifPresent(record -> {
                        renameZone(record, zone.name());
                        renamed.add(zone.id());
                    });
        }

        snapshot = List.copyOf(incoming.values());
        return new ReconcileOutcome(added, removed, renamed);
    }

    /**
     * The last roster applied, duplicates collapsed.
     */
    public List<ZoneInfo> knownZones() {
        return snapshot;
    }

    /**
     * Forgets every zone without touching the registries.
     */
    public void clear() {
        table.clear();
        snapshot = List.of();
    }

    /**
     * Finds the registry device of a zone in this session. The hub device is
     * never returned.
     */
    public Optional<DeviceEntry> lookupDeviceByZone(String zoneId) {
        return Optional.ofNullable(devicesByZone().get(zoneId));
    }

    // -------------------------------------------------------------------------
    // Added
    // -------------------------------------------------------------------------

    private Set<String> addZones(List<ZoneInfo> zones) {
        ZoneEntityPlatform platform = entityPlatform;
        if (platform == null) {
            lifecycle(ZoneLifecycleEvent.Kind.CREATION_SKIPPED, ALL_ZONES,
                    "entity platform not available, " + zones.size() + " zone(s) pending");
            return Set.of();
        }

        Set<String> added = new LinkedHashSet<>();
        List<SensorSpec> batch = new ArrayList<>(zones.size());
        for (ZoneInfo zone : zones) {
            String uniqueId = ZoneIdentifiers.entityUniqueId(sessionId, zone.id());
            ZoneMotionSensor sensor = new ZoneMotionSensor(
                    zone.id(), uniqueId, zone.name(), ZoneIdentifiers.zoneDeviceInfo(sessionId, zone));

            table.insert(new ZoneRecord(zone, sensor));
            batch.add(new SensorSpec(zone.id(), zone.name(), uniqueId, sensor.deviceInfo(), sensor));
            added.add(zone.id());
        }

        try {
            platform.createSensorEntities(List.copyOf(batch));
        } catch (RuntimeException e) {
            error("Failed to register " + batch.size() + " zone entities", e);
        }

        for (ZoneInfo zone : zones) {
            lifecycle(ZoneLifecycleEvent.Kind.CREATED, zone.id(), zone.name());
        }
        return added;
    }

    // -------------------------------------------------------------------------
    // Removed
    // -------------------------------------------------------------------------

    private Set<String> removeZones(List<String> zoneIds) {
        Map<String, DeviceEntry> devices;
        try {
            devices = devicesByZone();
        } catch (RuntimeException e) {
            error("Failed to list devices for session " + sessionId, e);
            devices = Map.of();
        }

        Set<String> removed = new LinkedHashSet<>();
        for (String zoneId : zoneIds) {
            table.remove(zoneId).ifPresent(record -> record.sensor().markRemoved());
            removed.add(zoneId);

            String uniqueId = ZoneIdentifiers.entityUniqueId(sessionId, zoneId);
            try {
                registry.lookupEntityByUniqueId(uniqueId)
                        .ifPresent(entity -> registry.removeEntity(entity.entityId()));
            } catch (RuntimeException e) {
                error("Failed to remove entity " + uniqueId + " for zone " + zoneId, e);
            }

            DeviceEntry device = devices.get(zoneId);
            if (device != null) {
                try {
                    registry.removeDevice(device.deviceId());
                } catch (RuntimeException e) {
                    error("Failed to remove device " + device.identifier() + " for zone " + zoneId, e);
                }
            }

            lifecycle(ZoneLifecycleEvent.Kind.REMOVED, zoneId, "removed");
        }
        return removed;
    }

    private Map<String, DeviceEntry> devicesByZone() {
        Map<String, DeviceEntry> byZone = new HashMap<>();
        for (DeviceEntry device : registry.devices()) {
            ZoneIdentifiers.zoneIdOf(sessionId, device.identifier())
                    .ifPresent(zoneId -> byZone.put(zoneId, device));
        }
        return byZone;
    }

    // -------------------------------------------------------------------------
    // Renamed
    // -------------------------------------------------------------------------

    private void renameZone(ZoneRecord record, String newName) {
        String zoneId = record.zoneId();
        String oldName = record.info().name();
        String expectedDeviceName = ZoneIdentifiers.zoneDeviceName(newName);

        try {
            registry.lookupDevice(ZoneIdentifiers.zoneDeviceIdentifier(sessionId, zoneId))
                    .filter(device -> !device.name().equals(expectedDeviceName))
                    .ifPresent(device -> registry.updateDeviceName(device.deviceId(), expectedDeviceName));
        } catch (RuntimeException e) {
            error("Failed to rename device for zone " + zoneId, e);
        }

        try {
            registry.lookupEntityByUniqueId(ZoneIdentifiers.entityUniqueId(sessionId, zoneId))
                    .filter(entity -> entity.labelOverride().isPresent())
                    .ifPresent(entity -> registry.clearEntityLabelOverride(entity.entityId()));
        } catch (RuntimeException e) {
            error("Failed to clear entity label for zone " + zoneId, e);
        }

        record.rename(newName);
        ZoneMotionSensor sensor = record.sensor();
        sensor.setName(newName);
        sensor.setDeviceInfo(ZoneIdentifiers.zoneDeviceInfo(sessionId, record.info()));

        if (sensor.isAttached()) {
            try {
                sensor.publishState();
            } catch (RuntimeException e) {
                error("Failed to publish renamed zone " + zoneId, e);
            }
        }

        lifecycle(ZoneLifecycleEvent.Kind.RENAMED, zoneId, oldName + " -> " + newName);
    }

    private void lifecycle(ZoneLifecycleEvent.Kind kind, String zoneId, String detail) {
        observabilitySink.onZoneLifecycleEvent(new ZoneLifecycleEvent(clock.now(), kind, zoneId, detail));
    }

    private void error(String message, Throwable cause) {
        observabilitySink.onError(new ZoneErrorEvent(clock.now(), message, cause));
    }
}
