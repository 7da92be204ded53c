package com.questrail.tommy.internal.zone;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * ZoneTable
 * =============================================================================
 * The known-zone table: zone id → {@link ZoneRecord}.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>An id is present iff its sensor was created and not yet removed.</li>
 *   <li>At most one record per id; inserting a present id is a programming
 *       error and raises {@link IllegalStateException}.</li>
 * </ul>
 *
 * <p>Written by {@link ZoneReconciler}, read by {@link MotionRouter}. Consumer
 * context only; not thread-safe.</p>
 */
public final class ZoneTable
{
    private final Map<String, ZoneRecord> records = new LinkedHashMap<>();

    void insert(ZoneRecord record) {
        Objects.requireNonNull(record, "record");
        if (records.putIfAbsent(record.zoneId(), record) != null) {
            throw new IllegalStateException("Zone " + record.zoneId() + " is already known");
        }
    }

    Optional<ZoneRecord> remove(String zoneId) {
        return Optional.ofNullable(records.remove(zoneId));
    }

    public Optional<ZoneRecord> get(String zoneId) {
        return Optional.ofNullable(records.get(zoneId));
    }

    public boolean contains(String zoneId) {
        return records.containsKey(zoneId);
    }

    /**
     * Known ids in insertion order; an unmodifiable view.
     */
    public Set<String> ids() {
        return Collections.unmodifiableSet(records.keySet());
    }

    public int size() {
        return records.size();
    }

    /**
     * Drops every record and marks its sensor removed.
     *
     * @return the records that were dropped
     */
    List<ZoneRecord> clear() {
        List<ZoneRecord> dropped = new ArrayList<>(records.values());
        records.clear();
        dropped.forEach(r -> r.sensor().markRemoved());
        return dropped;
    }
}
