package com.questrail.tommy.internal.zone;

import com.questrail.tommy.internal.time.WallClock;
import com.questrail.tommy.observability.NullObservabilitySink;
import com.questrail.tommy.observability.ZoneErrorEvent;
import com.questrail.tommy.observability.ZoneMotionEvent;
import com.questrail.tommy.observability.ZoneObservabilitySink;

import java.util.Objects;
import java.util.Optional;

/**
 * MotionRouter
 * -----------------------------------------------------------------------------
 * Routes a zone's boolean motion value to its sensor handle, suppressing
 * repeats.
 *
 * <ul>
 *   <li>Unknown or removed zone: ignored.</li>
 *   <li>Same value as last stored: ignored.</li>
 *   <li>Otherwise: stored, and the handle notified exactly once.</li>
 * </ul>
 *
 * <p>Consumer context only.</p>
 */
public final class MotionRouter
{
    private final ZoneTable table;
    private final WallClock clock;
    private final ZoneObservabilitySink observabilitySink;

    public MotionRouter(ZoneTable table, WallClock clock, ZoneObservabilitySink observabilitySink) {
        this.table = Objects.requireNonNull(table, "table");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    /**
     * @return {@code true} if the stored state changed and the handle was notified
     */
    public boolean update(String zoneId, boolean motion) {
        Optional<ZoneRecord> record = table.get(zoneId);
        if (record.isEmpty()) {
            return false;
        }

        ZoneMotionSensor sensor = record.get().sensor();
        if (sensor.currentState().equals(Optional.of(motion))) {
            return false;
        }

        try {
            sensor.applyMotion(motion);
        } catch (RuntimeException e) {
            // State is stored before the listener runs.
            observabilitySink.onError(new ZoneErrorEvent(
                    clock.now(), "Sensor listener failed for zone " + zoneId, e));
        }

        observabilitySink.onMotionEvent(new ZoneMotionEvent(clock.now(), zoneId, motion));
        return true;
    }
}
