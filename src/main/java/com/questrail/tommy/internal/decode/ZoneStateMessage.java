package com.questrail.tommy.internal.decode;

import com.questrail.tommy.api.ZoneInfo;

import java.util.List;
import java.util.Objects;

/**
 * A validated zone-state message: the motion of one zone plus the complete
 * current roster.
 *
 * @param zoneId zone the motion value refers to
 * @param motion decoded motion literal
 * @param zones  complete roster, in wire order
 */
public record ZoneStateMessage(String zoneId, MotionState motion, List<ZoneInfo> zones)
{
    public ZoneStateMessage {
        Objects.requireNonNull(zoneId, "zoneId");
        Objects.requireNonNull(motion, "motion");
        zones = List.copyOf(zones);
    }

    public boolean motionDetected() {
        return motion.isMotion();
    }
}
