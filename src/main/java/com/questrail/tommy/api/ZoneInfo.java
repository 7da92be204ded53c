package com.questrail.tommy.api;

import java.util.Objects;

/**
 * ZoneInfo
 * -----------------------------------------------------------------------------
 * Identity and label of one logical zone as reported by a TOMMY hub.
 *
 * <p>{@code id} is stable and broker-assigned; {@code name} is a human label
 * that may change from one roster to the next. Both fields are mandatory:
 * a zone entry missing either is rejected by the decoder and never becomes a
 * {@code ZoneInfo}.</p>
 *
 * @param id   stable zone identifier (identity)
 * @param name current human-readable zone name
 */
public record ZoneInfo(String id, String name)
{
    public ZoneInfo {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
    }

    /**
     * Returns a copy of this zone carrying a different name.
     */
    public ZoneInfo withName(String newName) {
        return new ZoneInfo(id, newName);
    }
}
