package com.questrail.tommy.api;

import java.util.Objects;
import java.util.Optional;

/**
 * Registry view of an entity.
 *
 * @param entityId      registry-assigned entity id
 * @param uniqueId      integration unique id
 * @param labelOverride manually set label, empty when the label is derived
 */
public record EntityEntry(String entityId, String uniqueId, Optional<String> labelOverride)
{
    public EntityEntry {
        Objects.requireNonNull(entityId, "entityId");
        Objects.requireNonNull(uniqueId, "uniqueId");
        Objects.requireNonNull(labelOverride, "labelOverride");
    }
}
