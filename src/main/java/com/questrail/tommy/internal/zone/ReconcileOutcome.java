package com.questrail.tommy.internal.zone;

import java.util.Set;

/**
 * Zone ids affected by one roster update.
 *
 * @param added   zones whose sensors were created
 * @param removed zones dropped from the table
 * @param renamed zones whose name changed
 */
public record ReconcileOutcome(Set<String> added, Set<String> removed, Set<String> renamed)
{
    public ReconcileOutcome {
        added = Set.copyOf(added);
        removed = Set.copyOf(removed);
        renamed = Set.copyOf(renamed);
    }

    public static ReconcileOutcome none() {
        return new ReconcileOutcome(Set.of(), Set.of(), Set.of());
    }

    public boolean isEmpty() {
        return added.isEmpty() && removed.isEmpty() && renamed.isEmpty();
    }
}
