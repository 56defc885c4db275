package com.fintech.anomaly.universe;

import java.util.Set;

/**
 * Result of one universe refresh.
 *
 * @param added Instruments entering the universe
 * @param removed Instruments leaving the universe
 * @param retained Instruments present before and after
 * @param status Refresh outcome; on {@link Status#DATA_UNAVAILABLE} the universe is unchanged
 */
public record UniverseChange(
    Set<String> added,
    Set<String> removed,
    Set<String> retained,
    Status status
) {

    public enum Status {
        UPDATED,
        DATA_UNAVAILABLE
    }

    public UniverseChange {
        added = Set.copyOf(added);
        removed = Set.copyOf(removed);
        retained = Set.copyOf(retained);
    }

    public static UniverseChange unavailable(Set<String> current) {
        return new UniverseChange(Set.of(), Set.of(), current, Status.DATA_UNAVAILABLE);
    }

    public boolean hasChanges() {
        return !added.isEmpty() || !removed.isEmpty();
    }
}
