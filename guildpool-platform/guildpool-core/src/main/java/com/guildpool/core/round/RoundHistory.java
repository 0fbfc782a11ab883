package com.guildpool.core.round;

import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Append-only, round-versioned value. A lookup at round R returns the value recorded at the
 * greatest round not above R. Only the latest recorded round may be overwritten; earlier rounds are frozen.
 */
public class RoundHistory<T> {

    private final NavigableMap<Long, T> values = new TreeMap<>();

    public synchronized void record(long round, T value) {
        if (!values.isEmpty() && round < values.lastKey()) {
            throw new IllegalStateException(
                    "Round " + round + " precedes latest recorded round " + values.lastKey());
        }
        values.put(round, value);
    }

    public synchronized Optional<T> valueAt(long round) {
        Map.Entry<Long, T> entry = values.floorEntry(round);
        return entry == null ? Optional.empty() : Optional.of(entry.getValue());
    }

    public synchronized Optional<T> latest() {
        return values.isEmpty() ? Optional.empty() : Optional.of(values.lastEntry().getValue());
    }

    public synchronized Optional<Long> latestRound() {
        return values.isEmpty() ? Optional.empty() : Optional.of(values.lastKey());
    }

    public synchronized boolean isEmpty() {
        return values.isEmpty();
    }
}
