package com.guildpool.core.membership;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One-to-many index whose entries carry an occupancy count. An entry disappears only when the last
 * reference to it is released, and a key disappears only when its last entry does.
 * Not thread-safe; callers synchronize.
 */
class ReferenceCountedIndex<K, V> {

    private final Map<K, Map<V, Integer>> entries = new LinkedHashMap<>();

    /**
     * @return true if the value was not present under the key before
     */
    boolean acquire(K key, V value) {
        Map<V, Integer> values = entries.computeIfAbsent(key, k -> new LinkedHashMap<>());
        return values.merge(value, 1, Integer::sum) == 1;
    }

    /**
     * @return true if this released the last reference to the value under the key
     */
    boolean release(K key, V value) {
        Map<V, Integer> values = entries.get(key);
        if (values == null) {
            return false;
        }
        Integer count = values.get(value);
        if (count == null) {
            return false;
        }
        if (count > 1) {
            values.put(value, count - 1);
            return false;
        }
        values.remove(value);
        if (values.isEmpty()) {
            entries.remove(key);
        }
        return true;
    }

    boolean contains(K key, V value) {
        Map<V, Integer> values = entries.get(key);
        return values != null && values.containsKey(value);
    }

    int references(K key, V value) {
        Map<V, Integer> values = entries.get(key);
        return values == null ? 0 : values.getOrDefault(value, 0);
    }

    List<V> values(K key) {
        Map<V, Integer> values = entries.get(key);
        return values == null ? List.of() : List.copyOf(values.keySet());
    }

    int count(K key) {
        Map<V, Integer> values = entries.get(key);
        return values == null ? 0 : values.size();
    }

    Set<K> keys() {
        return Set.copyOf(entries.keySet());
    }
}
