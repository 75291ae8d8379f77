/* @LICENSE@  
 */
package org.dfarx.regex;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * A one to many map: each key maps to a set of values. Duplicate key-value
 * mappings are ignored, and a key with an empty set is never stored. Keys and
 * values iterate in insertion order.
 */
final class MultiMap<K, V> {

    private final Map<K, Set<V>> map = new LinkedHashMap<K, Set<V>>();

    MultiMap() {
    }

    MultiMap(MultiMap<K, V> mm) {
        addAll(mm);
    }

    /**
     * @return a copy of the values mapped to <code>key</code>; empty, never
     *         null, if there are none.
     */
    Set<V> get(K key) {
        Set<V> values = map.get(key);
        return values == null 
                ? new LinkedHashSet<V>() 
                : new LinkedHashSet<V>(values);
    }

    boolean containsKey(K key) {
        return map.containsKey(key);
    }

    /**
     * @return true if the mapping was not already present.
     */
    boolean add(K key, V value) {
        Set<V> values = map.get(key);
        if (values == null) {
            map.put(key, values = new LinkedHashSet<V>());
        }
        return values.add(value);
    }

    /**
     * @return true if any mapping was not already present.
     */
    boolean addAll(K key, Collection<? extends V> values) {
        if (values.isEmpty()) return false;
        Set<V> set = map.get(key);
        if (set == null) {
            map.put(key, set = new LinkedHashSet<V>());
        }
        return set.addAll(values);
    }

    /**
     * Add every mapping of <code>mm</code> to this map.
     * 
     * @return true if any mapping was not already present.
     */
    boolean addAll(MultiMap<K, V> mm) {
        boolean changed = false;
        for (Map.Entry<K, Set<V>> e : mm.map.entrySet()) {
            changed |= addAll(e.getKey(), e.getValue());
        }
        return changed;
    }

    /**
     * Remove every value mapped to <code>key</code>.
     * 
     * @return the removed values, empty if there were none.
     */
    Set<V> remove(K key) {
        Set<V> values = map.remove(key);
        return values == null ? new LinkedHashSet<V>() : values;
    }

    Set<K> keySet() {
        return Collections.unmodifiableSet(map.keySet());
    }

    /**
     * @return an unmodifiable view of the map; the value sets are live, and
     *         must not be modified.
     */
    Map<K, Set<V>> asMap() {
        return Collections.unmodifiableMap(map);
    }

    boolean isEmpty() {
        return map.isEmpty();
    }

    /**
     * @return the number of keys.
     */
    int size() {
        return map.size();
    }

    /**
     * Compute the union of several multimaps.
     * 
     * @return a new multimap holding every mapping of every argument.
     */
    static <K, V> MultiMap<K, V> union(Iterable<MultiMap<K, V>> mms) {
        MultiMap<K, V> union = new MultiMap<K, V>();
        for (MultiMap<K, V> mm : mms) {
            union.addAll(mm);
        }
        return union;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MultiMap)) return false;
        return map.equals(((MultiMap<?, ?>) o).map);
    }

    @Override
    public int hashCode() {
        return map.hashCode();
    }

    @Override
    public String toString() {
        return map.toString();
    }
}
