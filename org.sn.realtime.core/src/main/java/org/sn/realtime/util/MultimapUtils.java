package org.sn.realtime.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;


/**
 * Helper class to deal with the multimap structure, i.e. something like Map&lt;K, Set&lt;V&gt;&gt;.
 * This is an alternative to the Guava Multimap classes.
 *
 * <p>Empty collections are never left behind in the map: removing the last value of a key removes the key.
 *
 * @param <K> the key
 * @param <V> the type of each value in the collection for this key
 */
public class MultimapUtils<K, V> {
    private final Map<K, Collection<V>> map;
    private final Supplier<Collection<V>> creator;

    /**
     * Setup class to perform operations on a multimap.
     *
     * @param map the source map
     * @param creator function that creates a new collection. Example usage LinkedHashSet::new
     */
    public MultimapUtils(Map<K, Collection<V>> map, Supplier<Collection<V>> creator) {
        this.map = map;
        this.creator = creator;
    }

    /**
     * Get the collection with the given key.
     * Create an empty collection if one does not exist.
     */
    public @Nonnull Collection<V> getOrCreate(K key) {
        return map.computeIfAbsent(key, unused -> creator.get());
    }

    /**
     * Get the collection with the given key.
     */
    public @Nullable Collection<V> get(K key) {
        return map.get(key);
    }

    /**
     * Insert a key value pair into the map.
     *
     * @return true if the collection changed
     */
    public boolean put(K key, V value) {
        return getOrCreate(key).add(value);
    }

    /**
     * Remove a specific key value from the map.
     *
     * @return true if something was removed
     */
    public boolean remove(K key, V value) {
        Collection<V> collection = map.get(key);
        if (collection == null) {
            return false;
        }
        boolean removed = collection.remove(value);
        if (collection.isEmpty()) {
            map.remove(key);
        }
        return removed;
    }

    /**
     * Remove the value from the collection of every key.
     * Running time O(N) where N is the number of keys.
     *
     * @return the keys the value was removed from
     */
    public @Nonnull List<K> removeFromAll(V value) {
        List<K> keys = new ArrayList<>();
        for (var iter = map.entrySet().iterator(); iter.hasNext(); ) {
            var entry = iter.next();
            if (entry.getValue().remove(value)) {
                keys.add(entry.getKey());
            }
            if (entry.getValue().isEmpty()) {
                iter.remove();
            }
        }
        return keys;
    }
}
