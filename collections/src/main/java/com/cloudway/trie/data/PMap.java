/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.trie.data;

import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.function.UnaryOperator;

import com.google.common.collect.ImmutableList;

/**
 * The PMap (P stands for Pure or Persistent) is an analogy of java.util.Map.
 * Every modification operation returns a new map that shares the unchanged
 * structure with the original map, the original map is never modified.
 *
 * <p>Keys and values must not be {@code null}.</p>
 *
 * @param <K> the type of keys maintained by this map
 * @param <V> the type of mapped values
 */
public interface PMap<K, V> extends Iterable<Map.Entry<K, V>> {

    // Query Operations

    /**
     * Returns {@code true} if this map contains no key-value mappings.
     *
     * @return {@code true} if this map contains no key-value mappings
     */
    boolean isEmpty();

    /**
     * Returns the number of key-value mappings in this map.
     *
     * @return the number of key-value mappings in this map
     */
    int size();

    /**
     * Returns {@code true} if this map contains a mapping for the specified
     * key.
     *
     * @param key key whose presence in this map is to be tested
     * @return {@code true} if this map contains a mapping for the specified key
     */
    default boolean containsKey(Object key) {
        return lookup(key).isPresent();
    }

    /**
     * Lookup the value to which the specified key is mapped.  Returns
     * an empty {@code Optional} if this map contains no mapping for the key.
     *
     * @param key the key whose associated value is to be returned
     * @return the value to which the specified key is mapped, or
     *         an empty {@code Optional} if this map contains no mapping
     *         for the key
     */
    Optional<V> lookup(Object key);

    /**
     * Returns the value to which the specified key is mapped. If this map contains
     * no mapping for the key, a NoSuchElementException is thrown.
     *
     * @param key the key whose associated value is to returned
     * @return the value to which specified key is mapped
     * @throws NoSuchElementException if this map contains no mapping for the key
     */
    default V get(Object key) {
        return lookup(key).orElseThrow(NoSuchElementException::new);
    }

    /**
     * Returns the value to which the specified key is mapped, or default value
     * if this map contains no mapping for the key.
     *
     * @param key the key whose associated value is to be returned
     * @param def the default mapping of the key
     * @return the mapped value or the default value
     */
    default V getOrDefault(Object key, V def) {
        return lookup(key).orElse(def);
    }

    // Modification Operations

    /**
     * Alters the value at the given key. The update function receives the
     * current value, or an empty {@code Optional} if the key is absent, and
     * returns the new value. Returning an empty {@code Optional} removes the
     * key from the map.
     *
     * <p>This is the primitive on which all other modification operations
     * are built.</p>
     *
     * @param f the update function
     * @param key the key to alter
     * @return the map that contains new mappings, the original map is unchanged
     */
    PMap<K, V> alter(UnaryOperator<Optional<V>> f, K key);

    /**
     * Insert a new key and value in the map. If the key is already present
     * in the map, the associated value is replaced with the supplied value.
     *
     * @param key key with which the specified value is to be associated
     * @param value value to be associated with the specified key
     * @return the map that contains new mappings, the original map is unchanged
     */
    default PMap<K, V> put(K key, V value) {
        return putWith((x, y) -> x, key, value);
    }

    /**
     * Insert with a combining function. If the key is absent the value is
     * inserted as is, otherwise the mapping is replaced with
     * {@code f.apply(value, oldValue)}.
     *
     * @param f the combining function, receives the new value first
     * @param key key with which the specified value is to be associated
     * @param value value to be associated with the specified key
     * @return the map that contains new mappings, the original map is unchanged
     */
    default PMap<K, V> putWith(BinaryOperator<V> f, K key, V value) {
        return alter(old -> Optional.of(old.isPresent() ? f.apply(value, old.get()) : value), key);
    }

    /**
     * Insert a new key and value in the map if it is not already present.
     *
     * @param key key with which the specified value is to be associated
     * @param value value to be associated with the specified key
     * @return the map that contains new mappings, the original map is unchanged
     */
    default PMap<K, V> putIfAbsent(K key, V value) {
        return putWith((x, y) -> y, key, value);
    }

    /**
     * Copies all of the mappings from the specified map to this map.
     *
     * @param that mappings to be stored in this map
     * @return the map that contains new mappings, the original map is unchanged
     */
    default PMap<K, V> putAll(PMap<? extends K, ? extends V> that) {
        PMap<K, V> result = this;
        for (Map.Entry<? extends K, ? extends V> e : that) {
            result = result.put(e.getKey(), e.getValue());
        }
        return result;
    }

    /**
     * Updates the value at the given key if it is present. If the function
     * returns an empty {@code Optional} the mapping is removed.
     *
     * @param f the update function
     * @param key the key to update
     * @return the map that contains new mappings, the original map is unchanged
     */
    default PMap<K, V> update(Function<? super V, Optional<V>> f, K key) {
        return alter(old -> old.flatMap(f), key);
    }

    /**
     * Adjusts the value at the given key if it is present.
     *
     * @param f the adjust function
     * @param key the key to adjust
     * @return the map that contains new mappings, the original map is unchanged
     */
    default PMap<K, V> adjust(UnaryOperator<V> f, K key) {
        return update(v -> Optional.of(f.apply(v)), key);
    }

    /**
     * Removes the mapping for a key from this map if it is present.
     *
     * @param key key with which the specified value is associated
     * @return the map that contains new mappings, the original map is unchanged
     */
    PMap<K, V> remove(Object key);

    /**
     * Returns an empty map that has the same hashing characteristics as this map.
     */
    PMap<K, V> clear();

    // Views

    /**
     * Returns all keys in this map. The order of keys is unspecified.
     */
    ImmutableList<K> keys();

    /**
     * Returns all values in this map. The order of values is unspecified
     * but it agrees with the order of {@link #keys()}.
     */
    ImmutableList<V> values();

    /**
     * Returns all mappings in this map. The order of entries is unspecified.
     */
    ImmutableList<Map.Entry<K, V>> entries();

    /**
     * Performs the given action for each mapping in this map.
     *
     * @param action the action to be performed for each mapping
     */
    default void forEach(BiConsumer<? super K, ? super V> action) {
        for (Map.Entry<K, V> e : this) {
            action.accept(e.getKey(), e.getValue());
        }
    }
}
