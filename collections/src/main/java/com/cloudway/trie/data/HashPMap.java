/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.trie.data;

import java.util.Map;
import java.util.Optional;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.function.ToIntFunction;
import java.util.function.UnaryOperator;

/**
 * A map implementation based on hash array mapped trie.
 *
 * <p>The map routes keys on successive 5-bit fragments of a 32-bit hash
 * computed by a hash function supplied at construction time. The hash
 * function must be deterministic and equal keys must hash equally. Unequal
 * keys with identical hashes are kept in collision nodes. The hash function
 * is applied to every key passed to the map, so lookups with a key of an
 * unrelated type may fail with the hash function's own exception.</p>
 *
 * @param <K> the type of keys maintained by this map
 * @param <V> the type of mapped values
 */
public interface HashPMap<K, V> extends PMap<K, V> {
    /**
     * Returns the hash function used by {@link #empty()}: the key's
     * {@code hashCode()} with its high half folded into the low half, so
     * that hash codes differing only in high bits still spread over the
     * first trie levels.
     *
     * @return the default key hash function
     */
    static ToIntFunction<Object> defaultHasher() {
        return HashTrieImpl::hash;
    }

    /**
     * Construct an empty hash trie map that hashes keys with their
     * {@code hashCode()} method.
     *
     * @return an empty map
     */
    static <K, V> HashPMap<K, V> empty() {
        return HashTrieImpl.empty(defaultHasher());
    }

    /**
     * Construct an empty hash trie map with the given hash function.
     *
     * @param hasher the key hash function
     * @return an empty map
     */
    static <K, V> HashPMap<K, V> empty(ToIntFunction<? super K> hasher) {
        return HashTrieImpl.empty(hasher);
    }

    /**
     * Construct a map with a single element.
     *
     * @param key the element key
     * @param value the element value
     * @return a map with a single element
     */
    static <K, V> HashPMap<K, V> singleton(K key, V value) {
        return HashPMap.<K,V>empty().put(key, value);
    }

    /**
     * Construct a map from the given entries. Later entries replace earlier
     * entries with the same key.
     *
     * @param entries the map entries
     * @return a map holding the given entries
     */
    static <K, V> HashPMap<K, V> fromList(Iterable<? extends Map.Entry<? extends K, ? extends V>> entries) {
        return fromList(defaultHasher(), entries);
    }

    /**
     * Construct a map from the given entries with the given hash function.
     *
     * @param hasher the key hash function
     * @param entries the map entries
     * @return a map holding the given entries
     */
    static <K, V> HashPMap<K, V> fromList(ToIntFunction<? super K> hasher,
                                          Iterable<? extends Map.Entry<? extends K, ? extends V>> entries) {
        HashPMap<K, V> result = empty(hasher);
        for (Map.Entry<? extends K, ? extends V> e : entries) {
            result = result.put(e.getKey(), e.getValue());
        }
        return result;
    }

    @Override
    HashPMap<K, V> alter(UnaryOperator<Optional<V>> f, K key);

    @Override
    HashPMap<K, V> remove(Object key);

    @Override
    HashPMap<K, V> clear();

    @Override
    default HashPMap<K, V> put(K key, V value) {
        return (HashPMap<K, V>)PMap.super.put(key, value);
    }

    @Override
    default HashPMap<K, V> putWith(BinaryOperator<V> f, K key, V value) {
        return (HashPMap<K, V>)PMap.super.putWith(f, key, value);
    }

    @Override
    default HashPMap<K, V> putIfAbsent(K key, V value) {
        return (HashPMap<K, V>)PMap.super.putIfAbsent(key, value);
    }

    @Override
    default HashPMap<K, V> putAll(PMap<? extends K, ? extends V> that) {
        return (HashPMap<K, V>)PMap.super.putAll(that);
    }

    @Override
    default HashPMap<K, V> update(Function<? super V, Optional<V>> f, K key) {
        return (HashPMap<K, V>)PMap.super.update(f, key);
    }

    @Override
    default HashPMap<K, V> adjust(UnaryOperator<V> f, K key) {
        return (HashPMap<K, V>)PMap.super.adjust(f, key);
    }
}
