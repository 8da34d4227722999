/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.trie.util;

import java.util.function.Function;
import java.util.function.ToIntFunction;
import java.util.stream.Collector;

import com.cloudway.trie.data.HashPMap;
import com.cloudway.trie.data.PVector;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Implementations of {@link Collector} that accumulate elements into
 * persistent collections.
 *
 * <pre>{@code
 *     // Accumulate names into a PVector
 *     PVector<String> names = people.stream().map(Person::getName).collect(MoreCollectors.toPVector());
 *
 *     // Index people by name
 *     HashPMap<String, Person> index = people.stream().collect(
 *         MoreCollectors.toHashPMap(Person::getName, Function.identity()));
 * }</pre>
 */
public final class MoreCollectors
{
    private MoreCollectors() {}

    /**
     * Mutable accumulation box for a persistent value, the persistent value
     * itself is never modified.
     */
    private static final class Box<T> {
        T value;

        Box(T value) {
            this.value = value;
        }
    }

    /**
     * Returns a {@code Collector} that accumulates the input elements into a
     * new {@code PVector}, in encounter order.
     *
     * @param <T> the type of the input elements
     * @return a {@code Collector} which collects all the input elements into a
     * {@code PVector}, in encounter order
     */
    public static <T> Collector<T, ?, PVector<T>> toPVector() {
        return Collector.<T, Box<PVector<T>>, PVector<T>>of(
            () -> new Box<>(PVector.<T>empty()),
            (b, x) -> b.value = b.value.append(x),
            (l, r) -> { l.value = l.value.appendAll(r.value); return l; },
            b -> b.value);
    }

    /**
     * Returns a {@code Collector} that accumulates elements into a {@code HashPMap}
     * whose keys and values are the result of applying the provided mapping
     * functions to the input elements. Keys are hashed with their
     * {@code hashCode()} method.
     *
     * <p>If the mapped keys contain duplicates, the value mapped last in
     * encounter order is retained.</p>
     *
     * @param keyMapper a mapping function to produce keys
     * @param valueMapper a mapping function to produce values
     * @return a {@code Collector} which collects elements into a {@code HashPMap}
     */
    public static <T, K, V> Collector<T, ?, HashPMap<K, V>>
    toHashPMap(Function<? super T, ? extends K> keyMapper,
               Function<? super T, ? extends V> valueMapper) {
        return toHashPMap(HashPMap.defaultHasher(), keyMapper, valueMapper);
    }

    /**
     * Returns a {@code Collector} that accumulates elements into a {@code HashPMap}
     * with the given key hash function.
     *
     * @param hasher the key hash function
     * @param keyMapper a mapping function to produce keys
     * @param valueMapper a mapping function to produce values
     * @return a {@code Collector} which collects elements into a {@code HashPMap}
     * @throws NullPointerException if {@code hasher} is {@code null}
     */
    public static <T, K, V> Collector<T, ?, HashPMap<K, V>>
    toHashPMap(ToIntFunction<? super K> hasher,
               Function<? super T, ? extends K> keyMapper,
               Function<? super T, ? extends V> valueMapper) {
        checkNotNull(hasher);
        return Collector.<T, Box<HashPMap<K,V>>, HashPMap<K,V>>of(
            () -> new Box<>(HashPMap.<K,V>empty(hasher)),
            (b, x) -> b.value = b.value.put(keyMapper.apply(x), valueMapper.apply(x)),
            (l, r) -> { l.value = l.value.putAll(r.value); return l; },
            b -> b.value);
    }
}
