/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.trie.util;

import java.util.function.Function;
import java.util.function.ToIntFunction;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import org.junit.Test;
import static org.junit.Assert.*;

import com.cloudway.trie.data.HashPMap;
import com.cloudway.trie.data.PVector;

public class MoreCollectorsTest {
    @Test
    public void collect_to_vector() {
        PVector<Integer> xs = IntStream.range(0, 1000).boxed().collect(MoreCollectors.toPVector());
        assertEquals(1000, xs.size());
        for (int i = 0; i < 1000; i++) {
            assertEquals(i, (int)xs.at(i));
        }
    }

    @Test
    public void collect_to_vector_in_parallel() {
        PVector<Integer> xs = IntStream.range(0, 5000).parallel().boxed().collect(MoreCollectors.toPVector());
        assertEquals(5000, xs.size());
        for (int i = 0; i < 5000; i++) {
            assertEquals(i, (int)xs.at(i));
        }
    }

    @Test
    public void collect_to_map() {
        HashPMap<String, Integer> m = Stream.of("a", "bb", "ccc")
            .collect(MoreCollectors.toHashPMap(Function.identity(), String::length));
        assertEquals(3, m.size());
        assertEquals(2, (int)m.get("bb"));
    }

    @Test
    public void collect_to_map_last_wins() {
        HashPMap<Integer, String> m = Stream.of("a", "bb", "cc", "d")
            .collect(MoreCollectors.toHashPMap(String::length, Function.identity()));
        assertEquals(2, m.size());
        assertEquals("d", m.get(1));
        assertEquals("cc", m.get(2));
    }

    @Test
    public void collect_to_map_in_parallel() {
        HashPMap<Integer, Integer> m = IntStream.range(0, 5000).parallel().boxed()
            .collect(MoreCollectors.toHashPMap(x -> x % 100, x -> x));
        assertEquals(100, m.size());
        for (int i = 0; i < 100; i++) {
            assertEquals(4900 + i, (int)m.get(i));
        }
    }

    @Test
    public void collect_with_hash_function() {
        HashPMap<Integer, Integer> m = IntStream.range(0, 50).boxed()
            .collect(MoreCollectors.toHashPMap(k -> 0, Function.identity(), x -> x * x));
        assertEquals(50, m.size());
        assertEquals(49 * 49, (int)m.get(49));
    }

    @Test(expected = NullPointerException.class)
    public void collect_with_null_hash_function() {
        MoreCollectors.<Integer, Integer, Integer>toHashPMap(null, Function.identity(), Function.identity());
    }

    @Test
    public void default_hash_function_spreads_high_bits() {
        ToIntFunction<Object> hasher = HashPMap.defaultHasher();
        assertEquals(1, hasher.applyAsInt(1));
        assertEquals(0x10001, hasher.applyAsInt(0x10000));
        assertEquals(HashPMap.empty().put("a", 1), Stream.of("a")
            .collect(MoreCollectors.toHashPMap(hasher, Function.identity(), String::length)));
    }
}
