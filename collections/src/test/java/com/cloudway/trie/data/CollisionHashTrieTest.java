/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.trie.data;

import org.junit.Test;
import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

public class CollisionHashTrieTest extends HashTrieTestBase {
    static class CollisionKey implements Key {
        final int value;

        CollisionKey(int value) {
            this.value = value;
        }

        public int hashCode() {
            return value % 37;
        }

        public boolean equals(Object obj) {
            return (obj instanceof CollisionKey)
                && value == ((CollisionKey)obj).value;
        }

        public String toString() {
            return String.valueOf(value);
        }
    }

    @Override
    protected Key newKey(int value) {
        return new CollisionKey(value);
    }

    private static HashTrieImpl.Node<String, Integer> root(PMap<String, Integer> m) {
        return ((HashTrieImpl.HashTrieMap<String, Integer>)m).root;
    }

    private static int verify(PMap<String, Integer> m) {
        return HashTrieImpl.verify(root(m));
    }

    @Test
    public void collision_merge_1() {
        PMap<Key, Integer> m1 = HashPMap.singleton(newKey(1), 1).put(newKey(38), 2); // collision key
        PMap<Key, Integer> m2 = HashPMap.singleton(newKey(1), 3).put(newKey(38), 4);
        PMap<Key, Integer> m3;

        m3 = m1.putAll(m2);
        assertEquals(2, m3.size());
        assertEquals(3, (int)m3.get(newKey(1)));
        assertEquals(4, (int)m3.get(newKey(38)));

        m3 = m2.putAll(m1);
        assertEquals(2, m3.size());
        assertEquals(1, (int)m3.get(newKey(1)));
        assertEquals(2, (int)m3.get(newKey(38)));
    }

    @Test
    public void collision_merge_2() {
        PMap<Key, Integer> m1 = HashPMap.singleton(newKey(1), 1).put(newKey(38), 2); // collision key
        PMap<Key, Integer> m2 = HashPMap.singleton(newKey(1), 3).put(newKey(39), 4);
        PMap<Key, Integer> m3;

        m3 = m1.putAll(m2);
        assertEquals(3, m3.size());
        assertEquals(3, (int)m3.get(newKey(1)));
        assertEquals(2, (int)m3.get(newKey(38)));
        assertEquals(4, (int)m3.get(newKey(39)));

        m3 = m2.putAll(m1);
        assertEquals(3, m3.size());
        assertEquals(1, (int)m3.get(newKey(1)));
        assertEquals(2, (int)m3.get(newKey(38)));
        assertEquals(4, (int)m3.get(newKey(39)));
    }

    @Test
    public void identical_hash_terminates_in_collision_node() {
        HashPMap<String, Integer> m = HashPMap.<String, Integer>empty(s -> 0xCAFEBABE)
            .put("a", 1)
            .put("b", 2);

        assertThat(root(m), instanceOf(HashTrieImpl.Collision.class));
        assertEquals(1, (int)m.get("a"));
        assertEquals(2, (int)m.get("b"));
        assertEquals(2, verify(m));

        HashPMap<String, Integer> m1 = m.remove("a");
        assertThat(root(m1), instanceOf(HashTrieImpl.Leaf.class));
        assertFalse(m1.containsKey("a"));
        assertEquals(2, (int)m1.get("b"));
        assertEquals(1, m1.size());

        // the original version still holds both keys
        assertEquals(1, (int)m.get("a"));
        assertEquals(2, m.size());
    }

    @Test
    public void collision_node_shares_trie_with_other_hashes() {
        // "a" and "b" collide on the full hash, "c" differs only in the last fragment
        HashPMap<String, Integer> m = HashPMap.<String, Integer>empty(s -> s.equals("c") ? 0x40000001 : 0x00000001)
            .put("a", 1)
            .put("b", 2)
            .put("c", 3);

        assertEquals(3, m.size());
        assertEquals(3, verify(m));
        assertEquals(1, (int)m.get("a"));
        assertEquals(2, (int)m.get("b"));
        assertEquals(3, (int)m.get("c"));

        HashPMap<String, Integer> m1 = m.remove("c");
        assertThat(root(m1), instanceOf(HashTrieImpl.Collision.class));
        assertEquals(2, verify(m1));

        HashPMap<String, Integer> m2 = m.remove("a").remove("b");
        assertThat(root(m2), instanceOf(HashTrieImpl.Leaf.class));
        assertEquals(3, (int)m2.get("c"));
        assertEquals(1, verify(m2));
    }

    @Test
    public void collision_node_updates() {
        HashPMap<String, Integer> m = HashPMap.<String, Integer>empty(s -> 7);
        for (int i = 0; i < 10; i++) {
            m = m.put("k" + i, i);
        }
        assertThat(root(m), instanceOf(HashTrieImpl.Collision.class));
        assertEquals(10, m.size());

        m = m.adjust(v -> v * 100, "k5");
        assertEquals(500, (int)m.get("k5"));
        assertEquals(10, m.size());

        m = m.putWith(Integer::sum, "k5", 1);
        assertEquals(501, (int)m.get("k5"));

        for (int i = 0; i < 9; i++) {
            m = m.remove("k" + i);
            assertEquals(9 - i, m.size());
            assertEquals(9 - i, verify(m));
        }
        assertThat(root(m), instanceOf(HashTrieImpl.Leaf.class));
        assertEquals(9, (int)m.get("k9"));
    }

    @Test
    public void lookup_absent_key_with_colliding_hash() {
        HashPMap<String, Integer> m = HashPMap.<String, Integer>empty(s -> 42).put("x", 1).put("y", 2);
        assertFalse(m.lookup("z").isPresent());
        assertSame(m, m.remove("z"));
    }
}
