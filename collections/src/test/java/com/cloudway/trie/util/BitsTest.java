/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.trie.util;

import org.junit.Test;
import static org.junit.Assert.*;

import static com.cloudway.trie.util.Bits.*;

public class BitsTest {
    @Test
    public void bit_of_slot() {
        assertEquals(1, bit(0));
        assertEquals(0x20, bit(5));
        assertEquals(Integer.MIN_VALUE, bit(31));
    }

    @Test
    public void rank_counts_lower_bits() {
        int mask = 0b1011_0010;
        assertEquals(0, rank(mask, 0));
        assertEquals(0, rank(mask, 1));
        assertEquals(1, rank(mask, 4));
        assertEquals(2, rank(mask, 5));
        assertEquals(3, rank(mask, 7));
        assertEquals(4, rank(mask, 8));
        assertEquals(0, rank(0, 17));
        assertEquals(31, rank(-1, 31));
    }

    @Test
    public void rank_of_every_slot() {
        for (int slot = 0; slot < WIDTH; slot++) {
            int naive = 0;
            for (int i = 0; i < slot; i++) {
                if ((0x5555_aaaa & (1 << i)) != 0)
                    naive++;
            }
            assertEquals("slot " + slot, naive, rank(0x5555_aaaa, slot));
        }
    }

    @Test
    public void popcount_of_mask() {
        assertEquals(0, popcount(0));
        assertEquals(1, popcount(bit(31)));
        assertEquals(4, popcount(0b1011_0010));
        assertEquals(32, popcount(-1));
    }

    @Test
    public void set_slots_in_ascending_order() {
        assertArrayEquals(new int[0], setSlots(0));
        assertArrayEquals(new int[]{1, 4, 5, 7}, setSlots(0b1011_0010));
        assertArrayEquals(new int[]{0, 31}, setSlots(bit(0) | bit(31)));
        assertEquals(32, setSlots(-1).length);
    }

    @Test
    public void fragment_of_hash() {
        int hash = 0b11_00001_00010_00011_00100_00101_00110;
        assertEquals(6, fragment(hash, 0));
        assertEquals(5, fragment(hash, 5));
        assertEquals(4, fragment(hash, 10));
        assertEquals(3, fragment(hash, 15));
        assertEquals(2, fragment(hash, 20));
        assertEquals(1, fragment(hash, 25));
        assertEquals(3, fragment(hash, 30));
        assertEquals(3, fragment(-1, 30));
        assertEquals(MASK, fragment(-1, 0));
    }
}
