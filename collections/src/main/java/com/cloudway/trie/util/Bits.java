/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.trie.util;

/**
 * Bit indexing primitives shared by the hash trie and the vector trie.
 *
 * <p>A 32-bit mask describes which of the 32 slots of a trie node are
 * occupied. The children of a sparse node are stored densely, so the
 * position of the child for a given slot is the number of occupied slots
 * below it.</p>
 */
public final class Bits {
    private Bits() {}

    /** Number of hash or index bits consumed at each trie level. */
    public static final int SHIFT = 5;

    /** Fan-out of a trie node. */
    public static final int WIDTH = 1 << SHIFT;

    /** Mask to extract a fragment. */
    public static final int MASK = WIDTH - 1;

    /** Width of a hash value. */
    public static final int HASH_BITS = Integer.SIZE;

    /**
     * Returns the single-bit mask for a slot.
     *
     * @param slot the slot number, 0 to 31
     * @return the mask with only the given slot set
     */
    public static int bit(int slot) {
        return 1 << slot;
    }

    /**
     * Returns the dense array position of a slot, that is, the number of
     * bits set in the mask at positions below the slot.
     *
     * @param mask the occupation mask
     * @param slot the slot number, 0 to 31
     * @return the dense position of the slot
     */
    public static int rank(int mask, int slot) {
        return Integer.bitCount(mask & (bit(slot) - 1));
    }

    /**
     * Returns the number of bits set in the mask.
     */
    public static int popcount(int mask) {
        return Integer.bitCount(mask);
    }

    /**
     * Returns the set slot numbers of the mask in ascending order.
     *
     * @param mask the occupation mask
     * @return the slots whose bit is set in the mask
     */
    public static int[] setSlots(int mask) {
        int[] slots = new int[Integer.bitCount(mask)];
        int bm = mask;
        for (int i = 0; bm != 0; i++) {
            slots[i] = Integer.numberOfTrailingZeros(bm);
            bm &= bm - 1;
        }
        return slots;
    }

    /**
     * Returns the 5-bit fragment of a hash or index consumed at the given level.
     *
     * @param hash the hash value or index
     * @param level the bit offset of the fragment
     * @return the fragment, 0 to 31
     */
    public static int fragment(int hash, int level) {
        return (hash >>> level) & MASK;
    }
}
