/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.trie.data;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.StringJoiner;
import java.util.function.Consumer;
import java.util.function.ToIntFunction;
import java.util.function.UnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import static com.google.common.base.Preconditions.checkNotNull;

import static com.cloudway.trie.util.Bits.*;

@SuppressWarnings("EqualsAndHashcode")
final class HashTrieImpl {
    private HashTrieImpl() {}

    private static final Logger logger = Logger.getLogger(HashTrieImpl.class.getName());

    /**
     * A bitmap node is expanded into a full node when an insertion makes
     * its child count exceed this value.
     */
    static final int EXPAND_THRESHOLD = 16;

    /**
     * A full node is packed into a bitmap node when a deletion drops its
     * live child count below this value.
     */
    static final int PACK_THRESHOLD = 8;

    private static final Empty<?,?> EMPTY = new Empty<>();

    @SuppressWarnings("unchecked")
    static <K,V> Node<K,V> emptyNode() {
        return (Node<K,V>)EMPTY;
    }

    static <K,V> HashPMap<K,V> empty(ToIntFunction<? super K> hasher) {
        return new HashTrieMap<>(checkNotNull(hasher), emptyNode(), 0);
    }

    static int hash(Object key) {
        int h = key.hashCode();
        return h ^ (h >>> 16);
    }

    @SuppressWarnings("unchecked")
    static <K,V> Node<K,V>[] newNodes(int size) {
        return new Node[size];
    }

    /**
     * Carries the caller's update function down the trie and records
     * whether the key existed before and after the update.
     */
    static final class Alteration<V> {
        private final UnaryOperator<Optional<V>> f;
        private boolean existed, exists;

        Alteration(UnaryOperator<Optional<V>> f) {
            this.f = f;
        }

        Optional<V> apply(Optional<V> old) {
            Optional<V> result = checkNotNull(f.apply(old), "update function returned null");
            existed = old.isPresent();
            exists = result.isPresent();
            return result;
        }

        int delta() {
            return (exists ? 1 : 0) - (existed ? 1 : 0);
        }
    }

    enum Change {
        ADDED, REMOVED, MODIFIED
    }

    // Nodes

    static abstract class Node<K,V> {
        abstract V get(int level, int hash, Object key);

        abstract Node<K,V> alter(int level, int hash, K key, Alteration<V> alt);

        abstract void forEachLeaf(Consumer<? super Leaf<K,V>> action);

        boolean isEmpty() {
            return false;
        }

        boolean isEntry() {
            return false;
        }
    }

    static final class Empty<K,V> extends Node<K,V> {
        @Override
        V get(int level, int hash, Object key) {
            return null;
        }

        @Override
        Node<K,V> alter(int level, int hash, K key, Alteration<V> alt) {
            Optional<V> v = alt.apply(Optional.empty());
            return v.isPresent() ? new Leaf<>(hash, key, v.get()) : this;
        }

        @Override
        void forEachLeaf(Consumer<? super Leaf<K,V>> action) {}

        @Override
        boolean isEmpty() {
            return true;
        }

        @Override
        public String toString() {
            return "Empty";
        }
    }

    /**
     * A node that holds entries with a single full hash value.
     */
    static abstract class EntryNode<K,V> extends Node<K,V> {
        final int hash;

        EntryNode(int hash) {
            this.hash = hash;
        }

        abstract ImmutableList<Leaf<K,V>> leaves();

        @Override
        boolean isEntry() {
            return true;
        }

        /**
         * Insert a key that is not stored in this node. The new entry is
         * combined with this node at the current level.
         */
        Node<K,V> alterAbsent(int level, int hash, K key, Alteration<V> alt) {
            Node<K,V> added = HashTrieImpl.<K,V>emptyNode().alter(level, hash, key, alt);
            return added.isEmpty() ? this : combine(level, this, (EntryNode<K,V>)added);
        }
    }

    static final class Leaf<K,V> extends EntryNode<K,V> implements Map.Entry<K,V> {
        final K key;
        final V value;

        Leaf(int hash, K key, V value) {
            super(hash);
            this.key = key;
            this.value = value;
        }

        private boolean equiv(Object key, int hash) {
            return this.hash == hash && this.key.equals(key);
        }

        @Override
        V get(int level, int hash, Object key) {
            return equiv(key, hash) ? value : null;
        }

        @Override
        Node<K,V> alter(int level, int hash, K key, Alteration<V> alt) {
            if (equiv(key, hash)) {
                Optional<V> v = alt.apply(Optional.of(value));
                if (!v.isPresent()) {
                    return emptyNode();
                } else if (v.get() == value) {
                    return this;
                } else {
                    return new Leaf<>(hash, this.key, v.get());
                }
            } else {
                return alterAbsent(level, hash, key, alt);
            }
        }

        @Override
        ImmutableList<Leaf<K,V>> leaves() {
            return ImmutableList.of(this);
        }

        @Override
        void forEachLeaf(Consumer<? super Leaf<K,V>> action) {
            action.accept(this);
        }

        @Override
        public K getKey() {
            return key;
        }

        @Override
        public V getValue() {
            return value;
        }

        @Override
        public V setValue(V value) {
            throw new UnsupportedOperationException();
        }

        @Override
        public boolean equals(Object obj) {
            if (obj == this)
                return true;
            if (!(obj instanceof Map.Entry))
                return false;
            Map.Entry<?,?> e = (Map.Entry<?,?>)obj;
            return key.equals(e.getKey()) && value.equals(e.getValue());
        }

        @Override
        public int hashCode() {
            return key.hashCode() ^ value.hashCode();
        }

        @Override
        public String toString() {
            return key + ":" + value;
        }
    }

    static final class Collision<K,V> extends EntryNode<K,V> {
        private final ImmutableList<Leaf<K,V>> entries;

        Collision(int hash, ImmutableList<Leaf<K,V>> entries) {
            super(hash);
            this.entries = entries;
        }

        private int indexOf(Object key) {
            for (int i = 0; i < entries.size(); i++) {
                if (entries.get(i).key.equals(key))
                    return i;
            }
            return -1;
        }

        @Override
        V get(int level, int hash, Object key) {
            if (this.hash == hash) {
                int i = indexOf(key);
                return i >= 0 ? entries.get(i).value : null;
            } else {
                return null;
            }
        }

        @Override
        Node<K,V> alter(int level, int hash, K key, Alteration<V> alt) {
            if (this.hash != hash) {
                return alterAbsent(level, hash, key, alt);
            }

            int i = indexOf(key);
            if (i < 0) {
                Optional<V> v = alt.apply(Optional.empty());
                if (!v.isPresent()) {
                    return this;
                }
                return new Collision<>(hash, ImmutableList.<Leaf<K,V>>builder()
                    .addAll(entries)
                    .add(new Leaf<>(hash, key, v.get()))
                    .build());
            }

            Leaf<K,V> e = entries.get(i);
            Optional<V> v = alt.apply(Optional.of(e.value));
            if (!v.isPresent()) {
                if (entries.size() == 2) {
                    return entries.get(1 - i);
                }
                ImmutableList.Builder<Leaf<K,V>> rest = ImmutableList.builder();
                for (int j = 0; j < entries.size(); j++) {
                    if (j != i)
                        rest.add(entries.get(j));
                }
                return new Collision<>(hash, rest.build());
            } else if (v.get() == e.value) {
                return this;
            } else {
                Leaf<K,V>[] updated = entries.toArray(newLeaves(entries.size()));
                updated[i] = new Leaf<>(hash, e.key, v.get());
                return new Collision<>(hash, ImmutableList.copyOf(updated));
            }
        }

        @SuppressWarnings("unchecked")
        private static <K,V> Leaf<K,V>[] newLeaves(int size) {
            return new Leaf[size];
        }

        @Override
        ImmutableList<Leaf<K,V>> leaves() {
            return entries;
        }

        @Override
        void forEachLeaf(Consumer<? super Leaf<K,V>> action) {
            entries.forEach(action);
        }

        @Override
        public String toString() {
            return "Collision" + entries;
        }
    }

    static final class Bitmap<K,V> extends Node<K,V> {
        final int mask;
        final Node<K,V>[] children;

        Bitmap(int mask, Node<K,V>[] children) {
            this.mask = mask;
            this.children = children;
        }

        @Override
        V get(int level, int hash, Object key) {
            int frag = fragment(hash, level);
            if ((mask & bit(frag)) == 0) {
                return null;
            } else {
                return children[rank(mask, frag)].get(level + SHIFT, hash, key);
            }
        }

        @Override
        Node<K,V> alter(int level, int hash, K key, Alteration<V> alt) {
            int frag = fragment(hash, level);
            int bit = bit(frag);
            int offset = rank(mask, frag);
            boolean exists = (mask & bit) != 0;

            Node<K,V> sub = exists ? children[offset] : emptyNode();
            Node<K,V> subNew = sub.alter(level + SHIFT, hash, key, alt);
            if (subNew == sub) {
                return this;
            }

            Change change;
            int maskNew;
            Node<K,V>[] childrenNew;

            if (!exists) {
                change = Change.ADDED;
                maskNew = mask | bit;
                childrenNew = newNodes(children.length + 1);
                System.arraycopy(children, 0, childrenNew, 0, offset);
                childrenNew[offset] = subNew;
                System.arraycopy(children, offset, childrenNew, offset + 1, children.length - offset);
            } else if (subNew.isEmpty()) {
                change = Change.REMOVED;
                maskNew = mask & ~bit;
                childrenNew = newNodes(children.length - 1);
                System.arraycopy(children, 0, childrenNew, 0, offset);
                System.arraycopy(children, offset + 1, childrenNew, offset, children.length - offset - 1);
            } else {
                change = Change.MODIFIED;
                maskNew = mask;
                childrenNew = children.clone();
                childrenNew[offset] = subNew;
            }

            if (maskNew == 0) {
                return emptyNode();
            } else if (childrenNew.length == 1 && childrenNew[0].isEntry()) {
                return childrenNew[0];
            } else if (change == Change.ADDED && childrenNew.length > EXPAND_THRESHOLD) {
                return expand(level, maskNew, childrenNew);
            } else {
                return new Bitmap<>(maskNew, childrenNew);
            }
        }

        private static <K,V> Full<K,V> expand(int level, int mask, Node<K,V>[] children) {
            if (logger.isLoggable(Level.FINEST)) {
                logger.finest("Expand bitmap node at level " + level +
                              " into full node with " + children.length + " children");
            }

            Node<K,V>[] slots = newNodes(WIDTH);
            int[] occupied = setSlots(mask);
            for (int i = 0; i < WIDTH; i++) {
                slots[i] = emptyNode();
            }
            for (int i = 0; i < occupied.length; i++) {
                slots[occupied[i]] = children[i];
            }
            return new Full<>(children.length, slots);
        }

        @Override
        void forEachLeaf(Consumer<? super Leaf<K,V>> action) {
            for (Node<K,V> child : children) {
                child.forEachLeaf(action);
            }
        }

        @Override
        public String toString() {
            return "Bitmap(" + Integer.toBinaryString(mask) + ")";
        }
    }

    static final class Full<K,V> extends Node<K,V> {
        final int occupied;
        final Node<K,V>[] children;

        Full(int occupied, Node<K,V>[] children) {
            this.occupied = occupied;
            this.children = children;
        }

        @Override
        V get(int level, int hash, Object key) {
            return children[fragment(hash, level)].get(level + SHIFT, hash, key);
        }

        @Override
        Node<K,V> alter(int level, int hash, K key, Alteration<V> alt) {
            int frag = fragment(hash, level);
            Node<K,V> sub = children[frag];
            Node<K,V> subNew = sub.alter(level + SHIFT, hash, key, alt);
            if (subNew == sub) {
                return this;
            }

            int occupiedNew = occupied;
            if (sub.isEmpty())
                occupiedNew++;
            if (subNew.isEmpty())
                occupiedNew--;

            Node<K,V>[] childrenNew = children.clone();
            childrenNew[frag] = subNew;

            if (occupiedNew < PACK_THRESHOLD) {
                return pack(level, childrenNew, occupiedNew);
            } else {
                return new Full<>(occupiedNew, childrenNew);
            }
        }

        private static <K,V> Bitmap<K,V> pack(int level, Node<K,V>[] slots, int occupied) {
            if (logger.isLoggable(Level.FINEST)) {
                logger.finest("Pack full node at level " + level +
                              " into bitmap node with " + occupied + " children");
            }

            Node<K,V>[] children = newNodes(occupied);
            int mask = 0, j = 0;
            for (int i = 0; i < WIDTH; i++) {
                if (!slots[i].isEmpty()) {
                    mask |= bit(i);
                    children[j++] = slots[i];
                }
            }
            return new Bitmap<>(mask, children);
        }

        @Override
        void forEachLeaf(Consumer<? super Leaf<K,V>> action) {
            for (Node<K,V> child : children) {
                child.forEachLeaf(action);
            }
        }

        @Override
        public String toString() {
            return "Full(" + occupied + ")";
        }
    }

    /**
     * Merge two entry nodes that must coexist under one parent at the
     * given level.
     */
    static <K,V> Node<K,V> combine(int level, EntryNode<K,V> a, EntryNode<K,V> b) {
        if (a.hash == b.hash || level >= HASH_BITS) {
            if (logger.isLoggable(Level.FINEST)) {
                logger.finest("Hash collision " + Integer.toHexString(a.hash) + " at level " + level);
            }
            return new Collision<>(a.hash, ImmutableList.<Leaf<K,V>>builder()
                .addAll(a.leaves())
                .addAll(b.leaves())
                .build());
        }

        int fa = fragment(a.hash, level);
        int fb = fragment(b.hash, level);
        if (fa != fb) {
            Node<K,V>[] children = newNodes(2);
            if (fa < fb) {
                children[0] = a;
                children[1] = b;
            } else {
                children[0] = b;
                children[1] = a;
            }
            return new Bitmap<>(bit(fa) | bit(fb), children);
        } else {
            Node<K,V>[] children = newNodes(1);
            children[0] = combine(level + SHIFT, a, b);
            return new Bitmap<>(bit(fa), children);
        }
    }

    /**
     * Check the structural invariants of a trie and return the number of
     * entries in it.
     *
     * @throws AssertionError if an invariant is violated
     */
    static int verify(Node<?,?> root) {
        return verify(root, 0, 0, true);
    }

    private static int verify(Node<?,?> node, int level, int prefix, boolean isRoot) {
        int prefixMask = level >= HASH_BITS ? -1 : (1 << level) - 1;

        if (node instanceof Empty) {
            check(isRoot, "empty node below root");
            return 0;
        }

        if (node instanceof EntryNode) {
            EntryNode<?,?> en = (EntryNode<?,?>)node;
            ImmutableList<? extends Leaf<?,?>> leaves = en.leaves();
            check(node instanceof Leaf || leaves.size() >= 2, "collision node with a single entry");
            Set<Object> keys = new HashSet<>();
            for (Leaf<?,?> leaf : leaves) {
                check(leaf.hash == en.hash, "collision entry with foreign hash");
                check((leaf.hash & prefixMask) == prefix, "entry routed to a wrong slot");
                check(keys.add(leaf.key), "duplicate key " + leaf.key);
            }
            return leaves.size();
        }

        if (node instanceof Bitmap) {
            Bitmap<?,?> bm = (Bitmap<?,?>)node;
            check(bm.mask != 0, "bitmap node with empty mask");
            check(bm.children.length == popcount(bm.mask), "bitmap mask disagrees with children");
            check(bm.children.length <= EXPAND_THRESHOLD, "oversized bitmap node");
            check(!(bm.children.length == 1 && bm.children[0].isEntry()), "uncollapsed bitmap node");
            int[] slots = setSlots(bm.mask);
            int count = 0;
            for (int i = 0; i < slots.length; i++) {
                check(!bm.children[i].isEmpty(), "empty child in bitmap node");
                count += verify(bm.children[i], level + SHIFT, prefix | (slots[i] << level), false);
            }
            return count;
        }

        if (node instanceof Full) {
            Full<?,?> full = (Full<?,?>)node;
            check(full.children.length == WIDTH, "full node with wrong width");
            check(full.occupied >= PACK_THRESHOLD, "underfull full node");
            int live = 0, count = 0;
            for (int i = 0; i < WIDTH; i++) {
                if (!full.children[i].isEmpty()) {
                    live++;
                    count += verify(full.children[i], level + SHIFT, prefix | (i << level), false);
                }
            }
            check(live == full.occupied, "full node occupation count mismatch");
            return count;
        }

        throw new AssertionError("unknown node " + node);
    }

    private static void check(boolean condition, String message) {
        if (!condition)
            throw new AssertionError(message);
    }

    // The map handle

    static final class HashTrieMap<K,V> implements HashPMap<K,V> {
        final ToIntFunction<? super K> hasher;
        final Node<K,V> root;
        private final int size;

        HashTrieMap(ToIntFunction<? super K> hasher, Node<K,V> root, int size) {
            this.hasher = hasher;
            this.root = root;
            this.size = size;
        }

        @Override
        public boolean isEmpty() {
            return size == 0;
        }

        @Override
        public int size() {
            return size;
        }

        @Override
        @SuppressWarnings("unchecked")
        public Optional<V> lookup(Object key) {
            if (key == null)
                return Optional.empty();
            return Optional.ofNullable(root.get(0, hasher.applyAsInt((K)key), key));
        }

        @Override
        public HashPMap<K,V> alter(UnaryOperator<Optional<V>> f, K key) {
            checkNotNull(f);
            checkNotNull(key);
            Alteration<V> alt = new Alteration<>(f);
            Node<K,V> rootNew = root.alter(0, hasher.applyAsInt(key), key, alt);
            return rootNew == root ? this : new HashTrieMap<>(hasher, rootNew, size + alt.delta());
        }

        @Override
        @SuppressWarnings("unchecked")
        public HashPMap<K,V> remove(Object key) {
            if (key == null)
                return this;
            return alter(v -> Optional.empty(), (K)key);
        }

        @Override
        public HashPMap<K,V> clear() {
            return isEmpty() ? this : new HashTrieMap<>(hasher, emptyNode(), 0);
        }

        @Override
        public ImmutableList<K> keys() {
            ImmutableList.Builder<K> builder = ImmutableList.builderWithExpectedSize(size);
            root.forEachLeaf(leaf -> builder.add(leaf.key));
            return builder.build();
        }

        @Override
        public ImmutableList<V> values() {
            ImmutableList.Builder<V> builder = ImmutableList.builderWithExpectedSize(size);
            root.forEachLeaf(leaf -> builder.add(leaf.value));
            return builder.build();
        }

        @Override
        public ImmutableList<Map.Entry<K,V>> entries() {
            ImmutableList.Builder<Map.Entry<K,V>> builder = ImmutableList.builderWithExpectedSize(size);
            root.forEachLeaf(builder::add);
            return builder.build();
        }

        @Override
        public Iterator<Map.Entry<K,V>> iterator() {
            return new EntryIterator<>(root);
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj)
                return true;
            if (!(obj instanceof PMap))
                return false;
            PMap<?,?> that = (PMap<?,?>)obj;
            if (size != that.size())
                return false;
            try {
                for (Map.Entry<?,?> e : that) {
                    V v = root.get(0, hashOf(e.getKey()), e.getKey());
                    if (v == null || !v.equals(e.getValue()))
                        return false;
                }
            } catch (ClassCastException ex) {
                // keys of a type this map's hasher does not accept
                return false;
            }
            return true;
        }

        @SuppressWarnings("unchecked")
        private int hashOf(Object key) {
            return hasher.applyAsInt((K)key);
        }

        @Override
        public int hashCode() {
            int h = 0;
            for (Map.Entry<K,V> e : this) {
                h += e.hashCode();
            }
            return h;
        }

        @Override
        public String toString() {
            StringJoiner sj = new StringJoiner(",", "{", "}");
            root.forEachLeaf(leaf -> sj.add(leaf.toString()));
            return sj.toString();
        }
    }

    /**
     * Depth first traversal over the leaves of a trie.
     */
    static final class EntryIterator<K,V> extends AbstractIterator<Map.Entry<K,V>> {
        private final Deque<Node<K,V>> stack = new ArrayDeque<>();

        EntryIterator(Node<K,V> root) {
            if (!root.isEmpty())
                stack.push(root);
        }

        @Override
        protected Map.Entry<K,V> computeNext() {
            while (!stack.isEmpty()) {
                Node<K,V> node = stack.pop();
                if (node instanceof Leaf) {
                    return (Leaf<K,V>)node;
                } else if (node instanceof Collision) {
                    pushAll(((Collision<K,V>)node).leaves());
                } else if (node instanceof Bitmap) {
                    pushAll(((Bitmap<K,V>)node).children);
                } else if (node instanceof Full) {
                    pushAll(((Full<K,V>)node).children);
                }
            }
            return endOfData();
        }

        private void pushAll(Node<K,V>[] nodes) {
            for (int i = nodes.length; --i >= 0; ) {
                if (!nodes[i].isEmpty())
                    stack.push(nodes[i]);
            }
        }

        private void pushAll(ImmutableList<Leaf<K,V>> leaves) {
            for (int i = leaves.size(); --i >= 0; ) {
                stack.push(leaves.get(i));
            }
        }
    }
}
