/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.trie.data;

import java.util.AbstractList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.RandomAccess;
import java.util.StringJoiner;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.collect.ImmutableList;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;

import static com.cloudway.trie.util.Bits.*;

final class VectorImpl {
    private VectorImpl() {}

    private static final Logger logger = Logger.getLogger(VectorImpl.class.getName());

    private static final Object[] EMPTY_ARRAY = new Object[0];

    private static final PersistentVector<?> EMPTY =
        new PersistentVector<>(0, SHIFT, new Body(new Node[0]), EMPTY_ARRAY);

    @SuppressWarnings("unchecked")
    static <T> PersistentVector<T> empty() {
        return (PersistentVector<T>)EMPTY;
    }

    /**
     * Returns the index of the first element stored in the tail buffer.
     */
    static int tailOffset(int count) {
        return count < WIDTH ? 0 : ((count - 1) >>> SHIFT) << SHIFT;
    }

    // Nodes

    static abstract class Node {}

    static final class Body extends Node {
        final Node[] children;

        Body(Node[] children) {
            this.children = children;
        }
    }

    static final class Leaf extends Node {
        final Object[] elements;

        Leaf(Object[] elements) {
            this.elements = elements;
        }
    }

    private static Node[] appendNode(Node[] nodes, Node node) {
        Node[] result = Arrays.copyOf(nodes, nodes.length + 1);
        result[nodes.length] = node;
        return result;
    }

    /**
     * Build a single path of body nodes from the given level down to the leaf.
     */
    static Node newPath(int level, Leaf leaf) {
        if (level == 0) {
            return leaf;
        } else {
            return new Body(new Node[]{newPath(level - SHIFT, leaf)});
        }
    }

    static final class PersistentVector<T> implements PVector<T> {
        final int count;
        final int shift;
        final Body root;
        final Object[] tail;

        PersistentVector(int count, int shift, Body root, Object[] tail) {
            this.count = count;
            this.shift = shift;
            this.root = root;
            this.tail = tail;
        }

        @Override
        public int size() {
            return count;
        }

        /**
         * Returns the array that holds the element at the given index,
         * either a leaf of the trie or the tail buffer.
         */
        Object[] arrayFor(int i) {
            if (i >= tailOffset(count)) {
                return tail;
            }
            Node node = root;
            for (int level = shift; level > 0; level -= SHIFT) {
                node = ((Body)node).children[fragment(i, level)];
            }
            return ((Leaf)node).elements;
        }

        @Override
        @SuppressWarnings("unchecked")
        public T at(int index) {
            checkElementIndex(index, count);
            return (T)arrayFor(index)[index & MASK];
        }

        @Override
        public PVector<T> append(T x) {
            checkNotNull(x);

            if (count - tailOffset(count) < WIDTH) {
                Object[] newTail = Arrays.copyOf(tail, tail.length + 1);
                newTail[tail.length] = x;
                return new PersistentVector<>(count + 1, shift, root, newTail);
            }

            Leaf tailNode = new Leaf(tail);
            Body newRoot;
            int newShift = shift;
            if ((count >>> SHIFT) > (1 << shift)) {
                // root overflow, grow the tree by one level
                newRoot = new Body(new Node[]{root, newPath(shift, tailNode)});
                newShift += SHIFT;
                if (logger.isLoggable(Level.FINER)) {
                    logger.finer("Grow vector trie to height " + (newShift / SHIFT) + " at " + (count + 1) + " elements");
                }
            } else {
                newRoot = pushTail(shift, root, tailNode);
            }
            return new PersistentVector<>(count + 1, newShift, newRoot, new Object[]{x});
        }

        private Body pushTail(int level, Body parent, Leaf tailNode) {
            int subidx = fragment(count - 1, level);
            Node[] children;
            if (level == SHIFT) {
                children = appendNode(parent.children, tailNode);
            } else if (subidx >= parent.children.length) {
                children = appendNode(parent.children, newPath(level - SHIFT, tailNode));
            } else {
                children = parent.children.clone();
                children[subidx] = pushTail(level - SHIFT, (Body)children[subidx], tailNode);
            }
            return new Body(children);
        }

        @Override
        public PVector<T> update(int index, T x) {
            checkElementIndex(index, count);
            checkNotNull(x);

            if (index >= tailOffset(count)) {
                int i = index & MASK;
                if (tail[i] == x) {
                    return this;
                }
                Object[] newTail = tail.clone();
                newTail[i] = x;
                return new PersistentVector<>(count, shift, root, newTail);
            }

            if (arrayFor(index)[index & MASK] == x) {
                return this;
            }
            return new PersistentVector<>(count, shift, (Body)doAssoc(shift, root, index, x), tail);
        }

        private static Node doAssoc(int level, Node node, int i, Object x) {
            if (level == 0) {
                Object[] elements = ((Leaf)node).elements.clone();
                elements[i & MASK] = x;
                return new Leaf(elements);
            } else {
                Node[] children = ((Body)node).children.clone();
                int subidx = fragment(i, level);
                children[subidx] = doAssoc(level - SHIFT, children[subidx], i, x);
                return new Body(children);
            }
        }

        @Override
        public ImmutableList<T> elems() {
            return ImmutableList.copyOf(iterator());
        }

        @Override
        public List<T> asList() {
            return new ListView<>(this);
        }

        @Override
        public Iterator<T> iterator() {
            return new ChunkedIterator<>(this);
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj)
                return true;
            if (!(obj instanceof PVector))
                return false;
            PVector<?> that = (PVector<?>)obj;
            if (count != that.size())
                return false;
            Iterator<?> it = that.iterator();
            for (T x : this) {
                if (!x.equals(it.next()))
                    return false;
            }
            return true;
        }

        @Override
        public int hashCode() {
            int h = 1;
            for (T x : this) {
                h = 31 * h + x.hashCode();
            }
            return h;
        }

        @Override
        public String toString() {
            StringJoiner sj = new StringJoiner(",", "[", "]");
            for (T x : this) {
                sj.add(String.valueOf(x));
            }
            return sj.toString();
        }
    }

    /**
     * Iterates a vector one leaf array at a time.
     */
    static final class ChunkedIterator<T> implements Iterator<T> {
        private final PersistentVector<T> vec;
        private Object[] chunk;
        private int index;

        ChunkedIterator(PersistentVector<T> vec) {
            this.vec = vec;
        }

        @Override
        public boolean hasNext() {
            return index < vec.count;
        }

        @Override
        @SuppressWarnings("unchecked")
        public T next() {
            if (index >= vec.count)
                throw new NoSuchElementException();
            if ((index & MASK) == 0 || chunk == null)
                chunk = vec.arrayFor(index);
            return (T)chunk[index++ & MASK];
        }
    }

    static final class ListView<T> extends AbstractList<T> implements RandomAccess {
        private final PVector<T> vec;

        ListView(PVector<T> vec) {
            this.vec = vec;
        }

        @Override
        public T get(int index) {
            return vec.at(index);
        }

        @Override
        public int size() {
            return vec.size();
        }

        @Override
        public Iterator<T> iterator() {
            return vec.iterator();
        }
    }
}
