/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.trie.data;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

import com.google.common.collect.ImmutableList;

/**
 * A persistent vector backed by a 32-way bit-partitioned trie with an
 * append buffer. Indexing, updating and appending take O(log32 n) time,
 * appending is amortized O(1).
 *
 * <p>Elements must not be {@code null}.</p>
 *
 * @param <T> the type of elements
 */
public interface PVector<T> extends Iterable<T> {
    /**
     * Returns an empty vector.
     */
    static <T> PVector<T> empty() {
        return VectorImpl.empty();
    }

    /**
     * Returns a vector containing the given elements in order.
     */
    @SafeVarargs
    static <T> PVector<T> of(T... elements) {
        PVector<T> result = empty();
        for (T x : elements) {
            result = result.append(x);
        }
        return result;
    }

    /**
     * Returns a vector containing the elements of the given iterable in
     * iteration order.
     */
    static <T> PVector<T> fromList(Iterable<? extends T> elements) {
        return VectorImpl.<T>empty().appendAll(elements);
    }

    /**
     * Returns the number of elements in this vector.
     */
    int size();

    /**
     * Returns {@code true} if this vector contains no elements.
     */
    default boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Returns the element at the given index.
     *
     * @param index the index of element
     * @return the element at the given index
     * @throws IndexOutOfBoundsException if index is negative or not less
     *         than the vector size
     */
    T at(int index);

    /**
     * Returns the element at the given index, or an empty {@code Optional}
     * if the index is out of range.
     *
     * @param index the index of element
     * @return the element at the given index
     */
    default Optional<T> lookup(int index) {
        return index >= 0 && index < size() ? Optional.of(at(index)) : Optional.empty();
    }

    /**
     * Returns a vector with the given element appended to the end.
     *
     * @param x the element to append
     * @return the new vector, the original vector is unchanged
     */
    PVector<T> append(T x);

    /**
     * Returns a vector with all elements of the given iterable appended.
     *
     * @param xs the elements to append
     * @return the new vector, the original vector is unchanged
     */
    default PVector<T> appendAll(Iterable<? extends T> xs) {
        PVector<T> result = this;
        for (T x : xs) {
            result = result.append(x);
        }
        return result;
    }

    /**
     * Returns a vector with the element at the given index replaced.
     *
     * @param index the index of element
     * @param x the new element
     * @return the new vector, the original vector is unchanged
     * @throws IndexOutOfBoundsException if index is negative or not less
     *         than the vector size
     */
    PVector<T> update(int index, T x);

    /**
     * Returns a vector with the element at the given index modified by
     * the given function.
     *
     * @throws IndexOutOfBoundsException if index is out of range
     */
    default PVector<T> modify(int index, UnaryOperator<T> f) {
        return update(index, f.apply(at(index)));
    }

    /**
     * Returns all elements of this vector in index order.
     */
    ImmutableList<T> elems();

    /**
     * Returns a read-only list view of this vector.
     */
    List<T> asList();
}
