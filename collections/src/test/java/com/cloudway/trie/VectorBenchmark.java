/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.trie;

import java.util.ArrayList;
import java.util.List;

import com.google.caliper.BeforeExperiment;
import com.google.caliper.Benchmark;
import com.google.caliper.Param;

import com.cloudway.trie.data.PVector;

/**
 * A microbenchmark for appending to and indexing the persistent vector,
 * with {@link ArrayList} as the baseline.
 */
public class VectorBenchmark {
    @Param({"32", "1000", "100000"})
    private int size;

    @Param("0")
    private SpecialRandom random;

    private PVector<Integer> vector;
    private List<Integer> list;
    private int[] indexes;

    @BeforeExperiment void setUp() {
        PVector<Integer> v = PVector.empty();
        List<Integer> l = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            v = v.append(i);
            l.add(i);
        }
        vector = v;
        list = l;

        indexes = new int[1024];
        for (int i = 0; i < indexes.length; i++) {
            indexes[i] = random.nextInt(size);
        }
    }

    @Benchmark int appendPersistent(int reps) {
        int dummy = 0;
        for (int i = 0; i < reps; i++) {
            PVector<Integer> v = PVector.empty();
            for (int j = 0; j < size; j++) {
                v = v.append(j);
            }
            dummy += v.size();
        }
        return dummy;
    }

    @Benchmark int appendMutable(int reps) {
        int dummy = 0;
        for (int i = 0; i < reps; i++) {
            List<Integer> l = new ArrayList<>();
            for (int j = 0; j < size; j++) {
                l.add(j);
            }
            dummy += l.size();
        }
        return dummy;
    }

    @Benchmark int indexPersistent(int reps) {
        int mask = indexes.length - 1;
        int dummy = 0;
        for (int i = 0; i < reps; i++) {
            dummy += vector.at(indexes[i & mask]);
        }
        return dummy;
    }

    @Benchmark int indexMutable(int reps) {
        int mask = indexes.length - 1;
        int dummy = 0;
        for (int i = 0; i < reps; i++) {
            dummy += list.get(indexes[i & mask]);
        }
        return dummy;
    }

    @Benchmark int updatePersistent(int reps) {
        int mask = indexes.length - 1;
        PVector<Integer> v = vector;
        for (int i = 0; i < reps; i++) {
            v = v.update(indexes[i & mask], i);
        }
        return v.size();
    }
}
