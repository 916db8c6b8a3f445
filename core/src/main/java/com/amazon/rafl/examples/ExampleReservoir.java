/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.rafl.examples;

import static com.amazon.rafl.CommonUtils.checkArgument;
import static com.amazon.rafl.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import com.amazon.rafl.base.Histogram;

/**
 * <p>
 * An ExampleReservoir holds a bounded, uniformly random sample of the examples
 * offered to it. It implements the classic reservoir sampling algorithm:
 * </p>
 * <ol>
 * <li>The first {@code capacity} examples are stored as they arrive.</li>
 * <li>The t-th example, for t greater than the capacity, is accepted with
 * probability {@code capacity / t} and replaces a slot chosen uniformly at
 * random.</li>
 * </ol>
 * <p>
 * After any number of offers, every example offered so far is in the sample
 * with the same probability, while the memory used stays bounded by the
 * capacity however long the stream is.
 * </p>
 *
 * @param <L> The label type.
 */
public class ExampleReservoir<L extends Comparable<? super L>> {

    /**
     * The stored examples.
     */
    private final List<Example<L>> examples;

    /**
     * The number of examples in the sample when full.
     */
    private final int capacity;

    /**
     * The random number generator used to decide acceptance and replacement. It is
     * owned by the tree, so reservoirs of one tree share a single stream of draws.
     */
    private final Random random;

    /**
     * The number of examples offered to this reservoir so far.
     */
    private long seenExamples;

    /**
     * The example evicted by the last call to {@link #add}, or null if nothing was
     * evicted.
     */
    private Example<L> evictedExample;

    public ExampleReservoir(int capacity, Random random) {
        checkArgument(capacity > 0, "capacity must be greater than 0");
        this.capacity = capacity;
        this.random = checkNotNull(random, "random must not be null");
        this.examples = new ArrayList<>(Math.min(capacity, 64));
    }

    /**
     * Offer an example to the reservoir.
     *
     * @param example The example to offer.
     * @return true if the example is now stored, false if it was rejected.
     */
    public boolean add(Example<L> example) {
        checkNotNull(example, "example must not be null");
        evictedExample = null;
        ++seenExamples;

        if (examples.size() < capacity) {
            examples.add(example);
            return true;
        }

        long slot = (long) (random.nextDouble() * seenExamples);
        if (slot < capacity) {
            evictedExample = examples.set((int) slot, example);
            return true;
        }
        return false;
    }

    /**
     * @return the example evicted by the most recent call to {@link #add}, if any.
     */
    public Optional<Example<L>> getEvictedExample() {
        return Optional.ofNullable(evictedExample);
    }

    /**
     * @return a snapshot of the stored examples.
     */
    public List<Example<L>> getExamples() {
        return new ArrayList<>(examples);
    }

    /**
     * @return a histogram of the labels of the stored examples.
     */
    public Histogram<L> toHistogram() {
        Histogram<L> histogram = new Histogram<>();
        for (Example<L> example : examples) {
            histogram.add(example.getLabel());
        }
        return histogram;
    }

    /**
     * Remove every stored example. The count of seen examples is kept.
     */
    public void clear() {
        examples.clear();
        evictedExample = null;
    }

    public int size() {
        return examples.size();
    }

    public int getCapacity() {
        return capacity;
    }

    public boolean isFull() {
        return examples.size() == capacity;
    }

    /**
     * @return the number of examples offered to this reservoir, whether or not
     *         they were stored.
     */
    public long getSeenExamples() {
        return seenExamples;
    }
}
