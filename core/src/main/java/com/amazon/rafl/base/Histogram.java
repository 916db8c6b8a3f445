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

package com.amazon.rafl.base;

import static com.amazon.rafl.CommonUtils.checkArgument;
import static com.amazon.rafl.CommonUtils.checkNotNull;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * A Histogram counts the number of times each label has been seen. The bins
 * are kept in label order so that every derived quantity (PMFs, entropies,
 * rendered output) is deterministic.
 *
 * @param <L> The label type.
 */
public class Histogram<L extends Comparable<? super L>> {

    /**
     * The number of bins shown by {@link #toString()} before eliding the rest.
     */
    static final int DISPLAY_LIMIT = 3;

    private final SortedMap<L, Long> bins = new TreeMap<>();

    private long total;

    public Histogram() {
    }

    /**
     * Create a copy of the given histogram.
     *
     * @param other The histogram to copy.
     */
    public Histogram(Histogram<L> other) {
        checkNotNull(other, "other must not be null");
        bins.putAll(other.bins);
        total = other.total;
    }

    /**
     * Increment the count for the given label by one.
     *
     * @param label The label to count.
     */
    public void add(L label) {
        add(label, 1);
    }

    /**
     * Increment the count for the given label.
     *
     * @param label The label to count.
     * @param count The (non-negative) number of instances to add.
     */
    public void add(L label, long count) {
        checkNotNull(label, "label must not be null");
        checkArgument(count >= 0, "count must be greater than or equal to 0");
        if (count == 0) {
            return;
        }
        bins.merge(label, count, Long::sum);
        total += count;
    }

    /**
     * @param label A label.
     * @return the number of instances of the label counted so far, 0 if the label
     *         has not been seen.
     */
    public long getCount(L label) {
        return bins.getOrDefault(label, 0L);
    }

    /**
     * @return the total number of instances counted by this histogram.
     */
    public long getTotal() {
        return total;
    }

    /**
     * @return a read-only view of the bins, in label order.
     */
    public SortedMap<L, Long> getBins() {
        return Collections.unmodifiableSortedMap(bins);
    }

    public boolean isEmpty() {
        return total == 0;
    }

    /**
     * Normalise the histogram into a probability mass function.
     *
     * @return the PMF corresponding to this histogram.
     * @throws IllegalArgumentException if the histogram is empty.
     */
    public ProbabilityMassFunction<L> toPmf() {
        return new ProbabilityMassFunction<>(this);
    }

    /**
     * @return the entropy (in bits) of the label distribution counted by this
     *         histogram, 0 for an empty histogram.
     */
    public double calculateEntropy() {
        return isEmpty() ? 0.0 : toPmf().calculateEntropy();
    }

    @Override
    public String toString() {
        return renderLimited(bins, DISPLAY_LIMIT);
    }

    static <K, V> String renderLimited(Map<K, V> map, int limit) {
        StringBuilder sb = new StringBuilder("{ ");
        int shown = 0;
        for (Map.Entry<K, V> entry : map.entrySet()) {
            if (shown == limit) {
                sb.append("... ");
                break;
            }
            sb.append('(').append(entry.getKey()).append(',').append(entry.getValue()).append(") ");
            ++shown;
        }
        return sb.append('}').toString();
    }
}
