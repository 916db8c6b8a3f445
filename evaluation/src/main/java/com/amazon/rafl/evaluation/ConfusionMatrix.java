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

package com.amazon.rafl.evaluation;

import static com.amazon.rafl.CommonUtils.checkArgument;
import static com.amazon.rafl.CommonUtils.checkNotNull;

import java.util.Collections;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * <p>
 * A confusion matrix counts, for each pair of labels (actual, predicted), the
 * number of validation examples with the actual label that were classified as
 * the predicted label. Rows are indexed by the actual label and columns by the
 * predicted label; both are kept in label order so that the matrix renders
 * deterministically.
 * </p>
 * <p>
 * Instances are immutable. Use {@link #builder()} to count predictions and
 * {@link #merge} to combine the matrices of several splits.
 * </p>
 *
 * @param <L> The label type.
 */
public class ConfusionMatrix<L extends Comparable<? super L>> {

    private final SortedSet<L> labels;

    private final SortedMap<L, SortedMap<L, Long>> counts;

    private final long total;

    private ConfusionMatrix(SortedSet<L> labels, SortedMap<L, SortedMap<L, Long>> counts) {
        this.labels = Collections.unmodifiableSortedSet(labels);
        this.counts = counts;
        long sum = 0;
        for (SortedMap<L, Long> row : counts.values()) {
            for (long count : row.values()) {
                sum += count;
            }
        }
        this.total = sum;
    }

    public static <L extends Comparable<? super L>> Builder<L> builder() {
        return new Builder<>();
    }

    /**
     * @param actual    the actual label
     * @param predicted the predicted label
     * @return the number of examples with the actual label that were predicted
     *         as the predicted label.
     */
    public long getCount(L actual, L predicted) {
        SortedMap<L, Long> row = counts.get(actual);
        return row == null ? 0 : row.getOrDefault(predicted, 0L);
    }

    /**
     * @return every label that appears as a row or column, in label order.
     */
    public SortedSet<L> getLabels() {
        return labels;
    }

    /**
     * @return the total number of counted predictions.
     */
    public long getTotal() {
        return total;
    }

    /**
     * @return the number of correct predictions, the sum of the diagonal.
     */
    public long getTrace() {
        long trace = 0;
        for (L label : labels) {
            trace += getCount(label, label);
        }
        return trace;
    }

    /**
     * @return the fraction of correct predictions, 0 for an empty matrix.
     */
    public double getAccuracy() {
        return total == 0 ? 0.0 : (double) getTrace() / total;
    }

    /**
     * Precision is computed from the column of the label: of the examples
     * predicted as the label, the fraction that actually have it.
     *
     * @param label a label
     * @return the precision for the label, 0 if it was never predicted.
     */
    public double getPrecision(L label) {
        long predicted = 0;
        for (L actual : labels) {
            predicted += getCount(actual, label);
        }
        return predicted == 0 ? 0.0 : (double) getCount(label, label) / predicted;
    }

    /**
     * Recall is computed from the row of the label: of the examples that have the
     * label, the fraction predicted as it.
     *
     * @param label a label
     * @return the recall for the label, 0 if no example has it.
     */
    public double getRecall(L label) {
        long actual = 0;
        for (L predicted : labels) {
            actual += getCount(label, predicted);
        }
        return actual == 0 ? 0.0 : (double) getCount(label, label) / actual;
    }

    /**
     * @param other another confusion matrix
     * @return a new matrix whose counts are the sums of the counts of both
     *         matrices, over the union of their labels.
     */
    public ConfusionMatrix<L> merge(ConfusionMatrix<L> other) {
        checkNotNull(other, "other must not be null");
        Builder<L> builder = new Builder<>();
        builder.addAll(this);
        builder.addAll(other);
        return builder.build();
    }

    /**
     * Render the matrix as text, one row per actual label and one column per
     * predicted label, both in label order.
     *
     * @return the rendered matrix, each line terminated by a newline.
     */
    public String render() {
        int firstWidth = 0;
        for (L label : labels) {
            firstWidth = Math.max(firstWidth, String.valueOf(label).length());
        }

        SortedMap<L, Integer> widths = new TreeMap<>();
        for (L predicted : labels) {
            int width = String.valueOf(predicted).length();
            for (L actual : labels) {
                width = Math.max(width, Long.toString(getCount(actual, predicted)).length());
            }
            widths.put(predicted, width);
        }

        StringBuilder sb = new StringBuilder();
        pad(sb, "", firstWidth, false);
        for (L predicted : labels) {
            sb.append("  ");
            pad(sb, String.valueOf(predicted), widths.get(predicted), true);
        }
        sb.append('\n');

        for (L actual : labels) {
            pad(sb, String.valueOf(actual), firstWidth, false);
            for (L predicted : labels) {
                sb.append("  ");
                pad(sb, Long.toString(getCount(actual, predicted)), widths.get(predicted), true);
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    private static void pad(StringBuilder sb, String value, int width, boolean right) {
        if (!right) {
            sb.append(value);
        }
        for (int i = value.length(); i < width; i++) {
            sb.append(' ');
        }
        if (right) {
            sb.append(value);
        }
    }

    @Override
    public String toString() {
        return render();
    }

    /**
     * Counts predictions into a new {@link ConfusionMatrix}.
     *
     * @param <L> The label type.
     */
    public static class Builder<L extends Comparable<? super L>> {

        private final SortedSet<L> labels = new TreeSet<>();

        private final SortedMap<L, SortedMap<L, Long>> counts = new TreeMap<>();

        /**
         * Make sure the label has a row and a column, even if it is never counted.
         *
         * @param label a label
         * @return this builder
         */
        public Builder<L> addLabel(L label) {
            labels.add(checkNotNull(label, "label must not be null"));
            return this;
        }

        public Builder<L> add(L actual, L predicted) {
            return add(actual, predicted, 1);
        }

        public Builder<L> add(L actual, L predicted, long count) {
            checkArgument(count >= 0, "count must be greater than or equal to 0");
            addLabel(actual);
            addLabel(predicted);
            counts.computeIfAbsent(actual, k -> new TreeMap<>()).merge(predicted, count, Long::sum);
            return this;
        }

        public Builder<L> addAll(ConfusionMatrix<L> matrix) {
            checkNotNull(matrix, "matrix must not be null");
            for (L label : matrix.getLabels()) {
                addLabel(label);
            }
            matrix.counts.forEach((actual, row) -> row.forEach((predicted, count) -> add(actual, predicted, count)));
            return this;
        }

        public ConfusionMatrix<L> build() {
            SortedMap<L, SortedMap<L, Long>> copy = new TreeMap<>();
            counts.forEach((actual, row) -> copy.put(actual, new TreeMap<>(row)));
            return new ConfusionMatrix<>(new TreeSet<>(labels), copy);
        }
    }
}
