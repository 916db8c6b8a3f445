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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * The outcome of evaluating a classifier over a number of training/validation
 * splits: the confusion matrix of each split, their sum, and the measures
 * derived from them.
 *
 * @param <L> The label type.
 */
public class EvaluationResult<L extends Comparable<? super L>> {

    public static final String ACCURACY = "Accuracy";

    private final List<ConfusionMatrix<L>> splitConfusionMatrices;

    private final ConfusionMatrix<L> confusionMatrix;

    private final PerformanceMeasure accuracy;

    public EvaluationResult(List<ConfusionMatrix<L>> splitConfusionMatrices) {
        checkNotNull(splitConfusionMatrices, "splitConfusionMatrices must not be null");
        checkArgument(!splitConfusionMatrices.isEmpty(), "there must be at least one split");
        this.splitConfusionMatrices = Collections.unmodifiableList(new ArrayList<>(splitConfusionMatrices));

        ConfusionMatrix<L> sum = splitConfusionMatrices.get(0);
        List<PerformanceMeasure> accuracies = new ArrayList<>();
        for (ConfusionMatrix<L> matrix : splitConfusionMatrices) {
            if (matrix != sum) {
                sum = sum.merge(matrix);
            }
            accuracies.add(new PerformanceMeasure(matrix.getAccuracy()));
        }
        this.confusionMatrix = sum;
        this.accuracy = PerformanceMeasure.average(accuracies);
    }

    public List<ConfusionMatrix<L>> getSplitConfusionMatrices() {
        return splitConfusionMatrices;
    }

    /**
     * @return the sum of the confusion matrices of all splits.
     */
    public ConfusionMatrix<L> getConfusionMatrix() {
        return confusionMatrix;
    }

    /**
     * @return the accuracy of each split, summarised across splits.
     */
    public PerformanceMeasure getAccuracy() {
        return accuracy;
    }

    public double getPrecision(L label) {
        return confusionMatrix.getPrecision(label);
    }

    public double getRecall(L label) {
        return confusionMatrix.getRecall(label);
    }

    /**
     * @return the measures used to compare evaluations, keyed by name.
     */
    public Map<String, PerformanceMeasure> getPerformanceMeasures() {
        Map<String, PerformanceMeasure> measures = new LinkedHashMap<>();
        measures.put(ACCURACY, accuracy);
        return measures;
    }

    /**
     * @return a human-readable report of the evaluation. Labels are listed in
     *         label order, so the report for a given result is always the same.
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.ROOT, "%s: %s over %d split(s)\n", ACCURACY, accuracy,
                splitConfusionMatrices.size()));
        sb.append(String.format(Locale.ROOT, "Correct: %d of %d\n", confusionMatrix.getTrace(),
                confusionMatrix.getTotal()));
        sb.append("Confusion matrix (rows: actual, columns: predicted):\n");
        sb.append(confusionMatrix.render());
        for (L label : confusionMatrix.getLabels()) {
            sb.append(String.format(Locale.ROOT, "%s: precision %.4f, recall %.4f\n", label, getPrecision(label),
                    getRecall(label)));
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return render();
    }
}
