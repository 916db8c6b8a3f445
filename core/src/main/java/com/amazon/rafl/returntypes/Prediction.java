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

package com.amazon.rafl.returntypes;

import static com.amazon.rafl.CommonUtils.checkNotNull;

import java.util.Optional;
import java.util.SortedMap;

import com.amazon.rafl.base.ProbabilityMassFunction;

/**
 * The result of classifying a descriptor with a forest: the predicted label and
 * the confidence the forest has in each label, which is the mass the label
 * receives in the average of the per-tree distributions.
 *
 * @param <L> The label type.
 */
public class Prediction<L extends Comparable<? super L>> {

    private final ProbabilityMassFunction<L> distribution;

    public Prediction(ProbabilityMassFunction<L> distribution) {
        this.distribution = checkNotNull(distribution, "distribution must not be null");
    }

    /**
     * @return the label with the greatest confidence, the lowest such label when
     *         several tie, or empty if the forest knows no labels yet.
     */
    public Optional<L> getLabel() {
        return distribution.calculateBestLabel();
    }

    /**
     * @return the confidence of the predicted label, 0 if there is none.
     */
    public double getConfidence() {
        return getLabel().map(distribution::getMass).orElse(0.0);
    }

    /**
     * @param label A label.
     * @return the confidence in the label, 0 for a label the forest has never
     *         associated with the descriptor.
     */
    public double getConfidence(L label) {
        return distribution.getMass(label);
    }

    /**
     * @return the confidence in each label, in label order.
     */
    public SortedMap<L, Double> getConfidences() {
        return distribution.getMasses();
    }

    public ProbabilityMassFunction<L> getDistribution() {
        return distribution;
    }

    @Override
    public String toString() {
        return String.format("Prediction(%s, %s)", getLabel().map(String::valueOf).orElse("none"), distribution);
    }
}
