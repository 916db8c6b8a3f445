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

package com.amazon.rafl.tree;

import static com.amazon.rafl.CommonUtils.checkNotNull;

import lombok.Getter;

import com.amazon.rafl.base.Histogram;
import com.amazon.rafl.decisionfunctions.DecisionFunction;

/**
 * The outcome of a successful split evaluation: the chosen decision function,
 * its information gain and the label histograms of the two halves it induces on
 * the leaf's examples.
 *
 * @param <L> The label type.
 */
public class SplitCandidate<L extends Comparable<? super L>> {

    @Getter
    private final DecisionFunction decisionFunction;

    /**
     * Information gain in bits.
     */
    @Getter
    private final double gain;

    private final Histogram<L> leftHistogram;

    private final Histogram<L> rightHistogram;

    public SplitCandidate(DecisionFunction decisionFunction, double gain, Histogram<L> leftHistogram,
            Histogram<L> rightHistogram) {
        this.decisionFunction = checkNotNull(decisionFunction, "decisionFunction must not be null");
        this.gain = gain;
        this.leftHistogram = new Histogram<>(checkNotNull(leftHistogram, "leftHistogram must not be null"));
        this.rightHistogram = new Histogram<>(checkNotNull(rightHistogram, "rightHistogram must not be null"));
    }

    /**
     * @return a copy of the label histogram of the examples sent left.
     */
    public Histogram<L> getLeftHistogram() {
        return new Histogram<>(leftHistogram);
    }

    /**
     * @return a copy of the label histogram of the examples sent right.
     */
    public Histogram<L> getRightHistogram() {
        return new Histogram<>(rightHistogram);
    }

    @Override
    public String toString() {
        return String.format("SplitCandidate(%s, gain=%f, left=%s, right=%s)", decisionFunction, gain, leftHistogram,
                rightHistogram);
    }
}
