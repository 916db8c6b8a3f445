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

import static com.amazon.rafl.CommonUtils.checkArgument;

import lombok.Getter;

/**
 * The hyperparameters shared by every node of a {@link DecisionTree}. Settings
 * are fixed when the tree is created.
 */
@Getter
public class TreeSettings {

    /**
     * Default capacity of the example reservoir held by each leaf.
     */
    public static final int DEFAULT_RESERVOIR_CAPACITY = 1000;

    /**
     * Default maximum depth of a leaf. The root has depth 0.
     */
    public static final int DEFAULT_MAX_DEPTH = 20;

    /**
     * Default number of candidate decision functions generated when a leaf is
     * considered for splitting.
     */
    public static final int DEFAULT_CANDIDATE_COUNT = 256;

    /**
     * Default number of examples a leaf must have seen before it is considered for
     * splitting.
     */
    public static final int DEFAULT_SEEN_EXAMPLES_THRESHOLD = 30;

    /**
     * Default minimum information gain (in bits) required to split a leaf.
     */
    public static final double DEFAULT_GAIN_THRESHOLD = 0.0;

    public static final boolean DEFAULT_PMF_REWEIGHTING_ENABLED = false;

    private final int reservoirCapacity;
    private final int maxDepth;
    private final int candidateCount;
    private final int seenExamplesThreshold;
    private final double gainThreshold;
    private final boolean pmfReweightingEnabled;

    private TreeSettings(Builder builder) {
        checkArgument(builder.reservoirCapacity > 0, "reservoirCapacity must be greater than 0");
        checkArgument(builder.maxDepth > 0, "maxDepth must be greater than 0");
        checkArgument(builder.candidateCount > 0, "candidateCount must be greater than 0");
        checkArgument(builder.seenExamplesThreshold >= 0, "seenExamplesThreshold must be greater than or equal to 0");
        checkArgument(builder.gainThreshold >= 0, "gainThreshold must be greater than or equal to 0");

        reservoirCapacity = builder.reservoirCapacity;
        maxDepth = builder.maxDepth;
        candidateCount = builder.candidateCount;
        seenExamplesThreshold = builder.seenExamplesThreshold;
        gainThreshold = builder.gainThreshold;
        pmfReweightingEnabled = builder.pmfReweightingEnabled;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return String.format(
                "TreeSettings(reservoirCapacity=%d, maxDepth=%d, candidateCount=%d, seenExamplesThreshold=%d, gainThreshold=%f, pmfReweightingEnabled=%b)",
                reservoirCapacity, maxDepth, candidateCount, seenExamplesThreshold, gainThreshold,
                pmfReweightingEnabled);
    }

    public static class Builder {

        private int reservoirCapacity = DEFAULT_RESERVOIR_CAPACITY;
        private int maxDepth = DEFAULT_MAX_DEPTH;
        private int candidateCount = DEFAULT_CANDIDATE_COUNT;
        private int seenExamplesThreshold = DEFAULT_SEEN_EXAMPLES_THRESHOLD;
        private double gainThreshold = DEFAULT_GAIN_THRESHOLD;
        private boolean pmfReweightingEnabled = DEFAULT_PMF_REWEIGHTING_ENABLED;

        public Builder reservoirCapacity(int reservoirCapacity) {
            this.reservoirCapacity = reservoirCapacity;
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder candidateCount(int candidateCount) {
            this.candidateCount = candidateCount;
            return this;
        }

        public Builder seenExamplesThreshold(int seenExamplesThreshold) {
            this.seenExamplesThreshold = seenExamplesThreshold;
            return this;
        }

        public Builder gainThreshold(double gainThreshold) {
            this.gainThreshold = gainThreshold;
            return this;
        }

        public Builder pmfReweightingEnabled(boolean pmfReweightingEnabled) {
            this.pmfReweightingEnabled = pmfReweightingEnabled;
            return this;
        }

        public TreeSettings build() {
            return new TreeSettings(this);
        }
    }
}
