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

package com.amazon.rafl.decisionfunctions;

import static com.amazon.rafl.CommonUtils.checkArgument;

import lombok.Getter;

import com.amazon.rafl.examples.Example;

/**
 * A decision function that compares a single feature of a descriptor to a
 * threshold. Descriptors whose feature value is strictly less than the
 * threshold go left, all others go right.
 */
@Getter
public final class FeatureThresholdDecisionFunction implements DecisionFunction {

    private final int featureIndex;
    private final float threshold;

    /**
     * @param featureIndex The 0-based index of the feature to test.
     * @param threshold    The threshold separating the two halves.
     */
    public FeatureThresholdDecisionFunction(int featureIndex, float threshold) {
        checkArgument(featureIndex >= 0, "featureIndex must be greater than or equal to 0");
        checkArgument(!Float.isNaN(threshold), "threshold must not be NaN");
        this.featureIndex = featureIndex;
        this.threshold = threshold;
    }

    @Override
    public Direction classify(float[] descriptor) {
        checkArgument(featureIndex < descriptor.length, "descriptor is too short for this decision function");
        return descriptor[featureIndex] < threshold ? Direction.LEFT : Direction.RIGHT;
    }

    @Override
    public Direction classify(Example<?> example) {
        return example.getFeature(featureIndex) < threshold ? Direction.LEFT : Direction.RIGHT;
    }

    @Override
    public String toString() {
        return String.format("Feature %d < %f", featureIndex, threshold);
    }
}
