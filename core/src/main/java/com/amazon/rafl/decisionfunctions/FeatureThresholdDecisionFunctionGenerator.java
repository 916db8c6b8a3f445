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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import com.amazon.rafl.examples.Example;

/**
 * Generates {@link FeatureThresholdDecisionFunction}s. Each candidate picks a
 * feature index uniformly at random, then a threshold uniformly at random from
 * the range of values that feature takes among the examples at the leaf.
 * Thresholds outside that range could never separate the examples.
 */
public class FeatureThresholdDecisionFunctionGenerator implements DecisionFunctionGenerator {

    private final int dimensions;

    /**
     * @param dimensions The number of features in a descriptor.
     */
    public FeatureThresholdDecisionFunctionGenerator(int dimensions) {
        checkArgument(dimensions > 0, "dimensions must be greater than 0");
        this.dimensions = dimensions;
    }

    @Override
    public List<DecisionFunction> generateCandidates(List<? extends Example<?>> examples, int candidateCount,
            Random random) {
        checkArgument(candidateCount >= 0, "candidateCount must be greater than or equal to 0");
        if (examples.isEmpty()) {
            return Collections.emptyList();
        }

        List<DecisionFunction> candidates = new ArrayList<>(candidateCount);
        for (int i = 0; i < candidateCount; i++) {
            int featureIndex = random.nextInt(dimensions);
            float min = Float.POSITIVE_INFINITY;
            float max = Float.NEGATIVE_INFINITY;
            for (Example<?> example : examples) {
                float value = example.getFeature(featureIndex);
                min = Math.min(min, value);
                max = Math.max(max, value);
            }
            float threshold = (float) (min + random.nextDouble() * ((double) max - min));
            candidates.add(new FeatureThresholdDecisionFunction(featureIndex, threshold));
        }
        return candidates;
    }

    public int getDimensions() {
        return dimensions;
    }
}
