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

package com.amazon.rafl.evaluation.splits;

import static com.amazon.rafl.CommonUtils.checkArgument;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import lombok.Getter;

/**
 * Generates repeated random divisions of the examples: for each split the
 * indices are randomly permuted, and the first {@code ratio} of them are used
 * for training and the rest for validation. Unlike cross-validation, an
 * example may be held out by several splits or by none.
 */
@Getter
public class RandomPermutationAndDivisionSplitGenerator implements SplitGenerator {

    private final int splitCount;

    /**
     * The fraction of the examples used for training.
     */
    private final double ratio;

    private final long seed;

    public RandomPermutationAndDivisionSplitGenerator(int splitCount, double ratio, long seed) {
        checkArgument(splitCount > 0, "splitCount must be greater than 0");
        checkArgument(ratio > 0 && ratio < 1, "ratio must be strictly between 0 and 1");
        this.splitCount = splitCount;
        this.ratio = ratio;
        this.seed = seed;
    }

    @Override
    public List<Split> generateSplits(int exampleCount) {
        int trainingCount = (int) Math.round(exampleCount * ratio);
        checkArgument(trainingCount > 0 && trainingCount < exampleCount,
                String.format("cannot divide %d examples with ratio %s", exampleCount, ratio));

        Random random = new Random(seed);
        List<Split> splits = new ArrayList<>(splitCount);
        for (int i = 0; i < splitCount; i++) {
            List<Integer> indices = IntStream.range(0, exampleCount).boxed().collect(Collectors.toList());
            Collections.shuffle(indices, random);

            List<Integer> training = new ArrayList<>(indices.subList(0, trainingCount));
            List<Integer> validation = new ArrayList<>(indices.subList(trainingCount, exampleCount));
            Collections.sort(training);
            Collections.sort(validation);
            splits.add(new Split(training, validation));
        }
        return splits;
    }
}
