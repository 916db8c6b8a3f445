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
 * <p>
 * Generates the splits of k-fold cross-validation. The example indices are
 * shuffled with a seeded random number generator and dealt into {@code foldCount}
 * contiguous folds whose sizes differ by at most one. Each split holds out one
 * fold for validation and trains on all the others.
 * </p>
 * <p>
 * Both the training and the validation indices of a split are in ascending
 * order, so that an online classifier sees its training examples in the order
 * in which they were supplied.
 * </p>
 */
@Getter
public class CrossValidationSplitGenerator implements SplitGenerator {

    private final int foldCount;

    private final long seed;

    public CrossValidationSplitGenerator(int foldCount, long seed) {
        checkArgument(foldCount >= 2, "foldCount must be at least 2");
        this.foldCount = foldCount;
        this.seed = seed;
    }

    @Override
    public List<Split> generateSplits(int exampleCount) {
        checkArgument(exampleCount >= foldCount,
                String.format("cannot divide %d examples into %d folds", exampleCount, foldCount));

        List<Integer> indices = IntStream.range(0, exampleCount).boxed().collect(Collectors.toList());
        Collections.shuffle(indices, new Random(seed));

        int[] foldOf = new int[exampleCount];
        for (int fold = 0; fold < foldCount; fold++) {
            int begin = (int) ((long) fold * exampleCount / foldCount);
            int end = (int) ((long) (fold + 1) * exampleCount / foldCount);
            for (int i = begin; i < end; i++) {
                foldOf[indices.get(i)] = fold;
            }
        }

        List<Split> splits = new ArrayList<>(foldCount);
        for (int fold = 0; fold < foldCount; fold++) {
            List<Integer> training = new ArrayList<>();
            List<Integer> validation = new ArrayList<>();
            for (int index = 0; index < exampleCount; index++) {
                if (foldOf[index] == fold) {
                    validation.add(index);
                } else {
                    training.add(index);
                }
            }
            splits.add(new Split(training, validation));
        }
        return splits;
    }
}
