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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

public class RandomPermutationAndDivisionSplitGeneratorTest {

    @Test
    public void testGenerateSplits() {
        RandomPermutationAndDivisionSplitGenerator generator = new RandomPermutationAndDivisionSplitGenerator(5, 0.7,
                3L);
        List<Split> splits = generator.generateSplits(20);
        assertEquals(5, splits.size());
        for (Split split : splits) {
            assertEquals(14, split.getTrainingIndices().size());
            assertEquals(6, split.getValidationIndices().size());
            Set<Integer> union = new HashSet<>(split.getTrainingIndices());
            union.addAll(split.getValidationIndices());
            assertEquals(20, union.size());
        }
    }

    @Test
    public void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new RandomPermutationAndDivisionSplitGenerator(0, 0.5, 0L));
        assertThrows(IllegalArgumentException.class, () -> new RandomPermutationAndDivisionSplitGenerator(1, 1.0, 0L));
        assertThrows(IllegalArgumentException.class, () -> new RandomPermutationAndDivisionSplitGenerator(1, 0.0, 0L));
        assertThrows(IllegalArgumentException.class,
                () -> new RandomPermutationAndDivisionSplitGenerator(1, 0.9, 0L).generateSplits(3));
    }
}
