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

import static com.amazon.rafl.TestUtils.example;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.when;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.rafl.examples.Example;

public class FeatureThresholdDecisionFunctionGeneratorTest {

    private FeatureThresholdDecisionFunctionGenerator generator;
    private List<Example<String>> examples;

    @BeforeEach
    public void setUp() {
        generator = new FeatureThresholdDecisionFunctionGenerator(2);
        examples = Arrays.asList(example("A", 0.0f, 10.0f), example("B", 4.0f, 20.0f), example("A", 2.0f, 30.0f));
    }

    @Test
    public void testNew() {
        assertEquals(2, generator.getDimensions());
        assertThrows(IllegalArgumentException.class, () -> new FeatureThresholdDecisionFunctionGenerator(0));
    }

    @Test
    public void testThresholdsLieWithinFeatureRange() {
        List<DecisionFunction> candidates = generator.generateCandidates(examples, 500, new Random(3));
        assertEquals(500, candidates.size());
        for (DecisionFunction candidate : candidates) {
            FeatureThresholdDecisionFunction function = (FeatureThresholdDecisionFunction) candidate;
            if (function.getFeatureIndex() == 0) {
                assertTrue(function.getThreshold() >= 0.0f && function.getThreshold() <= 4.0f);
            } else {
                assertEquals(1, function.getFeatureIndex());
                assertTrue(function.getThreshold() >= 10.0f && function.getThreshold() <= 30.0f);
            }
        }
    }

    @Test
    public void testCandidateFromRandomDraws() {
        Random random = spy(new Random(0));
        when(random.nextInt(2)).thenReturn(1);
        when(random.nextDouble()).thenReturn(0.25);

        List<DecisionFunction> candidates = generator.generateCandidates(examples, 1, random);
        FeatureThresholdDecisionFunction function = (FeatureThresholdDecisionFunction) candidates.get(0);
        assertEquals(1, function.getFeatureIndex());
        assertEquals(15.0f, function.getThreshold(), 1e-6);
    }

    @Test
    public void testNoExamples() {
        assertTrue(generator.generateCandidates(Collections.emptyList(), 10, new Random(0)).isEmpty());
    }

    @Test
    public void testInvalidCandidateCount() {
        assertThrows(IllegalArgumentException.class, () -> generator.generateCandidates(examples, -1, new Random(0)));
        assertTrue(generator.generateCandidates(examples, 0, new Random(0)).isEmpty());
    }
}
