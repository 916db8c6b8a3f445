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

import static com.amazon.rafl.TestUtils.EPSILON;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Collections;

import org.junit.jupiter.api.Test;

import com.amazon.rafl.base.Histogram;
import com.amazon.rafl.base.ProbabilityMassFunction;

public class PredictionTest {

    @Test
    public void testPrediction() {
        Histogram<String> histogram = new Histogram<>();
        histogram.add("cat", 1);
        histogram.add("dog", 3);
        Prediction<String> prediction = new Prediction<>(histogram.toPmf());

        assertEquals("dog", prediction.getLabel().get());
        assertEquals(0.75, prediction.getConfidence(), EPSILON);
        assertEquals(0.25, prediction.getConfidence("cat"), EPSILON);
        assertEquals(0.0, prediction.getConfidence("bird"));
        assertEquals(2, prediction.getConfidences().size());
        assertEquals("Prediction(dog, { (cat,0.25) (dog,0.75) })", prediction.toString());
    }

    @Test
    public void testEmptyPrediction() {
        Prediction<String> prediction = new Prediction<>(ProbabilityMassFunction.uniform(Collections.<String>emptyList()));
        assertEquals("Prediction(none, { })", prediction.toString());
        assertThrows(NullPointerException.class, () -> new Prediction<String>(null));
    }
}
