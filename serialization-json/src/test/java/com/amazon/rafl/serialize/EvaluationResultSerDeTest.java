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

package com.amazon.rafl.serialize;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.rafl.evaluation.ConfusionMatrix;
import com.amazon.rafl.evaluation.EvaluationResult;
import com.google.gson.GsonBuilder;

public class EvaluationResultSerDeTest {

    private static final double EPSILON = 1e-10;

    private EvaluationResult<String> result;
    private EvaluationResultSerDe serDe;

    @BeforeEach
    public void setUp() {
        ConfusionMatrix<String> first = ConfusionMatrix.<String>builder().add("A", "A", 2).add("B", "B").add("B", "A")
                .build();
        ConfusionMatrix<String> second = ConfusionMatrix.<String>builder().add("A", "A").add("B", "B").build();
        result = new EvaluationResult<>(Arrays.asList(first, second));
        serDe = new EvaluationResultSerDe();
    }

    @Test
    public void testToState() {
        EvaluationResultState state = serDe.getMapper().toState(result);

        assertEquals(EvaluationResultState.VERSION, state.getVersion());
        assertThat(state.getLabels(), contains("A", "B"));
        assertEquals(2, state.getSplitConfusionMatrices().size());
        assertArrayEquals(new long[] { 3, 0 }, state.getConfusionMatrix().getCounts()[0]);
        assertArrayEquals(new long[] { 1, 2 }, state.getConfusionMatrix().getCounts()[1]);
        assertEquals(0.875, state.getAccuracyMean(), EPSILON);
        assertEquals(0.125, state.getAccuracyStandardDeviation(), EPSILON);
        assertEquals(2, state.getAccuracySampleCount());
        assertEquals(0.75, state.getPrecision().get("A"), EPSILON);
        assertEquals(2.0 / 3, state.getRecall().get("B"), EPSILON);
    }

    @Test
    public void testRoundTrip() {
        String json = serDe.toJson(result);
        assertThat(json, containsString("\"accuracyMean\":0.875"));

        EvaluationResult<String> restored = serDe.fromJson(json);
        assertEquals(result.render(), restored.render());
        assertEquals(2, restored.getSplitConfusionMatrices().size());
        assertEquals(result.getSplitConfusionMatrices().get(0).render(),
                restored.getSplitConfusionMatrices().get(0).render());
    }

    @Test
    public void testIntegerLabelsAreWrittenAsStrings() {
        ConfusionMatrix<Integer> matrix = ConfusionMatrix.<Integer>builder().add(10, 10).add(2, 10).build();
        EvaluationResult<Integer> numeric = new EvaluationResult<>(Collections.singletonList(matrix));

        EvaluationResultState state = serDe.stateFromJson(serDe.toJson(numeric));
        assertThat(state.getLabels(), contains("2", "10"));
        assertArrayEquals(new long[] { 0, 1 }, state.getConfusionMatrix().getCounts()[0]);
    }

    @Test
    public void testPrettyPrinting() {
        EvaluationResultSerDe pretty = new EvaluationResultSerDe(new EvaluationResultMapper(),
                new GsonBuilder().setPrettyPrinting().create());
        String json = pretty.toJson(result);
        assertThat(json, containsString("\n  \"version\": \"1.0\""));
        assertEquals(result.render(), pretty.fromJson(json).render());
    }

    @Test
    public void testUnsupportedVersion() {
        EvaluationResultState state = serDe.getMapper().toState(result);
        state.setVersion("0.1");
        String json = serDe.getGson().toJson(state);
        assertThrows(IllegalArgumentException.class, () -> serDe.fromJson(json));
    }

    @Test
    public void testMalformedCounts() {
        ConfusionMatrixState state = new ConfusionMatrixState();
        state.setLabels(Arrays.asList("A", "B"));
        state.setCounts(new long[][] { { 1, 2 } });
        assertThrows(IllegalArgumentException.class, () -> new ConfusionMatrixMapper().toModel(state));
    }
}
