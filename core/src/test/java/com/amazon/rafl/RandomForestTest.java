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

package com.amazon.rafl;

import static com.amazon.rafl.TestUtils.EPSILON;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Random;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.rafl.config.Config;
import com.amazon.rafl.returntypes.Prediction;
import com.amazon.rafl.tree.DecisionTree;

public class RandomForestTest {

    private RandomForest<String> forest;

    @BeforeEach
    public void setUp() {
        forest = RandomForest.<String>builder().dimensions(2).numberOfTrees(1).reservoirCapacity(100)
                .seenExamplesThreshold(4).candidateCount(64).randomSeed(42L).build();
    }

    @Test
    public void testDefaults() {
        RandomForest<String> defaultForest = RandomForest.defaultForest(3, 0L);
        assertEquals(3, defaultForest.getDimensions());
        assertEquals(RandomForest.DEFAULT_NUMBER_OF_TREES, defaultForest.getNumberOfTrees());
        assertEquals(RandomForest.DEFAULT_NUMBER_OF_TREES, defaultForest.getTrees().size());
        assertEquals(RandomForest.DEFAULT_SPLIT_BUDGET_PER_UPDATE, defaultForest.getSplitBudgetPerUpdate());
        assertFalse(defaultForest.isParallelExecutionEnabled());
        assertEquals(0, defaultForest.getThreadPoolSize());
        assertEquals(0, defaultForest.getTotalUpdates());
    }

    @Test
    public void testInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> RandomForest.<String>builder().build());
        assertThrows(IllegalArgumentException.class,
                () -> RandomForest.<String>builder().dimensions(2).numberOfTrees(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> RandomForest.<String>builder().dimensions(2).reservoirCapacity(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> RandomForest.<String>builder().dimensions(2).maxDepth(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> RandomForest.<String>builder().dimensions(2).candidateCount(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> RandomForest.<String>builder().dimensions(2).splitBudgetPerUpdate(-1).build());
        assertThrows(IllegalArgumentException.class, () -> RandomForest.<String>builder().dimensions(2)
                .parallelExecutionEnabled(true).threadPoolSize(0).build());
    }

    @Test
    public void testPredictBeforeTraining() {
        Prediction<String> prediction = forest.predict(new float[] { 1.0f, 1.0f });
        assertFalse(prediction.getLabel().isPresent());
        assertEquals(0.0, prediction.getConfidence());
        assertTrue(prediction.getConfidences().isEmpty());
    }

    @Test
    public void testPredictWithInitialLabels() {
        RandomForest<String> labelled = RandomForest.<String>builder().dimensions(2).numberOfTrees(3)
                .initialLabels(Arrays.asList("B", "A")).randomSeed(1L).build();
        Prediction<String> prediction = labelled.predict(new float[] { 1.0f, 1.0f });

        // a tie between the labels goes to the lowest one
        assertEquals("A", prediction.getLabel().get());
        assertEquals(0.5, prediction.getConfidence("A"), EPSILON);
        assertEquals(0.5, prediction.getConfidence("B"), EPSILON);
        assertEquals(Arrays.asList("A", "B"), Arrays.asList(labelled.getKnownLabels().toArray()));
    }

    @Test
    public void testDimensionMismatch() {
        assertThrows(IllegalArgumentException.class, () -> forest.addExample(new float[] { 1.0f }, "A"));
        assertThrows(IllegalArgumentException.class, () -> forest.predict(new float[] { 1.0f, 2.0f, 3.0f }));
        assertThrows(NullPointerException.class, () -> forest.predict(null));
        assertThrows(NullPointerException.class, () -> forest.addExample(new float[] { 1.0f, 2.0f }, null));
    }

    @Test
    public void testNonFiniteDescriptorsLeaveForestUnchanged() {
        assertThrows(IllegalArgumentException.class, () -> forest.addExample(new float[] { Float.NaN, 0.0f }, "A"));
        assertThrows(IllegalArgumentException.class,
                () -> forest.addExample(new float[] { Float.NEGATIVE_INFINITY, 0.0f }, "A"));
        assertThrows(IllegalArgumentException.class,
                () -> forest.addExample(new float[] { Float.POSITIVE_INFINITY, 0.0f }, "B"));
        assertEquals(0, forest.getTotalUpdates());
        assertTrue(forest.getKnownLabels().isEmpty());

        // the forest keeps ingesting and growing afterwards
        for (int i = 0; i < 10; i++) {
            forest.addExample(new float[] { i, 0.0f }, i < 5 ? "A" : "B");
        }
        forest.train(100);
        assertEquals(10, forest.getTotalUpdates());
        assertThat(forest.getTrees().get(0).getNodeCount(), greaterThan(1));
        assertEquals("B", forest.predict(new float[] { 9.0f, 0.0f }).getLabel().get());
    }

    @Test
    public void testSeparatesTwoClusters() {
        forest.addExample(new float[] { 0.0f, 0.0f }, "A");
        forest.addExample(new float[] { 0.1f, 0.0f }, "A");
        forest.addExample(new float[] { 0.0f, 0.1f }, "A");
        forest.addExample(new float[] { 10.0f, 10.0f }, "B");
        forest.train(100);

        Prediction<String> a = forest.predict(new float[] { 0.05f, 0.05f });
        assertEquals("A", a.getLabel().get());
        assertEquals(1.0, a.getConfidence(), EPSILON);

        Prediction<String> b = forest.predict(new float[] { 10.0f, 10.0f });
        assertEquals("B", b.getLabel().get());
        assertEquals(1.0, b.getConfidence(), EPSILON);

        assertEquals(4, forest.getTotalUpdates());
        assertEquals(3, forest.getTrees().get(0).getNodeCount());
    }

    @Test
    public void testNoSplitsWithoutBudget() {
        forest.setConfig(Config.SPLIT_BUDGET_PER_UPDATE, 0);
        for (int i = 0; i < 10; i++) {
            forest.addExample(new float[] { i, 0.0f }, i < 5 ? "A" : "B");
        }
        assertEquals(1, forest.getTrees().get(0).getNodeCount());

        assertThat(forest.train(10), greaterThan(0));
        assertThat(forest.getTrees().get(0).getNodeCount(), greaterThan(1));
    }

    @Test
    public void testAveragingAcrossTrees() {
        RandomForest<Integer> multi = RandomForest.<Integer>builder().dimensions(2).numberOfTrees(5)
                .seenExamplesThreshold(10).candidateCount(16).randomSeed(7L).build();
        Random random = new Random(3);
        for (int i = 0; i < 500; i++) {
            float x = random.nextFloat();
            float y = random.nextFloat();
            multi.addExample(new float[] { x, y }, x + y < 1 ? 0 : 1);
        }

        float[] descriptor = new float[] { 0.4f, 0.4f };
        double expected = 0;
        for (DecisionTree<Integer> tree : multi.getTrees()) {
            expected += tree.predict(descriptor).getMass(0) / multi.getNumberOfTrees();
        }

        Prediction<Integer> prediction = multi.predict(descriptor);
        assertEquals(expected, prediction.getConfidence(0), EPSILON);
        double sum = prediction.getConfidences().values().stream().mapToDouble(Double::doubleValue).sum();
        assertEquals(1.0, sum, EPSILON);
        assertEquals(0, prediction.getLabel().get());
    }

    @Test
    public void testUsableAfterShutdown() {
        RandomForest<String> parallel = RandomForest.<String>builder().dimensions(2).numberOfTrees(3)
                .seenExamplesThreshold(4).randomSeed(5L).parallelExecutionEnabled(true).threadPoolSize(2).build();
        parallel.addExample(new float[] { 0.0f, 0.0f }, "A");
        parallel.shutdown();

        parallel.addExample(new float[] { 10.0f, 10.0f }, "B");
        assertEquals(2, parallel.getTotalUpdates());
        assertEquals(2, parallel.predict(new float[] { 0.0f, 0.0f }).getConfidences().size());
        parallel.shutdown();
        parallel.shutdown();
    }

    @Test
    public void testParallelMatchesSequential() {
        RandomForest<String> sequential = RandomForest.<String>builder().dimensions(2).numberOfTrees(4)
                .seenExamplesThreshold(5).randomSeed(99L).build();
        RandomForest<String> parallel = RandomForest.<String>builder().dimensions(2).numberOfTrees(4)
                .seenExamplesThreshold(5).randomSeed(99L).parallelExecutionEnabled(true).threadPoolSize(2).build();
        assertTrue(parallel.isParallelExecutionEnabled());
        assertEquals(2, parallel.getThreadPoolSize());

        Random random = new Random(5);
        for (int i = 0; i < 300; i++) {
            float[] descriptor = new float[] { random.nextFloat(), random.nextFloat() };
            String label = descriptor[0] < 0.5f ? "left" : "right";
            sequential.addExample(descriptor, label);
            parallel.addExample(descriptor, label);
        }

        for (int i = 0; i < 20; i++) {
            float[] descriptor = new float[] { random.nextFloat(), random.nextFloat() };
            assertEquals(sequential.predict(descriptor).getConfidences(),
                    parallel.predict(descriptor).getConfidences());
        }
    }

    @Test
    public void testGetConfig() {
        assertEquals(2, forest.getConfig(Config.DIMENSIONS, Integer.class));
        assertEquals(1, forest.getConfig(Config.NUMBER_OF_TREES, Integer.class));
        assertEquals(100, forest.getConfig(Config.RESERVOIR_CAPACITY, Integer.class));
        assertEquals(64, forest.getConfig(Config.CANDIDATE_COUNT, Integer.class));
        assertEquals(4, forest.getConfig(Config.SEEN_EXAMPLES_THRESHOLD, Integer.class));
        assertEquals(0.0, forest.getConfig(Config.GAIN_THRESHOLD, Double.class));
        assertFalse(forest.getConfig(Config.PMF_REWEIGHTING_ENABLED, Boolean.class));
        assertEquals(1, forest.getConfig(Config.SPLIT_BUDGET_PER_UPDATE));

        assertThrows(IllegalArgumentException.class, () -> forest.getConfig(Config.DIMENSIONS, Double.class));
        assertThrows(IllegalArgumentException.class, () -> forest.getConfig("foo"));
        assertThrows(IllegalArgumentException.class, () -> forest.getConfig(Config.RANDOM_SEED));
    }

    @Test
    public void testSetConfig() {
        forest.setConfig(Config.SPLIT_BUDGET_PER_UPDATE, 5);
        assertEquals(5, forest.getSplitBudgetPerUpdate());

        assertThrows(IllegalArgumentException.class, () -> forest.setConfig(Config.SPLIT_BUDGET_PER_UPDATE, -1));
        assertThrows(IllegalArgumentException.class, () -> forest.setConfig(Config.SPLIT_BUDGET_PER_UPDATE, 1.5));
        assertThrows(IllegalArgumentException.class, () -> forest.setConfig(Config.MAX_DEPTH, 3));
        assertThrows(IllegalArgumentException.class, () -> forest.setConfig("foo", 3));
        assertEquals(5, forest.getSplitBudgetPerUpdate());
    }

    @Test
    public void testParameters() {
        Map<String, Object> parameters = new HashMap<>();
        parameters.put(Config.DIMENSIONS, 4);
        parameters.put(Config.NUMBER_OF_TREES, 3L);
        parameters.put(Config.MAX_DEPTH, 6);
        parameters.put(Config.GAIN_THRESHOLD, 0.1f);
        parameters.put(Config.PMF_REWEIGHTING_ENABLED, true);
        parameters.put(Config.RANDOM_SEED, 12);

        RandomForest<String> configured = RandomForest.<String>builder().parameters(parameters).build();
        assertEquals(4, configured.getDimensions());
        assertEquals(3, configured.getNumberOfTrees());
        assertEquals(6, configured.getTreeSettings().getMaxDepth());
        assertEquals(0.1, configured.getTreeSettings().getGainThreshold(), EPSILON);
        assertTrue(configured.getTreeSettings().isPmfReweightingEnabled());

        assertThrows(IllegalArgumentException.class,
                () -> RandomForest.<String>builder().parameters(Map.of("foo", 1)));
        assertThrows(IllegalArgumentException.class,
                () -> RandomForest.<String>builder().parameters(Map.of(Config.MAX_DEPTH, 2.5)));
        assertThrows(IllegalArgumentException.class,
                () -> RandomForest.<String>builder().parameters(Map.of(Config.PMF_REWEIGHTING_ENABLED, "yes")));
    }
}
