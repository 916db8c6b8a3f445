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

import static com.amazon.rafl.TestUtils.EPSILON;
import static com.amazon.rafl.TestUtils.example;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.oneOf;
import static org.hamcrest.Matchers.lessThan;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.rafl.base.ProbabilityMassFunction;
import com.amazon.rafl.decisionfunctions.FeatureThresholdDecisionFunction;
import com.amazon.rafl.decisionfunctions.FeatureThresholdDecisionFunctionGenerator;
import com.amazon.rafl.examples.Example;
import com.amazon.rafl.executor.UpdateResult;

public class DecisionTreeTest {

    private TreeSettings settings;
    private FeatureThresholdDecisionFunctionGenerator generator;
    private DecisionTree<String> tree;

    @BeforeEach
    public void setUp() {
        settings = TreeSettings.builder().reservoirCapacity(100).maxDepth(5).candidateCount(64)
                .seenExamplesThreshold(4).build();
        generator = new FeatureThresholdDecisionFunctionGenerator(2);
        tree = new DecisionTree<>(settings, generator, 42L);
    }

    private void addSeparableExamples(DecisionTree<String> target) {
        target.addExample(example("A", 0.0f, 0.0f));
        target.addExample(example("A", 0.1f, 0.0f));
        target.addExample(example("A", 0.0f, 0.1f));
        target.addExample(example("B", 10.0f, 10.0f));
        target.addExample(example("B", 9.9f, 10.0f));
        target.addExample(example("B", 10.0f, 9.9f));
    }

    @Test
    public void testNew() {
        assertEquals(1, tree.getNodeCount());
        assertEquals(1, tree.getLeafCount());
        assertEquals(0, tree.getDepth());
        assertTrue(tree.isLeaf(0));
        assertEquals(0, tree.route(new float[] { 1.0f, 2.0f }));
        assertTrue(tree.predict(new float[] { 1.0f, 2.0f }).isEmpty());
        assertTrue(tree.getKnownLabels().isEmpty());
    }

    @Test
    public void testInitialLabels() {
        DecisionTree<String> labelled = new DecisionTree<>(settings, generator, new Random(0),
                Arrays.asList("A", "B"));
        ProbabilityMassFunction<String> pmf = labelled.predict(new float[] { 0.0f, 0.0f });
        assertEquals(0.5, pmf.getMass("A"), EPSILON);
        assertEquals(0.5, pmf.getMass("B"), EPSILON);
    }

    @Test
    public void testAddExample() {
        Example<String> first = example("A", 1.0f, 1.0f);
        UpdateResult<String> result = tree.addExample(first);
        assertEquals(0, result.getLeafIndex());
        assertTrue(result.isStateChange());
        assertEquals(first, result.getStoredExample().get());
        assertFalse(result.getEvictedExample().isPresent());

        tree.addExample(example("B", 1.0f, 1.0f));
        tree.addExample(example("B", 1.0f, 1.0f));
        assertEquals(0, tree.getScheduledLeafCount());
        tree.addExample(example("B", 1.0f, 1.0f));
        assertEquals(1, tree.getScheduledLeafCount());

        assertEquals(1, tree.getClassFrequencies().getCount("A"));
        assertEquals(3, tree.getClassFrequencies().getCount("B"));
        assertEquals(Arrays.asList("A", "B"), new ArrayList<>(tree.getKnownLabels()));

        ProbabilityMassFunction<String> pmf = tree.predict(new float[] { 0.0f, 0.0f });
        assertEquals(0.25, pmf.getMass("A"), EPSILON);
        assertEquals(0.75, pmf.getMass("B"), EPSILON);
    }

    @Test
    public void testTrainSplitsSeparableData() {
        addSeparableExamples(tree);
        assertEquals(1, tree.train(10));

        assertEquals(3, tree.getNodeCount());
        assertEquals(2, tree.getLeafCount());
        assertEquals(1, tree.getDepth());
        assertFalse(tree.isLeaf(0));
        assertEquals(1, tree.getNodeDepth(1));
        assertEquals(0, tree.getScheduledLeafCount());

        int leftRoute = tree.route(new float[] { 0.0f, 0.0f });
        int rightRoute = tree.route(new float[] { 10.0f, 10.0f });
        assertThat(leftRoute, oneOf(1, 2));
        assertThat(rightRoute, oneOf(1, 2));
        assertThat(leftRoute, not(rightRoute));

        assertEquals(1.0, tree.predict(new float[] { 0.05f, 0.05f }).getMass("A"), EPSILON);
        assertEquals(1.0, tree.predict(new float[] { 9.95f, 9.95f }).getMass("B"), EPSILON);
        assertThat(tree.toString(), containsString("Feature"));
    }

    @Test
    public void testConsiderSplit() {
        addSeparableExamples(tree);
        Optional<SplitCandidate<String>> candidate = tree.considerSplit(0);
        assertTrue(candidate.isPresent());
        assertEquals(1.0, candidate.get().getGain(), EPSILON);
        assertEquals(3, candidate.get().getLeftHistogram().getTotal());
        assertEquals(3, candidate.get().getRightHistogram().getTotal());

        // considering a split does not change the tree
        assertEquals(1, tree.getNodeCount());
        assertEquals(0, tree.getScheduledLeafCount());
    }

    @Test
    public void testConsiderSplitOnMixedData() {
        Random random = new Random(5);
        for (int i = 0; i < 60; i++) {
            tree.addExample(example(random.nextBoolean() ? "A" : "B", random.nextFloat(), random.nextFloat()));
        }

        Optional<SplitCandidate<String>> candidate = tree.considerSplit(0);
        if (candidate.isPresent()) {
            assertThat(candidate.get().getGain(), greaterThan(0.0));
            assertThat(candidate.get().getLeftHistogram().getTotal(), greaterThan(0L));
            assertThat(candidate.get().getRightHistogram().getTotal(), greaterThan(0L));
            assertEquals(60, candidate.get().getLeftHistogram().getTotal()
                    + candidate.get().getRightHistogram().getTotal());
        }
    }

    @Test
    public void testGainThreshold() {
        DecisionTree<String> strict = new DecisionTree<>(
                TreeSettings.builder().candidateCount(64).seenExamplesThreshold(4).gainThreshold(1.5).build(),
                generator, 42L);
        addSeparableExamples(strict);
        assertFalse(strict.considerSplit(0).isPresent());
        assertEquals(0, strict.train(10));
        assertEquals(1, strict.getNodeCount());
    }

    @Test
    public void testPureLeafIsNotSplit() {
        for (int i = 0; i < 10; i++) {
            tree.addExample(example("A", i, i));
        }
        assertFalse(tree.considerSplit(0).isPresent());
        assertEquals(0, tree.train(5));
        assertEquals(1, tree.getNodeCount());
    }

    @Test
    public void testLeafBelowSeenThresholdIsNotSplit() {
        tree.addExample(example("A", 0.0f, 0.0f));
        tree.addExample(example("B", 10.0f, 10.0f));
        assertFalse(tree.considerSplit(0).isPresent());
        assertEquals(0, tree.train(5));
    }

    @Test
    public void testMaxDepth() {
        DecisionTree<String> shallow = new DecisionTree<>(
                TreeSettings.builder().maxDepth(1).candidateCount(64).seenExamplesThreshold(2).build(), generator,
                7L);
        for (int i = 0; i < 2; i++) {
            shallow.addExample(example("A", 0.0f, 0.0f));
            shallow.addExample(example("B", 5.0f, 0.0f));
            shallow.addExample(example("C", 10.0f, 0.0f));
        }

        shallow.train(100);
        assertEquals(1, shallow.getDepth());
        assertEquals(3, shallow.getNodeCount());
    }

    @Test
    public void testTrainGrowsUntilLeavesArePure() {
        DecisionTree<String> deep = new DecisionTree<>(
                TreeSettings.builder().candidateCount(64).seenExamplesThreshold(2).build(), generator, 11L);
        for (int i = 0; i < 2; i++) {
            deep.addExample(example("A", 0.0f, 0.0f));
            deep.addExample(example("B", 5.0f, 0.0f));
            deep.addExample(example("C", 10.0f, 0.0f));
        }

        assertEquals(2, deep.train(100));
        assertEquals(3, deep.getLeafCount());
        assertEquals("A", deep.predict(new float[] { 0.0f, 0.0f }).calculateBestLabel().get());
        assertEquals("B", deep.predict(new float[] { 5.0f, 0.0f }).calculateBestLabel().get());
        assertEquals("C", deep.predict(new float[] { 10.0f, 0.0f }).calculateBestLabel().get());
    }

    @Test
    public void testApplySplit() {
        addSeparableExamples(tree);
        tree.applySplit(0, new FeatureThresholdDecisionFunction(0, 5.0f));

        assertFalse(tree.isLeaf(0));
        List<Example<String>> left = tree.getLeafExamples(1);
        List<Example<String>> right = tree.getLeafExamples(2);
        assertEquals(3, left.size());
        assertEquals(3, right.size());
        left.forEach(e -> assertThat(e.getFeature(0), lessThan(5.0f)));
        right.forEach(e -> assertThat(e.getLabel(), is("B")));

        assertThrows(IllegalArgumentException.class, () -> tree.getLeafExamples(0));
    }

    @Test
    public void testApplySplitOnInternalNodeThrows() {
        addSeparableExamples(tree);
        tree.applySplit(0, new FeatureThresholdDecisionFunction(0, 5.0f));
        assertThrows(IllegalStateException.class,
                () -> tree.applySplit(0, new FeatureThresholdDecisionFunction(1, 5.0f)));
        assertFalse(tree.considerSplit(0).isPresent());
        assertThrows(IllegalArgumentException.class, () -> tree.considerSplit(17));
    }

    @Test
    public void testEmptyLeafPredictsUniformOverKnownLabels() {
        addSeparableExamples(tree);
        tree.applySplit(0, new FeatureThresholdDecisionFunction(0, 100.0f));
        assertTrue(tree.getLeafExamples(2).isEmpty());

        ProbabilityMassFunction<String> pmf = tree.predict(new float[] { 200.0f, 0.0f });
        assertEquals(0.5, pmf.getMass("A"), EPSILON);
        assertEquals(0.5, pmf.getMass("B"), EPSILON);
    }

    @Test
    public void testPmfReweighting() {
        DecisionTree<String> reweighting = new DecisionTree<>(
                TreeSettings.builder().pmfReweightingEnabled(true).build(), generator, 42L);
        DecisionTree<String> plain = new DecisionTree<>(TreeSettings.builder().build(), generator, 42L);
        for (DecisionTree<String> t : Arrays.asList(reweighting, plain)) {
            t.addExample(example("A", 0.0f, 0.0f));
            t.addExample(example("A", 0.0f, 0.0f));
            t.addExample(example("A", 0.0f, 0.0f));
            t.addExample(example("B", 0.0f, 0.0f));
        }

        float[] descriptor = new float[] { 0.0f, 0.0f };
        assertEquals(0.5, reweighting.predict(descriptor).getMass("A"), EPSILON);
        assertEquals(0.75, plain.predict(descriptor).getMass("A"), EPSILON);
    }

    @Test
    public void testConcurrentUpdatesAndPredictions() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int thread = 0; thread < 4; thread++) {
                final int seed = thread;
                futures.add(executor.submit(() -> {
                    Random random = new Random(seed);
                    for (int i = 0; i < 250; i++) {
                        float x = random.nextFloat() * 10;
                        float y = random.nextFloat() * 10;
                        tree.addExample(example(x < 5 ? "A" : "B", x, y));
                        if (i % 10 == 0) {
                            tree.train(1);
                        }
                        ProbabilityMassFunction<String> pmf = tree.predict(new float[] { y, x });
                        double sum = pmf.getMasses().values().stream().mapToDouble(Double::doubleValue).sum();
                        assertEquals(1.0, sum, EPSILON);
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdown();
        }

        assertEquals(1000, tree.getClassFrequencies().getTotal());
        assertEquals(tree.getNodeCount(), 2 * tree.getLeafCount() - 1);
    }
}
