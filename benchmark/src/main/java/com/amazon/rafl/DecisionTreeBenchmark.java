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

import java.util.List;
import java.util.Optional;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

import com.amazon.rafl.decisionfunctions.FeatureThresholdDecisionFunctionGenerator;
import com.amazon.rafl.examples.Example;
import com.amazon.rafl.testutils.LabelledNormalMixtureTestData;
import com.amazon.rafl.tree.DecisionTree;
import com.amazon.rafl.tree.SplitCandidate;
import com.amazon.rafl.tree.TreeSettings;

/**
 * Measures the cost of evaluating split candidates for a single full leaf.
 */
@Warmup(iterations = 5)
@Measurement(iterations = 10)
@Fork(value = 1)
@State(Scope.Thread)
public class DecisionTreeBenchmark {

    @State(Scope.Benchmark)
    public static class BenchmarkState {
        @Param({ "4", "32" })
        int dimensions;

        @Param({ "100", "1000" })
        int reservoirCapacity;

        @Param({ "16", "256" })
        int candidateCount;

        DecisionTree<String> tree;

        @Setup(Level.Trial)
        public void setUpTree() {
            TreeSettings settings = TreeSettings.builder().reservoirCapacity(reservoirCapacity)
                    .candidateCount(candidateCount).build();
            tree = new DecisionTree<>(settings, new FeatureThresholdDecisionFunctionGenerator(dimensions), 42L);
            List<Example<String>> data = new LabelledNormalMixtureTestData(dimensions)
                    .generateTestData(reservoirCapacity, 42L);
            tree.addExamples(data);
        }
    }

    @Benchmark
    public Optional<SplitCandidate<String>> considerSplit(BenchmarkState state) {
        return state.tree.considerSplit(0);
    }
}
