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

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.OperationsPerInvocation;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import com.amazon.rafl.examples.Example;
import com.amazon.rafl.testutils.LabelledNormalMixtureTestData;

@Warmup(iterations = 2)
@Measurement(iterations = 5)
@Fork(value = 1)
@State(Scope.Thread)
public class RandomForestBenchmark {

    public final static int DATA_SIZE = 10_000;
    public final static int INITIAL_DATA_SIZE = 5_000;

    @State(Scope.Benchmark)
    public static class BenchmarkState {
        @Param({ "4", "32" })
        int dimensions;

        @Param({ "10", "50" })
        int numberOfTrees;

        @Param({ "0", "1" })
        int splitBudgetPerUpdate;

        @Param({ "false", "true" })
        boolean parallel;

        List<Example<String>> data;
        RandomForest<String> forest;

        @Setup(Level.Trial)
        public void setUpData() {
            LabelledNormalMixtureTestData testData = new LabelledNormalMixtureTestData(dimensions);
            data = testData.generateTestData(INITIAL_DATA_SIZE + DATA_SIZE, 99);
        }

        @Setup(Level.Invocation)
        public void setUpForest() {
            forest = RandomForest.<String>builder().dimensions(dimensions).numberOfTrees(numberOfTrees)
                    .reservoirCapacity(100).candidateCount(32).splitBudgetPerUpdate(splitBudgetPerUpdate)
                    .parallelExecutionEnabled(parallel).randomSeed(99).build();

            for (int i = 0; i < INITIAL_DATA_SIZE; i++) {
                forest.addExample(data.get(i));
            }
        }
    }

    private RandomForest<String> forest;

    @Benchmark
    @OperationsPerInvocation(DATA_SIZE)
    public RandomForest<String> addExample(BenchmarkState state) {
        List<Example<String>> data = state.data;
        forest = state.forest;

        for (int i = INITIAL_DATA_SIZE; i < data.size(); i++) {
            forest.addExample(data.get(i));
        }

        return forest;
    }

    @Benchmark
    @OperationsPerInvocation(DATA_SIZE)
    public RandomForest<String> predictAndAddExample(BenchmarkState state, Blackhole blackhole) {
        List<Example<String>> data = state.data;
        forest = state.forest;
        double confidence = 0.0;

        for (int i = INITIAL_DATA_SIZE; i < data.size(); i++) {
            Example<String> example = data.get(i);
            confidence += forest.predict(example.getDescriptor()).getConfidence();
            forest.addExample(example);
        }

        blackhole.consume(confidence);
        return forest;
    }

    @Benchmark
    public int trainUntilStable(BenchmarkState state) {
        forest = state.forest;
        int total = 0;
        int splits;
        do {
            splits = forest.train(100);
            total += splits;
        } while (splits > 0);
        return total;
    }
}
