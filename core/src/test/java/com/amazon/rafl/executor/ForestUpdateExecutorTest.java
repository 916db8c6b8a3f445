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

package com.amazon.rafl.executor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.ArgumentsProvider;
import org.junit.jupiter.params.provider.ArgumentsSource;

import com.amazon.rafl.examples.Example;
import com.amazon.rafl.tree.DecisionTree;

public class ForestUpdateExecutorTest {

    private static final int numberOfTrees = 10;
    private static final int threadPoolSize = 2;

    private static class TestExecutorProvider implements ArgumentsProvider {
        @Override
        @SuppressWarnings("unchecked")
        public Stream<? extends Arguments> provideArguments(ExtensionContext context) throws Exception {

            List<DecisionTree<String>> sequentialTrees = new ArrayList<>();
            List<DecisionTree<String>> parallelTrees = new ArrayList<>();

            for (int i = 0; i < numberOfTrees; i++) {
                sequentialTrees.add(mock(DecisionTree.class));
                parallelTrees.add(mock(DecisionTree.class));
            }

            AbstractForestUpdateExecutor<String> sequentialExecutor = new SequentialForestUpdateExecutor<>(
                    sequentialTrees);
            AbstractForestUpdateExecutor<String> parallelExecutor = new ParallelForestUpdateExecutor<>(parallelTrees,
                    threadPoolSize);

            return Stream.of(sequentialExecutor, parallelExecutor).map(Arguments::of);
        }
    }

    @ParameterizedTest
    @ArgumentsSource(TestExecutorProvider.class)
    public void testUpdate(AbstractForestUpdateExecutor<String> executor) {
        Example<String> example = new Example<>(new float[] { 1.0f }, "A");
        int storing = 6;

        List<DecisionTree<String>> trees = executor.getTrees();
        for (int i = 0; i < numberOfTrees; i++) {
            UpdateResult.UpdateResultBuilder<String> builder = UpdateResult.<String>builder().leafIndex(i);
            if (i < storing) {
                builder.storedExample(example);
            }
            when(trees.get(i).addExample(example)).thenReturn(builder.build());
        }

        List<UpdateResult<String>> results = executor.update(example);
        trees.forEach(tree -> verify(tree).addExample(example));

        assertEquals(numberOfTrees, results.size());
        for (int i = 0; i < numberOfTrees; i++) {
            assertEquals(i, results.get(i).getLeafIndex());
            assertEquals(i < storing, results.get(i).isStateChange());
        }
        assertSame(example, results.get(0).getStoredExample().get());
        assertEquals(storing, results.stream().filter(UpdateResult::isStateChange).count());
    }

    @ParameterizedTest
    @ArgumentsSource(TestExecutorProvider.class)
    public void testTrain(AbstractForestUpdateExecutor<String> executor) {
        List<DecisionTree<String>> trees = executor.getTrees();
        int expected = 0;
        for (int i = 0; i < numberOfTrees; i++) {
            when(trees.get(i).train(3)).thenReturn(i % 3);
            expected += i % 3;
        }

        assertEquals(expected, executor.train(3));
        trees.forEach(tree -> verify(tree).train(3));
    }

    @ParameterizedTest
    @ArgumentsSource(TestExecutorProvider.class)
    public void testTrainWithZeroBudget(AbstractForestUpdateExecutor<String> executor) {
        assertEquals(0, executor.train(0));
        executor.getTrees().forEach(tree -> verify(tree, never()).train(anyInt()));
        assertThrows(IllegalArgumentException.class, () -> executor.train(-1));
    }

    @ParameterizedTest
    @ArgumentsSource(TestExecutorProvider.class)
    public void testTrainAfterShutdown(AbstractForestUpdateExecutor<String> executor) {
        executor.getTrees().forEach(tree -> when(tree.train(2)).thenReturn(1));
        executor.shutdown();
        assertEquals(numberOfTrees, executor.train(2));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testShutdownReleasesThreadPool() {
        List<DecisionTree<String>> trees = new ArrayList<>();
        for (int i = 0; i < numberOfTrees; i++) {
            trees.add(mock(DecisionTree.class));
        }
        ParallelForestUpdateExecutor<String> executor = new ParallelForestUpdateExecutor<>(trees, threadPoolSize);
        ForkJoinPool pool = executor.getForkJoinPool();
        assertNotNull(pool);

        executor.shutdown();
        assertTrue(pool.isShutdown());
        assertNull(executor.getForkJoinPool());

        executor.train(1);
        assertNotNull(executor.getForkJoinPool());
        executor.shutdown();
    }
}
