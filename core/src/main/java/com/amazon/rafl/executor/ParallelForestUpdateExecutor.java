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

import static com.amazon.rafl.CommonUtils.checkArgument;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.Collectors;

import com.amazon.rafl.examples.Example;
import com.amazon.rafl.tree.DecisionTree;

/**
 * An implementation of forest update methods that uses a private thread pool to
 * update trees in parallel.
 *
 * @param <L> The label type.
 */
public class ParallelForestUpdateExecutor<L extends Comparable<? super L>> extends AbstractForestUpdateExecutor<L> {

    private ForkJoinPool forkJoinPool;
    private final int threadPoolSize;

    public ParallelForestUpdateExecutor(List<DecisionTree<L>> trees, int threadPoolSize) {
        super(trees);
        checkArgument(threadPoolSize > 0, "threadPoolSize must be greater than 0");
        this.threadPoolSize = threadPoolSize;
        forkJoinPool = new ForkJoinPool(threadPoolSize);
    }

    @Override
    protected List<UpdateResult<L>> updateTrees(Example<L> example) {
        return submitAndJoin(
                () -> trees.parallelStream().map(t -> t.addExample(example)).collect(Collectors.toList()));
    }

    @Override
    protected int trainTrees(int splitBudget) {
        return submitAndJoin(() -> trees.parallelStream().mapToInt(t -> t.train(splitBudget)).sum());
    }

    /**
     * Shut down the thread pool. A later update or lookup starts a new one.
     */
    @Override
    public synchronized void shutdown() {
        if (forkJoinPool != null) {
            forkJoinPool.shutdown();
            forkJoinPool = null;
        }
    }

    synchronized ForkJoinPool getForkJoinPool() {
        return forkJoinPool;
    }

    private <T> T submitAndJoin(Callable<T> callable) {
        ForkJoinPool pool;
        synchronized (this) {
            if (forkJoinPool == null) {
                forkJoinPool = new ForkJoinPool(threadPoolSize);
            }
            pool = forkJoinPool;
        }
        return pool.submit(callable).join();
    }
}
