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

import com.amazon.rafl.base.ProbabilityMassFunction;
import com.amazon.rafl.tree.DecisionTree;

/**
 * An implementation of forest traversal methods that uses a private thread pool
 * to visit trees in parallel.
 *
 * @param <L> The label type.
 */
public class ParallelForestTraversalExecutor<L extends Comparable<? super L>>
        extends AbstractForestTraversalExecutor<L> {

    private ForkJoinPool forkJoinPool;
    private final int threadPoolSize;

    public ParallelForestTraversalExecutor(List<DecisionTree<L>> trees, int threadPoolSize) {
        super(trees);
        checkArgument(threadPoolSize > 0, "threadPoolSize must be greater than 0");
        this.threadPoolSize = threadPoolSize;
        forkJoinPool = new ForkJoinPool(threadPoolSize);
    }

    @Override
    public List<ProbabilityMassFunction<L>> lookupDistributions(float[] descriptor) {
        return submitAndJoin(
                () -> trees.parallelStream().map(t -> t.predict(descriptor)).collect(Collectors.toList()));
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
