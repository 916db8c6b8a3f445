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

import static com.amazon.rafl.CommonUtils.checkNotNull;

import java.util.List;

import lombok.Getter;

import com.amazon.rafl.base.ProbabilityMassFunction;
import com.amazon.rafl.tree.DecisionTree;

/**
 * Looks up the label distribution of a descriptor in every tree of a forest.
 *
 * @param <L> The label type.
 */
@Getter
public abstract class AbstractForestTraversalExecutor<L extends Comparable<? super L>> {

    protected final List<DecisionTree<L>> trees;

    protected AbstractForestTraversalExecutor(List<DecisionTree<L>> trees) {
        this.trees = checkNotNull(trees, "trees must not be null");
    }

    /**
     * Route the descriptor through each tree and collect the distribution of the
     * leaf it reaches.
     *
     * @param descriptor A descriptor.
     * @return one distribution per tree, in tree order.
     */
    public abstract List<ProbabilityMassFunction<L>> lookupDistributions(float[] descriptor);

    /**
     * Release the threads held by this executor, if any.
     */
    public void shutdown() {
    }
}
