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
import static com.amazon.rafl.CommonUtils.checkNotNull;

import java.util.List;

import lombok.Getter;

import com.amazon.rafl.examples.Example;
import com.amazon.rafl.tree.DecisionTree;

/**
 * Submits examples to every tree of a forest, and runs split evaluation on
 * every tree. Trees share no mutable state, so subclasses are free to process
 * them in any order or concurrently.
 *
 * @param <L> The label type.
 */
@Getter
public abstract class AbstractForestUpdateExecutor<L extends Comparable<? super L>> {

    protected final List<DecisionTree<L>> trees;

    /**
     * Create a new AbstractForestUpdateExecutor.
     *
     * @param trees The trees to update.
     */
    protected AbstractForestUpdateExecutor(List<DecisionTree<L>> trees) {
        this.trees = checkNotNull(trees, "trees must not be null");
    }

    /**
     * Add the example to each tree in the forest.
     *
     * @param example The example used to update the forest.
     * @return one result per tree, in tree order.
     */
    public List<UpdateResult<L>> update(Example<L> example) {
        checkNotNull(example, "example must not be null");
        return updateTrees(example);
    }

    /**
     * Run split evaluation on each tree in the forest.
     *
     * @param splitBudget The maximum number of leaves to evaluate in each tree.
     * @return the total number of splits performed.
     */
    public int train(int splitBudget) {
        checkArgument(splitBudget >= 0, "splitBudget must be greater than or equal to 0");
        if (splitBudget == 0) {
            return 0;
        }
        return trainTrees(splitBudget);
    }

    /**
     * Internal update method which submits the given example to
     * {@link DecisionTree#addExample} for each tree managed by this executor.
     *
     * @param example The example to submit.
     * @return the update results, in tree order.
     */
    protected abstract List<UpdateResult<L>> updateTrees(Example<L> example);

    /**
     * Internal training method which calls {@link DecisionTree#train} for each tree
     * managed by this executor.
     *
     * @param splitBudget The split budget of each tree.
     * @return the total number of splits performed.
     */
    protected abstract int trainTrees(int splitBudget);

    /**
     * Release the threads held by this executor, if any.
     */
    public void shutdown() {
    }
}
