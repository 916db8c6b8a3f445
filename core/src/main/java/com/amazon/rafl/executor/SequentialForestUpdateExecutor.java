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

import java.util.List;
import java.util.stream.Collectors;

import com.amazon.rafl.examples.Example;
import com.amazon.rafl.tree.DecisionTree;

/**
 * Update the trees in a forest sequentially, in the caller's thread.
 *
 * @param <L> The label type.
 */
public class SequentialForestUpdateExecutor<L extends Comparable<? super L>> extends AbstractForestUpdateExecutor<L> {

    public SequentialForestUpdateExecutor(List<DecisionTree<L>> trees) {
        super(trees);
    }

    @Override
    protected List<UpdateResult<L>> updateTrees(Example<L> example) {
        return trees.stream().map(t -> t.addExample(example)).collect(Collectors.toList());
    }

    @Override
    protected int trainTrees(int splitBudget) {
        return trees.stream().mapToInt(t -> t.train(splitBudget)).sum();
    }
}
