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

import com.amazon.rafl.base.ProbabilityMassFunction;
import com.amazon.rafl.tree.DecisionTree;

/**
 * Traverse the trees in a forest sequentially.
 *
 * @param <L> The label type.
 */
public class SequentialForestTraversalExecutor<L extends Comparable<? super L>>
        extends AbstractForestTraversalExecutor<L> {

    public SequentialForestTraversalExecutor(List<DecisionTree<L>> trees) {
        super(trees);
    }

    @Override
    public List<ProbabilityMassFunction<L>> lookupDistributions(float[] descriptor) {
        return trees.stream().map(t -> t.predict(descriptor)).collect(Collectors.toList());
    }
}
