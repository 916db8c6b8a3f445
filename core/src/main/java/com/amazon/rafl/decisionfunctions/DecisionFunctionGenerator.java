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

package com.amazon.rafl.decisionfunctions;

import java.util.List;
import java.util.Random;

import com.amazon.rafl.examples.Example;

/**
 * Generates candidate decision functions for splitting a leaf. Candidates are
 * drawn at random, which is what makes the trees of a forest differ from one
 * another.
 */
public interface DecisionFunctionGenerator {

    /**
     * @param examples       The examples currently held at the leaf.
     * @param candidateCount The number of candidates to generate.
     * @param random         The random number generator of the tree.
     * @return the candidates; may hold fewer than {@code candidateCount} entries
     *         when the examples do not allow more, and is empty when there are no
     *         examples.
     */
    List<DecisionFunction> generateCandidates(List<? extends Example<?>> examples, int candidateCount, Random random);
}
