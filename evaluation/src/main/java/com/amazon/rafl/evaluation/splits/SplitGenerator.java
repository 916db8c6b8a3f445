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

package com.amazon.rafl.evaluation.splits;

import java.util.List;

/**
 * Generates the training/validation splits over which a classifier is
 * evaluated.
 */
public interface SplitGenerator {

    /**
     * @param exampleCount the number of examples to divide
     * @return the splits, each referring to examples by their index
     * @throws IllegalArgumentException if the examples cannot be divided as
     *                                  configured.
     */
    List<Split> generateSplits(int exampleCount);
}
