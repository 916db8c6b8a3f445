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

package com.amazon.rafl.config;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Names of the forest settings, as accepted by
 * {@link com.amazon.rafl.RandomForest.Builder#parameters} and
 * {@link IDynamicConfig}. Only {@link #SPLIT_BUDGET_PER_UPDATE} may be changed
 * after the forest has been built.
 */
public class Config {

    public static final String DIMENSIONS = "dimensions";
    public static final String NUMBER_OF_TREES = "numberOfTrees";
    public static final String RESERVOIR_CAPACITY = "reservoirCapacity";
    public static final String MAX_DEPTH = "maxDepth";
    public static final String CANDIDATE_COUNT = "candidateCount";
    public static final String SEEN_EXAMPLES_THRESHOLD = "seenExamplesThreshold";
    public static final String GAIN_THRESHOLD = "gainThreshold";
    public static final String SPLIT_BUDGET_PER_UPDATE = "splitBudgetPerUpdate";
    public static final String PMF_REWEIGHTING_ENABLED = "pmfReweightingEnabled";
    public static final String RANDOM_SEED = "randomSeed";

    public static final List<String> NAMES = Collections.unmodifiableList(Arrays.asList(DIMENSIONS, NUMBER_OF_TREES,
            RESERVOIR_CAPACITY, MAX_DEPTH, CANDIDATE_COUNT, SEEN_EXAMPLES_THRESHOLD, GAIN_THRESHOLD,
            SPLIT_BUDGET_PER_UPDATE, PMF_REWEIGHTING_ENABLED, RANDOM_SEED));

    private Config() {
    }
}
