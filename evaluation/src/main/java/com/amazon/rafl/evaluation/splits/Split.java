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

import static com.amazon.rafl.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.Getter;

/**
 * A division of a set of examples, given by index, into the examples used to
 * train a classifier and the examples held out to validate it.
 */
@Getter
public class Split {

    private final List<Integer> trainingIndices;

    private final List<Integer> validationIndices;

    public Split(List<Integer> trainingIndices, List<Integer> validationIndices) {
        checkNotNull(trainingIndices, "trainingIndices must not be null");
        checkNotNull(validationIndices, "validationIndices must not be null");
        this.trainingIndices = Collections.unmodifiableList(new ArrayList<>(trainingIndices));
        this.validationIndices = Collections.unmodifiableList(new ArrayList<>(validationIndices));
    }

    @Override
    public String toString() {
        return String.format("Split(%d training, %d validation)", trainingIndices.size(),
                validationIndices.size());
    }
}
