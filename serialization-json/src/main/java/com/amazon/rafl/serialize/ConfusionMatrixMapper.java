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

package com.amazon.rafl.serialize;

import static com.amazon.rafl.CommonUtils.checkArgument;
import static com.amazon.rafl.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.List;

import com.amazon.rafl.evaluation.ConfusionMatrix;

public class ConfusionMatrixMapper {

    public <L extends Comparable<? super L>> ConfusionMatrixState toState(ConfusionMatrix<L> matrix) {
        List<L> labels = new ArrayList<>(matrix.getLabels());
        List<String> names = new ArrayList<>(labels.size());
        long[][] counts = new long[labels.size()][labels.size()];
        for (int i = 0; i < labels.size(); i++) {
            names.add(String.valueOf(labels.get(i)));
            for (int j = 0; j < labels.size(); j++) {
                counts[i][j] = matrix.getCount(labels.get(i), labels.get(j));
            }
        }

        ConfusionMatrixState state = new ConfusionMatrixState();
        state.setLabels(names);
        state.setCounts(counts);
        return state;
    }

    /**
     * @param state a confusion matrix state
     * @return a confusion matrix over the string form of the labels.
     */
    public ConfusionMatrix<String> toModel(ConfusionMatrixState state) {
        checkNotNull(state.getLabels(), "labels must not be null");
        checkNotNull(state.getCounts(), "counts must not be null");
        List<String> labels = state.getLabels();
        long[][] counts = state.getCounts();
        checkArgument(counts.length == labels.size(), "there must be one row of counts per label");

        ConfusionMatrix.Builder<String> builder = ConfusionMatrix.builder();
        for (int i = 0; i < labels.size(); i++) {
            checkArgument(counts[i].length == labels.size(), "there must be one column of counts per label");
            builder.addLabel(labels.get(i));
            for (int j = 0; j < labels.size(); j++) {
                if (counts[i][j] > 0) {
                    builder.add(labels.get(i), labels.get(j), counts[i][j]);
                }
            }
        }
        return builder.build();
    }
}
