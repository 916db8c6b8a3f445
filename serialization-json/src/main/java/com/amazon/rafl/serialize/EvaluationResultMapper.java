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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.amazon.rafl.evaluation.ConfusionMatrix;
import com.amazon.rafl.evaluation.EvaluationResult;

/**
 * Converts an {@link EvaluationResult} to and from an
 * {@link EvaluationResultState}. The derived measures are stored alongside the
 * confusion matrices so that the JSON is readable on its own, but only the
 * per-split matrices are needed to rebuild a result.
 */
public class EvaluationResultMapper {

    private final ConfusionMatrixMapper confusionMatrixMapper = new ConfusionMatrixMapper();

    public <L extends Comparable<? super L>> EvaluationResultState toState(EvaluationResult<L> result) {
        checkNotNull(result, "result must not be null");
        EvaluationResultState state = new EvaluationResultState();

        ConfusionMatrix<L> matrix = result.getConfusionMatrix();
        List<String> labels = new ArrayList<>();
        Map<String, Double> precision = new LinkedHashMap<>();
        Map<String, Double> recall = new LinkedHashMap<>();
        for (L label : matrix.getLabels()) {
            String name = String.valueOf(label);
            labels.add(name);
            precision.put(name, result.getPrecision(label));
            recall.put(name, result.getRecall(label));
        }
        state.setLabels(labels);
        state.setPrecision(precision);
        state.setRecall(recall);

        List<ConfusionMatrixState> splitStates = new ArrayList<>();
        for (ConfusionMatrix<L> split : result.getSplitConfusionMatrices()) {
            splitStates.add(confusionMatrixMapper.toState(split));
        }
        state.setSplitConfusionMatrices(splitStates);
        state.setConfusionMatrix(confusionMatrixMapper.toState(matrix));

        state.setAccuracyMean(result.getAccuracy().getMean());
        state.setAccuracyStandardDeviation(result.getAccuracy().getStandardDeviation());
        state.setAccuracySampleCount(result.getAccuracy().getSampleCount());
        return state;
    }

    public EvaluationResult<String> toModel(EvaluationResultState state) {
        checkNotNull(state, "state must not be null");
        checkArgument(EvaluationResultState.VERSION.equals(state.getVersion()),
                String.format("unsupported version '%s'", state.getVersion()));
        checkNotNull(state.getSplitConfusionMatrices(), "splitConfusionMatrices must not be null");

        List<ConfusionMatrix<String>> matrices = new ArrayList<>();
        for (ConfusionMatrixState matrixState : state.getSplitConfusionMatrices()) {
            matrices.add(confusionMatrixMapper.toModel(matrixState));
        }
        return new EvaluationResult<>(matrices);
    }
}
