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

import java.io.Serializable;
import java.util.List;
import java.util.Map;

import lombok.Data;

/**
 * A class that encapsulates the data of an evaluation result such that it can be
 * written as JSON and read back.
 */
@Data
public class EvaluationResultState implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final String VERSION = "1.0";

    private String version = VERSION;

    private List<String> labels;

    private List<ConfusionMatrixState> splitConfusionMatrices;

    private ConfusionMatrixState confusionMatrix;

    private double accuracyMean;

    private double accuracyStandardDeviation;

    private long accuracySampleCount;

    private Map<String, Double> precision;

    private Map<String, Double> recall;
}
