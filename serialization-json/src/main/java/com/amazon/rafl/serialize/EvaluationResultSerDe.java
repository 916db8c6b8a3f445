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

import lombok.Getter;

import com.amazon.rafl.evaluation.EvaluationResult;
import com.google.gson.Gson;

/**
 * {@link EvaluationResult} serialization. Internally we use the
 * {@link EvaluationResultMapper} class to convert a result into a corresponding
 * state object, and we use <a href="https://github.com/google/gson">Gson</a> to
 * write the state object as a JSON string. The Gson instance is exposed so that
 * users can customize the output (e.g., by enabling pretty printing).
 */
@Getter
public class EvaluationResultSerDe {

    private final EvaluationResultMapper mapper;
    private final Gson gson;

    public EvaluationResultSerDe() {
        this(new EvaluationResultMapper(), new Gson());
    }

    public EvaluationResultSerDe(EvaluationResultMapper mapper, Gson gson) {
        this.mapper = mapper;
        this.gson = gson;
    }

    public <L extends Comparable<? super L>> String toJson(EvaluationResult<L> result) {
        return gson.toJson(mapper.toState(result));
    }

    public EvaluationResultState stateFromJson(String json) {
        return gson.fromJson(json, EvaluationResultState.class);
    }

    /**
     * @param json a json string written by {@link #toJson}
     * @return the evaluation result, with labels in their string form
     */
    public EvaluationResult<String> fromJson(String json) {
        return mapper.toModel(stateFromJson(json));
    }
}
