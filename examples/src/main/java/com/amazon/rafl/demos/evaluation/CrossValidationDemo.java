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

package com.amazon.rafl.demos.evaluation;

import java.util.List;

import com.amazon.rafl.RandomForest;
import com.amazon.rafl.demos.Demo;
import com.amazon.rafl.evaluation.EvaluationResult;
import com.amazon.rafl.evaluation.RandomForestEvaluator;
import com.amazon.rafl.examples.Example;
import com.amazon.rafl.serialize.EvaluationResultMapper;
import com.amazon.rafl.serialize.EvaluationResultSerDe;
import com.amazon.rafl.testutils.LabelledDataSets;
import com.google.gson.GsonBuilder;

/**
 * Cross-validate a forest on a fan of labelled blades, print the report and
 * write it as JSON using <a href="https://github.com/google/gson">Gson</a>.
 */
public class CrossValidationDemo implements Demo {

    public static void main(String[] args) throws Exception {
        new CrossValidationDemo().run();
    }

    @Override
    public String command() {
        return "cross_validate";
    }

    @Override
    public String description() {
        return "cross-validate a forest and print the report as text and JSON";
    }

    @Override
    public void run() throws Exception {
        int numberPerBlade = 200;
        int numberOfBlades = 3;
        int foldCount = 5;

        List<Example<String>> examples = LabelledDataSets.generateFan(numberPerBlade, numberOfBlades, 7);

        EvaluationResult<String> result = RandomForestEvaluator.crossValidate(examples, foldCount,
                () -> RandomForest.<String>builder().dimensions(2).numberOfTrees(10).reservoirCapacity(50)
                        .seenExamplesThreshold(10).candidateCount(20).randomSeed(3).build());

        System.out.printf("examples = %d, folds = %d%n", examples.size(), foldCount);
        System.out.print(result.render());

        EvaluationResultSerDe serDe = new EvaluationResultSerDe(new EvaluationResultMapper(),
                new GsonBuilder().setPrettyPrinting().create());
        String json = serDe.toJson(result);
        System.out.println(json);

        EvaluationResult<String> restored = serDe.fromJson(json);
        if (!restored.render().equals(result.render())) {
            throw new IllegalStateException("restored report does not match the original report");
        }
        System.out.println("Looks good!");
    }
}
