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

import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.rafl.RandomForest;
import com.amazon.rafl.config.Config;
import com.amazon.rafl.demos.Demo;
import com.amazon.rafl.evaluation.EvaluationResult;
import com.amazon.rafl.evaluation.ParameterSetProductGenerator;
import com.amazon.rafl.evaluation.PerformanceTable;
import com.amazon.rafl.evaluation.RandomForestEvaluator;
import com.amazon.rafl.evaluation.splits.CrossValidationSplitGenerator;
import com.amazon.rafl.examples.Example;
import com.amazon.rafl.testutils.LabelledDataSets;

/**
 * Search a small grid of forest settings with cross-validation and report the
 * best one.
 */
public class GridSearchDemo implements Demo {

    private static final Logger logger = LogManager.getLogger(GridSearchDemo.class);

    public static void main(String[] args) throws Exception {
        new GridSearchDemo().run();
    }

    @Override
    public String command() {
        return "grid_search";
    }

    @Override
    public String description() {
        return "evaluate every combination of a few forest settings on a checkerboard";
    }

    @Override
    public void run() throws Exception {
        List<Example<String>> examples = LabelledDataSets.generateCheckerboard(600, 3, 5);

        ParameterSetProductGenerator generator = new ParameterSetProductGenerator()
                .addParameter(Config.NUMBER_OF_TREES, 5, 20).addParameter(Config.MAX_DEPTH, 2, 8)
                .addParameter(Config.CANDIDATE_COUNT, 4, 32);

        PerformanceTable table = new PerformanceTable(Collections.singletonList(EvaluationResult.ACCURACY));
        for (Map<String, Object> parameterSet : generator.generateParameterSets()) {
            RandomForestEvaluator<String> evaluator = new RandomForestEvaluator<>(
                    new CrossValidationSplitGenerator(3, RandomForestEvaluator.DEFAULT_SEED),
                    () -> RandomForest.<String>builder().dimensions(2).seenExamplesThreshold(10)
                            .parameters(parameterSet).randomSeed(13).build());
            EvaluationResult<String> result = evaluator.evaluate(examples);
            logger.info("{}: accuracy {}", ParameterSetProductGenerator.describe(parameterSet),
                    result.getAccuracy());
            table.record(parameterSet, result.getPerformanceMeasures());
        }

        System.out.print(table.render());
        Map<String, Object> best = table.getBestParameterSet(EvaluationResult.ACCURACY)
                .orElseThrow(() -> new IllegalStateException("no parameter set was evaluated"));
        System.out.println("Best: " + ParameterSetProductGenerator.describe(best));
    }
}
