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

package com.amazon.rafl.demos.online;

import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.rafl.RandomForest;
import com.amazon.rafl.demos.Demo;
import com.amazon.rafl.examples.Example;
import com.amazon.rafl.returntypes.Prediction;
import com.amazon.rafl.testutils.LabelledDataSets;

/**
 * Simulates an interactive labelling session. A user labels cells of a
 * checkerboard a few strokes at a time, and after every stroke the forest
 * relabels a fixed grid of probe points. The fraction of probes labelled
 * correctly should grow as the session goes on.
 */
public class OnlineLabellingDemo implements Demo {

    private static final Logger logger = LogManager.getLogger(OnlineLabellingDemo.class);

    public static void main(String[] args) throws Exception {
        new OnlineLabellingDemo().run();
    }

    @Override
    public String command() {
        return "online";
    }

    @Override
    public String description() {
        return "label a checkerboard stroke by stroke and watch predictions improve";
    }

    @Override
    public void run() throws Exception {
        int cellsPerSide = 4;
        int strokes = 20;
        int examplesPerStroke = 50;

        RandomForest<String> forest = RandomForest.<String>builder().dimensions(2).numberOfTrees(20)
                .reservoirCapacity(64).maxDepth(12).candidateCount(32).seenExamplesThreshold(16)
                .splitBudgetPerUpdate(2).parallelExecutionEnabled(true).randomSeed(17).build();

        List<Example<String>> session = LabelledDataSets.generateCheckerboard(strokes * examplesPerStroke,
                cellsPerSide, 11);

        System.out.printf("numberOfTrees = %d, strokes = %d, examplesPerStroke = %d%n", forest.getNumberOfTrees(),
                strokes, examplesPerStroke);
        System.out.println("stroke\texamples\tprobe accuracy");

        double accuracy = 0;
        for (int stroke = 0; stroke < strokes; stroke++) {
            List<Example<String>> batch = session.subList(stroke * examplesPerStroke,
                    (stroke + 1) * examplesPerStroke);
            forest.addExamples(batch);
            accuracy = probeAccuracy(forest, cellsPerSide);
            System.out.printf("%d\t%d\t%.3f%n", stroke + 1, forest.getTotalUpdates(), accuracy);
        }

        // let the trees catch up on leaves that were touched but not yet evaluated
        int splits;
        do {
            splits = forest.train(100);
            logger.debug("{} splits during idle training", splits);
        } while (splits > 0);
        accuracy = probeAccuracy(forest, cellsPerSide);
        forest.shutdown();
        System.out.printf("after idle training\t%d\t%.3f%n", forest.getTotalUpdates(), accuracy);

        if (accuracy < 0.6) {
            throw new IllegalStateException("forest did not learn the checkerboard");
        }
        System.out.println("Looks good!");
    }

    private static double probeAccuracy(RandomForest<String> forest, int cellsPerSide) {
        int probesPerSide = 40;
        int correct = 0;
        for (int i = 0; i < probesPerSide; i++) {
            for (int j = 0; j < probesPerSide; j++) {
                float x = (i + 0.5f) / probesPerSide;
                float y = (j + 0.5f) / probesPerSide;
                Prediction<String> prediction = forest.predict(new float[] { x, y });
                String expected = LabelledDataSets.checkerboardLabel(x, y, cellsPerSide);
                if (prediction.getLabel().map(expected::equals).orElse(false)) {
                    correct++;
                }
            }
        }
        return (double) correct / (probesPerSide * probesPerSide);
    }
}
