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

package com.amazon.rafl.testutils;

import static java.lang.Math.PI;
import static java.lang.Math.cos;
import static java.lang.Math.sin;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import com.amazon.rafl.examples.Example;

/**
 * Two-dimensional labelled data sets whose class boundaries are not aligned with
 * a single feature, so that a classifier has to combine several splits.
 */
public class LabelledDataSets {

    private LabelledDataSets() {
    }

    /**
     * Examples drawn from thin elongated blades arranged around the origin like a
     * fan. Each blade is its own class, labelled "blade0", "blade1" and so on.
     *
     * @param numberPerBlade the expected number of examples per blade
     * @param numberOfBlades the number of blades, at most 12
     * @param seed           the random seed
     * @return the labelled examples
     */
    public static List<Example<String>> generateFan(int numberPerBlade, int numberOfBlades, long seed) {
        if (numberOfBlades <= 0 || numberOfBlades > 12 || numberPerBlade <= 0) {
            throw new IllegalArgumentException("between 1 and 12 blades with at least one example each");
        }
        int dataSize = numberOfBlades * numberPerBlade;
        Random prg = new Random(seed);
        LabelledNormalMixtureTestData.NormalDistribution dist = new LabelledNormalMixtureTestData.NormalDistribution(
                new Random(seed + 1));

        List<Example<String>> result = new ArrayList<>(dataSize);
        for (int j = 0; j < dataSize; j++) {
            // shrink
            double[] point = new double[] { 0.05 * dist.nextDouble(), 0.2 * dist.nextDouble() };

            // rotate onto a blade
            int blade = prg.nextInt(numberOfBlades);
            double theta = 2 * PI * blade / numberOfBlades;
            double[] vec = rotateClockWise(point, theta);
            float[] descriptor = new float[] { (float) (vec[0] + 0.6 * sin(theta)),
                    (float) (vec[1] + 0.6 * cos(theta)) };
            result.add(new Example<>(descriptor, "blade" + blade));
        }
        return result;
    }

    public static double[] rotateClockWise(double[] point, double theta) {
        double[] result = new double[2];
        result[0] = cos(theta) * point[0] + sin(theta) * point[1];
        result[1] = -sin(theta) * point[0] + cos(theta) * point[1];
        return result;
    }

    /**
     * Examples drawn uniformly from the unit square, labelled "black" or "white"
     * by the colour of the checkerboard cell they fall into.
     *
     * @param size          the number of examples
     * @param cellsPerSide  the number of cells along each side of the square
     * @param seed          the random seed
     * @return the labelled examples
     */
    public static List<Example<String>> generateCheckerboard(int size, int cellsPerSide, long seed) {
        if (cellsPerSide <= 0) {
            throw new IllegalArgumentException("cellsPerSide must be greater than 0");
        }
        Random prg = new Random(seed);
        List<Example<String>> result = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            float x = prg.nextFloat();
            float y = prg.nextFloat();
            result.add(new Example<>(new float[] { x, y }, checkerboardLabel(x, y, cellsPerSide)));
        }
        return result;
    }

    public static String checkerboardLabel(float x, float y, int cellsPerSide) {
        int column = Math.min((int) (x * cellsPerSide), cellsPerSide - 1);
        int row = Math.min((int) (y * cellsPerSide), cellsPerSide - 1);
        return (row + column) % 2 == 0 ? "black" : "white";
    }
}
