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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import com.amazon.rafl.examples.Example;

/**
 * This class samples labelled examples from a mixture of multi-variate normal
 * distributions with covariance matrices of the form sigma * I. Each component
 * of the mixture has its own mean and label, and components are chosen with
 * equal probability.
 */
public class LabelledNormalMixtureTestData {

    private final double[][] means;
    private final String[] labels;
    private final double sigma;

    public LabelledNormalMixtureTestData(double[][] means, String[] labels, double sigma) {
        if (means.length == 0 || means.length != labels.length) {
            throw new IllegalArgumentException("there must be one label per mean");
        }
        for (double[] mean : means) {
            if (mean.length != means[0].length) {
                throw new IllegalArgumentException("all means must have the same dimensions");
            }
        }
        this.means = means;
        this.labels = labels;
        this.sigma = sigma;
    }

    /**
     * Two well separated components labelled "A" and "B".
     *
     * @param dimensions the number of features
     */
    public LabelledNormalMixtureTestData(int dimensions) {
        this(new double[][] { filled(dimensions, 0.0), filled(dimensions, 5.0) }, new String[] { "A", "B" }, 1.0);
    }

    public int getDimensions() {
        return means[0].length;
    }

    public List<String> getLabels() {
        return Arrays.asList(labels);
    }

    public List<Example<String>> generateTestData(int numberOfExamples, long seed) {
        Random rng = new Random(seed);
        NormalDistribution dist = new NormalDistribution(rng);
        List<Example<String>> result = new ArrayList<>(numberOfExamples);

        for (int i = 0; i < numberOfExamples; i++) {
            int component = rng.nextInt(means.length);
            float[] descriptor = new float[getDimensions()];
            for (int j = 0; j < descriptor.length; j++) {
                descriptor[j] = (float) dist.nextDouble(means[component][j], sigma);
            }
            result.add(new Example<>(descriptor, labels[component]));
        }
        return result;
    }

    private static double[] filled(int dimensions, double value) {
        double[] result = new double[dimensions];
        Arrays.fill(result, value);
        return result;
    }

    static class NormalDistribution {
        private final Random rng;
        private final double[] buffer;
        private int index;

        NormalDistribution(Random rng) {
            this.rng = rng;
            buffer = new double[2];
            index = 0;
        }

        double nextDouble() {
            if (index == 0) {
                // Box-Muller; 1 - u keeps the argument of the log positive
                double u = 1.0 - rng.nextDouble();
                double v = rng.nextDouble();
                double r = Math.sqrt(-2 * Math.log(u));
                buffer[0] = r * Math.cos(2 * Math.PI * v);
                buffer[1] = r * Math.sin(2 * Math.PI * v);
            }

            double result = buffer[index];
            index = (index + 1) % 2;

            return result;
        }

        double nextDouble(double mu, double sigma) {
            return mu + sigma * nextDouble();
        }
    }
}
