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

package com.amazon.rafl.evaluation;

import static com.amazon.rafl.CommonUtils.checkArgument;
import static com.amazon.rafl.CommonUtils.checkNotNull;

import java.util.Collection;
import java.util.Locale;

import lombok.Getter;

/**
 * A performance measure (for example an accuracy) summarised over one or more
 * samples by its mean and (population) standard deviation.
 */
@Getter
public final class PerformanceMeasure {

    private final double mean;

    private final double standardDeviation;

    private final long sampleCount;

    /**
     * A measure consisting of a single sample.
     *
     * @param value the measured value
     */
    public PerformanceMeasure(double value) {
        this(value, 0.0, 1);
    }

    public PerformanceMeasure(double mean, double standardDeviation, long sampleCount) {
        checkArgument(standardDeviation >= 0, "standardDeviation must be greater than or equal to 0");
        checkArgument(sampleCount > 0, "sampleCount must be greater than 0");
        this.mean = mean;
        this.standardDeviation = standardDeviation;
        this.sampleCount = sampleCount;
    }

    /**
     * Combine several measures into one, as though all their samples had been
     * measured together.
     *
     * @param measures the measures to combine
     * @return the combined measure
     */
    public static PerformanceMeasure average(Collection<PerformanceMeasure> measures) {
        checkNotNull(measures, "measures must not be null");
        checkArgument(!measures.isEmpty(), "cannot average an empty collection of measures");

        long sampleCount = 0;
        double sum = 0;
        for (PerformanceMeasure measure : measures) {
            sampleCount += measure.sampleCount;
            sum += measure.sampleCount * measure.mean;
        }
        double mean = sum / sampleCount;

        double sumOfSquares = 0;
        for (PerformanceMeasure measure : measures) {
            double offset = measure.mean - mean;
            sumOfSquares += measure.sampleCount
                    * (measure.standardDeviation * measure.standardDeviation + offset * offset);
        }
        return new PerformanceMeasure(mean, Math.sqrt(sumOfSquares / sampleCount), sampleCount);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%.4f +/- %.4f", mean, standardDeviation);
    }
}
