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

package com.amazon.rafl.base;

import static com.amazon.rafl.CommonUtils.checkArgument;
import static com.amazon.rafl.CommonUtils.checkNotNull;
import static com.amazon.rafl.CommonUtils.log2;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A probability mass function (PMF) over labels, obtained by normalising a
 * {@link Histogram} or a set of non-negative weights.
 * <p>
 * Every label present in the PMF has a mass of at least {@link #SMALL_EPSILON}.
 * A mass that would fall below this value is clamped to it and the
 * distribution is renormalised, so the masses always sum to one and the entropy
 * calculation never sees a vanishing term that is not exactly zero.
 * </p>
 *
 * @param <L> The label type.
 */
public class ProbabilityMassFunction<L extends Comparable<? super L>> {

    private static final Logger logger = LogManager.getLogger(ProbabilityMassFunction.class);

    /**
     * The smallest mass a label present in a PMF may have.
     */
    public static final double SMALL_EPSILON = 1e-9;

    private final SortedMap<L, Double> masses;

    /**
     * Construct a PMF as a normalised version of the specified histogram.
     *
     * @param histogram The histogram from which to construct the PMF.
     * @throws IllegalArgumentException if the histogram is empty.
     */
    public ProbabilityMassFunction(Histogram<L> histogram) {
        this(histogram, Collections.emptyMap());
    }

    /**
     * Construct a PMF from the specified histogram, scaling the count of each
     * label by a multiplier before normalising. Labels without a multiplier are
     * scaled by 1.
     *
     * @param histogram   The histogram from which to construct the PMF.
     * @param multipliers Positive per-label multipliers.
     * @throws IllegalArgumentException if the histogram is empty.
     */
    public ProbabilityMassFunction(Histogram<L> histogram, Map<L, Double> multipliers) {
        checkNotNull(histogram, "histogram must not be null");
        checkNotNull(multipliers, "multipliers must not be null");
        checkArgument(!histogram.isEmpty(), "cannot construct a PMF from an empty histogram");

        SortedMap<L, Double> weights = new TreeMap<>();
        for (Map.Entry<L, Long> bin : histogram.getBins().entrySet()) {
            double multiplier = multipliers.getOrDefault(bin.getKey(), 1.0);
            checkArgument(multiplier > 0, "multipliers must be positive");
            weights.put(bin.getKey(), bin.getValue() * multiplier);
        }
        this.masses = normalise(weights);
    }

    private ProbabilityMassFunction(SortedMap<L, Double> masses) {
        this.masses = masses;
    }

    /**
     * Construct a PMF by normalising arbitrary non-negative weights. Labels with a
     * weight of zero are left out.
     *
     * @param weights The per-label weights.
     * @param <L>     The label type.
     * @return the normalised PMF.
     * @throws IllegalArgumentException if a weight is negative or all weights are
     *                                  zero.
     */
    public static <L extends Comparable<? super L>> ProbabilityMassFunction<L> fromMasses(Map<L, Double> weights) {
        checkNotNull(weights, "weights must not be null");
        SortedMap<L, Double> positive = new TreeMap<>();
        for (Map.Entry<L, Double> entry : weights.entrySet()) {
            checkArgument(entry.getValue() >= 0, "weights must be non-negative");
            if (entry.getValue() > 0) {
                positive.put(entry.getKey(), entry.getValue());
            }
        }
        checkArgument(!positive.isEmpty(), "at least one weight must be positive");
        return new ProbabilityMassFunction<>(normalise(positive));
    }

    /**
     * @param labels The labels over which to spread the mass.
     * @param <L>    The label type.
     * @return a uniform PMF over the labels, or an empty PMF if there are none.
     */
    public static <L extends Comparable<? super L>> ProbabilityMassFunction<L> uniform(Collection<L> labels) {
        checkNotNull(labels, "labels must not be null");
        SortedMap<L, Double> weights = new TreeMap<>();
        for (L label : labels) {
            weights.put(label, 1.0);
        }
        return new ProbabilityMassFunction<>(weights.isEmpty() ? weights : normalise(weights));
    }

    private static <L> SortedMap<L, Double> normalise(SortedMap<L, Double> weights) {
        double sum = weights.values().stream().mapToDouble(Double::doubleValue).sum();
        SortedMap<L, Double> result = new TreeMap<>();
        boolean clamped = false;
        for (Map.Entry<L, Double> entry : weights.entrySet()) {
            double mass = entry.getValue() / sum;
            if (mass < SMALL_EPSILON) {
                mass = SMALL_EPSILON;
                clamped = true;
            }
            result.put(entry.getKey(), mass);
        }

        if (clamped) {
            double clampedSum = result.values().stream().mapToDouble(Double::doubleValue).sum();
            logger.debug("clamped masses below {} and renormalised by {}", SMALL_EPSILON, clampedSum);
            result.replaceAll((label, mass) -> mass / clampedSum);
        }
        return result;
    }

    /**
     * Calculates the entropy of the PMF using the definition H(X) = -sum_{i}
     * P(x_i) log2(P(x_i)). A term with P(x_i) = 0 contributes 0, which is the
     * limit of p log2(p) as p tends to 0.
     *
     * @return the entropy in bits; high when the outcomes are equally likely, low
     *         when the outcome is predictable.
     */
    public double calculateEntropy() {
        double entropy = 0.0;
        for (double mass : masses.values()) {
            if (mass > 0) {
                entropy += mass * log2(mass);
            }
        }
        return entropy == 0.0 ? 0.0 : -entropy;
    }

    /**
     * @return the label with the greatest mass, the lowest such label in case of a
     *         tie, or empty if the PMF has no labels.
     */
    public Optional<L> calculateBestLabel() {
        L best = null;
        double bestMass = Double.NEGATIVE_INFINITY;
        for (Map.Entry<L, Double> entry : masses.entrySet()) {
            if (entry.getValue() > bestMass) {
                best = entry.getKey();
                bestMass = entry.getValue();
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * @param label A label.
     * @return the mass of the label, 0 if it is not in the PMF.
     */
    public double getMass(L label) {
        return masses.getOrDefault(label, 0.0);
    }

    /**
     * @return a read-only view of the masses, in label order.
     */
    public SortedMap<L, Double> getMasses() {
        return Collections.unmodifiableSortedMap(masses);
    }

    public boolean isEmpty() {
        return masses.isEmpty();
    }

    @Override
    public String toString() {
        return Histogram.renderLimited(masses, Histogram.DISPLAY_LIMIT);
    }
}
