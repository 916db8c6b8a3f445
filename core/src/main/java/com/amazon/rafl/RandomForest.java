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

package com.amazon.rafl;

import static com.amazon.rafl.CommonUtils.checkArgument;
import static com.amazon.rafl.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.rafl.base.ProbabilityMassFunction;
import com.amazon.rafl.config.Config;
import com.amazon.rafl.config.IDynamicConfig;
import com.amazon.rafl.decisionfunctions.DecisionFunctionGenerator;
import com.amazon.rafl.decisionfunctions.FeatureThresholdDecisionFunctionGenerator;
import com.amazon.rafl.examples.Example;
import com.amazon.rafl.executor.AbstractForestTraversalExecutor;
import com.amazon.rafl.executor.AbstractForestUpdateExecutor;
import com.amazon.rafl.executor.ParallelForestTraversalExecutor;
import com.amazon.rafl.executor.ParallelForestUpdateExecutor;
import com.amazon.rafl.executor.SequentialForestTraversalExecutor;
import com.amazon.rafl.executor.SequentialForestUpdateExecutor;
import com.amazon.rafl.executor.UpdateResult;
import com.amazon.rafl.returntypes.Prediction;
import com.amazon.rafl.tree.DecisionTree;
import com.amazon.rafl.tree.TreeSettings;

/**
 * The RandomForest class is the interface to the algorithms in this package. A
 * random forest is a collection of {@link DecisionTree}s grown online. When an
 * example is submitted to the forest, every tree receives it; the trees differ
 * only in the random draws they make when generating split candidates. When a
 * descriptor is classified, each tree supplies the label distribution of the
 * leaf the descriptor reaches and the forest averages them.
 *
 * @param <L> The label type.
 */
public class RandomForest<L extends Comparable<? super L>> implements IOnlineClassifier<L>, IDynamicConfig {

    private static final Logger logger = LogManager.getLogger(RandomForest.class);

    /**
     * Default number of trees in the forest.
     */
    public static final int DEFAULT_NUMBER_OF_TREES = 10;

    /**
     * Default number of leaves each tree evaluates for splitting after every
     * example. A value of 0 leaves training to explicit calls of {@link #train}.
     */
    public static final int DEFAULT_SPLIT_BUDGET_PER_UPDATE = 1;

    /**
     * Parallel execution is disabled by default.
     */
    public static final boolean DEFAULT_PARALLEL_EXECUTION_ENABLED = false;

    private final int dimensions;

    private final int numberOfTrees;

    private final TreeSettings treeSettings;

    private final boolean parallelExecutionEnabled;

    private final int threadPoolSize;

    /**
     * The number of leaves each tree evaluates after every example.
     */
    private volatile int splitBudgetPerUpdate;

    private final List<DecisionTree<L>> trees;

    private final AbstractForestUpdateExecutor<L> updateExecutor;

    private final AbstractForestTraversalExecutor<L> traversalExecutor;

    private final AtomicLong totalUpdates = new AtomicLong();

    protected RandomForest(Builder<L> builder) {
        checkArgument(builder.numberOfTrees > 0, "numberOfTrees must be greater than 0");
        checkArgument(builder.dimensions > 0, "dimensions must be greater than 0");
        checkArgument(builder.splitBudgetPerUpdate >= 0, "splitBudgetPerUpdate must be greater than or equal to 0");
        builder.threadPoolSize.ifPresent(n -> checkArgument((n > 0) || ((n == 0) && !builder.parallelExecutionEnabled),
                "threadPoolSize must be greater/equal than 0. To disable thread pool, set parallel execution to 'false'."));

        dimensions = builder.dimensions;
        numberOfTrees = builder.numberOfTrees;
        splitBudgetPerUpdate = builder.splitBudgetPerUpdate;
        parallelExecutionEnabled = builder.parallelExecutionEnabled;
        treeSettings = builder.treeSettings.build();

        if (parallelExecutionEnabled) {
            threadPoolSize = builder.threadPoolSize
                    .orElse(Math.max(1, Runtime.getRuntime().availableProcessors() - 1));
        } else {
            threadPoolSize = 0;
        }

        DecisionFunctionGenerator generator = builder.decisionFunctionGenerator
                .orElseGet(() -> new FeatureThresholdDecisionFunctionGenerator(dimensions));
        Random rng = builder.getRandom();
        List<DecisionTree<L>> treeList = new ArrayList<>(numberOfTrees);
        for (int i = 0; i < numberOfTrees; i++) {
            treeList.add(
                    new DecisionTree<>(treeSettings, generator, new Random(rng.nextLong()), builder.initialLabels));
        }
        trees = Collections.unmodifiableList(treeList);

        if (parallelExecutionEnabled) {
            updateExecutor = new ParallelForestUpdateExecutor<>(trees, threadPoolSize);
            traversalExecutor = new ParallelForestTraversalExecutor<>(trees, threadPoolSize);
        } else {
            updateExecutor = new SequentialForestUpdateExecutor<>(trees);
            traversalExecutor = new SequentialForestTraversalExecutor<>(trees);
        }
    }

    /**
     * @param <L> The label type.
     * @return a new RandomForest builder.
     */
    public static <L extends Comparable<? super L>> Builder<L> builder() {
        return new Builder<>();
    }

    /**
     * Create a new RandomForest with optional arguments set to default values.
     *
     * @param dimensions The number of features in a descriptor.
     * @param randomSeed The random seed used to seed the trees.
     * @param <L>        The label type.
     * @return a new RandomForest with optional arguments set to default values.
     */
    public static <L extends Comparable<? super L>> RandomForest<L> defaultForest(int dimensions, long randomSeed) {
        return RandomForest.<L>builder().dimensions(dimensions).randomSeed(randomSeed).build();
    }

    /**
     * Submit an example to every tree in the forest, then let each tree evaluate
     * up to {@code splitBudgetPerUpdate} leaves for splitting.
     *
     * @param example The example.
     */
    @Override
    public void addExample(Example<L> example) {
        checkNotNull(example, "example must not be null");
        checkArgument(example.getDimensions() == dimensions,
                String.format("descriptor length must equal %d", dimensions));

        List<UpdateResult<L>> results = updateExecutor.update(example);
        long updates = totalUpdates.incrementAndGet();
        if (logger.isTraceEnabled()) {
            long stored = results.stream().filter(UpdateResult::isStateChange).count();
            logger.trace("example {} with label {} stored by {} of {} trees", updates, example.getLabel(), stored,
                    numberOfTrees);
        }

        int budget = splitBudgetPerUpdate;
        if (budget > 0) {
            train(budget);
        }
    }

    /**
     * Run split evaluation on every tree.
     *
     * @param splitBudget The maximum number of leaves each tree evaluates.
     * @return the total number of splits performed across all trees.
     */
    @Override
    public int train(int splitBudget) {
        int splits = updateExecutor.train(splitBudget);
        if (splits > 0) {
            logger.debug("{} splits performed after {} updates", splits, totalUpdates.get());
        }
        return splits;
    }

    /**
     * Compute the average of the label distributions of the leaves the descriptor
     * reaches in each tree.
     *
     * @param descriptor A descriptor.
     * @return the averaged distribution; empty only if the forest knows no labels.
     */
    public ProbabilityMassFunction<L> calculatePmf(float[] descriptor) {
        checkNotNull(descriptor, "descriptor must not be null");
        checkArgument(descriptor.length == dimensions, String.format("descriptor length must equal %d", dimensions));

        Map<L, Double> sums = new TreeMap<>();
        for (ProbabilityMassFunction<L> pmf : traversalExecutor.lookupDistributions(descriptor)) {
            pmf.getMasses().forEach((label, mass) -> sums.merge(label, mass / numberOfTrees, Double::sum));
        }
        if (sums.isEmpty()) {
            return ProbabilityMassFunction.uniform(Collections.<L>emptySet());
        }
        return ProbabilityMassFunction.fromMasses(sums);
    }

    /**
     * Classify a descriptor. The predicted label is the one with the greatest
     * average mass across trees, ties going to the lowest label.
     *
     * @param descriptor A descriptor.
     * @return the prediction.
     */
    @Override
    public Prediction<L> predict(float[] descriptor) {
        return new Prediction<>(calculatePmf(descriptor));
    }

    /**
     * Shut down the thread pools of a forest with parallel execution enabled. The
     * forest can still be used afterwards; it then starts new pools.
     */
    @Override
    public void shutdown() {
        updateExecutor.shutdown();
        traversalExecutor.shutdown();
    }

    @Override
    public <T> void setConfig(String name, T value, Class<T> clazz) {
        if (Config.SPLIT_BUDGET_PER_UPDATE.equals(name)) {
            checkArgument(Integer.class.isAssignableFrom(clazz),
                    String.format("Setting '%s' must be an int value", name));
            int budget = (Integer) value;
            checkArgument(budget >= 0, "splitBudgetPerUpdate must be greater than or equal to 0");
            splitBudgetPerUpdate = budget;
        } else if (Config.NAMES.contains(name)) {
            throw new IllegalArgumentException(
                    String.format("Setting '%s' cannot be changed after construction", name));
        } else {
            throw new IllegalArgumentException("Unsupported configuration setting: " + name);
        }
    }

    @Override
    public <T> T getConfig(String name, Class<T> clazz) {
        checkNotNull(clazz, "clazz must not be null");
        Object value;
        switch (name) {
        case Config.DIMENSIONS:
            value = dimensions;
            break;
        case Config.NUMBER_OF_TREES:
            value = numberOfTrees;
            break;
        case Config.RESERVOIR_CAPACITY:
            value = treeSettings.getReservoirCapacity();
            break;
        case Config.MAX_DEPTH:
            value = treeSettings.getMaxDepth();
            break;
        case Config.CANDIDATE_COUNT:
            value = treeSettings.getCandidateCount();
            break;
        case Config.SEEN_EXAMPLES_THRESHOLD:
            value = treeSettings.getSeenExamplesThreshold();
            break;
        case Config.GAIN_THRESHOLD:
            value = treeSettings.getGainThreshold();
            break;
        case Config.SPLIT_BUDGET_PER_UPDATE:
            value = splitBudgetPerUpdate;
            break;
        case Config.PMF_REWEIGHTING_ENABLED:
            value = treeSettings.isPmfReweightingEnabled();
            break;
        default:
            throw new IllegalArgumentException("Unsupported configuration setting: " + name);
        }
        checkArgument(clazz.isInstance(value),
                String.format("Setting '%s' is a %s value", name, value.getClass().getSimpleName()));
        return clazz.cast(value);
    }

    @Override
    public int getDimensions() {
        return dimensions;
    }

    /**
     * @return the number of trees in the forest.
     */
    public int getNumberOfTrees() {
        return numberOfTrees;
    }

    public TreeSettings getTreeSettings() {
        return treeSettings;
    }

    public int getSplitBudgetPerUpdate() {
        return splitBudgetPerUpdate;
    }

    public boolean isParallelExecutionEnabled() {
        return parallelExecutionEnabled;
    }

    /**
     * @return the number of threads in the thread pool if parallel execution is
     *         enabled, 0 otherwise.
     */
    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    /**
     * @return a read-only view of the trees, in creation order.
     */
    public List<DecisionTree<L>> getTrees() {
        return trees;
    }

    /**
     * @return the number of examples submitted to the forest.
     */
    public long getTotalUpdates() {
        return totalUpdates.get();
    }

    /**
     * @return the labels the forest can predict.
     */
    public SortedSet<L> getKnownLabels() {
        SortedSet<L> labels = new TreeSet<>();
        trees.forEach(t -> labels.addAll(t.getKnownLabels()));
        return labels;
    }

    public static class Builder<L extends Comparable<? super L>> {

        // We use Optional types for optional fields when it doesn't make sense to use
        // a constant default.

        private int dimensions;
        private int numberOfTrees = DEFAULT_NUMBER_OF_TREES;
        private int splitBudgetPerUpdate = DEFAULT_SPLIT_BUDGET_PER_UPDATE;
        private boolean parallelExecutionEnabled = DEFAULT_PARALLEL_EXECUTION_ENABLED;
        private Optional<Integer> threadPoolSize = Optional.empty();
        private Optional<Long> randomSeed = Optional.empty();
        private Optional<DecisionFunctionGenerator> decisionFunctionGenerator = Optional.empty();
        private final TreeSettings.Builder treeSettings = TreeSettings.builder();
        private final List<L> initialLabels = new ArrayList<>();

        public Builder<L> dimensions(int dimensions) {
            this.dimensions = dimensions;
            return this;
        }

        public Builder<L> numberOfTrees(int numberOfTrees) {
            this.numberOfTrees = numberOfTrees;
            return this;
        }

        public Builder<L> reservoirCapacity(int reservoirCapacity) {
            treeSettings.reservoirCapacity(reservoirCapacity);
            return this;
        }

        public Builder<L> maxDepth(int maxDepth) {
            treeSettings.maxDepth(maxDepth);
            return this;
        }

        public Builder<L> candidateCount(int candidateCount) {
            treeSettings.candidateCount(candidateCount);
            return this;
        }

        public Builder<L> seenExamplesThreshold(int seenExamplesThreshold) {
            treeSettings.seenExamplesThreshold(seenExamplesThreshold);
            return this;
        }

        public Builder<L> gainThreshold(double gainThreshold) {
            treeSettings.gainThreshold(gainThreshold);
            return this;
        }

        public Builder<L> pmfReweightingEnabled(boolean pmfReweightingEnabled) {
            treeSettings.pmfReweightingEnabled(pmfReweightingEnabled);
            return this;
        }

        public Builder<L> splitBudgetPerUpdate(int splitBudgetPerUpdate) {
            this.splitBudgetPerUpdate = splitBudgetPerUpdate;
            return this;
        }

        public Builder<L> parallelExecutionEnabled(boolean parallelExecutionEnabled) {
            this.parallelExecutionEnabled = parallelExecutionEnabled;
            return this;
        }

        public Builder<L> threadPoolSize(int threadPoolSize) {
            this.threadPoolSize = Optional.of(threadPoolSize);
            return this;
        }

        public Builder<L> randomSeed(long randomSeed) {
            this.randomSeed = Optional.of(randomSeed);
            return this;
        }

        public Builder<L> decisionFunctionGenerator(DecisionFunctionGenerator decisionFunctionGenerator) {
            this.decisionFunctionGenerator = Optional.of(decisionFunctionGenerator);
            return this;
        }

        /**
         * @param labels labels the forest can predict before it has seen examples of
         *               them; the empty-leaf fallback is uniform over these
         * @return this builder
         */
        public Builder<L> initialLabels(Collection<L> labels) {
            checkNotNull(labels, "labels must not be null");
            initialLabels.addAll(labels);
            return this;
        }

        /**
         * Apply a set of settings given by name, as listed in {@link Config}. Numeric
         * values may be given as any {@link Number}.
         *
         * @param parameters The settings to apply.
         * @return this builder
         */
        public Builder<L> parameters(Map<String, ?> parameters) {
            checkNotNull(parameters, "parameters must not be null");
            parameters.forEach(this::parameter);
            return this;
        }

        private void parameter(String name, Object value) {
            checkNotNull(value, String.format("value of '%s' must not be null", name));
            switch (name) {
            case Config.DIMENSIONS:
                dimensions(intValue(name, value));
                break;
            case Config.NUMBER_OF_TREES:
                numberOfTrees(intValue(name, value));
                break;
            case Config.RESERVOIR_CAPACITY:
                reservoirCapacity(intValue(name, value));
                break;
            case Config.MAX_DEPTH:
                maxDepth(intValue(name, value));
                break;
            case Config.CANDIDATE_COUNT:
                candidateCount(intValue(name, value));
                break;
            case Config.SEEN_EXAMPLES_THRESHOLD:
                seenExamplesThreshold(intValue(name, value));
                break;
            case Config.GAIN_THRESHOLD:
                checkArgument(value instanceof Number, String.format("Setting '%s' must be a number", name));
                gainThreshold(((Number) value).doubleValue());
                break;
            case Config.SPLIT_BUDGET_PER_UPDATE:
                splitBudgetPerUpdate(intValue(name, value));
                break;
            case Config.PMF_REWEIGHTING_ENABLED:
                checkArgument(value instanceof Boolean, String.format("Setting '%s' must be a boolean", name));
                pmfReweightingEnabled((Boolean) value);
                break;
            case Config.RANDOM_SEED:
                checkArgument(value instanceof Number, String.format("Setting '%s' must be a number", name));
                randomSeed(((Number) value).longValue());
                break;
            default:
                throw new IllegalArgumentException("Unsupported configuration setting: " + name);
            }
        }

        private static int intValue(String name, Object value) {
            checkArgument(value instanceof Integer || value instanceof Long || value instanceof Short,
                    String.format("Setting '%s' must be an integer", name));
            return Math.toIntExact(((Number) value).longValue());
        }

        public RandomForest<L> build() {
            return new RandomForest<>(this);
        }

        public Random getRandom() {
            // If a random seed was given, use it to create a new Random. Otherwise, call
            // the 0-argument constructor
            return randomSeed.map(Random::new).orElseGet(Random::new);
        }
    }
}
