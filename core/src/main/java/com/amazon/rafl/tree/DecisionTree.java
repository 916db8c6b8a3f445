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

package com.amazon.rafl.tree;

import static com.amazon.rafl.CommonUtils.checkArgument;
import static com.amazon.rafl.CommonUtils.checkNotNull;
import static com.amazon.rafl.CommonUtils.checkState;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Random;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.rafl.base.Histogram;
import com.amazon.rafl.base.ProbabilityMassFunction;
import com.amazon.rafl.decisionfunctions.DecisionFunction;
import com.amazon.rafl.decisionfunctions.DecisionFunctionGenerator;
import com.amazon.rafl.examples.Example;
import com.amazon.rafl.examples.ExampleReservoir;
import com.amazon.rafl.executor.UpdateResult;

/**
 * <p>
 * A DecisionTree is a binary decision tree that is grown online. Examples are
 * routed to a leaf and stored in the leaf's {@link ExampleReservoir}; leaves that
 * have seen enough examples are scheduled for split evaluation, and a leaf whose
 * examples can be divided with positive information gain is turned into an
 * internal node with two fresh leaves. Each example is seen exactly once and
 * each leaf holds a bounded number of examples, so the tree never needs to be
 * retrained from scratch.
 * </p>
 * <p>
 * Nodes are stored in an arena and addressed by index; the root is node 0. A
 * node starts out as a leaf and may become an internal node exactly once.
 * Internal nodes own a decision function and two children, leaves own a
 * reservoir.
 * </p>
 * <p>
 * The tree is safe for use from several threads. Routing and prediction run
 * under a shared lock, and example insertion and splitting run under an
 * exclusive lock, so a split is never observed half-applied.
 * </p>
 *
 * @param <L> The label type.
 */
public class DecisionTree<L extends Comparable<? super L>> {

    private static final Logger logger = LogManager.getLogger(DecisionTree.class);

    private final TreeSettings settings;
    private final DecisionFunctionGenerator decisionFunctionGenerator;
    private final Random random;

    private final List<Node<L>> nodes = new ArrayList<>();
    private final SplitScheduler splitScheduler = new SplitScheduler();

    /**
     * The labels this tree can predict: the initial labels plus every label seen.
     */
    private final SortedSet<L> knownLabels = new TreeSet<>();

    /**
     * The number of examples of each label submitted to the tree.
     */
    private final Histogram<L> classFrequencies = new Histogram<>();

    private final Lock readLock;
    private final Lock writeLock;

    public DecisionTree(TreeSettings settings, DecisionFunctionGenerator decisionFunctionGenerator, long seed) {
        this(settings, decisionFunctionGenerator, new Random(seed), Collections.emptySet());
    }

    /**
     * Create a tree consisting of a single empty leaf.
     *
     * @param settings                  The hyperparameters of the tree.
     * @param decisionFunctionGenerator Generates split candidates.
     * @param random                    The random number generator used for
     *                                  sampling and candidate generation.
     * @param initialLabels             Labels that can be predicted before any
     *                                  example of them has been seen.
     */
    public DecisionTree(TreeSettings settings, DecisionFunctionGenerator decisionFunctionGenerator, Random random,
            Collection<L> initialLabels) {
        this.settings = checkNotNull(settings, "settings must not be null");
        this.decisionFunctionGenerator = checkNotNull(decisionFunctionGenerator,
                "decisionFunctionGenerator must not be null");
        this.random = checkNotNull(random, "random must not be null");
        checkNotNull(initialLabels, "initialLabels must not be null");
        knownLabels.addAll(initialLabels);

        ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
        readLock = lock.readLock();
        writeLock = lock.writeLock();

        nodes.add(new Node<L>(0, new ExampleReservoir<L>(settings.getReservoirCapacity(), random)));
    }

    /**
     * Route a descriptor from the root to a leaf.
     *
     * @param descriptor A descriptor.
     * @return the index of the leaf the descriptor reaches.
     */
    public int route(float[] descriptor) {
        checkNotNull(descriptor, "descriptor must not be null");
        readLock.lock();
        try {
            return findLeaf(descriptor);
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Add an example to the reservoir of the leaf it reaches, and schedule the
     * leaf for split evaluation if it is eligible.
     *
     * @param example An example.
     * @return the result of the update.
     */
    public UpdateResult<L> addExample(Example<L> example) {
        checkNotNull(example, "example must not be null");
        writeLock.lock();
        try {
            knownLabels.add(example.getLabel());
            classFrequencies.add(example.getLabel());

            int leafIndex = findLeaf(example);
            Node<L> leaf = nodes.get(leafIndex);
            boolean stored = leaf.reservoir.add(example);
            if (stored) {
                leaf.invalidate();
            }
            if (isEligibleForSplit(leaf)) {
                splitScheduler.schedule(leafIndex);
            }

            return UpdateResult.<L>builder().leafIndex(leafIndex).storedExample(stored ? example : null)
                    .evictedExample(leaf.reservoir.getEvictedExample().orElse(null)).build();
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Add several examples, in order.
     *
     * @param examples The examples to add.
     */
    public void addExamples(Collection<Example<L>> examples) {
        checkNotNull(examples, "examples must not be null");
        for (Example<L> example : examples) {
            addExample(example);
        }
    }

    /**
     * Evaluate the split candidates for a leaf and pick the best one. Not finding a
     * split is a normal outcome: the leaf may be too deep, may not have seen
     * enough examples, may be pure, or no candidate may divide its examples with
     * enough information gain.
     *
     * @param leafIndex The index of a node.
     * @return the best split candidate, or empty if the node should not be split.
     */
    public Optional<SplitCandidate<L>> considerSplit(int leafIndex) {
        writeLock.lock();
        try {
            return findBestSplit(leafIndex);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Turn a leaf into an internal node with the given decision function. Two
     * leaves are created and the examples of the split leaf are divided between
     * them; the split leaf's reservoir is discarded.
     *
     * @param leafIndex        The index of the leaf to split.
     * @param decisionFunction The decision function to install.
     * @throws IllegalStateException if the node is not a leaf.
     */
    public void applySplit(int leafIndex, DecisionFunction decisionFunction) {
        checkNotNull(decisionFunction, "decisionFunction must not be null");
        writeLock.lock();
        try {
            split(leafIndex, decisionFunction);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Evaluate scheduled leaves, most splittable first, and split those that have
     * a suitable candidate. Leaves created by a split are scheduled in turn when
     * eligible, so a large enough budget grows the tree until no leaf can be split.
     *
     * @param splitBudget The maximum number of leaves to evaluate.
     * @return the number of splits performed.
     */
    public int train(int splitBudget) {
        checkArgument(splitBudget >= 0, "splitBudget must be greater than or equal to 0");
        int splits = 0;
        for (int i = 0; i < splitBudget; i++) {
            writeLock.lock();
            try {
                OptionalInt next = splitScheduler.pollMostSplittable(this::calculateSplittability);
                if (!next.isPresent()) {
                    break;
                }
                Optional<SplitCandidate<L>> candidate = findBestSplit(next.getAsInt());
                if (candidate.isPresent()) {
                    split(next.getAsInt(), candidate.get().getDecisionFunction());
                    ++splits;
                }
            } finally {
                writeLock.unlock();
            }
        }
        return splits;
    }

    /**
     * Look up the label distribution of the leaf a descriptor reaches. A leaf with
     * no examples yields a uniform distribution over the known labels, or an empty
     * distribution if the tree knows no labels yet.
     *
     * @param descriptor A descriptor.
     * @return the distribution of labels at the leaf.
     */
    public ProbabilityMassFunction<L> predict(float[] descriptor) {
        checkNotNull(descriptor, "descriptor must not be null");
        readLock.lock();
        try {
            return calculatePmf(nodes.get(findLeaf(descriptor)));
        } finally {
            readLock.unlock();
        }
    }

    private int findLeaf(float[] descriptor) {
        int index = 0;
        Node<L> node = nodes.get(index);
        while (!node.isLeaf()) {
            index = node.decisionFunction.classify(descriptor) == DecisionFunction.Direction.LEFT
                    ? node.leftChildIndex
                    : node.rightChildIndex;
            node = nodes.get(index);
        }
        return index;
    }

    private int findLeaf(Example<L> example) {
        int index = 0;
        Node<L> node = nodes.get(index);
        while (!node.isLeaf()) {
            index = node.decisionFunction.classify(example) == DecisionFunction.Direction.LEFT ? node.leftChildIndex
                    : node.rightChildIndex;
            node = nodes.get(index);
        }
        return index;
    }

    private boolean isEligibleForSplit(Node<L> node) {
        return node.isLeaf() && node.depth < settings.getMaxDepth()
                && node.reservoir.getSeenExamples() >= settings.getSeenExamplesThreshold();
    }

    private double calculateSplittability(int nodeIndex) {
        Node<L> node = nodes.get(nodeIndex);
        double fill = (double) node.reservoir.size() / node.reservoir.getCapacity();
        return fill * node.histogram().calculateEntropy();
    }

    private Optional<SplitCandidate<L>> findBestSplit(int leafIndex) {
        checkArgument(0 <= leafIndex && leafIndex < nodes.size(), "no such node");
        Node<L> leaf = nodes.get(leafIndex);
        splitScheduler.unschedule(leafIndex);
        if (!isEligibleForSplit(leaf)) {
            return Optional.empty();
        }

        Histogram<L> parentHistogram = leaf.histogram();
        double parentEntropy = parentHistogram.calculateEntropy();
        if (parentEntropy == 0.0) {
            logger.debug("leaf {} is pure, not splitting", leafIndex);
            return Optional.empty();
        }

        List<Example<L>> examples = leaf.reservoir.getExamples();
        List<DecisionFunction> candidates = decisionFunctionGenerator.generateCandidates(examples,
                settings.getCandidateCount(), random);

        SplitCandidate<L> best = null;
        double total = examples.size();
        for (DecisionFunction candidate : candidates) {
            Histogram<L> left = new Histogram<>();
            Histogram<L> right = new Histogram<>();
            for (Example<L> example : examples) {
                if (candidate.classify(example) == DecisionFunction.Direction.LEFT) {
                    left.add(example.getLabel());
                } else {
                    right.add(example.getLabel());
                }
            }
            if (left.isEmpty() || right.isEmpty()) {
                continue;
            }

            double gain = parentEntropy - left.getTotal() / total * left.calculateEntropy()
                    - right.getTotal() / total * right.calculateEntropy();
            if (best == null || gain > best.getGain()) {
                best = new SplitCandidate<>(candidate, gain, left, right);
            }
        }

        if (best == null || best.getGain() <= 0 || best.getGain() < settings.getGainThreshold()) {
            logger.debug("no suitable split for leaf {} among {} candidates (best: {})", leafIndex, candidates.size(),
                    best);
            return Optional.empty();
        }
        return Optional.of(best);
    }

    private void split(int leafIndex, DecisionFunction decisionFunction) {
        checkArgument(0 <= leafIndex && leafIndex < nodes.size(), "no such node");
        Node<L> node = nodes.get(leafIndex);
        checkState(node.isLeaf(), "only a leaf can be split");

        Node<L> left = new Node<L>(node.depth + 1, new ExampleReservoir<L>(settings.getReservoirCapacity(), random));
        Node<L> right = new Node<L>(node.depth + 1, new ExampleReservoir<L>(settings.getReservoirCapacity(), random));
        for (Example<L> example : node.reservoir.getExamples()) {
            if (decisionFunction.classify(example) == DecisionFunction.Direction.LEFT) {
                left.reservoir.add(example);
            } else {
                right.reservoir.add(example);
            }
        }

        int leftIndex = nodes.size();
        int rightIndex = leftIndex + 1;
        nodes.add(left);
        nodes.add(right);
        node.becomeInternal(decisionFunction, leftIndex, rightIndex);
        splitScheduler.unschedule(leafIndex);

        if (isEligibleForSplit(left)) {
            splitScheduler.schedule(leftIndex);
        }
        if (isEligibleForSplit(right)) {
            splitScheduler.schedule(rightIndex);
        }
        logger.debug("split node {} at depth {} with {} into {} ({} examples) and {} ({} examples)", leafIndex,
                node.depth, decisionFunction, leftIndex, left.reservoir.size(), rightIndex, right.reservoir.size());
    }

    private ProbabilityMassFunction<L> calculatePmf(Node<L> leaf) {
        Histogram<L> histogram = leaf.histogram();
        if (histogram.isEmpty()) {
            return ProbabilityMassFunction.uniform(knownLabels);
        }
        if (settings.isPmfReweightingEnabled()) {
            return new ProbabilityMassFunction<>(histogram, calculateClassMultipliers());
        }
        return leaf.pmf();
    }

    private Map<L, Double> calculateClassMultipliers() {
        Map<L, Double> multipliers = new HashMap<>();
        for (Map.Entry<L, Long> entry : classFrequencies.getBins().entrySet()) {
            multipliers.put(entry.getKey(), 1.0 / entry.getValue());
        }
        return multipliers;
    }

    public TreeSettings getSettings() {
        return settings;
    }

    public int getNodeCount() {
        readLock.lock();
        try {
            return nodes.size();
        } finally {
            readLock.unlock();
        }
    }

    public int getLeafCount() {
        readLock.lock();
        try {
            return (int) nodes.stream().filter(Node::isLeaf).count();
        } finally {
            readLock.unlock();
        }
    }

    /**
     * @return the greatest depth of any node, 0 for a tree that has not split.
     */
    public int getDepth() {
        readLock.lock();
        try {
            return nodes.stream().mapToInt(n -> n.depth).max().orElse(0);
        } finally {
            readLock.unlock();
        }
    }

    public boolean isLeaf(int nodeIndex) {
        readLock.lock();
        try {
            checkArgument(0 <= nodeIndex && nodeIndex < nodes.size(), "no such node");
            return nodes.get(nodeIndex).isLeaf();
        } finally {
            readLock.unlock();
        }
    }

    public int getNodeDepth(int nodeIndex) {
        readLock.lock();
        try {
            checkArgument(0 <= nodeIndex && nodeIndex < nodes.size(), "no such node");
            return nodes.get(nodeIndex).depth;
        } finally {
            readLock.unlock();
        }
    }

    /**
     * @param nodeIndex the index of a leaf
     * @return a snapshot of the examples held by the leaf
     */
    public List<Example<L>> getLeafExamples(int nodeIndex) {
        readLock.lock();
        try {
            checkArgument(0 <= nodeIndex && nodeIndex < nodes.size(), "no such node");
            Node<L> node = nodes.get(nodeIndex);
            checkArgument(node.isLeaf(), "node is not a leaf");
            return node.reservoir.getExamples();
        } finally {
            readLock.unlock();
        }
    }

    /**
     * @return the number of leaves waiting for split evaluation
     */
    public int getScheduledLeafCount() {
        readLock.lock();
        try {
            return splitScheduler.size();
        } finally {
            readLock.unlock();
        }
    }

    /**
     * @return the number of examples of each label submitted to the tree
     */
    public Histogram<L> getClassFrequencies() {
        readLock.lock();
        try {
            return new Histogram<>(classFrequencies);
        } finally {
            readLock.unlock();
        }
    }

    public SortedSet<L> getKnownLabels() {
        readLock.lock();
        try {
            return new TreeSet<>(knownLabels);
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public String toString() {
        readLock.lock();
        try {
            StringBuilder sb = new StringBuilder();
            appendNode(sb, 0);
            return sb.toString();
        } finally {
            readLock.unlock();
        }
    }

    private void appendNode(StringBuilder sb, int nodeIndex) {
        Node<L> node = nodes.get(nodeIndex);
        for (int i = 0; i < node.depth; i++) {
            sb.append("  ");
        }
        sb.append(nodeIndex).append(": ");
        if (node.isLeaf()) {
            sb.append(node.histogram()).append('\n');
        } else {
            sb.append(node.decisionFunction).append('\n');
            appendNode(sb, node.leftChildIndex);
            appendNode(sb, node.rightChildIndex);
        }
    }

    /**
     * A node in the arena. The reservoir is non-null exactly while the node is a
     * leaf; the decision function and children are set when it becomes internal.
     */
    private static final class Node<L extends Comparable<? super L>> {

        final int depth;
        ExampleReservoir<L> reservoir;
        DecisionFunction decisionFunction;
        int leftChildIndex = -1;
        int rightChildIndex = -1;

        // rebuilt lazily from the reservoir; readers holding the shared lock may
        // fill them concurrently and always compute equal values
        volatile Histogram<L> cachedHistogram;
        volatile ProbabilityMassFunction<L> cachedPmf;

        Node(int depth, ExampleReservoir<L> reservoir) {
            this.depth = depth;
            this.reservoir = reservoir;
        }

        boolean isLeaf() {
            return reservoir != null;
        }

        void invalidate() {
            cachedHistogram = null;
            cachedPmf = null;
        }

        Histogram<L> histogram() {
            Histogram<L> histogram = cachedHistogram;
            if (histogram == null) {
                histogram = reservoir.toHistogram();
                cachedHistogram = histogram;
            }
            return histogram;
        }

        ProbabilityMassFunction<L> pmf() {
            ProbabilityMassFunction<L> pmf = cachedPmf;
            if (pmf == null) {
                pmf = histogram().toPmf();
                cachedPmf = pmf;
            }
            return pmf;
        }

        void becomeInternal(DecisionFunction decisionFunction, int leftChildIndex, int rightChildIndex) {
            this.decisionFunction = decisionFunction;
            this.leftChildIndex = leftChildIndex;
            this.rightChildIndex = rightChildIndex;
            reservoir = null;
            invalidate();
        }
    }
}
