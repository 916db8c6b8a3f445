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
import static com.amazon.rafl.CommonUtils.checkState;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Supplier;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.rafl.IOnlineClassifier;
import com.amazon.rafl.evaluation.splits.CrossValidationSplitGenerator;
import com.amazon.rafl.evaluation.splits.Split;
import com.amazon.rafl.evaluation.splits.SplitGenerator;
import com.amazon.rafl.examples.Example;
import com.amazon.rafl.returntypes.Prediction;

/**
 * <p>
 * Evaluates an online classifier over the splits produced by a
 * {@link SplitGenerator}. For each split a fresh classifier is obtained from the
 * factory, the training examples are added to it in ascending index order, and
 * it is trained until it stops changing. The held-out examples are then
 * classified and counted into the confusion matrix of the split.
 * </p>
 * <p>
 * The splits are generated before any classifier is created, so malformed input
 * (for example fewer examples than folds) fails without doing any training.
 * </p>
 *
 * @param <L> The label type.
 */
public class RandomForestEvaluator<L extends Comparable<? super L>> {

    private static final Logger logger = LogManager.getLogger(RandomForestEvaluator.class);

    /**
     * Seed used to shuffle the examples when none is given.
     */
    public static final long DEFAULT_SEED = 42L;

    /**
     * The split budget of each call to {@link IOnlineClassifier#train} while a
     * classifier is trained to completion.
     */
    public static final int TRAINING_BUDGET = 1000;

    private final SplitGenerator splitGenerator;

    private final Supplier<? extends IOnlineClassifier<L>> classifierFactory;

    public RandomForestEvaluator(SplitGenerator splitGenerator,
            Supplier<? extends IOnlineClassifier<L>> classifierFactory) {
        this.splitGenerator = checkNotNull(splitGenerator, "splitGenerator must not be null");
        this.classifierFactory = checkNotNull(classifierFactory, "classifierFactory must not be null");
    }

    /**
     * Run k-fold cross-validation with the default seed.
     *
     * @param examples          the labelled examples
     * @param foldCount         the number of folds, at least 2
     * @param classifierFactory creates a fresh classifier for each fold
     * @param <L>               the label type
     * @return the result of the evaluation
     * @throws IllegalArgumentException if foldCount is less than 2 or there are
     *                                  fewer examples than folds.
     */
    public static <L extends Comparable<? super L>> EvaluationResult<L> crossValidate(List<Example<L>> examples,
            int foldCount, Supplier<? extends IOnlineClassifier<L>> classifierFactory) {
        return crossValidate(examples, foldCount, DEFAULT_SEED, classifierFactory);
    }

    public static <L extends Comparable<? super L>> EvaluationResult<L> crossValidate(List<Example<L>> examples,
            int foldCount, long seed, Supplier<? extends IOnlineClassifier<L>> classifierFactory) {
        return new RandomForestEvaluator<L>(new CrossValidationSplitGenerator(foldCount, seed), classifierFactory)
                .evaluate(examples);
    }

    /**
     * Evaluate a fresh classifier on each split of the examples.
     *
     * @param examples the labelled examples
     * @return the result of the evaluation
     */
    public EvaluationResult<L> evaluate(List<Example<L>> examples) {
        checkNotNull(examples, "examples must not be null");
        checkArgument(!examples.isEmpty(), "there must be at least one example");
        List<Split> splits = splitGenerator.generateSplits(examples.size());

        SortedSet<L> labels = new TreeSet<>();
        for (Example<L> example : examples) {
            labels.add(example.getLabel());
        }

        List<ConfusionMatrix<L>> matrices = new ArrayList<>(splits.size());
        for (int i = 0; i < splits.size(); i++) {
            ConfusionMatrix<L> matrix = evaluateSplit(examples, splits.get(i), labels);
            logger.info("split {} of {}: {} training examples, accuracy {}", i + 1, splits.size(),
                    splits.get(i).getTrainingIndices().size(), matrix.getAccuracy());
            matrices.add(matrix);
        }
        return new EvaluationResult<>(matrices);
    }

    private ConfusionMatrix<L> evaluateSplit(List<Example<L>> examples, Split split, SortedSet<L> labels) {
        IOnlineClassifier<L> classifier = classifierFactory.get();
        checkState(classifier != null, "classifierFactory returned null");
        try {
            return evaluateSplit(classifier, examples, split, labels);
        } finally {
            classifier.shutdown();
        }
    }

    private ConfusionMatrix<L> evaluateSplit(IOnlineClassifier<L> classifier, List<Example<L>> examples, Split split,
            SortedSet<L> labels) {
        for (int index : split.getTrainingIndices()) {
            classifier.addExample(examples.get(index));
        }
        int rounds = 0;
        int changes;
        do {
            changes = classifier.train(TRAINING_BUDGET);
            ++rounds;
        } while (changes > 0);
        logger.debug("classifier trained to completion in {} rounds", rounds);

        ConfusionMatrix.Builder<L> builder = ConfusionMatrix.builder();
        labels.forEach(builder::addLabel);
        for (int index : split.getValidationIndices()) {
            Example<L> example = examples.get(index);
            Prediction<L> prediction = classifier.predict(example.getDescriptor());
            L predicted = prediction.getLabel()
                    .orElseThrow(() -> new IllegalStateException("the classifier made no prediction"));
            builder.add(example.getLabel(), predicted);
        }
        return builder.build();
    }

    public SplitGenerator getSplitGenerator() {
        return splitGenerator;
    }
}
