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

import java.util.Collection;

import com.amazon.rafl.examples.Example;
import com.amazon.rafl.returntypes.Prediction;

/**
 * A classifier that is trained one example at a time and can make predictions
 * at any point during training.
 *
 * @param <L> The label type.
 */
public interface IOnlineClassifier<L extends Comparable<? super L>> {

    /**
     * Submit a labelled example.
     *
     * @param example The example.
     */
    void addExample(Example<L> example);

    default void addExample(float[] descriptor, L label) {
        addExample(new Example<>(descriptor, label));
    }

    default void addExamples(Collection<Example<L>> examples) {
        for (Example<L> example : examples) {
            addExample(example);
        }
    }

    /**
     * Let the classifier incorporate the examples it has received so far.
     *
     * @param splitBudget The maximum amount of work to do, in split evaluations per
     *                    tree.
     * @return the number of changes made to the model.
     */
    int train(int splitBudget);

    /**
     * @param descriptor A descriptor.
     * @return the predicted label and per-label confidence.
     */
    Prediction<L> predict(float[] descriptor);

    /**
     * @return the number of features in a descriptor.
     */
    int getDimensions();

    /**
     * Release any threads the classifier holds. The classifier stays usable.
     */
    default void shutdown() {
    }
}
