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

package com.amazon.rafl.decisionfunctions;

import com.amazon.rafl.examples.Example;

/**
 * A DecisionFunction divides descriptor space into two halves. Decision
 * functions are installed on the internal nodes of a
 * {@link com.amazon.rafl.tree.DecisionTree} and determine which child a
 * descriptor is routed to. Implementations must be immutable.
 */
public interface DecisionFunction {

    /**
     * The side of a decision function a descriptor falls on.
     */
    enum Direction {
        LEFT, RIGHT
    }

    /**
     * @param descriptor A descriptor.
     * @return the side of this decision function on which the descriptor falls.
     */
    Direction classify(float[] descriptor);

    /**
     * @param example An example.
     * @return the side of this decision function on which the example's descriptor
     *         falls.
     */
    default Direction classify(Example<?> example) {
        return classify(example.getDescriptor());
    }
}
