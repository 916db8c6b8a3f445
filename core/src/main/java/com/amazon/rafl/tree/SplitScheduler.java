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

import java.util.OptionalInt;
import java.util.TreeSet;
import java.util.function.IntToDoubleFunction;

/**
 * Keeps track of the leaves of a tree that are due for split evaluation. A leaf
 * is scheduled when it receives an example and is eligible for splitting, and
 * unscheduled once it has been evaluated; it is not evaluated again until a new
 * example reaches it.
 * <p>
 * Leaves are handed out in order of decreasing splittability, with the lower
 * node index winning ties. This class is not thread-safe; the owning tree
 * serialises access to it.
 * </p>
 */
public class SplitScheduler {

    private final TreeSet<Integer> scheduled = new TreeSet<>();

    /**
     * @param nodeIndex the index of a leaf that is due for evaluation
     */
    public void schedule(int nodeIndex) {
        scheduled.add(nodeIndex);
    }

    public void unschedule(int nodeIndex) {
        scheduled.remove(nodeIndex);
    }

    public boolean isScheduled(int nodeIndex) {
        return scheduled.contains(nodeIndex);
    }

    /**
     * Remove and return the scheduled leaf with the greatest splittability.
     *
     * @param splittability computes the splittability of a leaf
     * @return the index of the most splittable leaf, or empty if no leaf is
     *         scheduled
     */
    public OptionalInt pollMostSplittable(IntToDoubleFunction splittability) {
        int best = -1;
        double bestSplittability = Double.NEGATIVE_INFINITY;
        for (int nodeIndex : scheduled) {
            double value = splittability.applyAsDouble(nodeIndex);
            if (value > bestSplittability) {
                best = nodeIndex;
                bestSplittability = value;
            }
        }
        if (best < 0) {
            return OptionalInt.empty();
        }
        scheduled.remove(best);
        return OptionalInt.of(best);
    }

    public int size() {
        return scheduled.size();
    }

    public boolean isEmpty() {
        return scheduled.isEmpty();
    }
}
