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

package com.amazon.rafl.executor;

import java.util.Optional;

import lombok.Builder;

import com.amazon.rafl.examples.Example;

/**
 * When an example is submitted to a {@link com.amazon.rafl.tree.DecisionTree},
 * the reservoir of the leaf it reaches may store it, and may evict an older
 * example to make room. This class holds the result of such an operation; a list
 * of them is returned by {@link AbstractForestUpdateExecutor#update}.
 *
 * @param <L> The label type.
 */
@Builder
public class UpdateResult<L extends Comparable<? super L>> {

    /**
     * The index of the leaf the example was routed to.
     */
    private final int leafIndex;

    private final Example<L> storedExample;

    private final Example<L> evictedExample;

    public int getLeafIndex() {
        return leafIndex;
    }

    /**
     * @return the example stored by the update, or {@code Optional.empty()} if the
     *         reservoir rejected it.
     */
    public Optional<Example<L>> getStoredExample() {
        return Optional.ofNullable(storedExample);
    }

    /**
     * @return the example evicted from a full reservoir to make room, or
     *         {@code Optional.empty()} if nothing was evicted.
     */
    public Optional<Example<L>> getEvictedExample() {
        return Optional.ofNullable(evictedExample);
    }

    /**
     * @return true if the update changed the content of a reservoir.
     */
    public boolean isStateChange() {
        return storedExample != null;
    }
}
