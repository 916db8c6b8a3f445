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

package com.amazon.rafl.examples;

import static com.amazon.rafl.CommonUtils.checkNotNull;

import java.util.Arrays;

import lombok.Getter;

import com.amazon.rafl.CommonUtils;

/**
 * A training example: a descriptor together with its label. The descriptor is
 * copied on construction and never exposed for writing, so an example is
 * immutable.
 *
 * @param <L> The label type.
 */
public final class Example<L extends Comparable<? super L>> {

    private final float[] descriptor;

    @Getter
    private final L label;

    public Example(float[] descriptor, L label) {
        this.descriptor = CommonUtils.cleanCopy(descriptor);
        this.label = checkNotNull(label, "label must not be null");
    }

    /**
     * @return a copy of the descriptor.
     */
    public float[] getDescriptor() {
        return Arrays.copyOf(descriptor, descriptor.length);
    }

    /**
     * @param index A feature index.
     * @return the value of the descriptor at the index.
     */
    public float getFeature(int index) {
        return descriptor[index];
    }

    public int getDimensions() {
        return descriptor.length;
    }

    @Override
    public String toString() {
        return String.format("Example(%s, %s)", Arrays.toString(descriptor), label);
    }
}
