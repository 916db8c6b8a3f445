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

import java.util.Arrays;
import java.util.Objects;

/**
 * A collection of common utility functions.
 */
public class CommonUtils {

    private static final double LOG_2 = Math.log(2.0);

    private CommonUtils() {
    }

    /**
     * Throws an {@link IllegalArgumentException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalArgumentException} if {@code condition} is
     *                  false.
     * @throws IllegalArgumentException if {@code condition} is false.
     */
    public static void checkArgument(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Throws an {@link IllegalStateException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalStateException} if {@code condition} is
     *                  false.
     * @throws IllegalStateException if {@code condition} is false.
     */
    public static void checkState(boolean condition, String message) {
        if (!condition) {
            throw new IllegalStateException(message);
        }
    }

    /**
     * Throws a {@link NullPointerException} with the specified message if the
     * specified input is null.
     *
     * @param <T>     An arbitrary type.
     * @param object  An object reference to test for nullity.
     * @param message The error message to include in the
     *                {@code NullPointerException} if {@code object} is null.
     * @return {@code object} if not null.
     * @throws NullPointerException if the supplied object is null.
     */
    public static <T> T checkNotNull(T object, String message) {
        Objects.requireNonNull(object, message);
        return object;
    }

    /**
     * Returns a clean deep copy of the descriptor. Negative zero is changed to
     * positive zero so that descriptors that compare equal also route equally.
     *
     * @param descriptor The original descriptor.
     * @return a clean deep copy of the original descriptor.
     * @throws IllegalArgumentException if a value is NaN or infinite.
     */
    public static float[] cleanCopy(float[] descriptor) {
        checkNotNull(descriptor, "descriptor must not be null");
        float[] copy = Arrays.copyOf(descriptor, descriptor.length);
        for (int i = 0; i < copy.length; i++) {
            checkArgument(Float.isFinite(copy[i]), String.format("descriptor value %d must be finite", i));
            if (copy[i] == 0.0f) {
                copy[i] = 0.0f;
            }
        }
        return copy;
    }

    /**
     * @param value a positive value
     * @return the base 2 logarithm of the value
     */
    public static double log2(double value) {
        return Math.log(value) / LOG_2;
    }
}
