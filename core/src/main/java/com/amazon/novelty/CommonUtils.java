/*
 * Copyright 2026 Amazon.com, Inc. or its affiliates. All Rights Reserved.
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

package com.amazon.novelty;

import java.util.Comparator;
import java.util.Objects;

/** A collection of common utility functions. */
public class CommonUtils {

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
     * Orders sample identifiers. Two identifiers that both parse as integers are
     * compared numerically, so that "9" precedes "10"; all other pairs are
     * compared lexicographically, with numeric identifiers first.
     */
    public static final Comparator<String> SAMPLE_ID_ORDER = (first, second) -> {
        Long a = parseLongOrNull(first);
        Long b = parseLongOrNull(second);
        if (a != null && b != null) {
            int result = Long.compare(a, b);
            return result != 0 ? result : first.compareTo(second);
        } else if (a != null) {
            return -1;
        } else if (b != null) {
            return 1;
        }
        return first.compareTo(second);
    };

    private static Long parseLongOrNull(String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Squared Euclidean distance between two points of the same length.
     *
     * @param first  a point
     * @param second another point
     * @return the sum of squared coordinate differences
     */
    public static double squaredDistance(double[] first, double[] second) {
        checkArgument(first.length == second.length, "points must have the same length");
        double sum = 0;
        for (int i = 0; i < first.length; i++) {
            double diff = first[i] - second[i];
            sum += diff * diff;
        }
        return sum;
    }

    public static float[] toFloatArray(double[] point) {
        checkNotNull(point, "point must not be null");
        float[] result = new float[point.length];
        for (int i = 0; i < point.length; i++) {
            result[i] = (point[i] == 0) ? 0 : (float) point[i];
            // eliminating -0.0 issues
        }
        return result;
    }
}
