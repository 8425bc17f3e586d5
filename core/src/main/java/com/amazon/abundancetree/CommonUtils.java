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

package com.amazon.abundancetree;

import java.util.Objects;

/**
 * A collection of common utility functions.
 */
public class CommonUtils {

    /**
     * Reserved score value meaning that no score is available for a taxon.
     */
    public static final double NO_SCORE = Double.NaN;

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
     * @param score a score value
     * @return true if the value is an actual score and not {@link #NO_SCORE}
     */
    public static boolean hasScore(double score) {
        return !Double.isNaN(score);
    }

    /**
     * Weighted average of two scores. A side without a score, or with a zero
     * weight, does not take part in the average.
     *
     * @param score       the first score
     * @param weight      the weight of the first score
     * @param otherScore  the second score
     * @param otherWeight the weight of the second score
     * @return the weighted average, or {@link #NO_SCORE} if neither side can be
     *         used
     */
    public static double weightedScore(double score, long weight, double otherScore, long otherWeight) {
        double sum = 0;
        long total = 0;
        if (hasScore(score) && weight > 0) {
            sum += score * weight;
            total += weight;
        }
        if (hasScore(otherScore) && otherWeight > 0) {
            sum += otherScore * otherWeight;
            total += otherWeight;
        }
        return (total == 0) ? NO_SCORE : sum / total;
    }
}
