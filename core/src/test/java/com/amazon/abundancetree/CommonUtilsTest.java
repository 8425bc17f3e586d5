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

import static com.amazon.abundancetree.CommonUtils.NO_SCORE;
import static com.amazon.abundancetree.TestUtils.EPSILON;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class CommonUtilsTest {

    @Test
    public void testChecks() {
        assertThrows(IllegalArgumentException.class, () -> CommonUtils.checkArgument(false, "bad"));
        assertThrows(IllegalStateException.class, () -> CommonUtils.checkState(false, "bad"));
        assertThrows(NullPointerException.class, () -> CommonUtils.checkNotNull(null, "bad"));
        assertEquals("x", CommonUtils.checkNotNull("x", "bad"));
    }

    @Test
    public void testWeightedScore() {
        assertEquals(0.25, CommonUtils.weightedScore(0.0, 3, 1.0, 1), EPSILON);
        assertEquals(0.4, CommonUtils.weightedScore(NO_SCORE, 3, 0.4, 1), EPSILON);
        assertEquals(0.7, CommonUtils.weightedScore(0.7, 2, 0.1, 0), EPSILON);
        assertFalse(CommonUtils.hasScore(CommonUtils.weightedScore(NO_SCORE, 1, NO_SCORE, 1)));
        assertFalse(CommonUtils.hasScore(CommonUtils.weightedScore(0.5, 0, 0.5, 0)));
        assertTrue(CommonUtils.hasScore(0.0));
    }
}
