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


package com.amazon.abundancetree.inputtypes;

import static com.amazon.abundancetree.TestUtils.counts;
import static com.amazon.abundancetree.TestUtils.scores;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

public class SampleAbundanceTest {

    @Test
    public void testValidation() {
        assertThrows(NullPointerException.class, () -> new SampleAbundance(null, counts("562", 1)));
        assertThrows(NullPointerException.class, () -> new SampleAbundance("s", null));
        assertThrows(IllegalArgumentException.class, () -> new SampleAbundance("s", counts("562", -1)));

        Map<String, Long> nullCount = new HashMap<>();
        nullCount.put("562", null);
        assertThrows(IllegalArgumentException.class, () -> new SampleAbundance("s", nullCount));

        Map<String, Double> nullScore = new HashMap<>();
        nullScore.put("562", null);
        assertThrows(IllegalArgumentException.class, () -> new SampleAbundance("s", counts("562", 1), nullScore));
    }

    @Test
    public void testCopies() {
        Map<String, Long> abundances = counts("562", 3, "1423", 4);
        SampleAbundance sample = new SampleAbundance("s", abundances, scores("562", 0.5));
        abundances.put("590", 10L);
        assertEquals(7, sample.getTotalCount());
        assertEquals(Double.valueOf(0.5), sample.getScores().get("562"));
        assertTrue(new SampleAbundance("s", abundances).getScores().isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> sample.getAbundances().put("2", 1L));
    }
}
