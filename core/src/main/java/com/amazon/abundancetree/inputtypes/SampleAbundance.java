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

import static com.amazon.abundancetree.CommonUtils.checkArgument;
import static com.amazon.abundancetree.CommonUtils.checkNotNull;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import lombok.Getter;

/**
 * The classification results of one sample: how many reads were assigned to
 * each taxid and, optionally, the score of each taxid.
 */
@Getter
public class SampleAbundance {

    private final String name;

    private final Map<String, Long> abundances;

    private final Map<String, Double> scores;

    public SampleAbundance(String name, Map<String, Long> abundances, Map<String, Double> scores) {
        this.name = checkNotNull(name, "name cannot be null");
        checkNotNull(abundances, "abundances cannot be null");
        abundances.forEach((taxid, count) -> checkArgument(count != null && count >= 0,
                "counts must be non-negative, taxid " + taxid));
        this.abundances = Collections.unmodifiableMap(new HashMap<>(abundances));
        if (scores != null) {
            scores.forEach((taxid, score) -> checkArgument(score != null, "score cannot be null, taxid " + taxid));
        }
        this.scores = (scores == null) ? Collections.emptyMap() : Collections.unmodifiableMap(new HashMap<>(scores));
    }

    public SampleAbundance(String name, Map<String, Long> abundances) {
        this(name, abundances, null);
    }

    /**
     * @return the total number of reads in the sample
     */
    public long getTotalCount() {
        return abundances.values().stream().mapToLong(Long::longValue).sum();
    }
}
