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

package com.amazon.abundancetree.returntypes;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import lombok.Getter;

/**
 * One row of the tabular export of a tree. A full row holds, for every sample,
 * the accumulated count, the count and the score, followed by the rank and the
 * name of the taxon. A count-only row holds the counts of a chosen subset of
 * samples and nothing else; its other fields are null.
 */
@Getter
public class TaxonRow {

    private final String taxid;

    private final long[] counts;

    private final long[] accs;

    private final double[] scores;

    private final String rank;

    private final String name;

    public TaxonRow(String taxid, long[] accs, long[] counts, double[] scores, String rank, String name) {
        this.taxid = taxid;
        this.accs = accs;
        this.counts = counts;
        this.scores = scores;
        this.rank = rank;
        this.name = name;
    }

    public TaxonRow(String taxid, long[] counts) {
        this(taxid, null, counts, null, null, null);
    }

    public boolean isCountOnly() {
        return accs == null;
    }

    /**
     * @return the values of the row in column order
     */
    public List<Object> getValues() {
        List<Object> values = new ArrayList<>();
        if (isCountOnly()) {
            Arrays.stream(counts).forEach(values::add);
            return values;
        }
        for (int i = 0; i < counts.length; i++) {
            values.add(accs[i]);
            values.add(counts[i]);
            values.add(scores[i]);
        }
        values.add(rank);
        values.add(name);
        return values;
    }

    @Override
    public String toString() {
        return taxid + getValues();
    }
}
