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

package com.amazon.abundancetree.inspect;

import static com.amazon.abundancetree.CommonUtils.checkArgument;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.amazon.abundancetree.Visitor;
import com.amazon.abundancetree.returntypes.TaxonRow;
import com.amazon.abundancetree.tree.ITaxonView;

/**
 * A visitor producing one {@link TaxonRow} per node, in pre-order, to feed a
 * table. Without sample indexes every row is a full row; with sample indexes
 * the rows only hold the counts of those samples, which is how a restricted set
 * of samples (for instance classified against unclassified reads) is compared.
 */
public class TaxonItemsVisitor implements Visitor<List<TaxonRow>> {

    private final int[] sampleIndexes;

    private final List<TaxonRow> rows = new ArrayList<>();

    public TaxonItemsVisitor() {
        this(Collections.emptyList());
    }

    /**
     * @param sampleIndexes indexes of the samples whose counts are wanted; empty
     *                      for full rows
     */
    public TaxonItemsVisitor(List<Integer> sampleIndexes) {
        this.sampleIndexes = sampleIndexes.stream().mapToInt(Integer::intValue).toArray();
        for (int index : this.sampleIndexes) {
            checkArgument(index >= 0, "sample indexes must be non-negative");
        }
    }

    @Override
    public void accept(ITaxonView node, int depthOfNode) {
        long[] counts = node.getCounts();
        if (sampleIndexes.length > 0) {
            long[] selected = new long[sampleIndexes.length];
            for (int i = 0; i < sampleIndexes.length; i++) {
                checkArgument(sampleIndexes[i] < counts.length, "sample index out of range " + sampleIndexes[i]);
                selected[i] = counts[sampleIndexes[i]];
            }
            rows.add(new TaxonRow(node.getTaxid(), selected));
        } else {
            rows.add(new TaxonRow(node.getTaxid(), node.getAccs(), counts, node.getScores(), node.getRank().label(),
                    node.getName()));
        }
    }

    @Override
    public List<TaxonRow> getResult() {
        return rows;
    }
}
