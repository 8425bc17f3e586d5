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

package com.amazon.abundancetree.tree;

import static com.amazon.abundancetree.CommonUtils.checkArgument;
import static com.amazon.abundancetree.CommonUtils.checkNotNull;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Getter;

import com.amazon.abundancetree.config.Rank;

/**
 * A node of a multi-sample abundance tree. Counts, accumulated counts and scores
 * are held per sample, in the sample order of the tree the node belongs to.
 */
public class MultiTaxonNode {

    @Getter
    private final Rank rank;

    private final long[] counts;

    private final long[] accs;

    private final double[] scores;

    private final LinkedHashMap<String, MultiTaxonNode> children = new LinkedHashMap<>();

    public MultiTaxonNode(Rank rank, long[] counts, long[] accs, double[] scores) {
        checkNotNull(counts, "counts cannot be null");
        checkNotNull(accs, "accs cannot be null");
        checkNotNull(scores, "scores cannot be null");
        checkArgument(counts.length == accs.length && accs.length == scores.length,
                "counts, accs and scores must have one value per sample");
        this.rank = checkNotNull(rank, "rank cannot be null");
        this.counts = Arrays.copyOf(counts, counts.length);
        this.accs = Arrays.copyOf(accs, accs.length);
        this.scores = Arrays.copyOf(scores, scores.length);
    }

    public int getNumberOfSamples() {
        return counts.length;
    }

    public long getCount(int sampleIndex) {
        return counts[sampleIndex];
    }

    public long getAcc(int sampleIndex) {
        return accs[sampleIndex];
    }

    public double getScore(int sampleIndex) {
        return scores[sampleIndex];
    }

    public long[] getCounts() {
        return Arrays.copyOf(counts, counts.length);
    }

    public long[] getAccs() {
        return Arrays.copyOf(accs, accs.length);
    }

    public double[] getScores() {
        return Arrays.copyOf(scores, scores.length);
    }

    /**
     * @return the largest count of this taxon over all the samples
     */
    public long getMaxCount() {
        return Arrays.stream(counts).max().orElse(0);
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    public Map<String, MultiTaxonNode> getChildren() {
        return Collections.unmodifiableMap(children);
    }

    public MultiTaxonNode getChild(String taxid) {
        return children.get(taxid);
    }

    Map<String, MultiTaxonNode> children() {
        return children;
    }

    void addChild(String taxid, MultiTaxonNode child) {
        checkArgument(child.getNumberOfSamples() == getNumberOfSamples(), "sample number mismatch");
        children.put(taxid, child);
    }
}
