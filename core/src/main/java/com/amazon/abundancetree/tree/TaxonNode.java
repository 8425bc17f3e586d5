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

import static com.amazon.abundancetree.CommonUtils.NO_SCORE;
import static com.amazon.abundancetree.CommonUtils.checkArgument;
import static com.amazon.abundancetree.CommonUtils.checkNotNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.AccessLevel;
import lombok.Getter;

import com.amazon.abundancetree.CommonUtils;
import com.amazon.abundancetree.config.Rank;

/**
 * A node of a single-sample abundance tree. The node owns its children, which
 * are keyed by taxid and kept in the order in which they were grown.
 */
@Getter
public class TaxonNode {

    /**
     * counts directly assigned to this taxon
     */
    private long counts;

    private final Rank rank;

    /**
     * the score of the taxon, {@link CommonUtils#NO_SCORE} if there is none
     */
    private double score;

    /**
     * counts of this taxon plus the counts of all its descendants, populated by
     * {@link TaxTree#shape()}
     */
    private long acc;

    @Getter(AccessLevel.NONE)
    private final LinkedHashMap<String, TaxonNode> children = new LinkedHashMap<>();

    public TaxonNode(long counts, Rank rank, double score) {
        checkArgument(counts >= 0, "counts must be non-negative");
        this.counts = counts;
        this.rank = checkNotNull(rank, "rank cannot be null");
        this.score = score;
    }

    public TaxonNode(long counts, Rank rank) {
        this(counts, rank, NO_SCORE);
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    public boolean hasScore() {
        return CommonUtils.hasScore(score);
    }

    /**
     * @return an unmodifiable view of the children of this node
     */
    public Map<String, TaxonNode> getChildren() {
        return Collections.unmodifiableMap(children);
    }

    public TaxonNode getChild(String taxid) {
        return children.get(taxid);
    }

    Map<String, TaxonNode> children() {
        return children;
    }

    void addChild(String taxid, TaxonNode child) {
        children.put(taxid, child);
    }

    void setCounts(long counts) {
        this.counts = counts;
    }

    void setScore(double score) {
        this.score = score;
    }

    void setAcc(long acc) {
        this.acc = acc;
    }
}
