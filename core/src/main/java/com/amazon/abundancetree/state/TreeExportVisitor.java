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

package com.amazon.abundancetree.state;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import com.amazon.abundancetree.CommonUtils;
import com.amazon.abundancetree.Visitor;
import com.amazon.abundancetree.tree.ITaxonView;

/**
 * A visitor rebuilding the hierarchy of a tree as {@link TaxonNodeState}s. It
 * relies on the pre-order of the traversal: a node at depth d is a child of the
 * last node seen at depth d - 1. Nodes at depth 0 are top-level nodes; a full
 * traversal has a single one, the root, while a filtered traversal may have
 * several.
 */
public class TreeExportVisitor implements Visitor<TaxonNodeState> {

    private final Deque<TaxonNodeState> path = new ArrayDeque<>();

    private final List<TaxonNodeState> roots = new ArrayList<>();

    @Override
    public void accept(ITaxonView node, int depthOfNode) {
        TaxonNodeState state = toState(node);
        while (path.size() > depthOfNode) {
            path.pop();
        }
        if (path.isEmpty()) {
            roots.add(state);
        } else {
            path.peek().getChildren().add(state);
        }
        path.push(state);
    }

    @Override
    public TaxonNodeState getResult() {
        return roots.isEmpty() ? null : roots.get(0);
    }

    /**
     * @return the top-level nodes visited, in traversal order
     */
    public List<TaxonNodeState> getRoots() {
        return roots;
    }

    static TaxonNodeState toState(ITaxonView node) {
        TaxonNodeState state = new TaxonNodeState();
        state.setName(node.getName());
        state.setTaxid(node.getTaxid());
        state.setRank(node.getRank().label());
        state.setCount(presentCounts(node.getAccs()));
        long[] counts = node.getCounts();
        boolean anyAssigned = false;
        for (long value : counts) {
            anyAssigned |= value != 0;
        }
        state.setUnassigned(anyAssigned ? presentCounts(counts) : null);
        List<Double> scores = new ArrayList<>();
        for (double score : node.getScores()) {
            scores.add(CommonUtils.hasScore(score) ? score : null);
        }
        state.setScore(scores);
        return state;
    }

    private static List<Long> presentCounts(long[] values) {
        List<Long> list = new ArrayList<>();
        for (long value : values) {
            list.add(value == 0 ? null : value);
        }
        return list;
    }
}
