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

import com.amazon.abundancetree.config.Rank;

/**
 * A read-only view of a node, shared by single-sample and multi-sample trees.
 * Arrays are indexed by sample, in the order of
 * {@link com.amazon.abundancetree.ITraversable#getSamples()}; single-sample
 * trees report arrays of length one. The arrays returned are copies.
 */
public interface ITaxonView {

    String getTaxid();

    /**
     * @return the display name of the taxon, resolved through the taxonomy
     */
    String getName();

    Rank getRank();

    /**
     * @return the counts directly assigned to the taxon, per sample
     */
    long[] getCounts();

    /**
     * @return the accumulated counts of the taxon, per sample
     */
    long[] getAccs();

    /**
     * @return the scores of the taxon per sample;
     *         {@link com.amazon.abundancetree.CommonUtils#NO_SCORE} where there is
     *         none
     */
    double[] getScores();

    boolean hasChildren();
}
