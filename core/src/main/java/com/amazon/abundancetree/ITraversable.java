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

import java.util.Collections;
import java.util.List;

import com.amazon.abundancetree.inspect.TaxonItemsVisitor;
import com.amazon.abundancetree.returntypes.TaxonRow;

/**
 * A tree which can be walked by a {@link Visitor}. The sample order reported by
 * {@link #getSamples()} is the order of the per-sample values of every node
 * seen during the traversal.
 */
public interface ITraversable {

    /**
     * Visit every node of the tree in pre-order.
     *
     * @param visitor the visitor
     * @param <R>     the type of the visitor result
     * @return the result of the visitor after all the nodes were visited
     */
    <R> R traverse(Visitor<R> visitor);

    /**
     * @return the names of the samples, in the order used by the node values
     */
    List<String> getSamples();

    /**
     * @return one full row per node, in pre-order
     */
    default List<TaxonRow> toItems() {
        return toItems(Collections.emptyList());
    }

    /**
     * @param sampleIndexes the samples whose counts are wanted, empty for full
     *                      rows
     * @return one row per node, in pre-order
     */
    default List<TaxonRow> toItems(List<Integer> sampleIndexes) {
        return traverse(new TaxonItemsVisitor(sampleIndexes));
    }
}
