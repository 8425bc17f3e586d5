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

import com.amazon.abundancetree.tree.ITaxonView;

/**
 * This is the interface for a visitor which can be used to export an
 * {@link ITraversable} tree. A visitor is submitted to
 * {@link ITraversable#traverse(Visitor)}, and during the traversal the
 * {@link #accept} method is invoked once per node, parents before children, in
 * the order in which the children are stored.
 *
 * @param <R> the type of the result computed by the visitor
 */
public interface Visitor<R> {
    /**
     * Visit a node of the tree.
     *
     * @param node        the node being visited
     * @param depthOfNode the depth of the node being visited, 0 for the root
     */
    void accept(ITaxonView node, int depthOfNode);

    /**
     * At the end of the traversal, this method is called to obtain the result
     * computed by the visitor.
     *
     * @return the result value computed by the visitor.
     */
    R getResult();
}
