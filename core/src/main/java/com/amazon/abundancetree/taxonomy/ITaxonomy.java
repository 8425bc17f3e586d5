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

package com.amazon.abundancetree.taxonomy;

import java.util.List;
import java.util.Optional;

import com.amazon.abundancetree.config.Rank;

/**
 * A read-only view of a reference taxonomy. Trees read the taxonomy while they
 * are grown and exported; implementations must not change while any tree built
 * from them is in use, which also makes them safe to share across threads.
 * <p>
 * The graph is expected to be a tree rooted at {@link #getRoot()}, but it may
 * contain back references (for instance the root listed as its own child);
 * growth of abundance trees guards against those.
 */
public interface ITaxonomy {

    /**
     * The default taxid of the universal ancestor.
     */
    String ROOT = "1";

    /**
     * @return the taxid of the universal ancestor
     */
    default String getRoot() {
        return ROOT;
    }

    /**
     * @param taxid a taxid
     * @return the rank of the taxid, {@link Rank#NO_RANK} if unknown
     */
    Rank rankOf(String taxid);

    /**
     * @param taxid a taxid
     * @return the display name of the taxid, the taxid itself if unknown
     */
    String nameOf(String taxid);

    /**
     * @param taxid a taxid
     * @return the children of the taxid in a stable order, an empty list if the
     *         taxid has none or is unknown
     */
    List<String> childrenOf(String taxid);

    /**
     * @param taxid a taxid
     * @return the parent of the taxid, empty for unknown taxids
     */
    Optional<String> parentOf(String taxid);

    /**
     * @param taxid a taxid
     * @return true if the taxonomy knows the taxid
     */
    default boolean contains(String taxid) {
        return parentOf(taxid).isPresent();
    }
}
