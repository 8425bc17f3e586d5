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

import static com.amazon.abundancetree.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.List;

import com.amazon.abundancetree.ITraversable;
import com.amazon.abundancetree.tree.TaxTree;
import com.amazon.abundancetree.tree.TaxaQuery;

/**
 * A utility class for creating a {@link TreeExportState} from a single-sample
 * or multi-sample tree.
 */
public class TreeExportMapper {

    /**
     * Create a {@link TreeExportState} representing the given tree.
     *
     * @param tree     a tree
     * @param metadata the display metadata of the export
     * @return the exported tree
     */
    public TreeExportState toState(ITraversable tree, ExportMetadata metadata) {
        TreeExportState state = toHeader(tree, metadata);
        state.setRoot(tree.traverse(new TreeExportVisitor()));
        return state;
    }

    /**
     * Create a {@link TreeExportState} holding only the taxa of a single-sample
     * tree selected by a query, as {@link TaxTree#getTaxa} selects them. A taxon
     * whose parent is not selected is attached to its closest selected ancestor.
     * When the selection has exactly one top-level taxon, that taxon is the root
     * of the export; otherwise the root of the tree is exported as the root, with
     * the selected top-level taxa as its children.
     *
     * @param tree     a single-sample tree
     * @param query    the taxa to export
     * @param metadata the display metadata of the export
     * @return the exported subset of the tree
     */
    public TreeExportState toState(TaxTree tree, TaxaQuery query, ExportMetadata metadata) {
        checkNotNull(query, "query cannot be null");
        TreeExportState state = toHeader(tree, metadata);
        TreeExportVisitor visitor = new TreeExportVisitor();
        tree.traverse(visitor, query);
        List<TaxonNodeState> roots = visitor.getRoots();
        if (roots.size() == 1) {
            state.setRoot(roots.get(0));
        } else {
            TaxonNodeState root = TreeExportVisitor.toState(tree.getRootView());
            root.getChildren().addAll(roots);
            state.setRoot(root);
        }
        return state;
    }

    public TreeExportState toState(ITraversable tree) {
        return toState(tree, ExportMetadata.builder().build());
    }

    private static TreeExportState toHeader(ITraversable tree, ExportMetadata metadata) {
        checkNotNull(tree, "tree cannot be null");
        checkNotNull(metadata, "metadata cannot be null");

        TreeExportState state = new TreeExportState();
        state.setSamples(new ArrayList<>(tree.getSamples()));
        state.setNumRawSamples(metadata.getNumRawSamples().orElse(tree.getSamples().size()));
        state.setMinScore(metadata.getMinScore());
        state.setMaxScore(metadata.getMaxScore());
        state.setScoring(metadata.getScoring().name());
        state.setScoreDisplay(metadata.getScoring().getDisplay());
        return state;
    }
}
