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

package com.amazon.abundancetree.serialize;

import lombok.Getter;

import com.amazon.abundancetree.ITraversable;
import com.amazon.abundancetree.state.ExportMetadata;
import com.amazon.abundancetree.state.TreeExportMapper;
import com.amazon.abundancetree.state.TreeExportState;
import com.google.gson.Gson;

/**
 * JSON export of abundance trees. Internally we use the
 * {@link TreeExportMapper} class to convert a single-sample or multi-sample
 * tree into a {@link TreeExportState}, and we use
 * <a href="https://github.com/google/gson">Gson</a> to write the state object
 * as a JSON string. The Gson instance is exposed so users can customize the
 * output (e.g., by enabling pretty printing).
 * <p>
 * Gson leaves out null fields, so a taxon without directly assigned counts has
 * no {@code unassigned} field; null entries inside the per-sample lists are
 * kept to preserve the sample positions.
 */
@Getter
public class TreeExportSerDe {

    private final TreeExportMapper mapper;
    private final Gson gson;

    /**
     * Constructor instantiating objects for default serialization.
     */
    public TreeExportSerDe() {
        this(new TreeExportMapper(), new Gson());
    }

    /**
     * Create a SerDe instance using the provided mapper and Gson objects.
     *
     * @param mapper A TreeExportMapper instance, used to convert a tree to a
     *               corresponding state object.
     * @param gson   A Gson instance that will be used to generate JSON for a given
     *               {@link TreeExportState} object.
     */
    public TreeExportSerDe(TreeExportMapper mapper, Gson gson) {
        this.mapper = mapper;
        this.gson = gson;
    }

    /**
     * Serializes a tree with the default export metadata.
     *
     * @param tree a single-sample or multi-sample tree
     * @return a json string describing the tree
     */
    public String toJson(ITraversable tree) {
        return toJson(mapper.toState(tree));
    }

    /**
     * Serializes a tree.
     *
     * @param tree     a single-sample or multi-sample tree
     * @param metadata score bounds, scoring scheme and raw sample count to write
     *                 along the tree
     * @return a json string describing the tree
     */
    public String toJson(ITraversable tree, ExportMetadata metadata) {
        return toJson(mapper.toState(tree, metadata));
    }

    public String toJson(TreeExportState state) {
        return gson.toJson(state);
    }

    /**
     * Reads back an exported tree. The result is the export state; trees are
     * not rebuilt from it.
     *
     * @param json a json string written by this class
     * @return the export state
     */
    public TreeExportState fromJson(String json) {
        return gson.fromJson(json, TreeExportState.class);
    }
}
