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

import static com.amazon.abundancetree.CommonUtils.checkArgument;
import static com.amazon.abundancetree.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.amazon.abundancetree.config.Rank;

/**
 * An immutable in-memory taxonomy snapshot. Nodes are added through a
 * {@link Builder} in the order of a nodes dump (taxid, parent, rank) and names
 * are attached separately, as in a names dump. The children of a taxid keep the
 * order in which they were added. The root always has rank {@link Rank#ROOT},
 * whatever rank it was added with.
 */
public class Taxonomy implements ITaxonomy {

    private final String root;
    private final Map<String, String> parents;
    private final Map<String, Rank> ranks;
    private final Map<String, String> names;
    private final Map<String, List<String>> children;

    protected Taxonomy(Builder builder) {
        this.root = builder.root;
        this.parents = Collections.unmodifiableMap(new HashMap<>(builder.parents));
        this.ranks = Collections.unmodifiableMap(new HashMap<>(builder.ranks));
        this.names = Collections.unmodifiableMap(new HashMap<>(builder.names));
        Map<String, List<String>> childrenCopy = new HashMap<>();
        builder.children.forEach(
                (taxid, list) -> childrenCopy.put(taxid, Collections.unmodifiableList(new ArrayList<>(list))));
        this.children = Collections.unmodifiableMap(childrenCopy);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String getRoot() {
        return root;
    }

    @Override
    public Rank rankOf(String taxid) {
        return ranks.getOrDefault(taxid, Rank.NO_RANK);
    }

    @Override
    public String nameOf(String taxid) {
        return names.getOrDefault(taxid, taxid);
    }

    @Override
    public List<String> childrenOf(String taxid) {
        return children.getOrDefault(taxid, Collections.emptyList());
    }

    @Override
    public Optional<String> parentOf(String taxid) {
        return Optional.ofNullable(parents.get(taxid));
    }

    /**
     * @return the parent of every known taxid; the root is its own parent
     */
    public Map<String, String> getParents() {
        return parents;
    }

    public int size() {
        return parents.size();
    }

    public static class Builder {

        private String root = ROOT;
        private final Map<String, String> parents = new LinkedHashMap<>();
        private final Map<String, Rank> ranks = new HashMap<>();
        private final Map<String, String> names = new HashMap<>();
        private final Map<String, List<String>> children = new HashMap<>();

        public Builder root(String root) {
            this.root = checkNotNull(root, "root cannot be null");
            return this;
        }

        /**
         * Adds a node. A node added with itself as parent is only linked as its own
         * child, which is how taxonomy dumps describe the root.
         *
         * @param taxid  the taxid of the node
         * @param parent the taxid of its parent
         * @param rank   the rank of the node
         * @return this builder
         */
        public Builder addNode(String taxid, String parent, Rank rank) {
            checkNotNull(taxid, "taxid cannot be null");
            checkNotNull(parent, "parent cannot be null");
            checkArgument(!parents.containsKey(taxid), "duplicate taxid " + taxid);
            parents.put(taxid, parent);
            ranks.put(taxid, checkNotNull(rank, "rank cannot be null"));
            children.computeIfAbsent(parent, p -> new ArrayList<>()).add(taxid);
            return this;
        }

        public Builder addNode(String taxid, String parent, Rank rank, String name) {
            addNode(taxid, parent, rank);
            return name(taxid, name);
        }

        public Builder name(String taxid, String name) {
            names.put(checkNotNull(taxid, "taxid cannot be null"), checkNotNull(name, "name cannot be null"));
            return this;
        }

        /**
         * Adds a link from a parent to a child which is already in the taxonomy
         * elsewhere. Used to describe graphs with back references; the parent lookup
         * of the child does not change.
         *
         * @param parent the taxid of the parent
         * @param child  the taxid of the extra child
         * @return this builder
         */
        public Builder addLink(String parent, String child) {
            children.computeIfAbsent(checkNotNull(parent, "parent cannot be null"), p -> new ArrayList<>())
                    .add(checkNotNull(child, "child cannot be null"));
            return this;
        }

        public Taxonomy build() {
            if (!parents.containsKey(root)) {
                addNode(root, root, Rank.ROOT, "root");
            }
            // dumps give the root "no rank"
            ranks.put(root, Rank.ROOT);
            return new Taxonomy(this);
        }
    }
}
