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

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import lombok.Getter;

import com.amazon.abundancetree.config.Rank;

/**
 * The bounds of a taxa extraction. Depths count from the root, which is at depth
 * 0. A {@code mindepth} of 0 sets no lower bound and a {@code maxdepth} of 0
 * sets no upper bound.
 * <p>
 * A node is in branch when the include set is empty, or the node or one of its
 * ancestors is included, and the node itself is not excluded. Exclusion only
 * drops the excluded node: its descendants stay in branch when nothing is
 * included or when they are below an included node.
 */
@Getter
public class TaxaQuery {

    private final int mindepth;
    private final int maxdepth;
    private final Set<String> include;
    private final Set<String> exclude;

    /**
     * if not null, only taxa at this rank are recorded
     */
    private final Rank justLevel;

    protected TaxaQuery(Builder builder) {
        this.mindepth = builder.mindepth;
        this.maxdepth = builder.maxdepth;
        this.include = Collections.unmodifiableSet(new HashSet<>(builder.include));
        this.exclude = Collections.unmodifiableSet(new HashSet<>(builder.exclude));
        this.justLevel = builder.justLevel;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a query that extracts every taxon in the tree
     */
    public static TaxaQuery all() {
        return builder().build();
    }

    public static class Builder {

        private int mindepth = 0;
        private int maxdepth = 0;
        private Set<String> include = Collections.emptySet();
        private Set<String> exclude = Collections.emptySet();
        private Rank justLevel = null;

        public Builder mindepth(int mindepth) {
            checkArgument(mindepth >= 0, "mindepth must be non-negative");
            this.mindepth = mindepth;
            return this;
        }

        public Builder maxdepth(int maxdepth) {
            checkArgument(maxdepth >= 0, "maxdepth must be non-negative");
            this.maxdepth = maxdepth;
            return this;
        }

        public Builder include(Collection<String> include) {
            this.include = new HashSet<>(checkNotNull(include, "include cannot be null"));
            return this;
        }

        public Builder exclude(Collection<String> exclude) {
            this.exclude = new HashSet<>(checkNotNull(exclude, "exclude cannot be null"));
            return this;
        }

        public Builder justLevel(Rank justLevel) {
            this.justLevel = justLevel;
            return this;
        }

        public TaxaQuery build() {
            return new TaxaQuery(this);
        }
    }
}
