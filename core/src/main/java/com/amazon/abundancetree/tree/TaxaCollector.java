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

import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Getter;

import com.amazon.abundancetree.config.Rank;

/**
 * The outputs of a taxa extraction. Each output is optional: only the maps given
 * to the builder are filled, the getters of the others return null. Taxa are
 * recorded in the pre-order in which they are visited. Scores are only recorded
 * for taxa which have one.
 */
@Getter
public class TaxaCollector {

    private final Map<String, Long> abundances;
    private final Map<String, Long> accs;
    private final Map<String, Double> scores;
    private final Map<String, Rank> ranks;

    protected TaxaCollector(Builder builder) {
        this.abundances = builder.abundances;
        this.accs = builder.accs;
        this.scores = builder.scores;
        this.ranks = builder.ranks;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a collector recording every output into new maps
     */
    public static TaxaCollector all() {
        return builder().abundances(new LinkedHashMap<>()).accs(new LinkedHashMap<>())
                .scores(new LinkedHashMap<>()).ranks(new LinkedHashMap<>()).build();
    }

    void record(String taxid, TaxonNode node) {
        if (abundances != null) {
            abundances.put(taxid, node.getCounts());
        }
        if (accs != null) {
            accs.put(taxid, node.getAcc());
        }
        if (scores != null && node.hasScore()) {
            scores.put(taxid, node.getScore());
        }
        if (ranks != null) {
            ranks.put(taxid, node.getRank());
        }
    }

    public static class Builder {

        private Map<String, Long> abundances;
        private Map<String, Long> accs;
        private Map<String, Double> scores;
        private Map<String, Rank> ranks;

        public Builder abundances(Map<String, Long> abundances) {
            this.abundances = abundances;
            return this;
        }

        public Builder accs(Map<String, Long> accs) {
            this.accs = accs;
            return this;
        }

        public Builder scores(Map<String, Double> scores) {
            this.scores = scores;
            return this;
        }

        public Builder ranks(Map<String, Rank> ranks) {
            this.ranks = ranks;
            return this;
        }

        public TaxaCollector build() {
            return new TaxaCollector(this);
        }
    }
}
