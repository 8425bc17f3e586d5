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

import java.util.HashMap;
import java.util.Map;

import com.amazon.abundancetree.config.Rank;
import com.amazon.abundancetree.taxonomy.Taxonomy;
import com.amazon.abundancetree.testutils.ExampleTaxonomies;
import com.amazon.abundancetree.tree.ITaxonView;

public class TestUtils {
    public static final double EPSILON = 1e-6;

    /** Return a visitor that does nothing. */
    public static final Visitor<Double> DUMMY_VISITOR = new Visitor<Double>() {
        @Override
        public void accept(ITaxonView node, int depthOfNode) {
        }

        @Override
        public Double getResult() {
            return Double.NaN;
        }
    };

    /**
     * @return the small NCBI-like taxonomy of the test utilities
     */
    public static Taxonomy bacteriaTaxonomy() {
        Taxonomy.Builder builder = Taxonomy.builder();
        for (String[] row : ExampleTaxonomies.bacteriaRows()) {
            builder.addNode(row[ExampleTaxonomies.TAXID], row[ExampleTaxonomies.PARENT],
                    Rank.fromName(row[ExampleTaxonomies.RANK]), row[ExampleTaxonomies.NAME]);
        }
        return builder.build();
    }

    /**
     * @return the chain 1 -> A (phylum) -> B (genus) -> C (species)
     */
    public static Taxonomy chainTaxonomy() {
        return Taxonomy.builder().addNode("A", "1", Rank.PHYLUM, "Alpha").addNode("B", "A", Rank.GENUS, "Beta")
                .addNode("C", "B", Rank.SPECIES, "Gamma").build();
    }

    public static Map<String, Long> counts(Object... taxidsAndCounts) {
        Map<String, Long> counts = new HashMap<>();
        for (int i = 0; i < taxidsAndCounts.length; i += 2) {
            counts.put((String) taxidsAndCounts[i], ((Number) taxidsAndCounts[i + 1]).longValue());
        }
        return counts;
    }

    public static Map<String, Double> scores(Object... taxidsAndScores) {
        Map<String, Double> scores = new HashMap<>();
        for (int i = 0; i < taxidsAndScores.length; i += 2) {
            scores.put((String) taxidsAndScores[i], ((Number) taxidsAndScores[i + 1]).doubleValue());
        }
        return scores;
    }
}
