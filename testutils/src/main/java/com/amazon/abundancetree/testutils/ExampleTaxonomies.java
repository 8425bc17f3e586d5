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

package com.amazon.abundancetree.testutils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Small reference taxonomies and sample abundances for tests. The taxonomy is
 * given as rows of {taxid, parent taxid, rank, name}, in the layout of an NCBI
 * nodes and names dump, so that this module does not depend on the model
 * classes.
 */
public class ExampleTaxonomies {

    public static final int TAXID = 0;
    public static final int PARENT = 1;
    public static final int RANK = 2;
    public static final int NAME = 3;

    private static final String[][] BACTERIA = { { "1", "1", "no rank", "root" },
            { "2", "1", "superkingdom", "Bacteria" }, { "1224", "2", "phylum", "Proteobacteria" },
            { "1236", "1224", "class", "Gammaproteobacteria" }, { "91347", "1236", "order", "Enterobacterales" },
            { "543", "91347", "family", "Enterobacteriaceae" }, { "561", "543", "genus", "Escherichia" },
            { "562", "561", "species", "Escherichia coli" }, { "83333", "562", "no rank", "Escherichia coli K-12" },
            { "590", "543", "genus", "Salmonella" }, { "28901", "590", "species", "Salmonella enterica" },
            { "1239", "2", "phylum", "Firmicutes" }, { "1386", "1239", "genus", "Bacillus" },
            { "1423", "1386", "species", "Bacillus subtilis" }, { "10239", "1", "superkingdom", "Viruses" },
            { "2759", "1", "superkingdom", "Eukaryota" }, { "9606", "2759", "species", "Homo sapiens" } };

    private ExampleTaxonomies() {
    }

    /**
     * @return the rows of a small taxonomy of bacteria, viruses and eukaryotes,
     *         root first and every parent before its children
     */
    public static List<String[]> bacteriaRows() {
        List<String[]> rows = new ArrayList<>();
        for (String[] row : BACTERIA) {
            rows.add(Arrays.copyOf(row, row.length));
        }
        return rows;
    }

    /**
     * @return the taxids of the small taxonomy, in row order
     */
    public static List<String> bacteriaTaxids() {
        List<String> taxids = new ArrayList<>();
        for (String[] row : BACTERIA) {
            taxids.add(row[TAXID]);
        }
        return Collections.unmodifiableList(taxids);
    }

    /**
     * Generates the counts of a sample over the given taxids. Each taxid gets
     * counts with probability {@code density}.
     *
     * @param taxids   the candidate taxids
     * @param density  the probability for a taxid to get counts
     * @param maxCount the maximum counts of a taxid
     * @param seed     the seed of the random generator
     * @return the counts of each taxid which got some, in the order of the taxids
     */
    public static Map<String, Long> randomAbundances(List<String> taxids, double density, int maxCount, long seed) {
        Random prg = new Random(seed);
        Map<String, Long> abundances = new LinkedHashMap<>();
        for (String taxid : taxids) {
            if (prg.nextDouble() < density) {
                abundances.put(taxid, 1L + prg.nextInt(maxCount));
            }
        }
        return abundances;
    }

    /**
     * Generates a score in [0, 1) for every taxid with counts.
     *
     * @param abundances the counts of a sample
     * @param seed       the seed of the random generator
     * @return the score of each taxid
     */
    public static Map<String, Double> randomScores(Map<String, Long> abundances, long seed) {
        Random prg = new Random(seed);
        Map<String, Double> scores = new LinkedHashMap<>();
        for (String taxid : abundances.keySet()) {
            scores.put(taxid, prg.nextDouble());
        }
        return scores;
    }
}
