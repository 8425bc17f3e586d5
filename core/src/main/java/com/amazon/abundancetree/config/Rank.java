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

package com.amazon.abundancetree.config;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Taxonomic levels, totally ordered from coarse to fine by their level value.
 * A larger level is a coarser rank. {@link #UNCLASSIFIED} and {@link #NO_RANK}
 * order below every real rank, so a taxon without a proper rank is always
 * considered finer than any rank floor.
 */
public enum Rank {

    ROOT(33), DOMAIN(32), SUPERKINGDOM(31), KINGDOM(30), SUBKINGDOM(29), SUPERPHYLUM(28), PHYLUM(27), SUBPHYLUM(26),
    SUPERCLASS(25), CLASS(24), SUBCLASS(23), INFRACLASS(22), COHORT(21), SUBCOHORT(20), SUPERORDER(19), ORDER(18),
    SUBORDER(17), INFRAORDER(16), PARVORDER(15), SUPERFAMILY(14), FAMILY(13), SUBFAMILY(12), TRIBE(11), SUBTRIBE(10),
    GENUS(9), SUBGENUS(8), SECTION(7), SPECIES_GROUP(6), SPECIES_SUBGROUP(5), SPECIES(4), SUBSPECIES(3), VARIETAS(2),
    FORMA(1),

    /**
     * taxa which the classifier could not place
     */
    UNCLASSIFIED(0),

    /**
     * taxa without a rank in the taxonomy (e.g. "no rank" or "clade")
     */
    NO_RANK(-1);

    private final int level;

    Rank(int level) {
        this.level = level;
    }

    public int getLevel() {
        return level;
    }

    /**
     * @param other another rank
     * @return true if this rank is strictly coarser (closer to the root) than the
     *         other
     */
    public boolean isCoarserThan(Rank other) {
        return level > other.level;
    }

    /**
     * @param other another rank
     * @return true if this rank is strictly finer (closer to the leaves) than the
     *         other
     */
    public boolean isFinerThan(Rank other) {
        return level < other.level;
    }

    /**
     * @param other another rank
     * @return true if this rank is the same level as the other or finer
     */
    public boolean isAtOrFinerThan(Rank other) {
        return level <= other.level;
    }

    /**
     * Lower case label, as used in taxonomy dumps and reports.
     *
     * @return the display label of the rank
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT).replace('_', ' ');
    }

    /**
     * Maps a rank string from a taxonomy dump (e.g. "species group") to a rank.
     * Unknown strings map to {@link #NO_RANK}.
     *
     * @param name the rank string
     * @return the matching rank
     */
    public static Rank fromName(String name) {
        if (name == null) {
            return NO_RANK;
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace(' ', '_');
        if (normalized.equals("VARIETY")) {
            return VARIETAS;
        }
        for (Rank rank : values()) {
            if (rank.name().equals(normalized)) {
                return rank;
            }
        }
        return NO_RANK;
    }

    /**
     * Groups taxids by their rank.
     *
     * @param ranks a mapping from taxid to rank
     * @return for each rank present, the sorted set of taxids at that rank
     */
    public static Map<Rank, Set<String>> ranksToTaxLevels(Map<String, Rank> ranks) {
        Map<Rank, Set<String>> taxLevels = new EnumMap<>(Rank.class);
        ranks.forEach((taxid, rank) -> taxLevels.computeIfAbsent(rank, r -> new TreeSet<>()).add(taxid));
        return taxLevels;
    }
}
