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

import static com.amazon.abundancetree.TestUtils.EPSILON;
import static com.amazon.abundancetree.TestUtils.counts;
import static com.amazon.abundancetree.TestUtils.scores;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.amazon.abundancetree.CommonUtils;
import com.amazon.abundancetree.TestUtils;
import com.amazon.abundancetree.config.Rank;
import com.amazon.abundancetree.returntypes.TaxonRow;
import com.amazon.abundancetree.taxonomy.Taxonomy;
import com.amazon.abundancetree.testutils.ExampleTaxonomies;

public class TaxTreeTest {

    private Taxonomy bacteria;
    private Taxonomy chain;

    @BeforeEach
    public void setUp() {
        bacteria = TestUtils.bacteriaTaxonomy();
        chain = TestUtils.chainTaxonomy();
    }

    private static long sumOfCounts(TaxonNode node) {
        long sum = node.getCounts();
        for (TaxonNode child : node.getChildren().values()) {
            sum += sumOfCounts(child);
        }
        return sum;
    }

    private static void assertAccumulated(TaxonNode node) {
        long acc = node.getCounts();
        for (TaxonNode child : node.getChildren().values()) {
            assertTrue(child.getAcc() > 0);
            assertAccumulated(child);
            acc += child.getAcc();
        }
        assertEquals(acc, node.getAcc());
    }

    @ParameterizedTest
    @ValueSource(longs = { 1L, 7L, 42L, 2020L })
    public void testShapeConservesCounts(long seed) {
        Map<String, Long> abundances = ExampleTaxonomies.randomAbundances(ExampleTaxonomies.bacteriaTaxids(), 0.4,
                50, seed);
        TaxTree tree = TaxTree.grow(bacteria, abundances, ExampleTaxonomies.randomScores(abundances, seed));
        tree.shape();

        long total = abundances.values().stream().mapToLong(Long::longValue).sum();
        if (total == 0) {
            total = 1;
        }
        assertEquals(total, tree.getRoot().getAcc());
        assertEquals(total, sumOfCounts(tree.getRoot()));
        assertAccumulated(tree.getRoot());
    }

    @Test
    public void testShapeIsIdempotent() {
        TaxTree tree = TaxTree.grow(bacteria, counts("562", 10, "28901", 30, "1423", 4), scores("562", 0.8));
        tree.shape();
        String rendered = tree.toString(0);
        TaxaCollector first = TaxaCollector.all();
        tree.getTaxa(TaxaQuery.all(), first);

        tree.shape();
        TaxaCollector second = TaxaCollector.all();
        tree.getTaxa(TaxaQuery.all(), second);

        assertEquals(rendered, tree.toString(0));
        assertEquals(first.getAccs(), second.getAccs());
        assertEquals(first.getScores(), second.getScores());
    }

    @Test
    public void testShapeRemovesEmptyBranchesAndAveragesScores() {
        TaxTree tree = TaxTree.grow(bacteria, counts("562", 10, "28901", 30, "1423", 4),
                scores("562", 0.8, "28901", 0.4));
        assertEquals(17, tree.size());
        tree.shape();

        assertNull(tree.getNode("9606"));
        assertNull(tree.getNode("83333"));
        assertNull(tree.getNode("10239"));
        assertEquals(44, tree.getRoot().getAcc());
        assertEquals(0.5, tree.getNode("543").getScore(), EPSILON);
        // Bacillus has no scored children
        assertFalse(tree.getNode("1239").hasScore());
        // only the scored branch weighs in
        assertEquals(0.5, tree.getNode("2").getScore(), EPSILON);
    }

    @Test
    public void testGrowDefaults() {
        TaxTree tree = TaxTree.grow(chain, Collections.emptyMap(), null);
        tree.shape();
        assertEquals(TaxTree.DEFAULT_SAMPLE, tree.getSample());
        assertEquals(1, tree.getRoot().getCounts());
        assertEquals(1, tree.getRoot().getAcc());
        assertFalse(tree.getRoot().hasChildren());
        assertFalse(tree.getRoot().hasScore());

        TaxTree unknown = TaxTree.grow(chain, counts("Z", 5, "C", 1), null);
        unknown.shape();
        assertEquals(1, unknown.getRoot().getAcc());

        assertThrows(NullPointerException.class, () -> TaxTree.grow(null, counts("C", 1), null));
    }

    @Test
    public void testGrowWithNullScore() {
        Map<String, Double> scores = new HashMap<>();
        scores.put("C", null);
        scores.put("B", 0.5);
        TaxTree tree = TaxTree.grow(chain, counts("B", 1, "C", 2), scores);
        tree.shape();
        assertFalse(tree.getNode("C").hasScore());
        assertEquals(0.5, tree.getNode("B").getScore(), EPSILON);

        Map<String, Long> abundances = new HashMap<>();
        abundances.put("A", null);
        abundances.put("C", 2L);
        tree = TaxTree.grow(chain, abundances, null);
        tree.shape();
        assertEquals(0, tree.getNode("A").getCounts());
        assertEquals(2, tree.getRoot().getAcc());
    }

    @Test
    public void testGrowBelowTaxid() {
        TaxTree tree = TaxTree.grow(chain, "s1", counts("B", 2, "C", 3), null, "A");
        tree.shape();
        assertEquals("A", tree.getRootTaxid());
        assertEquals(3, tree.size());
        assertEquals(5, tree.getRoot().getAcc());
        assertEquals(Rank.PHYLUM, tree.getRoot().getRank());
    }

    @Test
    public void testGrowSurvivesCycles() {
        Taxonomy cyclic = Taxonomy.builder().addNode("A", "1", Rank.PHYLUM).addNode("B", "A", Rank.GENUS)
                .addNode("C", "B", Rank.SPECIES).addLink("C", "A").build();
        // the root lists itself as a child
        assertTrue(cyclic.childrenOf("1").contains("1"));

        TaxTree tree = TaxTree.grow(cyclic, counts("C", 2), null);
        tree.shape();
        assertEquals(2, tree.getRoot().getAcc());
        assertNull(tree.getNode("C").getChild("A"));
        assertNull(tree.getRoot().getChild("1"));
        assertNotNull(tree.getNode("A").getChild("B"));
        assertEquals(4, tree.size());
    }

    @Test
    public void testToString() {
        TaxTree tree = TaxTree.grow(chain, counts("A", 2, "B", 3), null);
        tree.shape();
        assertEquals("->(A[2]->(B[3],)))", tree.toString());
        assertEquals("1[0]->(A[2]->(B[3],)))", tree.toString(0));
        assertEquals("->(->(B[3],)))", tree.toString(3));
    }

    @Test
    public void testPruneCollapse() {
        TaxTree tree = TaxTree.grow(chain, counts("A", 2, "B", 1, "C", 5), scores("B", 0.0, "C", 1.0));
        tree.shape();
        assertEquals(8, tree.getRoot().getAcc());

        assertTrue(tree.prune(3, null, true));
        assertEquals(4, tree.size());

        assertTrue(tree.prune(6, null, true));
        assertNull(tree.getNode("C"));
        assertEquals(6, tree.getNode("B").getCounts());
        assertEquals(5.0 / 6, tree.getNode("B").getScore(), EPSILON);
        assertEquals(8, sumOfCounts(tree.getRoot()));

        assertFalse(tree.prune(100, null, true));
        assertFalse(tree.getRoot().hasChildren());
        assertEquals(8, tree.getRoot().getCounts());
        assertEquals(8, tree.getRoot().getAcc());
    }

    @ParameterizedTest
    @ValueSource(longs = { 3L, 11L, 99L, 2021L })
    public void testPruneCollapseConservesCounts(long seed) {
        Map<String, Long> abundances = ExampleTaxonomies.randomAbundances(ExampleTaxonomies.bacteriaTaxids(), 0.5,
                30, seed);
        TaxTree tree = TaxTree.grow(bacteria, abundances, ExampleTaxonomies.randomScores(abundances, seed));
        tree.shape();
        long total = sumOfCounts(tree.getRoot());
        assertEquals(total, tree.getRoot().getAcc());

        tree.prune(1, null, true);
        assertEquals(total, sumOfCounts(tree.getRoot()));
        for (long minTaxa : new long[] { 5, 20 }) {
            tree.prune(minTaxa, null, true);
            assertEquals(total, sumOfCounts(tree.getRoot()), "minTaxa " + minTaxa);
            assertEquals(total, tree.getRoot().getAcc());
        }
        tree.prune(1, Rank.GENUS, true);
        assertEquals(total, sumOfCounts(tree.getRoot()));
    }

    @Test
    public void testPruneWithoutCollapse() {
        TaxTree tree = TaxTree.grow(chain, counts("A", 10, "B", 1, "C", 5), null);
        tree.shape();
        assertEquals(16, tree.getNode("A").getAcc());

        assertTrue(tree.prune(6, null, false, true));
        assertNull(tree.getNode("B"));
        assertEquals(10, tree.getNode("A").getCounts());
        assertEquals(15, tree.getNode("A").getAcc());
        assertEquals(16, tree.getRoot().getAcc());
    }

    @Test
    public void testPruneByRank() {
        TaxTree tree = TaxTree.grow(bacteria, counts("562", 10, "83333", 3, "561", 2, "1423", 4), null);
        tree.shape();
        assertEquals(19, tree.getRoot().getAcc());

        assertTrue(tree.prune(1, Rank.GENUS, true));
        assertNull(tree.getNode("562"));
        assertNull(tree.getNode("83333"));
        assertNull(tree.getNode("1423"));
        assertEquals(15, tree.getNode("561").getCounts());
        assertEquals(4, tree.getNode("1386").getCounts());
        assertEquals(19, sumOfCounts(tree.getRoot()));

        TaxaCollector collector = TaxaCollector.builder().ranks(new HashMap<>()).build();
        tree.getTaxa(TaxaQuery.all(), collector);
        for (Rank rank : collector.getRanks().values()) {
            assertFalse(rank.isFinerThan(Rank.GENUS), "rank " + rank + " should have been pruned");
        }
        assertThrows(IllegalArgumentException.class, () -> tree.prune(-1, null, true));
    }

    @Test
    public void testGetTaxaDepthBounds() {
        TaxTree tree = TaxTree.grow(chain, counts("C", 1), null);
        tree.shape();

        TaxaCollector collector = TaxaCollector.all();
        tree.getTaxa(TaxaQuery.builder().mindepth(2).maxdepth(2).build(), collector);
        assertEquals(Collections.singletonMap("B", 0L), collector.getAbundances());

        collector = TaxaCollector.all();
        tree.getTaxa(TaxaQuery.builder().maxdepth(1).build(), collector);
        assertThat(collector.getAccs().keySet(), contains("1", "A"));

        collector = TaxaCollector.all();
        tree.getTaxa(TaxaQuery.builder().mindepth(3).build(), collector);
        assertThat(collector.getAccs().keySet(), contains("C"));
        assertEquals(Rank.SPECIES, collector.getRanks().get("C"));
        assertTrue(collector.getScores().isEmpty());
    }

    @Test
    public void testGetTaxaIncludeExclude() {
        TaxTree tree = TaxTree.grow(bacteria, counts("562", 10, "28901", 30, "1423", 4), scores("562", 0.8));
        tree.shape();

        TaxaCollector collector = TaxaCollector.all();
        tree.getTaxa(TaxaQuery.builder().include(Arrays.asList("543")).exclude(Arrays.asList("590")).build(),
                collector);
        assertThat(collector.getAccs().keySet(), contains("543", "561", "562"));
        assertEquals(Long.valueOf(40), collector.getAccs().get("543"));

        collector = TaxaCollector.all();
        tree.getTaxa(TaxaQuery.builder().include(Arrays.asList("543")).exclude(Arrays.asList("543")).build(),
                collector);
        assertTrue(collector.getAccs().isEmpty());

        collector = TaxaCollector.all();
        tree.getTaxa(TaxaQuery.builder().exclude(Arrays.asList("1224")).justLevel(Rank.SPECIES).build(), collector);
        assertThat(collector.getAccs().keySet(), containsInAnyOrder("562", "28901", "1423"));

        collector = TaxaCollector.all();
        tree.getTaxa(TaxaQuery.builder().exclude(Arrays.asList("1224")).build(), collector);
        assertFalse(collector.getAccs().containsKey("1224"));
        assertTrue(collector.getAccs().containsKey("1236"));
    }

    @Test
    public void testGetTaxaExcludeDropsOnlyTheExcludedTaxon() {
        TaxTree tree = TaxTree.grow(chain, counts("C", 1), null);
        tree.shape();

        TaxaCollector collector = TaxaCollector.all();
        tree.getTaxa(TaxaQuery.builder().exclude(Arrays.asList("B")).build(), collector);
        assertThat(collector.getAccs().keySet(), contains("1", "A", "C"));

        collector = TaxaCollector.all();
        tree.getTaxa(TaxaQuery.builder().include(Arrays.asList("C")).exclude(Arrays.asList("B")).build(), collector);
        assertThat(collector.getAccs().keySet(), contains("C"));

        collector = TaxaCollector.all();
        tree.getTaxa(TaxaQuery.builder().include(Arrays.asList("A")).exclude(Arrays.asList("B")).build(), collector);
        assertThat(collector.getAccs().keySet(), contains("A"));
    }

    @Test
    public void testGetTaxaJustLevel() {
        TaxTree tree = TaxTree.grow(bacteria, counts("562", 10, "28901", 30, "1423", 4), null);
        tree.shape();
        TaxaCollector collector = TaxaCollector.builder().abundances(new LinkedHashMap<>()).build();
        tree.getTaxa(TaxaQuery.builder().justLevel(Rank.SPECIES).build(), collector);
        assertThat(collector.getAbundances().keySet(), contains("562", "28901", "1423"));
        assertNull(collector.getAccs());
    }

    @Test
    public void testTrace() {
        TaxTree tree = TaxTree.grow(chain, counts("C", 1), null);
        tree.shape();
        List<String> nodes = new ArrayList<>();
        assertTrue(tree.trace("C", nodes));
        assertThat(nodes, contains("1", "A", "B", "C"));

        nodes = new ArrayList<>();
        assertFalse(tree.trace("Z", nodes));
        assertTrue(nodes.isEmpty());
    }

    @Test
    public void testGetLineage() {
        TaxTree tree = TaxTree.grow(chain, counts("B", 1), null);
        tree.shape();

        LineageResult result = tree.getLineage(Arrays.asList("B", "1", "C", "Z"));
        assertThat(result.getLineages().get("B"), contains("1", "A", "B"));
        assertThat(result.getLineages().get("1"), contains("1"));
        assertTrue(result.hasWarnings());
        assertThat(result.getWarnings().get("C"), containsString("missing in tree"));
        assertThat(result.getWarnings().get("Z"), containsString("missing in parents"));
        assertFalse(result.getLineages().containsKey("C"));

        LineageResult withParents = tree.getLineage(Collections.singletonMap("B", "A"), Arrays.asList("A", "B"));
        assertThat(withParents.getLineages().keySet(), contains("B"));
        assertThat(withParents.getWarnings().get("A"), containsString("missing in parents"));
    }

    @Test
    public void testToItems() {
        TaxTree tree = TaxTree.grow(chain, "s1", counts("A", 2, "B", 3), scores("B", 0.5));
        tree.shape();
        List<TaxonRow> rows = tree.toItems();
        assertEquals(3, rows.size());
        TaxonRow row = rows.get(1);
        assertEquals("A", row.getTaxid());
        // A has its own counts, so it does not take the score of B
        assertEquals(Arrays.asList(5L, 2L, Double.NaN, "phylum", "Alpha"), row.getValues());
        assertEquals(Arrays.asList(3L, 3L, 0.5), rows.get(2).getValues().subList(0, 3));
        assertFalse(CommonUtils.hasScore(rows.get(0).getScores()[0]));
    }
}
