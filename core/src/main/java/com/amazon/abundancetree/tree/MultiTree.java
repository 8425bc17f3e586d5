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

import static com.amazon.abundancetree.CommonUtils.NO_SCORE;
import static com.amazon.abundancetree.CommonUtils.checkArgument;
import static com.amazon.abundancetree.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import lombok.Getter;

import com.amazon.abundancetree.ITraversable;
import com.amazon.abundancetree.Visitor;
import com.amazon.abundancetree.config.Rank;
import com.amazon.abundancetree.taxonomy.ITaxonomy;

/**
 * A tree holding several samples at once, used to compare them. It is grown from
 * the outputs of already shaped single-sample trees, and holds a taxon whenever
 * at least one sample has accumulated counts for it: the tree is the union of
 * the sample trees. The sample order is fixed when the tree is grown.
 */
@Getter
public class MultiTree implements ITraversable {

    private final ITaxonomy taxonomy;

    private final List<String> samples;

    private final String rootTaxid;

    /**
     * the root node, null if no sample has counts at the root taxid
     */
    private final MultiTaxonNode root;

    protected MultiTree(ITaxonomy taxonomy, List<String> samples, String rootTaxid, MultiTaxonNode root) {
        this.taxonomy = taxonomy;
        this.samples = samples;
        this.rootTaxid = rootTaxid;
        this.root = root;
    }

    /**
     * Grows a multi-sample tree from per-sample maps keyed by sample name. The
     * accumulated counts decide which taxa are in the tree, so they are expected
     * to come from shaped single-sample trees; they are not recomputed.
     *
     * @param taxonomy   the taxonomy to mirror
     * @param samples    the sample names, in the order used by the tree
     * @param abundances for each sample, the counts directly assigned to each
     *                   taxid; if null or empty, one count on the root per sample
     * @param accs       for each sample, the accumulated counts of each taxid; if
     *                   null or empty, one count on the root per sample
     * @param scores     for each sample, the score of each taxid; may be null
     * @return the new tree
     * @throws IllegalArgumentException if a non-empty input lacks a sample
     */
    public static MultiTree grow(ITaxonomy taxonomy, List<String> samples, Map<String, Map<String, Long>> abundances,
            Map<String, Map<String, Long>> accs, Map<String, Map<String, Double>> scores) {
        checkNotNull(taxonomy, "taxonomy cannot be null");
        checkNotNull(samples, "samples cannot be null");
        checkArgument(!samples.isEmpty(), "at least one sample is required");
        checkArgument(new HashSet<>(samples).size() == samples.size(), "sample names must be unique");
        String rootTaxid = taxonomy.getRoot();

        List<Map<String, Long>> sampleCounts = perSample(samples, abundances, rootTaxid, "abundances");
        List<Map<String, Long>> sampleAccs = perSample(samples, accs, rootTaxid, "accs");
        List<Map<String, Double>> sampleScores = new ArrayList<>();
        for (String sample : samples) {
            if (scores == null || scores.isEmpty()) {
                sampleScores.add(Collections.emptyMap());
            } else {
                checkArgument(scores.containsKey(sample), "no scores for sample " + sample);
                sampleScores.add(scores.get(sample));
            }
        }

        MultiTaxonNode root = growNode(taxonomy, sampleCounts, sampleAccs, sampleScores, rootTaxid, new HashSet<>());
        return new MultiTree(taxonomy, Collections.unmodifiableList(new ArrayList<>(samples)), rootTaxid, root);
    }

    private static List<Map<String, Long>> perSample(List<String> samples, Map<String, Map<String, Long>> input,
            String rootTaxid, String what) {
        List<Map<String, Long>> result = new ArrayList<>();
        for (String sample : samples) {
            if (input == null || input.isEmpty()) {
                result.add(Collections.singletonMap(rootTaxid, 1L));
            } else {
                checkArgument(input.containsKey(sample), "no " + what + " for sample " + sample);
                result.add(input.get(sample));
            }
        }
        return result;
    }

    private static MultiTaxonNode growNode(ITaxonomy taxonomy, List<Map<String, Long>> abundances,
            List<Map<String, Long>> accs, List<Map<String, Double>> scores, String taxid, Set<String> path) {
        int numberOfSamples = abundances.size();
        long[] counts = new long[numberOfSamples];
        long[] nodeAccs = new long[numberOfSamples];
        double[] nodeScores = new double[numberOfSamples];
        boolean populated = false;
        for (int i = 0; i < numberOfSamples; i++) {
            counts[i] = countOf(abundances.get(i), taxid);
            nodeAccs[i] = countOf(accs.get(i), taxid);
            Double score = scores.get(i).get(taxid);
            nodeScores[i] = (score == null) ? NO_SCORE : score;
            populated |= nodeAccs[i] != 0;
        }
        if (!populated) {
            return null;
        }
        MultiTaxonNode node = new MultiTaxonNode(taxonomy.rankOf(taxid), counts, nodeAccs, nodeScores);
        path.add(taxid);
        for (String child : taxonomy.childrenOf(taxid)) {
            if (!path.contains(child)) {
                MultiTaxonNode childNode = growNode(taxonomy, abundances, accs, scores, child, path);
                if (childNode != null) {
                    node.addChild(child, childNode);
                }
            }
        }
        path.remove(taxid);
        return node;
    }

    /**
     * Merges shaped single-sample trees. The samples of the new tree follow the
     * iteration order of the map.
     *
     * @param taxonomy the taxonomy the trees were grown from
     * @param trees    the trees, keyed by sample name
     * @return the merged tree
     */
    public static MultiTree merge(ITaxonomy taxonomy, Map<String, TaxTree> trees) {
        checkNotNull(trees, "trees cannot be null");
        List<String> samples = new ArrayList<>(trees.keySet());
        Map<String, Map<String, Long>> abundances = new HashMap<>();
        Map<String, Map<String, Long>> accs = new HashMap<>();
        Map<String, Map<String, Double>> scores = new HashMap<>();
        for (Map.Entry<String, TaxTree> entry : trees.entrySet()) {
            TaxaCollector collector = TaxaCollector.builder().abundances(new HashMap<>()).accs(new HashMap<>())
                    .scores(new HashMap<>()).build();
            entry.getValue().getTaxa(TaxaQuery.all(), collector);
            abundances.put(entry.getKey(), collector.getAbundances());
            accs.put(entry.getKey(), collector.getAccs());
            scores.put(entry.getKey(), collector.getScores());
        }
        return grow(taxonomy, samples, abundances, accs, scores);
    }

    /**
     * @param taxid a taxid
     * @return the node of the taxid in this tree, null if it is not in the tree
     */
    public MultiTaxonNode getNode(String taxid) {
        if (root == null) {
            return null;
        }
        return rootTaxid.equals(taxid) ? root : findNode(root, taxid);
    }

    private static long countOf(Map<String, Long> values, String taxid) {
        Long value = values.get(taxid);
        return (value == null) ? 0L : value;
    }

    private static MultiTaxonNode findNode(MultiTaxonNode node, String taxid) {
        MultiTaxonNode found = node.getChild(taxid);
        if (found != null) {
            return found;
        }
        for (MultiTaxonNode child : node.children().values()) {
            found = findNode(child, taxid);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    public int getNumberOfSamples() {
        return samples.size();
    }

    @Override
    public <R> R traverse(Visitor<R> visitor) {
        checkNotNull(visitor, "visitor cannot be null");
        if (root != null) {
            traverse(rootTaxid, root, 0, visitor);
        }
        return visitor.getResult();
    }

    private void traverse(String taxid, MultiTaxonNode node, int depth, Visitor<?> visitor) {
        visitor.accept(new View(taxid, node), depth);
        for (Map.Entry<String, MultiTaxonNode> entry : node.children().entrySet()) {
            traverse(entry.getKey(), entry.getValue(), depth + 1, visitor);
        }
    }

    /**
     * Renders the tree as {@code taxid[counts]->(child,...)}, writing the counts
     * of all the samples only for taxa with at least {@code numMin} counts in some
     * sample.
     *
     * @param numMin the minimum counts to write the counts of a taxon
     * @return the rendered tree
     */
    public String toString(long numMin) {
        StringBuilder builder = new StringBuilder();
        if (root != null) {
            render(rootTaxid, root, numMin, builder);
        }
        builder.append(')');
        return builder.toString();
    }

    private static void render(String taxid, MultiTaxonNode node, long numMin, StringBuilder builder) {
        if (node.getMaxCount() >= numMin) {
            builder.append(taxid).append(Arrays.toString(node.getCounts()));
        }
        if (node.hasChildren()) {
            builder.append("->(");
            for (Map.Entry<String, MultiTaxonNode> entry : node.children().entrySet()) {
                render(entry.getKey(), entry.getValue(), numMin, builder);
            }
            builder.append(')');
        } else {
            builder.append(',');
        }
    }

    @Override
    public String toString() {
        return toString(1);
    }

    private class View implements ITaxonView {

        private final String taxid;
        private final MultiTaxonNode node;

        View(String taxid, MultiTaxonNode node) {
            this.taxid = taxid;
            this.node = node;
        }

        @Override
        public String getTaxid() {
            return taxid;
        }

        @Override
        public String getName() {
            return taxonomy.nameOf(taxid);
        }

        @Override
        public Rank getRank() {
            return node.getRank();
        }

        @Override
        public long[] getCounts() {
            return node.getCounts();
        }

        @Override
        public long[] getAccs() {
            return node.getAccs();
        }

        @Override
        public double[] getScores() {
            return node.getScores();
        }

        @Override
        public boolean hasChildren() {
            return node.hasChildren();
        }
    }
}
