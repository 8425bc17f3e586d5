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
import static com.amazon.abundancetree.CommonUtils.weightedScore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

import lombok.Getter;

import org.apache.log4j.Logger;

import com.amazon.abundancetree.ITraversable;
import com.amazon.abundancetree.Visitor;
import com.amazon.abundancetree.config.Rank;
import com.amazon.abundancetree.taxonomy.ITaxonomy;

/**
 * A single-sample abundance tree. The tree mirrors the taxonomy below its root
 * taxid and carries, for every taxon, the counts directly assigned to it in the
 * sample and optionally a score.
 * <p>
 * The usual lifecycle is {@link #grow}, then {@link #shape()} to accumulate
 * counts and drop empty branches, then optionally {@link #prune} to collapse
 * low abundance taxa, after which the tree is only read: taxa extraction,
 * lineage tracing and export. A tree is not thread-safe, but distinct trees can
 * be built concurrently from the same taxonomy.
 */
@Getter
public class TaxTree implements ITraversable {

    private static final Logger LOGGER = Logger.getLogger(TaxTree.class);

    public static final String DEFAULT_SAMPLE = "sample";

    private final ITaxonomy taxonomy;

    private final String sample;

    private final String rootTaxid;

    private final TaxonNode root;

    protected TaxTree(ITaxonomy taxonomy, String sample, String rootTaxid, TaxonNode root) {
        this.taxonomy = taxonomy;
        this.sample = sample;
        this.rootTaxid = rootTaxid;
        this.root = root;
    }

    public static TaxTree grow(ITaxonomy taxonomy, Map<String, Long> abundances, Map<String, Double> scores) {
        return grow(taxonomy, DEFAULT_SAMPLE, abundances, scores);
    }

    public static TaxTree grow(ITaxonomy taxonomy, String sample, Map<String, Long> abundances,
            Map<String, Double> scores) {
        return grow(taxonomy, sample, abundances, scores, checkNotNull(taxonomy, "taxonomy cannot be null").getRoot());
    }

    /**
     * Builds the tree below a taxid. A node is created for every taxid reachable
     * from the start taxid in the taxonomy, except for taxids already on the path
     * from the start taxid, which end that branch.
     *
     * @param taxonomy   the taxonomy to mirror
     * @param sample     the name of the sample
     * @param abundances counts directly assigned to each taxid; if null or empty,
     *                   a single count on the root of the taxonomy
     * @param scores     score of each taxid, may be null
     * @param taxid      the taxid at the root of the new tree
     * @return the new tree, with no accumulated counts yet
     */
    public static TaxTree grow(ITaxonomy taxonomy, String sample, Map<String, Long> abundances,
            Map<String, Double> scores, String taxid) {
        checkNotNull(taxonomy, "taxonomy cannot be null");
        checkNotNull(sample, "sample cannot be null");
        checkNotNull(taxid, "taxid cannot be null");
        Map<String, Long> counts = (abundances == null || abundances.isEmpty())
                ? Collections.singletonMap(taxonomy.getRoot(), 1L)
                : abundances;
        Map<String, Double> taxScores = (scores == null) ? Collections.emptyMap() : scores;
        TaxonNode root = growNode(taxonomy, counts, taxScores, taxid, new HashSet<>());
        return new TaxTree(taxonomy, sample, taxid, root);
    }

    private static TaxonNode growNode(ITaxonomy taxonomy, Map<String, Long> abundances, Map<String, Double> scores,
            String taxid, Set<String> path) {
        Long counts = abundances.get(taxid);
        Double score = scores.get(taxid);
        TaxonNode node = new TaxonNode((counts == null) ? 0L : counts, taxonomy.rankOf(taxid),
                (score == null) ? NO_SCORE : score);
        path.add(taxid);
        for (String child : taxonomy.childrenOf(taxid)) {
            if (!path.contains(child)) {
                node.addChild(child, growNode(taxonomy, abundances, scores, child, path));
            }
        }
        path.remove(taxid);
        return node;
    }

    /**
     * Accumulates counts from the leaves up, removing the branches without counts.
     * Taxa without directly assigned counts get the average of the scores of their
     * children, weighted by the accumulated counts of the children. Calling this
     * method again on a shaped tree does not change it.
     */
    public void shape() {
        shape(root);
    }

    private static void shape(TaxonNode node) {
        long acc = node.getCounts();
        Iterator<TaxonNode> children = node.children().values().iterator();
        while (children.hasNext()) {
            TaxonNode child = children.next();
            shape(child);
            if (child.getAcc() == 0) {
                children.remove();
            } else {
                acc += child.getAcc();
            }
        }
        node.setAcc(acc);
        if (node.getCounts() == 0 && acc > 0) {
            node.setScore(childrenScore(node));
        }
    }

    private static double childrenScore(TaxonNode node) {
        double sum = 0;
        long total = 0;
        for (TaxonNode child : node.children().values()) {
            if (child.hasScore()) {
                sum += child.getScore() * child.getAcc();
                total += child.getAcc();
            }
        }
        return (total == 0) ? NO_SCORE : sum / total;
    }

    public boolean prune(long minTaxa, Rank minRank, boolean collapse) {
        return prune(minTaxa, minRank, collapse, false);
    }

    /**
     * Removes leaves with fewer than {@code minTaxa} counts and, if
     * {@code minRank} is set, leaves finer than {@code minRank} or hanging from a
     * taxon at or below {@code minRank}. Branches are pruned bottom-up, so a taxon
     * which loses all its children becomes a leaf that can be pruned in turn. The
     * root is never removed.
     *
     * @param minTaxa  the minimum counts for a leaf to be kept
     * @param minRank  the finest rank allowed in the tree, null for no limit
     * @param collapse if true, the counts of a removed leaf are added to its
     *                 parent; if false they are subtracted from the accumulated
     *                 counts of the parent
     * @param debug    if true, every decision is logged at debug level
     * @return true if the root still has children after pruning
     */
    public boolean prune(long minTaxa, Rank minRank, boolean collapse, boolean debug) {
        checkArgument(minTaxa >= 0, "minTaxa must be non-negative");
        return prune(root, minTaxa, minRank, collapse, debug);
    }

    private static boolean prune(TaxonNode node, long minTaxa, Rank minRank, boolean collapse, boolean debug) {
        Iterator<Map.Entry<String, TaxonNode>> entries = node.children().entrySet().iterator();
        while (entries.hasNext()) {
            Map.Entry<String, TaxonNode> entry = entries.next();
            TaxonNode child = entry.getValue();
            if (child.hasChildren() && prune(child, minTaxa, minRank, collapse, debug)) {
                if (debug) {
                    LOGGER.debug("Not pruning branch " + entry.getKey() + ", counts=" + child.getCounts());
                }
                continue;
            }
            if (child.getCounts() < minTaxa || (minRank != null
                    && (child.getRank().isFinerThan(minRank) || node.getRank().isAtOrFinerThan(minRank)))) {
                if (collapse) {
                    long collapsedCounts = node.getCounts() + child.getCounts();
                    if (collapsedCounts > 0) {
                        node.setScore(weightedScore(node.getScore(), node.getCounts(), child.getScore(),
                                child.getCounts()));
                        node.setCounts(collapsedCounts);
                    }
                } else {
                    node.setAcc(Math.max(0, node.getAcc() - child.getCounts()));
                }
                if (debug && child.getCounts() > 0) {
                    LOGGER.debug("Pruning branch " + entry.getKey() + ", counts=" + child.getCounts());
                }
                entries.remove();
            } else if (debug) {
                LOGGER.debug("Not pruning leaf " + entry.getKey() + ", counts=" + child.getCounts());
            }
        }
        return node.hasChildren();
    }

    /**
     * Records the taxa selected by the query into the outputs of the collector.
     *
     * @param query     depth bounds, subtrees and rank to extract
     * @param collector the outputs to fill
     */
    public void getTaxa(TaxaQuery query, TaxaCollector collector) {
        checkNotNull(query, "query cannot be null");
        checkNotNull(collector, "collector cannot be null");
        int maxdepth = (query.getMaxdepth() == 0) ? 0 : query.getMaxdepth() + 1;
        getTaxa(rootTaxid, root, query, collector, query.getMindepth(), maxdepth, false);
    }

    private static void getTaxa(String taxid, TaxonNode node, TaxaQuery query, TaxaCollector collector, int mindepth,
            int maxdepth, boolean inBranch) {
        boolean branch = isInBranch(taxid, query, inBranch);
        if (isSelected(node, query, mindepth, branch)) {
            collector.record(taxid, node);
        }
        if (maxdepth != 1) {
            for (Map.Entry<String, TaxonNode> entry : node.children().entrySet()) {
                getTaxa(entry.getKey(), entry.getValue(), query, collector, mindepth - 1, maxdepth - 1, branch);
            }
        }
    }

    /**
     * A taxon is in branch when it or an ancestor is included, or nothing is
     * included, and the taxon itself is not excluded. Exclusion only applies to
     * the excluded taxon: its descendants are still in branch if included or if
     * nothing is included.
     */
    private static boolean isInBranch(String taxid, TaxaQuery query, boolean inBranch) {
        return (inBranch || query.getInclude().isEmpty() || query.getInclude().contains(taxid))
                && !query.getExclude().contains(taxid);
    }

    private static boolean isSelected(TaxonNode node, TaxaQuery query, int mindepth, boolean branch) {
        return mindepth <= 0 && branch && (query.getJustLevel() == null || node.getRank() == query.getJustLevel());
    }

    /**
     * Collects the taxids on the path from the root of the tree to the target.
     * Only taxa below the root can be traced.
     *
     * @param target the taxid to find
     * @param nodes  output list, empty at the first call; on success it holds the
     *               path from the root to the target, both included
     * @return true if the target was found
     */
    public boolean trace(String target, List<String> nodes) {
        return trace(rootTaxid, root, target, nodes);
    }

    private boolean trace(String taxid, TaxonNode node, String target, List<String> nodes) {
        if (!node.hasChildren()) {
            return false;
        }
        nodes.add(taxid);
        if (node.children().containsKey(target) && !target.equals(rootTaxid)) {
            nodes.add(target);
            return true;
        }
        for (Map.Entry<String, TaxonNode> entry : node.children().entrySet()) {
            if (trace(entry.getKey(), entry.getValue(), target, nodes)) {
                return true;
            }
        }
        nodes.remove(nodes.size() - 1);
        return false;
    }

    /**
     * Finds the lineage of each taxid, using the taxonomy of the tree to tell
     * unknown taxids apart.
     *
     * @param taxids the taxids to trace
     * @return the lineages found and a warning for each taxid which was not
     */
    public LineageResult getLineage(Iterable<String> taxids) {
        return getLineage(taxonomy::contains, taxids);
    }

    /**
     * Finds the lineage of each taxid. Taxids missing in the parents map or in the
     * tree are reported as warnings and do not stop the batch.
     *
     * @param parents the parent of every known taxid
     * @param taxids  the taxids to trace
     * @return the lineages found and a warning for each taxid which was not
     */
    public LineageResult getLineage(Map<String, String> parents, Iterable<String> taxids) {
        checkNotNull(parents, "parents cannot be null");
        return getLineage(parents::containsKey, taxids);
    }

    private LineageResult getLineage(Predicate<String> known, Iterable<String> taxids) {
        checkNotNull(taxids, "taxids cannot be null");
        LineageResult result = new LineageResult();
        for (String taxid : taxids) {
            if (rootTaxid.equals(taxid)) {
                result.addLineage(taxid, Collections.singletonList(rootTaxid));
            } else if (known.test(taxid)) {
                List<String> nodes = new ArrayList<>();
                if (trace(taxid, nodes)) {
                    result.addLineage(taxid, nodes);
                } else {
                    String message = "Failed tracing of taxid " + taxid + ": missing in tree";
                    LOGGER.warn(message);
                    result.addWarning(taxid, message);
                }
            } else {
                String message = "Discarded unknown taxid " + taxid + ": missing in parents";
                LOGGER.warn(message);
                result.addWarning(taxid, message);
            }
        }
        return result;
    }

    /**
     * @param taxid a taxid
     * @return the node of the taxid in this tree, null if it is not in the tree
     */
    public TaxonNode getNode(String taxid) {
        return rootTaxid.equals(taxid) ? root : findNode(root, taxid);
    }

    private static TaxonNode findNode(TaxonNode node, String taxid) {
        TaxonNode found = node.getChild(taxid);
        if (found != null) {
            return found;
        }
        for (TaxonNode child : node.children().values()) {
            found = findNode(child, taxid);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    /**
     * @return the number of nodes in the tree
     */
    public int size() {
        return size(root);
    }

    private static int size(TaxonNode node) {
        int size = 1;
        for (TaxonNode child : node.children().values()) {
            size += size(child);
        }
        return size;
    }

    @Override
    public List<String> getSamples() {
        return Collections.singletonList(sample);
    }

    @Override
    public <R> R traverse(Visitor<R> visitor) {
        checkNotNull(visitor, "visitor cannot be null");
        traverse(rootTaxid, root, 0, visitor);
        return visitor.getResult();
    }

    private void traverse(String taxid, TaxonNode node, int depth, Visitor<?> visitor) {
        visitor.accept(new View(taxid, node), depth);
        for (Map.Entry<String, TaxonNode> entry : node.children().entrySet()) {
            traverse(entry.getKey(), entry.getValue(), depth + 1, visitor);
        }
    }

    /**
     * Visits only the taxa that {@link #getTaxa} would select for the query, in
     * pre-order. The depth passed to the visitor is the number of visited
     * ancestors of a taxon, so a visitor that rebuilds a hierarchy attaches every
     * taxon to its closest visited ancestor, and taxa without one are at depth 0.
     *
     * @param visitor the visitor to apply
     * @param query   depth bounds, subtrees and rank to visit
     * @param <R>     the type of the visitor result
     * @return the result of the visitor
     */
    public <R> R traverse(Visitor<R> visitor, TaxaQuery query) {
        checkNotNull(visitor, "visitor cannot be null");
        checkNotNull(query, "query cannot be null");
        int maxdepth = (query.getMaxdepth() == 0) ? 0 : query.getMaxdepth() + 1;
        traverse(rootTaxid, root, query, visitor, query.getMindepth(), maxdepth, false, 0);
        return visitor.getResult();
    }

    private void traverse(String taxid, TaxonNode node, TaxaQuery query, Visitor<?> visitor, int mindepth,
            int maxdepth, boolean inBranch, int visitedAncestors) {
        boolean branch = isInBranch(taxid, query, inBranch);
        int childAncestors = visitedAncestors;
        if (isSelected(node, query, mindepth, branch)) {
            visitor.accept(new View(taxid, node), visitedAncestors);
            childAncestors++;
        }
        if (maxdepth != 1) {
            for (Map.Entry<String, TaxonNode> entry : node.children().entrySet()) {
                traverse(entry.getKey(), entry.getValue(), query, visitor, mindepth - 1, maxdepth - 1, branch,
                        childAncestors);
            }
        }
    }

    /**
     * @return a read-only view of the root of the tree
     */
    public ITaxonView getRootView() {
        return new View(rootTaxid, root);
    }

    /**
     * Renders the tree as {@code taxid[counts]->(child,...)}, writing the counts
     * only for taxa with at least {@code numMin} counts.
     *
     * @param numMin the minimum counts to write the counts of a taxon
     * @return the rendered tree
     */
    public String toString(long numMin) {
        StringBuilder builder = new StringBuilder();
        render(rootTaxid, root, numMin, builder);
        builder.append(')');
        return builder.toString();
    }

    private static void render(String taxid, TaxonNode node, long numMin, StringBuilder builder) {
        if (node.getCounts() >= numMin) {
            builder.append(taxid).append('[').append(node.getCounts()).append(']');
        }
        if (node.hasChildren()) {
            builder.append("->(");
            for (Map.Entry<String, TaxonNode> entry : node.children().entrySet()) {
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
        private final TaxonNode node;

        View(String taxid, TaxonNode node) {
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
            return new long[] { node.getCounts() };
        }

        @Override
        public long[] getAccs() {
            return new long[] { node.getAcc() };
        }

        @Override
        public double[] getScores() {
            return new double[] { node.getScore() };
        }

        @Override
        public boolean hasChildren() {
            return node.hasChildren();
        }
    }
}
