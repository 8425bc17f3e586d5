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

import static com.amazon.abundancetree.CommonUtils.checkArgument;
import static com.amazon.abundancetree.CommonUtils.checkNotNull;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.Getter;

import org.apache.log4j.Logger;

import com.amazon.abundancetree.config.Rank;
import com.amazon.abundancetree.executor.AbstractSampleTreeExecutor;
import com.amazon.abundancetree.executor.ParallelSampleTreeExecutor;
import com.amazon.abundancetree.executor.SequentialSampleTreeExecutor;
import com.amazon.abundancetree.inputtypes.SampleAbundance;
import com.amazon.abundancetree.taxonomy.ITaxonomy;
import com.amazon.abundancetree.tree.MultiTree;
import com.amazon.abundancetree.tree.TaxTree;

/**
 * The entry point to summarize the classification results of several samples.
 * Every sample is turned into a {@link TaxTree}, which is grown from the
 * taxonomy, shaped and pruned with the thresholds of the forest; the sample
 * trees are then merged into a {@link MultiTree} for comparison.
 * <p>
 * Sample trees are independent, so they can be built in parallel; the merge
 * waits for all of them.
 */
@Getter
public class AbundanceForest {

    private static final Logger LOGGER = Logger.getLogger(AbundanceForest.class);

    /**
     * Default minimum counts for a taxon to be kept without collapsing.
     */
    public static final long DEFAULT_MIN_TAXA = 1;

    /**
     * Default collapsing of pruned taxa into their parents.
     */
    public static final boolean DEFAULT_COLLAPSE = true;

    /**
     * Parallel execution is disabled by default.
     */
    public static final boolean DEFAULT_PARALLEL_EXECUTION_ENABLED = false;

    private final ITaxonomy taxonomy;

    private final long minTaxa;

    /**
     * the finest rank kept in the sample trees, null for no limit
     */
    private final Rank minRank;

    private final boolean collapse;

    private final boolean parallelExecutionEnabled;

    private final int threadPoolSize;

    private final AbstractSampleTreeExecutor executor;

    protected <T extends Builder<T>> AbundanceForest(Builder<T> builder) {
        this.taxonomy = checkNotNull(builder.taxonomy, "taxonomy cannot be null");
        checkArgument(builder.minTaxa >= 0, "minTaxa must be non-negative");
        this.minTaxa = builder.minTaxa;
        this.minRank = builder.minRank.orElse(null);
        this.collapse = builder.collapse;
        this.parallelExecutionEnabled = builder.parallelExecutionEnabled;

        if (parallelExecutionEnabled) {
            threadPoolSize = builder.threadPoolSize.orElse(Math.max(1, Runtime.getRuntime().availableProcessors() - 1));
            checkArgument(threadPoolSize > 0, "threadPoolSize must be greater than 0");
            executor = new ParallelSampleTreeExecutor(this::buildTree, threadPoolSize);
        } else {
            checkArgument(!builder.threadPoolSize.isPresent(),
                    "threadPoolSize can only be set when parallel execution is enabled");
            threadPoolSize = 0;
            executor = new SequentialSampleTreeExecutor(this::buildTree);
        }
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    /**
     * Grow, shape and prune the tree of one sample.
     *
     * @param sample the classification results of the sample
     * @return the shaped and pruned tree
     */
    public TaxTree buildTree(SampleAbundance sample) {
        checkNotNull(sample, "sample cannot be null");
        TaxTree tree = TaxTree.grow(taxonomy, sample.getName(), sample.getAbundances(), sample.getScores());
        tree.shape();
        tree.prune(minTaxa, minRank, collapse, LOGGER.isDebugEnabled());
        return tree;
    }

    /**
     * @param samples the classification results of the samples
     * @return the shaped and pruned tree of each sample, in the order of the
     *         samples
     */
    public Map<String, TaxTree> buildTrees(List<SampleAbundance> samples) {
        Map<String, TaxTree> trees = executor.buildTrees(samples);
        LOGGER.info("Built " + trees.size() + " sample trees");
        return trees;
    }

    /**
     * @param trees shaped sample trees keyed by sample name
     * @return the tree holding all the samples
     */
    public MultiTree merge(Map<String, TaxTree> trees) {
        MultiTree tree = MultiTree.merge(taxonomy, trees);
        LOGGER.info("Merged " + tree.getNumberOfSamples() + " samples");
        return tree;
    }

    /**
     * Build the tree of every sample and merge them.
     *
     * @param samples the classification results of the samples
     * @return the tree holding all the samples
     */
    public MultiTree summarize(List<SampleAbundance> samples) {
        return merge(buildTrees(samples));
    }

    public static class Builder<T extends Builder<T>> {

        // We use Optional types for optional fields when it doesn't make
        // sense to use a constant default.

        private ITaxonomy taxonomy;
        private long minTaxa = DEFAULT_MIN_TAXA;
        private Optional<Rank> minRank = Optional.empty();
        private boolean collapse = DEFAULT_COLLAPSE;
        private boolean parallelExecutionEnabled = DEFAULT_PARALLEL_EXECUTION_ENABLED;
        private Optional<Integer> threadPoolSize = Optional.empty();

        public T taxonomy(ITaxonomy taxonomy) {
            this.taxonomy = taxonomy;
            return (T) this;
        }

        public T minTaxa(long minTaxa) {
            this.minTaxa = minTaxa;
            return (T) this;
        }

        public T minRank(Rank minRank) {
            this.minRank = Optional.ofNullable(minRank);
            return (T) this;
        }

        public T collapse(boolean collapse) {
            this.collapse = collapse;
            return (T) this;
        }

        public T parallelExecutionEnabled(boolean parallelExecutionEnabled) {
            this.parallelExecutionEnabled = parallelExecutionEnabled;
            return (T) this;
        }

        public T threadPoolSize(int threadPoolSize) {
            this.threadPoolSize = Optional.of(threadPoolSize);
            return (T) this;
        }

        public AbundanceForest build() {
            return new AbundanceForest(this);
        }
    }
}
