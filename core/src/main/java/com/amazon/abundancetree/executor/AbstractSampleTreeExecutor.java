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

package com.amazon.abundancetree.executor;

import static com.amazon.abundancetree.CommonUtils.checkArgument;
import static com.amazon.abundancetree.CommonUtils.checkNotNull;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import com.amazon.abundancetree.inputtypes.SampleAbundance;
import com.amazon.abundancetree.tree.TaxTree;

/**
 * Builds one tree per sample. Every sample tree is independent of the others,
 * so implementations are free to build them in any order or concurrently, as
 * long as the result keeps the order of the input samples.
 */
public abstract class AbstractSampleTreeExecutor {

    protected final Function<SampleAbundance, TaxTree> treeBuilder;

    protected AbstractSampleTreeExecutor(Function<SampleAbundance, TaxTree> treeBuilder) {
        this.treeBuilder = checkNotNull(treeBuilder, "treeBuilder cannot be null");
    }

    /**
     * Build a tree for each sample.
     *
     * @param samples the samples, with unique names
     * @return the trees keyed by sample name, in the order of the samples
     */
    public Map<String, TaxTree> buildTrees(List<SampleAbundance> samples) {
        checkNotNull(samples, "samples cannot be null");
        Set<String> names = new HashSet<>();
        for (SampleAbundance sample : samples) {
            checkArgument(names.add(sample.getName()), "duplicate sample " + sample.getName());
        }
        List<TaxTree> trees = build(samples);
        Map<String, TaxTree> result = new LinkedHashMap<>();
        for (int i = 0; i < samples.size(); i++) {
            result.put(samples.get(i).getName(), trees.get(i));
        }
        return result;
    }

    /**
     * @param samples the samples
     * @return the trees, in the order of the samples
     */
    protected abstract List<TaxTree> build(List<SampleAbundance> samples);
}
