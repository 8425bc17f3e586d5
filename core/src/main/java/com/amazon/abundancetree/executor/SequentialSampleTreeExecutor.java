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

import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.amazon.abundancetree.inputtypes.SampleAbundance;
import com.amazon.abundancetree.tree.TaxTree;

/**
 * Build the sample trees one after the other, in the calling thread.
 */
public class SequentialSampleTreeExecutor extends AbstractSampleTreeExecutor {

    public SequentialSampleTreeExecutor(Function<SampleAbundance, TaxTree> treeBuilder) {
        super(treeBuilder);
    }

    @Override
    protected List<TaxTree> build(List<SampleAbundance> samples) {
        return samples.stream().map(treeBuilder).collect(Collectors.toList());
    }
}
