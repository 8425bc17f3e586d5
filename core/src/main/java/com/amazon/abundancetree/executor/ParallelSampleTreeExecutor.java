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

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ForkJoinPool;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.amazon.abundancetree.inputtypes.SampleAbundance;
import com.amazon.abundancetree.tree.TaxTree;

/**
 * An implementation of the sample tree executor that uses a private thread pool
 * to build the trees in parallel.
 */
public class ParallelSampleTreeExecutor extends AbstractSampleTreeExecutor {

    private final ForkJoinPool forkJoinPool;
    private final int threadPoolSize;

    public ParallelSampleTreeExecutor(Function<SampleAbundance, TaxTree> treeBuilder, int threadPoolSize) {
        super(treeBuilder);
        checkArgument(threadPoolSize > 0, "threadPoolSize must be greater than 0");
        this.threadPoolSize = threadPoolSize;
        forkJoinPool = new ForkJoinPool(threadPoolSize);
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    @Override
    protected List<TaxTree> build(List<SampleAbundance> samples) {
        return submitAndJoin(() -> samples.parallelStream().map(treeBuilder).collect(Collectors.toList()));
    }

    private <T> T submitAndJoin(Callable<T> callable) {
        return forkJoinPool.submit(callable).join();
    }
}
