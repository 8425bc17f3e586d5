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

package com.amazon.abundancetree.state;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;

/**
 * A node of an exported tree. The lists hold one value per sample. Zero counts
 * and missing scores are written as null, and {@code unassigned} is null
 * altogether when no sample has counts directly assigned to the taxon.
 */
@Data
public class TaxonNodeState {

    private String name;

    private String taxid;

    private String rank;

    /**
     * accumulated counts per sample
     */
    private List<Long> count;

    /**
     * counts directly assigned to the taxon per sample
     */
    private List<Long> unassigned;

    private List<Double> score;

    private List<TaxonNodeState> children = new ArrayList<>();
}
