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

import java.util.List;

import lombok.Data;

/**
 * A generic hierarchical representation of a tree, ready to be written by an
 * exporter.
 */
@Data
public class TreeExportState {

    private String version = Version.V1_0;

    private List<String> samples;

    private int numRawSamples;

    private double minScore;

    private double maxScore;

    private String scoring;

    private String scoreDisplay;

    private TaxonNodeState root;
}
