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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;

/**
 * The outcome of tracing a batch of taxids. Taxids which could not be traced do
 * not get a lineage, they get a warning instead.
 */
@Getter
public class LineageResult {

    /**
     * for each traced taxid, the taxids from the root down to it
     */
    private final Map<String, List<String>> lineages = new LinkedHashMap<>();

    /**
     * for each taxid which could not be traced, the reason
     */
    private final Map<String, String> warnings = new LinkedHashMap<>();

    void addLineage(String taxid, List<String> lineage) {
        lineages.put(taxid, Collections.unmodifiableList(lineage));
    }

    void addWarning(String taxid, String message) {
        warnings.put(taxid, message);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
