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

package com.amazon.abundancetree.config;

import static com.amazon.abundancetree.CommonUtils.checkArgument;

import java.util.Locale;

/**
 * The scheme used to compute the per-read scores carried by the trees. It only
 * determines how the score attribute is labelled when a tree is exported.
 */
public enum Scoring {

    /**
     * single hit equivalent length, the classifier confidence
     */
    SHEL("Confidence (avg)"),
    /**
     * read length
     */
    LENGTH("Read length (avg)"),
    /**
     * log10 of the read length
     */
    LOGLENGTH("Read length (avg, log10)"),
    /**
     * confidence normalized by read length
     */
    NORMA("Confidence/Length (%)"),
    /**
     * score reported by LMAT
     */
    LMAT("LMAT score (avg)");

    private final String display;

    Scoring(String display) {
        this.display = display;
    }

    public String getDisplay() {
        return display;
    }

    /**
     * Looks up a scoring scheme by name, ignoring case.
     *
     * @param name the identifier of the scheme
     * @return the scoring scheme
     * @throws IllegalArgumentException if the identifier is unknown
     */
    public static Scoring fromName(String name) {
        checkArgument(name != null, "scoring scheme cannot be null");
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (Scoring scoring : values()) {
            if (scoring.name().equals(normalized)) {
                return scoring;
            }
        }
        throw new IllegalArgumentException("Unknown scoring scheme \"" + name + "\"");
    }
}
