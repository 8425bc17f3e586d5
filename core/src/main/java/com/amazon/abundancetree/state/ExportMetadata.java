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

import static com.amazon.abundancetree.CommonUtils.checkArgument;
import static com.amazon.abundancetree.CommonUtils.checkNotNull;

import java.util.Optional;

import lombok.Getter;

import com.amazon.abundancetree.config.Scoring;

/**
 * Display metadata attached to an exported tree: the number of raw samples (the
 * samples which do not come from a cross-sample analysis), the score range used
 * to color the taxa and the scoring scheme which labels the scores.
 */
@Getter
public class ExportMetadata {

    public static final double DEFAULT_MIN_SCORE = 0.0;
    public static final double DEFAULT_MAX_SCORE = 1.0;
    public static final Scoring DEFAULT_SCORING = Scoring.SHEL;

    private final Optional<Integer> numRawSamples;
    private final double minScore;
    private final double maxScore;
    private final Scoring scoring;

    protected ExportMetadata(Builder builder) {
        checkArgument(builder.minScore <= builder.maxScore, "minScore cannot be larger than maxScore");
        this.numRawSamples = builder.numRawSamples;
        this.minScore = builder.minScore;
        this.maxScore = builder.maxScore;
        this.scoring = builder.scoring;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {

        private Optional<Integer> numRawSamples = Optional.empty();
        private double minScore = DEFAULT_MIN_SCORE;
        private double maxScore = DEFAULT_MAX_SCORE;
        private Scoring scoring = DEFAULT_SCORING;

        public Builder numRawSamples(int numRawSamples) {
            checkArgument(numRawSamples >= 0, "numRawSamples must be non-negative");
            this.numRawSamples = Optional.of(numRawSamples);
            return this;
        }

        public Builder minScore(double minScore) {
            this.minScore = minScore;
            return this;
        }

        public Builder maxScore(double maxScore) {
            this.maxScore = maxScore;
            return this;
        }

        public Builder scoring(Scoring scoring) {
            this.scoring = checkNotNull(scoring, "scoring cannot be null");
            return this;
        }

        /**
         * @param scoring the name of a scoring scheme
         * @return this builder
         * @throws IllegalArgumentException if the scheme is unknown
         */
        public Builder scoring(String scoring) {
            this.scoring = Scoring.fromName(scoring);
            return this;
        }

        public ExportMetadata build() {
            return new ExportMetadata(this);
        }
    }
}
