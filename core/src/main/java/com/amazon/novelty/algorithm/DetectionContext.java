/*
 * Copyright 2026 Amazon.com, Inc. or its affiliates. All Rights Reserved.
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

package com.amazon.novelty.algorithm;

import java.nio.file.Path;
import java.util.List;

import lombok.Builder;
import lombok.Getter;

import org.slf4j.Logger;

import com.amazon.novelty.config.ResultsConfig;
import com.amazon.novelty.feature.FeatureMatrix;

/**
 * The inputs shared by every algorithm of an experiment. The feature matrices
 * are immutable and the same instances are handed to each algorithm in turn.
 */
@Getter
@Builder
public class DetectionContext {

    /**
     * Features of the data to fit, used to fit or calibrate a model only.
     */
    private final FeatureMatrix fitFeatures;

    /**
     * Features of the data to score; these rows are ranked.
     */
    private final FeatureMatrix scoreFeatures;

    /**
     * Identifiers of the data to score, aligned with the rows of
     * {@link #scoreFeatures}.
     */
    private final List<String> scoreIds;

    /**
     * The experiment output directory. Each algorithm writes below
     * {@code outDir/<algorithm name>}.
     */
    private final Path outDir;

    private final ResultsConfig resultsConfig;

    private final int topN;

    private final Logger logger;

    /**
     * Seeds every stochastic step of the algorithm.
     */
    private final long seed;
}
