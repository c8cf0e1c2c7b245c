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

package com.amazon.novelty.driver;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import lombok.Getter;

import com.amazon.novelty.algorithm.AlgorithmParameters;
import com.amazon.novelty.algorithm.OutlierDetectionAlgorithm;
import com.amazon.novelty.config.ExperimentConfig;
import com.amazon.novelty.data.DataLoader;
import com.amazon.novelty.feature.FeatureRecipe;

/**
 * Everything an experiment needs once its configuration has been resolved
 * against the registries: nothing in a plan can fail to resolve later.
 */
@Getter
public class ExperimentPlan {

    private final ExperimentConfig config;
    private final DataLoader dataLoader;
    private final Map<String, Object> loaderParams;
    private final FeatureRecipe recipe;
    private final Path outDir;
    private final List<PlannedRun> runs;

    ExperimentPlan(ExperimentConfig config, DataLoader dataLoader, Map<String, Object> loaderParams,
            FeatureRecipe recipe, Path outDir, List<PlannedRun> runs) {
        this.config = config;
        this.dataLoader = dataLoader;
        this.loaderParams = loaderParams;
        this.recipe = recipe;
        this.outDir = outDir;
        this.runs = List.copyOf(runs);
    }

    /**
     * One configured algorithm with its validated parameters.
     */
    @Getter
    public static class PlannedRun {
        private final String name;
        private final OutlierDetectionAlgorithm algorithm;
        private final AlgorithmParameters parameters;

        PlannedRun(String name, OutlierDetectionAlgorithm algorithm, AlgorithmParameters parameters) {
            this.name = name;
            this.algorithm = algorithm;
            this.parameters = parameters;
        }
    }
}
