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

package com.amazon.novelty.config;

import java.util.LinkedHashMap;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import com.amazon.novelty.exception.ConfigurationException;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * An experiment configuration. Property names follow the snake case used in
 * configuration files, for example {@code data_to_fit} or {@code top_n}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ExperimentConfig {

    private DataLoaderConfig dataLoader;
    private String dataToFit;
    private String dataToScore;

    /**
     * Feature extractor name to extractor parameters, in column order.
     */
    private Map<String, Map<String, Object>> features;

    @Builder.Default
    private boolean zscoreNormalization = false;

    /**
     * Algorithm name to algorithm parameters, in execution order. A null parameter
     * mapping means the algorithm runs with its defaults.
     */
    private Map<String, Map<String, Object>> outlierDetection;

    private String outDir;

    @Builder.Default
    private ResultsConfig results = new ResultsConfig();

    private Integer topN;

    /**
     * When true a failing algorithm is recorded and the remaining algorithms still
     * run; the failures are reported once all algorithms have been attempted.
     */
    @Builder.Default
    private boolean continueOnError = false;

    /**
     * @param outDir the output directory that replaces the configured one
     * @return a copy of this configuration using the given output directory
     */
    public ExperimentConfig withOutDir(String outDir) {
        return toBuilder().outDir(outDir).build();
    }

    /**
     * Check that every required field is present and well formed.
     *
     * @throws ConfigurationException describing the first problem found
     */
    public void validate() {
        if (dataLoader == null || dataLoader.getName() == null || dataLoader.getName().isBlank()) {
            throw new ConfigurationException("missing required field 'data_loader.name'");
        }
        require(dataToFit, "data_to_fit");
        require(dataToScore, "data_to_score");
        require(outDir, "out_dir");
        if (features == null || features.isEmpty()) {
            throw new ConfigurationException("missing required field 'features'");
        }
        if (outlierDetection == null || outlierDetection.isEmpty()) {
            throw new ConfigurationException("missing required field 'outlier_detection'");
        }
        if (topN == null) {
            throw new ConfigurationException("missing required field 'top_n'");
        }
        if (topN <= 0) {
            throw new ConfigurationException("top_n must be a positive integer, got " + topN);
        }
    }

    /**
     * @return the algorithms in configuration order, with empty parameter mappings
     *         in place of null ones
     */
    public Map<String, Map<String, Object>> resolveAlgorithms() {
        Map<String, Map<String, Object>> result = new LinkedHashMap<>();
        if (outlierDetection != null) {
            outlierDetection.forEach((name, params) -> result.put(name,
                    (params == null) ? new LinkedHashMap<>() : new LinkedHashMap<>(params)));
        }
        return result;
    }

    private static void require(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("missing required field '" + field + "'");
        }
    }
}
