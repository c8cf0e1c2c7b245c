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

package com.amazon.novelty.feature;

import static com.amazon.novelty.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.amazon.novelty.exception.FeatureExtractionException;

/**
 * An ordered list of feature extractor invocations. Each step names an
 * extractor and carries its parameters; the columns produced by the steps are
 * concatenated in step order.
 */
public class FeatureRecipe {

    public static final String FIELDS_PARAM = "fields";

    private final List<Step> steps;

    private FeatureRecipe(List<Step> steps) {
        this.steps = Collections.unmodifiableList(steps);
    }

    /**
     * Build a recipe from the configuration mapping of extractor name to
     * parameters. Iteration order of the mapping is the column order.
     *
     * @param configuration the {@code features} section of the configuration
     * @return the recipe
     */
    public static FeatureRecipe fromConfiguration(Map<String, Map<String, Object>> configuration) {
        checkNotNull(configuration, "feature configuration must not be null");
        List<Step> steps = new ArrayList<>();
        for (Map.Entry<String, Map<String, Object>> entry : configuration.entrySet()) {
            Map<String, Object> params = (entry.getValue() == null) ? Collections.emptyMap() : entry.getValue();
            steps.add(new Step(entry.getKey(), params));
        }
        return new FeatureRecipe(steps);
    }

    public List<Step> getSteps() {
        return steps;
    }

    public static class Step {
        private final String extractor;
        private final Map<String, Object> params;

        Step(String extractor, Map<String, Object> params) {
            this.extractor = extractor;
            this.params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
        }

        public String getExtractor() {
            return extractor;
        }

        public Map<String, Object> getParams() {
            return params;
        }

        /**
         * @return the {@value FeatureRecipe#FIELDS_PARAM} parameter as a list of field
         *         names
         * @throws FeatureExtractionException if the parameter is missing or empty
         */
        public List<String> getFields() {
            Object value = params.get(FIELDS_PARAM);
            if (value instanceof String) {
                return List.of((String) value);
            }
            if (!(value instanceof List) || ((List<?>) value).isEmpty()) {
                throw new FeatureExtractionException(
                        String.format("feature extractor '%s' requires a non-empty '%s' list", extractor, FIELDS_PARAM));
            }
            List<String> fields = new ArrayList<>();
            for (Object field : (List<?>) value) {
                fields.add(String.valueOf(field));
            }
            return fields;
        }
    }
}
