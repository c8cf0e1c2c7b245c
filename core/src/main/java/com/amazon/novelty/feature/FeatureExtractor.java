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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import com.amazon.novelty.data.Dataset;
import com.amazon.novelty.exception.FeatureExtractionException;

/**
 * Turns datasets into {@link FeatureMatrix} instances according to a
 * {@link FeatureRecipe}. Extraction is deterministic and preserves sample order:
 * row {@code i} of the result describes sample {@code i} of the dataset.
 */
public class FeatureExtractor {

    private final Map<String, FeatureFunction> functions = new LinkedHashMap<>();

    /**
     * Create an extractor that knows the {@code raw_values} and
     * {@code summary_statistics} functions.
     */
    public FeatureExtractor() {
        this(List.of(new RawValuesFeature(), new SummaryStatisticsFeature()));
    }

    public FeatureExtractor(List<FeatureFunction> functions) {
        for (FeatureFunction function : functions) {
            this.functions.put(function.getName(), function);
        }
    }

    /**
     * Extract the features of one dataset.
     *
     * @param dataset the dataset
     * @param recipe  the recipe
     * @return a matrix with one row per sample
     * @throws FeatureExtractionException if the recipe is empty, names an unknown
     *                                    function, or references a missing or
     *                                    non-numeric field
     */
    public FeatureMatrix extract(Dataset dataset, FeatureRecipe recipe) {
        checkNotNull(dataset, "dataset must not be null");
        checkNotNull(recipe, "recipe must not be null");
        if (recipe.getSteps().isEmpty()) {
            throw new FeatureExtractionException("feature recipe is empty");
        }

        List<double[][]> blocks = new ArrayList<>();
        int width = 0;
        for (FeatureRecipe.Step step : recipe.getSteps()) {
            FeatureFunction function = functions.get(step.getExtractor());
            if (function == null) {
                throw new FeatureExtractionException(String.format("unknown feature extractor '%s', expected one of %s",
                        step.getExtractor(), functions.keySet()));
            }
            Set<String> unknown = new TreeSet<>(step.getParams().keySet());
            unknown.remove(FeatureRecipe.FIELDS_PARAM);
            if (!unknown.isEmpty()) {
                throw new FeatureExtractionException(
                        String.format("unknown parameters %s for feature extractor '%s'", unknown, step.getExtractor()));
            }
            double[][] block = function.apply(dataset, step);
            blocks.add(block);
            width += (block.length == 0) ? 0 : block[0].length;
        }

        double[][] result = new double[dataset.size()][width];
        int offset = 0;
        for (double[][] block : blocks) {
            if (block.length == 0) {
                continue;
            }
            for (int i = 0; i < block.length; i++) {
                System.arraycopy(block[i], 0, result[i], offset, block[i].length);
            }
            offset += block[0].length;
        }
        return new FeatureMatrix(result, width);
    }

    /**
     * Extract the features of the fit and score datasets with the same recipe.
     *
     * @param fit    the data to fit
     * @param score  the data to score
     * @param recipe the recipe
     * @return the pair of matrices
     * @throws FeatureExtractionException if both matrices have rows but different
     *                                    widths
     */
    public FeatureMatrix[] extractPair(Dataset fit, Dataset score, FeatureRecipe recipe) {
        FeatureMatrix fitFeatures = extract(fit, recipe);
        FeatureMatrix scoreFeatures = extract(score, recipe);
        if (fitFeatures.getRows() > 0 && scoreFeatures.getRows() > 0
                && fitFeatures.getColumns() != scoreFeatures.getColumns()) {
            throw new FeatureExtractionException(
                    String.format("data to fit has %d features but data to score has %d features",
                            fitFeatures.getColumns(), scoreFeatures.getColumns()));
        }
        return new FeatureMatrix[] { fitFeatures, scoreFeatures };
    }

    /**
     * @throws FeatureExtractionException if the value is NaN or infinite
     */
    static double requireFinite(double value, String field, int sample) {
        if (!Double.isFinite(value)) {
            throw new FeatureExtractionException(
                    String.format("field '%s' holds the non-finite value %s for sample %d", field, value, sample));
        }
        return value;
    }

    static List<Object> requireField(Dataset dataset, String field) {
        if (!dataset.hasField(field)) {
            throw new FeatureExtractionException(
                    String.format("field '%s' is not available, dataset has %s", field, dataset.getFieldNames()));
        }
        return dataset.getField(field);
    }
}
