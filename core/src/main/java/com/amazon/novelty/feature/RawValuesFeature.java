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

import java.util.List;

import com.amazon.novelty.data.Dataset;
import com.amazon.novelty.exception.FeatureExtractionException;

/**
 * Copies the values of the listed fields. A scalar field contributes one column;
 * a vector field is flattened into as many columns as its length, which has to
 * be the same for every sample.
 */
public class RawValuesFeature implements FeatureFunction {

    public static final String NAME = "raw_values";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public double[][] apply(Dataset dataset, FeatureRecipe.Step step) {
        List<String> fields = step.getFields();
        int rows = dataset.size();
        double[][][] blocks = new double[fields.size()][][];
        int width = 0;
        for (int f = 0; f < fields.size(); f++) {
            blocks[f] = flatten(dataset, fields.get(f));
            width += rows == 0 ? 0 : blocks[f][0].length;
        }

        double[][] result = new double[rows][width];
        for (int i = 0; i < rows; i++) {
            int offset = 0;
            for (double[][] block : blocks) {
                System.arraycopy(block[i], 0, result[i], offset, block[i].length);
                offset += block[i].length;
            }
        }
        return result;
    }

    private double[][] flatten(Dataset dataset, String field) {
        List<Object> values = FeatureExtractor.requireField(dataset, field);
        double[][] result = new double[values.size()][];
        for (int i = 0; i < values.size(); i++) {
            Object value = values.get(i);
            if (value instanceof Number) {
                result[i] = new double[] { ((Number) value).doubleValue() };
            } else if (value instanceof double[]) {
                result[i] = ((double[]) value).clone();
            } else {
                throw new FeatureExtractionException(
                        String.format("field '%s' holds a non-numeric value for sample %d", field, i));
            }
            for (double x : result[i]) {
                FeatureExtractor.requireFinite(x, field, i);
            }
            if (i > 0 && result[i].length != result[0].length) {
                throw new FeatureExtractionException(String.format(
                        "field '%s' has vectors of length %d and %d", field, result[0].length, result[i].length));
            }
        }
        return result;
    }
}
