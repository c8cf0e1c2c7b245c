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
 * Summarizes each listed vector field by four columns: mean, population
 * standard deviation, minimum and maximum. A scalar value is treated as a vector
 * of length one.
 */
public class SummaryStatisticsFeature implements FeatureFunction {

    public static final String NAME = "summary_statistics";
    static final int STATISTICS = 4;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public double[][] apply(Dataset dataset, FeatureRecipe.Step step) {
        List<String> fields = step.getFields();
        double[][] result = new double[dataset.size()][STATISTICS * fields.size()];
        for (int f = 0; f < fields.size(); f++) {
            String field = fields.get(f);
            List<Object> values = FeatureExtractor.requireField(dataset, field);
            for (int i = 0; i < values.size(); i++) {
                double[] vector = toVector(field, i, values.get(i));
                for (double x : vector) {
                    FeatureExtractor.requireFinite(x, field, i);
                }
                summarize(vector, result[i], STATISTICS * f);
            }
        }
        return result;
    }

    private static double[] toVector(String field, int sample, Object value) {
        if (value instanceof double[] && ((double[]) value).length > 0) {
            return (double[]) value;
        } else if (value instanceof Number) {
            return new double[] { ((Number) value).doubleValue() };
        }
        throw new FeatureExtractionException(
                String.format("field '%s' holds no numeric values for sample %d", field, sample));
    }

    private static void summarize(double[] vector, double[] target, int offset) {
        double sum = 0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double x : vector) {
            sum += x;
            min = Math.min(min, x);
            max = Math.max(max, x);
        }
        double mean = sum / vector.length;
        double squares = 0;
        for (double x : vector) {
            squares += (x - mean) * (x - mean);
        }
        target[offset] = mean;
        target[offset + 1] = Math.sqrt(squares / vector.length);
        target[offset + 2] = min;
        target[offset + 3] = max;
    }
}
