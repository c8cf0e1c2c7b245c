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

import java.util.Arrays;

/**
 * Per-feature mean and divisor computed from the data to fit.
 */
public class NormalizationStatistics {

    private final double[] mean;
    private final double[] standardDeviation;
    private final double[] divisor;

    NormalizationStatistics(double[] mean, double[] standardDeviation, double[] divisor) {
        this.mean = mean;
        this.standardDeviation = standardDeviation;
        this.divisor = divisor;
    }

    public double[] getMean() {
        return Arrays.copyOf(mean, mean.length);
    }

    public double[] getStandardDeviation() {
        return Arrays.copyOf(standardDeviation, standardDeviation.length);
    }

    public double[] getDivisor() {
        return Arrays.copyOf(divisor, divisor.length);
    }

    /**
     * @param matrix a matrix with as many columns as there are statistics
     * @return {@code (x - mean) / divisor} applied to every cell
     */
    public FeatureMatrix apply(FeatureMatrix matrix) {
        double[][] values = matrix.toArray();
        for (double[] row : values) {
            for (int j = 0; j < row.length; j++) {
                row[j] = (row[j] - mean[j]) / divisor[j];
            }
        }
        return new FeatureMatrix(values, matrix.getColumns());
    }
}
