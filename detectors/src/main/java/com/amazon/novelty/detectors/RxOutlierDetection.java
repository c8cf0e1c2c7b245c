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

package com.amazon.novelty.detectors;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.apache.commons.math3.stat.correlation.Covariance;

import com.amazon.novelty.algorithm.AbstractOutlierDetection;
import com.amazon.novelty.algorithm.AlgorithmParameters;
import com.amazon.novelty.algorithm.ParameterSchema;
import com.amazon.novelty.feature.FeatureMatrix;

/**
 * Reed-Xiaoli detector: the score of a sample is its squared Mahalanobis
 * distance to the mean of the data to fit. The inverse of the covariance is the
 * Moore-Penrose pseudo-inverse, so collinear or constant features are allowed.
 */
public class RxOutlierDetection extends AbstractOutlierDetection {

    public static final String NAME = "rx";

    public RxOutlierDetection() {
        super(NAME, ParameterSchema.empty());
    }

    @Override
    protected double[] score(FeatureMatrix fit, FeatureMatrix score, AlgorithmParameters parameters, long seed) {
        requireFitRows(fit, 2);
        RealMatrix data = new Array2DRowRealMatrix(fit.toArray(), false);
        RealMatrix covariance = new Covariance(data, true).getCovarianceMatrix();
        RealMatrix precision = new SingularValueDecomposition(covariance).getSolver().getInverse();

        double[] mean = new double[fit.getColumns()];
        for (int j = 0; j < mean.length; j++) {
            double[] column = fit.getColumn(j);
            double sum = 0;
            for (double value : column) {
                sum += value;
            }
            mean[j] = sum / column.length;
        }
        RealVector center = new ArrayRealVector(mean, false);

        double[] scores = new double[score.getRows()];
        for (int i = 0; i < scores.length; i++) {
            RealVector difference = new ArrayRealVector(score.getRow(i), false).subtract(center);
            scores[i] = difference.dotProduct(precision.operate(difference));
        }
        return scores;
    }
}
