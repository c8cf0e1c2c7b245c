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

import static com.amazon.novelty.CommonUtils.squaredDistance;

import java.util.Arrays;

import com.amazon.novelty.algorithm.AbstractOutlierDetection;
import com.amazon.novelty.algorithm.AlgorithmParameters;
import com.amazon.novelty.algorithm.ParameterDefinition;
import com.amazon.novelty.algorithm.ParameterSchema;
import com.amazon.novelty.feature.FeatureMatrix;

/**
 * Scores a sample by its mean Euclidean distance to its {@code k} nearest
 * samples in the data to fit. When there are fewer than {@code k} samples to fit
 * all of them are used.
 */
public class KnnOutlierDetection extends AbstractOutlierDetection {

    public static final String NAME = "knn";
    public static final String NEIGHBORS_PARAM = "k";
    public static final int DEFAULT_NEIGHBORS = 5;

    public KnnOutlierDetection() {
        super(NAME, ParameterSchema.of(
                ParameterDefinition.integer(NEIGHBORS_PARAM, DEFAULT_NEIGHBORS, 1, "number of nearest neighbors")));
    }

    @Override
    protected double[] score(FeatureMatrix fit, FeatureMatrix score, AlgorithmParameters parameters, long seed) {
        requireFitRows(fit, 1);
        int k = Math.min(parameters.getInt(NEIGHBORS_PARAM), fit.getRows());
        double[][] reference = fit.toArray();

        double[] scores = new double[score.getRows()];
        double[] distances = new double[reference.length];
        for (int i = 0; i < scores.length; i++) {
            double[] point = score.getRow(i);
            for (int j = 0; j < reference.length; j++) {
                distances[j] = Math.sqrt(squaredDistance(point, reference[j]));
            }
            Arrays.sort(distances);
            double sum = 0;
            for (int j = 0; j < k; j++) {
                sum += distances[j];
            }
            scores[i] = sum / k;
        }
        return scores;
    }
}
