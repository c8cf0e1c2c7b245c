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

import java.util.Random;

import com.amazon.novelty.algorithm.AbstractOutlierDetection;
import com.amazon.novelty.algorithm.AlgorithmParameters;
import com.amazon.novelty.algorithm.ParameterSchema;
import com.amazon.novelty.feature.FeatureMatrix;

/**
 * Baseline that ignores the data and draws every score uniformly from [0, 1).
 * The scores depend on the seed and the number of samples only.
 */
public class RandomOutlierDetection extends AbstractOutlierDetection {

    public static final String NAME = "random";

    public RandomOutlierDetection() {
        super(NAME, ParameterSchema.empty());
    }

    @Override
    protected double[] score(FeatureMatrix fit, FeatureMatrix score, AlgorithmParameters parameters, long seed) {
        Random random = new Random(seed);
        double[] scores = new double[score.getRows()];
        for (int i = 0; i < scores.length; i++) {
            scores[i] = random.nextDouble();
        }
        return scores;
    }
}
