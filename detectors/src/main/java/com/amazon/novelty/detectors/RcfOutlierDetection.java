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

import com.amazon.novelty.algorithm.AbstractOutlierDetection;
import com.amazon.novelty.algorithm.AlgorithmParameters;
import com.amazon.novelty.algorithm.ParameterDefinition;
import com.amazon.novelty.algorithm.ParameterSchema;
import com.amazon.novelty.feature.FeatureMatrix;
import com.amazon.randomcutforest.RandomCutForest;

/**
 * Random Cut Forest anomaly scores. The forest is trained on the data to fit in
 * row order and is not updated while the data to score is scored, so every
 * score sample sees the same model.
 */
public class RcfOutlierDetection extends AbstractOutlierDetection {

    public static final String NAME = "rcf";
    public static final String NUMBER_OF_TREES_PARAM = "number_of_trees";
    public static final String SAMPLE_SIZE_PARAM = "sample_size";

    public RcfOutlierDetection() {
        super(NAME, ParameterSchema.of(
                ParameterDefinition.integer(NUMBER_OF_TREES_PARAM, RandomCutForest.DEFAULT_NUMBER_OF_TREES, 1,
                        "number of trees in the forest"),
                ParameterDefinition.integer(SAMPLE_SIZE_PARAM, RandomCutForest.DEFAULT_SAMPLE_SIZE, 2,
                        "number of points kept by each tree")));
    }

    @Override
    protected double[] score(FeatureMatrix fit, FeatureMatrix score, AlgorithmParameters parameters, long seed) {
        requireFitRows(fit, 1);
        RandomCutForest forest = RandomCutForest.builder().dimensions(fit.getColumns())
                .numberOfTrees(parameters.getInt(NUMBER_OF_TREES_PARAM))
                .sampleSize(parameters.getInt(SAMPLE_SIZE_PARAM)).outputAfter(1).randomSeed(seed).build();

        for (int i = 0; i < fit.getRows(); i++) {
            forest.update(fit.getRow(i));
        }

        double[] scores = new double[score.getRows()];
        for (int i = 0; i < scores.length; i++) {
            scores[i] = forest.getAnomalyScore(score.getRow(i));
        }
        return scores;
    }
}
