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

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.novelty.algorithm.AbstractOutlierDetection;
import com.amazon.novelty.algorithm.AlgorithmParameters;
import com.amazon.novelty.algorithm.ParameterDefinition;
import com.amazon.novelty.algorithm.ParameterSchema;
import com.amazon.novelty.feature.FeatureMatrix;

/**
 * Scores a sample by its squared reconstruction error after projection onto the
 * leading {@code k} principal components of the data to fit.
 */
public class PcaOutlierDetection extends AbstractOutlierDetection {

    private static final Logger logger = LoggerFactory.getLogger(PcaOutlierDetection.class);

    public static final String NAME = "pca";
    public static final String COMPONENTS_PARAM = "k";
    public static final int DEFAULT_COMPONENTS = 2;

    public PcaOutlierDetection() {
        super(NAME, ParameterSchema.of(ParameterDefinition.integer(COMPONENTS_PARAM, DEFAULT_COMPONENTS, 1,
                "number of principal components")));
    }

    @Override
    protected double[] score(FeatureMatrix fit, FeatureMatrix score, AlgorithmParameters parameters, long seed) {
        requireFitRows(fit, 1);
        int k = parameters.getInt(COMPONENTS_PARAM);
        List<double[]> rows = new ArrayList<>(fit.getRows());
        for (int i = 0; i < fit.getRows(); i++) {
            rows.add(fit.getRow(i));
        }
        PrincipalSubspace subspace = PrincipalSubspace.fit(rows, fit.getColumns(), k);
        if (subspace.getComponents() < k) {
            logger.debug("{}: data to fit supports {} of the {} requested components", NAME,
                    subspace.getComponents(), k);
        }

        double[] scores = new double[score.getRows()];
        for (int i = 0; i < scores.length; i++) {
            scores[i] = subspace.reconstructionError(score.getRow(i));
        }
        return scores;
    }
}
