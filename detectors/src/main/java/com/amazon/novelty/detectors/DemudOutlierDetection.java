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

import static com.amazon.novelty.CommonUtils.SAMPLE_ID_ORDER;

import java.util.ArrayList;
import java.util.List;

import com.amazon.novelty.algorithm.AbstractOutlierDetection;
import com.amazon.novelty.algorithm.AlgorithmParameters;
import com.amazon.novelty.algorithm.DetectionContext;
import com.amazon.novelty.algorithm.ParameterDefinition;
import com.amazon.novelty.algorithm.ParameterSchema;
import com.amazon.novelty.feature.FeatureMatrix;
import com.amazon.novelty.results.DetectionResult;
import com.amazon.novelty.results.RankedSample;

/**
 * Discovery via eigenbasis modeling of uninteresting data (DEMUD). A model of
 * what has been seen is built from the data to fit: its mean and leading
 * {@code k} principal components. The sample to score that the model
 * reconstructs worst is selected and added to the model, the model is rebuilt,
 * and the process repeats until {@code top_n} samples are selected. The ranking
 * is the selection order and each selection keeps the reconstruction error it
 * had when it was selected, so scores need not decrease with rank.
 * <p>
 * The full score listing holds the selection time error for selected samples and
 * the error under the final model for the others. With no data to fit the first
 * model is empty and the first selection is the sample of largest norm.
 */
public class DemudOutlierDetection extends AbstractOutlierDetection {

    public static final String NAME = "demud";
    public static final String COMPONENTS_PARAM = "k";
    public static final int DEFAULT_COMPONENTS = 2;

    public DemudOutlierDetection() {
        super(NAME, ParameterSchema.of(ParameterDefinition.integer(COMPONENTS_PARAM, DEFAULT_COMPONENTS, 1,
                "number of principal components of the model")));
    }

    @Override
    protected DetectionResult detect(DetectionContext context, AlgorithmParameters parameters) {
        FeatureMatrix fit = context.getFitFeatures();
        FeatureMatrix score = context.getScoreFeatures();
        List<String> ids = context.getScoreIds();
        int k = parameters.getInt(COMPONENTS_PARAM);
        int dimensions = score.getColumns();
        int selections = Math.min(context.getTopN(), score.getRows());

        List<double[]> seen = new ArrayList<>(fit.getRows() + selections);
        for (int i = 0; i < fit.getRows(); i++) {
            seen.add(fit.getRow(i));
        }
        boolean[] selected = new boolean[score.getRows()];
        double[] scores = new double[score.getRows()];
        List<RankedSample> ranking = new ArrayList<>(selections);

        PrincipalSubspace model = PrincipalSubspace.fit(seen, dimensions, k);
        for (int rank = 1; rank <= selections; rank++) {
            int best = -1;
            double bestError = Double.NEGATIVE_INFINITY;
            for (int i = 0; i < score.getRows(); i++) {
                if (selected[i]) {
                    continue;
                }
                double error = model.reconstructionError(score.getRow(i));
                if (best < 0 || error > bestError
                        || (error == bestError && SAMPLE_ID_ORDER.compare(ids.get(i), ids.get(best)) < 0)) {
                    best = i;
                    bestError = error;
                }
            }
            selected[best] = true;
            scores[best] = bestError;
            ranking.add(new RankedSample(rank, ids.get(best), bestError));

            seen.add(score.getRow(best));
            model = PrincipalSubspace.fit(seen, dimensions, k);
        }

        for (int i = 0; i < score.getRows(); i++) {
            if (!selected[i]) {
                scores[i] = model.reconstructionError(score.getRow(i));
            }
        }
        return new DetectionResult(ranking, scores);
    }

    /**
     * DEMUD has no one-shot score; each score depends on the samples selected
     * before it, so ranking goes through {@link #detect} only.
     */
    @Override
    protected double[] score(FeatureMatrix fit, FeatureMatrix score, AlgorithmParameters parameters, long seed) {
        throw new IllegalStateException("demud ranks by iterative selection and has no one-shot score");
    }
}
