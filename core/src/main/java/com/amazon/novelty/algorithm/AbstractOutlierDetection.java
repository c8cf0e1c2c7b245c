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

package com.amazon.novelty.algorithm;

import static com.amazon.novelty.CommonUtils.checkNotNull;

import java.util.List;

import com.amazon.novelty.exception.AlgorithmRuntimeException;
import com.amazon.novelty.feature.FeatureMatrix;
import com.amazon.novelty.results.DetectionResult;
import com.amazon.novelty.results.RankedSample;
import com.amazon.novelty.results.Ranking;
import com.amazon.novelty.results.ResultWriter;

/**
 * Common flow of the algorithms that assign one novelty score to every sample:
 * check the inputs, score, rank by descending score, truncate to top-N and write
 * the result. Subclasses implement {@link #score}; algorithms whose ranking is
 * not a plain sort of independent scores override {@link #detect}.
 */
public abstract class AbstractOutlierDetection implements OutlierDetectionAlgorithm {

    private final String name;
    private final ParameterSchema parameterSchema;
    private final ResultWriter resultWriter;

    protected AbstractOutlierDetection(String name, ParameterSchema parameterSchema) {
        this(name, parameterSchema, new ResultWriter());
    }

    protected AbstractOutlierDetection(String name, ParameterSchema parameterSchema, ResultWriter resultWriter) {
        this.name = checkNotNull(name, "name must not be null");
        this.parameterSchema = checkNotNull(parameterSchema, "parameterSchema must not be null");
        this.resultWriter = checkNotNull(resultWriter, "resultWriter must not be null");
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public ParameterSchema getParameterSchema() {
        return parameterSchema;
    }

    @Override
    public final void run(DetectionContext context, AlgorithmParameters parameters) {
        checkInputs(context);
        DetectionResult result;
        if (context.getScoreFeatures().getRows() == 0) {
            result = new DetectionResult(List.of(), new double[0]);
        } else {
            try {
                result = detect(context, parameters);
            } catch (IllegalArgumentException | IllegalStateException | ArithmeticException e) {
                throw new AlgorithmRuntimeException(name,
                        String.format("algorithm '%s' failed: %s", name, e.getMessage()), e);
            }
        }
        resultWriter.write(name, result, context, parameters);
        if (context.getLogger() != null) {
            context.getLogger().info("{}: selected {} of {} samples", name, result.getSelections().size(),
                    context.getScoreIds().size());
        }
    }

    /**
     * Score every sample and keep the top-N.
     *
     * @param context    the inputs; the data to score has at least one row
     * @param parameters the validated parameters
     * @return the ranked selections and the scores
     */
    protected DetectionResult detect(DetectionContext context, AlgorithmParameters parameters) {
        double[] scores = score(context.getFitFeatures(), context.getScoreFeatures(), parameters, context.getSeed());
        if (scores.length != context.getScoreFeatures().getRows()) {
            throw new AlgorithmRuntimeException(name, String.format("algorithm '%s' produced %d scores for %d samples",
                    name, scores.length, context.getScoreFeatures().getRows()));
        }
        List<RankedSample> selections = Ranking.topN(context.getScoreIds(), scores, context.getTopN());
        return new DetectionResult(selections, scores);
    }

    /**
     * Compute a novelty score for each row of the data to score; larger means more
     * novel.
     *
     * @param fit        the data to fit, read only
     * @param score      the data to score, read only
     * @param parameters the validated parameters
     * @param seed       the seed for any randomness
     * @return one score per row of {@code score}
     */
    protected abstract double[] score(FeatureMatrix fit, FeatureMatrix score, AlgorithmParameters parameters,
            long seed);

    /**
     * @param fit the data to fit
     * @param minimumRows the number of rows the algorithm needs
     * @throws AlgorithmRuntimeException if the data to fit is too small
     */
    protected void requireFitRows(FeatureMatrix fit, int minimumRows) {
        if (fit.getRows() < minimumRows) {
            throw new AlgorithmRuntimeException(name, String.format(
                    "algorithm '%s' needs at least %d samples to fit, got %d", name, minimumRows, fit.getRows()));
        }
    }

    private void checkInputs(DetectionContext context) {
        checkNotNull(context, "context must not be null");
        FeatureMatrix fit = checkNotNull(context.getFitFeatures(), "fit features must not be null");
        FeatureMatrix score = checkNotNull(context.getScoreFeatures(), "score features must not be null");
        List<String> ids = checkNotNull(context.getScoreIds(), "score ids must not be null");
        checkNotNull(context.getOutDir(), "output directory must not be null");
        if (ids.size() != score.getRows()) {
            throw new AlgorithmRuntimeException(name,
                    String.format("%d score ids for %d score samples", ids.size(), score.getRows()));
        }
        if (context.getTopN() <= 0) {
            throw new AlgorithmRuntimeException(name, "top_n must be positive, got " + context.getTopN());
        }
        if (score.getRows() > 0 && fit.getRows() > 0 && fit.getColumns() != score.getColumns()) {
            throw new AlgorithmRuntimeException(name, String.format(
                    "data to fit has %d features but data to score has %d", fit.getColumns(), score.getColumns()));
        }
    }
}
