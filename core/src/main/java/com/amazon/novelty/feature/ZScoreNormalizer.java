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

import static com.amazon.novelty.CommonUtils.checkArgument;

import lombok.Getter;

/**
 * Standardizes features to zero mean and unit variance. The statistics are
 * computed from the data to fit only and the same transform is applied to the
 * data to score, so the content of the score set never influences how either
 * matrix is transformed.
 * <p>
 * A feature whose standard deviation over the fit set is below
 * {@link #MIN_STANDARD_DEVIATION} times {@code max(1, |mean|)} is only centred:
 * its divisor is 1. The cutoff scales with the mean so that rounding error in
 * the statistics of a large constant feature is not mistaken for spread.
 */
public class ZScoreNormalizer {

    public static final double MIN_STANDARD_DEVIATION = 1e-12;

    /**
     * @param fit the data to fit; must have at least one row
     * @return the per-feature mean, population standard deviation and divisor
     */
    public NormalizationStatistics fitStatistics(FeatureMatrix fit) {
        checkArgument(fit.getRows() > 0, "cannot normalize with an empty data to fit");
        int columns = fit.getColumns();
        double[] mean = new double[columns];
        double[] deviation = new double[columns];
        double[] divisor = new double[columns];
        for (int j = 0; j < columns; j++) {
            double sum = 0;
            for (int i = 0; i < fit.getRows(); i++) {
                sum += fit.get(i, j);
            }
            mean[j] = sum / fit.getRows();
            double squares = 0;
            for (int i = 0; i < fit.getRows(); i++) {
                double diff = fit.get(i, j) - mean[j];
                squares += diff * diff;
            }
            deviation[j] = Math.sqrt(squares / fit.getRows());
            double cutoff = MIN_STANDARD_DEVIATION * Math.max(1.0, Math.abs(mean[j]));
            divisor[j] = (deviation[j] < cutoff) ? 1.0 : deviation[j];
        }
        return new NormalizationStatistics(mean, deviation, divisor);
    }

    /**
     * Normalize both matrices with the statistics of the fit matrix.
     *
     * @param fit   the data to fit
     * @param score the data to score
     * @return the normalized pair
     */
    public NormalizedPair normalize(FeatureMatrix fit, FeatureMatrix score) {
        checkArgument(score.getRows() == 0 || fit.getColumns() == score.getColumns(),
                "fit and score matrices must have the same number of columns");
        NormalizationStatistics statistics = fitStatistics(fit);
        FeatureMatrix normalizedScore = (score.getRows() == 0) ? score : statistics.apply(score);
        return new NormalizedPair(statistics.apply(fit), normalizedScore, statistics);
    }

    @Getter
    public static class NormalizedPair {
        private final FeatureMatrix fit;
        private final FeatureMatrix score;
        private final NormalizationStatistics statistics;

        NormalizedPair(FeatureMatrix fit, FeatureMatrix score, NormalizationStatistics statistics) {
            this.fit = fit;
            this.score = score;
            this.statistics = statistics;
        }
    }
}
