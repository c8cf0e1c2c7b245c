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

package com.amazon.novelty.testutils;

import java.util.Random;

/**
 * Samples points from two multi-variate normal distributions with covariance
 * matrices of the form sigma * I. Most rows come from the base distribution;
 * the rows named as outliers come from the anomaly distribution. Every draw
 * comes from one seeded generator, so equal seeds give equal data.
 */
public class NormalMixtureTestData {

    private final double baseMu;
    private final double baseSigma;
    private final double anomalyMu;
    private final double anomalySigma;

    public NormalMixtureTestData(double baseMu, double baseSigma, double anomalyMu, double anomalySigma) {
        this.baseMu = baseMu;
        this.baseSigma = baseSigma;
        this.anomalyMu = anomalyMu;
        this.anomalySigma = anomalySigma;
    }

    public NormalMixtureTestData() {
        this(0.0, 1.0, 8.0, 1.0);
    }

    public NormalMixtureTestData(double baseMu, double anomalyMu) {
        this(baseMu, 1.0, anomalyMu, 1.0);
    }

    /**
     * @return rows drawn from the base distribution only
     */
    public double[][] generateTestData(int numberOfRows, int numberOfColumns, long seed) {
        return generateTestData(numberOfRows, numberOfColumns, seed, new int[0]);
    }

    /**
     * @param numberOfRows    number of rows
     * @param numberOfColumns number of columns
     * @param seed            seed of the generator
     * @param outlierRows     indexes of the rows drawn from the anomaly
     *                        distribution
     * @return the sampled rows
     */
    public double[][] generateTestData(int numberOfRows, int numberOfColumns, long seed, int... outlierRows) {
        boolean[] anomaly = new boolean[numberOfRows];
        for (int row : outlierRows) {
            anomaly[row] = true;
        }

        double[][] result = new double[numberOfRows][numberOfColumns];
        NormalDistribution dist = new NormalDistribution(new Random(seed));
        for (int i = 0; i < numberOfRows; i++) {
            if (anomaly[i]) {
                fillRow(result[i], dist, anomalyMu, anomalySigma);
            } else {
                fillRow(result[i], dist, baseMu, baseSigma);
            }
        }
        return result;
    }

    private void fillRow(double[] row, NormalDistribution dist, double mu, double sigma) {
        for (int j = 0; j < row.length; j++) {
            row[j] = dist.nextDouble(mu, sigma);
        }
    }

    static class NormalDistribution {
        private final Random rng;
        private final double[] buffer;
        private int index;

        NormalDistribution(Random rng) {
            this.rng = rng;
            buffer = new double[2];
            index = 0;
        }

        double nextDouble() {
            if (index == 0) {
                // Box-Muller
                double u = 1.0 - rng.nextDouble();
                double v = rng.nextDouble();
                double r = Math.sqrt(-2 * Math.log(u));
                buffer[0] = r * Math.cos(2 * Math.PI * v);
                buffer[1] = r * Math.sin(2 * Math.PI * v);
            }

            double result = buffer[index];
            index = (index + 1) % 2;

            return result;
        }

        double nextDouble(double mu, double sigma) {
            return mu + sigma * nextDouble();
        }
    }
}
