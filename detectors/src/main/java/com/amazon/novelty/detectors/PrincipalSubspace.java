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

import static com.amazon.novelty.CommonUtils.checkArgument;

import java.util.List;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;

/**
 * The mean and the leading principal directions of a set of points. Points are
 * scored by the squared distance between them and their projection onto the
 * affine subspace spanned by the directions.
 */
class PrincipalSubspace {

    /** Singular values below this fraction of the largest carry no direction. */
    static final double RELATIVE_TOLERANCE = 1e-10;

    private final double[] mean;

    /** One principal direction per row, each of unit length. */
    private final double[][] basis;

    private PrincipalSubspace(double[] mean, double[][] basis) {
        this.mean = mean;
        this.basis = basis;
    }

    /**
     * @param rows       the points, possibly none
     * @param dimensions the length of every point
     * @param components the maximum number of directions to keep
     * @return the subspace; with no points the mean is the origin and there are no
     *         directions
     */
    static PrincipalSubspace fit(List<double[]> rows, int dimensions, int components) {
        checkArgument(dimensions > 0, "dimensions must be positive");
        checkArgument(components > 0, "components must be positive");

        double[] mean = new double[dimensions];
        if (rows.isEmpty()) {
            return new PrincipalSubspace(mean, new double[0][]);
        }
        for (double[] row : rows) {
            checkArgument(row.length == dimensions, "all points must have the same length");
            for (int j = 0; j < dimensions; j++) {
                mean[j] += row[j];
            }
        }
        for (int j = 0; j < dimensions; j++) {
            mean[j] /= rows.size();
        }

        double[][] centered = new double[rows.size()][dimensions];
        for (int i = 0; i < rows.size(); i++) {
            for (int j = 0; j < dimensions; j++) {
                centered[i][j] = rows.get(i)[j] - mean[j];
            }
        }

        SingularValueDecomposition svd = new SingularValueDecomposition(new Array2DRowRealMatrix(centered, false));
        double[] singularValues = svd.getSingularValues();
        double threshold = RELATIVE_TOLERANCE * Math.max(1.0, singularValues.length == 0 ? 0 : singularValues[0]);
        int kept = 0;
        while (kept < Math.min(components, singularValues.length) && singularValues[kept] > threshold) {
            kept++;
        }

        RealMatrix v = svd.getV();
        double[][] basis = new double[kept][];
        for (int c = 0; c < kept; c++) {
            basis[c] = v.getColumn(c);
        }
        return new PrincipalSubspace(mean, basis);
    }

    int getComponents() {
        return basis.length;
    }

    double[] getMean() {
        return mean.clone();
    }

    /**
     * @param point a point of the fitted length
     * @return the squared norm of the part of {@code point - mean} that lies
     *         outside the subspace
     */
    double reconstructionError(double[] point) {
        checkArgument(point.length == mean.length, "point has the wrong length");
        double[] residual = new double[mean.length];
        for (int j = 0; j < mean.length; j++) {
            residual[j] = point[j] - mean[j];
        }
        for (double[] direction : basis) {
            double projection = 0;
            for (int j = 0; j < residual.length; j++) {
                projection += residual[j] * direction[j];
            }
            for (int j = 0; j < residual.length; j++) {
                residual[j] -= projection * direction[j];
            }
        }
        double error = 0;
        for (double value : residual) {
            error += value * value;
        }
        return error;
    }
}
