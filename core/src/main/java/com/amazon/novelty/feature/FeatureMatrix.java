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
import static com.amazon.novelty.CommonUtils.checkNotNull;

import java.util.Arrays;

/**
 * An immutable matrix of features: one row per sample, in the order of the
 * dataset ids, and one column per extracted feature. The same instance is handed
 * to every algorithm of an experiment, so it never exposes its backing array.
 */
public class FeatureMatrix {

    private final double[][] values;
    private final int columns;

    /**
     * @param values the rows; copied
     * @param columns the number of columns, needed when there are no rows
     */
    public FeatureMatrix(double[][] values, int columns) {
        checkNotNull(values, "values must not be null");
        checkArgument(columns >= 0, "columns must be non-negative");
        this.values = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            checkArgument(values[i].length == columns,
                    String.format("row %d has %d columns, expected %d", i, values[i].length, columns));
            this.values[i] = Arrays.copyOf(values[i], columns);
        }
        this.columns = columns;
    }

    public FeatureMatrix(double[][] values) {
        this(values, values.length == 0 ? 0 : values[0].length);
    }

    public int getRows() {
        return values.length;
    }

    public int getColumns() {
        return columns;
    }

    public double get(int row, int column) {
        return values[row][column];
    }

    /**
     * @param row a row index
     * @return a copy of the row
     */
    public double[] getRow(int row) {
        return Arrays.copyOf(values[row], columns);
    }

    /**
     * @param column a column index
     * @return a copy of the column
     */
    public double[] getColumn(int column) {
        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = values[i][column];
        }
        return result;
    }

    /**
     * @return a deep copy of the values, which the caller may modify
     */
    public double[][] toArray() {
        double[][] copy = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            copy[i] = Arrays.copyOf(values[i], columns);
        }
        return copy;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof FeatureMatrix)) {
            return false;
        }
        FeatureMatrix that = (FeatureMatrix) other;
        return columns == that.columns && Arrays.deepEquals(values, that.values);
    }

    @Override
    public int hashCode() {
        return 31 * columns + Arrays.deepHashCode(values);
    }

    @Override
    public String toString() {
        return String.format("FeatureMatrix(%d x %d)", getRows(), columns);
    }
}
