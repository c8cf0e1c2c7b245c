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

import com.amazon.novelty.data.Dataset;

/**
 * One named step of a {@link FeatureRecipe}. A function turns some fields of a
 * dataset into a block of columns, one row per sample, in sample order.
 */
public interface FeatureFunction {

    String getName();

    /**
     * @param dataset the dataset
     * @param step    the recipe step naming this function, with its parameters
     * @return one row per sample; every row has the same length
     */
    double[][] apply(Dataset dataset, FeatureRecipe.Step step);
}
