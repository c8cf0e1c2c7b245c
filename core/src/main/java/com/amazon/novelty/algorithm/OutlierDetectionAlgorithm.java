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

import com.amazon.novelty.exception.AlgorithmRuntimeException;

/**
 * The contract shared by all outlier detection algorithms. An algorithm ranks the
 * samples of the data to score by novelty, using the data to fit as its notion
 * of normal, and writes its top-N selections below the output directory. It
 * returns nothing to the caller.
 * <p>
 * Implementations must not modify the feature matrices they are given, must
 * write only below {@code outDir/<name>}, and must derive any randomness from
 * {@link DetectionContext#getSeed()} so that identical inputs and seeds give
 * identical rankings.
 */
public interface OutlierDetectionAlgorithm {

    /**
     * @return the unique name under which the algorithm is registered and
     *         configured
     */
    String getName();

    /**
     * @return the parameters the algorithm accepts
     */
    default ParameterSchema getParameterSchema() {
        return ParameterSchema.empty();
    }

    /**
     * Rank the data to score and write the results.
     *
     * @param context    the shared inputs of the experiment
     * @param parameters parameters validated against
     *                   {@link #getParameterSchema()}
     * @throws AlgorithmRuntimeException if the algorithm cannot process the
     *                                   inputs
     */
    void run(DetectionContext context, AlgorithmParameters parameters);
}
