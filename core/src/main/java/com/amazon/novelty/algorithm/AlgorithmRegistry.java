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

import com.amazon.novelty.registry.NamedRegistry;

/**
 * Binds algorithm names to {@link OutlierDetectionAlgorithm} implementations.
 * Registration order defines which names exist; execution order is given by
 * the experiment configuration.
 */
public class AlgorithmRegistry extends NamedRegistry<OutlierDetectionAlgorithm> {

    public AlgorithmRegistry() {
        super("outlier detection algorithm");
    }

    /**
     * Register an algorithm under its own name.
     *
     * @param algorithm the algorithm
     */
    public void register(OutlierDetectionAlgorithm algorithm) {
        register(algorithm.getName(), algorithm);
    }
}
