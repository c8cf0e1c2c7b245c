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

import com.amazon.novelty.algorithm.AlgorithmRegistry;

/**
 * Factory for the algorithm registry holding every detector shipped with the
 * pipeline.
 */
public class Detectors {

    private Detectors() {
    }

    /**
     * Register every built-in detector.
     *
     * @param registry an unfrozen registry
     * @return the registry
     */
    public static AlgorithmRegistry registerAll(AlgorithmRegistry registry) {
        registry.register(new RandomOutlierDetection());
        registry.register(new RxOutlierDetection());
        registry.register(new PcaOutlierDetection());
        registry.register(new DemudOutlierDetection());
        registry.register(new KnnOutlierDetection());
        registry.register(new RcfOutlierDetection());
        return registry;
    }

    /**
     * @return a frozen registry holding every built-in detector
     */
    public static AlgorithmRegistry defaultAlgorithmRegistry() {
        AlgorithmRegistry registry = registerAll(new AlgorithmRegistry());
        registry.freeze();
        return registry;
    }
}
