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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import com.amazon.novelty.algorithm.AlgorithmRegistry;
import com.amazon.novelty.algorithm.OutlierDetectionAlgorithm;
import com.amazon.novelty.exception.NotFoundException;

public class DetectorsTest {

    @Test
    public void testDefaultRegistry() {
        AlgorithmRegistry registry = Detectors.defaultAlgorithmRegistry();

        assertTrue(registry.isFrozen());
        assertThat(registry.getNames(), contains("random", "rx", "pca", "demud", "knn", "rcf"));
        for (String name : registry.getNames()) {
            OutlierDetectionAlgorithm algorithm = registry.resolve(name);
            assertEquals(name, algorithm.getName());
        }
        assertThrows(NotFoundException.class, () -> registry.resolve("nonexistent_algorithm"));
        assertThrows(IllegalStateException.class, () -> registry.register(new KnnOutlierDetection()));
    }

    @Test
    public void testRegisterAllLeavesRegistryOpen() {
        AlgorithmRegistry registry = Detectors.registerAll(new AlgorithmRegistry());
        assertFalse(registry.isFrozen());
        assertTrue(registry.contains("demud"));
    }
}
