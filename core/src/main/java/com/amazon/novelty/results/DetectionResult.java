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

package com.amazon.novelty.results;

import java.util.List;

import lombok.Getter;

/**
 * What an algorithm produced: its ranked selections and, when the algorithm
 * scores every sample, the scores in input order.
 */
@Getter
public class DetectionResult {

    private final List<RankedSample> selections;
    private final double[] scores;

    public DetectionResult(List<RankedSample> selections, double[] scores) {
        this.selections = List.copyOf(selections);
        this.scores = scores;
    }

    public boolean hasScores() {
        return scores != null;
    }
}
