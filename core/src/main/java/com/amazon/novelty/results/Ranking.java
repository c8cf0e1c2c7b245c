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

import static com.amazon.novelty.CommonUtils.SAMPLE_ID_ORDER;
import static com.amazon.novelty.CommonUtils.checkArgument;
import static com.amazon.novelty.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

public class Ranking {

    private Ranking() {
    }

    /**
     * Select the {@code topN} most novel samples. Samples are ordered by
     * descending score; equal scores are ordered by ascending id (see
     * {@link com.amazon.novelty.CommonUtils#SAMPLE_ID_ORDER}) and then by position.
     * NaN scores rank below every other score.
     *
     * @param ids    sample ids
     * @param scores one score per id
     * @param topN   the maximum number of entries, positive
     * @return {@code min(topN, ids.size())} entries with ranks starting at 1
     */
    public static List<RankedSample> topN(List<String> ids, double[] scores, int topN) {
        checkNotNull(ids, "ids must not be null");
        checkNotNull(scores, "scores must not be null");
        checkArgument(ids.size() == scores.length,
                String.format("there are %d ids but %d scores", ids.size(), scores.length));
        checkArgument(topN > 0, "topN must be positive");

        Comparator<Integer> order = Comparator.<Integer, Double>comparing(i -> orderable(scores[i]))
                .reversed()
                .thenComparing(i -> ids.get(i), SAMPLE_ID_ORDER)
                .thenComparing(i -> i);
        List<Integer> indexes = IntStream.range(0, scores.length).boxed().sorted(order).limit(topN)
                .collect(Collectors.toList());

        List<RankedSample> result = new ArrayList<>(indexes.size());
        for (int rank = 0; rank < indexes.size(); rank++) {
            int index = indexes.get(rank);
            result.add(new RankedSample(rank + 1, ids.get(index), scores[index]));
        }
        return result;
    }

    private static double orderable(double score) {
        return Double.isNaN(score) ? Double.NEGATIVE_INFINITY : score;
    }
}
