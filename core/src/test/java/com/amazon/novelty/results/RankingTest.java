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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class RankingTest {

    private static List<String> ids(List<RankedSample> ranking) {
        return ranking.stream().map(RankedSample::getId).collect(Collectors.toList());
    }

    @ParameterizedTest
    @ValueSource(ints = { 1, 3, 10, 100 })
    public void testSizeIsMinOfTopNAndSamples(int topN) {
        Random random = new Random(topN);
        List<String> ids = new ArrayList<>();
        double[] scores = new double[10];
        for (int i = 0; i < scores.length; i++) {
            ids.add("id" + i);
            scores[i] = random.nextDouble();
        }
        List<RankedSample> ranking = Ranking.topN(ids, scores, topN);
        assertEquals(Math.min(topN, 10), ranking.size());
        assertEquals(1, ranking.get(0).getRank());
        for (int i = 1; i < ranking.size(); i++) {
            assertEquals(i + 1, ranking.get(i).getRank());
            assertTrue(ranking.get(i - 1).getScore() >= ranking.get(i).getScore());
        }
    }

    @Test
    public void testTieBreak() {
        List<RankedSample> ranking = Ranking.topN(List.of("b", "a", "12", "2"), new double[] { 1, 1, 1, 1 }, 4);
        assertThat(ids(ranking), contains("2", "12", "a", "b"));
    }

    @Test
    public void testNaNRanksLast() {
        List<RankedSample> ranking = Ranking.topN(List.of("a", "b", "c"),
                new double[] { Double.NaN, -5, Double.NEGATIVE_INFINITY }, 3);
        assertThat(ids(ranking), contains("b", "a", "c"));
    }

    @Test
    public void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> Ranking.topN(List.of("a"), new double[2], 1));
        assertThrows(IllegalArgumentException.class, () -> Ranking.topN(List.of("a"), new double[1], 0));
    }
}
