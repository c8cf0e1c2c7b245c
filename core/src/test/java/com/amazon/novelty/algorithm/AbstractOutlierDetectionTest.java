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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;

import com.amazon.novelty.config.ResultsConfig;
import com.amazon.novelty.exception.AlgorithmRuntimeException;
import com.amazon.novelty.feature.FeatureMatrix;
import com.amazon.novelty.results.ResultWriter;

public class AbstractOutlierDetectionTest {

    @TempDir
    Path outDir;

    private static class FixedScores extends AbstractOutlierDetection {
        private final double[] scores;

        FixedScores(double... scores) {
            super("fixed", ParameterSchema.empty());
            this.scores = scores;
        }

        @Override
        protected double[] score(FeatureMatrix fit, FeatureMatrix score, AlgorithmParameters parameters, long seed) {
            return scores;
        }
    }

    private DetectionContext.DetectionContextBuilder context(int scoreRows, List<String> ids, int topN) {
        return DetectionContext.builder().fitFeatures(new FeatureMatrix(new double[][] { { 0, 0 }, { 1, 1 } }))
                .scoreFeatures(new FeatureMatrix(new double[scoreRows][2], 2)).scoreIds(ids).outDir(outDir)
                .resultsConfig(new ResultsConfig()).topN(topN).seed(7L);
    }

    private List<String> selectionLines() throws IOException {
        return Files.readAllLines(outDir.resolve("fixed").resolve(ResultWriter.SELECTIONS_FILE)).stream()
                .skip(1).collect(Collectors.toList());
    }

    @Test
    public void testTopNIsSortedAndTruncated() throws IOException {
        new FixedScores(0.1, 0.9, 0.5, 0.7, 0.3).run(context(5, List.of("a", "b", "c", "d", "e"), 3).build(),
                AlgorithmParameters.empty());

        assertThat(selectionLines(), contains("1,b,0.9", "2,d,0.7", "3,c,0.5"));
    }

    @Test
    public void testTopNLargerThanSampleCount() throws IOException {
        new FixedScores(0.1, 0.2).run(context(2, List.of("x", "y"), 10).build(), AlgorithmParameters.empty());
        assertEquals(2, selectionLines().size());
    }

    @Test
    public void testTiesAreBrokenByAscendingId() throws IOException {
        new FixedScores(1.0, 1.0, 1.0, 2.0).run(context(4, List.of("10", "9", "11", "3"), 4).build(),
                AlgorithmParameters.empty());
        assertThat(selectionLines(), contains("1,3,2.0", "2,9,1.0", "3,10,1.0", "4,11,1.0"));
    }

    @Test
    public void testEmptyScoreSetWritesEmptySelection() throws IOException {
        new FixedScores().run(context(0, List.of(), 3).build(), AlgorithmParameters.empty());
        assertTrue(selectionLines().isEmpty());
    }

    @Test
    public void testLoggerReceivesProgress() {
        Logger logger = mock(Logger.class);
        new FixedScores(0.5).run(context(1, List.of("only"), 1).logger(logger).build(), AlgorithmParameters.empty());
        verify(logger).info(anyString(), eq("fixed"), anyInt(), anyInt());
    }

    @Test
    public void testMismatchedIds() {
        assertThrows(AlgorithmRuntimeException.class, () -> new FixedScores(0.1, 0.2)
                .run(context(2, List.of("only"), 1).build(), AlgorithmParameters.empty()));
        assertFalse(Files.exists(outDir.resolve("fixed")));
    }

    @Test
    public void testWrongNumberOfScores() {
        AlgorithmRuntimeException exception = assertThrows(AlgorithmRuntimeException.class,
                () -> new FixedScores(0.1).run(context(2, List.of("a", "b"), 1).build(), AlgorithmParameters.empty()));
        assertEquals("fixed", exception.getAlgorithmName());
    }

    @Test
    public void testMismatchedColumns() {
        DetectionContext context = context(1, List.of("a"), 1)
                .scoreFeatures(new FeatureMatrix(new double[][] { { 1, 2, 3 } })).build();
        assertThrows(AlgorithmRuntimeException.class,
                () -> new FixedScores(0.1).run(context, AlgorithmParameters.empty()));
    }

    @Test
    public void testIllegalArgumentIsReportedAsAlgorithmFailure() {
        AbstractOutlierDetection failing = new AbstractOutlierDetection("failing", ParameterSchema.empty(),
                new ResultWriter()) {
            @Override
            protected double[] score(FeatureMatrix fit, FeatureMatrix score, AlgorithmParameters parameters,
                    long seed) {
                throw new IllegalArgumentException("singular");
            }
        };
        AlgorithmRuntimeException exception = assertThrows(AlgorithmRuntimeException.class,
                () -> failing.run(context(1, List.of("a"), 1).build(), AlgorithmParameters.empty()));
        assertEquals("failing", exception.getAlgorithmName());
        assertTrue(exception.getCause() instanceof IllegalArgumentException);
    }

    @Test
    public void testWriterIsUsed() {
        ResultWriter writer = mock(ResultWriter.class);
        AbstractOutlierDetection algorithm = new AbstractOutlierDetection("mocked", ParameterSchema.empty(), writer) {
            @Override
            protected double[] score(FeatureMatrix fit, FeatureMatrix score, AlgorithmParameters parameters,
                    long seed) {
                return new double[] { 1.0 };
            }
        };
        DetectionContext context = context(1, List.of("a"), 1).build();
        algorithm.run(context, AlgorithmParameters.empty());
        verify(writer).write(eq("mocked"), any(), eq(context), any());
    }
}
