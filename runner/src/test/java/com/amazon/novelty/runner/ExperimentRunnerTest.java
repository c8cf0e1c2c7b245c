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

package com.amazon.novelty.runner;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.amazon.novelty.data.DataLoaderRegistry;
import com.amazon.novelty.detectors.Detectors;
import com.amazon.novelty.exception.NotFoundException;
import com.amazon.novelty.results.ResultWriter;
import com.amazon.novelty.testutils.ExperimentFixtures;
import com.amazon.novelty.testutils.NormalMixtureTestData;

public class ExperimentRunnerTest {

    private static final int SCORE_ID_OFFSET = 1000;

    @TempDir
    Path directory;

    private Path fit;
    private Path score;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    public void setUp() {
        NormalMixtureTestData data = new NormalMixtureTestData();
        fit = ExperimentFixtures.writeCsv(directory.resolve("fit.csv"), 0, data.generateTestData(10, 3, 1L));
        score = ExperimentFixtures.writeCsv(directory.resolve("score.csv"), SCORE_ID_OFFSET,
                data.generateTestData(5, 3, 2L, 4));
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    private ExperimentRunner runner() {
        return new ExperimentRunner(Detectors.defaultAlgorithmRegistry(), DataLoaderRegistry.withDefaultLoaders(),
                new PrintStream(out, true, StandardCharsets.UTF_8), new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private static Map<String, Map<String, Object>> algorithms(String... names) {
        Map<String, Map<String, Object>> algorithms = new LinkedHashMap<>();
        for (String name : names) {
            algorithms.put(name, null);
        }
        return algorithms;
    }

    private Path writeConfig(Map<String, Map<String, Object>> algorithms, Path outDir, int topN) {
        Map<String, Object> config = ExperimentFixtures.csvConfig(fit, score, 3, algorithms, outDir, topN);
        config.put("zscore_normalization", true);
        return ExperimentFixtures.writeYaml(directory.resolve("experiment.yml"), config);
    }

    private static List<String> selectionLines(Path outDir, String algorithm) throws IOException {
        return Files.readAllLines(outDir.resolve(algorithm).resolve(ResultWriter.SELECTIONS_FILE)).stream().skip(1)
                .collect(Collectors.toList());
    }

    @Test
    public void testRandomBaselineIsReproducible() throws IOException {
        Path outDir = directory.resolve("out");
        Path config = writeConfig(algorithms("random"), outDir, 3);

        assertEquals(0, runner().start(config, null, null, 42L));
        List<String> first = selectionLines(outDir, "random");
        assertEquals(0, runner().start(config, directory.resolve("again").toString(), null, 42L));
        List<String> second = selectionLines(directory.resolve("again"), "random");

        assertThat(first, hasSize(3));
        assertEquals(first, second);
        Set<String> ids = first.stream().map(line -> line.split(",")[1]).collect(Collectors.toSet());
        assertEquals(3, ids.size());
        Set<String> scoreIds = new HashSet<>();
        for (int i = 0; i < 5; i++) {
            scoreIds.add(Integer.toString(SCORE_ID_OFFSET + i));
        }
        assertTrue(scoreIds.containsAll(ids));
    }

    @Test
    public void testUnknownAlgorithmWritesNothing() {
        Path outDir = directory.resolve("out");
        Path config = writeConfig(algorithms("nonexistent_algorithm"), outDir, 3);

        NotFoundException exception = assertThrows(NotFoundException.class,
                () -> runner().start(config, null, null, 1L));
        assertThat(exception.getMessage(), containsString("nonexistent_algorithm"));
        assertFalse(Files.exists(outDir));
    }

    @Test
    public void testMissingConfigurationFile() {
        Path missing = directory.resolve("missing.yml");
        Path outDir = directory.resolve("out");

        assertEquals(1, runner().run(missing.toString(), "-o", outDir.toString()));
        assertThat(err.toString(StandardCharsets.UTF_8),
                containsString("[ERROR] Configuration file not found: " + missing.toAbsolutePath()));
        assertFalse(Files.exists(outDir));
    }

    @Test
    public void testOutDirOverride() throws IOException {
        Path configured = directory.resolve("configured");
        Path overridden = directory.resolve("overridden");
        Path config = writeConfig(algorithms("rx", "knn"), configured, 2);

        assertEquals(0, runner().run(config.toString(), "--out_dir", overridden.toString(), "--seed", "5"));
        assertFalse(Files.exists(configured));
        assertThat(selectionLines(overridden, "rx"), hasSize(2));
        assertThat(selectionLines(overridden, "knn"), hasSize(2));
        assertTrue(Files.isRegularFile(overridden.resolve("rx").resolve(ResultWriter.METADATA_FILE)));
    }

    @Test
    public void testEveryBuiltInDetector() throws IOException {
        Map<String, Map<String, Object>> algorithms = algorithms("random", "rx", "pca", "demud", "knn");
        Map<String, Object> rcf = new LinkedHashMap<>();
        rcf.put("number_of_trees", 10);
        rcf.put("sample_size", 16);
        algorithms.put("rcf", rcf);
        Path outDir = directory.resolve("out");

        assertEquals(0, runner().start(writeConfig(algorithms, outDir, 5), null, null, 3L));
        for (String name : algorithms.keySet()) {
            assertThat(name, selectionLines(outDir, name), hasSize(5));
        }
    }

    @Test
    public void testDeterministicDetectorsAreByteIdentical() throws IOException {
        Path config = writeConfig(algorithms("rx", "pca", "demud", "knn"), directory.resolve("unused"), 5);
        runner().start(config, directory.resolve("a").toString(), null, 1L);
        runner().start(config, directory.resolve("b").toString(), null, 2L);

        for (String name : List.of("rx", "pca", "demud", "knn")) {
            Path selections = Path.of(name, ResultWriter.SELECTIONS_FILE);
            assertEquals(-1L, Files.mismatch(directory.resolve("a").resolve(selections),
                    directory.resolve("b").resolve(selections)), name);
        }
    }

    @Test
    public void testLogFile() throws IOException {
        Path config = writeConfig(algorithms("random"), directory.resolve("configured"), 1);
        Path logFile = directory.resolve("logs").resolve("run.log");

        assertEquals(0, runner().run("-l", logFile.toString(), "-o", directory.resolve("out").toString(),
                config.toString()));
        String log = Files.readString(logFile);
        assertThat(log, containsString("out_dir overridden by the command line"));
        assertThat(log, containsString("Loading data_to_fit"));
        assertThat(log, containsString("Outlier detection [1/1]: random"));
    }

    @Test
    public void testHelp() {
        assertEquals(0, runner().run("-h"));
        assertThat(out.toString(StandardCharsets.UTF_8), containsString("config_file"));
    }

    @Test
    public void testMalformedCommandLine() {
        assertEquals(1, runner().run("--bogus", "experiment.yml"));
        assertThat(err.toString(StandardCharsets.UTF_8), containsString("Unknown argument: --bogus"));
    }
}
