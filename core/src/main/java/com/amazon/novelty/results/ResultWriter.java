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

import static com.amazon.novelty.CommonUtils.checkNotNull;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import com.amazon.novelty.algorithm.AlgorithmParameters;
import com.amazon.novelty.algorithm.DetectionContext;
import com.amazon.novelty.config.ResultsConfig;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Persists the result of one algorithm below {@code outDir/<algorithm name>}:
 * <ul>
 * <li>{@value #SELECTIONS_FILE}: rank, id and score of the top-N samples,
 * always written;</li>
 * <li>{@value #SCORES_FILE}: id and score of every sample in input order, when
 * {@link ResultsConfig#isSaveScores()} is set and the algorithm scores every
 * sample;</li>
 * <li>{@value #METADATA_FILE}: algorithm name, parameters, seed, top-N and data
 * shapes, when {@link ResultsConfig#isSaveMetadata()} is set.</li>
 * </ul>
 */
public class ResultWriter {

    public static final String SELECTIONS_FILE = "selections.csv";
    public static final String SCORES_FILE = "scores.csv";
    public static final String METADATA_FILE = "metadata.json";

    private final Gson gson;

    public ResultWriter() {
        this(new GsonBuilder().setPrettyPrinting().serializeSpecialFloatingPointValues().create());
    }

    public ResultWriter(Gson gson) {
        this.gson = checkNotNull(gson, "gson must not be null");
    }

    /**
     * @param algorithmName the algorithm that produced the result
     * @param result        the ranked selections and optional scores
     * @param context       the inputs the algorithm ran on
     * @param parameters    the parameters the algorithm ran with
     * @return the directory the files were written to
     * @throws UncheckedIOException if the directory or a file cannot be written
     */
    public Path write(String algorithmName, DetectionResult result, DetectionContext context,
            AlgorithmParameters parameters) {
        Path directory = context.getOutDir().resolve(algorithmName);
        ResultsConfig options = (context.getResultsConfig() == null) ? new ResultsConfig()
                : context.getResultsConfig();
        try {
            Files.createDirectories(directory);
            writeSelections(directory.resolve(SELECTIONS_FILE), result.getSelections());
            if (options.isSaveScores() && result.hasScores()) {
                writeScores(directory.resolve(SCORES_FILE), context.getScoreIds(), result.getScores());
            }
            if (options.isSaveMetadata()) {
                writeMetadata(directory.resolve(METADATA_FILE), algorithmName, result, context, parameters);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("cannot write results to " + directory.toAbsolutePath(), e);
        }
        return directory;
    }

    private void writeSelections(Path file, List<RankedSample> selections) throws IOException {
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter printer = new CSVPrinter(writer, CSVFormat.DEFAULT.withHeader("rank", "id", "score"))) {
            for (RankedSample sample : selections) {
                printer.printRecord(sample.getRank(), sample.getId(), Double.toString(sample.getScore()));
            }
        }
    }

    private void writeScores(Path file, List<String> ids, double[] scores) throws IOException {
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter printer = new CSVPrinter(writer, CSVFormat.DEFAULT.withHeader("id", "score"))) {
            for (int i = 0; i < scores.length; i++) {
                printer.printRecord(ids.get(i), Double.toString(scores[i]));
            }
        }
    }

    private void writeMetadata(Path file, String algorithmName, DetectionResult result, DetectionContext context,
            AlgorithmParameters parameters) throws IOException {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("algorithm", algorithmName);
        metadata.put("parameters", parameters == null ? Map.of() : parameters.asMap());
        metadata.put("seed", context.getSeed());
        metadata.put("top_n", context.getTopN());
        metadata.put("fit_samples", context.getFitFeatures().getRows());
        metadata.put("score_samples", context.getScoreFeatures().getRows());
        metadata.put("features",
                Math.max(context.getFitFeatures().getColumns(), context.getScoreFeatures().getColumns()));
        metadata.put("selected", result.getSelections().size());
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            gson.toJson(metadata, writer);
        }
    }
}
