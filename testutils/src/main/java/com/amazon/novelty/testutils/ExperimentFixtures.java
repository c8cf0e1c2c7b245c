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

package com.amazon.novelty.testutils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Writes data sets and experiment configurations to disk for end to end tests.
 */
public class ExperimentFixtures {

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private ExperimentFixtures() {
    }

    /**
     * @param columns number of feature columns
     * @return the column names {@code f0, f1, ...}
     */
    public static List<String> featureNames(int columns) {
        List<String> names = new ArrayList<>();
        for (int i = 0; i < columns; i++) {
            names.add("f" + i);
        }
        return names;
    }

    /**
     * Write a CSV file with an {@code id} column followed by {@code f0, f1, ...}.
     *
     * @param file     the file to write
     * @param idOffset the id of the first row; row i has id
     *                 {@code idOffset + i}
     * @param rows     the feature values
     * @return the file
     */
    public static Path writeCsv(Path file, int idOffset, double[][] rows) {
        int columns = (rows.length == 0) ? 1 : rows[0].length;
        List<String> header = new ArrayList<>();
        header.add("id");
        header.addAll(featureNames(columns));

        try (Writer writer = Files.newBufferedWriter(file);
                CSVPrinter printer = new CSVPrinter(writer,
                        CSVFormat.DEFAULT.withHeader(header.toArray(new String[0])))) {
            for (int i = 0; i < rows.length; i++) {
                List<Object> record = new ArrayList<>();
                record.add(idOffset + i);
                for (double value : rows[i]) {
                    record.add(value);
                }
                printer.printRecord(record);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return file;
    }

    /**
     * @param file   the file to write
     * @param config the configuration as nested maps and lists
     * @return the file
     */
    public static Path writeYaml(Path file, Map<String, Object> config) {
        try {
            YAML.writeValue(file.toFile(), config);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return file;
    }

    /**
     * A configuration for CSV files written by {@link #writeCsv}, using every
     * feature column as a raw value.
     *
     * @param fit        the data to fit
     * @param score      the data to score
     * @param columns    number of feature columns
     * @param algorithms algorithm name to parameters, in execution order
     * @param outDir     the output directory
     * @param topN       number of samples to select
     * @return a mutable configuration map
     */
    public static Map<String, Object> csvConfig(Path fit, Path score, int columns,
            Map<String, Map<String, Object>> algorithms, Path outDir, int topN) {
        Map<String, Object> loader = new LinkedHashMap<>();
        loader.put("name", "csv");
        loader.put("params", new LinkedHashMap<>(Map.of("id_field", "id")));

        Map<String, Object> rawValues = new LinkedHashMap<>();
        rawValues.put("fields", featureNames(columns));
        Map<String, Object> features = new LinkedHashMap<>();
        features.put("raw_values", rawValues);

        Map<String, Object> config = new LinkedHashMap<>();
        config.put("data_loader", loader);
        config.put("data_to_fit", fit.toString());
        config.put("data_to_score", score.toString());
        config.put("features", features);
        config.put("zscore_normalization", false);
        config.put("outlier_detection", new LinkedHashMap<>(algorithms));
        config.put("out_dir", outDir.toString());
        config.put("top_n", topN);
        return config;
    }
}
