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

package com.amazon.novelty.data;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import com.amazon.novelty.exception.DataLoadException;

/**
 * Loads a delimited text file with a header row. A column whose cells all parse
 * as numbers becomes a numeric field; any other column is kept as text. When the
 * id column is absent the zero-based row index is used as the sample id.
 * <p>
 * Parameters: {@code id_field} (default {@code id}), {@code delimiter} (default
 * {@code ,}).
 */
public class CsvDataLoader extends AbstractDataLoader {

    public static final String NAME = "csv";
    public static final String DELIMITER_PARAM = "delimiter";

    public CsvDataLoader() {
        super(NAME, Set.of(ID_FIELD_PARAM, DELIMITER_PARAM));
    }

    @Override
    protected Dataset read(Path path, Map<String, Object> params) {
        String idField = stringParameter(params, ID_FIELD_PARAM, Dataset.ID_FIELD);
        String delimiter = stringParameter(params, DELIMITER_PARAM, ",");
        if (delimiter.length() != 1) {
            throw new DataLoadException("delimiter must be a single character, got '" + delimiter + "'");
        }

        CSVFormat format = CSVFormat.DEFAULT.withDelimiter(delimiter.charAt(0)).withFirstRecordAsHeader()
                .withIgnoreSurroundingSpaces();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
                CSVParser parser = new CSVParser(reader, format)) {
            List<String> header = parser.getHeaderNames();
            if (header.isEmpty()) {
                throw new DataLoadException("missing header row in " + path.toAbsolutePath());
            }
            List<List<String>> columns = new ArrayList<>();
            for (int i = 0; i < header.size(); i++) {
                columns.add(new ArrayList<>());
            }
            for (CSVRecord record : parser) {
                if (record.size() != header.size()) {
                    throw new DataLoadException(String.format("line %d of %s has %d values, expected %d",
                            parser.getCurrentLineNumber(), path, record.size(), header.size()));
                }
                for (int i = 0; i < header.size(); i++) {
                    columns.get(i).add(record.get(i));
                }
            }

            Dataset.Builder builder = Dataset.builder();
            int idColumn = header.indexOf(idField);
            if (idColumn >= 0) {
                builder.ids(columns.get(idColumn));
            } else {
                int rows = columns.get(0).size();
                List<String> ids = new ArrayList<>(rows);
                for (int i = 0; i < rows; i++) {
                    ids.add(Integer.toString(i));
                }
                builder.ids(ids);
            }
            for (int i = 0; i < header.size(); i++) {
                if (i != idColumn) {
                    builder.field(header.get(i), toValues(columns.get(i)));
                }
            }
            return builder.build();
        } catch (IOException | IllegalStateException | IllegalArgumentException e) {
            throw new DataLoadException("failed to read " + path.toAbsolutePath() + ": " + e.getMessage(), e);
        }
    }

    private static List<?> toValues(List<String> cells) {
        List<Double> numbers = new ArrayList<>(cells.size());
        for (String cell : cells) {
            try {
                numbers.add(Double.parseDouble(cell));
            } catch (NumberFormatException e) {
                return cells;
            }
        }
        return numbers;
    }
}
