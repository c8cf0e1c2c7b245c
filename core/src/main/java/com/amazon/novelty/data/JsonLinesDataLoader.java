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

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.amazon.novelty.exception.DataLoadException;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

/**
 * Loads a file holding one JSON object per line. Numbers become scalar numeric
 * values, arrays of numbers become vectors, anything else is kept as text. Every
 * object must carry the same keys. Blank lines are skipped.
 * <p>
 * Parameters: {@code id_field} (default {@code id}).
 */
public class JsonLinesDataLoader extends AbstractDataLoader {

    public static final String NAME = "jsonl";

    public JsonLinesDataLoader() {
        super(NAME, Set.of(ID_FIELD_PARAM));
    }

    @Override
    protected Dataset read(Path path, Map<String, Object> params) {
        String idField = stringParameter(params, ID_FIELD_PARAM, Dataset.ID_FIELD);
        Map<String, List<Object>> columns = new LinkedHashMap<>();
        int lineNumber = 0;
        int records = 0;
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                JsonObject object = JsonParser.parseString(line).getAsJsonObject();
                if (records == 0) {
                    object.keySet().forEach(key -> columns.put(key, new ArrayList<>()));
                } else if (!object.keySet().equals(columns.keySet())) {
                    throw new DataLoadException(String.format("line %d of %s has keys %s, expected %s", lineNumber,
                            path, object.keySet(), columns.keySet()));
                }
                for (Map.Entry<String, JsonElement> entry : object.entrySet()) {
                    Object value = entry.getKey().equals(idField) ? toId(entry.getValue()) : toValue(entry.getValue());
                    columns.get(entry.getKey()).add(value);
                }
                records++;
            }
        } catch (IOException | JsonParseException | IllegalStateException e) {
            throw new DataLoadException(
                    String.format("failed to read line %d of %s: %s", lineNumber, path.toAbsolutePath(), e.getMessage()),
                    e);
        }

        Dataset.Builder builder = Dataset.builder();
        List<Object> idValues = columns.remove(idField);
        if (idValues != null) {
            List<String> ids = new ArrayList<>(idValues.size());
            idValues.forEach(value -> ids.add((String) value));
            builder.ids(ids);
        } else {
            List<String> ids = new ArrayList<>(records);
            for (int i = 0; i < records; i++) {
                ids.add(Integer.toString(i));
            }
            builder.ids(ids);
        }
        columns.forEach(builder::field);
        return builder.build();
    }

    /**
     * Numeric ids keep their exact decimal value, so {@code 7}, {@code 7.0} and
     * {@code 7e0} all give {@code "7"} and large integers are not rounded.
     */
    private static String toId(JsonElement element) {
        if (element.isJsonPrimitive() && element.getAsJsonPrimitive().isNumber()) {
            return element.getAsJsonPrimitive().getAsBigDecimal().stripTrailingZeros().toPlainString();
        }
        if (element.isJsonNull()) {
            return "";
        }
        return element.isJsonPrimitive() ? element.getAsString() : element.toString();
    }

    private static Object toValue(JsonElement element) {
        if (element.isJsonPrimitive() && element.getAsJsonPrimitive().isNumber()) {
            return element.getAsDouble();
        }
        if (element.isJsonArray()) {
            JsonArray array = element.getAsJsonArray();
            double[] vector = new double[array.size()];
            for (int i = 0; i < array.size(); i++) {
                JsonElement item = array.get(i);
                if (!item.isJsonPrimitive() || !item.getAsJsonPrimitive().isNumber()) {
                    return array.toString();
                }
                vector[i] = item.getAsDouble();
            }
            return vector;
        }
        if (element.isJsonNull()) {
            return "";
        }
        return element.isJsonPrimitive() ? element.getAsString() : element.toString();
    }
}
