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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.amazon.novelty.exception.DataLoadException;

public class CsvDataLoaderTest {

    @TempDir
    Path directory;

    private final CsvDataLoader loader = new CsvDataLoader();

    private Path write(String name, String content) throws IOException {
        Path file = directory.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    @Test
    public void testLoadWithIdColumn() throws IOException {
        Path file = write("data.csv", "id,x,y,label\n7,1.5,2,a\n3,-1,0.25,b\n");
        Dataset dataset = loader.load(file, Map.of());

        assertThat(dataset.getIds(), contains("7", "3"));
        assertThat(dataset.getFieldNames(), contains("x", "y", "label"));
        assertEquals(1.5, dataset.getField("x").get(0));
        assertEquals(0.25, dataset.getField("y").get(1));
        assertEquals("b", dataset.getField("label").get(1));
    }

    @Test
    public void testRowIndexIdsWhenIdColumnMissing() throws IOException {
        Path file = write("data.csv", "x;y\n1;2\n3;4\n5;6\n");
        Dataset dataset = loader.load(file, Map.of(CsvDataLoader.DELIMITER_PARAM, ";"));
        assertThat(dataset.getIds(), contains("0", "1", "2"));
        assertEquals(6.0, dataset.getField("y").get(2));
    }

    @Test
    public void testCustomIdField() throws IOException {
        Path file = write("data.csv", "name,x\nfirst,1\nsecond,2\n");
        Dataset dataset = loader.load(file, Map.of(AbstractDataLoader.ID_FIELD_PARAM, "name"));
        assertThat(dataset.getIds(), contains("first", "second"));
        assertThat(dataset.getFieldNames(), contains("x"));
    }

    @Test
    public void testErrors() throws IOException {
        assertThrows(DataLoadException.class, () -> loader.load(directory.resolve("missing.csv"), Map.of()));
        Path file = write("data.csv", "id,x\n1,2\n");
        assertThrows(DataLoadException.class, () -> loader.load(file, Map.of("unknown", 1)));
        assertThrows(DataLoadException.class, () -> loader.load(file, Map.of(CsvDataLoader.DELIMITER_PARAM, "::")));
        Path ragged = write("ragged.csv", "id,x\n1,2,3\n");
        assertThrows(DataLoadException.class, () -> loader.load(ragged, Map.of()));
    }
}
