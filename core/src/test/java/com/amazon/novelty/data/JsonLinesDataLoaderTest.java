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
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.amazon.novelty.exception.DataLoadException;

public class JsonLinesDataLoaderTest {

    @TempDir
    Path directory;

    private final JsonLinesDataLoader loader = new JsonLinesDataLoader();

    @Test
    public void testLoad() throws IOException {
        Path file = directory.resolve("data.jsonl");
        Files.writeString(file, "{\"id\": 4, \"spectrum\": [1, 2, 3], \"temp\": 20.5, \"site\": \"north\"}\n\n"
                + "{\"id\": 5, \"spectrum\": [4, 5, 6], \"temp\": 21.0, \"site\": \"south\"}\n");
        Dataset dataset = loader.load(file, null);

        assertThat(dataset.getIds(), contains("4", "5"));
        assertThat(dataset.getFieldNames(), contains("spectrum", "temp", "site"));
        assertArrayEquals(new double[] { 4, 5, 6 }, (double[]) dataset.getField("spectrum").get(1));
        assertEquals(20.5, dataset.getField("temp").get(0));
        assertEquals("south", dataset.getField("site").get(1));
    }

    @Test
    public void testLargeNumericIdsKeepTheirDigits() throws IOException {
        Path file = directory.resolve("data.jsonl");
        Files.writeString(file, "{\"id\": 9007199254740993, \"x\": 1}\n{\"id\": 9007199254740992, \"x\": 2}\n"
                + "{\"id\": 7.0, \"x\": 3}\n{\"id\": \"a-1\", \"x\": 4}\n");
        Dataset dataset = loader.load(file, Map.of());

        assertThat(dataset.getIds(), contains("9007199254740993", "9007199254740992", "7", "a-1"));
    }

    @Test
    public void testInconsistentKeys() throws IOException {
        Path file = directory.resolve("data.jsonl");
        Files.writeString(file, "{\"id\": 1, \"x\": 1}\n{\"id\": 2, \"y\": 1}\n");
        assertThrows(DataLoadException.class, () -> loader.load(file, Map.of()));
    }

    @Test
    public void testMalformedLine() throws IOException {
        Path file = directory.resolve("data.jsonl");
        Files.writeString(file, "{\"id\": 1, \"x\": 1}\nnot json\n");
        assertThrows(DataLoadException.class, () -> loader.load(file, Map.of()));
    }

    @Test
    public void testDefaultRegistry() {
        DataLoaderRegistry registry = DataLoaderRegistry.withDefaultLoaders();
        assertThat(registry.getNames(), contains(CsvDataLoader.NAME, JsonLinesDataLoader.NAME));
        assertThrows(IllegalStateException.class, () -> registry.register(new CsvDataLoader()));
    }
}
