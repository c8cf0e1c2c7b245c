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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.amazon.novelty.exception.DataLoadException;

public class DatasetTest {

    @Test
    public void testBuild() {
        Dataset dataset = Dataset.builder().ids(List.of("a", "b")).field("x", List.of(1.0, 2.0))
                .field("label", List.of("cat", "dog")).build();
        assertEquals(2, dataset.size());
        assertThat(dataset.getIds(), contains("a", "b"));
        assertThat(dataset.getFieldNames(), contains("x", "label"));
        assertTrue(dataset.hasField("x"));
        assertFalse(dataset.hasField(Dataset.ID_FIELD));
        assertEquals(2.0, dataset.getField("x").get(1));
        assertThrows(IllegalArgumentException.class, () -> dataset.getField("y"));
        assertThrows(UnsupportedOperationException.class, () -> dataset.getIds().add("c"));
    }

    @Test
    public void testFieldsMustHaveSameLength() {
        Dataset.Builder builder = Dataset.builder().ids(List.of("a", "b")).field("x", List.of(1.0));
        assertThrows(DataLoadException.class, builder::build);
    }

    @Test
    public void testIdsAreMandatory() {
        Dataset.Builder builder = Dataset.builder().field("x", List.of(1.0));
        assertThrows(DataLoadException.class, builder::build);
        assertThrows(IllegalArgumentException.class, () -> Dataset.builder().field(Dataset.ID_FIELD, List.of()));
    }
}
