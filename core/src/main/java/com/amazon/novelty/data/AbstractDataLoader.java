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

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import com.amazon.novelty.exception.DataLoadException;

/**
 * Shared parameter handling for the loaders shipped with the pipeline.
 */
public abstract class AbstractDataLoader implements DataLoader {

    public static final String ID_FIELD_PARAM = "id_field";

    private final String name;
    private final Set<String> knownParameters;

    protected AbstractDataLoader(String name, Set<String> knownParameters) {
        this.name = name;
        this.knownParameters = knownParameters;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Dataset load(Path path, Map<String, Object> params) {
        Map<String, Object> actual = (params == null) ? Collections.emptyMap() : params;
        Set<String> unknown = new TreeSet<>(actual.keySet());
        unknown.removeAll(knownParameters);
        if (!unknown.isEmpty()) {
            throw new DataLoadException(String.format("unknown parameters %s for data loader '%s', expected a subset of %s",
                    unknown, name, new TreeSet<>(knownParameters)));
        }
        if (!Files.isRegularFile(path)) {
            throw new DataLoadException("data file not found: " + path.toAbsolutePath());
        }
        return read(path, actual);
    }

    /**
     * Read the file once the parameters have been checked.
     *
     * @param path   an existing file
     * @param params parameters restricted to the known names
     * @return the dataset
     */
    protected abstract Dataset read(Path path, Map<String, Object> params);

    protected static String stringParameter(Map<String, Object> params, String key, String defaultValue) {
        Object value = params.get(key);
        return (value == null) ? defaultValue : value.toString();
    }
}
