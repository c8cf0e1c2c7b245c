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

import java.nio.file.Path;
import java.util.Map;

import com.amazon.novelty.exception.DataLoadException;

/**
 * Reads a {@link Dataset} from a file. Loaders are registered by name in a
 * {@link DataLoaderRegistry} and selected by the experiment configuration.
 */
public interface DataLoader {

    /**
     * @return the name under which this loader is registered
     */
    String getName();

    /**
     * Load a dataset.
     *
     * @param path   the file to read
     * @param params loader specific parameters, passed verbatim from the
     *               configuration
     * @return a dataset with an id field as long as every other field
     * @throws DataLoadException if the file cannot be read or is malformed
     */
    Dataset load(Path path, Map<String, Object> params);
}
