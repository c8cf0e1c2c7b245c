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

import com.amazon.novelty.registry.NamedRegistry;

public class DataLoaderRegistry extends NamedRegistry<DataLoader> {

    public DataLoaderRegistry() {
        super("data loader");
    }

    /**
     * Register a loader under its own name.
     *
     * @param loader the loader
     */
    public void register(DataLoader loader) {
        register(loader.getName(), loader);
    }

    /**
     * @return a frozen registry holding every loader shipped with the pipeline
     */
    public static DataLoaderRegistry withDefaultLoaders() {
        DataLoaderRegistry registry = new DataLoaderRegistry();
        registry.register(new CsvDataLoader());
        registry.register(new JsonLinesDataLoader());
        registry.freeze();
        return registry;
    }
}
