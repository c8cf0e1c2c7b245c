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

package com.amazon.novelty.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

import com.amazon.novelty.exception.ConfigurationException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Reads an {@link ExperimentConfig} from a YAML ({@code .yml}, {@code .yaml}) or
 * JSON file. Unknown top level properties are rejected.
 */
public class ConfigReader {

    private final ObjectMapper yamlMapper;
    private final ObjectMapper jsonMapper;

    public ConfigReader() {
        this.yamlMapper = configure(new ObjectMapper(new YAMLFactory()));
        this.jsonMapper = configure(new ObjectMapper());
    }

    /**
     * @param path the configuration file
     * @return the parsed and validated configuration
     * @throws ConfigurationException if the file is missing, cannot be parsed, or
     *                                lacks a required field
     */
    public ExperimentConfig read(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("Configuration file not found: " + path.toAbsolutePath());
        }
        ExperimentConfig config = parse(path);
        config.validate();
        return config;
    }

    /**
     * Parse without validation, for callers that still need to apply overrides.
     *
     * @param path the configuration file
     * @return the parsed configuration
     */
    public ExperimentConfig parse(Path path) {
        try {
            ExperimentConfig config = mapperFor(path).readValue(path.toFile(), ExperimentConfig.class);
            if (config == null) {
                throw new ConfigurationException("configuration file is empty: " + path.toAbsolutePath());
            }
            if (config.getResults() == null) {
                config.setResults(new ResultsConfig());
            }
            return config;
        } catch (IOException e) {
            throw new ConfigurationException(
                    String.format("cannot parse configuration file %s: %s", path.toAbsolutePath(), e.getMessage()), e);
        }
    }

    private ObjectMapper mapperFor(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return (name.endsWith(".yml") || name.endsWith(".yaml")) ? yamlMapper : jsonMapper;
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
        return mapper;
    }
}
