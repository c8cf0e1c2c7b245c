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

package com.amazon.novelty.algorithm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.amazon.novelty.exception.ConfigurationException;

/**
 * The set of parameters an outlier detection algorithm accepts. Validation turns
 * the open-ended parameter mapping of a configuration into a typed
 * {@link AlgorithmParameters} record, reporting unknown keys, missing required
 * keys, wrong types and out of range values together.
 */
public class ParameterSchema {

    private static final ParameterSchema EMPTY = new ParameterSchema(Collections.emptyList());

    private final Map<String, ParameterDefinition> definitions = new LinkedHashMap<>();

    public ParameterSchema(List<ParameterDefinition> definitions) {
        for (ParameterDefinition definition : definitions) {
            this.definitions.put(definition.getName(), definition);
        }
    }

    public static ParameterSchema of(ParameterDefinition... definitions) {
        return new ParameterSchema(List.of(definitions));
    }

    public static ParameterSchema empty() {
        return EMPTY;
    }

    public List<ParameterDefinition> getDefinitions() {
        return new ArrayList<>(definitions.values());
    }

    /**
     * @param algorithmName the algorithm being configured, used in error messages
     * @param raw           the parameter mapping from the configuration, may be
     *                      null
     * @return the typed parameters, with defaults filled in
     * @throws ConfigurationException listing every problem found
     */
    public AlgorithmParameters validate(String algorithmName, Map<String, Object> raw) {
        Map<String, Object> input = (raw == null) ? Collections.emptyMap() : raw;
        List<String> errors = new ArrayList<>();
        Map<String, Object> values = new LinkedHashMap<>();

        for (String key : input.keySet()) {
            if (!definitions.containsKey(key)) {
                errors.add(String.format("unknown parameter '%s' (accepted: %s)", key, definitions.keySet()));
            }
        }

        for (ParameterDefinition definition : definitions.values()) {
            Object value = input.get(definition.getName());
            if (value == null) {
                if (definition.isRequired()) {
                    errors.add(String.format("missing required parameter '%s'", definition.getName()));
                } else if (definition.getDefaultValue() != null) {
                    values.put(definition.getName(), definition.getDefaultValue());
                }
                continue;
            }
            Object converted = convert(definition, value, errors);
            if (converted != null) {
                values.put(definition.getName(), converted);
            }
        }

        if (!errors.isEmpty()) {
            throw new ConfigurationException(
                    String.format("invalid parameters for algorithm '%s': %s", algorithmName, String.join("; ", errors)));
        }
        return new AlgorithmParameters(values);
    }

    private static Object convert(ParameterDefinition definition, Object value, List<String> errors) {
        String name = definition.getName();
        switch (definition.getType()) {
        case INTEGER:
            if (!(value instanceof Integer || value instanceof Long)) {
                errors.add(String.format("parameter '%s' expects an integer, got '%s'", name, value));
                return null;
            }
            long integer = ((Number) value).longValue();
            if (integer < Integer.MIN_VALUE || integer > Integer.MAX_VALUE) {
                errors.add(String.format("parameter '%s' value %d does not fit an integer", name, integer));
                return null;
            }
            return checkRange(definition, (int) integer, errors) ? Integer.valueOf((int) integer) : null;
        case DOUBLE:
            if (!(value instanceof Number)) {
                errors.add(String.format("parameter '%s' expects a number, got '%s'", name, value));
                return null;
            }
            double number = ((Number) value).doubleValue();
            return checkRange(definition, number, errors) ? Double.valueOf(number) : null;
        case BOOLEAN:
            if (!(value instanceof Boolean)) {
                errors.add(String.format("parameter '%s' expects true or false, got '%s'", name, value));
                return null;
            }
            return value;
        case STRING:
        default:
            return value.toString();
        }
    }

    private static boolean checkRange(ParameterDefinition definition, double value, List<String> errors) {
        if (Double.isNaN(value)) {
            errors.add(String.format("parameter '%s' must not be NaN", definition.getName()));
            return false;
        }
        if (definition.getMinValue() != null && value < definition.getMinValue()) {
            errors.add(String.format("parameter '%s' value %s is below minimum %s", definition.getName(), value,
                    definition.getMinValue()));
            return false;
        }
        if (definition.getMaxValue() != null && value > definition.getMaxValue()) {
            errors.add(String.format("parameter '%s' value %s is above maximum %s", definition.getName(), value,
                    definition.getMaxValue()));
            return false;
        }
        return true;
    }
}
