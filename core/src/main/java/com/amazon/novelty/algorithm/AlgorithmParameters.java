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

import static com.amazon.novelty.CommonUtils.checkArgument;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parameters of one algorithm invocation after validation against its
 * {@link ParameterSchema}. Values already have the declared types.
 */
public class AlgorithmParameters {

    private final Map<String, Object> values;

    public AlgorithmParameters(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static AlgorithmParameters empty() {
        return new AlgorithmParameters(Collections.emptyMap());
    }

    public int getInt(String name) {
        return (Integer) require(name);
    }

    public double getDouble(String name) {
        return (Double) require(name);
    }

    public boolean getBoolean(String name) {
        return (Boolean) require(name);
    }

    public String getString(String name) {
        return (String) require(name);
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    /**
     * @return every parameter with its value, in schema order
     */
    public Map<String, Object> asMap() {
        return values;
    }

    private Object require(String name) {
        Object value = values.get(name);
        checkArgument(value != null, String.format("parameter '%s' has no value", name));
        return value;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
