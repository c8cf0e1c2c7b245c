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

import lombok.Builder;
import lombok.Getter;

/**
 * Describes one parameter accepted by an outlier detection algorithm. Numeric
 * parameters may carry inclusive bounds.
 */
@Getter
@Builder
public class ParameterDefinition {

    private final String name;
    private final ParameterType type;
    private final boolean required;
    private final Object defaultValue;
    private final Double minValue;
    private final Double maxValue;
    private final String description;

    public static ParameterDefinition integer(String name, int defaultValue, int minValue, String description) {
        return ParameterDefinition.builder().name(name).type(ParameterType.INTEGER).defaultValue(defaultValue)
                .minValue((double) minValue).description(description).build();
    }

    public static ParameterDefinition decimal(String name, double defaultValue, double minValue, double maxValue,
            String description) {
        return ParameterDefinition.builder().name(name).type(ParameterType.DOUBLE).defaultValue(defaultValue)
                .minValue(minValue).maxValue(maxValue).description(description).build();
    }
}
