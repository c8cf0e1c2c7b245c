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

package com.amazon.novelty.exception;

import lombok.Getter;

/**
 * Raised when an outlier detection algorithm fails while it runs.
 */
@Getter
public class AlgorithmRuntimeException extends NoveltyExperimentException {

    private static final long serialVersionUID = 1L;

    /**
     * Name of the failed algorithm, or null when the exception summarizes several
     * failures.
     */
    private final String algorithmName;

    public AlgorithmRuntimeException(String algorithmName, String message) {
        super(message);
        this.algorithmName = algorithmName;
    }

    public AlgorithmRuntimeException(String algorithmName, String message, Throwable cause) {
        super(message, cause);
        this.algorithmName = algorithmName;
    }
}
