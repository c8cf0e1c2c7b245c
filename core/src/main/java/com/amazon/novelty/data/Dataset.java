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

import static com.amazon.novelty.CommonUtils.checkArgument;
import static com.amazon.novelty.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.amazon.novelty.exception.DataLoadException;

/**
 * The loaded representation of a data set: an ordered mapping from field name
 * to one value per sample, plus the mandatory {@value #ID_FIELD} sequence of
 * sample identifiers. Every field holds exactly {@link #size()} values.
 * <p>
 * Values are {@link Double} for scalar numeric fields, {@code double[]} for
 * vector fields and {@link String} otherwise. A Dataset is immutable once built.
 */
public class Dataset {

    public static final String ID_FIELD = "id";

    private final List<String> ids;
    private final Map<String, List<Object>> fields;

    private Dataset(List<String> ids, Map<String, List<Object>> fields) {
        this.ids = ids;
        this.fields = fields;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the number of samples
     */
    public int size() {
        return ids.size();
    }

    /**
     * @return the sample identifiers, in sample order
     */
    public List<String> getIds() {
        return ids;
    }

    /**
     * @return the names of the non-id fields, in insertion order
     */
    public Set<String> getFieldNames() {
        return fields.keySet();
    }

    public boolean hasField(String name) {
        return fields.containsKey(name);
    }

    /**
     * @param name a field name
     * @return the values of the field, in sample order
     * @throws IllegalArgumentException if the field does not exist
     */
    public List<Object> getField(String name) {
        List<Object> values = fields.get(name);
        checkArgument(values != null, String.format("unknown field '%s'", name));
        return values;
    }

    public static class Builder {
        private List<String> ids;
        private final Map<String, List<Object>> fields = new LinkedHashMap<>();

        public Builder ids(List<String> ids) {
            this.ids = new ArrayList<>(checkNotNull(ids, "ids must not be null"));
            return this;
        }

        public Builder field(String name, List<?> values) {
            checkNotNull(name, "field name must not be null");
            checkNotNull(values, "field values must not be null");
            checkArgument(!ID_FIELD.equals(name), "use ids() to set the id field");
            fields.put(name, new ArrayList<>(values));
            return this;
        }

        /**
         * @return the dataset
         * @throws DataLoadException if the ids are missing or a field has a different
         *                           number of values than there are ids
         */
        public Dataset build() {
            if (ids == null) {
                throw new DataLoadException("dataset has no '" + ID_FIELD + "' field");
            }
            Map<String, List<Object>> frozen = new LinkedHashMap<>();
            for (Map.Entry<String, List<Object>> entry : fields.entrySet()) {
                if (entry.getValue().size() != ids.size()) {
                    throw new DataLoadException(String.format("field '%s' has %d values but there are %d ids",
                            entry.getKey(), entry.getValue().size(), ids.size()));
                }
                frozen.put(entry.getKey(), Collections.unmodifiableList(entry.getValue()));
            }
            return new Dataset(Collections.unmodifiableList(ids), Collections.unmodifiableMap(frozen));
        }
    }
}
