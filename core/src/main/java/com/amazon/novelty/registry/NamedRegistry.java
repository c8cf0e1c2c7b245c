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

package com.amazon.novelty.registry;

import static com.amazon.novelty.CommonUtils.checkArgument;
import static com.amazon.novelty.CommonUtils.checkNotNull;
import static com.amazon.novelty.CommonUtils.checkState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.amazon.novelty.exception.DuplicateNameException;
import com.amazon.novelty.exception.NotFoundException;

/**
 * A mapping from unique names to implementations. A registry is built once per
 * run: it is constructed empty, populated with {@link #register}, frozen with
 * {@link #freeze}, and from then on only used for lookups. Registries are not
 * thread-safe; registration is expected to happen from a single thread before
 * the registry is shared.
 *
 * @param <T> the type of the registered implementations
 */
public class NamedRegistry<T> {

    private final String kind;
    private final Map<String, T> entries = new LinkedHashMap<>();
    private boolean frozen;

    /**
     * @param kind a human readable description of the registered entries, used in
     *             error messages (for example "outlier detection algorithm")
     */
    public NamedRegistry(String kind) {
        this.kind = checkNotNull(kind, "kind must not be null");
    }

    /**
     * Bind an implementation to a name.
     *
     * @param name           the unique name
     * @param implementation the implementation to bind
     * @throws DuplicateNameException if the name is already bound
     * @throws IllegalStateException  if the registry has been frozen
     */
    public void register(String name, T implementation) {
        checkNotNull(name, "name must not be null");
        checkArgument(!name.isBlank(), "name must not be blank");
        checkNotNull(implementation, "implementation must not be null");
        checkState(!frozen, String.format("%s registry is frozen, cannot register '%s'", kind, name));
        if (entries.containsKey(name)) {
            throw new DuplicateNameException(String.format("%s '%s' is already registered", kind, name));
        }
        entries.put(name, implementation);
    }

    /**
     * Look up the implementation bound to a name.
     *
     * @param name the name to resolve
     * @return the bound implementation, never null
     * @throws NotFoundException if nothing is bound to the name
     */
    public T resolve(String name) {
        T implementation = (name == null) ? null : entries.get(name);
        if (implementation == null) {
            throw new NotFoundException(
                    String.format("%s '%s' is not registered. Registered names: %s", kind, name, entries.keySet()));
        }
        return implementation;
    }

    public boolean contains(String name) {
        return entries.containsKey(name);
    }

    /**
     * @return the registered names in registration order
     */
    public List<String> getNames() {
        return Collections.unmodifiableList(new ArrayList<>(entries.keySet()));
    }

    /**
     * Disallow any further registration.
     */
    public void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public String getKind() {
        return kind;
    }
}
