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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.novelty.exception.ConfigurationException;
import com.amazon.novelty.exception.DuplicateNameException;
import com.amazon.novelty.exception.NotFoundException;

public class NamedRegistryTest {

    private NamedRegistry<Object> registry;

    @BeforeEach
    public void setUp() {
        registry = new NamedRegistry<>("widget");
    }

    @Test
    public void testRegisterAndResolve() {
        Object first = new Object();
        Object second = new Object();
        registry.register("first", first);
        registry.register("second", second);

        assertThat(registry.resolve("first"), sameInstance(first));
        assertThat(registry.resolve("second"), sameInstance(second));
        assertThat(registry.getNames(), contains("first", "second"));
        assertTrue(registry.contains("first"));
        assertFalse(registry.contains("third"));
    }

    @Test
    public void testDuplicateName() {
        registry.register("name", new Object());
        assertThrows(DuplicateNameException.class, () -> registry.register("name", new Object()));
    }

    @Test
    public void testUnknownName() {
        registry.register("name", new Object());
        NotFoundException exception = assertThrows(NotFoundException.class, () -> registry.resolve("nonexistent"));
        assertTrue(exception.getMessage().contains("nonexistent"));
        assertTrue(exception instanceof ConfigurationException);
        assertThrows(NotFoundException.class, () -> registry.resolve(null));
    }

    @Test
    public void testFreeze() {
        registry.register("name", new Object());
        registry.freeze();
        assertTrue(registry.isFrozen());
        assertThrows(IllegalStateException.class, () -> registry.register("other", new Object()));
        registry.resolve("name");
    }

    @Test
    public void testInvalidRegistration() {
        assertThrows(NullPointerException.class, () -> registry.register(null, new Object()));
        assertThrows(IllegalArgumentException.class, () -> registry.register(" ", new Object()));
        assertThrows(NullPointerException.class, () -> registry.register("name", null));
    }
}
