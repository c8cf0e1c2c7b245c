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

package com.amazon.novelty.runner;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;

public class LoggerConfigTest {

    @TempDir
    Path directory;

    private Logger rootLogger;
    private Level initialLevel;

    @BeforeEach
    public void setUp() {
        rootLogger = ((LoggerContext) LoggerFactory.getILoggerFactory()).getLogger(Logger.ROOT_LOGGER_NAME);
        initialLevel = rootLogger.getLevel();
    }

    @AfterEach
    public void tearDown() {
        rootLogger.setLevel(initialLevel);
    }

    @Test
    public void testQuietRootLevelIsRestored() throws IOException {
        rootLogger.setLevel(Level.WARN);
        Path logFile = directory.resolve("logs").resolve("run.log");

        FileAppender<ILoggingEvent> appender = LoggerConfig.addFileAppender(logFile);
        assertEquals(Level.INFO, rootLogger.getLevel());
        LoggerFactory.getLogger(LoggerConfigTest.class).info("written to the file");
        LoggerConfig.removeFileAppender(appender);

        assertEquals(Level.WARN, rootLogger.getLevel());
        assertTrue(Files.readString(logFile).contains("written to the file"));
    }

    @Test
    public void testVerboseRootLevelIsKept() {
        rootLogger.setLevel(Level.DEBUG);

        FileAppender<ILoggingEvent> appender = LoggerConfig.addFileAppender(directory.resolve("run.log"));
        assertEquals(Level.DEBUG, rootLogger.getLevel());
        LoggerConfig.removeFileAppender(appender);

        assertEquals(Level.DEBUG, rootLogger.getLevel());
    }
}
