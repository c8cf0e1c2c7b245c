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

import static com.amazon.novelty.CommonUtils.checkNotNull;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.IdentityHashMap;
import java.util.Map;

import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;

/**
 * Programmatic additions to the logback configuration loaded from
 * {@code logback.xml}.
 */
public class LoggerConfig {

    public static final String FILE_PATTERN = "%d{yyyy-MM-dd HH:mm:ss} %-5level %logger{36} - %msg%n";

    // root levels replaced by addFileAppender, keyed by the appender that replaced them
    private static final Map<FileAppender<ILoggingEvent>, Level> replacedRootLevels = new IdentityHashMap<>();

    private LoggerConfig() {
    }

    /**
     * Copy every log event at INFO or above to a file, in addition to the
     * configured appenders. The file is appended to if it exists. A root level
     * above INFO is lowered to INFO until the appender is removed.
     *
     * @param logFile the log file; missing parent directories are created
     * @return the started appender, attached to the root logger
     */
    public static FileAppender<ILoggingEvent> addFileAppender(Path logFile) {
        checkNotNull(logFile, "logFile must not be null");
        Path parent = logFile.toAbsolutePath().getParent();
        try {
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("cannot create directory for log file " + logFile.toAbsolutePath(), e);
        }

        LoggerContext loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();

        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(loggerContext);
        encoder.setPattern(FILE_PATTERN);
        encoder.start();

        FileAppender<ILoggingEvent> appender = new FileAppender<>();
        appender.setContext(loggerContext);
        appender.setName("FILE");
        appender.setFile(logFile.toAbsolutePath().toString());
        appender.setAppend(true);
        appender.setEncoder(encoder);
        appender.start();

        Logger rootLogger = loggerContext.getLogger(Logger.ROOT_LOGGER_NAME);
        synchronized (replacedRootLevels) {
            Level level = rootLogger.getLevel();
            if (!Level.INFO.isGreaterOrEqual(level)) {
                replacedRootLevels.put(appender, level);
                rootLogger.setLevel(Level.INFO);
            }
        }
        rootLogger.addAppender(appender);
        return appender;
    }

    /**
     * Detach and stop an appender added by {@link #addFileAppender}, and put back
     * the root level it replaced.
     *
     * @param appender the appender
     */
    public static void removeFileAppender(FileAppender<ILoggingEvent> appender) {
        LoggerContext loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger rootLogger = loggerContext.getLogger(Logger.ROOT_LOGGER_NAME);
        rootLogger.detachAppender(appender);
        appender.stop();
        synchronized (replacedRootLevels) {
            if (replacedRootLevels.containsKey(appender)) {
                rootLogger.setLevel(replacedRootLevels.remove(appender));
            }
        }
    }
}
