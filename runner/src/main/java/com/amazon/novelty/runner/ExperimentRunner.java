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

import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;

import com.amazon.novelty.algorithm.AlgorithmRegistry;
import com.amazon.novelty.config.ConfigReader;
import com.amazon.novelty.config.ExperimentConfig;
import com.amazon.novelty.data.DataLoaderRegistry;
import com.amazon.novelty.detectors.Detectors;
import com.amazon.novelty.driver.ExperimentDriver;

/**
 * Command line entry point: reads an experiment configuration and runs it with
 * every built-in data loader and detector.
 *
 * <pre>
 * java -jar novelty-runner-1.0.jar [-o out_dir] [-l log_file] [--seed n] config_file
 * </pre>
 *
 * Exits with status 1 when the configuration file does not exist or the command
 * line is malformed. Any failure of the experiment itself propagates out of
 * {@code main}.
 */
public class ExperimentRunner {

    private static final Logger logger = LoggerFactory.getLogger(ExperimentRunner.class);

    private final AlgorithmRegistry algorithmRegistry;
    private final DataLoaderRegistry dataLoaderRegistry;
    private final ConfigReader configReader;
    private final PrintStream out;
    private final PrintStream err;

    public ExperimentRunner() {
        this(Detectors.defaultAlgorithmRegistry(), DataLoaderRegistry.withDefaultLoaders(), System.out, System.err);
    }

    public ExperimentRunner(AlgorithmRegistry algorithmRegistry, DataLoaderRegistry dataLoaderRegistry,
            PrintStream out, PrintStream err) {
        this.algorithmRegistry = checkNotNull(algorithmRegistry, "algorithmRegistry must not be null");
        this.dataLoaderRegistry = checkNotNull(dataLoaderRegistry, "dataLoaderRegistry must not be null");
        this.configReader = new ConfigReader();
        this.out = checkNotNull(out, "out must not be null");
        this.err = checkNotNull(err, "err must not be null");
    }

    public static void main(String... args) {
        int status = new ExperimentRunner().run(args);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Parse the command line and run the experiment.
     *
     * @param args the command line arguments
     * @return the exit status
     */
    public int run(String... args) {
        ExperimentArgumentParser parser = new ExperimentArgumentParser(ExperimentRunner.class.getSimpleName(),
                "Run the novelty detection algorithms of an experiment configuration and rank the data to score.");
        try {
            parser.parse(args);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            parser.printUsage(err);
            return 1;
        }
        if (parser.isHelpRequested()) {
            parser.printUsage(out);
            return 0;
        }
        return start(Paths.get(parser.getConfigFile()), parser.getOutDir(), parser.getLogFile(), parser.getSeed());
    }

    /**
     * Run the experiment described by a configuration file.
     *
     * @param configFile the configuration file
     * @param outDir     output directory overriding the configured one, or null
     * @param logFile    file receiving a copy of the log, or null
     * @param seed       the seed handed to every algorithm
     * @return 0 on success, 1 if the configuration file does not exist
     */
    public int start(Path configFile, String outDir, String logFile, long seed) {
        Path configPath = configFile.toAbsolutePath();
        if (!Files.isRegularFile(configPath)) {
            err.println("[ERROR] Configuration file not found: " + configPath);
            return 1;
        }

        FileAppender<ILoggingEvent> fileAppender = (logFile == null) ? null
                : LoggerConfig.addFileAppender(Paths.get(logFile));
        try {
            logger.info("Configuration file: {}", configPath);
            ExperimentConfig config = configReader.parse(configPath);
            if (outDir != null) {
                config = config.withOutDir(outDir);
                logger.info("out_dir overridden by the command line: {}", Paths.get(outDir).toAbsolutePath());
            }
            logger.info("Seed: {}", seed);

            new ExperimentDriver(algorithmRegistry, dataLoaderRegistry).run(config, seed);
            logger.info("Experiment finished, results in {}", Paths.get(config.getOutDir()).toAbsolutePath());
            return 0;
        } finally {
            if (fileAppender != null) {
                LoggerConfig.removeFileAppender(fileAppender);
            }
        }
    }
}
