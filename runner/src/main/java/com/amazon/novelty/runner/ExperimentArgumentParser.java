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

import static com.amazon.novelty.CommonUtils.checkArgument;
import static com.amazon.novelty.CommonUtils.checkNotNull;

import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Parses the command line of the experiment runner: one positional
 * configuration file followed or preceded by options.
 */
public class ExperimentArgumentParser {

    public static final String ARCHIVE_NAME = "novelty-runner-1.0.jar";
    public static final long DEFAULT_SEED = 1234L;

    private final String runnerClass;
    private final String runnerDescription;
    private final Map<String, Argument<?>> shortFlags;
    private final Map<String, Argument<?>> longFlags;
    private final StringArgument outDir;
    private final StringArgument logFile;
    private final LongArgument seed;
    private String configFile;
    private boolean helpRequested;

    /**
     * Create a new parser. The runner class and runner description will be used in
     * help text.
     *
     * @param runnerClass       The name of the runner class where this argument
     *                          parser is being invoked.
     * @param runnerDescription A description of the runner.
     */
    public ExperimentArgumentParser(String runnerClass, String runnerDescription) {
        this.runnerClass = runnerClass;
        this.runnerDescription = runnerDescription;
        shortFlags = new LinkedHashMap<>();
        longFlags = new LinkedHashMap<>();

        outDir = new StringArgument("-o", "--out_dir",
                "Output directory; overrides out_dir in the configuration file.", null);
        addArgument(outDir);

        logFile = new StringArgument("-l", "--log_file", "Also write the log to this file.", null);
        addArgument(logFile);

        seed = new LongArgument(null, "--seed", "Seed for every stochastic algorithm.", DEFAULT_SEED);
        addArgument(seed);
    }

    protected void addArgument(Argument<?> argument) {
        checkNotNull(argument, "argument should not be null");

        checkArgument(argument.getShortFlag() == null || !shortFlags.containsKey(argument.getShortFlag()),
                String.format("An argument mapping already exists for %s", argument.getShortFlag()));

        checkArgument(!longFlags.containsKey(argument.getLongFlag()),
                String.format("An argument mapping already exists for %s", argument.getLongFlag()));

        if (argument.getShortFlag() != null) {
            shortFlags.put(argument.getShortFlag(), argument);
        }

        longFlags.put(argument.getLongFlag(), argument);
    }

    /**
     * Parse the given command-line arguments. Parsing stops at {@code -h} or
     * {@code --help}.
     *
     * @param arguments An array of command-line arguments.
     * @throws IllegalArgumentException for an unknown option, an option without a
     *                                  value, an invalid value, or anything other
     *                                  than exactly one configuration file
     */
    public void parse(String... arguments) {
        int i = 0;
        while (i < arguments.length) {
            String flag = arguments[i];
            if ("-h".equals(flag) || "--help".equals(flag)) {
                helpRequested = true;
                return;
            }

            Argument<?> argument = shortFlags.containsKey(flag) ? shortFlags.get(flag) : longFlags.get(flag);
            if (argument != null) {
                checkArgument(i + 1 < arguments.length, "Missing value for argument: " + flag);
                argument.parse(arguments[++i]);
            } else if (flag.startsWith("-") && flag.length() > 1) {
                throw new IllegalArgumentException("Unknown argument: " + flag);
            } else {
                checkArgument(configFile == null, "Unexpected extra argument: " + flag);
                configFile = flag;
            }

            i++;
        }
        checkArgument(configFile != null, "Missing required argument: config_file");
    }

    /**
     * Print a usage message.
     *
     * @param out the stream to print to
     */
    public void printUsage(PrintStream out) {
        out.println(String.format("Usage: java -jar %s [options] config_file", ARCHIVE_NAME));
        out.println();
        out.println(runnerClass + ": " + runnerDescription);
        out.println();
        out.println("Options:");

        longFlags.values().stream().map(Argument::getHelpMessage).sorted().forEach(msg -> out.println("\t" + msg));

        out.println();
        out.println("\t--help, -h: Print this help message and exit.");
    }

    public String getConfigFile() {
        return configFile;
    }

    /**
     * @return the output directory given on the command line, or null
     */
    public String getOutDir() {
        return outDir.getValue();
    }

    /**
     * @return the log file given on the command line, or null
     */
    public String getLogFile() {
        return logFile.getValue();
    }

    public long getSeed() {
        return seed.getValue();
    }

    public boolean isHelpRequested() {
        return helpRequested;
    }

    public static class Argument<T> {

        private final String shortFlag;
        private final String longFlag;
        private final String description;
        private final T defaultValue;
        private final Function<String, T> parseFunction;
        private final Consumer<T> validateFunction;
        private T value;

        public Argument(String shortFlag, String longFlag, String description, T defaultValue,
                Function<String, T> parseFunction, Consumer<T> validateFunction) {
            this.shortFlag = shortFlag;
            this.longFlag = longFlag;
            this.description = description;
            this.defaultValue = defaultValue;
            this.parseFunction = parseFunction;
            this.validateFunction = validateFunction;
            value = defaultValue;
        }

        public Argument(String shortFlag, String longFlag, String description, T defaultValue,
                Function<String, T> parseFunction) {
            this(shortFlag, longFlag, description, defaultValue, parseFunction, t -> {
            });
        }

        public String getShortFlag() {
            return shortFlag;
        }

        public String getLongFlag() {
            return longFlag;
        }

        public String getHelpMessage() {
            String defaultText = (defaultValue == null) ? "" : String.format(" (default: %s)", defaultValue);
            if (shortFlag != null) {
                return String.format("%s, %s: %s%s", longFlag, shortFlag, description, defaultText);
            } else {
                return String.format("%s: %s%s", longFlag, description, defaultText);
            }
        }

        public void parse(String string) {
            value = parseFunction.apply(string);
            validateFunction.accept(value);
        }

        public T getValue() {
            return value;
        }
    }

    public static class StringArgument extends Argument<String> {
        public StringArgument(String shortFlag, String longFlag, String description, String defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, x -> x,
                    x -> checkArgument(!x.isBlank(), longFlag + " must not be blank"));
        }
    }

    public static class LongArgument extends Argument<Long> {
        public LongArgument(String shortFlag, String longFlag, String description, long defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, Long::parseLong);
        }
    }
}
