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

package com.amazon.novelty.driver;

import static com.amazon.novelty.CommonUtils.checkNotNull;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.novelty.algorithm.AlgorithmParameters;
import com.amazon.novelty.algorithm.AlgorithmRegistry;
import com.amazon.novelty.algorithm.DetectionContext;
import com.amazon.novelty.algorithm.OutlierDetectionAlgorithm;
import com.amazon.novelty.config.ExperimentConfig;
import com.amazon.novelty.data.DataLoader;
import com.amazon.novelty.data.DataLoaderRegistry;
import com.amazon.novelty.data.Dataset;
import com.amazon.novelty.exception.AlgorithmRuntimeException;
import com.amazon.novelty.exception.ConfigurationException;
import com.amazon.novelty.exception.FeatureExtractionException;
import com.amazon.novelty.feature.FeatureExtractor;
import com.amazon.novelty.feature.FeatureMatrix;
import com.amazon.novelty.feature.FeatureRecipe;
import com.amazon.novelty.feature.ZScoreNormalizer;

/**
 * Runs one experiment end to end. The phases run strictly in sequence on the
 * calling thread:
 * <ol>
 * <li>plan: validate the configuration, resolve the data loader and every
 * algorithm, and validate the algorithm parameters;</li>
 * <li>create the output directory;</li>
 * <li>load the data to fit and the data to score;</li>
 * <li>extract features from both with the same recipe;</li>
 * <li>optionally z-score normalize both with the statistics of the data to
 * fit;</li>
 * <li>run each algorithm in configuration order on the shared matrices.</li>
 * </ol>
 * Configuration problems surface in the first phase, before any data is read or
 * anything is written. The registries are frozen when the driver is built.
 */
public class ExperimentDriver {

    private static final Logger logger = LoggerFactory.getLogger(ExperimentDriver.class);

    private final AlgorithmRegistry algorithmRegistry;
    private final DataLoaderRegistry dataLoaderRegistry;
    private final FeatureExtractor featureExtractor;
    private final ZScoreNormalizer normalizer;

    public ExperimentDriver(AlgorithmRegistry algorithmRegistry, DataLoaderRegistry dataLoaderRegistry) {
        this(algorithmRegistry, dataLoaderRegistry, new FeatureExtractor(), new ZScoreNormalizer());
    }

    public ExperimentDriver(AlgorithmRegistry algorithmRegistry, DataLoaderRegistry dataLoaderRegistry,
            FeatureExtractor featureExtractor, ZScoreNormalizer normalizer) {
        this.algorithmRegistry = checkNotNull(algorithmRegistry, "algorithmRegistry must not be null");
        this.dataLoaderRegistry = checkNotNull(dataLoaderRegistry, "dataLoaderRegistry must not be null");
        this.featureExtractor = checkNotNull(featureExtractor, "featureExtractor must not be null");
        this.normalizer = checkNotNull(normalizer, "normalizer must not be null");
        algorithmRegistry.freeze();
        dataLoaderRegistry.freeze();
    }

    /**
     * Run the experiment described by the configuration.
     *
     * @param config the configuration, with any command line override of the
     *               output directory already applied
     * @param seed   the seed handed to every algorithm
     * @throws ConfigurationException     if the configuration is incomplete or
     *                                    names an unknown loader or algorithm
     * @throws UncheckedIOException       if the output directory cannot be created
     * @throws AlgorithmRuntimeException  if an algorithm fails
     */
    public void run(ExperimentConfig config, long seed) {
        ExperimentPlan plan = plan(config);
        createOutputDirectory(plan.getOutDir());

        logger.info("Loading data_to_fit");
        Dataset fit = plan.getDataLoader().load(Paths.get(config.getDataToFit()), plan.getLoaderParams());
        logger.info("Loading data_to_score");
        Dataset score = plan.getDataLoader().load(Paths.get(config.getDataToScore()), plan.getLoaderParams());

        FeatureMatrix[] features = featureExtractor.extractPair(fit, score, plan.getRecipe());
        FeatureMatrix fitFeatures = features[0];
        FeatureMatrix scoreFeatures = features[1];
        logger.info("data_to_fit dimension (row x column): {} x {}", fitFeatures.getRows(), fitFeatures.getColumns());
        logger.info("data_to_score dimension (row x column): {} x {}", scoreFeatures.getRows(),
                scoreFeatures.getColumns());

        if (config.isZscoreNormalization()) {
            if (fitFeatures.getRows() == 0) {
                throw new FeatureExtractionException("z-score normalization needs at least one sample in data_to_fit");
            }
            ZScoreNormalizer.NormalizedPair normalized = normalizer.normalize(fitFeatures, scoreFeatures);
            fitFeatures = normalized.getFit();
            scoreFeatures = normalized.getScore();
            logger.info("Applied z-score normalization using data_to_fit statistics");
        }

        DetectionContext context = DetectionContext.builder().fitFeatures(fitFeatures).scoreFeatures(scoreFeatures)
                .scoreIds(score.getIds()).outDir(plan.getOutDir()).resultsConfig(config.getResults())
                .topN(config.getTopN()).logger(logger).seed(seed).build();
        execute(plan, context);
    }

    /**
     * Resolve a configuration against the registries without touching the file
     * system.
     *
     * @param config the configuration
     * @return the plan
     * @throws ConfigurationException if anything fails to validate or resolve
     */
    public ExperimentPlan plan(ExperimentConfig config) {
        checkNotNull(config, "config must not be null");
        config.validate();
        DataLoader loader = dataLoaderRegistry.resolve(config.getDataLoader().getName());
        Map<String, Object> loaderParams = (config.getDataLoader().getParams() == null) ? new LinkedHashMap<>()
                : config.getDataLoader().getParams();
        FeatureRecipe recipe = FeatureRecipe.fromConfiguration(config.getFeatures());

        List<ExperimentPlan.PlannedRun> runs = new ArrayList<>();
        for (Map.Entry<String, Map<String, Object>> entry : config.resolveAlgorithms().entrySet()) {
            OutlierDetectionAlgorithm algorithm = algorithmRegistry.resolve(entry.getKey());
            AlgorithmParameters parameters = algorithm.getParameterSchema().validate(entry.getKey(), entry.getValue());
            runs.add(new ExperimentPlan.PlannedRun(entry.getKey(), algorithm, parameters));
        }
        return new ExperimentPlan(config, loader, loaderParams, recipe, Paths.get(config.getOutDir()), runs);
    }

    private void execute(ExperimentPlan plan, DetectionContext context) {
        List<ExperimentPlan.PlannedRun> runs = plan.getRuns();
        List<AlgorithmRuntimeException> failures = new ArrayList<>();
        for (int i = 0; i < runs.size(); i++) {
            ExperimentPlan.PlannedRun run = runs.get(i);
            logger.info("Outlier detection [{}/{}]: {} {}", i + 1, runs.size(), run.getName(), run.getParameters());
            try {
                run.getAlgorithm().run(context, run.getParameters());
            } catch (RuntimeException e) {
                AlgorithmRuntimeException failure = asAlgorithmFailure(run.getName(), e);
                if (!plan.getConfig().isContinueOnError()) {
                    throw failure;
                }
                logger.error("Outlier detection algorithm '{}' failed, continuing with the remaining algorithms",
                        run.getName(), failure);
                failures.add(failure);
            }
        }

        if (!failures.isEmpty()) {
            List<String> names = new ArrayList<>();
            failures.forEach(failure -> names.add(failure.getAlgorithmName()));
            AlgorithmRuntimeException summary = new AlgorithmRuntimeException(null,
                    String.format("%d of %d outlier detection algorithms failed: %s", failures.size(), runs.size(),
                            names));
            failures.forEach(summary::addSuppressed);
            throw summary;
        }
    }

    private static AlgorithmRuntimeException asAlgorithmFailure(String name, RuntimeException e) {
        if (e instanceof AlgorithmRuntimeException) {
            return (AlgorithmRuntimeException) e;
        }
        return new AlgorithmRuntimeException(name, String.format("algorithm '%s' failed: %s", name, e.getMessage()),
                e);
    }

    private static void createOutputDirectory(Path outDir) {
        if (Files.isDirectory(outDir)) {
            return;
        }
        try {
            Files.createDirectories(outDir);
            logger.info("Created out_dir: {}", outDir.toAbsolutePath());
        } catch (IOException e) {
            throw new UncheckedIOException("cannot create output directory " + outDir.toAbsolutePath(), e);
        }
    }
}
