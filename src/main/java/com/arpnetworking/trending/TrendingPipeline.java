/*
 * Copyright 2026 Inscope Metrics
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.arpnetworking.trending;

import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.arpnetworking.trending.condition.CompositeCondition;
import com.arpnetworking.trending.configuration.ConditionDefinition;
import com.arpnetworking.trending.configuration.CorrelationDefinition;
import com.arpnetworking.trending.configuration.ExtractionDefinition;
import com.arpnetworking.trending.configuration.TrendingConfiguration;
import com.arpnetworking.trending.correlation.CorrelationResult;
import com.arpnetworking.trending.extraction.DataExtractor;
import com.arpnetworking.trending.extraction.ExtractionResult;
import com.arpnetworking.trending.model.MnemonicTable;
import com.arpnetworking.trending.model.TrendSummary;
import com.arpnetworking.trending.statistics.TrendStatistics;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs the configured extraction and correlation routines over a batch of
 * telemetry. A routine whose condition mnemonics are absent from the batch is
 * skipped; the rest of the batch still runs.
 *
 * @author Inscope Metrics
 */
public final class TrendingPipeline {

    /**
     * Public constructor.
     *
     * @param configuration The routines to run.
     */
    public TrendingPipeline(final TrendingConfiguration configuration) {
        this(configuration, new DataExtractor(), new TrendStatistics());
    }

    /**
     * Constructor with explicit collaborators.
     *
     * @param configuration The routines to run.
     * @param extractor The extractor.
     * @param statistics The summarizer.
     */
    public TrendingPipeline(
            final TrendingConfiguration configuration,
            final DataExtractor extractor,
            final TrendStatistics statistics) {
        _configuration = configuration;
        _extractor = extractor;
        _statistics = statistics;
    }

    /**
     * Run every routine.
     *
     * @param tables The telemetry keyed by mnemonic identifier.
     * @return The report.
     */
    public TrendingReport run(final Map<String, MnemonicTable> tables) {
        final ImmutableMap.Builder<String, ImmutableMap<String, TrendSummary>> summaries = ImmutableMap.builder();
        final ImmutableMap.Builder<String, ImmutableMap<String, ExtractionResult>> extractions = ImmutableMap.builder();
        final ImmutableMap.Builder<String, CorrelationResult> correlations = ImmutableMap.builder();

        for (final ExtractionDefinition definition : _configuration.getExtractions()) {
            final Optional<CompositeCondition> condition = buildCondition(
                    definition.getName(),
                    definition.getConditions(),
                    tables);
            if (!condition.isPresent()) {
                continue;
            }

            final ImmutableMap.Builder<String, TrendSummary> routineSummaries = ImmutableMap.builder();
            final ImmutableMap.Builder<String, ExtractionResult> routineExtractions = ImmutableMap.builder();
            try (CompositeCondition scoped = condition.get()) {
                for (final String mnemonic : definition.getMnemonics()) {
                    final MnemonicTable table = tables.get(mnemonic);
                    if (table == null) {
                        LOGGER.warn()
                                .setMessage("Extraction mnemonic not found")
                                .addData("routine", definition.getName())
                                .addData("mnemonic", mnemonic)
                                .log();
                        continue;
                    }
                    final ExtractionResult result = _extractor.extract(scoped, table);
                    routineExtractions.put(mnemonic, result);
                    if (result.isEmpty()) {
                        LOGGER.warn()
                                .setMessage("No data for condition")
                                .addData("routine", definition.getName())
                                .addData("mnemonic", mnemonic)
                                .log();
                        continue;
                    }
                    _statistics.summarize(table, result).ifPresent(summary -> routineSummaries.put(mnemonic, summary));
                }
            }
            summaries.put(definition.getName(), routineSummaries.build());
            extractions.put(definition.getName(), routineExtractions.build());
            LOGGER.info()
                    .setMessage("Extraction routine complete")
                    .addData("routine", definition.getName())
                    .log();
        }

        for (final CorrelationDefinition definition : _configuration.getCorrelations()) {
            final MnemonicTable positions = tables.get(definition.getPositionMnemonic());
            final MnemonicTable ratios = tables.get(definition.getRatioMnemonic());
            if (positions == null || ratios == null) {
                LOGGER.warn()
                        .setMessage("Correlation mnemonic not found")
                        .addData("routine", definition.getName())
                        .addData("positionMnemonic", definition.getPositionMnemonic())
                        .addData("ratioMnemonic", definition.getRatioMnemonic())
                        .log();
                continue;
            }
            final Optional<CompositeCondition> condition = buildCondition(
                    definition.getName(),
                    definition.getConditions(),
                    tables);
            if (!condition.isPresent()) {
                continue;
            }
            try (CompositeCondition scoped = condition.get()) {
                final CorrelationResult result = definition.createCorrelator(_configuration.getUnknownLabel())
                        .correlate(scoped, definition.getNominals(), positions, ratios);
                correlations.put(definition.getName(), result);
                LOGGER.info()
                        .setMessage("Correlation routine complete")
                        .addData("routine", definition.getName())
                        .addData("matched", result.getMatches().size())
                        .addData("exhausted", result.getExhausted())
                        .log();
            }
        }

        return new TrendingReport.Builder()
                .setSummaries(summaries.build())
                .setExtractions(extractions.build())
                .setCorrelations(correlations.build())
                .build();
    }

    private Optional<CompositeCondition> buildCondition(
            final String routine,
            final List<ConditionDefinition> definitions,
            final Map<String, MnemonicTable> tables) {
        for (final ConditionDefinition definition : definitions) {
            if (!tables.containsKey(definition.getMnemonic())) {
                LOGGER.warn()
                        .setMessage("Condition mnemonic not found; skipping routine")
                        .addData("routine", routine)
                        .addData("mnemonic", definition.getMnemonic())
                        .log();
                return Optional.empty();
            }
        }
        final CompositeCondition.Builder builder = new CompositeCondition.Builder();
        for (final ConditionDefinition definition : definitions) {
            builder.addCondition(definition.toCondition(tables.get(definition.getMnemonic())));
        }
        return Optional.of(builder.build());
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", Integer.toHexString(System.identityHashCode(this)))
                .add("Configuration", _configuration)
                .toString();
    }

    private final TrendingConfiguration _configuration;
    private final DataExtractor _extractor;
    private final TrendStatistics _statistics;

    private static final Logger LOGGER = LoggerFactory.getLogger(TrendingPipeline.class);
}
