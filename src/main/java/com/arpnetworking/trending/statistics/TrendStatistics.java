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
package com.arpnetworking.trending.statistics;

import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.arpnetworking.trending.extraction.ExtractionResult;
import com.arpnetworking.trending.model.MnemonicTable;
import com.arpnetworking.trending.model.TrendSummary;
import com.arpnetworking.trending.model.ValueType;
import com.google.common.math.Stats;

import java.util.Optional;

/**
 * Condenses the values extracted for a mnemonic into a {@link TrendSummary}
 * covering the period of its table.
 *
 * @author Inscope Metrics
 */
public final class TrendStatistics {

    /**
     * Summarize an extraction.
     *
     * @param table The table the values were extracted from.
     * @param result The extracted values.
     * @return The summary, or empty when there is nothing numeric to summarize.
     */
    public Optional<TrendSummary> summarize(final MnemonicTable table, final ExtractionResult result) {
        if (result.isEmpty()) {
            return Optional.empty();
        }
        if (result.getValueType() != ValueType.NUMERIC) {
            LOGGER.warn()
                    .setMessage("Cannot summarize categorical values")
                    .addData("mnemonic", result.getIdentifier())
                    .log();
            return Optional.empty();
        }

        final Stats stats = Stats.of(result.getNumericValues());
        // Sample deviation is undefined for a single value
        final double deviation = stats.count() > 1 ? stats.sampleStandardDeviation() : 0d;
        return Optional.of(new TrendSummary.Builder()
                .setIdentifier(result.getIdentifier())
                .setStart(table.getStart())
                .setEnd(table.getEnd())
                .setCount(stats.count())
                .setMean(stats.mean())
                .setStandardDeviation(deviation)
                .build());
    }

    private static final Logger LOGGER = LoggerFactory.getLogger(TrendStatistics.class);
}
