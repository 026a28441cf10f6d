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

import com.arpnetworking.commons.builder.OvalBuilder;
import com.arpnetworking.logback.annotations.Loggable;
import com.arpnetworking.trending.correlation.CorrelationResult;
import com.arpnetworking.trending.extraction.ExtractionResult;
import com.arpnetworking.trending.model.TrendSummary;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;
import net.sf.oval.constraint.NotNull;

/**
 * The outcome of one trending run, keyed by routine name.
 *
 * @author Inscope Metrics
 */
@Loggable
public final class TrendingReport {

    /**
     * The summaries of the numeric extractions.
     *
     * @return Routine name to mnemonic to summary.
     */
    public ImmutableMap<String, ImmutableMap<String, TrendSummary>> getSummaries() {
        return _summaries;
    }

    /**
     * The raw extractions, including empty ones.
     *
     * @return Routine name to mnemonic to extraction.
     */
    public ImmutableMap<String, ImmutableMap<String, ExtractionResult>> getExtractions() {
        return _extractions;
    }

    public ImmutableMap<String, CorrelationResult> getCorrelations() {
        return _correlations;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", Integer.toHexString(System.identityHashCode(this)))
                .add("Summaries", _summaries)
                .add("Extractions", _extractions)
                .add("Correlations", _correlations)
                .toString();
    }

    private TrendingReport(final Builder builder) {
        _summaries = builder._summaries;
        _extractions = builder._extractions;
        _correlations = builder._correlations;
    }

    private final ImmutableMap<String, ImmutableMap<String, TrendSummary>> _summaries;
    private final ImmutableMap<String, ImmutableMap<String, ExtractionResult>> _extractions;
    private final ImmutableMap<String, CorrelationResult> _correlations;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link TrendingReport}.
     */
    public static final class Builder extends OvalBuilder<TrendingReport> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(TrendingReport::new);
        }

        /**
         * Set the summaries. Optional. Cannot be null. Defaults to none.
         *
         * @param value The summaries.
         * @return This {@link Builder} instance.
         */
        public Builder setSummaries(final ImmutableMap<String, ImmutableMap<String, TrendSummary>> value) {
            _summaries = value;
            return this;
        }

        /**
         * Set the extractions. Optional. Cannot be null. Defaults to none.
         *
         * @param value The extractions.
         * @return This {@link Builder} instance.
         */
        public Builder setExtractions(final ImmutableMap<String, ImmutableMap<String, ExtractionResult>> value) {
            _extractions = value;
            return this;
        }

        /**
         * Set the correlations. Optional. Cannot be null. Defaults to none.
         *
         * @param value The correlations.
         * @return This {@link Builder} instance.
         */
        public Builder setCorrelations(final ImmutableMap<String, CorrelationResult> value) {
            _correlations = value;
            return this;
        }

        @NotNull
        private ImmutableMap<String, ImmutableMap<String, TrendSummary>> _summaries = ImmutableMap.of();
        @NotNull
        private ImmutableMap<String, ImmutableMap<String, ExtractionResult>> _extractions = ImmutableMap.of();
        @NotNull
        private ImmutableMap<String, CorrelationResult> _correlations = ImmutableMap.of();
    }
}
