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
package com.arpnetworking.trending.configuration;

import com.arpnetworking.commons.builder.OvalBuilder;
import com.arpnetworking.commons.jackson.databind.ObjectMapperFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import net.sf.oval.constraint.NotEmpty;
import net.sf.oval.constraint.NotNull;

import java.util.Collections;
import java.util.List;

/**
 * Representation of the trending routines to run over a batch of telemetry.
 *
 * @author Inscope Metrics
 */
@JsonDeserialize(builder = TrendingConfiguration.Builder.class)
public final class TrendingConfiguration {

    /**
     * Create an {@link ObjectMapper} for trending configuration.
     *
     * @return An {@link ObjectMapper} for trending configuration.
     */
    public static ObjectMapper createObjectMapper() {
        return ObjectMapperFactory.getInstance();
    }

    public String getUnknownLabel() {
        return _unknownLabel;
    }

    public ImmutableList<ExtractionDefinition> getExtractions() {
        return _extractions;
    }

    public ImmutableList<CorrelationDefinition> getCorrelations() {
        return _correlations;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", Integer.toHexString(System.identityHashCode(this)))
                .add("UnknownLabel", _unknownLabel)
                .add("Extractions", _extractions)
                .add("Correlations", _correlations)
                .toString();
    }

    private TrendingConfiguration(final Builder builder) {
        _unknownLabel = builder._unknownLabel;
        _extractions = ImmutableList.copyOf(builder._extractions);
        _correlations = ImmutableList.copyOf(builder._correlations);
    }

    private final String _unknownLabel;
    private final ImmutableList<ExtractionDefinition> _extractions;
    private final ImmutableList<CorrelationDefinition> _correlations;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link TrendingConfiguration}.
     */
    @JsonPOJOBuilder(withPrefix = "set")
    public static final class Builder extends OvalBuilder<TrendingConfiguration> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(TrendingConfiguration::new);
        }

        /**
         * Set the label of unclassified positions. Optional. Cannot be null or
         * empty. Defaults to {@code UNKNOWN}.
         *
         * @param value The label.
         * @return This {@link Builder} instance.
         */
        public Builder setUnknownLabel(final String value) {
            _unknownLabel = value;
            return this;
        }

        /**
         * Set the extraction routines. Optional. Cannot be null. Defaults to none.
         *
         * @param value The extraction routines.
         * @return This {@link Builder} instance.
         */
        public Builder setExtractions(final List<ExtractionDefinition> value) {
            _extractions = value;
            return this;
        }

        /**
         * Set the correlation routines. Optional. Cannot be null. Defaults to none.
         *
         * @param value The correlation routines.
         * @return This {@link Builder} instance.
         */
        public Builder setCorrelations(final List<CorrelationDefinition> value) {
            _correlations = value;
            return this;
        }

        @NotNull
        @NotEmpty
        private String _unknownLabel = "UNKNOWN";
        @NotNull
        private List<ExtractionDefinition> _extractions = Collections.emptyList();
        @NotNull
        private List<CorrelationDefinition> _correlations = Collections.emptyList();
    }
}
