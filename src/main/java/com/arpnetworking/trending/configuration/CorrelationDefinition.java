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
import com.arpnetworking.logback.annotations.Loggable;
import com.arpnetworking.trending.correlation.NominalMap;
import com.arpnetworking.trending.correlation.PositionCorrelator;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import net.sf.oval.constraint.MinSize;
import net.sf.oval.constraint.NotEmpty;
import net.sf.oval.constraint.NotNull;
import net.sf.oval.constraint.ValidateWithMethod;

import java.util.List;
import java.util.Map;

/**
 * A routine that validates the positions reported by a mechanism against
 * the ratio of its position sensor while the condition set holds.
 *
 * @author Inscope Metrics
 */
@Loggable
@JsonDeserialize(builder = CorrelationDefinition.Builder.class)
public final class CorrelationDefinition {

    public String getName() {
        return _name;
    }

    public ImmutableList<ConditionDefinition> getConditions() {
        return _conditions;
    }

    public String getPositionMnemonic() {
        return _positionMnemonic;
    }

    public String getRatioMnemonic() {
        return _ratioMnemonic;
    }

    public NominalMap getNominals() {
        return _nominals;
    }

    public double getInitialWindow() {
        return _initialWindow;
    }

    public double getWindowStep() {
        return _windowStep;
    }

    public double getWindowLimit() {
        return _windowLimit;
    }

    /**
     * Create the correlator for this routine.
     *
     * @param unknownLabel The label marking unclassified positions.
     * @return New {@link PositionCorrelator}.
     */
    public PositionCorrelator createCorrelator(final String unknownLabel) {
        return new PositionCorrelator.Builder()
                .setInitialWindow(_initialWindow)
                .setWindowStep(_windowStep)
                .setWindowLimit(_windowLimit)
                .setUnknownLabel(unknownLabel)
                .build();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Name", _name)
                .add("Conditions", _conditions)
                .add("PositionMnemonic", _positionMnemonic)
                .add("RatioMnemonic", _ratioMnemonic)
                .add("Nominals", _nominals)
                .add("InitialWindow", _initialWindow)
                .add("WindowStep", _windowStep)
                .add("WindowLimit", _windowLimit)
                .toString();
    }

    private CorrelationDefinition(final Builder builder) {
        _name = builder._name;
        _conditions = ImmutableList.copyOf(builder._conditions);
        _positionMnemonic = builder._positionMnemonic;
        _ratioMnemonic = builder._ratioMnemonic;
        _nominals = NominalMap.of(builder._nominals);
        _initialWindow = builder._initialWindow;
        _windowStep = builder._windowStep;
        _windowLimit = builder._windowLimit;
    }

    private final String _name;
    private final ImmutableList<ConditionDefinition> _conditions;
    private final String _positionMnemonic;
    private final String _ratioMnemonic;
    private final NominalMap _nominals;
    private final double _initialWindow;
    private final double _windowStep;
    private final double _windowLimit;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link CorrelationDefinition}.
     */
    @JsonPOJOBuilder(withPrefix = "set")
    public static final class Builder extends OvalBuilder<CorrelationDefinition> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(CorrelationDefinition::new);
        }

        /**
         * Set the routine name. Required. Cannot be null or empty.
         *
         * @param value The name.
         * @return This {@link Builder} instance.
         */
        public Builder setName(final String value) {
            _name = value;
            return this;
        }

        /**
         * Set the condition set under which the ratio is meaningful. Required.
         * Cannot be null or empty.
         *
         * @param value The conditions.
         * @return This {@link Builder} instance.
         */
        public Builder setConditions(final List<ConditionDefinition> value) {
            _conditions = value;
            return this;
        }

        /**
         * Set the categorical position mnemonic. Required. Cannot be null or empty.
         *
         * @param value The mnemonic identifier.
         * @return This {@link Builder} instance.
         */
        public Builder setPositionMnemonic(final String value) {
            _positionMnemonic = value;
            return this;
        }

        /**
         * Set the numeric ratio mnemonic. Required. Cannot be null or empty.
         *
         * @param value The mnemonic identifier.
         * @return This {@link Builder} instance.
         */
        public Builder setRatioMnemonic(final String value) {
            _ratioMnemonic = value;
            return this;
        }

        /**
         * Set the nominal ratio per position label. Required. Cannot be null or empty.
         *
         * @param value The nominals.
         * @return This {@link Builder} instance.
         */
        public Builder setNominals(final Map<String, Double> value) {
            _nominals = value;
            return this;
        }

        /**
         * Set the initial tolerance. Optional. Defaults to 1.
         *
         * @param value The initial window.
         * @return This {@link Builder} instance.
         */
        public Builder setInitialWindow(final Double value) {
            _initialWindow = value;
            return this;
        }

        /**
         * Set the tolerance increment. Optional. Defaults to 2.
         *
         * @param value The window step.
         * @return This {@link Builder} instance.
         */
        public Builder setWindowStep(final Double value) {
            _windowStep = value;
            return this;
        }

        /**
         * Set the widest tolerance. Optional. Defaults to 10.
         *
         * @param value The window limit.
         * @return This {@link Builder} instance.
         */
        public Builder setWindowLimit(final Double value) {
            _windowLimit = value;
            return this;
        }

        /**
         * Checks that a tolerance parameter is positive.
         *
         * @param value The parameter.
         * @return true if the parameter is valid
         */
        @SuppressFBWarnings(value = "UPM_UNCALLED_PRIVATE_METHOD", justification = "invoked reflectively by @ValidateWithMethod")
        public boolean validatePositive(final Double value) {
            return value == null || value > 0;
        }

        /**
         * Checks that the window limit admits at least the initial window.
         *
         * @param value The window limit.
         * @return true if the window limit is valid
         */
        @SuppressFBWarnings(value = "UPM_UNCALLED_PRIVATE_METHOD", justification = "invoked reflectively by @ValidateWithMethod")
        public boolean validateWindowLimit(final Double value) {
            return value == null || _initialWindow == null || value >= _initialWindow;
        }

        @NotNull
        @NotEmpty
        private String _name;
        @NotNull
        @MinSize(1)
        private List<ConditionDefinition> _conditions;
        @NotNull
        @NotEmpty
        private String _positionMnemonic;
        @NotNull
        @NotEmpty
        private String _ratioMnemonic;
        @NotNull
        @MinSize(1)
        private Map<String, Double> _nominals;
        @NotNull
        @ValidateWithMethod(methodName = "validatePositive", parameterType = Double.class)
        private Double _initialWindow = 1d;
        @NotNull
        @ValidateWithMethod(methodName = "validatePositive", parameterType = Double.class)
        private Double _windowStep = 2d;
        @NotNull
        @ValidateWithMethod(methodName = "validateWindowLimit", parameterType = Double.class)
        private Double _windowLimit = 10d;
    }
}
