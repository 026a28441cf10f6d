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
package com.arpnetworking.trending.correlation;

import com.arpnetworking.commons.builder.OvalBuilder;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.arpnetworking.trending.condition.CompositeCondition;
import com.arpnetworking.trending.model.Interval;
import com.arpnetworking.trending.model.MnemonicTable;
import com.arpnetworking.trending.model.Sample;
import com.arpnetworking.trending.model.ValueType;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import net.sf.oval.constraint.NotEmpty;
import net.sf.oval.constraint.NotNull;
import net.sf.oval.constraint.ValidateWithMethod;

import java.util.List;
import java.util.Optional;

/**
 * Validates actuator position reports against the continuous position sensor.
 *
 * <p>For every reported position the correlator determines the settle window:
 * from the report time to the earlier of the next report and the end of the
 * span in which the feedback condition holds. It then searches the ratio
 * samples of that window for one within a tolerance of the position's
 * nominal value. The tolerance starts at the initial window and widens by the
 * window step until a sample qualifies or the window limit is passed. The
 * first qualifying sample in time order is the match.</p>
 *
 * @author Inscope Metrics
 */
public final class PositionCorrelator {

    /**
     * Correlate position reports with ratio samples.
     *
     * @param condition The condition under which the ratio feedback is meaningful.
     * @param nominals The nominal ratio per position label.
     * @param positions The categorical position reports.
     * @param ratios The numeric ratio samples.
     * @return The matches per position label.
     */
    public CorrelationResult correlate(
            final CompositeCondition condition,
            final NominalMap nominals,
            final MnemonicTable positions,
            final MnemonicTable ratios) {
        if (positions.getValueType() != ValueType.CATEGORICAL) {
            throw new IllegalArgumentException(String.format(
                    "Position mnemonic must be categorical; mnemonic=%s", positions.getIdentifier()));
        }
        if (ratios.getValueType() != ValueType.NUMERIC) {
            throw new IllegalArgumentException(String.format(
                    "Ratio mnemonic must be numeric; mnemonic=%s", ratios.getIdentifier()));
        }

        final ImmutableListMultimap.Builder<String, Sample> matches = ImmutableListMultimap.builder();
        int unclassified = 0;
        int unmapped = 0;
        int noWindow = 0;
        int exhausted = 0;

        final ImmutableList<Sample> reports = positions.getSamples();
        for (int index = 0; index < reports.size(); ++index) {
            final Sample report = reports.get(index);
            final String label = report.getValue().asLabel();
            if (_unknownLabel.equals(label)) {
                LOGGER.warn()
                        .setMessage("Skipping unclassified position")
                        .addData("mnemonic", positions.getIdentifier())
                        .addData("time", report.getTime())
                        .log();
                ++unclassified;
                continue;
            }

            final Optional<Double> nominal = nominals.getNominal(label);
            if (!nominal.isPresent()) {
                LOGGER.warn()
                        .setMessage("Skipping position without nominal value")
                        .addData("mnemonic", positions.getIdentifier())
                        .addData("label", label)
                        .addData("time", report.getTime())
                        .log();
                ++unmapped;
                continue;
            }

            final Optional<Interval> interval = condition.getInterval(report.getTime());
            if (!interval.isPresent()) {
                LOGGER.warn()
                        .setMessage("No correlation window for position")
                        .addData("mnemonic", positions.getIdentifier())
                        .addData("label", label)
                        .addData("time", report.getTime())
                        .log();
                ++noWindow;
                continue;
            }

            final double start = report.getTime();
            double end = interval.get().getUpperBound();
            if (index + 1 < reports.size()) {
                end = Math.min(end, reports.get(index + 1).getTime());
            }

            final List<Sample> candidates = ratios.samplesBetween(start, end);
            final Optional<Sample> match = search(candidates, nominal.get());
            if (match.isPresent()) {
                matches.put(label, match.get());
            } else {
                LOGGER.warn()
                        .setMessage("No ratio within tolerance of nominal")
                        .addData("mnemonic", ratios.getIdentifier())
                        .addData("label", label)
                        .addData("time", report.getTime())
                        .addData("nominal", nominal.get())
                        .addData("candidates", candidates.size())
                        .addData("window", finalWindow())
                        .log();
                ++exhausted;
            }
        }

        return new CorrelationResult.Builder()
                .setPositionIdentifier(positions.getIdentifier())
                .setRatioIdentifier(ratios.getIdentifier())
                .setMatches(matches.build())
                .setUnclassified(unclassified)
                .setUnmapped(unmapped)
                .setNoWindow(noWindow)
                .setExhausted(exhausted)
                .build();
    }

    /**
     * Find the first candidate within the tightest tolerance of the nominal,
     * trying tolerances from the initial window up to the window limit.
     *
     * @param candidates The ratio samples in time order.
     * @param nominal The nominal ratio.
     * @return The matching sample, if any.
     */
    Optional<Sample> search(final List<Sample> candidates, final double nominal) {
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        for (double window = _initialWindow; window <= _windowLimit; window += _windowStep) {
            for (final Sample candidate : candidates) {
                if (Math.abs(candidate.getValue().asNumber() - nominal) < window) {
                    return Optional.of(candidate);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * The first tolerance past the limit, reported when a search is abandoned.
     */
    private double finalWindow() {
        double window = _initialWindow;
        while (window <= _windowLimit) {
            window += _windowStep;
        }
        return window;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", Integer.toHexString(System.identityHashCode(this)))
                .add("InitialWindow", _initialWindow)
                .add("WindowStep", _windowStep)
                .add("WindowLimit", _windowLimit)
                .add("UnknownLabel", _unknownLabel)
                .toString();
    }

    private PositionCorrelator(final Builder builder) {
        _initialWindow = builder._initialWindow;
        _windowStep = builder._windowStep;
        _windowLimit = builder._windowLimit;
        _unknownLabel = builder._unknownLabel;
    }

    private final double _initialWindow;
    private final double _windowStep;
    private final double _windowLimit;
    private final String _unknownLabel;

    private static final Logger LOGGER = LoggerFactory.getLogger(PositionCorrelator.class);

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link PositionCorrelator}.
     */
    public static final class Builder extends OvalBuilder<PositionCorrelator> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(PositionCorrelator::new);
        }

        /**
         * Set the strictest tolerance. Optional. Must be positive. Defaults to 1.
         *
         * @param value The initial window.
         * @return This {@link Builder} instance.
         */
        public Builder setInitialWindow(final Double value) {
            _initialWindow = value;
            return this;
        }

        /**
         * Set the amount the tolerance widens by after a failed pass. Optional.
         * Must be positive. Defaults to 2.
         *
         * @param value The window step.
         * @return This {@link Builder} instance.
         */
        public Builder setWindowStep(final Double value) {
            _windowStep = value;
            return this;
        }

        /**
         * Set the widest tolerance to try. Optional. Must not be less than the
         * initial window. Defaults to 10.
         *
         * @param value The window limit.
         * @return This {@link Builder} instance.
         */
        public Builder setWindowLimit(final Double value) {
            _windowLimit = value;
            return this;
        }

        /**
         * Set the label that marks a report without a classified position.
         * Optional. Cannot be null or empty. Defaults to {@code UNKNOWN}.
         *
         * @param value The unknown label.
         * @return This {@link Builder} instance.
         */
        public Builder setUnknownLabel(final String value) {
            _unknownLabel = value;
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
        @ValidateWithMethod(methodName = "validatePositive", parameterType = Double.class)
        private Double _initialWindow = 1d;
        @NotNull
        @ValidateWithMethod(methodName = "validatePositive", parameterType = Double.class)
        private Double _windowStep = 2d;
        @NotNull
        @ValidateWithMethod(methodName = "validateWindowLimit", parameterType = Double.class)
        private Double _windowLimit = 10d;
        @NotNull
        @NotEmpty
        private String _unknownLabel = "UNKNOWN";
    }
}
