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
package com.arpnetworking.trending.model;

import com.arpnetworking.commons.builder.OvalBuilder;
import com.arpnetworking.logback.annotations.Loggable;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import net.sf.oval.constraint.Min;
import net.sf.oval.constraint.NotEmpty;
import net.sf.oval.constraint.NotNull;

/**
 * Aggregate of the values a mnemonic produced while a condition held over one
 * telemetry period. This is the record handed to the persistence layer.
 *
 * @author Inscope Metrics
 */
@Loggable
public final class TrendSummary {

    public String getIdentifier() {
        return _identifier;
    }

    public double getStart() {
        return _start;
    }

    public double getEnd() {
        return _end;
    }

    public long getCount() {
        return _count;
    }

    public double getMean() {
        return _mean;
    }

    public double getStandardDeviation() {
        return _standardDeviation;
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }
        final TrendSummary other = (TrendSummary) object;
        return Objects.equal(_identifier, other._identifier)
                && Double.compare(_start, other._start) == 0
                && Double.compare(_end, other._end) == 0
                && _count == other._count
                && Double.compare(_mean, other._mean) == 0
                && Double.compare(_standardDeviation, other._standardDeviation) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_identifier, _start, _end, _count, _mean, _standardDeviation);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Identifier", _identifier)
                .add("Start", _start)
                .add("End", _end)
                .add("Count", _count)
                .add("Mean", _mean)
                .add("StandardDeviation", _standardDeviation)
                .toString();
    }

    private TrendSummary(final Builder builder) {
        _identifier = builder._identifier;
        _start = builder._start;
        _end = builder._end;
        _count = builder._count;
        _mean = builder._mean;
        _standardDeviation = builder._standardDeviation;
    }

    private final String _identifier;
    private final double _start;
    private final double _end;
    private final long _count;
    private final double _mean;
    private final double _standardDeviation;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link TrendSummary}.
     */
    public static final class Builder extends OvalBuilder<TrendSummary> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(TrendSummary::new);
        }

        /**
         * Set the mnemonic identifier. Required. Cannot be null or empty.
         *
         * @param value The identifier.
         * @return This {@link Builder} instance.
         */
        public Builder setIdentifier(final String value) {
            _identifier = value;
            return this;
        }

        /**
         * Set the period start. Required. Cannot be null.
         *
         * @param value The period start.
         * @return This {@link Builder} instance.
         */
        public Builder setStart(final Double value) {
            _start = value;
            return this;
        }

        /**
         * Set the period end. Required. Cannot be null.
         *
         * @param value The period end.
         * @return This {@link Builder} instance.
         */
        public Builder setEnd(final Double value) {
            _end = value;
            return this;
        }

        /**
         * Set the number of values. Required. Must be at least one.
         *
         * @param value The count.
         * @return This {@link Builder} instance.
         */
        public Builder setCount(final Long value) {
            _count = value;
            return this;
        }

        /**
         * Set the mean. Required. Cannot be null.
         *
         * @param value The mean.
         * @return This {@link Builder} instance.
         */
        public Builder setMean(final Double value) {
            _mean = value;
            return this;
        }

        /**
         * Set the sample standard deviation. Optional. Defaults to zero.
         *
         * @param value The standard deviation.
         * @return This {@link Builder} instance.
         */
        public Builder setStandardDeviation(final Double value) {
            _standardDeviation = value;
            return this;
        }

        @NotNull
        @NotEmpty
        private String _identifier;
        @NotNull
        private Double _start;
        @NotNull
        private Double _end;
        @NotNull
        @Min(1)
        private Long _count;
        @NotNull
        private Double _mean;
        @NotNull
        @Min(0)
        private Double _standardDeviation = 0d;
    }
}
