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
import com.google.common.collect.ImmutableList;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import net.sf.oval.constraint.NotEmpty;
import net.sf.oval.constraint.NotNull;
import net.sf.oval.constraint.ValidateWithMethod;

import java.util.List;
import javax.annotation.Nullable;

/**
 * The time ordered samples of one mnemonic together with its identifying
 * metadata. Tables are materialized by the telemetry source and are read-only
 * to the trending core.
 *
 * @author Inscope Metrics
 */
@Loggable
public final class MnemonicTable {

    public String getIdentifier() {
        return _identifier;
    }

    public ValueType getValueType() {
        return _valueType;
    }

    public ImmutableList<Sample> getSamples() {
        return _samples;
    }

    /**
     * The start of the period covered by this table; the first sample time
     * unless set explicitly, zero for an empty table.
     *
     * @return The period start.
     */
    public double getStart() {
        return _start;
    }

    /**
     * The end of the period covered by this table; the last sample time
     * unless set explicitly, zero for an empty table.
     *
     * @return The period end.
     */
    public double getEnd() {
        return _end;
    }

    public int getCount() {
        return _samples.size();
    }

    public boolean isEmpty() {
        return _samples.isEmpty();
    }

    /**
     * The samples whose time lies in {@code [startInclusive, endExclusive)}.
     *
     * @param startInclusive The first time to include.
     * @param endExclusive The first time to exclude.
     * @return The time ordered samples in the span.
     */
    public List<Sample> samplesBetween(final double startInclusive, final double endExclusive) {
        if (!(endExclusive > startInclusive)) {
            return ImmutableList.of();
        }
        final int from = firstIndexAtOrAfter(startInclusive);
        final int to = firstIndexAtOrAfter(endExclusive);
        return _samples.subList(from, Math.max(from, to));
    }

    /**
     * The index of the first sample with a time at or after {@code time}, or
     * the sample count if there is none.
     */
    private int firstIndexAtOrAfter(final double time) {
        int low = 0;
        int high = _samples.size();
        while (low < high) {
            final int middle = (low + high) >>> 1;
            if (_samples.get(middle).getTime() < time) {
                low = middle + 1;
            } else {
                high = middle;
            }
        }
        return low;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", Integer.toHexString(System.identityHashCode(this)))
                .add("Identifier", _identifier)
                .add("ValueType", _valueType)
                .add("Start", _start)
                .add("End", _end)
                .add("Count", _samples.size())
                .toString();
    }

    private MnemonicTable(final Builder builder) {
        _identifier = builder._identifier;
        _valueType = builder._valueType;
        _samples = builder._samples;
        if (builder._start != null) {
            _start = builder._start;
        } else {
            _start = _samples.isEmpty() ? 0 : _samples.get(0).getTime();
        }
        if (builder._end != null) {
            _end = builder._end;
        } else {
            _end = _samples.isEmpty() ? 0 : _samples.get(_samples.size() - 1).getTime();
        }
    }

    private final String _identifier;
    private final ValueType _valueType;
    private final ImmutableList<Sample> _samples;
    private final double _start;
    private final double _end;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link MnemonicTable}.
     */
    public static final class Builder extends OvalBuilder<MnemonicTable> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(MnemonicTable::new);
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
         * Set the declared value type. Required. Cannot be null.
         *
         * @param value The value type.
         * @return This {@link Builder} instance.
         */
        public Builder setValueType(final ValueType value) {
            _valueType = value;
            return this;
        }

        /**
         * Set the samples in time order. Optional. Cannot be null. Defaults to
         * no samples. Every sample must carry a value of the declared type.
         *
         * @param value The samples.
         * @return This {@link Builder} instance.
         */
        public Builder setSamples(final List<Sample> value) {
            _samples = value == null ? null : ImmutableList.copyOf(value);
            return this;
        }

        /**
         * Set the period start. Optional. Defaults to the first sample time.
         *
         * @param value The period start.
         * @return This {@link Builder} instance.
         */
        public Builder setStart(@Nullable final Double value) {
            _start = value;
            return this;
        }

        /**
         * Set the period end. Optional. Defaults to the last sample time.
         *
         * @param value The period end.
         * @return This {@link Builder} instance.
         */
        public Builder setEnd(@Nullable final Double value) {
            _end = value;
            return this;
        }

        /**
         * Checks that every sample matches the declared value type.
         *
         * @param samples The samples to check.
         * @return true if the samples are valid
         */
        @SuppressFBWarnings(value = "UPM_UNCALLED_PRIVATE_METHOD", justification = "invoked reflectively by @ValidateWithMethod")
        public boolean validateSamples(final ImmutableList<Sample> samples) {
            if (_valueType == null) {
                return true;
            }
            for (final Sample sample : samples) {
                if (sample.getValue().getType() != _valueType) {
                    return false;
                }
            }
            return true;
        }

        @NotNull
        @NotEmpty
        private String _identifier;
        @NotNull
        private ValueType _valueType;
        @NotNull
        @ValidateWithMethod(methodName = "validateSamples", parameterType = ImmutableList.class)
        private ImmutableList<Sample> _samples = ImmutableList.of();
        @Nullable
        private Double _start;
        @Nullable
        private Double _end;
    }
}
