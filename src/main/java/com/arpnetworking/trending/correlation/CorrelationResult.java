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
import com.arpnetworking.logback.annotations.Loggable;
import com.arpnetworking.trending.model.Sample;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableListMultimap;
import net.sf.oval.constraint.Min;
import net.sf.oval.constraint.NotEmpty;
import net.sf.oval.constraint.NotNull;

/**
 * The ratio readings matched to each reported position, together with counts
 * of the position reports that could not be matched.
 *
 * @author Inscope Metrics
 */
@Loggable
public final class CorrelationResult {

    public String getPositionIdentifier() {
        return _positionIdentifier;
    }

    public String getRatioIdentifier() {
        return _ratioIdentifier;
    }

    /**
     * The matched ratio samples keyed by position label, one per successfully
     * validated position report, in report order.
     *
     * @return The matches.
     */
    public ImmutableListMultimap<String, Sample> getMatches() {
        return _matches;
    }

    public int getUnclassified() {
        return _unclassified;
    }

    public int getUnmapped() {
        return _unmapped;
    }

    public int getNoWindow() {
        return _noWindow;
    }

    public int getExhausted() {
        return _exhausted;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("PositionIdentifier", _positionIdentifier)
                .add("RatioIdentifier", _ratioIdentifier)
                .add("Matches", _matches)
                .add("Unclassified", _unclassified)
                .add("Unmapped", _unmapped)
                .add("NoWindow", _noWindow)
                .add("Exhausted", _exhausted)
                .toString();
    }

    private CorrelationResult(final Builder builder) {
        _positionIdentifier = builder._positionIdentifier;
        _ratioIdentifier = builder._ratioIdentifier;
        _matches = builder._matches;
        _unclassified = builder._unclassified;
        _unmapped = builder._unmapped;
        _noWindow = builder._noWindow;
        _exhausted = builder._exhausted;
    }

    private final String _positionIdentifier;
    private final String _ratioIdentifier;
    private final ImmutableListMultimap<String, Sample> _matches;
    private final int _unclassified;
    private final int _unmapped;
    private final int _noWindow;
    private final int _exhausted;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link CorrelationResult}.
     */
    public static final class Builder extends OvalBuilder<CorrelationResult> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(CorrelationResult::new);
        }

        /**
         * Set the position mnemonic identifier. Required. Cannot be null or empty.
         *
         * @param value The identifier.
         * @return This {@link Builder} instance.
         */
        public Builder setPositionIdentifier(final String value) {
            _positionIdentifier = value;
            return this;
        }

        /**
         * Set the ratio mnemonic identifier. Required. Cannot be null or empty.
         *
         * @param value The identifier.
         * @return This {@link Builder} instance.
         */
        public Builder setRatioIdentifier(final String value) {
            _ratioIdentifier = value;
            return this;
        }

        /**
         * Set the matches. Optional. Cannot be null. Defaults to no matches.
         *
         * @param value The matches.
         * @return This {@link Builder} instance.
         */
        public Builder setMatches(final ImmutableListMultimap<String, Sample> value) {
            _matches = value;
            return this;
        }

        /**
         * Set the number of reports skipped for carrying the unknown label.
         * Optional. Defaults to zero.
         *
         * @param value The count.
         * @return This {@link Builder} instance.
         */
        public Builder setUnclassified(final Integer value) {
            _unclassified = value;
            return this;
        }

        /**
         * Set the number of reports skipped for a label without a nominal.
         * Optional. Defaults to zero.
         *
         * @param value The count.
         * @return This {@link Builder} instance.
         */
        public Builder setUnmapped(final Integer value) {
            _unmapped = value;
            return this;
        }

        /**
         * Set the number of reports skipped because the condition did not hold.
         * Optional. Defaults to zero.
         *
         * @param value The count.
         * @return This {@link Builder} instance.
         */
        public Builder setNoWindow(final Integer value) {
            _noWindow = value;
            return this;
        }

        /**
         * Set the number of reports without a ratio inside the widest tolerance.
         * Optional. Defaults to zero.
         *
         * @param value The count.
         * @return This {@link Builder} instance.
         */
        public Builder setExhausted(final Integer value) {
            _exhausted = value;
            return this;
        }

        @NotNull
        @NotEmpty
        private String _positionIdentifier;
        @NotNull
        @NotEmpty
        private String _ratioIdentifier;
        @NotNull
        private ImmutableListMultimap<String, Sample> _matches = ImmutableListMultimap.of();
        @NotNull
        @Min(0)
        private Integer _unclassified = 0;
        @NotNull
        @Min(0)
        private Integer _unmapped = 0;
        @NotNull
        @Min(0)
        private Integer _noWindow = 0;
        @NotNull
        @Min(0)
        private Integer _exhausted = 0;
    }
}
