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
import com.arpnetworking.trending.condition.AtomicCondition;
import com.arpnetworking.trending.condition.Comparison;
import com.arpnetworking.trending.condition.IncomparableValueException;
import com.arpnetworking.trending.model.MnemonicTable;
import com.arpnetworking.trending.model.SampleValue;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.google.common.base.MoreObjects;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import net.sf.oval.constraint.NotEmpty;
import net.sf.oval.constraint.NotNull;
import net.sf.oval.constraint.ValidateWithMethod;

/**
 * Configured predicate over a single mnemonic. A numeric value compares
 * against numeric telemetry and a string value against categorical telemetry.
 *
 * @author Inscope Metrics
 */
@Loggable
@JsonDeserialize(builder = ConditionDefinition.Builder.class)
public final class ConditionDefinition {

    public String getMnemonic() {
        return _mnemonic;
    }

    public Comparison getComparator() {
        return _comparator;
    }

    public SampleValue getValue() {
        return _value;
    }

    /**
     * Bind this definition to the telemetry of its mnemonic.
     *
     * @param table The telemetry of {@link #getMnemonic()}.
     * @return New {@link AtomicCondition}.
     * @throws IncomparableValueException if the value cannot be compared with the table.
     */
    public AtomicCondition toCondition(final MnemonicTable table) {
        return AtomicCondition.of(table, _comparator, _value);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Mnemonic", _mnemonic)
                .add("Comparator", _comparator)
                .add("Value", _value)
                .toString();
    }

    private ConditionDefinition(final Builder builder) {
        _mnemonic = builder._mnemonic;
        _comparator = builder._comparator;
        if (builder._value instanceof Number) {
            _value = SampleValue.numeric(((Number) builder._value).doubleValue());
        } else {
            _value = SampleValue.categorical((String) builder._value);
        }
    }

    private final String _mnemonic;
    private final Comparison _comparator;
    private final SampleValue _value;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link ConditionDefinition}.
     */
    @JsonPOJOBuilder(withPrefix = "set")
    public static final class Builder extends OvalBuilder<ConditionDefinition> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(ConditionDefinition::new);
        }

        /**
         * Set the mnemonic. Required. Cannot be null or empty.
         *
         * @param value The mnemonic identifier.
         * @return This {@link Builder} instance.
         */
        public Builder setMnemonic(final String value) {
            _mnemonic = value;
            return this;
        }

        /**
         * Set the comparator. Required. Cannot be null.
         *
         * @param value The comparator.
         * @return This {@link Builder} instance.
         */
        public Builder setComparator(final Comparison value) {
            _comparator = value;
            return this;
        }

        /**
         * Set the literal. Required. Must be a number or a string.
         *
         * @param value The literal.
         * @return This {@link Builder} instance.
         */
        public Builder setValue(final Object value) {
            _value = value;
            return this;
        }

        /**
         * Checks that the literal is a number or a string.
         *
         * @param value The literal.
         * @return true if the literal is valid
         */
        @SuppressFBWarnings(value = "UPM_UNCALLED_PRIVATE_METHOD", justification = "invoked reflectively by @ValidateWithMethod")
        public boolean validateValue(final Object value) {
            return value instanceof Number || value instanceof String;
        }

        @NotNull
        @NotEmpty
        private String _mnemonic;
        @NotNull
        private Comparison _comparator;
        @NotNull
        @ValidateWithMethod(methodName = "validateValue", parameterType = Object.class)
        private Object _value;
    }
}
