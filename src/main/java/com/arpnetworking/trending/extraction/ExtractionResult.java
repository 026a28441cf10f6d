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
package com.arpnetworking.trending.extraction;

import com.arpnetworking.logback.annotations.Loggable;
import com.arpnetworking.trending.model.SampleValue;
import com.arpnetworking.trending.model.ValueType;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;

/**
 * The values of one mnemonic that were recorded while a condition held. An
 * empty result is a normal outcome and is reported by {@link #isEmpty()}.
 *
 * @author Inscope Metrics
 */
@Loggable
public final class ExtractionResult {

    /**
     * Create the result of an extraction that selected no samples.
     *
     * @param identifier The mnemonic identifier.
     * @param valueType The declared type of the mnemonic.
     * @return New empty {@link ExtractionResult}.
     */
    public static ExtractionResult empty(final String identifier, final ValueType valueType) {
        return new ExtractionResult(identifier, valueType, ImmutableList.of());
    }

    /**
     * Create the result of an extraction.
     *
     * @param identifier The mnemonic identifier.
     * @param valueType The declared type of the mnemonic.
     * @param values The selected values in time order.
     * @return New {@link ExtractionResult}.
     */
    public static ExtractionResult of(
            final String identifier,
            final ValueType valueType,
            final ImmutableList<SampleValue> values) {
        return new ExtractionResult(identifier, valueType, values);
    }

    public String getIdentifier() {
        return _identifier;
    }

    public ValueType getValueType() {
        return _valueType;
    }

    public ImmutableList<SampleValue> getValues() {
        return _values;
    }

    public boolean isEmpty() {
        return _values.isEmpty();
    }

    public int size() {
        return _values.size();
    }

    /**
     * The selected values as numbers.
     *
     * @return The numeric values in time order.
     * @throws IllegalStateException if the mnemonic is categorical.
     */
    @JsonIgnore
    public double[] getNumericValues() {
        if (_valueType != ValueType.NUMERIC) {
            throw new IllegalStateException(String.format("Mnemonic is not numeric; mnemonic=%s", _identifier));
        }
        final double[] numbers = new double[_values.size()];
        for (int i = 0; i < numbers.length; ++i) {
            numbers[i] = _values.get(i).asNumber();
        }
        return numbers;
    }

    /**
     * The selected values as labels.
     *
     * @return The labels in time order.
     * @throws IllegalStateException if the mnemonic is numeric.
     */
    @JsonIgnore
    public ImmutableList<String> getLabels() {
        if (_valueType != ValueType.CATEGORICAL) {
            throw new IllegalStateException(String.format("Mnemonic is not categorical; mnemonic=%s", _identifier));
        }
        final ImmutableList.Builder<String> labels = ImmutableList.builder();
        for (final SampleValue value : _values) {
            labels.add(value.asLabel());
        }
        return labels.build();
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }
        final ExtractionResult other = (ExtractionResult) object;
        return Objects.equal(_identifier, other._identifier)
                && _valueType == other._valueType
                && Objects.equal(_values, other._values);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_identifier, _valueType, _values);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Identifier", _identifier)
                .add("ValueType", _valueType)
                .add("Count", _values.size())
                .toString();
    }

    private ExtractionResult(
            final String identifier,
            final ValueType valueType,
            final ImmutableList<SampleValue> values) {
        _identifier = identifier;
        _valueType = valueType;
        _values = values;
    }

    private final String _identifier;
    private final ValueType _valueType;
    private final ImmutableList<SampleValue> _values;
}
