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

import com.arpnetworking.logback.annotations.Loggable;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.Objects;

import java.io.Serializable;

/**
 * A telemetry value tagged with its {@link ValueType}. Numeric and categorical
 * values never compare equal and are never converted into one another.
 *
 * @author Inscope Metrics
 */
@Loggable
public final class SampleValue implements Serializable {

    /**
     * Create a numeric value.
     *
     * @param value The engineering value.
     * @return New numeric {@link SampleValue}.
     */
    public static SampleValue numeric(final double value) {
        return new SampleValue(ValueType.NUMERIC, value, null);
    }

    /**
     * Create a categorical value.
     *
     * @param value The label.
     * @return New categorical {@link SampleValue}.
     */
    public static SampleValue categorical(final String value) {
        if (value == null) {
            throw new IllegalArgumentException("Categorical value cannot be null");
        }
        return new SampleValue(ValueType.CATEGORICAL, Double.NaN, value);
    }

    public ValueType getType() {
        return _type;
    }

    public boolean isNumeric() {
        return _type == ValueType.NUMERIC;
    }

    /**
     * Access the numeric value.
     *
     * @return The numeric value.
     * @throws IllegalStateException if this value is categorical.
     */
    public double asNumber() {
        if (_type != ValueType.NUMERIC) {
            throw new IllegalStateException(String.format("Value is not numeric; value=%s", _label));
        }
        return _number;
    }

    /**
     * Access the categorical value.
     *
     * @return The label.
     * @throws IllegalStateException if this value is numeric.
     */
    public String asLabel() {
        if (_type != ValueType.CATEGORICAL) {
            throw new IllegalStateException(String.format("Value is not categorical; value=%s", _number));
        }
        return _label;
    }

    /**
     * Plain representation used for serialization.
     *
     * @return The wrapped {@link Double} or {@link String}.
     */
    @JsonValue
    public Object unwrap() {
        return _type == ValueType.NUMERIC ? (Object) _number : _label;
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }
        final SampleValue other = (SampleValue) object;
        return _type == other._type
                && Double.compare(_number, other._number) == 0
                && Objects.equal(_label, other._label);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_type, _number, _label);
    }

    @Override
    public String toString() {
        return String.valueOf(unwrap());
    }

    private SampleValue(final ValueType type, final double number, final String label) {
        _type = type;
        _number = number;
        _label = label;
    }

    private final ValueType _type;
    private final double _number;
    private final String _label;

    private static final long serialVersionUID = 2381672946105348771L;
}
