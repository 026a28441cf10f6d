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
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

import java.io.Serializable;

/**
 * A single telemetry reading: a timestamp and a tagged value.
 *
 * @author Inscope Metrics
 */
@Loggable
public final class Sample implements Serializable {

    /**
     * Create a numeric sample.
     *
     * @param time The sample time.
     * @param value The numeric value.
     * @return New {@link Sample}.
     */
    public static Sample of(final double time, final double value) {
        return new Sample(time, SampleValue.numeric(value));
    }

    /**
     * Create a categorical sample.
     *
     * @param time The sample time.
     * @param value The label.
     * @return New {@link Sample}.
     */
    public static Sample of(final double time, final String value) {
        return new Sample(time, SampleValue.categorical(value));
    }

    /**
     * Create a sample from an already tagged value.
     *
     * @param time The sample time.
     * @param value The value.
     * @return New {@link Sample}.
     */
    public static Sample of(final double time, final SampleValue value) {
        return new Sample(time, value);
    }

    public double getTime() {
        return _time;
    }

    public SampleValue getValue() {
        return _value;
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }
        final Sample other = (Sample) object;
        return Double.compare(_time, other._time) == 0
                && Objects.equal(_value, other._value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_time, _value);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Time", _time)
                .add("Value", _value)
                .toString();
    }

    private Sample(final double time, final SampleValue value) {
        if (value == null) {
            throw new IllegalArgumentException("Sample value cannot be null");
        }
        _time = time;
        _value = value;
    }

    private final double _time;
    private final SampleValue _value;

    private static final long serialVersionUID = -4108937460011925561L;
}
