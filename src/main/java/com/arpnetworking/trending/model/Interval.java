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
import com.google.common.base.Objects;

import java.io.Serializable;

/**
 * A span of time during which a condition is known to be true.
 *
 * <p>The {@code (start, end)} pair keeps the telemetry convention that an
 * {@code end} of zero marks an open-ended span and that {@code (0, 0)} marks
 * a condition that is never true. The {@link Kind} disambiguates these
 * markers from genuine timestamps of zero and records whether an open-ended
 * span includes its start.</p>
 *
 * @author Inscope Metrics
 */
@Loggable
public final class Interval implements Serializable {

    /**
     * The interval that contains no time at all.
     */
    public static final Interval NEVER = new Interval(Kind.NEVER, 0, 0);

    /**
     * Create the half-open interval {@code [start, end)}.
     *
     * @param start The inclusive start.
     * @param end The exclusive end.
     * @return New bounded {@link Interval}.
     */
    public static Interval bounded(final double start, final double end) {
        if (!(end > start)) {
            throw new IllegalArgumentException(String.format(
                    "Interval end must be after start; start=%s, end=%s", start, end));
        }
        return new Interval(Kind.BOUNDED, start, end);
    }

    /**
     * Create the open interval {@code (start, end)}.
     *
     * @param start The exclusive start.
     * @param end The exclusive end.
     * @return New bounded {@link Interval}.
     */
    public static Interval boundedAfter(final double start, final double end) {
        if (!(end > start)) {
            throw new IllegalArgumentException(String.format(
                    "Interval end must be after start; start=%s, end=%s", start, end));
        }
        return new Interval(Kind.BOUNDED_AFTER, start, end);
    }

    /**
     * Create the interval {@code [start, +inf)}.
     *
     * @param start The inclusive start.
     * @return New open-ended {@link Interval}.
     */
    public static Interval openFrom(final double start) {
        return new Interval(Kind.OPEN_FROM, start, 0);
    }

    /**
     * Create the interval {@code (start, +inf)}.
     *
     * @param start The exclusive start.
     * @return New open-ended {@link Interval}.
     */
    public static Interval openAfter(final double start) {
        return new Interval(Kind.OPEN_AFTER, start, 0);
    }

    public Kind getKind() {
        return _kind;
    }

    public double getStart() {
        return _start;
    }

    /**
     * The end of the interval; zero when the interval is open-ended or never true.
     *
     * @return The exclusive end.
     */
    public double getEnd() {
        return _end;
    }

    public boolean isOpenEnded() {
        return _kind == Kind.OPEN_FROM || _kind == Kind.OPEN_AFTER;
    }

    public boolean isStartExcluded() {
        return _kind == Kind.OPEN_AFTER || _kind == Kind.BOUNDED_AFTER;
    }

    public boolean isNever() {
        return _kind == Kind.NEVER;
    }

    /**
     * The end as a position on the time axis; positive infinity for open-ended
     * intervals.
     *
     * @return The effective exclusive end.
     */
    public double getUpperBound() {
        return isOpenEnded() ? Double.POSITIVE_INFINITY : _end;
    }

    /**
     * Whether {@code time} lies inside this interval.
     *
     * @param time The time to test.
     * @return True if and only if the interval contains the time.
     */
    public boolean contains(final double time) {
        switch (_kind) {
            case BOUNDED:
                return _start <= time && time < _end;
            case BOUNDED_AFTER:
                return _start < time && time < _end;
            case OPEN_FROM:
                return time >= _start;
            case OPEN_AFTER:
                return time > _start;
            default:
                return false;
        }
    }

    /**
     * Intersect this interval with another that shares at least one point with it.
     *
     * @param other The other interval.
     * @return The overlap of both intervals, or {@link #NEVER} if they are disjoint.
     */
    public Interval intersect(final Interval other) {
        if (isNever() || other.isNever()) {
            return NEVER;
        }
        final Interval later = _start > other._start
                || (_start == other._start && isStartExcluded()) ? this : other;
        final double upperBound = Math.min(getUpperBound(), other.getUpperBound());
        if (Double.isInfinite(upperBound)) {
            return later;
        }
        if (!(upperBound > later._start)) {
            return NEVER;
        }
        return later.isStartExcluded()
                ? boundedAfter(later._start, upperBound)
                : bounded(later._start, upperBound);
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }
        final Interval other = (Interval) object;
        return _kind == other._kind
                && Double.compare(_start, other._start) == 0
                && Double.compare(_end, other._end) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_kind, _start, _end);
    }

    @Override
    public String toString() {
        return "(" + _start + ", " + _end + ")";
    }

    private Interval(final Kind kind, final double start, final double end) {
        _kind = kind;
        _start = start;
        _end = end;
    }

    private final Kind _kind;
    private final double _start;
    private final double _end;

    private static final long serialVersionUID = 6302291450183572937L;

    /**
     * The shape of an {@link Interval}.
     */
    public enum Kind {
        /**
         * {@code [start, end)}.
         */
        BOUNDED,
        /**
         * {@code (start, end)}; the overlap of a span that excludes its start with a bounded span.
         */
        BOUNDED_AFTER,
        /**
         * {@code [start, +inf)}; the condition held for every sample from the first one on.
         */
        OPEN_FROM,
        /**
         * {@code (start, +inf)}; the condition became true after the last false sample.
         */
        OPEN_AFTER,
        /**
         * The condition is never true.
         */
        NEVER
    }
}
