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
package com.arpnetworking.trending.condition;

import com.arpnetworking.trending.model.Interval;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Interval algebra shared by the condition types.
 *
 * @author Inscope Metrics
 */
public final class Intervals {

    /**
     * Compile the times at which a predicate held and the times at which it
     * did not hold into the ascending, non-overlapping list of spans during
     * which it is known to be true.
     *
     * <p>A start time opens a span which the first strictly later false time
     * closes. Start times inside an already closed span are absorbed. When the
     * predicate never held the result is {@link Interval#NEVER}; when it never
     * failed the result is a single span open from the first true time. A true
     * region left unclosed after the last false time becomes a trailing span
     * open after that false time.</p>
     *
     * @param trueTimes The times at which the predicate held, in any order.
     * @param falseTimes The times at which the predicate did not hold, in any order.
     * @return The true spans.
     */
    public static ImmutableList<Interval> fromClassification(
            final Collection<Double> trueTimes,
            final Collection<Double> falseTimes) {
        if (trueTimes.isEmpty()) {
            return ImmutableList.of(Interval.NEVER);
        }
        final ImmutableSortedSet<Double> starts = ImmutableSortedSet.copyOf(trueTimes);
        if (falseTimes.isEmpty()) {
            return ImmutableList.of(Interval.openFrom(starts.first()));
        }
        final ImmutableSortedSet<Double> ends = ImmutableSortedSet.copyOf(falseTimes);

        final ImmutableList.Builder<Interval> intervals = ImmutableList.builder();
        double timeHook = Double.NEGATIVE_INFINITY;
        for (final Double start : starts) {
            if (start > timeHook) {
                final Double end = ends.higher(start);
                if (end == null) {
                    break;
                }
                intervals.add(Interval.bounded(start, end));
                timeHook = end;
            }
        }
        if (starts.last() > ends.last()) {
            intervals.add(Interval.openAfter(ends.last()));
        }
        return intervals.build();
    }

    /**
     * Find the span of an ascending interval list that contains a time.
     *
     * @param intervals The ascending, non-overlapping intervals.
     * @param time The time to look up.
     * @return The containing interval, if any.
     */
    public static Optional<Interval> findContaining(final List<Interval> intervals, final double time) {
        for (final Interval interval : intervals) {
            if (interval.contains(time)) {
                return Optional.of(interval);
            }
            if (interval.getStart() > time) {
                break;
            }
        }
        return Optional.empty();
    }

    private Intervals() { }
}
