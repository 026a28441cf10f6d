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

import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.arpnetworking.trending.model.Interval;
import com.arpnetworking.trending.model.MnemonicTable;
import com.arpnetworking.trending.model.Sample;
import com.arpnetworking.trending.model.SampleValue;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A single predicate over one mnemonic, compiled at construction into the
 * spans of time during which it holds.
 *
 * <p>Each instance owns its interval list. The list is computed once from the
 * table and never changes until {@link #release()} discards it. Holders that
 * share a condition {@link #retain()} it, and the list is discarded only when
 * the last of them releases it.</p>
 *
 * @author Inscope Metrics
 */
public final class AtomicCondition {

    /**
     * Create a condition that holds while the mnemonic equals a label.
     *
     * @param table The categorical mnemonic.
     * @param label The label.
     * @return New {@link AtomicCondition}.
     */
    public static AtomicCondition equal(final MnemonicTable table, final String label) {
        return of(table, Comparison.EQUAL, SampleValue.categorical(label));
    }

    /**
     * Create a condition that holds while the mnemonic equals a number.
     *
     * @param table The numeric mnemonic.
     * @param value The value.
     * @return New {@link AtomicCondition}.
     */
    public static AtomicCondition equal(final MnemonicTable table, final double value) {
        return of(table, Comparison.EQUAL, SampleValue.numeric(value));
    }

    /**
     * Create a condition that holds while the mnemonic is below a threshold.
     *
     * @param table The numeric mnemonic.
     * @param threshold The exclusive threshold.
     * @return New {@link AtomicCondition}.
     */
    public static AtomicCondition lessThan(final MnemonicTable table, final double threshold) {
        return of(table, Comparison.LESS_THAN, SampleValue.numeric(threshold));
    }

    /**
     * Create a condition that holds while the mnemonic is above a threshold.
     *
     * @param table The numeric mnemonic.
     * @param threshold The exclusive threshold.
     * @return New {@link AtomicCondition}.
     */
    public static AtomicCondition greaterThan(final MnemonicTable table, final double threshold) {
        return of(table, Comparison.GREATER_THAN, SampleValue.numeric(threshold));
    }

    /**
     * Create a condition from its parts.
     *
     * @param table The mnemonic.
     * @param comparison The predicate kind.
     * @param literal The literal to compare against.
     * @return New {@link AtomicCondition}.
     * @throws IncomparableValueException if the comparison is not defined for
     * the table's value type and the literal.
     */
    public static AtomicCondition of(
            final MnemonicTable table,
            final Comparison comparison,
            final SampleValue literal) {
        if (!comparison.supports(table.getValueType(), literal)) {
            throw new IncomparableValueException(table.getIdentifier(), table.getValueType(), comparison, literal);
        }
        return new AtomicCondition(table, comparison, literal);
    }

    public String getIdentifier() {
        return _identifier;
    }

    public Comparison getComparison() {
        return _comparison;
    }

    public SampleValue getLiteral() {
        return _literal;
    }

    /**
     * The ascending, non-overlapping spans during which this condition holds.
     *
     * @return The interval list.
     */
    public ImmutableList<Interval> getIntervals() {
        assertNotReleased();
        return _intervals;
    }

    /**
     * Whether this condition holds at a time.
     *
     * @param time The time to test.
     * @return True if and only if one of the spans contains the time.
     */
    public boolean isTrueAt(final double time) {
        return findInterval(time).isPresent();
    }

    /**
     * The span that contains a time.
     *
     * @param time The time to look up.
     * @return The containing interval, if any.
     */
    public Optional<Interval> findInterval(final double time) {
        assertNotReleased();
        return Intervals.findContaining(_intervals, time);
    }

    /**
     * Register an additional holder of this condition. Each call must be
     * matched by a call to {@link #release()}.
     */
    public void retain() {
        assertNotReleased();
        ++_holders;
    }

    /**
     * Give up one hold on this condition. When no holder remains the interval
     * list is discarded and any later query fails.
     */
    public void release() {
        if (_holders > 1) {
            --_holders;
            return;
        }
        _holders = 0;
        _intervals = null;
    }

    public boolean isReleased() {
        return _intervals == null;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", Integer.toHexString(System.identityHashCode(this)))
                .add("Identifier", _identifier)
                .add("Comparison", _comparison)
                .add("Literal", _literal)
                .add("Intervals", _intervals)
                .toString();
    }

    private void assertNotReleased() {
        if (_intervals == null) {
            throw new IllegalStateException(String.format("Condition already released; mnemonic=%s", _identifier));
        }
    }

    private AtomicCondition(final MnemonicTable table, final Comparison comparison, final SampleValue literal) {
        _identifier = table.getIdentifier();
        _comparison = comparison;
        _literal = literal;

        final List<Double> trueTimes = new ArrayList<>();
        final List<Double> falseTimes = new ArrayList<>();
        for (final Sample sample : table.getSamples()) {
            if (comparison.test(sample.getValue(), literal)) {
                trueTimes.add(sample.getTime());
            } else {
                falseTimes.add(sample.getTime());
            }
        }
        _intervals = Intervals.fromClassification(trueTimes, falseTimes);

        LOGGER.debug()
                .setMessage("Compiled condition")
                .addData("mnemonic", _identifier)
                .addData("comparison", _comparison)
                .addData("literal", _literal)
                .addData("trueSamples", trueTimes.size())
                .addData("falseSamples", falseTimes.size())
                .addData("intervals", _intervals.size())
                .log();
    }

    private final String _identifier;
    private final Comparison _comparison;
    private final SampleValue _literal;
    private ImmutableList<Interval> _intervals;
    private int _holders;

    private static final Logger LOGGER = LoggerFactory.getLogger(AtomicCondition.class);
}
