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

import com.arpnetworking.commons.builder.OvalBuilder;
import com.arpnetworking.trending.model.Interval;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import net.sf.oval.constraint.MinSize;
import net.sf.oval.constraint.NotNull;

import java.util.List;
import java.util.Optional;

/**
 * The conjunction of one or more {@link AtomicCondition} instances. Answers
 * whether every subcondition holds at a time and which span of time around it
 * they all hold for.
 *
 * <p>A composite condition holds each of its atomic conditions from
 * construction until it is closed. An atomic condition shared by several
 * composites keeps its interval data until the last of them is closed.</p>
 *
 * @author Inscope Metrics
 */
public final class CompositeCondition implements AutoCloseable {

    /**
     * Create a composite condition over the given subconditions.
     *
     * @param first The first subcondition.
     * @param rest The remaining subconditions.
     * @return New {@link CompositeCondition}.
     */
    public static CompositeCondition of(final AtomicCondition first, final AtomicCondition... rest) {
        return new Builder()
                .setConditions(ImmutableList.<AtomicCondition>builder().add(first).add(rest).build())
                .build();
    }

    public ImmutableList<AtomicCondition> getConditions() {
        return _conditions;
    }

    /**
     * Whether every subcondition holds at a time. Evaluation stops at the first
     * subcondition that does not hold.
     *
     * @param time The time to test.
     * @return True if and only if all subconditions hold.
     */
    public boolean state(final double time) {
        for (final AtomicCondition condition : _conditions) {
            if (!condition.isTrueAt(time)) {
                return false;
            }
        }
        return true;
    }

    /**
     * The tightest span containing {@code time} during which every
     * subcondition holds: the overlap of each subcondition's span around
     * {@code time}.
     *
     * @param time The time to look up.
     * @return The enclosing interval, or empty if the conjunction does not hold
     * at {@code time}.
     */
    public Optional<Interval> getInterval(final double time) {
        Interval enclosing = null;
        for (final AtomicCondition condition : _conditions) {
            final Optional<Interval> interval = condition.findInterval(time);
            if (!interval.isPresent()) {
                return Optional.empty();
            }
            enclosing = enclosing == null ? interval.get() : enclosing.intersect(interval.get());
        }
        if (enclosing == null || enclosing.isNever()) {
            return Optional.empty();
        }
        return Optional.of(enclosing);
    }

    /**
     * Give up this composite's hold on every subcondition. Closing twice has no
     * further effect.
     */
    @Override
    public void close() {
        if (_closed) {
            return;
        }
        _closed = true;
        for (final AtomicCondition condition : _conditions) {
            condition.release();
        }
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", Integer.toHexString(System.identityHashCode(this)))
                .add("Conditions", _conditions)
                .toString();
    }

    private CompositeCondition(final Builder builder) {
        _conditions = builder._conditions;
        for (final AtomicCondition condition : _conditions) {
            condition.retain();
        }
    }

    private final ImmutableList<AtomicCondition> _conditions;
    private boolean _closed;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link CompositeCondition}.
     */
    public static final class Builder extends OvalBuilder<CompositeCondition> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(CompositeCondition::new);
        }

        /**
         * Set the subconditions. Required. Cannot be null or empty.
         *
         * @param value The subconditions.
         * @return This {@link Builder} instance.
         */
        public Builder setConditions(final List<AtomicCondition> value) {
            _conditions = value == null ? null : ImmutableList.copyOf(value);
            return this;
        }

        /**
         * Add a subcondition.
         *
         * @param value The subcondition.
         * @return This {@link Builder} instance.
         */
        public Builder addCondition(final AtomicCondition value) {
            final ImmutableList.Builder<AtomicCondition> conditions = ImmutableList.builder();
            if (_conditions != null) {
                conditions.addAll(_conditions);
            }
            _conditions = conditions.add(value).build();
            return this;
        }

        @NotNull
        @MinSize(1)
        private ImmutableList<AtomicCondition> _conditions = ImmutableList.of();
    }
}
