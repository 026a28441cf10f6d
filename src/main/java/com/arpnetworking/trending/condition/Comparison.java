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

import com.arpnetworking.trending.model.SampleValue;
import com.arpnetworking.trending.model.ValueType;

/**
 * The predicate kinds an {@link AtomicCondition} can apply to a mnemonic.
 *
 * @author Inscope Metrics
 */
public enum Comparison {

    /**
     * The sample value equals the literal. Applies to numeric and categorical
     * mnemonics alike. Numbers compare by value, so zero matches negative zero.
     */
    EQUAL(true) {
        @Override
        boolean test(final SampleValue value, final SampleValue literal) {
            if (value.getType() == ValueType.NUMERIC && literal.getType() == ValueType.NUMERIC) {
                return value.asNumber() == literal.asNumber();
            }
            return value.equals(literal);
        }
    },

    /**
     * The sample value is strictly less than the literal. Numeric only.
     */
    LESS_THAN(false) {
        @Override
        boolean test(final SampleValue value, final SampleValue literal) {
            return value.asNumber() < literal.asNumber();
        }
    },

    /**
     * The sample value is strictly greater than the literal. Numeric only.
     */
    GREATER_THAN(false) {
        @Override
        boolean test(final SampleValue value, final SampleValue literal) {
            return value.asNumber() > literal.asNumber();
        }
    };

    /**
     * Whether this comparison can be evaluated for a mnemonic of the given
     * type against the given literal.
     *
     * @param valueType The declared type of the mnemonic.
     * @param literal The literal to compare against.
     * @return True if and only if the comparison is well defined.
     */
    public boolean supports(final ValueType valueType, final SampleValue literal) {
        if (literal.getType() != valueType) {
            return false;
        }
        return _categorical || valueType == ValueType.NUMERIC;
    }

    abstract boolean test(SampleValue value, SampleValue literal);

    Comparison(final boolean categorical) {
        _categorical = categorical;
    }

    private final boolean _categorical;
}
