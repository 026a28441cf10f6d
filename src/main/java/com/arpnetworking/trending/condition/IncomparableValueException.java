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
 * Thrown when a condition cannot compare a mnemonic's values with its literal,
 * for example a numeric threshold applied to a status mnemonic.
 *
 * @author Inscope Metrics
 */
public final class IncomparableValueException extends IllegalArgumentException {

    /**
     * Public constructor.
     *
     * @param identifier The mnemonic identifier.
     * @param valueType The declared type of the mnemonic.
     * @param comparison The requested comparison.
     * @param literal The literal.
     */
    public IncomparableValueException(
            final String identifier,
            final ValueType valueType,
            final Comparison comparison,
            final SampleValue literal) {
        super(String.format(
                "Cannot compare mnemonic values with literal; mnemonic=%s, valueType=%s, comparison=%s, literal=%s (%s)",
                identifier,
                valueType,
                comparison,
                literal,
                literal.getType()));
        _identifier = identifier;
    }

    public String getIdentifier() {
        return _identifier;
    }

    private final String _identifier;

    private static final long serialVersionUID = -1370264521874433291L;
}
