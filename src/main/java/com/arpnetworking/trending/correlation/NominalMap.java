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
package com.arpnetworking.trending.correlation;

import com.arpnetworking.logback.annotations.Loggable;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;

import java.util.Map;
import java.util.Optional;

/**
 * The expected sensor ratio for each commanded position label.
 *
 * @author Inscope Metrics
 */
@Loggable
public final class NominalMap {

    /**
     * Create a nominal map.
     *
     * @param nominals Nominal ratio by position label.
     * @return New {@link NominalMap}.
     */
    public static NominalMap of(final Map<String, Double> nominals) {
        return new NominalMap(ImmutableMap.copyOf(nominals));
    }

    /**
     * The nominal ratio of a position.
     *
     * @param label The position label.
     * @return The nominal ratio, or empty if the label is not mapped.
     */
    public Optional<Double> getNominal(final String label) {
        return Optional.ofNullable(_nominals.get(label));
    }

    public ImmutableMap<String, Double> asMap() {
        return _nominals;
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }
        return _nominals.equals(((NominalMap) object)._nominals);
    }

    @Override
    public int hashCode() {
        return _nominals.hashCode();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Nominals", _nominals)
                .toString();
    }

    private NominalMap(final ImmutableMap<String, Double> nominals) {
        _nominals = nominals;
    }

    private final ImmutableMap<String, Double> _nominals;
}
