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
package com.arpnetworking.test;

import com.arpnetworking.trending.model.MnemonicTable;
import com.arpnetworking.trending.model.Sample;
import com.arpnetworking.trending.model.ValueType;
import com.google.common.collect.ImmutableList;

import java.util.UUID;

/**
 * Creates reasonable instances of common data types for testing. This is
 * strongly preferred over mocking data type classes as mocking should be
 * reserved for defining behavior and not data.
 *
 * @author Inscope Metrics
 */
public final class TestBeanFactory {

    /**
     * Create a numeric table from alternating time and value pairs.
     *
     * @param identifier The mnemonic identifier.
     * @param timesAndValues Time, value, time, value, ...
     * @return New numeric {@link MnemonicTable}.
     */
    public static MnemonicTable createNumericTable(final String identifier, final double... timesAndValues) {
        if (timesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Times and values must be paired");
        }
        final ImmutableList.Builder<Sample> samples = ImmutableList.builder();
        for (int i = 0; i < timesAndValues.length; i += 2) {
            samples.add(Sample.of(timesAndValues[i], timesAndValues[i + 1]));
        }
        return new MnemonicTable.Builder()
                .setIdentifier(identifier)
                .setValueType(ValueType.NUMERIC)
                .setSamples(samples.build())
                .build();
    }

    /**
     * Create a categorical table with one sample per label at the given times.
     *
     * @param identifier The mnemonic identifier.
     * @param times The sample times.
     * @param labels The labels, one per time.
     * @return New categorical {@link MnemonicTable}.
     */
    public static MnemonicTable createCategoricalTable(
            final String identifier,
            final double[] times,
            final String... labels) {
        if (times.length != labels.length) {
            throw new IllegalArgumentException("Times and labels must be paired");
        }
        final ImmutableList.Builder<Sample> samples = ImmutableList.builder();
        for (int i = 0; i < times.length; ++i) {
            samples.add(Sample.of(times[i], labels[i]));
        }
        return new MnemonicTable.Builder()
                .setIdentifier(identifier)
                .setValueType(ValueType.CATEGORICAL)
                .setSamples(samples.build())
                .build();
    }

    /**
     * Create a numeric table with a random identifier.
     *
     * @param timesAndValues Time, value, time, value, ...
     * @return New numeric {@link MnemonicTable}.
     */
    public static MnemonicTable createNumericTable(final double... timesAndValues) {
        return createNumericTable("mnemonic-" + UUID.randomUUID(), timesAndValues);
    }

    private TestBeanFactory() {}
}
