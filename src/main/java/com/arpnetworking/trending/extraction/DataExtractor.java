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
package com.arpnetworking.trending.extraction;

import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.arpnetworking.trending.condition.CompositeCondition;
import com.arpnetworking.trending.model.MnemonicTable;
import com.arpnetworking.trending.model.Sample;
import com.arpnetworking.trending.model.SampleValue;
import com.google.common.collect.ImmutableList;

/**
 * Selects the values of a mnemonic that were recorded while a condition held.
 *
 * @author Inscope Metrics
 */
public final class DataExtractor {

    /**
     * Keep every sample whose time satisfies the condition.
     *
     * @param condition The condition.
     * @param table The mnemonic to filter.
     * @return The selected values, typed by the table's declared value type.
     */
    public ExtractionResult extract(final CompositeCondition condition, final MnemonicTable table) {
        final ImmutableList.Builder<SampleValue> values = ImmutableList.builder();
        for (final Sample sample : table.getSamples()) {
            if (condition.state(sample.getTime())) {
                values.add(sample.getValue());
            }
        }
        final ImmutableList<SampleValue> selected = values.build();
        if (selected.isEmpty()) {
            return ExtractionResult.empty(table.getIdentifier(), table.getValueType());
        }
        LOGGER.trace()
                .setMessage("Extracted values")
                .addData("mnemonic", table.getIdentifier())
                .addData("selected", selected.size())
                .addData("total", table.getCount())
                .log();
        return ExtractionResult.of(table.getIdentifier(), table.getValueType(), selected);
    }

    private static final Logger LOGGER = LoggerFactory.getLogger(DataExtractor.class);
}
