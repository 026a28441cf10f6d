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
package com.arpnetworking.trending.telemetry;

import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.arpnetworking.trending.model.MnemonicTable;
import com.arpnetworking.trending.model.Sample;
import com.arpnetworking.trending.model.SampleValue;
import com.arpnetworking.trending.model.ValueType;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.LinkedListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.primitives.Doubles;

import java.io.IOException;
import java.io.Reader;
import java.util.List;
import java.util.Map;

/**
 * Reads telemetry exported as CSV rows of {@code mnemonic,time,value} into
 * one {@link MnemonicTable} per mnemonic. Rows keep their file order within
 * a mnemonic. A mnemonic is numeric when every one of its values parses as a
 * number and categorical otherwise.
 *
 * @author Inscope Metrics
 */
public final class CsvMnemonicTableReader {

    /**
     * Read the telemetry.
     *
     * @param reader The CSV source, with a header row.
     * @return The tables keyed by mnemonic identifier, in order of first appearance.
     * @throws IOException if the source cannot be read or parsed.
     */
    public ImmutableMap<String, MnemonicTable> read(final Reader reader) throws IOException {
        final ListMultimap<String, Row> rows = LinkedListMultimap.create();
        try (MappingIterator<Map<String, String>> iterator = MAPPER.readerFor(Map.class).with(SCHEMA).readValues(reader)) {
            while (iterator.hasNext()) {
                final Map<String, String> row = iterator.next();
                final String mnemonic = row.get(MNEMONIC_COLUMN);
                final String time = row.get(TIME_COLUMN);
                final String value = row.get(VALUE_COLUMN);
                if (mnemonic == null || mnemonic.isEmpty() || time == null || value == null) {
                    throw new IOException(String.format("Incomplete telemetry row; row=%s", row));
                }
                final Double parsedTime = Doubles.tryParse(time.trim());
                if (parsedTime == null) {
                    throw new IOException(String.format("Invalid sample time; mnemonic=%s, time=%s", mnemonic, time));
                }
                rows.put(mnemonic, new Row(parsedTime, value.trim()));
            }
        }

        final ImmutableMap.Builder<String, MnemonicTable> tables = ImmutableMap.builder();
        for (final String mnemonic : rows.keySet()) {
            final MnemonicTable table = toTable(mnemonic, rows.get(mnemonic));
            LOGGER.debug()
                    .setMessage("Read mnemonic table")
                    .addData("mnemonic", mnemonic)
                    .addData("valueType", table.getValueType())
                    .addData("count", table.getCount())
                    .log();
            tables.put(mnemonic, table);
        }
        return tables.build();
    }

    private static MnemonicTable toTable(final String mnemonic, final List<Row> rows) {
        boolean numeric = true;
        for (final Row row : rows) {
            if (Doubles.tryParse(row._value) == null) {
                numeric = false;
                break;
            }
        }

        final ImmutableList.Builder<Sample> samples = ImmutableList.builder();
        for (final Row row : rows) {
            final SampleValue value = numeric
                    ? SampleValue.numeric(Double.parseDouble(row._value))
                    : SampleValue.categorical(row._value);
            samples.add(Sample.of(row._time, value));
        }
        return new MnemonicTable.Builder()
                .setIdentifier(mnemonic)
                .setValueType(numeric ? ValueType.NUMERIC : ValueType.CATEGORICAL)
                .setSamples(samples.build())
                .build();
    }

    private static final CsvMapper MAPPER = new CsvMapper();
    private static final CsvSchema SCHEMA = CsvSchema.emptySchema().withHeader();
    private static final String MNEMONIC_COLUMN = "mnemonic";
    private static final String TIME_COLUMN = "time";
    private static final String VALUE_COLUMN = "value";
    private static final Logger LOGGER = LoggerFactory.getLogger(CsvMnemonicTableReader.class);

    private static final class Row {

        private Row(final double time, final String value) {
            _time = time;
            _value = value;
        }

        private final double _time;
        private final String _value;
    }
}
