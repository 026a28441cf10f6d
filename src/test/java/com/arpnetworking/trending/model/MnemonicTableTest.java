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

import com.arpnetworking.test.TestBeanFactory;
import com.google.common.collect.ImmutableList;
import net.sf.oval.exception.ConstraintsViolatedException;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests for the {@link MnemonicTable} class.
 *
 * @author Inscope Metrics
 */
public class MnemonicTableTest {

    @Test
    public void testMetadataFromSamples() {
        final MnemonicTable table = TestBeanFactory.createNumericTable("TEMP", 2, 10, 3, 11, 7, 12);
        Assert.assertEquals("TEMP", table.getIdentifier());
        Assert.assertEquals(ValueType.NUMERIC, table.getValueType());
        Assert.assertEquals(2, table.getStart(), 0.0);
        Assert.assertEquals(7, table.getEnd(), 0.0);
        Assert.assertEquals(3, table.getCount());
        Assert.assertFalse(table.isEmpty());
    }

    @Test
    public void testExplicitMetadata() {
        final MnemonicTable table = new MnemonicTable.Builder()
                .setIdentifier("TEMP")
                .setValueType(ValueType.NUMERIC)
                .setSamples(ImmutableList.of(Sample.of(2, 10)))
                .setStart(0d)
                .setEnd(86400d)
                .build();
        Assert.assertEquals(0, table.getStart(), 0.0);
        Assert.assertEquals(86400, table.getEnd(), 0.0);
    }

    @Test
    public void testEmpty() {
        final MnemonicTable table = new MnemonicTable.Builder()
                .setIdentifier("TEMP")
                .setValueType(ValueType.CATEGORICAL)
                .build();
        Assert.assertTrue(table.isEmpty());
        Assert.assertEquals(0, table.getStart(), 0.0);
        Assert.assertEquals(0, table.getEnd(), 0.0);
        Assert.assertTrue(table.samplesBetween(0, 10).isEmpty());
    }

    @Test(expected = ConstraintsViolatedException.class)
    public void testMixedValueTypes() {
        new MnemonicTable.Builder()
                .setIdentifier("TEMP")
                .setValueType(ValueType.NUMERIC)
                .setSamples(ImmutableList.of(Sample.of(0, 10), Sample.of(1, "OFF")))
                .build();
    }

    @Test(expected = ConstraintsViolatedException.class)
    public void testMissingIdentifier() {
        new MnemonicTable.Builder()
                .setValueType(ValueType.NUMERIC)
                .build();
    }

    @Test
    public void testSamplesBetween() {
        final MnemonicTable table = TestBeanFactory.createNumericTable(1, 99, 5, 101, 11, 199, 11, 198, 20, 0);
        Assert.assertEquals(
                ImmutableList.of(Sample.of(1, 99), Sample.of(5, 101)),
                table.samplesBetween(0, 10));
        Assert.assertEquals(
                ImmutableList.of(Sample.of(11, 199), Sample.of(11, 198)),
                table.samplesBetween(11, 20));
        Assert.assertEquals(
                ImmutableList.of(Sample.of(20, 0)),
                table.samplesBetween(20, Double.POSITIVE_INFINITY));
        Assert.assertTrue(table.samplesBetween(6, 11).isEmpty());
        Assert.assertTrue(table.samplesBetween(10, 10).isEmpty());
        Assert.assertTrue(table.samplesBetween(30, 20).isEmpty());
    }
}
