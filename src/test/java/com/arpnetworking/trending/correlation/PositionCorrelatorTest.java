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

import com.arpnetworking.test.TestBeanFactory;
import com.arpnetworking.trending.condition.AtomicCondition;
import com.arpnetworking.trending.condition.CompositeCondition;
import com.arpnetworking.trending.model.MnemonicTable;
import com.arpnetworking.trending.model.Sample;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.sf.oval.exception.ConstraintsViolatedException;
import org.junit.Assert;
import org.junit.Test;

import java.util.Optional;

/**
 * Tests for the {@link PositionCorrelator} class.
 *
 * @author Inscope Metrics
 */
public class PositionCorrelatorTest {

    @Test
    public void testCorrelate() {
        final CompositeCondition condition = supplyCondition(0, 300, 20, 0);
        final MnemonicTable positions = TestBeanFactory.createCategoricalTable(
                "POS", new double[] {0, 10}, "A", "B");
        final MnemonicTable ratios = TestBeanFactory.createNumericTable("RATIO", 1, 99, 5, 101, 11, 199);

        final CorrelationResult result = new PositionCorrelator.Builder().build()
                .correlate(condition, NOMINALS, positions, ratios);

        Assert.assertEquals("POS", result.getPositionIdentifier());
        Assert.assertEquals("RATIO", result.getRatioIdentifier());
        Assert.assertEquals(ImmutableList.of(Sample.of(1, 99)), result.getMatches().get("A"));
        Assert.assertEquals(ImmutableList.of(Sample.of(11, 199)), result.getMatches().get("B"));
        Assert.assertEquals(2, result.getMatches().size());
        Assert.assertEquals(0, result.getExhausted());
    }

    @Test
    public void testLabelAccumulatesMatches() {
        final CompositeCondition condition = supplyCondition(0, 300, 100, 0);
        final MnemonicTable positions = TestBeanFactory.createCategoricalTable(
                "POS", new double[] {0, 10, 20}, "A", "B", "A");
        final MnemonicTable ratios = TestBeanFactory.createNumericTable("RATIO", 1, 100.2, 11, 200.1, 21, 99.5);

        final CorrelationResult result = new PositionCorrelator.Builder().build()
                .correlate(condition, NOMINALS, positions, ratios);

        Assert.assertEquals(
                ImmutableList.of(Sample.of(1, 100.2), Sample.of(21, 99.5)),
                result.getMatches().get("A"));
    }

    @Test
    public void testWideningOnlyAddsMatches() {
        final CompositeCondition condition = supplyCondition(0, 300, 100, 0);
        final MnemonicTable positions = TestBeanFactory.createCategoricalTable(
                "POS", new double[] {0, 10, 20, 30, 40}, "A", "A", "A", "A", "A");
        final MnemonicTable ratios = TestBeanFactory.createNumericTable(
                "RATIO", 1, 100.5, 11, 102, 21, 104, 31, 108, 41, 110.5);

        final double[] limits = {1, 3, 5, 7, 9, 11};
        final int[] expected = {1, 2, 3, 3, 4, 5};
        ImmutableList<Sample> previous = ImmutableList.of();
        for (int i = 0; i < limits.length; ++i) {
            final CorrelationResult result = new PositionCorrelator.Builder()
                    .setWindowLimit(limits[i])
                    .build()
                    .correlate(condition, NOMINALS, positions, ratios);
            final ImmutableList<Sample> matches = result.getMatches().get("A");
            Assert.assertEquals("limit=" + limits[i], expected[i], matches.size());
            Assert.assertTrue("limit=" + limits[i], matches.containsAll(previous));
            Assert.assertEquals(5 - expected[i], result.getExhausted());
            previous = matches;
        }
    }

    @Test
    public void testDefaultLimitExhausted() {
        final CompositeCondition condition = supplyCondition(0, 300, 100, 0);
        final MnemonicTable positions = TestBeanFactory.createCategoricalTable("POS", new double[] {0}, "A");
        final MnemonicTable ratios = TestBeanFactory.createNumericTable("RATIO", 1, 110.5);

        final CorrelationResult result = new PositionCorrelator.Builder().build()
                .correlate(condition, NOMINALS, positions, ratios);

        Assert.assertTrue(result.getMatches().isEmpty());
        Assert.assertEquals(1, result.getExhausted());
    }

    @Test
    public void testSkippedReports() {
        // Supply holds on [0, 20) only
        final CompositeCondition condition = supplyCondition(0, 300, 20, 0, 40, 0);
        final MnemonicTable positions = TestBeanFactory.createCategoricalTable(
                "POS", new double[] {0, 5, 10, 25}, "UNKNOWN", "X", "A", "B");
        final MnemonicTable ratios = TestBeanFactory.createNumericTable("RATIO", 1, 100, 6, 100, 11, 100, 26, 200);

        final CorrelationResult result = new PositionCorrelator.Builder().build()
                .correlate(condition, NOMINALS, positions, ratios);

        Assert.assertEquals(1, result.getUnclassified());
        Assert.assertEquals(1, result.getUnmapped());
        Assert.assertEquals(1, result.getNoWindow());
        Assert.assertEquals(0, result.getExhausted());
        Assert.assertEquals(ImmutableList.of(Sample.of(11, 100)), result.getMatches().get("A"));
        Assert.assertTrue(result.getMatches().get("B").isEmpty());
    }

    @Test
    public void testCustomUnknownLabel() {
        final CompositeCondition condition = supplyCondition(0, 300, 20, 0);
        final MnemonicTable positions = TestBeanFactory.createCategoricalTable("POS", new double[] {0}, "NONE");
        final MnemonicTable ratios = TestBeanFactory.createNumericTable("RATIO", 1, 100);

        final CorrelationResult result = new PositionCorrelator.Builder()
                .setUnknownLabel("NONE")
                .build()
                .correlate(condition, NOMINALS, positions, ratios);

        Assert.assertEquals(1, result.getUnclassified());
        Assert.assertEquals(0, result.getUnmapped());
    }

    @Test
    public void testOpenEndedWindow() {
        final CompositeCondition condition = supplyCondition(0, 300, 50, 300);
        final MnemonicTable positions = TestBeanFactory.createCategoricalTable("POS", new double[] {0}, "B");
        final MnemonicTable ratios = TestBeanFactory.createNumericTable("RATIO", 1, 150, 1000, 200);

        final CorrelationResult result = new PositionCorrelator.Builder().build()
                .correlate(condition, NOMINALS, positions, ratios);

        Assert.assertEquals(ImmutableList.of(Sample.of(1000, 200)), result.getMatches().get("B"));
    }

    @Test
    public void testWindowEndsAtConditionEnd() {
        final CompositeCondition condition = supplyCondition(0, 300, 20, 0);
        final MnemonicTable positions = TestBeanFactory.createCategoricalTable("POS", new double[] {0}, "A");
        final MnemonicTable ratios = TestBeanFactory.createNumericTable("RATIO", 25, 100);

        final CorrelationResult result = new PositionCorrelator.Builder().build()
                .correlate(condition, NOMINALS, positions, ratios);

        Assert.assertTrue(result.getMatches().isEmpty());
        Assert.assertEquals(1, result.getExhausted());
    }

    @Test
    public void testSearchTieBreak() {
        final PositionCorrelator correlator = new PositionCorrelator.Builder().build();
        Assert.assertEquals(
                Optional.of(Sample.of(1, 100.5)),
                correlator.search(ImmutableList.of(Sample.of(1, 100.5), Sample.of(2, 100.1)), 100));
        Assert.assertEquals(
                Optional.of(Sample.of(2, 100.2)),
                correlator.search(ImmutableList.of(Sample.of(1, 101), Sample.of(2, 100.2)), 100));
        Assert.assertEquals(
                Optional.of(Sample.of(2, 101.5)),
                correlator.search(ImmutableList.of(Sample.of(1, 103), Sample.of(2, 101.5)), 100));
        Assert.assertEquals(Optional.empty(), correlator.search(ImmutableList.of(), 100));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNumericPositions() {
        final CompositeCondition condition = supplyCondition(0, 300, 20, 0);
        new PositionCorrelator.Builder().build().correlate(
                condition,
                NOMINALS,
                TestBeanFactory.createNumericTable("POS", 0, 1),
                TestBeanFactory.createNumericTable("RATIO", 1, 100));
    }

    @Test(expected = ConstraintsViolatedException.class)
    public void testNonPositiveWindow() {
        new PositionCorrelator.Builder().setInitialWindow(0d).build();
    }

    @Test(expected = ConstraintsViolatedException.class)
    public void testLimitBelowInitialWindow() {
        new PositionCorrelator.Builder().setInitialWindow(5d).setWindowLimit(3d).build();
    }

    private static CompositeCondition supplyCondition(final double... timesAndValues) {
        return CompositeCondition.of(AtomicCondition.greaterThan(
                TestBeanFactory.createNumericTable("SUPPLY", timesAndValues),
                250));
    }

    private static final NominalMap NOMINALS = NominalMap.of(ImmutableMap.of("A", 100d, "B", 200d));
}
