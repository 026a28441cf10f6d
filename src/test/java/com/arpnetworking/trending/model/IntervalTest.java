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

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests for the {@link Interval} class.
 *
 * @author Inscope Metrics
 */
public class IntervalTest {

    @Test
    public void testBounded() {
        final Interval interval = Interval.bounded(0, 2);
        Assert.assertTrue(interval.contains(0));
        Assert.assertTrue(interval.contains(1.999));
        Assert.assertFalse(interval.contains(2));
        Assert.assertFalse(interval.contains(-0.001));
        Assert.assertEquals(2, interval.getUpperBound(), 0.0);
        Assert.assertFalse(interval.isOpenEnded());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBoundedEmpty() {
        Interval.bounded(3, 3);
    }

    @Test
    public void testOpenForms() {
        final Interval from = Interval.openFrom(5);
        final Interval after = Interval.openAfter(5);
        Assert.assertTrue(from.contains(5));
        Assert.assertFalse(after.contains(5));
        Assert.assertTrue(after.contains(5.001));
        Assert.assertEquals(0, from.getEnd(), 0.0);
        Assert.assertEquals(0, after.getEnd(), 0.0);
        Assert.assertEquals(Double.POSITIVE_INFINITY, after.getUpperBound(), 0.0);
        Assert.assertTrue(from.isOpenEnded());
        Assert.assertNotEquals(from, after);
    }

    @Test
    public void testNeverDistinctFromZeroTimestamps() {
        Assert.assertTrue(Interval.NEVER.isNever());
        Assert.assertFalse(Interval.NEVER.contains(0));
        Assert.assertTrue(Interval.openFrom(0).contains(0));
        Assert.assertNotEquals(Interval.NEVER, Interval.openFrom(0));
    }

    @Test
    public void testIntersect() {
        Assert.assertEquals(Interval.bounded(5, 10), Interval.bounded(0, 10).intersect(Interval.bounded(5, 15)));
        Assert.assertEquals(Interval.bounded(5, 15), Interval.openFrom(0).intersect(Interval.bounded(5, 15)));
        Assert.assertEquals(Interval.openAfter(3), Interval.openFrom(3).intersect(Interval.openAfter(3)));
        Assert.assertEquals(Interval.NEVER, Interval.bounded(0, 5).intersect(Interval.bounded(5, 10)));
        Assert.assertEquals(Interval.NEVER, Interval.NEVER.intersect(Interval.openFrom(0)));
    }

    @Test
    public void testIntersectKeepsExcludedStart() {
        final Interval overlap = Interval.openAfter(5).intersect(Interval.bounded(0, 10));
        Assert.assertEquals(Interval.boundedAfter(5, 10), overlap);
        Assert.assertFalse(overlap.contains(5));
        Assert.assertTrue(overlap.contains(5.5));
        Assert.assertFalse(overlap.contains(10));
        Assert.assertTrue(overlap.isStartExcluded());
        Assert.assertFalse(overlap.isOpenEnded());

        Assert.assertEquals(
                Interval.boundedAfter(5, 8),
                Interval.boundedAfter(5, 10).intersect(Interval.bounded(5, 8)));
        Assert.assertEquals(Interval.bounded(6, 10), Interval.openAfter(5).intersect(Interval.bounded(6, 10)));
    }
}
