/**
 * Copyright (C) 2016, BMW AG
 * Author: Stefan Holder (stefan.holder@bmw.de)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.bmw.hmmfit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

public class ConvergenceMonitorTest {

    @Test
    public void testConvergesWhenChangeBelowTol() {
        ConvergenceMonitor monitor = new ConvergenceMonitor(0.1, 10);
        assertFalse(monitor.isConverged());

        monitor = monitor.report(-10.0);
        assertFalse(monitor.isConverged());
        monitor = monitor.report(-9.0);
        assertFalse(monitor.isConverged());
        monitor = monitor.report(-8.95);
        assertTrue(monitor.isConverged());
        assertTrue(monitor.isTolReached());
        assertFalse(monitor.isIterationLimitReached());
        assertEquals(3, monitor.getIteration());
        assertEquals(Arrays.asList(-10.0, -9.0, -8.95), monitor.getHistory());
    }

    @Test
    public void testIterationLimit() {
        ConvergenceMonitor monitor = new ConvergenceMonitor(0.01, 3);
        monitor = monitor.report(-100.0).report(-50.0).report(-10.0);
        assertTrue(monitor.isConverged());
        assertFalse(monitor.isTolReached());
        assertTrue(monitor.isIterationLimitReached());
    }

    @Test
    public void testSingleIterationCap() {
        final ConvergenceMonitor monitor = new ConvergenceMonitor(0.01, 1).report(-5.0);
        assertTrue(monitor.isConverged());
        assertFalse(monitor.isTolReached());
    }

    @Test
    public void testZeroTolNeverReached() {
        final ConvergenceMonitor monitor = new ConvergenceMonitor(0.0, 5).report(-5.0)
                .report(-5.0);
        assertFalse(monitor.isTolReached());
        assertFalse(monitor.isConverged());
    }

    @Test
    public void testDecreaseIsRecorded() {
        final ConvergenceMonitor monitor = new ConvergenceMonitor(0.01, 10).report(-10.0)
                .report(-11.0).report(-10.5);
        assertEquals(Collections.singletonList(2), monitor.getDecreasingIterations());
        assertFalse(monitor.isConverged());
    }

    @Test
    public void testRoundingDecreaseIsIgnored() {
        final ConvergenceMonitor monitor = new ConvergenceMonitor(0.01, 10).report(-1000.0)
                .report(-1000.0000001);
        assertTrue(monitor.getDecreasingIterations().isEmpty());
        assertTrue(monitor.isConverged());
    }

    @Test
    public void testReportReturnsNewValue() {
        final ConvergenceMonitor monitor = new ConvergenceMonitor(0.01, 10);
        final ConvergenceMonitor next = monitor.report(-3.0);
        assertEquals(0, monitor.getIteration());
        assertTrue(monitor.getHistory().isEmpty());
        assertEquals(1, next.getIteration());
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testHistoryIsReadOnly() {
        new ConvergenceMonitor(0.01, 10).report(-3.0).getHistory().add(1.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidNIter() {
        new ConvergenceMonitor(0.01, 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeTol() {
        new ConvergenceMonitor(-1.0, 10);
    }

}
