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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.EnumSet;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.junit.Test;

public class CategoricalEmissionModelTest {

    private static final double DELTA = 1e-12;

    private static CategoricalEmissionModel newModel() {
        return new CategoricalEmissionModel(2).setEmissionProbabilities(new double[][] {
                {0.5, 0.4, 0.1}, {0.1, 0.3, 0.6}});
    }

    @Test
    public void testLogLikelihoods() {
        final CategoricalEmissionModel model = newModel();
        model.check();
        assertEquals(3, model.getNumSymbols());
        final double[][] result = model.logLikelihoods(new double[][] {{0}, {2}});
        assertEquals(Math.log(0.5), result[0][0], DELTA);
        assertEquals(Math.log(0.1), result[0][1], DELTA);
        assertEquals(Math.log(0.1), result[1][0], DELTA);
        assertEquals(Math.log(0.6), result[1][1], DELTA);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testSymbolOutOfRange() {
        newModel().logLikelihoods(new double[][] {{3}});
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonIntegerSymbol() {
        newModel().logLikelihoods(new double[][] {{1.5}});
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeSymbol() {
        newModel().logLikelihoods(new double[][] {{-1}});
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRowsMustBeStochastic() {
        new CategoricalEmissionModel(1).setEmissionProbabilities(new double[][] {{0.5, 0.4}})
                .check();
    }

    @Test
    public void testMStepNormalizesCounts() {
        final CategoricalEmissionModel model = newModel();
        final double[][] observations = {{0}, {0}, {1}, {2}, {2}};
        final double[][] posteriors = {{1.0, 0.0}, {0.5, 0.5}, {1.0, 0.0}, {0.0, 1.0},
                {0.0, 1.0}};
        GaussianEmissionModelTest.doMStep(model, observations, posteriors);

        final double[][] result = model.getEmissionProbabilities();
        assertArrayEquals(new double[] {1.5 / 2.5, 1.0 / 2.5, 0.0}, result[0], DELTA);
        assertArrayEquals(new double[] {0.5 / 2.5, 0.0, 2.0 / 2.5}, result[1], DELTA);
    }

    @Test
    public void testPrior() {
        final CategoricalEmissionModel model = newModel().setEmissionProbabilitiesPrior(2.0);
        GaussianEmissionModelTest.doMStep(model, new double[][] {{0}},
                new double[][] {{1.0, 0.0}});

        // counts + 1 for each symbol
        assertArrayEquals(new double[] {0.5, 0.25, 0.25}, model.getEmissionProbabilities()[0],
                DELTA);
        assertArrayEquals(new double[] {1.0 / 3, 1.0 / 3, 1.0 / 3},
                model.getEmissionProbabilities()[1], DELTA);
    }

    @Test
    public void testStateWithoutCountsKeepsRow() {
        final CategoricalEmissionModel model = newModel();
        GaussianEmissionModelTest.doMStep(model, new double[][] {{0}, {1}},
                new double[][] {{1.0, 0.0}, {1.0, 0.0}});
        assertArrayEquals(new double[] {0.1, 0.3, 0.6}, model.getEmissionProbabilities()[1],
                0.0);
    }

    @Test
    public void testInitFromData() {
        final CategoricalEmissionModel model = new CategoricalEmissionModel(3);
        model.initFromData(new double[][] {{0}, {1}, {1}, {3}, {0}},
                EnumSet.allOf(HmmParameter.class), new Well19937c(1));

        assertEquals(4, model.getNumSymbols());
        model.check();
        for (double[] row : model.getEmissionProbabilities()) {
            // Symbol 2 never occurs.
            assertEquals(0.0, row[2], 0.0);
            assertTrue(row[1] > 0.0);
        }
    }

    @Test
    public void testInitRejectsUnknownSymbol() {
        final CategoricalEmissionModel model = new CategoricalEmissionModel(2, 2);
        try {
            model.initFromData(new double[][] {{0}, {3}}, EnumSet.allOf(HmmParameter.class),
                    new Well19937c(1));
            fail("Expected an invalid symbol.");
        } catch (IllegalArgumentException e) {
            assertEquals(2, model.getNumSymbols());
            assertNull(model.getEmissionProbabilities());
        }
    }

    @Test
    public void testSample() {
        final CategoricalEmissionModel model = new CategoricalEmissionModel(2)
                .setEmissionProbabilities(new double[][] {{1.0, 0.0}, {0.2, 0.8}});
        final RandomGenerator random = new Well19937c(4);
        int ones = 0;
        for (int t = 0; t < 10000; t++) {
            assertEquals(0.0, model.generateSample(0, random)[0], 0.0);
            ones += (int) model.generateSample(1, random)[0];
        }
        assertEquals(0.8, ones / 10000.0, 0.02);
    }

}
