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
import static org.junit.Assert.assertTrue;

import java.util.EnumSet;

import org.apache.commons.math3.distribution.PoissonDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.junit.Test;

public class PoissonEmissionModelTest {

    private static final double DELTA = 1e-10;

    private static PoissonEmissionModel newModel() {
        return new PoissonEmissionModel(2).setRates(new double[][] {{1.5, 4.0}, {8.0, 0.5}});
    }

    @Test
    public void testLogLikelihoods() {
        final PoissonEmissionModel model = newModel();
        model.check();
        final double[][] result = model.logLikelihoods(new double[][] {{2, 3}});
        final double expected = new PoissonDistribution(8.0).logProbability(2)
                + new PoissonDistribution(0.5).logProbability(3);
        assertEquals(expected, result[0][1], 1e-9);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeCount() {
        newModel().logLikelihoods(new double[][] {{-1, 0}});
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonPositiveRate() {
        new PoissonEmissionModel(1).setRates(new double[][] {{0.0}}).check();
    }

    @Test
    public void testMStepWeightedMean() {
        final PoissonEmissionModel model = newModel();
        GaussianEmissionModelTest.doMStep(model, new double[][] {{1, 2}, {3, 6}, {10, 0}},
                new double[][] {{1.0, 0.0}, {0.5, 0.5}, {0.0, 1.0}});

        final double[][] rates = model.getRates();
        assertEquals((1 + 1.5) / 1.5, rates[0][0], DELTA);
        assertEquals((2 + 3) / 1.5, rates[0][1], DELTA);
        assertEquals((1.5 + 10) / 1.5, rates[1][0], DELTA);
        assertEquals(3.0 / 1.5, rates[1][1], DELTA);
    }

    @Test
    public void testRatesPrior() {
        final PoissonEmissionModel model = newModel().setRatesPrior(2.0, 1.0);
        GaussianEmissionModelTest.doMStep(model, new double[][] {{4, 0}},
                new double[][] {{1.0, 0.0}});
        assertEquals(3.0, model.getRates()[0][0], DELTA);
        assertEquals(1.0, model.getRates()[0][1], DELTA);
        assertEquals(2.0, model.getRates()[1][0], DELTA);
    }

    @Test
    public void testSampleMean() {
        final PoissonEmissionModel model = newModel();
        final RandomGenerator random = new Well19937c(9);
        double sum = 0.0;
        for (int t = 0; t < 10000; t++) {
            final double[] sample = model.generateSample(1, random);
            assertEquals(Math.rint(sample[0]), sample[0], 0.0);
            sum += sample[0];
        }
        assertEquals(8.0, sum / 10000, 0.1);
    }

    @Test
    public void testInitFromData() {
        final PoissonEmissionModel model = new PoissonEmissionModel(3);
        model.initFromData(new double[][] {{1, 10}, {3, 12}, {2, 9}, {6, 15}},
                EnumSet.allOf(HmmParameter.class), new Well19937c(2));
        model.check();
        assertEquals(2, model.getNumFeatures());
        for (double[] row : model.getRates()) {
            assertTrue(row[0] > 0.0 && row[1] > 0.0);
        }
    }

}
