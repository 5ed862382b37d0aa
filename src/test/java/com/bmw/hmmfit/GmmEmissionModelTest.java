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
import static org.junit.Assert.assertTrue;

import java.util.EnumSet;

import org.apache.commons.math3.random.Well19937c;
import org.junit.Test;

public class GmmEmissionModelTest {

    private static final double DELTA = 1e-10;

    private static double normalDensity(double x, double mean, double variance) {
        return Math.exp(-0.5 * (x - mean) * (x - mean) / variance)
                / Math.sqrt(2 * Math.PI * variance);
    }

    private static GmmEmissionModel twoComponents() {
        return new GmmEmissionModel(1, 2, CovarianceType.DIAGONAL)
                .setWeights(new double[][] {{0.3, 0.7}})
                .setMeans(new double[][][] {{{0.0}, {3.0}}})
                .setCovariances(new double[][][][] {{{{1.0}}, {{1.0}}}});
    }

    @Test
    public void testLogLikelihoodOfMixture() {
        final GmmEmissionModel model = twoComponents();
        model.check();
        final double x = 1.2;
        final double expected = Math.log(0.3 * normalDensity(x, 0.0, 1.0)
                + 0.7 * normalDensity(x, 3.0, 1.0));
        assertEquals(expected, model.logLikelihoods(new double[][] {{x}})[0][0], DELTA);
    }

    @Test
    public void testSingleComponentMatchesGaussian() {
        final double[][] observations = {{0.5, 1.0}, {1.5, -0.5}, {4.0, 4.5}, {5.5, 5.0},
                {4.5, 6.0}};
        final double[][] posteriors = {{0.9, 0.1}, {0.8, 0.2}, {0.1, 0.9}, {0.05, 0.95},
                {0.3, 0.7}};
        final GmmEmissionModel gmm = new GmmEmissionModel(2, 1, CovarianceType.FULL)
                .setWeights(new double[][] {{1.0}, {1.0}})
                .setMeans(new double[][][] {{{0.0, 0.0}}, {{5.0, 5.0}}})
                .setCovariances(new double[][][][] {{{{1.0, 0.0}, {0.0, 1.0}}},
                        {{{1.0, 0.0}, {0.0, 1.0}}}});
        final GaussianEmissionModel gaussian = new GaussianEmissionModel(2, CovarianceType.FULL)
                .setMeans(new double[][] {{0.0, 0.0}, {5.0, 5.0}})
                .setVariances(new double[][] {{1.0, 1.0}, {1.0, 1.0}});

        GaussianEmissionModelTest.doMStep(gmm, observations, posteriors);
        GaussianEmissionModelTest.doMStep(gaussian, observations, posteriors);

        for (int i = 0; i < 2; i++) {
            assertArrayEquals(gaussian.getMeans()[i], gmm.getMeans()[i][0], 1e-9);
            for (int a = 0; a < 2; a++) {
                assertArrayEquals(gaussian.getCovariances()[i][a], gmm.getCovariances()[i][0][a],
                        1e-9);
            }
            assertArrayEquals(new double[] {1.0}, gmm.getWeights()[i], DELTA);
        }
    }

    @Test
    public void testWeightsFollowResponsibilities() {
        final GmmEmissionModel model = new GmmEmissionModel(1, 2, CovarianceType.DIAGONAL)
                .setWeights(new double[][] {{0.5, 0.5}})
                .setMeans(new double[][][] {{{0.0}, {10.0}}})
                .setCovariances(new double[][][][] {{{{1.0}}, {{1.0}}}});
        final double[][] observations = {{-0.2}, {0.1}, {0.3}, {10.2}};
        GaussianEmissionModelTest.doMStep(model, observations,
                new double[][] {{1.0}, {1.0}, {1.0}, {1.0}});

        assertEquals(0.75, model.getWeights()[0][0], 1e-6);
        assertEquals(0.25, model.getWeights()[0][1], 1e-6);
        assertEquals(0.2 / 3.0, model.getMeans()[0][0][0], 1e-6);
        assertEquals(10.2, model.getMeans()[0][1][0], 1e-6);
    }

    @Test
    public void testTiedWithinState() {
        final GmmEmissionModel model = new GmmEmissionModel(1, 2, CovarianceType.TIED)
                .setWeights(new double[][] {{0.5, 0.5}})
                .setMeans(new double[][][] {{{0.0}, {10.0}}})
                .setCovariances(new double[][][][] {{{{1.0}}, {{1.0}}}});
        GaussianEmissionModelTest.doMStep(model, new double[][] {{-1.0}, {1.0}, {9.0}, {11.0}},
                new double[][] {{1.0}, {1.0}, {1.0}, {1.0}});

        final double[][][][] covariances = model.getCovariances();
        assertEquals(covariances[0][0][0][0], covariances[0][1][0][0], 0.0);
        model.check();
    }

    @Test
    public void testInitFromData() {
        final GmmEmissionModel model = new GmmEmissionModel(2, 2, CovarianceType.SPHERICAL);
        final double[][] observations = {{0.0, 0.0}, {0.1, 0.2}, {5.0, 5.0}, {5.2, 4.9},
                {10.0, 0.0}, {10.1, 0.1}, {0.0, 10.0}, {0.2, 9.8}};
        model.initFromData(observations, EnumSet.allOf(HmmParameter.class), new Well19937c(3));

        assertTrue(model.isInitialized());
        model.check();
        assertEquals(2, model.getNumFeatures());
        for (double[] row : model.getWeights()) {
            assertArrayEquals(new double[] {0.5, 0.5}, row, DELTA);
        }
        final double[][] covariance = model.getCovariances()[1][1];
        assertEquals(covariance[0][0], covariance[1][1], DELTA);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testWeightsMustBeStochastic() {
        twoComponents().setWeights(new double[][] {{0.3, 0.6}}).check();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testWrongNumberOfComponents() {
        twoComponents().setWeights(new double[][] {{1.0}}).check();
    }

}
