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

import java.util.List;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.junit.Test;

public class ViterbiAlgorithmTest {

    private static final double DELTA = 1e-10;

    private static double[][] gaussianLogLikelihoods(double[][] observations) {
        final GaussianEmissionModel emissions = new GaussianEmissionModel(2,
                CovarianceType.DIAGONAL)
                .setMeans(new double[][] {{0.0}, {5.0}})
                .setVariances(new double[][] {{1.0}, {1.0}});
        return emissions.logLikelihoods(observations);
    }

    @Test
    public void testComputeMostLikelySequence() {
        final double[] logStartProb = Utils.log(new double[] {1.0, 0.0});
        final double[][] logTransMat = Utils.log(new double[][] {{0.9, 0.1}, {0.1, 0.9}});
        final double[][] logLikelihoods = gaussianLogLikelihoods(
                new double[][] {{0.1}, {0.2}, {4.8}, {5.1}});

        final MostLikelySequence result = ViterbiAlgorithm.compute(logStartProb, logTransMat,
                logLikelihoods);
        assertArrayEquals(new int[] {0, 0, 1, 1}, result.states);
        assertEquals(HmmTestUtils.jointLogProbability(logStartProb, logTransMat, logLikelihoods,
                result.states), result.score, DELTA);
        assertNull(result.messageHistory);
    }

    @Test
    public void testOptimalAmongAllPaths() {
        final RandomGenerator random = new Well19937c(7);
        for (int run = 0; run < 10; run++) {
            final double[] logStartProb = Utils.log(HmmTestUtils.randomDistribution(3, random));
            final double[][] logTransMat = Utils.log(
                    HmmTestUtils.randomStochasticMatrix(3, random));
            final double[][] logLikelihoods = HmmTestUtils.randomLogLikelihoods(4, 3, random);

            final MostLikelySequence result = ViterbiAlgorithm.compute(logStartProb,
                    logTransMat, logLikelihoods);
            final double score = HmmTestUtils.jointLogProbability(logStartProb, logTransMat,
                    logLikelihoods, result.states);
            assertEquals(score, result.score, DELTA);

            final List<int[]> paths = HmmTestUtils.allPaths(3, 4);
            for (int[] path : paths) {
                assertTrue(score >= HmmTestUtils.jointLogProbability(logStartProb, logTransMat,
                        logLikelihoods, path) - DELTA);
            }
        }
    }

    @Test
    public void testTiesPreferLowestState() {
        final double[] logStartProb = Utils.log(new double[] {0.5, 0.5});
        final double[][] logTransMat = Utils.log(new double[][] {{0.5, 0.5}, {0.5, 0.5}});
        final double[][] logLikelihoods = {{-1.0, -1.0}, {-2.0, -2.0}, {-3.0, -3.0}};

        final MostLikelySequence result = ViterbiAlgorithm.compute(logStartProb, logTransMat,
                logLikelihoods);
        assertArrayEquals(new int[] {0, 0, 0}, result.states);
    }

    @Test
    public void testMessageHistory() {
        final double[] logStartProb = Utils.log(new double[] {0.5, 0.5});
        final double[][] logTransMat = Utils.log(new double[][] {{0.7, 0.3}, {0.3, 0.7}});
        final double[][] logLikelihoods = {{Math.log(0.9), Math.log(0.2)},
                {Math.log(0.1), Math.log(0.8)}};

        final MostLikelySequence result = ViterbiAlgorithm.compute(logStartProb, logTransMat,
                logLikelihoods, true);
        assertEquals(2, result.messageHistory.length);
        assertEquals(Math.log(0.45), result.messageHistory[0][0], DELTA);
        assertEquals(Math.log(0.1), result.messageHistory[0][1], DELTA);
        // 0.45 * 0.3 * 0.8 > 0.1 * 0.7 * 0.8
        assertEquals(Math.log(0.45 * 0.3 * 0.8), result.messageHistory[1][1], DELTA);
        assertEquals(result.score, result.messageHistory[1][result.states[1]], DELTA);
        assertArrayEquals(new int[] {0, 1}, result.states);
        assertTrue(result.messageHistoryString().startsWith(
                "Message history with log probabilities"));
        assertTrue(result.messageHistoryString().contains("Time step 1"));
    }

    @Test
    public void testHmmBreak() {
        final double[] logStartProb = Utils.log(new double[] {1.0, 0.0});
        final double[][] logTransMat = Utils.log(new double[][] {{1.0, 0.0}, {0.0, 1.0}});
        final double[][] logLikelihoods = {{0.0, 0.0}, {Double.NEGATIVE_INFINITY, 0.0}};
        try {
            ViterbiAlgorithm.compute(logStartProb, logTransMat, logLikelihoods);
            fail("Expected an HMM break.");
        } catch (DegenerateSequenceException e) {
            assertEquals(-1, e.getSequenceIndex());
            assertTrue(e.getMessage().contains("time step 1"));
        }
    }

    @Test
    public void testMapDecoding() {
        final double[] umbrella = {Math.log(0.9), Math.log(0.2)};
        final double[] noUmbrella = {Math.log(0.1), Math.log(0.8)};
        final MostLikelySequence result = DecoderAlgorithm.MAP.decode(
                Utils.log(new double[] {0.5, 0.5}),
                Utils.log(new double[][] {{0.7, 0.3}, {0.3, 0.7}}),
                new double[][] {umbrella, umbrella, noUmbrella, umbrella, umbrella});

        assertArrayEquals(new int[] {0, 0, 1, 0, 0}, result.states);
        assertEquals((0.8673 + 0.8204 + 0.6925 + 0.8204 + 0.8673) / 5, result.score, 1e-4);
    }

    /**
     * Independent per-step decisions can combine into a path the chain cannot take.
     */
    @Test
    public void testMapDecodingIgnoresTransitionConstraints() {
        final double[] logStartProb = Utils.log(new double[] {0.4, 0.3, 0.3});
        final double[][] logTransMat = Utils.log(new double[][] {{1.0, 0.0, 0.0},
                {0.0, 0.0, 1.0}, {0.0, 0.0, 1.0}});
        final double[][] logLikelihoods = new double[2][3];

        final MostLikelySequence map = DecoderAlgorithm.MAP.decode(logStartProb, logTransMat,
                logLikelihoods);
        assertArrayEquals(new int[] {0, 2}, map.states);
        assertEquals(Double.NEGATIVE_INFINITY, logTransMat[0][2], 0.0);

        final MostLikelySequence viterbi = DecoderAlgorithm.VITERBI.decode(logStartProb,
                logTransMat, logLikelihoods);
        assertArrayEquals(new int[] {0, 0}, viterbi.states);
        assertEquals(Math.log(0.4), viterbi.score, DELTA);
    }

}
