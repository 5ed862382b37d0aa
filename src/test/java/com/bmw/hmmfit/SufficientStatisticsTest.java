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

import org.junit.Test;

public class SufficientStatisticsTest {

    private static final double DELTA = 1e-12;

    private static final double[][] OBSERVATIONS = {{0.1}, {0.3}, {4.9}, {5.2}};

    private static Hmm newHmm() {
        final GaussianEmissionModel emissions = new GaussianEmissionModel(2,
                CovarianceType.DIAGONAL)
                .setMeans(new double[][] {{0.0}, {5.0}})
                .setVariances(new double[][] {{1.0}, {1.0}});
        return new Hmm(emissions)
                .setStartProb(new double[] {0.6, 0.4})
                .setTransMat(new double[][] {{0.8, 0.2}, {0.3, 0.7}});
    }

    private static void accumulate(Hmm hmm, SufficientStatistics statistics,
            double[][] observations) {
        final double[][] logLikelihoods = hmm.getEmissionModel().logLikelihoods(observations);
        final ForwardBackwardResult forwardBackward = ForwardBackwardAlgorithm.compute(
                Utils.log(hmm.getStartProb()), Utils.log(hmm.getTransMat()), logLikelihoods);
        statistics.addSequence(forwardBackward);
        hmm.getEmissionModel().accumulateSufficientStatistics(statistics, observations,
                logLikelihoods, forwardBackward.posteriors);
    }

    @Test
    public void testSequencesAreIndependent() {
        final Hmm hmm = newHmm();
        final ObservationSequences sequences = new ObservationSequences(OBSERVATIONS,
                new int[] {2, 2});
        final SufficientStatistics total = hmm.newSufficientStatistics();
        for (int k = 0; k < sequences.size(); k++) {
            accumulate(hmm, total, sequences.sequence(k));
        }

        final SufficientStatistics first = hmm.newSufficientStatistics();
        accumulate(hmm, first, new double[][] {OBSERVATIONS[0], OBSERVATIONS[1]});
        final SufficientStatistics second = hmm.newSufficientStatistics();
        accumulate(hmm, second, new double[][] {OBSERVATIONS[2], OBSERVATIONS[3]});

        assertEquals(2, total.getNumSequences());
        for (int i = 0; i < 2; i++) {
            assertEquals(first.getStartCounts()[i] + second.getStartCounts()[i],
                    total.getStartCounts()[i], DELTA);
            for (int j = 0; j < 2; j++) {
                assertEquals(first.getTransitionCounts()[i][j]
                        + second.getTransitionCounts()[i][j],
                        total.getTransitionCounts()[i][j], DELTA);
            }
        }
        for (String name : total.emissionNames()) {
            final double[] values = total.emission(name);
            for (int k = 0; k < values.length; k++) {
                assertEquals(first.emission(name)[k] + second.emission(name)[k], values[k],
                        DELTA);
            }
        }

        // One transition per sequence of length 2, none across the boundary.
        assertEquals(2.0, Utils.sum(total.getStartCounts()), DELTA);
        double transitions = 0.0;
        for (double[] row : total.getTransitionCounts()) {
            transitions += Utils.sum(row);
        }
        assertEquals(2.0, transitions, DELTA);
    }

    @Test
    public void testSingleSequenceHasBoundaryTransition() {
        final Hmm hmm = newHmm();
        final SufficientStatistics statistics = hmm.newSufficientStatistics();
        accumulate(hmm, statistics, OBSERVATIONS);

        assertEquals(1.0, Utils.sum(statistics.getStartCounts()), DELTA);
        double transitions = 0.0;
        for (double[] row : statistics.getTransitionCounts()) {
            transitions += Utils.sum(row);
        }
        assertEquals(3.0, transitions, DELTA);
    }

    @Test
    public void testMergeIsOrderIndependent() {
        final Hmm hmm = newHmm();
        final double[][][] sequences = {{{0.0}, {0.4}, {5.0}}, {{4.0}, {3.5}}, {{1.0}}};
        final SufficientStatistics[] parts = new SufficientStatistics[sequences.length];
        for (int k = 0; k < sequences.length; k++) {
            parts[k] = hmm.newSufficientStatistics();
            accumulate(hmm, parts[k], sequences[k]);
        }

        final SufficientStatistics forward = hmm.newSufficientStatistics();
        for (int k = 0; k < parts.length; k++) {
            forward.merge(parts[k]);
        }
        final SufficientStatistics backward = hmm.newSufficientStatistics();
        for (int k = parts.length - 1; k >= 0; k--) {
            backward.merge(parts[k]);
        }

        assertEquals(3, forward.getNumSequences());
        assertArrayEquals(forward.getStartCounts(), backward.getStartCounts(), DELTA);
        for (int i = 0; i < 2; i++) {
            assertArrayEquals(forward.getTransitionCounts()[i],
                    backward.getTransitionCounts()[i], DELTA);
        }
        for (String name : forward.emissionNames()) {
            assertArrayEquals(forward.emission(name), backward.emission(name), DELTA);
        }
    }

    @Test
    public void testEmissionStatisticsOfGaussian() {
        final Hmm hmm = newHmm();
        final SufficientStatistics statistics = hmm.newSufficientStatistics();
        accumulate(hmm, statistics, OBSERVATIONS);

        final double[] post = statistics.emission(GaussianEmissionModel.POST);
        final double[] obs = statistics.emission(GaussianEmissionModel.OBS);
        assertEquals(OBSERVATIONS.length, Utils.sum(post), DELTA);
        assertEquals(0.1 + 0.3 + 4.9 + 5.2, Utils.sum(obs), 1e-10);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMergeDifferentShapes() {
        final SufficientStatistics statistics = new SufficientStatistics(2);
        statistics.register("obs", 4);
        statistics.merge(new SufficientStatistics(2));
    }

    @Test(expected = IllegalStateException.class)
    public void testRegisterTwice() {
        final SufficientStatistics statistics = new SufficientStatistics(2);
        statistics.register("obs", 4);
        statistics.register("obs", 4);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownStatistic() {
        new SufficientStatistics(2).emission("post");
    }

}
