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

import org.apache.commons.math3.util.FastMath;

/**
 * Forward-backward algorithm for time-homogeneous HMMs with a fixed set of N states.
 * All recursions are computed in log space to prevent arithmetic underflows for long sequences,
 * see also https://en.wikipedia.org/wiki/Forward%E2%80%93backward_algorithm.
 *
 * <p>All methods expect logarithmic start and transition probabilities as well as the T x N
 * matrix of emission log-likelihoods of one sequence, where entry (t, i) is
 * log p(o_t | s_t = i). The class keeps no state between calls.
 */
public final class ForwardBackwardAlgorithm {

    private static final double DELTA = 1e-8;

    private ForwardBackwardAlgorithm() {
    }

    /**
     * Computes forward and backward log-probabilities, the sequence log-likelihood, the state
     * posteriors and the expected transition counts.
     *
     * @throws IllegalArgumentException if the dimensions are inconsistent
     * @throws DegenerateSequenceException if the sequence has zero probability
     */
    public static ForwardBackwardResult compute(double[] logStartProb, double[][] logTransMat,
            double[][] logLikelihoods) {
        checkDimensions(logStartProb, logTransMat, logLikelihoods);
        final int numSteps = logLikelihoods.length;
        final int numStates = logStartProb.length;

        final double[][] logAlpha = forward(logStartProb, logTransMat, logLikelihoods);
        final double logLikelihood = Utils.logSumExp(logAlpha[numSteps - 1]);
        checkNotDegenerate(logLikelihood);
        final double[][] logBeta = backward(logTransMat, logLikelihoods);

        final double[][] posteriors = new double[numSteps][numStates];
        for (int t = 0; t < numSteps; t++) {
            for (int i = 0; i < numStates; i++) {
                posteriors[t][i] = FastMath.exp(logAlpha[t][i] + logBeta[t][i] - logLikelihood);
            }
            // Removes rounding errors accumulated over long sequences.
            Utils.normalize(posteriors[t]);
            assert Utils.sumsToOne(posteriors[t]);
        }

        final double[][] xiSum = new double[numStates][numStates];
        for (int t = 0; t < numSteps - 1; t++) {
            for (int i = 0; i < numStates; i++) {
                if (logAlpha[t][i] == Double.NEGATIVE_INFINITY) {
                    continue;
                }
                for (int j = 0; j < numStates; j++) {
                    final double logXi = logAlpha[t][i] + logTransMat[i][j]
                            + logLikelihoods[t + 1][j] + logBeta[t + 1][j] - logLikelihood;
                    xiSum[i][j] += FastMath.exp(logXi);
                }
            }
        }
        assert allInRange(posteriors);

        return new ForwardBackwardResult(logLikelihood, logAlpha, logBeta, posteriors, xiSum);
    }

    /**
     * Returns the log-likelihood of the sequence using the forward pass only.
     *
     * @throws DegenerateSequenceException if the sequence has zero probability
     */
    public static double logLikelihood(double[] logStartProb, double[][] logTransMat,
            double[][] logLikelihoods) {
        checkDimensions(logStartProb, logTransMat, logLikelihoods);
        final double[][] logAlpha = forward(logStartProb, logTransMat, logLikelihoods);
        final double result = Utils.logSumExp(logAlpha[logAlpha.length - 1]);
        checkNotDegenerate(result);
        return result;
    }

    /**
     * logAlpha[0][i] = logStart[i] + logLik[0][i],
     * logAlpha[t][j] = logsumexp_i(logAlpha[t-1][i] + logTrans[i][j]) + logLik[t][j].
     */
    static double[][] forward(double[] logStartProb, double[][] logTransMat,
            double[][] logLikelihoods) {
        final int numSteps = logLikelihoods.length;
        final int numStates = logStartProb.length;
        final double[][] logAlpha = new double[numSteps][numStates];
        final double[] buffer = new double[numStates];

        for (int i = 0; i < numStates; i++) {
            logAlpha[0][i] = logStartProb[i] + logLikelihoods[0][i];
        }
        for (int t = 1; t < numSteps; t++) {
            for (int j = 0; j < numStates; j++) {
                for (int i = 0; i < numStates; i++) {
                    buffer[i] = logAlpha[t - 1][i] + logTransMat[i][j];
                }
                logAlpha[t][j] = Utils.logSumExp(buffer) + logLikelihoods[t][j];
            }
        }
        return logAlpha;
    }

    /**
     * logBeta[T-1][i] = 0,
     * logBeta[t][i] = logsumexp_j(logTrans[i][j] + logLik[t+1][j] + logBeta[t+1][j]).
     */
    static double[][] backward(double[][] logTransMat, double[][] logLikelihoods) {
        final int numSteps = logLikelihoods.length;
        final int numStates = logTransMat.length;
        final double[][] logBeta = new double[numSteps][numStates];
        final double[] buffer = new double[numStates];

        // logBeta[numSteps - 1] is already 0.
        for (int t = numSteps - 2; t >= 0; t--) {
            for (int i = 0; i < numStates; i++) {
                for (int j = 0; j < numStates; j++) {
                    buffer[j] = logTransMat[i][j] + logLikelihoods[t + 1][j] + logBeta[t + 1][j];
                }
                logBeta[t][i] = Utils.logSumExp(buffer);
            }
        }
        return logBeta;
    }

    static void checkDimensions(double[] logStartProb, double[][] logTransMat,
            double[][] logLikelihoods) {
        if (logStartProb == null || logTransMat == null || logLikelihoods == null) {
            throw new NullPointerException("Probabilities and log-likelihoods must not be null.");
        }
        final int numStates = logStartProb.length;
        if (numStates == 0) {
            throw new IllegalArgumentException("At least one state is required.");
        }
        if (logTransMat.length != numStates) {
            throw new IllegalArgumentException("Transition matrix must be " + numStates + " x "
                    + numStates + ".");
        }
        for (double[] row : logTransMat) {
            if (row.length != numStates) {
                throw new IllegalArgumentException("Transition matrix must be " + numStates
                        + " x " + numStates + ".");
            }
        }
        if (logLikelihoods.length == 0) {
            throw new IllegalArgumentException("Sequence must not be empty.");
        }
        for (double[] row : logLikelihoods) {
            if (row.length != numStates) {
                throw new IllegalArgumentException("Log-likelihood matrix must have " + numStates
                        + " columns.");
            }
        }
    }

    private static void checkNotDegenerate(double logLikelihood) {
        if (Double.isNaN(logLikelihood)) {
            throw new DegenerateSequenceException("Log-likelihood of the observation sequence is "
                    + "NaN. The emission log-likelihoods contain NaN, e.g. from a NaN observation.");
        }
        if (logLikelihood == Double.NEGATIVE_INFINITY) {
            throw new DegenerateSequenceException(
                    "Observation sequence has zero probability under every state path.");
        }
    }

    private static boolean allInRange(double[][] probabilities) {
        for (double[] row : probabilities) {
            for (double probability : row) {
                if (!Utils.probabilityInRange(probability, DELTA)) {
                    return false;
                }
            }
        }
        return true;
    }

}
