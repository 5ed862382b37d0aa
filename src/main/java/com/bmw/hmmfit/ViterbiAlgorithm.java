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

/**
 * Implementation of the Viterbi algorithm for time-homogeneous HMMs with a fixed set of N states.
 * The plain Viterbi algorithm is described e.g. in
 * Rabiner, Juang, An introduction to Hidden Markov Models, IEEE ASSP Mag., pp 4-16, June 1986.
 *
 * <p>Expects logarithmic probabilities as input to prevent arithmetic underflows for small
 * probability values. Ties are broken in favour of the lowest state index, so results are
 * reproducible.
 */
public final class ViterbiAlgorithm {

    private ViterbiAlgorithm() {
    }

    /**
     * Returns the most likely sequence of states for all time steps.
     * Formally, this is argmax p(s_1, ..., s_T | o_1, ..., o_T) with respect to s_1, ..., s_T.
     *
     * @throws DegenerateSequenceException if an HMM break occurs, i.e. all states of some time
     * step have zero probability
     */
    public static MostLikelySequence compute(double[] logStartProb, double[][] logTransMat,
            double[][] logLikelihoods) {
        return compute(logStartProb, logTransMat, logLikelihoods, false);
    }

    /**
     * @param keepMessageHistory Whether to store intermediate forward messages
     * (probabilities of intermediate most likely paths) for debugging.
     *
     * @see #compute(double[], double[][], double[][])
     */
    public static MostLikelySequence compute(double[] logStartProb, double[][] logTransMat,
            double[][] logLikelihoods, boolean keepMessageHistory) {
        ForwardBackwardAlgorithm.checkDimensions(logStartProb, logTransMat, logLikelihoods);
        final int numSteps = logLikelihoods.length;
        final int numStates = logStartProb.length;

        double[] message = new double[numStates];
        for (int i = 0; i < numStates; i++) {
            message[i] = logStartProb[i] + logLikelihoods[0][i];
        }
        checkHmmBreak(message, 0);

        final double[][] messageHistory = keepMessageHistory ? new double[numSteps][] : null;
        if (keepMessageHistory) {
            messageHistory[0] = message;
        }

        // backPointers[t][j] is the previous state of the most likely sequence passing at time
        // step t through state j. Since there are no previous states for t = 0, row 0 is unused.
        final int[][] backPointers = new int[numSteps][numStates];
        for (int t = 1; t < numSteps; t++) {
            final double[] nextMessage = forwardStep(message, logTransMat, logLikelihoods[t],
                    backPointers[t]);
            checkHmmBreak(nextMessage, t);
            if (keepMessageHistory) {
                messageHistory[t] = nextMessage;
            }
            message = nextMessage;
        }

        final int[] states = new int[numSteps];
        states[numSteps - 1] = Utils.argMax(message);
        for (int t = numSteps - 1; t > 0; t--) {
            states[t - 1] = backPointers[t][states[t]];
        }
        return new MostLikelySequence(states, message[states[numSteps - 1]], messageHistory);
    }

    /**
     * Computes the next message and fills the back pointers to the previous states.
     */
    private static double[] forwardStep(double[] message, double[][] logTransMat,
            double[] emissionLogLikelihoods, int[] backPointers) {
        final int numStates = message.length;
        final double[] result = new double[numStates];
        for (int j = 0; j < numStates; j++) {
            double maxLogProbability = Double.NEGATIVE_INFINITY;
            int maxPrevState = 0;
            for (int i = 0; i < numStates; i++) {
                final double logProbability = message[i] + logTransMat[i][j];
                // Strict comparison keeps the lowest index on ties.
                if (logProbability > maxLogProbability) {
                    maxLogProbability = logProbability;
                    maxPrevState = i;
                }
            }
            result[j] = maxLogProbability + emissionLogLikelihoods[j];
            backPointers[j] = maxPrevState;
        }
        return result;
    }

    /**
     * Throws if the specified message only contains states with 0 probability.
     */
    private static void checkHmmBreak(double[] message, int timeStep) {
        for (double logProbability : message) {
            if (logProbability != Double.NEGATIVE_INFINITY && !Double.isNaN(logProbability)) {
                return;
            }
        }
        throw new DegenerateSequenceException("HMM break at time step " + timeStep
                + ": all states have zero probability.");
    }

}
