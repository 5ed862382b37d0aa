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
 * Policy for decoding the hidden states of an observation sequence.
 */
public enum DecoderAlgorithm {

    /**
     * Single most probable state path, see {@link ViterbiAlgorithm}.
     */
    VITERBI {
        @Override
        MostLikelySequence decode(double[] logStartProb, double[][] logTransMat,
                double[][] logLikelihoods) {
            return ViterbiAlgorithm.compute(logStartProb, logTransMat, logLikelihoods);
        }
    },

    /**
     * Most probable state at each time step, chosen independently from the posteriors of the
     * {@link ForwardBackwardAlgorithm}. The result is not necessarily a jointly optimal path and
     * may contain transitions with zero probability.
     */
    MAP {
        @Override
        MostLikelySequence decode(double[] logStartProb, double[][] logTransMat,
                double[][] logLikelihoods) {
            final double[][] posteriors = ForwardBackwardAlgorithm.compute(logStartProb,
                    logTransMat, logLikelihoods).posteriors;
            final int[] states = new int[posteriors.length];
            double sum = 0.0;
            for (int t = 0; t < posteriors.length; t++) {
                states[t] = Utils.argMax(posteriors[t]);
                sum += posteriors[t][states[t]];
            }
            return new MostLikelySequence(states, sum / posteriors.length, null);
        }
    };

    abstract MostLikelySequence decode(double[] logStartProb, double[][] logTransMat,
            double[][] logLikelihoods);

}
