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
 * Result of the {@link ForwardBackwardAlgorithm} for one observation sequence.
 * Arrays are owned by this result and are not copied by the accessors.
 */
public class ForwardBackwardResult {

    /**
     * log p(o_1, ..., o_T), the log-likelihood of the entire sequence.
     */
    public final double logLikelihood;

    /**
     * logAlpha[t][i] = log p(o_1, ..., o_t, s_t = i).
     */
    public final double[][] logAlpha;

    /**
     * logBeta[t][i] = log p(o_t+1, ..., o_T | s_t = i).
     */
    public final double[][] logBeta;

    /**
     * posteriors[t][i] = p(s_t = i | o_1, ..., o_T). Each row sums to 1.
     */
    public final double[][] posteriors;

    /**
     * xiSum[i][j] = sum over t of p(s_t = i, s_t+1 = j | o_1, ..., o_T), the expected number of
     * transitions from i to j. All zero for a sequence of length 1.
     */
    public final double[][] xiSum;

    public ForwardBackwardResult(double logLikelihood, double[][] logAlpha, double[][] logBeta,
            double[][] posteriors, double[][] xiSum) {
        this.logLikelihood = logLikelihood;
        this.logAlpha = logAlpha;
        this.logBeta = logBeta;
        this.posteriors = posteriors;
        this.xiSum = xiSum;
    }

    public int length() {
        return posteriors.length;
    }

}
