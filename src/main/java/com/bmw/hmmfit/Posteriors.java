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
 * Result of {@link Hmm#scoreSamples(double[][], int[])}.
 */
public class Posteriors {

    /**
     * Total log-likelihood summed over all sequences.
     */
    public final double logLikelihood;

    /**
     * T_total x N state posteriors, the rows of all sequences concatenated in input order.
     */
    public final double[][] posteriors;

    public Posteriors(double logLikelihood, double[][] posteriors) {
        this.logLikelihood = logLikelihood;
        this.posteriors = posteriors;
    }

}
