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

import java.util.Set;

import org.apache.commons.math3.random.RandomGenerator;

/**
 * This interface needs to be implemented and passed to {@link Hmm} to specify the observation
 * distribution of each hidden state. Implementations own their parameters and change them only
 * in {@link #initFromData(double[][], Set, RandomGenerator)} and
 * {@link #doMStep(SufficientStatistics, Set)}.
 *
 * <p>Observations are rows of a T x D array. Families with discrete observations encode symbols
 * or counts as doubles.
 */
public interface EmissionModel {

    /**
     * Number N of hidden states.
     */
    int getNumStates();

    /**
     * Number D of features per observation, or -1 if not known yet.
     */
    int getNumFeatures();

    /**
     * The parameter codes this family owns.
     */
    Set<HmmParameter> getParameterCodes();

    /**
     * Whether all parameters are present.
     */
    boolean isInitialized();

    /**
     * Validates the parameters.
     *
     * @throws IllegalStateException if a parameter is missing
     * @throws IllegalArgumentException if the parameters are inconsistent or invalid
     */
    void check();

    /**
     * Returns the T x N matrix whose entry (t, i) is log p(observations[t] | state i).
     *
     * @throws IllegalArgumentException if an observation does not fit this family
     */
    double[][] logLikelihoods(double[][] observations);

    /**
     * Draws one observation from the distribution of the given state.
     */
    double[] generateSample(int state, RandomGenerator random);

    /**
     * Assigns data-driven defaults to the parameters that are listed in initParams and have not
     * been set by the caller. Nothing is assigned if the parameters would be incomplete or
     * invalid afterwards.
     *
     * @throws IllegalStateException if a parameter is missing and not listed in initParams
     * @throws IllegalArgumentException if the resulting parameters are invalid or the
     * observations do not fit this family
     */
    void initFromData(double[][] observations, Set<HmmParameter> initParams,
            RandomGenerator random);

    /**
     * Registers the zero-initialized statistics of this family.
     */
    void initializeSufficientStatistics(SufficientStatistics statistics);

    /**
     * Adds the contribution of one sequence.
     *
     * @param logLikelihoods the result of {@link #logLikelihoods(double[][])} for observations
     * @param posteriors the T x N state posteriors of the sequence
     */
    void accumulateSufficientStatistics(SufficientStatistics statistics, double[][] observations,
            double[][] logLikelihoods, double[][] posteriors);

    /**
     * Re-estimates the parameters listed in params from the accumulated statistics. Either all
     * updates are applied or, if the new parameters are invalid, none.
     *
     * @throws IllegalArgumentException if the new parameters are invalid
     */
    void doMStep(SufficientStatistics statistics, Set<HmmParameter> params);

}
