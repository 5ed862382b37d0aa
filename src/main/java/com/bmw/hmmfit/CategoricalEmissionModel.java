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

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import org.apache.commons.math3.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A categorical distribution over K symbols per hidden state. Observations have a single feature
 * holding the symbol index 0, ..., K-1.
 */
public class CategoricalEmissionModel implements EmissionModel {

    private static final Logger logger = LoggerFactory.getLogger(CategoricalEmissionModel.class);

    static final String OBS = "obs";

    private static final Set<HmmParameter> PARAMETER_CODES = Collections.unmodifiableSet(
            EnumSet.of(HmmParameter.EMISSION_PROBABILITIES));

    private final int numStates;
    private int numSymbols;
    private double emissionProbabilitiesPrior = 1.0;
    private double[][] emissionProbabilities;

    /**
     * The number of symbols is taken from the emission probabilities or from the data.
     */
    public CategoricalEmissionModel(int numStates) {
        this(numStates, -1);
    }

    public CategoricalEmissionModel(int numStates, int numSymbols) {
        if (numStates <= 0) {
            throw new IllegalArgumentException("Number of states must be positive.");
        }
        this.numStates = numStates;
        this.numSymbols = numSymbols;
    }

    /**
     * Dirichlet concentration of each row of the emission probabilities. Default is 1, i.e. no
     * prior.
     */
    public CategoricalEmissionModel setEmissionProbabilitiesPrior(double value) {
        if (value <= 0.0) {
            throw new IllegalArgumentException("emissionProbabilitiesPrior must be positive.");
        }
        this.emissionProbabilitiesPrior = value;
        return this;
    }

    /**
     * @param emissionProbabilities N x K matrix, row i is the symbol distribution of state i
     */
    public CategoricalEmissionModel setEmissionProbabilities(double[][] emissionProbabilities) {
        this.emissionProbabilities = Utils.copy(emissionProbabilities);
        if (emissionProbabilities != null && emissionProbabilities.length > 0) {
            numSymbols = emissionProbabilities[0].length;
        }
        return this;
    }

    public double[][] getEmissionProbabilities() {
        return Utils.copy(emissionProbabilities);
    }

    public int getNumSymbols() {
        return numSymbols;
    }

    @Override
    public int getNumStates() {
        return numStates;
    }

    @Override
    public int getNumFeatures() {
        return 1;
    }

    @Override
    public Set<HmmParameter> getParameterCodes() {
        return PARAMETER_CODES;
    }

    @Override
    public boolean isInitialized() {
        return emissionProbabilities != null;
    }

    @Override
    public void check() {
        if (!isInitialized()) {
            throw new IllegalStateException("Emission probabilities must be set.");
        }
        if (emissionProbabilities.length != numStates) {
            throw new IllegalArgumentException("Emission probabilities must be given for "
                    + numStates + " states.");
        }
        for (int i = 0; i < numStates; i++) {
            if (emissionProbabilities[i].length != numSymbols) {
                throw new IllegalArgumentException("Emission probabilities of state " + i
                        + " must have " + numSymbols + " symbols.");
            }
            Utils.checkStochastic(emissionProbabilities[i],
                    "Emission probabilities of state " + i);
        }
    }

    @Override
    public double[][] logLikelihoods(double[][] observations) {
        final double[][] logProbabilities = Utils.log(emissionProbabilities);
        final double[][] result = new double[observations.length][numStates];
        for (int t = 0; t < observations.length; t++) {
            final int symbol = symbol(observations[t], numSymbols);
            for (int i = 0; i < numStates; i++) {
                result[t][i] = logProbabilities[i][symbol];
            }
        }
        return result;
    }

    @Override
    public double[] generateSample(int state, RandomGenerator random) {
        return new double[] {
                Utils.sampleIndex(emissionProbabilities[state], random.nextDouble())};
    }

    /**
     * Starts from the empirical symbol frequencies. Each state scales them by a random factor
     * in [0.5, 1.5) per symbol so that the states differ.
     */
    @Override
    public void initFromData(double[][] observations, Set<HmmParameter> initParams,
            RandomGenerator random) {
        if (emissionProbabilities != null) {
            return;
        }
        if (!initParams.contains(HmmParameter.EMISSION_PROBABILITIES)) {
            throw new IllegalStateException("Emission probabilities must be set.");
        }
        int newNumSymbols = numSymbols;
        if (newNumSymbols <= 0) {
            int max = 0;
            for (double[] observation : observations) {
                max = Math.max(max, symbol(observation, Integer.MAX_VALUE));
            }
            newNumSymbols = max + 1;
        }
        final double[] frequencies = new double[newNumSymbols];
        for (double[] observation : observations) {
            frequencies[symbol(observation, newNumSymbols)] += 1.0 / observations.length;
        }
        final double[][] newEmissionProbabilities = new double[numStates][newNumSymbols];
        for (int i = 0; i < numStates; i++) {
            for (int k = 0; k < newNumSymbols; k++) {
                newEmissionProbabilities[i][k] = frequencies[k] * (0.5 + random.nextDouble());
            }
            Utils.normalize(newEmissionProbabilities[i]);
        }
        numSymbols = newNumSymbols;
        emissionProbabilities = newEmissionProbabilities;
        logger.debug("Initialized emission probabilities for {} symbols.", numSymbols);
    }

    @Override
    public void initializeSufficientStatistics(SufficientStatistics statistics) {
        statistics.register(OBS, numStates * numSymbols);
    }

    @Override
    public void accumulateSufficientStatistics(SufficientStatistics statistics,
            double[][] observations, double[][] logLikelihoods, double[][] posteriors) {
        final double[] counts = statistics.emission(OBS);
        for (int t = 0; t < observations.length; t++) {
            final int symbol = symbol(observations[t], numSymbols);
            for (int i = 0; i < numStates; i++) {
                counts[i * numSymbols + symbol] += posteriors[t][i];
            }
        }
    }

    @Override
    public void doMStep(SufficientStatistics statistics, Set<HmmParameter> params) {
        if (!params.contains(HmmParameter.EMISSION_PROBABILITIES)) {
            return;
        }
        final double[] counts = statistics.emission(OBS);
        final double[][] result = new double[numStates][numSymbols];
        for (int i = 0; i < numStates; i++) {
            for (int k = 0; k < numSymbols; k++) {
                result[i][k] = Math.max(emissionProbabilitiesPrior - 1.0
                        + counts[i * numSymbols + k], 0.0);
            }
            if (!Utils.normalize(result[i])) {
                result[i] = emissionProbabilities[i].clone();
            }
        }
        emissionProbabilities = result;
    }

    /**
     * @throws IllegalArgumentException if the observation is not a symbol index below numSymbols
     */
    private static int symbol(double[] observation, int numSymbols) {
        if (observation.length != 1) {
            throw new IllegalArgumentException(
                    "Categorical observations must have exactly one feature.");
        }
        final double value = observation[0];
        if (value != Math.rint(value) || value < 0 || value >= numSymbols) {
            throw new IllegalArgumentException("Invalid symbol " + value + ", expected an integer "
                    + "in [0, " + numSymbols + ").");
        }
        return (int) value;
    }

}
