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

import org.apache.commons.math3.distribution.GammaDistribution;
import org.apache.commons.math3.distribution.PoissonDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.special.Gamma;
import org.apache.commons.math3.util.FastMath;

/**
 * Independent Poisson distributions per hidden state and feature. Observations are non-negative
 * counts.
 */
public class PoissonEmissionModel implements EmissionModel {

    static final String POST = "post";
    static final String OBS = "obs";

    /**
     * Rates are kept above this value so that the log-likelihood stays finite.
     */
    static final double MIN_RATE = 1e-10;

    private static final Set<HmmParameter> PARAMETER_CODES = Collections.unmodifiableSet(
            EnumSet.of(HmmParameter.RATES));

    private final int numStates;
    private double ratesPrior = 0.0;
    private double ratesWeight = 0.0;
    private double[][] rates;

    public PoissonEmissionModel(int numStates) {
        if (numStates <= 0) {
            throw new IllegalArgumentException("Number of states must be positive.");
        }
        this.numStates = numStates;
    }

    /**
     * Prior rate and its weight in pseudo-observations. Both default to 0, i.e. no prior.
     */
    public PoissonEmissionModel setRatesPrior(double prior, double weight) {
        if (prior < 0.0 || weight < 0.0) {
            throw new IllegalArgumentException("Rates prior and weight must be non-negative.");
        }
        this.ratesPrior = prior;
        this.ratesWeight = weight;
        return this;
    }

    /**
     * @param rates N x D matrix of positive rates
     */
    public PoissonEmissionModel setRates(double[][] rates) {
        this.rates = Utils.copy(rates);
        return this;
    }

    public double[][] getRates() {
        return Utils.copy(rates);
    }

    @Override
    public int getNumStates() {
        return numStates;
    }

    @Override
    public int getNumFeatures() {
        return rates == null ? -1 : rates[0].length;
    }

    @Override
    public Set<HmmParameter> getParameterCodes() {
        return PARAMETER_CODES;
    }

    @Override
    public boolean isInitialized() {
        return rates != null;
    }

    @Override
    public void check() {
        check(rates);
    }

    private void check(double[][] rates) {
        if (rates == null) {
            throw new IllegalStateException("Poisson rates must be set.");
        }
        if (rates.length != numStates) {
            throw new IllegalArgumentException("Rates must be given for " + numStates
                    + " states.");
        }
        final int d = rates[0].length;
        for (int i = 0; i < numStates; i++) {
            if (rates[i].length != d) {
                throw new IllegalArgumentException("Rates of state " + i + " must have " + d
                        + " features.");
            }
            for (double rate : rates[i]) {
                if (!(rate > 0.0) || Double.isInfinite(rate)) {
                    throw new IllegalArgumentException("Rates must be positive and finite.");
                }
            }
        }
    }

    @Override
    public double[][] logLikelihoods(double[][] observations) {
        final int d = getNumFeatures();
        final double[][] logRates = Utils.log(rates);
        final double[][] result = new double[observations.length][numStates];
        for (int t = 0; t < observations.length; t++) {
            final double[] x = observations[t];
            if (x.length != d) {
                throw new IllegalArgumentException("Expected observations with " + d
                        + " features but got " + x.length + ".");
            }
            double logFactorials = 0.0;
            for (int a = 0; a < d; a++) {
                checkCount(x[a]);
                logFactorials += Gamma.logGamma(x[a] + 1.0);
            }
            for (int i = 0; i < numStates; i++) {
                double value = -logFactorials;
                for (int a = 0; a < d; a++) {
                    value += x[a] * logRates[i][a] - rates[i][a];
                }
                result[t][i] = value;
            }
        }
        return result;
    }

    @Override
    public double[] generateSample(int state, RandomGenerator random) {
        final double[] result = new double[rates[state].length];
        for (int a = 0; a < result.length; a++) {
            final PoissonDistribution poisson = new PoissonDistribution(random, rates[state][a],
                    PoissonDistribution.DEFAULT_EPSILON,
                    PoissonDistribution.DEFAULT_MAX_ITERATIONS);
            result[a] = poisson.sample();
        }
        return result;
    }

    /**
     * Draws the rates of each state from a gamma distribution matching the mean and variance of
     * each feature.
     */
    @Override
    public void initFromData(double[][] observations, Set<HmmParameter> initParams,
            RandomGenerator random) {
        if (rates != null) {
            return;
        }
        if (!initParams.contains(HmmParameter.RATES)) {
            throw new IllegalStateException("Poisson rates must be set.");
        }
        final int d = observations[0].length;
        final double[][] newRates = new double[numStates][d];
        for (int a = 0; a < d; a++) {
            double mean = 0.0;
            for (double[] x : observations) {
                checkCount(x[a]);
                mean += x[a] / observations.length;
            }
            double variance = 0.0;
            for (double[] x : observations) {
                variance += (x[a] - mean) * (x[a] - mean) / observations.length;
            }
            mean = Math.max(mean, MIN_RATE);
            if (variance <= 0.0) {
                variance = mean;
            }
            final GammaDistribution gamma = new GammaDistribution(random, mean * mean / variance,
                    variance / mean, GammaDistribution.DEFAULT_INVERSE_ABSOLUTE_ACCURACY);
            for (int i = 0; i < numStates; i++) {
                newRates[i][a] = Math.max(gamma.sample(), MIN_RATE);
            }
        }
        check(newRates);
        rates = newRates;
    }

    @Override
    public void initializeSufficientStatistics(SufficientStatistics statistics) {
        statistics.register(POST, numStates);
        statistics.register(OBS, numStates * getNumFeatures());
    }

    @Override
    public void accumulateSufficientStatistics(SufficientStatistics statistics,
            double[][] observations, double[][] logLikelihoods, double[][] posteriors) {
        final int d = getNumFeatures();
        final double[] post = statistics.emission(POST);
        final double[] obs = statistics.emission(OBS);
        for (int t = 0; t < observations.length; t++) {
            for (int i = 0; i < numStates; i++) {
                post[i] += posteriors[t][i];
                for (int a = 0; a < d; a++) {
                    obs[i * d + a] += posteriors[t][i] * observations[t][a];
                }
            }
        }
    }

    @Override
    public void doMStep(SufficientStatistics statistics, Set<HmmParameter> params) {
        if (!params.contains(HmmParameter.RATES)) {
            return;
        }
        final int d = getNumFeatures();
        final double[] post = statistics.emission(POST);
        final double[] obs = statistics.emission(OBS);
        final double[][] result = new double[numStates][d];
        for (int i = 0; i < numStates; i++) {
            final double denominator = ratesWeight + post[i];
            for (int a = 0; a < d; a++) {
                if (denominator < GaussianDensity.MIN_MASS) {
                    result[i][a] = rates[i][a];
                } else {
                    result[i][a] = FastMath.max((ratesPrior * ratesWeight + obs[i * d + a])
                            / denominator, MIN_RATE);
                }
            }
        }
        rates = result;
    }

    private static void checkCount(double x) {
        if (x < 0.0 || x != Math.rint(x)) {
            throw new IllegalArgumentException("Invalid count " + x + ".");
        }
    }

}
