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

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.util.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A mixture of M multivariate Gaussians per hidden state.
 *
 * <p>The E-step splits the posterior of each state into the responsibilities of its mixture
 * components, the M-step applies the closed-form mixture update. Each EM iteration of the HMM
 * therefore performs one inner EM step of every state's mixture.
 *
 * <p>{@link CovarianceType#TIED} means that the components of one state share a covariance.
 */
public class GmmEmissionModel implements EmissionModel {

    private static final Logger logger = LoggerFactory.getLogger(GmmEmissionModel.class);

    static final String POST_MIX = "post_mix";
    static final String OBS = "obs";
    static final String OBS_SQUARED = "obs**2";
    static final String OBS_OUTER = "obs*obs.T";

    private static final Set<HmmParameter> PARAMETER_CODES = Collections.unmodifiableSet(
            EnumSet.of(HmmParameter.WEIGHTS, HmmParameter.MEANS, HmmParameter.COVARIANCES));

    private final int numStates;
    private final int numMix;
    private final CovarianceType covarianceType;

    private double minCovar = 1e-3;
    private double weightsPrior = 1.0;
    private double meansPrior = 0.0;
    private double meansWeight = 0.0;
    private double covarsPrior = 1e-2;
    private double covarsWeight = 1.0;

    private double[][] weights;
    private double[][][] means;
    private double[][][][] covariances;

    public GmmEmissionModel(int numStates, int numMix, CovarianceType covarianceType) {
        if (numStates <= 0 || numMix <= 0) {
            throw new IllegalArgumentException(
                    "Number of states and mixture components must be positive.");
        }
        if (covarianceType == null) {
            throw new NullPointerException("covarianceType must not be null.");
        }
        this.numStates = numStates;
        this.numMix = numMix;
        this.covarianceType = covarianceType;
    }

    public GmmEmissionModel setMinCovar(double value) {
        if (value < 0.0) {
            throw new IllegalArgumentException("minCovar must be non-negative.");
        }
        this.minCovar = value;
        return this;
    }

    /**
     * Dirichlet concentration of the mixture weights. Default is 1, i.e. no prior.
     */
    public GmmEmissionModel setWeightsPrior(double value) {
        if (value <= 0.0) {
            throw new IllegalArgumentException("weightsPrior must be positive.");
        }
        this.weightsPrior = value;
        return this;
    }

    public GmmEmissionModel setMeansPrior(double value) {
        this.meansPrior = value;
        return this;
    }

    public GmmEmissionModel setMeansWeight(double value) {
        if (value < 0.0) {
            throw new IllegalArgumentException("meansWeight must be non-negative.");
        }
        this.meansWeight = value;
        return this;
    }

    public GmmEmissionModel setCovarsPrior(double value) {
        if (value < 0.0) {
            throw new IllegalArgumentException("covarsPrior must be non-negative.");
        }
        this.covarsPrior = value;
        return this;
    }

    public GmmEmissionModel setCovarsWeight(double value) {
        this.covarsWeight = value;
        return this;
    }

    /**
     * @param weights N x M mixture weights, each row sums to 1
     */
    public GmmEmissionModel setWeights(double[][] weights) {
        this.weights = Utils.copy(weights);
        return this;
    }

    /**
     * @param means N x M x D component means
     */
    public GmmEmissionModel setMeans(double[][][] means) {
        this.means = Utils.copy(means);
        return this;
    }

    /**
     * @param covariances N x M x D x D component covariances in full form
     */
    public GmmEmissionModel setCovariances(double[][][][] covariances) {
        this.covariances = copy(covariances);
        return this;
    }

    public double[][] getWeights() {
        return Utils.copy(weights);
    }

    public double[][][] getMeans() {
        return Utils.copy(means);
    }

    public double[][][][] getCovariances() {
        return copy(covariances);
    }

    public int getNumMix() {
        return numMix;
    }

    public CovarianceType getCovarianceType() {
        return covarianceType;
    }

    @Override
    public int getNumStates() {
        return numStates;
    }

    @Override
    public int getNumFeatures() {
        return means == null ? -1 : means[0][0].length;
    }

    @Override
    public Set<HmmParameter> getParameterCodes() {
        return PARAMETER_CODES;
    }

    @Override
    public boolean isInitialized() {
        return weights != null && means != null && covariances != null;
    }

    @Override
    public void check() {
        check(weights, means, covariances);
    }

    private void check(double[][] weights, double[][][] means, double[][][][] covariances) {
        if (weights == null || means == null || covariances == null) {
            throw new IllegalStateException("Mixture weights, means and covariances must be set.");
        }
        if (weights.length != numStates || means.length != numStates
                || covariances.length != numStates) {
            throw new IllegalArgumentException("Mixture parameters must be given for "
                    + numStates + " states.");
        }
        final int d = means[0][0].length;
        for (int i = 0; i < numStates; i++) {
            if (weights[i].length != numMix || means[i].length != numMix
                    || covariances[i].length != numMix) {
                throw new IllegalArgumentException("State " + i + " must have " + numMix
                        + " mixture components.");
            }
            Utils.checkStochastic(weights[i], "Mixture weights of state " + i);
            for (int m = 0; m < numMix; m++) {
                if (means[i][m].length != d || covariances[i][m].length != d) {
                    throw new IllegalArgumentException("Component " + m + " of state " + i
                            + " must have " + d + " features.");
                }
                covarianceType.checkStructure(covariances[i][m],
                        "Covariance of component " + m + " of state " + i);
                if (covarianceType == CovarianceType.TIED
                        && !Arrays.deepEquals(covariances[i][m], covariances[i][0])) {
                    throw new IllegalArgumentException("Tied covariances of state " + i
                            + " must be equal for all components.");
                }
                GaussianDensity.choleskyFactor(covariances[i][m], minCovar);
            }
        }
    }

    @Override
    public double[][] logLikelihoods(double[][] observations) {
        final GaussianDensity[][] densities = densities(means, covariances);
        final double[][] logWeights = Utils.log(weights);
        final double[] buffer = new double[numMix];
        final double[][] result = new double[observations.length][numStates];
        for (int t = 0; t < observations.length; t++) {
            checkFeatures(observations[t]);
            for (int i = 0; i < numStates; i++) {
                for (int m = 0; m < numMix; m++) {
                    buffer[m] = logWeights[i][m] + densities[i][m].logDensity(observations[t]);
                }
                result[t][i] = Utils.logSumExp(buffer);
            }
        }
        return result;
    }

    @Override
    public double[] generateSample(int state, RandomGenerator random) {
        final int m = Utils.sampleIndex(weights[state], random.nextDouble());
        return new GaussianDensity(means[state][m], covariances[state][m], minCovar)
                .sample(random);
    }

    /**
     * Nothing is assigned unless the resulting parameters are complete and valid.
     */
    @Override
    public void initFromData(double[][] observations, Set<HmmParameter> initParams,
            RandomGenerator random) {
        double[][] newWeights = weights;
        if (initParams.contains(HmmParameter.WEIGHTS) && newWeights == null) {
            newWeights = new double[numStates][numMix];
            for (double[] row : newWeights) {
                Arrays.fill(row, 1.0 / numMix);
            }
        }
        double[][][] newMeans = means;
        if (initParams.contains(HmmParameter.MEANS) && newMeans == null) {
            final double[][] centers = new KMeans(numStates * numMix).fit(observations, random);
            newMeans = new double[numStates][numMix][];
            for (int i = 0; i < numStates; i++) {
                for (int m = 0; m < numMix; m++) {
                    newMeans[i][m] = centers[i * numMix + m];
                }
            }
        }
        double[][][][] newCovariances = covariances;
        if (initParams.contains(HmmParameter.COVARIANCES) && newCovariances == null) {
            final double[][] covariance = GaussianDensity.initialCovariance(observations,
                    covarianceType, minCovar);
            newCovariances = new double[numStates][numMix][][];
            for (int i = 0; i < numStates; i++) {
                for (int m = 0; m < numMix; m++) {
                    newCovariances[i][m] = Utils.copy(covariance);
                }
            }
        }
        check(newWeights, newMeans, newCovariances);

        if (means == null) {
            logger.debug("Initialized mixture means by k-means with {} clusters.",
                    numStates * numMix);
        }
        weights = newWeights;
        means = newMeans;
        covariances = newCovariances;
    }

    @Override
    public void initializeSufficientStatistics(SufficientStatistics statistics) {
        final int d = getNumFeatures();
        statistics.register(POST_MIX, numStates * numMix);
        statistics.register(OBS, numStates * numMix * d);
        if (covarianceType.needsOuterProducts()) {
            statistics.register(OBS_OUTER, numStates * numMix * d * d);
        } else {
            statistics.register(OBS_SQUARED, numStates * numMix * d);
        }
    }

    @Override
    public void accumulateSufficientStatistics(SufficientStatistics statistics,
            double[][] observations, double[][] logLikelihoods, double[][] posteriors) {
        final int d = getNumFeatures();
        final GaussianDensity[][] densities = densities(means, covariances);
        final double[][] logWeights = Utils.log(weights);
        final double[] postMix = statistics.emission(POST_MIX);
        final double[] obs = statistics.emission(OBS);
        final double[] obsSquared = covarianceType.needsOuterProducts() ? null
                : statistics.emission(OBS_SQUARED);
        final double[] obsOuter = covarianceType.needsOuterProducts()
                ? statistics.emission(OBS_OUTER) : null;

        for (int t = 0; t < observations.length; t++) {
            final double[] x = observations[t];
            for (int i = 0; i < numStates; i++) {
                final double statePosterior = posteriors[t][i];
                if (statePosterior == 0.0) {
                    continue;
                }
                for (int m = 0; m < numMix; m++) {
                    // Responsibility of component m given state i, weighted by the state posterior.
                    final double weight = statePosterior * FastMath.exp(logWeights[i][m]
                            + densities[i][m].logDensity(x) - logLikelihoods[t][i]);
                    final int component = i * numMix + m;
                    postMix[component] += weight;
                    for (int a = 0; a < d; a++) {
                        obs[component * d + a] += weight * x[a];
                        if (obsSquared != null) {
                            obsSquared[component * d + a] += weight * x[a] * x[a];
                        } else {
                            for (int b = 0; b < d; b++) {
                                obsOuter[(component * d + a) * d + b] += weight * x[a] * x[b];
                            }
                        }
                    }
                }
            }
        }
    }

    @Override
    public void doMStep(SufficientStatistics statistics, Set<HmmParameter> params) {
        final int d = getNumFeatures();
        final double[][] postMix = GaussianEmissionModel.reshape(statistics.emission(POST_MIX),
                numStates, numMix);
        final double[][] obs = GaussianEmissionModel.reshape(statistics.emission(OBS),
                numStates * numMix, d);

        double[][] newWeights = weights;
        if (params.contains(HmmParameter.WEIGHTS)) {
            newWeights = new double[numStates][numMix];
            for (int i = 0; i < numStates; i++) {
                for (int m = 0; m < numMix; m++) {
                    newWeights[i][m] = Math.max(weightsPrior - 1.0 + postMix[i][m], 0.0);
                }
                if (!Utils.normalize(newWeights[i])) {
                    newWeights[i] = weights[i].clone();
                }
            }
        }

        double[][][] newMeans = means;
        if (params.contains(HmmParameter.MEANS)) {
            newMeans = new double[numStates][numMix][];
            for (int i = 0; i < numStates; i++) {
                for (int m = 0; m < numMix; m++) {
                    newMeans[i][m] = GaussianDensity.estimateMean(obs[i * numMix + m],
                            postMix[i][m], meansPrior, meansWeight, means[i][m]);
                }
            }
        }

        double[][][][] newCovariances = covariances;
        if (params.contains(HmmParameter.COVARIANCES)) {
            final double[][] obsSquared = covarianceType.needsOuterProducts() ? null
                    : GaussianEmissionModel.reshape(statistics.emission(OBS_SQUARED),
                            numStates * numMix, d);
            final double[][][] obsOuter = covarianceType.needsOuterProducts()
                    ? GaussianEmissionModel.reshape(statistics.emission(OBS_OUTER),
                            numStates * numMix, d, d) : null;
            newCovariances = new double[numStates][][][];
            for (int i = 0; i < numStates; i++) {
                final int from = i * numMix;
                final int to = from + numMix;
                newCovariances[i] = GaussianDensity.estimateCovariances(covarianceType,
                        Arrays.copyOfRange(obs, from, to),
                        obsSquared == null ? null : Arrays.copyOfRange(obsSquared, from, to),
                        obsOuter == null ? null : Arrays.copyOfRange(obsOuter, from, to),
                        postMix[i], newMeans[i], covariances[i], meansPrior, meansWeight,
                        covarsPrior, covarsWeight);
            }
        }

        // Validates before committing.
        densities(newMeans, newCovariances);
        weights = newWeights;
        means = newMeans;
        covariances = newCovariances;
    }

    private GaussianDensity[][] densities(double[][][] means, double[][][][] covariances) {
        final GaussianDensity[][] result = new GaussianDensity[numStates][numMix];
        for (int i = 0; i < numStates; i++) {
            for (int m = 0; m < numMix; m++) {
                result[i][m] = new GaussianDensity(means[i][m], covariances[i][m], minCovar);
            }
        }
        return result;
    }

    private void checkFeatures(double[] observation) {
        if (observation.length != getNumFeatures()) {
            throw new IllegalArgumentException("Expected observations with " + getNumFeatures()
                    + " features but got " + observation.length + ".");
        }
    }

    private static double[][][][] copy(double[][][][] values) {
        if (values == null) {
            return null;
        }
        final double[][][][] result = new double[values.length][][][];
        for (int i = 0; i < values.length; i++) {
            result[i] = Utils.copy(values[i]);
        }
        return result;
    }

}
