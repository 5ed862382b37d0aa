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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One multivariate Gaussian per hidden state.
 *
 * <p>Covariances are exposed in full D x D form for every state, regardless of the
 * {@link CovarianceType}. For {@link CovarianceType#TIED} all states carry the same matrix.
 *
 * <p>The M-step computes the maximum a posteriori estimate under a normal prior on the means
 * (meansPrior, meansWeight) and an inverse-Wishart-like prior on the covariances (covarsPrior on
 * the diagonal, covarsWeight). With meansWeight = 0, covarsPrior = 0 and covarsWeight = 1 this is
 * the maximum likelihood estimate.
 */
public class GaussianEmissionModel implements EmissionModel {

    private static final Logger logger = LoggerFactory.getLogger(GaussianEmissionModel.class);

    static final String POST = "post";
    static final String OBS = "obs";
    static final String OBS_SQUARED = "obs**2";
    static final String OBS_OUTER = "obs*obs.T";

    private static final Set<HmmParameter> PARAMETER_CODES = Collections.unmodifiableSet(
            EnumSet.of(HmmParameter.MEANS, HmmParameter.COVARIANCES));

    private final int numStates;
    private final CovarianceType covarianceType;

    private double minCovar = 1e-3;
    private double meansPrior = 0.0;
    private double meansWeight = 0.0;
    private double covarsPrior = 1e-2;
    private double covarsWeight = 1.0;

    private double[][] means;
    private double[][][] covariances;

    public GaussianEmissionModel(int numStates, CovarianceType covarianceType) {
        if (numStates <= 0) {
            throw new IllegalArgumentException("Number of states must be positive.");
        }
        if (covarianceType == null) {
            throw new NullPointerException("covarianceType must not be null.");
        }
        this.numStates = numStates;
        this.covarianceType = covarianceType;
    }

    /**
     * Floor added on the diagonal of the initial covariances and jitter for covariances that are
     * not positive-definite. Default is 1e-3.
     */
    public GaussianEmissionModel setMinCovar(double value) {
        if (value < 0.0) {
            throw new IllegalArgumentException("minCovar must be non-negative.");
        }
        this.minCovar = value;
        return this;
    }

    public GaussianEmissionModel setMeansPrior(double value) {
        this.meansPrior = value;
        return this;
    }

    public GaussianEmissionModel setMeansWeight(double value) {
        if (value < 0.0) {
            throw new IllegalArgumentException("meansWeight must be non-negative.");
        }
        this.meansWeight = value;
        return this;
    }

    public GaussianEmissionModel setCovarsPrior(double value) {
        if (value < 0.0) {
            throw new IllegalArgumentException("covarsPrior must be non-negative.");
        }
        this.covarsPrior = value;
        return this;
    }

    public GaussianEmissionModel setCovarsWeight(double value) {
        this.covarsWeight = value;
        return this;
    }

    /**
     * @param means N x D matrix of state means
     */
    public GaussianEmissionModel setMeans(double[][] means) {
        this.means = Utils.copy(means);
        return this;
    }

    /**
     * @param covariances N x D x D covariances in full form
     */
    public GaussianEmissionModel setCovariances(double[][][] covariances) {
        this.covariances = Utils.copy(covariances);
        return this;
    }

    /**
     * Sets diagonal covariances from an N x D matrix of variances.
     */
    public GaussianEmissionModel setVariances(double[][] variances) {
        final double[][][] result = new double[variances.length][][];
        for (int i = 0; i < variances.length; i++) {
            final int d = variances[i].length;
            result[i] = new double[d][d];
            for (int a = 0; a < d; a++) {
                result[i][a][a] = variances[i][a];
            }
        }
        this.covariances = result;
        return this;
    }

    public double[][] getMeans() {
        return Utils.copy(means);
    }

    public double[][][] getCovariances() {
        return Utils.copy(covariances);
    }

    public CovarianceType getCovarianceType() {
        return covarianceType;
    }

    public double getMinCovar() {
        return minCovar;
    }

    @Override
    public int getNumStates() {
        return numStates;
    }

    @Override
    public int getNumFeatures() {
        return means == null ? -1 : means[0].length;
    }

    @Override
    public Set<HmmParameter> getParameterCodes() {
        return PARAMETER_CODES;
    }

    @Override
    public boolean isInitialized() {
        return means != null && covariances != null;
    }

    @Override
    public void check() {
        check(means, covariances);
    }

    private void check(double[][] means, double[][][] covariances) {
        if (means == null || covariances == null) {
            throw new IllegalStateException("Gaussian means and covariances must be set.");
        }
        if (means.length != numStates || covariances.length != numStates) {
            throw new IllegalArgumentException("Means and covariances must be given for "
                    + numStates + " states.");
        }
        final int d = means[0].length;
        for (int i = 0; i < numStates; i++) {
            if (means[i].length != d || covariances[i].length != d) {
                throw new IllegalArgumentException("Means and covariances of state " + i
                        + " must have " + d + " features.");
            }
            covarianceType.checkStructure(covariances[i], "Covariance of state " + i);
            if (covarianceType == CovarianceType.TIED
                    && !Arrays.deepEquals(covariances[i], covariances[0])) {
                throw new IllegalArgumentException("Tied covariances must be equal for all "
                        + "states.");
            }
            GaussianDensity.choleskyFactor(covariances[i], minCovar);
        }
    }

    @Override
    public double[][] logLikelihoods(double[][] observations) {
        final GaussianDensity[] densities = densities(means, covariances);
        final double[][] result = new double[observations.length][numStates];
        for (int t = 0; t < observations.length; t++) {
            checkFeatures(observations[t]);
            for (int i = 0; i < numStates; i++) {
                result[t][i] = densities[i].logDensity(observations[t]);
            }
        }
        return result;
    }

    @Override
    public double[] generateSample(int state, RandomGenerator random) {
        return new GaussianDensity(means[state], covariances[state], minCovar).sample(random);
    }

    /**
     * Means are initialized by k-means, covariances from the covariance of all observations.
     * Nothing is assigned unless the resulting parameters are complete and valid.
     */
    @Override
    public void initFromData(double[][] observations, Set<HmmParameter> initParams,
            RandomGenerator random) {
        double[][] newMeans = means;
        if (initParams.contains(HmmParameter.MEANS) && newMeans == null) {
            newMeans = new KMeans(numStates).fit(observations, random);
        }
        double[][][] newCovariances = covariances;
        if (initParams.contains(HmmParameter.COVARIANCES) && newCovariances == null) {
            final double[][] covariance = GaussianDensity.initialCovariance(observations,
                    covarianceType, minCovar);
            newCovariances = new double[numStates][][];
            for (int i = 0; i < numStates; i++) {
                newCovariances[i] = Utils.copy(covariance);
            }
        }
        check(newMeans, newCovariances);

        if (means == null) {
            logger.debug("Initialized Gaussian means by k-means with {} clusters.", numStates);
        }
        if (covariances == null) {
            logger.debug("Initialized {} covariances from the data covariance.", covarianceType);
        }
        means = newMeans;
        covariances = newCovariances;
    }

    @Override
    public void initializeSufficientStatistics(SufficientStatistics statistics) {
        final int d = getNumFeatures();
        statistics.register(POST, numStates);
        statistics.register(OBS, numStates * d);
        if (covarianceType.needsOuterProducts()) {
            statistics.register(OBS_OUTER, numStates * d * d);
        } else {
            statistics.register(OBS_SQUARED, numStates * d);
        }
    }

    @Override
    public void accumulateSufficientStatistics(SufficientStatistics statistics,
            double[][] observations, double[][] logLikelihoods, double[][] posteriors) {
        final int d = getNumFeatures();
        final double[] post = statistics.emission(POST);
        final double[] obs = statistics.emission(OBS);
        final double[] obsSquared = covarianceType.needsOuterProducts() ? null
                : statistics.emission(OBS_SQUARED);
        final double[] obsOuter = covarianceType.needsOuterProducts()
                ? statistics.emission(OBS_OUTER) : null;

        for (int t = 0; t < observations.length; t++) {
            final double[] x = observations[t];
            for (int i = 0; i < numStates; i++) {
                final double weight = posteriors[t][i];
                post[i] += weight;
                for (int a = 0; a < d; a++) {
                    obs[i * d + a] += weight * x[a];
                    if (obsSquared != null) {
                        obsSquared[i * d + a] += weight * x[a] * x[a];
                    } else {
                        for (int b = 0; b < d; b++) {
                            obsOuter[(i * d + a) * d + b] += weight * x[a] * x[b];
                        }
                    }
                }
            }
        }
    }

    @Override
    public void doMStep(SufficientStatistics statistics, Set<HmmParameter> params) {
        final int d = getNumFeatures();
        final double[] post = statistics.emission(POST);
        final double[][] obs = reshape(statistics.emission(OBS), numStates, d);

        double[][] newMeans = means;
        if (params.contains(HmmParameter.MEANS)) {
            newMeans = new double[numStates][];
            for (int i = 0; i < numStates; i++) {
                newMeans[i] = GaussianDensity.estimateMean(obs[i], post[i], meansPrior,
                        meansWeight, means[i]);
            }
        }

        double[][][] newCovariances = covariances;
        if (params.contains(HmmParameter.COVARIANCES)) {
            final double[][] obsSquared = covarianceType.needsOuterProducts() ? null
                    : reshape(statistics.emission(OBS_SQUARED), numStates, d);
            final double[][][] obsOuter = covarianceType.needsOuterProducts()
                    ? reshape(statistics.emission(OBS_OUTER), numStates, d, d) : null;
            newCovariances = GaussianDensity.estimateCovariances(covarianceType, obs, obsSquared,
                    obsOuter, post, newMeans, covariances, meansPrior, meansWeight, covarsPrior,
                    covarsWeight);
        }

        // Validates before committing.
        densities(newMeans, newCovariances);
        means = newMeans;
        covariances = newCovariances;
    }

    private GaussianDensity[] densities(double[][] means, double[][][] covariances) {
        final GaussianDensity[] result = new GaussianDensity[numStates];
        for (int i = 0; i < numStates; i++) {
            result[i] = new GaussianDensity(means[i], covariances[i], minCovar);
        }
        return result;
    }

    private void checkFeatures(double[] observation) {
        if (observation.length != means[0].length) {
            throw new IllegalArgumentException("Expected observations with " + means[0].length
                    + " features but got " + observation.length + ".");
        }
    }

    static double[][] reshape(double[] flat, int rows, int columns) {
        final double[][] result = new double[rows][columns];
        for (int r = 0; r < rows; r++) {
            System.arraycopy(flat, r * columns, result[r], 0, columns);
        }
        return result;
    }

    static double[][][] reshape(double[] flat, int blocks, int rows, int columns) {
        final double[][][] result = new double[blocks][rows][columns];
        for (int k = 0; k < blocks; k++) {
            for (int r = 0; r < rows; r++) {
                System.arraycopy(flat, (k * rows + r) * columns, result[k][r], 0, columns);
            }
        }
        return result;
    }

}
